package com.mike.contactharvester.service.emailextractor;

import org.jsoup.parser.Parser;

import java.util.stream.Stream;

/**
 * Percent-encoded (%40) and HTML-entity encoded (&amp;#64;, &amp;commat;) addresses:
 * decodes the text and matches again.
 */
public class EncodedEmailExtractor implements EmailSourceExtractor {

    @Override
    public Stream<String> extractCandidates(String html) {
        if (html == null || html.isBlank()) return Stream.empty();

        String entityDecoded = Parser.unescapeEntities(html, false);
        String fullyDecoded = EmailNormalizer.decodePercentEscapes(entityDecoded);

        if (fullyDecoded.equals(html)) return Stream.empty();
        return RegexTextExtractor.findAll(fullyDecoded);
    }
}
