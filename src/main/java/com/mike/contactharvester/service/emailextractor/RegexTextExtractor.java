package com.mike.contactharvester.service.emailextractor;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Plain local@domain.tld matches over the raw page text.
 */
public class RegexTextExtractor implements EmailSourceExtractor {

    static final Pattern EMAIL_PATTERN =
            Pattern.compile("[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}");

    @Override
    public Stream<String> extractCandidates(String html) {
        if (html == null || html.isBlank()) return Stream.empty();
        return findAll(html);
    }

    static Stream<String> findAll(String text) {
        Matcher matcher = EMAIL_PATTERN.matcher(text);
        Stream.Builder<String> builder = Stream.builder();
        while (matcher.find()) {
            builder.add(matcher.group());
        }
        return builder.build();
    }
}
