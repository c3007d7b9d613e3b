package com.mike.contactharvester.service.emailextractor;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Addresses stored in data-email / data-contact / data-mail attributes and in
 * "email": "..." key-value fragments of inline scripts and JSON blobs.
 */
public class EmbeddedDataExtractor implements EmailSourceExtractor {

    private static final List<Pattern> PATTERNS = List.of(
            Pattern.compile("(?i)data-(?:email|contact|mail)\\s*=\\s*\"([^\"]+)\""),
            Pattern.compile("(?i)data-(?:email|contact|mail)\\s*=\\s*'([^']+)'"),
            Pattern.compile("(?i)\"e-?mail\"\\s*:\\s*\"([^\"]+)\""),
            Pattern.compile("(?i)'e-?mail'\\s*:\\s*'([^']+)'")
    );

    private final TextObfuscationNormalizer obfuscationNormalizer;

    public EmbeddedDataExtractor(TextObfuscationNormalizer obfuscationNormalizer) {
        this.obfuscationNormalizer = obfuscationNormalizer;
    }

    @Override
    public Stream<String> extractCandidates(String html) {
        if (html == null || html.isBlank()) return Stream.empty();

        Stream.Builder<String> builder = Stream.builder();
        for (Pattern pattern : PATTERNS) {
            Matcher matcher = pattern.matcher(html);
            while (matcher.find()) {
                String value = obfuscationNormalizer.deobfuscate(matcher.group(1));
                if (value != null && !value.isBlank()) builder.add(value);
            }
        }
        return builder.build();
    }
}
