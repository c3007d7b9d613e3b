package com.mike.contactharvester.service.emailextractor;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * "info @ airline . ae" and the textual "info at airline dot ae" variants.
 */
public class SpacedEmailExtractor implements EmailSourceExtractor {

    private static final Pattern SPACED_PATTERN =
            Pattern.compile("[a-zA-Z0-9._%+-]+[ \\t]*@[ \\t]*[a-zA-Z0-9-]+(?:[ \\t]*\\.[ \\t]*[a-zA-Z0-9-]+)*[ \\t]*\\.[ \\t]*[a-zA-Z]{2,}\\b");

    private final TextObfuscationNormalizer obfuscationNormalizer;

    public SpacedEmailExtractor(TextObfuscationNormalizer obfuscationNormalizer) {
        this.obfuscationNormalizer = obfuscationNormalizer;
    }

    @Override
    public Stream<String> extractCandidates(String html) {
        if (html == null || html.isBlank()) return Stream.empty();

        String deobfuscated = obfuscationNormalizer.deobfuscate(html);

        Matcher matcher = SPACED_PATTERN.matcher(deobfuscated);
        Stream.Builder<String> builder = Stream.builder();
        while (matcher.find()) {
            builder.add(matcher.group());
        }
        return builder.build();
    }
}
