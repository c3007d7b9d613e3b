package com.mike.contactharvester.service.emailextractor;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

public class MailToExtractor implements EmailSourceExtractor {

    private static final Pattern MAILTO_PATTERN =
            Pattern.compile("(?i)mailto:([^\"'\\s>]+)");

    private final TextObfuscationNormalizer obfuscationNormalizer;

    public MailToExtractor(TextObfuscationNormalizer obfuscationNormalizer) {
        this.obfuscationNormalizer = obfuscationNormalizer;
    }

    @Override
    public Stream<String> extractCandidates(String html) {
        if (html == null || html.isBlank()) return Stream.empty();

        Matcher matcher = MAILTO_PATTERN.matcher(html);

        Stream.Builder<String> builder = Stream.builder();
        while (matcher.find()) {
            String raw = matcher.group(1);
            int q = raw.indexOf('?');
            if (q >= 0) raw = raw.substring(0, q);
            // mailto:a@x.ae,b@y.ae
            for (String part : raw.split("[,;]")) {
                String candidate = obfuscationNormalizer.deobfuscate(part);
                if (candidate != null && !candidate.isBlank()) builder.add(candidate);
            }
        }
        return builder.build();
    }
}
