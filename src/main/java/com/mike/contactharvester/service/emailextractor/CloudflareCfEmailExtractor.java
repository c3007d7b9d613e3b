package com.mike.contactharvester.service.emailextractor;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

public class CloudflareCfEmailExtractor implements EmailSourceExtractor {

    private static final List<Pattern> PATTERNS = List.of(
            Pattern.compile("data-cfemail=[\"']([0-9a-fA-F]+)[\"']"),
            Pattern.compile("/cdn-cgi/l/email-protection#([0-9a-fA-F]+)")
    );

    @Override
    public Stream<String> extractCandidates(String html) {
        if (html == null || html.isBlank()) return Stream.empty();

        Stream.Builder<String> builder = Stream.builder();
        for (Pattern pattern : PATTERNS) {
            Matcher matcher = pattern.matcher(html);
            while (matcher.find()) {
                String decoded = CloudflareEmailDecoder.decode(matcher.group(1));
                if (decoded != null && !decoded.isBlank()) builder.add(decoded);
            }
        }
        return builder.build();
    }
}
