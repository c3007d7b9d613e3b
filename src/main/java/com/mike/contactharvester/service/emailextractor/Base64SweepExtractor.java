package com.mike.contactharvester.service.emailextractor;

import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Decodes base64 runs (32+ chars, or any atob('...') argument) and matches addresses in the result.
 */
@Slf4j
public class Base64SweepExtractor implements EmailSourceExtractor {

    private static final Pattern BASE64_RUN = Pattern.compile("[A-Za-z0-9+/]{32,}={0,2}");
    private static final Pattern ATOB_CALL = Pattern.compile("(?i)atob\\(\\s*['\"]([A-Za-z0-9+/=]+)['\"]\\s*\\)");

    @Override
    public Stream<String> extractCandidates(String html) {
        if (html == null || html.isBlank()) return Stream.empty();

        Stream.Builder<String> builder = Stream.builder();
        sweep(ATOB_CALL.matcher(html), 1, builder);
        sweep(BASE64_RUN.matcher(html), 0, builder);
        return builder.build();
    }

    private void sweep(Matcher matcher, int group, Stream.Builder<String> builder) {
        while (matcher.find()) {
            String decoded = tryDecode(matcher.group(group));
            if (decoded == null || decoded.indexOf('@') < 0) continue;
            RegexTextExtractor.findAll(decoded).forEach(builder::add);
        }
    }

    static String tryDecode(String token) {
        if (token == null || token.length() % 4 != 0) return null;
        try {
            return new String(Base64.getDecoder().decode(token), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            log.debug("Base64SweepExtractor: skipping undecodable token of length {}", token.length());
            return null;
        }
    }
}
