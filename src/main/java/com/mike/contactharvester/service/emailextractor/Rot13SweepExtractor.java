package com.mike.contactharvester.service.emailextractor;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Rotates every 10+ char token drawn from the email alphabet by 13 letters and matches addresses in the result.
 * <p>
 * A plain address rotates into a syntactically valid twin (mark@safari.tz -> znex@fnsnev.gm), and two-letter
 * country codes rotate into other country codes. A rotated match is therefore kept only when its source
 * does not already read as a plain address: the source TLD must be neither two letters long nor a common
 * generic TLD. Rot13-encoded addresses under a country-code TLD are not recovered.
 */
public class Rot13SweepExtractor implements EmailSourceExtractor {

    private static final Pattern ROT13_CANDIDATE = Pattern.compile("[A-Za-z0-9._%+@-]{10,}");

    static final Set<String> PLAIN_GENERIC_TLDS = Set.of(
            "com", "net", "org", "info", "biz", "edu", "gov", "mil", "int", "aero", "travel", "jobs",
            "mobi", "name", "pro", "coop", "museum", "asia", "tel", "app", "dev", "online", "site", "tech",
            "store", "shop", "global", "group", "company", "agency", "services", "email", "africa");

    @Override
    public Stream<String> extractCandidates(String html) {
        if (html == null || html.isBlank()) return Stream.empty();

        Matcher matcher = ROT13_CANDIDATE.matcher(html);
        Stream.Builder<String> builder = Stream.builder();
        while (matcher.find()) {
            String token = matcher.group();
            if (token.indexOf('@') < 0) continue;

            String rotated = rot13(token);
            if (rotated.equals(token)) continue;
            RegexTextExtractor.findAll(rotated)
                    .filter(decoded -> !looksPlain(rot13(decoded)))
                    .forEach(builder::add);
        }
        return builder.build();
    }

    static boolean looksPlain(String address) {
        int dot = address.lastIndexOf('.');
        if (dot < 0 || dot == address.length() - 1) return false;
        String tld = address.substring(dot + 1).toLowerCase(Locale.ROOT);
        return tld.length() == 2 || PLAIN_GENERIC_TLDS.contains(tld);
    }

    static String rot13(String input) {
        StringBuilder sb = new StringBuilder(input.length());
        for (char c : input.toCharArray()) {
            if (c >= 'a' && c <= 'z') {
                sb.append((char) ('a' + (c - 'a' + 13) % 26));
            } else if (c >= 'A' && c <= 'Z') {
                sb.append((char) ('A' + (c - 'A' + 13) % 26));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
