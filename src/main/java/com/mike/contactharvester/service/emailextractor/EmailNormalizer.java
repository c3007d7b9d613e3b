package com.mike.contactharvester.service.emailextractor;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.parser.Parser;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a raw candidate into its canonical lowercase form, or null when the result is not a valid address.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EmailNormalizer {

    private static final Pattern PERCENT_ESCAPE = Pattern.compile("%([0-9A-Fa-f]{2})");

    private static final Pattern LEADING_JUNK =
            Pattern.compile("^[\\s\"'<>()\\[\\]{};:,.*]+");
    private static final Pattern TRAILING_JUNK =
            Pattern.compile("[\\s\"'<>()\\[\\]{};:,.*!?]+$");

    private static final Pattern MAILTO_PREFIX = Pattern.compile("(?i)^mailto:");
    private static final Pattern LEADING_UNICODE_ESCAPE = Pattern.compile("^\\\\?u00[0-9a-fA-F]{2}");

    // phone number glued to the address: "0176123456mona@..."
    private static final Pattern LEADING_PHONE_DIGITS_BEFORE_LETTER =
            Pattern.compile("^\\d{5,}(?=[a-z])");

    private final TextObfuscationNormalizer obfuscationNormalizer;

    public String normalize(String raw) {
        if (raw == null || raw.isBlank()) return null;

        String email = Parser.unescapeEntities(raw, false);
        email = decodePercentEscapes(email);

        email = obfuscationNormalizer.collapse(email);

        email = LEADING_JUNK.matcher(email).replaceAll("");
        email = TRAILING_JUNK.matcher(email).replaceAll("");
        email = MAILTO_PREFIX.matcher(email).replaceFirst("");
        email = LEADING_UNICODE_ESCAPE.matcher(email).replaceFirst("");
        if (email.isEmpty()) return null;

        email = email.toLowerCase(Locale.ROOT);
        email = LEADING_PHONE_DIGITS_BEFORE_LETTER.matcher(email).replaceFirst("");

        if (!EmailValidator.isCanonical(email)) {
            log.trace("EmailNormalizer: dropping candidate '{}' -> '{}'", raw, email);
            return null;
        }
        return email;
    }

    /**
     * Decodes %XX escapes of printable ASCII only; '+' and malformed escapes are left alone.
     */
    public static String decodePercentEscapes(String input) {
        if (input == null || input.indexOf('%') < 0) return input;

        Matcher matcher = PERCENT_ESCAPE.matcher(input);
        StringBuilder sb = new StringBuilder(input.length());
        while (matcher.find()) {
            int value = Integer.parseInt(matcher.group(1), 16);
            String replacement = (value >= 0x20 && value < 0x7f)
                    ? String.valueOf((char) value)
                    : matcher.group();
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }
}
