package com.mike.contactharvester.service.emailextractor;

import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Undoes the textual "at" / "dot" obfuscation of addresses.
 * <p>
 * {@link #deobfuscate} is safe on whole page text; {@link #collapse} is for a single candidate and also
 * closes the gaps around '@' and '.'.
 */
@Component
public class TextObfuscationNormalizer {

    // (at) [at] {at} <at>, with or without surrounding blanks
    private static final Pattern BRACKETED_AT =
            Pattern.compile("(?i)\\s*[\\(\\[\\{<]\\s*at\\s*[\\)\\]\\}>]\\s*");
    private static final Pattern BRACKETED_DOT =
            Pattern.compile("(?i)\\s*[\\(\\[\\{<]\\s*dot\\s*[\\)\\]\\}>]\\s*");
    private static final Pattern WORDED_AT = Pattern.compile("(?i)\\s+at\\s+");
    private static final Pattern WORDED_DOT = Pattern.compile("(?i)\\s+dot\\s+");

    private static final Pattern GAP_AROUND_AT = Pattern.compile("\\s*@\\s*");
    private static final Pattern GAP_AROUND_DOT = Pattern.compile("\\s*\\.\\s*");

    public String deobfuscate(String text) {
        if (text == null || text.isBlank()) return text;
        String s = BRACKETED_AT.matcher(text).replaceAll("@");
        s = BRACKETED_DOT.matcher(s).replaceAll(".");
        s = WORDED_AT.matcher(s).replaceAll("@");
        return WORDED_DOT.matcher(s).replaceAll(".");
    }

    /**
     * "info at acme dot com", "info [at] acme (dot) com" and "info @ acme . com" all become info@acme.com.
     * Only meant for a single candidate: on free text it would join sentences.
     */
    public String collapse(String candidate) {
        if (candidate == null || candidate.isBlank()) return candidate;
        String s = deobfuscate(candidate);
        s = GAP_AROUND_AT.matcher(s).replaceAll("@");
        return GAP_AROUND_DOT.matcher(s).replaceAll(".");
    }
}
