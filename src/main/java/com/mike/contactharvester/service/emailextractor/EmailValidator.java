package com.mike.contactharvester.service.emailextractor;

import java.util.regex.Pattern;

/**
 * Canonical email grammar: lowercase local@domain, local part from [a-z0-9._%+-],
 * dot-separated domain labels from [a-z0-9-], alphabetic TLD of at least two letters.
 */
public final class EmailValidator {

    private static final Pattern CANONICAL_EMAIL =
            Pattern.compile("^[a-z0-9._%+-]+@[a-z0-9-]+(?:\\.[a-z0-9-]+)*\\.[a-z]{2,}$");

    private static final Pattern SUSPICIOUS_UNICODE_ESCAPE =
            Pattern.compile("u00[0-9a-f]{2}");

    private static final int MAX_LOCAL_PART = 64;
    private static final int MAX_ADDRESS = 254;

    private EmailValidator() {
    }

    public static boolean isCanonical(String email) {
        if (email == null || email.length() > MAX_ADDRESS) return false;
        if (!CANONICAL_EMAIL.matcher(email).matches()) return false;

        int at = email.indexOf('@');
        return isLocalPartAllowed(email.substring(0, at))
                && isDomainAllowed(email.substring(at + 1));
    }

    static boolean isLocalPartAllowed(String localPart) {
        if (localPart.isEmpty() || localPart.length() > MAX_LOCAL_PART) return false;
        if (localPart.startsWith(".") || localPart.endsWith(".")) return false;
        if (localPart.contains("..")) return false;
        return !SUSPICIOUS_UNICODE_ESCAPE.matcher(localPart).find();
    }

    static boolean isDomainAllowed(String domain) {
        if (domain.contains("..")) return false;
        for (String label : domain.split("\\.")) {
            if (label.isEmpty()) return false;
            if (label.startsWith("-") || label.endsWith("-")) return false;
        }
        return true;
    }
}
