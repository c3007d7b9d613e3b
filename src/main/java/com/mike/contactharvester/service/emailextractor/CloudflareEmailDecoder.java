package com.mike.contactharvester.service.emailextractor;

public final class CloudflareEmailDecoder {

    private CloudflareEmailDecoder() {
    }

    /**
     * First byte is the XOR key, the rest the encoded address. Returns null for malformed input.
     */
    public static String decode(String cfemail) {
        if (cfemail == null || cfemail.length() < 4 || cfemail.length() % 2 != 0) return null;

        try {
            int r = Integer.parseInt(cfemail.substring(0, 2), 16);
            StringBuilder email = new StringBuilder();

            for (int n = 2; n < cfemail.length(); n += 2) {
                int c = Integer.parseInt(cfemail.substring(n, n + 2), 16) ^ r;
                email.append((char) c);
            }
            return email.toString();
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
