package com.mike.contactharvester.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

public final class UrlUtils {

    private UrlUtils() {
    }

    /**
     * Lowercase host without a leading "www.", or null when the URL has none.
     */
    public static String hostOf(String url) {
        if (url == null || url.isBlank()) return null;
        try {
            String host = new URI(url.trim()).getHost();
            if (host == null || host.isBlank()) return null;
            host = host.toLowerCase(Locale.ROOT);
            if (host.startsWith("www.")) {
                host = host.substring(4);
            }
            return host;
        } catch (URISyntaxException e) {
            return null;
        }
    }

    /**
     * https://sub.airline.ae/x -> airline.ae
     */
    public static String baseDomainOf(String url) {
        String host = hostOf(url);
        if (host == null) return null;
        String[] parts = host.split("\\.");
        if (parts.length < 2) return host;
        return parts[parts.length - 2] + "." + parts[parts.length - 1];
    }

    /**
     * True when {@code host} is {@code domain} or one of its subdomains. A leading dot on {@code domain}
     * is ignored, so ".gov" covers every host under gov. "x.com" never matches "jetex.com".
     */
    public static boolean isSameOrSubdomain(String host, String domain) {
        if (host == null || domain == null) return false;
        String d = domain.startsWith(".") ? domain.substring(1) : domain;
        if (d.isEmpty()) return false;
        return host.equals(d) || host.endsWith("." + d);
    }

    public static boolean isHttpUrl(String url) {
        if (url == null) return false;
        String lower = url.trim().toLowerCase(Locale.ROOT);
        return (lower.startsWith("http://") || lower.startsWith("https://")) && hostOf(url) != null;
    }

    /**
     * Form used for visited-set membership: lowercase scheme and host, no fragment,
     * no trailing slash on the path. Returns null for URLs that cannot be parsed.
     */
    public static String normalize(String url) {
        if (url == null || url.isBlank()) return null;
        try {
            URI uri = new URI(url.trim());
            String scheme = uri.getScheme() == null ? "http" : uri.getScheme().toLowerCase(Locale.ROOT);
            String host = uri.getHost();
            if (host == null) return null;

            StringBuilder sb = new StringBuilder();
            sb.append(scheme).append("://").append(host.toLowerCase(Locale.ROOT));
            int port = uri.getPort();
            if (port != -1 && !isDefaultPort(scheme, port)) {
                sb.append(':').append(port);
            }
            String path = uri.getRawPath();
            if (path != null && !path.isEmpty() && !"/".equals(path)) {
                sb.append(path.endsWith("/") ? path.substring(0, path.length() - 1) : path);
            }
            if (uri.getRawQuery() != null) {
                sb.append('?').append(uri.getRawQuery());
            }
            return sb.toString();
        } catch (URISyntaxException e) {
            return null;
        }
    }

    private static boolean isDefaultPort(String scheme, int port) {
        return ("http".equals(scheme) && port == 80) || ("https".equals(scheme) && port == 443);
    }
}
