package com.tooldigest.research.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

public final class UrlNormalizer {

    private UrlNormalizer() {
    }

    /**
     * True for a syntactically valid absolute http/https URL with a host.
     */
    public static boolean isAbsoluteHttpUrl(String url) {
        if (url == null || url.isBlank()) {
            return false;
        }
        try {
            URI uri = new URI(url.trim());
            String scheme = uri.getScheme();
            return scheme != null
                    && (scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))
                    && uri.getHost() != null
                    && !uri.getHost().isBlank();
        } catch (URISyntaxException e) {
            return false;
        }
    }

    /**
     * Identity key for a URL: lower-cased scheme, host and path, trailing slash removed,
     * query and fragment dropped. Returns an empty string for null or unparseable input.
     */
    public static String normalizeForKey(String url) {
        if (!isAbsoluteHttpUrl(url)) {
            return "";
        }
        URI uri = URI.create(url.trim());
        String path = uri.getPath() == null ? "" : uri.getPath();
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        String port = uri.getPort() == -1 ? "" : ":" + uri.getPort();
        return (uri.getScheme() + "://" + uri.getHost() + port + path).toLowerCase(Locale.ROOT);
    }

    /**
     * Host without a leading "www.", or null if the URL has none.
     */
    public static String hostOf(String url) {
        if (!isAbsoluteHttpUrl(url)) {
            return null;
        }
        String host = URI.create(url.trim()).getHost().toLowerCase(Locale.ROOT);
        return host.startsWith("www.") ? host.substring(4) : host;
    }
}
