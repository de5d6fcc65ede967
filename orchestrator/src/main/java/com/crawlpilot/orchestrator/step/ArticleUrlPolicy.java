package com.crawlpilot.orchestrator.step;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Decides which URLs the crawler accepts: http(s) on the configured host,
 * with a path under the configured prefix.
 */
public record ArticleUrlPolicy(String host, String pathPrefix) {

    /** True if {@code url} is syntactically a URI at all. */
    public static boolean isWellFormed(String url) {
        if (url == null || url.isBlank()) return false;
        try {
            URI uri = new URI(url.trim());
            return uri.getScheme() != null && uri.getHost() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }

    public boolean matches(String url) {
        if (!isWellFormed(url)) return false;
        URI uri = URI.create(url.trim());
        String scheme = uri.getScheme().toLowerCase();
        if (!scheme.equals("http") && !scheme.equals("https")) return false;
        if (!host.equalsIgnoreCase(uri.getHost())) return false;
        String path = uri.getPath();
        return path != null && path.startsWith(pathPrefix);
    }
}
