package de.mirkosertic.mcp.spicedocs.crawler;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Decides which URLs belong to the mirrored documentation tree.
 * <p>
 * A URL is in scope when it is on the same host as the base URL (or has no host), its path lies under the
 * documentation prefix, and the path names an HTML page or a directory index.
 */
public class UrlScope {

    private static final String HTML_SUFFIX = ".html";
    private static final String INDEX_FILE = "index.html";

    private final String baseAuthority;
    private final String pathPrefix;

    public UrlScope(final String baseUrl, final String pathPrefix) {
        final URI base = URI.create(baseUrl);
        this.baseAuthority = base.getRawAuthority();
        this.pathPrefix = pathPrefix;
    }

    public boolean shouldDownload(final String url) {
        final URI uri;
        try {
            uri = new URI(url);
        } catch (final URISyntaxException e) {
            return false;
        }
        // mailto:, javascript: and friends are opaque and never in scope
        if (uri.isOpaque()) {
            return false;
        }

        final String authority = uri.getRawAuthority();
        if (authority != null && !authority.isEmpty() && !authority.equalsIgnoreCase(baseAuthority)) {
            return false;
        }

        final String path = uri.getPath();
        if (path == null || !path.startsWith(pathPrefix)) {
            return false;
        }

        return path.endsWith(HTML_SUFFIX) || path.endsWith("/");
    }

    /**
     * Key used for the visited set: the URL without fragment and without trailing slash.
     */
    public static String visitKey(final String url) {
        String key = stripFragment(url);
        while (key.endsWith("/")) {
            key = key.substring(0, key.length() - 1);
        }
        return key;
    }

    public static String stripFragment(final String url) {
        final int hash = url.indexOf('#');
        return hash >= 0 ? url.substring(0, hash) : url;
    }

    /**
     * Relative file path for a page, derived from the URL path. Directory URLs map to their index.html.
     */
    public static String relativeFilePath(final String url) {
        String path = URI.create(stripFragment(url)).getPath();
        if (path == null) {
            path = "";
        }
        while (path.startsWith("/")) {
            path = path.substring(1);
        }
        if (path.isEmpty() || path.endsWith("/")) {
            path += INDEX_FILE;
        }
        return path;
    }
}
