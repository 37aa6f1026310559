package de.mirkosertic.mcp.spicedocs.crawler;

/**
 * Raw HTTP response for one page.
 *
 * @param url        the requested URL
 * @param statusCode HTTP status after redirects
 * @param body       response body, unmodified
 */
public record FetchedPage(String url, int statusCode, byte[] body) {

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }
}
