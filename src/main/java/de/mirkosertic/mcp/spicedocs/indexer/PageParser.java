package de.mirkosertic.mcp.spicedocs.indexer;

/**
 * Extracts the fields the crawler, the indexer and the query tools need from an HTML page.
 * Implementations never fail on malformed markup; missing elements fall back to defaults.
 */
public interface PageParser {

    /**
     * @param html          page source
     * @param baseUri       location the page was loaded from, used to resolve relative links (may be empty)
     * @param fallbackTitle title to use when the page has no title element
     */
    ParsedPage parse(String html, String baseUri, String fallbackTitle);
}
