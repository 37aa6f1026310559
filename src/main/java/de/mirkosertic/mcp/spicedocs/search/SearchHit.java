package de.mirkosertic.mcp.spicedocs.search;

/**
 * One page matching a query.
 *
 * @param score relevance score; 0 for strategies without ranking
 */
public record SearchHit(String path, String title, String url, String snippet, float score) {

    public boolean hasDistinctUrl() {
        return url != null && !url.isEmpty() && !url.equals(path);
    }
}
