package de.mirkosertic.mcp.spicedocs.mcp.dto;

/**
 * One page in a list_pages response.
 */
public record PageEntry(String path, String title, String url) {

    public boolean hasDistinctUrl() {
        return url != null && !url.isEmpty() && !url.equals(path);
    }
}
