package de.mirkosertic.mcp.spicedocs.mcp.dto;

import java.util.List;

/**
 * Response DTO for the extract_links tool.
 */
public record ExtractLinksResponse(
        boolean success,
        String path,
        boolean internalOnly,
        List<LinkEntry> links,
        String error
) {
    public static ExtractLinksResponse success(final String path, final boolean internalOnly,
                                               final List<LinkEntry> links) {
        return new ExtractLinksResponse(true, path, internalOnly, links, null);
    }

    public static ExtractLinksResponse error(final String path, final boolean internalOnly,
                                             final String errorMessage) {
        return new ExtractLinksResponse(false, path, internalOnly, List.of(), errorMessage);
    }
}
