package de.mirkosertic.mcp.spicedocs.mcp.dto;

import de.mirkosertic.mcp.spicedocs.search.SearchHit;

import java.util.List;

/**
 * Response DTO for the search_archive tool.
 */
public record SearchArchiveResponse(
        boolean success,
        String query,
        List<SearchHit> results,
        String error
) {
    public static SearchArchiveResponse success(final String query, final List<SearchHit> results) {
        return new SearchArchiveResponse(true, query, results, null);
    }

    public static SearchArchiveResponse error(final String query, final String errorMessage) {
        return new SearchArchiveResponse(false, query, List.of(), errorMessage);
    }
}
