package de.mirkosertic.mcp.spicedocs.mcp.dto;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Response DTO for the list_pages tool.
 */
public record ListPagesResponse(
        boolean success,
        @Nullable String filterPattern,
        List<PageEntry> pages,
        String error
) {
    public static ListPagesResponse success(@Nullable final String filterPattern, final List<PageEntry> pages) {
        return new ListPagesResponse(true, filterPattern, pages, null);
    }

    public static ListPagesResponse error(final String errorMessage) {
        return new ListPagesResponse(false, null, List.of(), errorMessage);
    }
}
