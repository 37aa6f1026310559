package de.mirkosertic.mcp.spicedocs.mcp.dto;

import org.jspecify.annotations.Nullable;

/**
 * Response DTO for the get_page tool.
 */
public record GetPageResponse(
        boolean success,
        String path,
        String title,
        long sizeBytes,
        String content,
        @Nullable String rawHtml,
        String error
) {
    public static GetPageResponse success(final String path, final String title, final long sizeBytes,
                                          final String content, @Nullable final String rawHtml) {
        return new GetPageResponse(true, path, title, sizeBytes, content, rawHtml, null);
    }

    public static GetPageResponse error(final String path, final String errorMessage) {
        return new GetPageResponse(false, path, null, 0, null, null, errorMessage);
    }
}
