package de.mirkosertic.mcp.spicedocs.mcp.dto;

/**
 * Response DTO for the get_archive_stats tool.
 */
public record ArchiveStatsResponse(
        boolean success,
        String archivePath,
        long htmlPages,
        long otherFiles,
        long totalFiles,
        long indexedPages,
        double totalSizeMb,
        String searchType,
        String error
) {
    public static ArchiveStatsResponse success(final String archivePath, final long htmlPages, final long otherFiles,
                                               final long indexedPages, final double totalSizeMb,
                                               final String searchType) {
        return new ArchiveStatsResponse(true, archivePath, htmlPages, otherFiles, htmlPages + otherFiles,
                indexedPages, totalSizeMb, searchType, null);
    }

    public static ArchiveStatsResponse error(final String errorMessage) {
        return new ArchiveStatsResponse(false, null, 0, 0, 0, 0, 0, null, errorMessage);
    }
}
