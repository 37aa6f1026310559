package de.mirkosertic.mcp.spicedocs.mcp.dto;

import de.mirkosertic.mcp.spicedocs.mcp.Description;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Request DTO for the search_archive tool.
 */
public record SearchArchiveRequest(
        @Description("Search query. With ranked search this is Lucene query syntax: bare terms must all match, "
                + "'\"exact phrase\"', 'term1 OR term2', 'NOT term', 'kern*', 'title:spkezr'. "
                + "Basic search matches the text literally (case-insensitive).")
        String query,

        @Nullable
        @Description("Maximum number of results to return. Default is 10, maximum is 100.")
        Integer limit
) {
    public static final int DEFAULT_LIMIT = 10;
    public static final int MAX_LIMIT = 100;

    public static SearchArchiveRequest fromMap(final Map<String, Object> args) {
        return new SearchArchiveRequest(
                (String) args.get("query"),
                args.get("limit") != null ? ((Number) args.get("limit")).intValue() : null
        );
    }

    public int effectiveLimit() {
        return (limit != null && limit > 0) ? Math.min(limit, MAX_LIMIT) : DEFAULT_LIMIT;
    }
}
