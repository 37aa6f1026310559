package de.mirkosertic.mcp.spicedocs.mcp.dto;

import de.mirkosertic.mcp.spicedocs.mcp.Description;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Request DTO for the list_pages tool.
 */
public record ListPagesRequest(
        @Nullable
        @Description("Optional glob matched against the whole page path, e.g. 'ug/*' or '*kernel*.html'. "
                + "'*' also matches '/', '?' matches one character, '[abc]' and '[!abc]' match character classes. "
                + "Matching is case-sensitive.")
        String filterPattern,

        @Nullable
        @Description("Maximum number of pages to return. Default is 50, maximum is 1000.")
        Integer limit
) {
    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 1000;

    public static ListPagesRequest fromMap(final Map<String, Object> args) {
        return new ListPagesRequest(
                (String) args.get("filter_pattern"),
                args.get("limit") != null ? ((Number) args.get("limit")).intValue() : null
        );
    }

    public int effectiveLimit() {
        return (limit != null && limit > 0) ? Math.min(limit, MAX_LIMIT) : DEFAULT_LIMIT;
    }

    /**
     * Blank patterns mean no filter.
     */
    public @Nullable String effectiveFilterPattern() {
        return (filterPattern == null || filterPattern.isEmpty()) ? null : filterPattern;
    }
}
