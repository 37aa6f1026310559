package de.mirkosertic.mcp.spicedocs.mcp.dto;

import de.mirkosertic.mcp.spicedocs.mcp.Description;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Request DTO for the extract_links tool.
 */
public record ExtractLinksRequest(
        @Description("Path of the HTML file relative to the archive root.")
        String path,

        @Nullable
        @Description("If true (default), only links to pages that exist in the archive and same-page anchors "
                + "are returned. Set to false to return every link, including external ones.")
        Boolean internalOnly
) {
    public static ExtractLinksRequest fromMap(final Map<String, Object> args) {
        return new ExtractLinksRequest(
                (String) args.get("path"),
                (Boolean) args.get("internal_only")
        );
    }

    public boolean effectiveInternalOnly() {
        return internalOnly == null || internalOnly;
    }
}
