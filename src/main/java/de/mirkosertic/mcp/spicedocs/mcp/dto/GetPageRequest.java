package de.mirkosertic.mcp.spicedocs.mcp.dto;

import de.mirkosertic.mcp.spicedocs.mcp.Description;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Request DTO for the get_page tool.
 */
public record GetPageRequest(
        @Description("Path of the HTML file relative to the archive root, e.g. 'index.html' or 'ug/mkspk.html'.")
        String path,

        @Nullable
        @Description("If true, the raw HTML source is returned in addition to the extracted text. Default is false.")
        Boolean includeRaw
) {
    public static GetPageRequest fromMap(final Map<String, Object> args) {
        return new GetPageRequest(
                (String) args.get("path"),
                (Boolean) args.get("include_raw")
        );
    }

    public boolean effectiveIncludeRaw() {
        return includeRaw != null && includeRaw;
    }
}
