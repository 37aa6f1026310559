package de.mirkosertic.mcp.spicedocs.mcp;

import io.modelcontextprotocol.spec.McpSchema;

import java.util.List;

/**
 * Wraps the text rendered for a tool call into an MCP result.
 */
public final class ToolResultHelper {

    private ToolResultHelper() {
    }

    public static McpSchema.CallToolResult createResult(final String text) {
        return build(text, false);
    }

    /**
     * Error result; {@code message} is prefixed with {@code "Error: "}.
     */
    public static McpSchema.CallToolResult createErrorResult(final String message) {
        return build("Error: " + message, true);
    }

    private static McpSchema.CallToolResult build(final String text, final boolean error) {
        return McpSchema.CallToolResult.builder()
                .content(List.of(new McpSchema.TextContent(text)))
                .isError(error)
                .build();
    }
}
