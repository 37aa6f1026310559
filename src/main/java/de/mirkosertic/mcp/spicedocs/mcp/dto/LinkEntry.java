package de.mirkosertic.mcp.spicedocs.mcp.dto;

/**
 * One anchor in an extract_links response; {@code href} is as written in the page.
 */
public record LinkEntry(String href, String text) {
}
