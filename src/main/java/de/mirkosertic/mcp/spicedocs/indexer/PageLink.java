package de.mirkosertic.mcp.spicedocs.indexer;

/**
 * An anchor found in a page.
 *
 * @param href         the attribute value as written
 * @param absoluteHref the href resolved against the page location, empty if it cannot be resolved
 * @param text         trimmed anchor text
 */
public record PageLink(String href, String absoluteHref, String text) {
}
