package de.mirkosertic.mcp.spicedocs.indexer;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Fields extracted from one HTML page.
 *
 * @param title        text of the title element, or the fallback title
 * @param text         visible text without script and style content, whitespace collapsed
 * @param canonicalUrl href of the canonical link element, if present
 * @param links        anchors in document order
 */
public record ParsedPage(
        String title,
        String text,
        @Nullable String canonicalUrl,
        List<PageLink> links
) {
}
