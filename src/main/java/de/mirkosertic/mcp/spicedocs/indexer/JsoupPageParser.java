package de.mirkosertic.mcp.spicedocs.indexer;

import de.mirkosertic.mcp.spicedocs.util.TextCleaner;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link PageParser} backed by jsoup's lenient HTML parser.
 */
public class JsoupPageParser implements PageParser {

    @Override
    public ParsedPage parse(final String html, final String baseUri, final String fallbackTitle) {
        final Document document = Jsoup.parse(html == null ? "" : html, baseUri == null ? "" : baseUri);

        final String title = TextCleaner.clean(document.title());

        final Element canonical = document.selectFirst("link[rel=canonical][href]");
        final String canonicalUrl = canonical != null && !canonical.attr("href").isBlank()
                ? canonical.attr("href").trim()
                : null;

        // Anchors are read before script/style removal so that the whole document is considered
        final List<PageLink> links = new ArrayList<>();
        for (final Element anchor : document.select("a[href]")) {
            links.add(new PageLink(anchor.attr("href"), anchor.absUrl("href"), anchor.text().trim()));
        }

        document.select("script, style").remove();
        final String text = TextCleaner.clean(document.text());

        return new ParsedPage(title.isEmpty() ? fallbackTitle : title, text, canonicalUrl, List.copyOf(links));
    }

    /**
     * File name without its extension, used as title when a page has none.
     */
    public static String fallbackTitle(final String fileName) {
        final int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
    }
}
