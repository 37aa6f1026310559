package de.mirkosertic.mcp.spicedocs;

import de.mirkosertic.mcp.spicedocs.indexer.DocumentRecord;
import de.mirkosertic.mcp.spicedocs.indexer.JsoupPageParser;
import de.mirkosertic.mcp.spicedocs.indexer.PageLink;
import de.mirkosertic.mcp.spicedocs.indexer.PageParser;
import de.mirkosertic.mcp.spicedocs.indexer.ParsedPage;
import de.mirkosertic.mcp.spicedocs.mcp.dto.ArchiveStatsResponse;
import de.mirkosertic.mcp.spicedocs.mcp.dto.ExtractLinksResponse;
import de.mirkosertic.mcp.spicedocs.mcp.dto.GetPageResponse;
import de.mirkosertic.mcp.spicedocs.mcp.dto.LinkEntry;
import de.mirkosertic.mcp.spicedocs.mcp.dto.ListPagesResponse;
import de.mirkosertic.mcp.spicedocs.mcp.dto.PageEntry;
import de.mirkosertic.mcp.spicedocs.mcp.dto.SearchArchiveResponse;
import de.mirkosertic.mcp.spicedocs.search.SearchHit;
import de.mirkosertic.mcp.spicedocs.util.ArchivePaths;
import de.mirkosertic.mcp.spicedocs.util.GlobPattern;
import org.apache.lucene.queryparser.classic.ParseException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Read-only operations over the mirror and its index. Safe for concurrent use.
 * <p>
 * Failures are reported in the response records, never thrown.
 */
public class ArchiveQueryService {

    private static final Logger logger = LoggerFactory.getLogger(ArchiveQueryService.class);

    static final String NOT_INITIALIZED = "Database not initialized";

    private final ArchiveIndexService indexService;
    private final Path mirrorRoot;
    private final PageParser pageParser;

    public ArchiveQueryService(final ArchiveIndexService indexService, final Path mirrorRoot,
                               final PageParser pageParser) {
        this.indexService = indexService;
        this.mirrorRoot = mirrorRoot;
        this.pageParser = pageParser;
    }

    public boolean isInitialized() {
        return indexService.isOpen();
    }

    public SearchArchiveResponse search(final String query, final int limit) {
        if (!isInitialized()) {
            return SearchArchiveResponse.error(query, NOT_INITIALIZED);
        }
        if (query == null || query.isBlank()) {
            return SearchArchiveResponse.error(query, "Query must not be empty");
        }
        try {
            final List<SearchHit> hits = indexService.search(query, limit);
            logger.debug("Search '{}' returned {} hits", query, hits.size());
            return SearchArchiveResponse.success(query, hits);
        } catch (final ParseException e) {
            logger.warn("Invalid query syntax: {}", e.getMessage());
            return SearchArchiveResponse.error(query, "Invalid search query '" + query + "': " + e.getMessage());
        } catch (final IOException e) {
            logger.error("Search error", e);
            return SearchArchiveResponse.error(query, "Search error: " + e.getMessage());
        }
    }

    public GetPageResponse getPage(final String path, final boolean includeRaw) {
        if (path == null || path.isBlank()) {
            return GetPageResponse.error(path, "Path must not be empty");
        }
        final Path file;
        try {
            file = ArchivePaths.resolveInside(mirrorRoot, path);
        } catch (final IOException e) {
            logger.error("Cannot resolve archive root {}", mirrorRoot, e);
            return GetPageResponse.error(path, "Archive root is not accessible: " + e.getMessage());
        }
        if (file == null) {
            return GetPageResponse.error(path, "Path '" + path + "' is outside the archive or invalid");
        }
        if (!Files.exists(file)) {
            return GetPageResponse.error(path, "File '" + path + "' not found in archive");
        }
        if (Files.isDirectory(file)) {
            return GetPageResponse.error(path, "'" + path + "' is a directory, not a file");
        }

        try {
            final byte[] bytes = Files.readAllBytes(file);
            final String html = new String(bytes, StandardCharsets.UTF_8);
            final ParsedPage page = pageParser.parse(html, "",
                    JsoupPageParser.fallbackTitle(file.getFileName().toString()));
            return GetPageResponse.success(path, page.title(), bytes.length, page.text(), includeRaw ? html : null);
        } catch (final IOException | RuntimeException e) {
            logger.warn("Error reading {}", file, e);
            return GetPageResponse.error(path, "Failed to read file '" + path + "': " + e.getMessage());
        }
    }

    public ListPagesResponse listPages(@Nullable final String filterPattern, final int limit) {
        if (!isInitialized()) {
            return ListPagesResponse.error(NOT_INITIALIZED);
        }
        Pattern pathFilter = null;
        if (filterPattern != null) {
            pathFilter = GlobPattern.compile(filterPattern);
            if (pathFilter == null) {
                logger.debug("Glob '{}' cannot be compiled, no page matches", filterPattern);
                return ListPagesResponse.success(filterPattern, List.of());
            }
        }
        try {
            final List<PageEntry> pages = new ArrayList<>();
            for (final DocumentRecord record : indexService.listRecords(pathFilter, limit)) {
                pages.add(new PageEntry(record.path(), record.title(), record.url()));
            }
            return ListPagesResponse.success(filterPattern, pages);
        } catch (final IOException e) {
            logger.error("Error listing pages", e);
            return ListPagesResponse.error("Error listing pages: " + e.getMessage());
        }
    }

    /**
     * Anchors of a page. With {@code internalOnly}, only same-page anchors and links to files that exist
     * inside the mirror are kept.
     */
    public ExtractLinksResponse extractLinks(final String path, final boolean internalOnly) {
        if (path == null || path.isBlank()) {
            return ExtractLinksResponse.error(path, internalOnly, "Path must not be empty");
        }
        final Path realRoot;
        final Path file;
        try {
            realRoot = mirrorRoot.toRealPath();
            file = ArchivePaths.resolveInside(realRoot, path);
        } catch (final IOException e) {
            logger.error("Cannot resolve archive root {}", mirrorRoot, e);
            return ExtractLinksResponse.error(path, internalOnly, "Archive root is not accessible: " + e.getMessage());
        }
        if (file == null) {
            return ExtractLinksResponse.error(path, internalOnly, "Invalid path '" + path + "'");
        }
        if (!Files.isRegularFile(file)) {
            return ExtractLinksResponse.error(path, internalOnly, "File '" + path + "' not found");
        }

        try {
            final String html = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
            final ParsedPage page = pageParser.parse(html, "", "");
            final Path pageDirectory = file.getParent();

            final List<LinkEntry> links = new ArrayList<>();
            for (final PageLink link : page.links()) {
                if (!internalOnly || isInternal(realRoot, pageDirectory, link.href())) {
                    links.add(new LinkEntry(link.href(), link.text()));
                }
            }
            return ExtractLinksResponse.success(path, internalOnly, links);
        } catch (final IOException | RuntimeException e) {
            logger.warn("Error extracting links from {}", file, e);
            return ExtractLinksResponse.error(path, internalOnly,
                    "Failed to extract links from '" + path + "': " + e.getMessage());
        }
    }

    private static boolean isInternal(final Path realRoot, final Path pageDirectory, final String href)
            throws IOException {
        if (href.startsWith("http")) {
            return false;
        }
        final String target = stripFragmentAndQuery(href);
        if (target.isEmpty()) {
            // Same-page anchor
            return href.startsWith("#");
        }
        final Path resolved = ArchivePaths.resolveInside(realRoot, pageDirectory, target);
        return resolved != null && Files.exists(resolved);
    }

    static String stripFragmentAndQuery(final String href) {
        String result = href;
        final int hash = result.indexOf('#');
        if (hash >= 0) {
            result = result.substring(0, hash);
        }
        final int question = result.indexOf('?');
        if (question >= 0) {
            result = result.substring(0, question);
        }
        return result;
    }

    public ArchiveStatsResponse getArchiveStats() {
        if (!isInitialized()) {
            return ArchiveStatsResponse.error(NOT_INITIALIZED);
        }
        final Path root = mirrorRoot.toAbsolutePath().normalize();
        final Path indexPath = indexService.getIndexPath().toAbsolutePath().normalize();

        long htmlFiles = 0;
        long otherFiles = 0;
        long totalBytes = 0;
        try (Stream<Path> stream = Files.walk(root)) {
            final List<Path> files = stream
                    .filter(p -> !p.startsWith(indexPath))
                    .filter(Files::isRegularFile)
                    .toList();
            for (final Path file : files) {
                if (file.getFileName().toString().endsWith(".html")) {
                    htmlFiles++;
                } else {
                    otherFiles++;
                }
                totalBytes += Files.size(file);
            }
            final long indexed = indexService.getDocumentCount();
            return ArchiveStatsResponse.success(root.toString(), htmlFiles, otherFiles, indexed,
                    totalBytes / (1024.0 * 1024.0), indexService.getSearchStrategy().description());
        } catch (final IOException | RuntimeException e) {
            logger.error("Error getting archive stats", e);
            return ArchiveStatsResponse.error("Error getting archive stats: " + e.getMessage());
        }
    }
}
