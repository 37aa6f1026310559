package de.mirkosertic.mcp.spicedocs;

import de.mirkosertic.mcp.spicedocs.mcp.SchemaGenerator;
import de.mirkosertic.mcp.spicedocs.mcp.ToolResultHelper;
import de.mirkosertic.mcp.spicedocs.mcp.dto.ArchiveStatsResponse;
import de.mirkosertic.mcp.spicedocs.mcp.dto.ExtractLinksRequest;
import de.mirkosertic.mcp.spicedocs.mcp.dto.ExtractLinksResponse;
import de.mirkosertic.mcp.spicedocs.mcp.dto.GetPageRequest;
import de.mirkosertic.mcp.spicedocs.mcp.dto.GetPageResponse;
import de.mirkosertic.mcp.spicedocs.mcp.dto.LinkEntry;
import de.mirkosertic.mcp.spicedocs.mcp.dto.ListPagesRequest;
import de.mirkosertic.mcp.spicedocs.mcp.dto.ListPagesResponse;
import de.mirkosertic.mcp.spicedocs.mcp.dto.PageEntry;
import de.mirkosertic.mcp.spicedocs.mcp.dto.SearchArchiveRequest;
import de.mirkosertic.mcp.spicedocs.mcp.dto.SearchArchiveResponse;
import de.mirkosertic.mcp.spicedocs.search.SearchHit;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * MCP tools for searching and browsing the documentation archive.
 * Each tool renders its response as Markdown-flavoured text.
 */
public class ArchiveTools {

    private static final Logger logger = LoggerFactory.getLogger(ArchiveTools.class);

    private static final String SEARCH_DESCRIPTION = """
            Search for content across all pages in the SPICE documentation. \
            With full-text search, results are ranked by relevance and query terms are highlighted with <mark> tags. \
            Supports Lucene query syntax: \
            - Simple terms: 'kernel pool' (all terms must match) \
            - Phrases: '"light time correction"' \
            - Boolean: 'spkezr OR spkpos', 'frames NOT dynamic' \
            - Wildcards: 'furnsh*' \
            - Field search: 'title:spkezr' \
            When the archive only offers basic search, the query is matched literally and case-insensitively \
            against titles and text. Returns titles, paths and snippets.""";

    private final ArchiveQueryService queryService;

    public ArchiveTools(final ArchiveQueryService queryService) {
        this.queryService = queryService;
    }

    /**
     * Returns all MCP tool specifications for registration with the MCP server.
     */
    public List<McpServerFeatures.SyncToolSpecification> getToolSpecifications() {
        final List<McpServerFeatures.SyncToolSpecification> tools = new ArrayList<>();

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("search_archive")
                        .description(SEARCH_DESCRIPTION)
                        .inputSchema(SchemaGenerator.generateSchema(SearchArchiveRequest.class))
                        .build())
                .callHandler((exchange, request) -> searchArchive(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("get_page")
                        .description("Retrieve the content of a specific page from the SPICE documentation. "
                                + "Returns the page title, file size and extracted text, optionally the raw HTML. "
                                + "Paths are relative to the archive root, e.g. 'index.html' or 'ug/mkspk.html'.")
                        .inputSchema(SchemaGenerator.generateSchema(GetPageRequest.class))
                        .build())
                .callHandler((exchange, request) -> getPage(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("list_pages")
                        .description("List available pages in the SPICE documentation archive, ordered by path. "
                                + "Use filter_pattern to narrow the list, e.g. 'cspice/*' or '*spk*'.")
                        .inputSchema(SchemaGenerator.generateSchema(ListPagesRequest.class))
                        .build())
                .callHandler((exchange, request) -> listPages(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("extract_links")
                        .description("Extract all links from a specific page in the documentation. "
                                + "By default only links to other pages in the archive are returned.")
                        .inputSchema(SchemaGenerator.generateSchema(ExtractLinksRequest.class))
                        .build())
                .callHandler((exchange, request) -> extractLinks(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("get_archive_stats")
                        .description("Get statistics about the SPICE documentation archive: file counts, "
                                + "total size, indexed pages and the active search type.")
                        .inputSchema(SchemaGenerator.emptySchema())
                        .build())
                .callHandler((exchange, request) -> getArchiveStats())
                .build());

        return tools;
    }

    McpSchema.CallToolResult searchArchive(final Map<String, Object> args) {
        if (!queryService.isInitialized()) {
            return ToolResultHelper.createErrorResult(ArchiveQueryService.NOT_INITIALIZED);
        }
        final SearchArchiveRequest request = SearchArchiveRequest.fromMap(args);
        logger.info("Search request: query='{}', limit={}", request.query(), request.effectiveLimit());

        final SearchArchiveResponse response = queryService.search(request.query(), request.effectiveLimit());
        if (!response.success()) {
            return ToolResultHelper.createErrorResult(response.error());
        }
        return ToolResultHelper.createResult(formatSearch(response));
    }

    static String formatSearch(final SearchArchiveResponse response) {
        if (response.results().isEmpty()) {
            return "No results found for query: '" + response.query() + "'";
        }
        final StringBuilder sb = new StringBuilder();
        sb.append("Found ").append(response.results().size()).append(" results for '")
                .append(response.query()).append("':\n\n");
        int i = 1;
        for (final SearchHit hit : response.results()) {
            sb.append(i++).append(". **").append(hit.title()).append("**\n");
            sb.append("   Path: ").append(hit.path()).append('\n');
            if (hit.hasDistinctUrl()) {
                sb.append("   Original URL: ").append(hit.url()).append('\n');
            }
            sb.append("   Snippet: ").append(hit.snippet()).append("\n\n");
        }
        return sb.toString();
    }

    McpSchema.CallToolResult getPage(final Map<String, Object> args) {
        if (!queryService.isInitialized()) {
            return ToolResultHelper.createErrorResult(ArchiveQueryService.NOT_INITIALIZED);
        }
        final GetPageRequest request = GetPageRequest.fromMap(args);
        logger.info("Get page request: path='{}', includeRaw={}", request.path(), request.effectiveIncludeRaw());

        final GetPageResponse response = queryService.getPage(request.path(), request.effectiveIncludeRaw());
        if (!response.success()) {
            return ToolResultHelper.createErrorResult(response.error());
        }
        return ToolResultHelper.createResult(formatPage(response));
    }

    static String formatPage(final GetPageResponse response) {
        final StringBuilder sb = new StringBuilder();
        sb.append("# ").append(response.title()).append("\n\n");
        sb.append("**Path:** ").append(response.path()).append('\n');
        sb.append("**File size:** ").append(response.sizeBytes()).append(" bytes\n\n");
        sb.append("**Content:**\n").append(response.content());
        if (response.rawHtml() != null) {
            sb.append("\n\n**Raw HTML:**\n```html\n").append(response.rawHtml()).append("\n```");
        }
        return sb.toString();
    }

    McpSchema.CallToolResult listPages(final Map<String, Object> args) {
        if (!queryService.isInitialized()) {
            return ToolResultHelper.createErrorResult(ArchiveQueryService.NOT_INITIALIZED);
        }
        final ListPagesRequest request = ListPagesRequest.fromMap(args);
        logger.info("List pages request: filter='{}', limit={}", request.filterPattern(), request.effectiveLimit());

        final ListPagesResponse response =
                queryService.listPages(request.effectiveFilterPattern(), request.effectiveLimit());
        if (!response.success()) {
            return ToolResultHelper.createErrorResult(response.error());
        }
        return ToolResultHelper.createResult(formatPageList(response));
    }

    static String formatPageList(final ListPagesResponse response) {
        if (response.pages().isEmpty()) {
            return response.filterPattern() == null
                    ? "No pages found in archive"
                    : "No pages found matching '" + response.filterPattern() + "'";
        }
        final StringBuilder sb = new StringBuilder();
        sb.append("Archive contains ").append(response.pages().size()).append(" pages");
        if (response.filterPattern() != null) {
            sb.append(" matching '").append(response.filterPattern()).append('\'');
        }
        sb.append(":\n\n");
        for (final PageEntry page : response.pages()) {
            sb.append("• **").append(page.title()).append("**\n  Path: ").append(page.path()).append('\n');
            if (page.hasDistinctUrl()) {
                sb.append("  Original: ").append(page.url()).append('\n');
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    McpSchema.CallToolResult extractLinks(final Map<String, Object> args) {
        if (!queryService.isInitialized()) {
            return ToolResultHelper.createErrorResult(ArchiveQueryService.NOT_INITIALIZED);
        }
        final ExtractLinksRequest request = ExtractLinksRequest.fromMap(args);
        logger.info("Extract links request: path='{}', internalOnly={}",
                request.path(), request.effectiveInternalOnly());

        final ExtractLinksResponse response =
                queryService.extractLinks(request.path(), request.effectiveInternalOnly());
        if (!response.success()) {
            return ToolResultHelper.createErrorResult(response.error());
        }
        return ToolResultHelper.createResult(formatLinks(response));
    }

    static String formatLinks(final ExtractLinksResponse response) {
        final String kind = response.internalOnly() ? "internal " : "";
        if (response.links().isEmpty()) {
            return "No " + kind + "links found in '" + response.path() + "'";
        }
        final StringBuilder sb = new StringBuilder();
        sb.append("Found ").append(response.links().size()).append(' ').append(kind)
                .append("links in '").append(response.path()).append("':\n\n");
        for (final LinkEntry link : response.links()) {
            final String text = link.text() == null || link.text().isEmpty() ? "No text" : link.text();
            sb.append("• [").append(text).append("](").append(link.href()).append(")\n");
        }
        return sb.toString();
    }

    McpSchema.CallToolResult getArchiveStats() {
        if (!queryService.isInitialized()) {
            return ToolResultHelper.createErrorResult(ArchiveQueryService.NOT_INITIALIZED);
        }
        logger.info("Archive stats request");

        final ArchiveStatsResponse response = queryService.getArchiveStats();
        if (!response.success()) {
            return ToolResultHelper.createErrorResult(response.error());
        }
        return ToolResultHelper.createResult(formatStats(response));
    }

    static String formatStats(final ArchiveStatsResponse response) {
        return "# Archive Statistics\n\n"
                + "**Archive Path:** " + response.archivePath() + '\n'
                + "**HTML Pages:** " + response.htmlPages() + '\n'
                + "**Other Files:** " + response.otherFiles() + '\n'
                + "**Total Files:** " + response.totalFiles() + '\n'
                + "**Indexed Pages:** " + response.indexedPages() + '\n'
                + "**Total Size:** " + String.format(Locale.ROOT, "%.1f", response.totalSizeMb()) + " MB\n"
                + "**Search Type:** " + response.searchType() + '\n';
    }
}
