package de.mirkosertic.mcp.spicedocs;

import de.mirkosertic.mcp.spicedocs.indexer.ArchiveIndexer;
import de.mirkosertic.mcp.spicedocs.indexer.DocumentIndexer;
import de.mirkosertic.mcp.spicedocs.indexer.JsoupPageParser;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tool registration and the text rendered for each tool.
 */
@DisplayName("Archive MCP tools")
class ArchiveToolsTest {

    @TempDir
    Path tempDir;

    private ArchiveIndexService indexService;
    private ArchiveTools tools;

    @BeforeEach
    void setUp() throws IOException {
        final Path mirrorRoot = ArchiveFixture.create(tempDir.resolve("mirror"));
        indexService = new ArchiveIndexService(tempDir.resolve("index"), true);
        indexService.init();
        final JsoupPageParser parser = new JsoupPageParser();
        new ArchiveIndexer(indexService, new DocumentIndexer(), parser).ensureIndexed(mirrorRoot);
        tools = new ArchiveTools(new ArchiveQueryService(indexService, mirrorRoot, parser));
    }

    @AfterEach
    void tearDown() throws IOException {
        if (indexService.isOpen()) {
            indexService.close();
        }
    }

    private static String text(final McpSchema.CallToolResult result) {
        assertThat(result.content()).hasSize(1);
        return ((McpSchema.TextContent) result.content().get(0)).text();
    }

    @Test
    @DisplayName("Should register the five archive tools")
    void shouldRegisterTools() {
        assertThat(tools.getToolSpecifications())
                .extracting(spec -> spec.tool().name())
                .containsExactly("search_archive", "get_page", "list_pages", "extract_links", "get_archive_stats");
        assertThat(tools.getToolSpecifications())
                .extracting(McpServerFeatures.SyncToolSpecification::callHandler)
                .doesNotContainNull();
    }

    @Nested
    @DisplayName("search_archive")
    class SearchArchive {

        @Test
        @DisplayName("Should list hits with path, original URL and snippet")
        void shouldRenderHits() {
            final McpSchema.CallToolResult result = tools.searchArchive(Map.of("query", "ephemeris"));

            assertThat(result.isError()).isFalse();
            assertThat(text(result))
                    .startsWith("Found 1 results for 'ephemeris':")
                    .contains("1. **Time Required Reading**")
                    .contains("Path: page_time.html")
                    .contains("Original URL: " + ArchiveFixture.TIME_CANONICAL_URL)
                    .contains("<mark>ephemeris</mark>");
        }

        @Test
        @DisplayName("Should omit the original URL when it equals the path")
        void shouldOmitUrlEqualToPath() {
            final String text = text(tools.searchArchive(Map.of("query", "furnsh")));

            assertThat(text).contains("Path: page_kernels.html").doesNotContain("Original URL");
        }

        @Test
        @DisplayName("Should report an empty result")
        void shouldReportNoResults() {
            assertThat(text(tools.searchArchive(Map.of("query", "xyzzy"))))
                    .isEqualTo("No results found for query: 'xyzzy'");
        }

        @Test
        @DisplayName("Should report syntax errors as tool errors")
        void shouldReportSyntaxErrors() {
            final McpSchema.CallToolResult result = tools.searchArchive(Map.of("query", "title:(open"));

            assertThat(result.isError()).isTrue();
            assertThat(text(result)).startsWith("Error: Invalid search query");
        }
    }

    @Nested
    @DisplayName("get_page")
    class GetPage {

        @Test
        @DisplayName("Should render title, path, size and content")
        void shouldRenderPage() {
            final String text = text(tools.getPage(Map.of("path", "subdir/nested.html")));

            assertThat(text)
                    .startsWith("# Nested Page")
                    .contains("**Path:** subdir/nested.html")
                    .containsPattern("\\*\\*File size:\\*\\* \\d+ bytes")
                    .contains("**Content:**\n")
                    .contains("A page inside a subdirectory.")
                    .doesNotContain("**Raw HTML:**");
        }

        @Test
        @DisplayName("Should append the raw HTML on request")
        void shouldAppendRawHtml() {
            final String text = text(tools.getPage(Map.of("path", "subdir/nested.html", "include_raw", true)));

            assertThat(text).contains("**Raw HTML:**\n```html\n<html><head><title>Nested Page</title>");
        }

        @Test
        @DisplayName("Should report traversal attempts as tool errors")
        void shouldRejectTraversal() {
            final McpSchema.CallToolResult result = tools.getPage(Map.of("path", "../../etc/passwd"));

            assertThat(result.isError()).isTrue();
            assertThat(text(result)).startsWith("Error: ").contains("outside the archive");
        }
    }

    @Nested
    @DisplayName("list_pages")
    class ListPages {

        @Test
        @DisplayName("Should list every page")
        void shouldListPages() {
            final String text = text(tools.listPages(Map.of()));

            assertThat(text)
                    .startsWith("Archive contains 6 pages:")
                    .contains("• **SPICE Toolkit Documentation**\n  Path: index.html")
                    .contains("Original: " + ArchiveFixture.TIME_CANONICAL_URL);
        }

        @Test
        @DisplayName("Should mention the filter")
        void shouldMentionFilter() {
            assertThat(text(tools.listPages(Map.of("filter_pattern", "subdir/*"))))
                    .startsWith("Archive contains 2 pages matching 'subdir/*':");
            assertThat(text(tools.listPages(Map.of("filter_pattern", "*.pdf"))))
                    .isEqualTo("No pages found matching '*.pdf'");
        }
    }

    @Nested
    @DisplayName("extract_links")
    class ExtractLinks {

        @Test
        @DisplayName("Should render internal links as Markdown")
        void shouldRenderInternalLinks() {
            final String text = text(tools.extractLinks(Map.of("path", "subdir/deep/deeper.html")));

            assertThat(text).isEqualTo("Found 2 internal links in 'subdir/deep/deeper.html':\n\n"
                    + "• [Root index](/index.html)\n"
                    + "• [Parent](../nested.html)\n");
        }

        @Test
        @DisplayName("Should label links without text")
        void shouldLabelEmptyText() {
            assertThat(text(tools.extractLinks(Map.of("path", "page_links.html")))).contains("• [No text](subdir/)");
        }

        @Test
        @DisplayName("Should include external links when asked")
        void shouldIncludeExternalLinks() {
            final String text = text(tools.extractLinks(Map.of("path", "page_links.html", "internal_only", false)));

            assertThat(text).startsWith("Found 9 links in 'page_links.html':")
                    .contains("(https://example.com/external.html)");
        }

        @Test
        @DisplayName("Should report a missing page")
        void shouldReportMissingPage() {
            final McpSchema.CallToolResult result = tools.extractLinks(Map.of("path", "nope.html"));

            assertThat(result.isError()).isTrue();
            assertThat(text(result)).isEqualTo("Error: File 'nope.html' not found");
        }
    }

    @Test
    @DisplayName("get_archive_stats should render the statistics")
    void shouldRenderStats() {
        final String text = text(tools.getArchiveStats());

        assertThat(text)
                .startsWith("# Archive Statistics")
                .contains("**HTML Pages:** 6")
                .contains("**Other Files:** 0")
                .contains("**Total Files:** 6")
                .contains("**Indexed Pages:** 6")
                .containsPattern("\\*\\*Total Size:\\*\\* \\d+\\.\\d MB")
                .contains("**Search Type:** Full-text search (ranked)");
    }

    @Test
    @DisplayName("Every tool should fail when the index is closed")
    void shouldFailWhenNotInitialized() throws IOException {
        indexService.close();

        for (final McpSchema.CallToolResult result : new McpSchema.CallToolResult[]{
                tools.searchArchive(Map.of("query", "spk")),
                tools.getPage(Map.of("path", "index.html")),
                tools.listPages(Map.of()),
                tools.extractLinks(Map.of("path", "index.html")),
                tools.getArchiveStats()}) {
            assertThat(result.isError()).isTrue();
            assertThat(text(result)).isEqualTo("Error: Database not initialized");
        }
    }
}
