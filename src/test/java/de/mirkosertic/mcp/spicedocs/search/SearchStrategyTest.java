package de.mirkosertic.mcp.spicedocs.search;

import de.mirkosertic.mcp.spicedocs.indexer.DocumentIndexer;
import de.mirkosertic.mcp.spicedocs.indexer.ParsedPage;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.queryparser.classic.ParseException;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Search strategies")
class SearchStrategyTest {

    private static final String LONG_TEXT = "Introduction to the toolkit. ".repeat(20)
            + "The SPK subsystem computes ephemeris data for spacecraft and planets. "
            + "Closing remarks about the toolkit. ".repeat(20);

    private final StandardAnalyzer analyzer = new StandardAnalyzer();
    private Directory directory;
    private DirectoryReader reader;

    @AfterEach
    void tearDown() throws IOException {
        if (reader != null) {
            reader.close();
        }
        if (directory != null) {
            directory.close();
        }
    }

    private IndexSearcher index(final boolean ranked) throws IOException {
        directory = new ByteBuffersDirectory();
        final DocumentIndexer documentIndexer = new DocumentIndexer();
        try (IndexWriter writer = new IndexWriter(directory, new IndexWriterConfig(analyzer))) {
            writer.addDocument(documentIndexer.createDocument("req/spk.html",
                    new ParsedPage("SPK Required Reading", LONG_TEXT, null, List.of()), 1L, ranked));
            writer.addDocument(documentIndexer.createDocument("req/ck.html",
                    new ParsedPage("CK Required Reading", "Pointing kernels store spacecraft orientation.",
                            null, List.of()), 2L, ranked));
            writer.addDocument(documentIndexer.createDocument("cspice/spkezr_c.html",
                    new ParsedPage("spkezr_c", "Return the state of a target body relative to an observer.",
                            "https://naif.jpl.nasa.gov/pub/naif/toolkit_docs/C/cspice/spkezr_c.html", List.of()),
                    3L, ranked));
        }
        reader = DirectoryReader.open(directory);
        return new IndexSearcher(reader);
    }

    @Nested
    @DisplayName("Ranked")
    class Ranked {

        private final RankedSearchStrategy strategy = new RankedSearchStrategy(analyzer);

        @Test
        @DisplayName("Should highlight matches in a passage around the hit")
        void shouldHighlightMatches() throws IOException, ParseException {
            final List<SearchHit> hits = strategy.search(index(true), "ephemeris", 10);

            assertThat(hits).singleElement().satisfies(hit -> {
                assertThat(hit.path()).isEqualTo("req/spk.html");
                assertThat(hit.title()).isEqualTo("SPK Required Reading");
                assertThat(hit.snippet()).contains("<mark>ephemeris</mark>").startsWith("...");
                assertThat(hit.snippet().length()).isLessThan(LONG_TEXT.length());
                assertThat(hit.score()).isPositive();
            });
        }

        @Test
        @DisplayName("Should combine bare terms with AND")
        void shouldRequireAllTerms() throws IOException, ParseException {
            final IndexSearcher searcher = index(true);

            assertThat(strategy.search(searcher, "spacecraft orientation", 10))
                    .extracting(SearchHit::path).containsExactly("req/ck.html");
            assertThat(strategy.search(searcher, "spacecraft OR observer", 10))
                    .extracting(SearchHit::path).containsExactlyInAnyOrder("req/spk.html", "req/ck.html",
                            "cspice/spkezr_c.html");
        }

        @Test
        @DisplayName("Should support field queries, phrases and wildcards")
        void shouldSupportQuerySyntax() throws IOException, ParseException {
            final IndexSearcher searcher = index(true);

            assertThat(strategy.search(searcher, "title:ck", 10))
                    .extracting(SearchHit::path).containsExactly("req/ck.html");
            assertThat(strategy.search(searcher, "\"pointing kernels\"", 10))
                    .extracting(SearchHit::path).containsExactly("req/ck.html");
            assertThat(strategy.search(searcher, "orient*", 10))
                    .extracting(SearchHit::path).containsExactly("req/ck.html");
        }

        @Test
        @DisplayName("Should expose the canonical URL")
        void shouldExposeCanonicalUrl() throws IOException, ParseException {
            final SearchHit hit = strategy.search(index(true), "observer", 10).get(0);

            assertThat(hit.url()).isEqualTo("https://naif.jpl.nasa.gov/pub/naif/toolkit_docs/C/cspice/spkezr_c.html");
            assertThat(hit.hasDistinctUrl()).isTrue();
        }

        @Test
        @DisplayName("Should give title-only matches a snippet from the text")
        void shouldSnippetTitleOnlyMatches() throws IOException, ParseException {
            final SearchHit hit = strategy.search(index(true), "title:spkezr_c", 10).get(0);

            assertThat(hit.snippet()).startsWith("Return the state").doesNotContain("<mark>");
        }

        @Test
        @DisplayName("Should reject malformed queries")
        void shouldRejectMalformedQueries() throws IOException {
            final IndexSearcher searcher = index(true);

            assertThatThrownBy(() -> strategy.search(searcher, "title:(ck", 10)).isInstanceOf(ParseException.class);
        }

        @Test
        @DisplayName("Should honour the limit")
        void shouldHonourLimit() throws IOException, ParseException {
            final IndexSearcher searcher = index(true);

            assertThat(strategy.search(searcher, "reading", 1)).hasSize(1);
            assertThat(strategy.search(searcher, "reading", 0)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Substring")
    class Substring {

        private final SubstringSearchStrategy strategy = new SubstringSearchStrategy();

        @Test
        @DisplayName("Should match case-insensitively in index order")
        void shouldMatchCaseInsensitively() throws IOException {
            final List<SearchHit> hits = strategy.search(index(false), "SPACECRAFT", 10);

            assertThat(hits).extracting(SearchHit::path).containsExactly("req/spk.html", "req/ck.html");
        }

        @Test
        @DisplayName("Should treat the query as a literal string")
        void shouldMatchLiterally() throws IOException {
            final IndexSearcher searcher = index(false);

            assertThat(strategy.search(searcher, "title:ck", 10)).isEmpty();
            assertThat(strategy.search(searcher, "state of a", 10))
                    .extracting(SearchHit::path).containsExactly("cspice/spkezr_c.html");
        }

        @Test
        @DisplayName("Should match titles")
        void shouldMatchTitles() throws IOException {
            assertThat(strategy.search(index(false), "ck required", 10))
                    .extracting(SearchHit::path).containsExactly("req/ck.html");
        }

        @Test
        @DisplayName("Should honour the limit")
        void shouldHonourLimit() throws IOException {
            assertThat(strategy.search(index(false), "required reading", 1)).hasSize(1);
        }

        @Test
        @DisplayName("Snippet should start fifty characters before the match")
        void snippetShouldLeadMatch() {
            final String content = "x".repeat(100) + "needle" + "y".repeat(300);

            final String snippet = SubstringSearchStrategy.snippet(content, "needle");

            assertThat(snippet).hasSize(SubstringSearchStrategy.SNIPPET_LENGTH)
                    .startsWith("x".repeat(SubstringSearchStrategy.SNIPPET_LEAD) + "needle");
        }

        @Test
        @DisplayName("Snippet should clamp to the text boundaries")
        void snippetShouldClamp() {
            assertThat(SubstringSearchStrategy.snippet("short needle text", "needle")).isEqualTo("short needle text");
            assertThat(SubstringSearchStrategy.snippet("no match here", "needle")).isEqualTo("no match here");
        }
    }
}
