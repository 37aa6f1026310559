package de.mirkosertic.mcp.spicedocs.search;

import de.mirkosertic.mcp.spicedocs.indexer.DocumentIndexer;
import de.mirkosertic.mcp.spicedocs.util.TextCleaner;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.queryparser.classic.MultiFieldQueryParser;
import org.apache.lucene.queryparser.classic.ParseException;
import org.apache.lucene.queryparser.classic.QueryParser;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.search.uhighlight.LengthGoalBreakIterator;
import org.apache.lucene.search.uhighlight.UnifiedHighlighter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.text.BreakIterator;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * BM25-ranked search over the analyzed {@code title}, {@code content} and {@code url} fields.
 * <p>
 * Queries use the classic Lucene syntax. Bare terms are combined with AND, so {@code kernel loading}
 * only matches pages containing both words. Snippets come from the {@link UnifiedHighlighter} using the
 * offsets stored with {@code content}.
 */
public class RankedSearchStrategy implements SearchStrategy {

    private static final Logger logger = LoggerFactory.getLogger(RankedSearchStrategy.class);

    private static final String[] SEARCH_FIELDS = {
            DocumentIndexer.FIELD_TITLE,
            DocumentIndexer.FIELD_CONTENT,
            DocumentIndexer.FIELD_URL
    };

    static final int PASSAGE_LENGTH = 200;
    static final int MAX_PASSAGES = 2;
    static final int FALLBACK_SNIPPET_LENGTH = 200;

    private final Analyzer analyzer;

    public RankedSearchStrategy(final Analyzer analyzer) {
        this.analyzer = analyzer;
    }

    @Override
    public String description() {
        return "Full-text search (ranked)";
    }

    @Override
    public List<SearchHit> search(final IndexSearcher searcher, final String query, final int limit)
            throws IOException, ParseException {
        if (limit <= 0) {
            return List.of();
        }

        final MultiFieldQueryParser parser = new MultiFieldQueryParser(SEARCH_FIELDS, analyzer);
        parser.setDefaultOperator(QueryParser.Operator.AND);
        final Query parsed = parser.parse(query);

        final TopDocs topDocs = searcher.search(parsed, limit);
        logger.debug("Ranked query '{}' parsed as {} with {} hits", query, parsed, topDocs.totalHits.value);
        if (topDocs.scoreDocs.length == 0) {
            return List.of();
        }

        final UnifiedHighlighter highlighter = UnifiedHighlighter.builder(searcher, analyzer)
                .withFormatter(new SnippetFormatter())
                .withBreakIterator(() -> LengthGoalBreakIterator.createClosestToLength(
                        BreakIterator.getSentenceInstance(Locale.ROOT), PASSAGE_LENGTH, 0.5f))
                .build();
        final String[] snippets = highlighter.highlight(DocumentIndexer.FIELD_CONTENT, parsed, topDocs, MAX_PASSAGES);

        final List<SearchHit> hits = new ArrayList<>(topDocs.scoreDocs.length);
        for (int i = 0; i < topDocs.scoreDocs.length; i++) {
            final ScoreDoc scoreDoc = topDocs.scoreDocs[i];
            final Document doc = searcher.storedFields().document(scoreDoc.doc);
            final String content = doc.get(DocumentIndexer.FIELD_CONTENT);
            // Pages matched only through title or url get the start of their text
            final String snippet = snippets[i] != null
                    ? snippets[i]
                    : TextCleaner.truncate(content == null ? "" : content, FALLBACK_SNIPPET_LENGTH);
            hits.add(new SearchHit(
                    doc.get(DocumentIndexer.FIELD_PATH),
                    doc.get(DocumentIndexer.FIELD_TITLE),
                    doc.get(DocumentIndexer.FIELD_URL),
                    snippet,
                    scoreDoc.score));
        }
        return hits;
    }
}
