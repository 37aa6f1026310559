package de.mirkosertic.mcp.spicedocs.search;

import de.mirkosertic.mcp.spicedocs.indexer.DocumentIndexer;
import org.apache.lucene.document.Document;
import org.apache.lucene.index.IndexReader;
import org.apache.lucene.index.LeafReaderContext;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.util.Bits;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static com.google.common.base.Strings.nullToEmpty;

/**
 * Case-insensitive containment search over the stored {@code title} and {@code content}, used when the
 * index has no analyzed fields. Hits come in index order.
 */
public class SubstringSearchStrategy implements SearchStrategy {

    static final int SNIPPET_LEAD = 50;
    static final int SNIPPET_LENGTH = 150;

    @Override
    public String description() {
        return "Basic search";
    }

    @Override
    public List<SearchHit> search(final IndexSearcher searcher, final String query, final int limit)
            throws IOException {
        final List<SearchHit> hits = new ArrayList<>();
        if (limit <= 0) {
            return hits;
        }
        final String needle = query.toLowerCase(Locale.ROOT);

        final IndexReader reader = searcher.getIndexReader();
        for (final LeafReaderContext leaf : reader.leaves()) {
            final Bits liveDocs = leaf.reader().getLiveDocs();
            final StoredFields storedFields = leaf.reader().storedFields();
            for (int docId = 0; docId < leaf.reader().maxDoc(); docId++) {
                if (liveDocs != null && !liveDocs.get(docId)) {
                    continue;
                }
                final Document doc = storedFields.document(docId);
                final String title = nullToEmpty(doc.get(DocumentIndexer.FIELD_TITLE));
                final String content = nullToEmpty(doc.get(DocumentIndexer.FIELD_CONTENT));
                if (!title.toLowerCase(Locale.ROOT).contains(needle)
                        && !content.toLowerCase(Locale.ROOT).contains(needle)) {
                    continue;
                }
                hits.add(new SearchHit(
                        doc.get(DocumentIndexer.FIELD_PATH),
                        title,
                        doc.get(DocumentIndexer.FIELD_URL),
                        snippet(content, needle),
                        0f));
                if (hits.size() >= limit) {
                    return hits;
                }
            }
        }
        return hits;
    }

    /**
     * Up to {@value #SNIPPET_LENGTH} characters of {@code content} starting {@value #SNIPPET_LEAD} characters
     * before the first match; the start of the text when only the title matched.
     */
    static String snippet(final String content, final String lowerCaseNeedle) {
        final int matchAt = content.toLowerCase(Locale.ROOT).indexOf(lowerCaseNeedle);
        // Lower-casing may change the length for a few code points, so clamp to the original text
        final int start = Math.min(content.length(), matchAt < 0 ? 0 : Math.max(0, matchAt - SNIPPET_LEAD));
        final int end = Math.min(content.length(), start + SNIPPET_LENGTH);
        return content.substring(start, end);
    }
}
