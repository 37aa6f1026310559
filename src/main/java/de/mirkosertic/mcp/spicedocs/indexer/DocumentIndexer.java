package de.mirkosertic.mcp.spicedocs.indexer;

import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.FieldType;
import org.apache.lucene.document.SortedDocValuesField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.IndexOptions;
import org.apache.lucene.util.BytesRef;

/**
 * Creates Lucene documents for mirrored pages with a consistent field schema.
 * <p>
 * Every document stores {@code path}, {@code title}, {@code content}, {@code url} and {@code last_modified}.
 * When ranked search is active, {@code title}, {@code content} and {@code url} are also analyzed, and
 * {@code content} carries offsets so the highlighter can cut snippets without re-analysing the text.
 */
public class DocumentIndexer {

    /**
     * Schema version for the index.
     * MUST be incremented whenever fields are added, removed or indexed differently.
     */
    public static final int SCHEMA_VERSION = 1;

    public static final String FIELD_PATH = "path";
    public static final String FIELD_TITLE = "title";
    public static final String FIELD_CONTENT = "content";
    public static final String FIELD_URL = "url";
    public static final String FIELD_LAST_MODIFIED = "last_modified";

    private static final FieldType CONTENT_WITH_OFFSETS = createContentFieldType();

    private static FieldType createContentFieldType() {
        final FieldType type = new FieldType(TextField.TYPE_STORED);
        type.setIndexOptions(IndexOptions.DOCS_AND_FREQS_AND_POSITIONS_AND_OFFSETS);
        type.freeze();
        return type;
    }

    /**
     * @param relativePath  path below the mirror root with {@code /} separators
     * @param page          parsed page
     * @param lastModified  file modification time in epoch millis
     * @param ranked        whether the analyzed fields are written
     */
    public Document createDocument(final String relativePath, final ParsedPage page, final long lastModified,
                                   final boolean ranked) {
        final Document doc = new Document();

        // path - unique key (not analyzed, stored, sortable)
        doc.add(new StringField(FIELD_PATH, relativePath, Field.Store.YES));
        doc.add(new SortedDocValuesField(FIELD_PATH, new BytesRef(relativePath)));

        final String url = page.canonicalUrl() != null ? page.canonicalUrl() : relativePath;
        final String content = page.text() != null ? page.text() : "";

        if (ranked) {
            doc.add(new TextField(FIELD_TITLE, page.title(), Field.Store.YES));
            doc.add(new Field(FIELD_CONTENT, content, CONTENT_WITH_OFFSETS));
            doc.add(new TextField(FIELD_URL, url, Field.Store.YES));
        } else {
            doc.add(new StoredField(FIELD_TITLE, page.title()));
            doc.add(new StoredField(FIELD_CONTENT, content));
            doc.add(new StoredField(FIELD_URL, url));
        }

        doc.add(new StoredField(FIELD_LAST_MODIFIED, lastModified));
        return doc;
    }
}
