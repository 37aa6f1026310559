package de.mirkosertic.mcp.spicedocs.indexer;

import org.apache.lucene.document.Document;
import org.apache.lucene.index.IndexableField;

import static com.google.common.base.Strings.nullToEmpty;

/**
 * Stored fields of one indexed page.
 */
public record DocumentRecord(String path, String title, String content, String url, long lastModified) {

    public static DocumentRecord fromDocument(final Document doc) {
        final IndexableField modified = doc.getField(DocumentIndexer.FIELD_LAST_MODIFIED);
        return new DocumentRecord(
                doc.get(DocumentIndexer.FIELD_PATH),
                nullToEmpty(doc.get(DocumentIndexer.FIELD_TITLE)),
                nullToEmpty(doc.get(DocumentIndexer.FIELD_CONTENT)),
                nullToEmpty(doc.get(DocumentIndexer.FIELD_URL)),
                modified != null && modified.numericValue() != null ? modified.numericValue().longValue() : 0L);
    }

    /**
     * True when the original URL differs from the path and is worth showing.
     */
    public boolean hasDistinctUrl() {
        return !url.isEmpty() && !url.equals(path);
    }
}
