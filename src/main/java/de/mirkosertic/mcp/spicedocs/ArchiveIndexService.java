package de.mirkosertic.mcp.spicedocs;

import de.mirkosertic.mcp.spicedocs.config.BuildInfo;
import de.mirkosertic.mcp.spicedocs.indexer.DocumentIndexer;
import de.mirkosertic.mcp.spicedocs.indexer.DocumentRecord;
import de.mirkosertic.mcp.spicedocs.search.RankedSearchStrategy;
import de.mirkosertic.mcp.spicedocs.search.SearchHit;
import de.mirkosertic.mcp.spicedocs.search.SearchStrategy;
import de.mirkosertic.mcp.spicedocs.search.SubstringSearchStrategy;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.SegmentInfos;
import org.apache.lucene.index.Term;
import org.apache.lucene.queryparser.classic.ParseException;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.MatchAllDocsQuery;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.Sort;
import org.apache.lucene.search.SortField;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Owns the Lucene index holding one record per mirrored page.
 * <p>
 * All read operations acquire their own {@link IndexSearcher} from the {@link SearcherManager} and release it
 * when done, so any number of callers can read concurrently. The search strategy (ranked or substring) is
 * chosen when the index is opened: ranking requires the configuration to ask for it and the index to either
 * be empty or already carry the analyzed fields.
 */
public class ArchiveIndexService implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(ArchiveIndexService.class);

    static final String SCHEMA_VERSION_KEY = "schema_version";
    static final String RANKED_SEARCH_KEY = "ranked_search";
    static final String SOFTWARE_VERSION_KEY = "software_version";

    private final Path indexPath;
    private final boolean rankedSearchRequested;
    private final StandardAnalyzer analyzer;

    private Directory directory;
    private IndexWriter indexWriter;
    private SearcherManager searcherManager;
    private volatile SearchStrategy searchStrategy;
    private volatile boolean rankedSearch;
    private volatile int indexSchemaVersion;
    @Nullable
    private volatile String indexSoftwareVersion;
    private volatile boolean open;

    public ArchiveIndexService(final Path indexPath, final boolean rankedSearchRequested) {
        this.indexPath = indexPath;
        this.rankedSearchRequested = rankedSearchRequested;
        this.analyzer = new StandardAnalyzer();
    }

    /**
     * Open (or create) the index. Must be called before using the service.
     */
    public void init() throws IOException {
        if (!Files.exists(indexPath)) {
            Files.createDirectories(indexPath);
            logger.info("Created index directory: {}", indexPath.toAbsolutePath());
        }

        directory = FSDirectory.open(indexPath);
        final Map<String, String> userData = DirectoryReader.indexExists(directory)
                ? SegmentInfos.readLatestCommit(directory).getUserData()
                : Map.of();

        final IndexWriterConfig config = new IndexWriterConfig(analyzer);
        config.setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND);
        indexWriter = new IndexWriter(directory, config);

        final boolean empty = indexWriter.getDocStats().numDocs == 0;
        if (empty) {
            selectStrategy(rankedSearchRequested);
            // Records the chosen mode right away so a restart before the first build keeps it
            commit();
        } else {
            selectStrategy(rankedSearchRequested && Boolean.parseBoolean(userData.get(RANKED_SEARCH_KEY)));
            indexSchemaVersion = parseSchemaVersion(userData.get(SCHEMA_VERSION_KEY));
            indexSoftwareVersion = userData.get(SOFTWARE_VERSION_KEY);
            if (rankedSearchRequested && !rankedSearch) {
                logger.warn("Index at {} was built without ranked fields, using basic search", indexPath);
            }
        }

        searcherManager = new SearcherManager(indexWriter, null);
        open = true;

        logger.info("Lucene index initialized at: {} ({} documents, {})",
                indexPath.toAbsolutePath(), indexWriter.getDocStats().numDocs, searchStrategy.description());
    }

    private static int parseSchemaVersion(@Nullable final String value) {
        if (value == null) {
            return 0;
        }
        try {
            return Integer.parseInt(value);
        } catch (final NumberFormatException e) {
            return 0;
        }
    }

    private void selectStrategy(final boolean ranked) {
        this.rankedSearch = ranked;
        this.searchStrategy = ranked ? new RankedSearchStrategy(analyzer) : new SubstringSearchStrategy();
    }

    public boolean isOpen() {
        return open;
    }

    public boolean isRankedSearch() {
        return rankedSearch;
    }

    public SearchStrategy getSearchStrategy() {
        return searchStrategy;
    }

    public Path getIndexPath() {
        return indexPath;
    }

    public int getIndexSchemaVersion() {
        return indexSchemaVersion;
    }

    /**
     * Software version that last committed the index, null if unknown.
     */
    @Nullable
    public String getIndexSoftwareVersion() {
        return indexSoftwareVersion;
    }

    /**
     * True if the index holds documents written with a different field layout.
     */
    public boolean isSchemaUpgradeRequired() {
        return indexWriter.getDocStats().numDocs > 0 && indexSchemaVersion != DocumentIndexer.SCHEMA_VERSION;
    }

    /**
     * Insert or replace the record for {@code path}.
     */
    public void upsert(final String path, final Document document) throws IOException {
        indexWriter.updateDocument(new Term(DocumentIndexer.FIELD_PATH, path), document);
    }

    /**
     * Commit pending changes together with the schema metadata and make them visible to new searchers.
     */
    public void commit() throws IOException {
        final Map<String, String> commitData = new HashMap<>();
        commitData.put(SCHEMA_VERSION_KEY, String.valueOf(DocumentIndexer.SCHEMA_VERSION));
        commitData.put(RANKED_SEARCH_KEY, String.valueOf(rankedSearch));
        commitData.put(SOFTWARE_VERSION_KEY, BuildInfo.getVersion());
        indexWriter.setLiveCommitData(commitData.entrySet());
        indexWriter.commit();
        indexSchemaVersion = DocumentIndexer.SCHEMA_VERSION;
        indexSoftwareVersion = BuildInfo.getVersion();

        if (searcherManager != null) {
            searcherManager.maybeRefreshBlocking();
        }
    }

    /**
     * Delete every record. The search strategy is chosen again because the index is empty afterwards.
     */
    public void purge() throws IOException {
        logger.info("Purging index at {}", indexPath);
        indexWriter.deleteAll();
        selectStrategy(rankedSearchRequested);
        commit();
    }

    public long getDocumentCount() throws IOException {
        final IndexSearcher searcher = searcherManager.acquire();
        try {
            return searcher.getIndexReader().numDocs();
        } finally {
            searcherManager.release(searcher);
        }
    }

    public List<SearchHit> search(final String query, final int limit) throws IOException, ParseException {
        final IndexSearcher searcher = searcherManager.acquire();
        try {
            return searchStrategy.search(searcher, query, limit);
        } finally {
            searcherManager.release(searcher);
        }
    }

    /**
     * Records ordered by path.
     *
     * @param pathFilter only paths fully matching this pattern are returned; null returns all
     */
    public List<DocumentRecord> listRecords(@Nullable final Pattern pathFilter, final int limit) throws IOException {
        final List<DocumentRecord> records = new ArrayList<>();
        if (limit <= 0) {
            return records;
        }

        final IndexSearcher searcher = searcherManager.acquire();
        try {
            final int maxDoc = Math.max(1, searcher.getIndexReader().maxDoc());
            final Sort byPath = new Sort(new SortField(DocumentIndexer.FIELD_PATH, SortField.Type.STRING));
            final TopDocs topDocs = searcher.search(new MatchAllDocsQuery(), maxDoc, byPath);

            for (final ScoreDoc scoreDoc : topDocs.scoreDocs) {
                final Document doc = searcher.storedFields().document(scoreDoc.doc);
                final String path = doc.get(DocumentIndexer.FIELD_PATH);
                if (pathFilter != null && !pathFilter.matcher(path).matches()) {
                    continue;
                }
                records.add(DocumentRecord.fromDocument(doc));
                if (records.size() >= limit) {
                    break;
                }
            }
            return records;
        } finally {
            searcherManager.release(searcher);
        }
    }

    @Nullable
    public DocumentRecord findByPath(final String path) throws IOException {
        final IndexSearcher searcher = searcherManager.acquire();
        try {
            final TopDocs topDocs = searcher.search(new TermQuery(new Term(DocumentIndexer.FIELD_PATH, path)), 1);
            if (topDocs.scoreDocs.length == 0) {
                return null;
            }
            return DocumentRecord.fromDocument(searcher.storedFields().document(topDocs.scoreDocs[0].doc));
        } finally {
            searcherManager.release(searcher);
        }
    }

    @Override
    public void close() throws IOException {
        open = false;
        // Close SearcherManager before IndexWriter
        if (searcherManager != null) {
            searcherManager.close();
        }
        if (indexWriter != null) {
            indexWriter.close();
        }
        if (directory != null) {
            directory.close();
        }
        logger.info("Lucene index closed");
    }
}
