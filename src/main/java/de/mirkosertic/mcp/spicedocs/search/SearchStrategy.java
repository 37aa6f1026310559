package de.mirkosertic.mcp.spicedocs.search;

import org.apache.lucene.queryparser.classic.ParseException;
import org.apache.lucene.search.IndexSearcher;

import java.io.IOException;
import java.util.List;

/**
 * How {@code search_archive} matches pages. Chosen once when the index is opened.
 */
public interface SearchStrategy {

    /**
     * Human-readable name reported in the archive statistics.
     */
    String description();

    /**
     * @param searcher searcher acquired by the caller, released by the caller
     * @param query    raw user query
     * @param limit    maximum number of hits
     * @throws ParseException if the query cannot be parsed by this strategy
     */
    List<SearchHit> search(IndexSearcher searcher, String query, int limit) throws IOException, ParseException;
}
