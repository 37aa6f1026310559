package de.mirkosertic.mcp.spicedocs.crawler;

import java.io.IOException;

/**
 * Performs a single HTTP GET. Non-2xx statuses are returned, not thrown; network failures are thrown.
 */
@FunctionalInterface
public interface PageFetcher {

    FetchedPage fetch(String url) throws IOException;
}
