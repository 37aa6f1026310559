package de.mirkosertic.mcp.spicedocs;

import de.mirkosertic.mcp.spicedocs.config.ApplicationConfig;
import de.mirkosertic.mcp.spicedocs.indexer.ArchiveIndexer;
import de.mirkosertic.mcp.spicedocs.indexer.DocumentIndexer;
import de.mirkosertic.mcp.spicedocs.indexer.JsoupPageParser;
import de.mirkosertic.mcp.spicedocs.indexer.PageParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Everything a running server needs, created once at startup and passed explicitly.
 */
public record ServerContext(
        ApplicationConfig config,
        Path archiveRoot,
        ArchiveIndexService indexService,
        ArchiveQueryService queryService,
        ArchiveTools tools
) implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(ServerContext.class);

    /**
     * Open the index for {@code archiveRoot}, building it first if needed.
     *
     * @param fromCache true if the archive is the mirror inside the cache directory
     */
    public static ServerContext open(final ApplicationConfig config, final Path archiveRoot, final boolean fromCache)
            throws IOException {
        final Path indexPath = config.resolveIndexPath(archiveRoot, fromCache);
        logger.info("Index path: {}", indexPath);

        final ArchiveIndexService indexService = new ArchiveIndexService(indexPath, config.isRankedSearch());
        indexService.init();

        final PageParser pageParser = new JsoupPageParser();
        try {
            new ArchiveIndexer(indexService, new DocumentIndexer(), pageParser).ensureIndexed(archiveRoot);
        } catch (final IOException | RuntimeException e) {
            try {
                indexService.close();
            } catch (final IOException closeError) {
                e.addSuppressed(closeError);
            }
            throw e;
        }

        final ArchiveQueryService queryService = new ArchiveQueryService(indexService, archiveRoot, pageParser);
        return new ServerContext(config, archiveRoot, indexService, queryService, new ArchiveTools(queryService));
    }

    @Override
    public void close() throws IOException {
        indexService.close();
    }
}
