package de.mirkosertic.mcp.spicedocs.indexer;

import de.mirkosertic.mcp.spicedocs.ArchiveIndexService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Builds the index from the HTML files of a mirror.
 */
public class ArchiveIndexer {

    private static final Logger logger = LoggerFactory.getLogger(ArchiveIndexer.class);

    private final ArchiveIndexService indexService;
    private final DocumentIndexer documentIndexer;
    private final PageParser pageParser;

    public ArchiveIndexer(final ArchiveIndexService indexService, final DocumentIndexer documentIndexer,
                          final PageParser pageParser) {
        this.indexService = indexService;
        this.documentIndexer = documentIndexer;
        this.pageParser = pageParser;
    }

    /**
     * Build the index if it is empty, or purge and rebuild it if it was written with another schema version.
     *
     * @return number of pages indexed by this call (0 if the index was already usable)
     */
    public int ensureIndexed(final Path mirrorRoot) throws IOException {
        if (indexService.isSchemaUpgradeRequired()) {
            logger.warn("Index schema version {} differs from current version {}, rebuilding",
                    indexService.getIndexSchemaVersion(), DocumentIndexer.SCHEMA_VERSION);
            indexService.purge();
            return rebuildIndex(mirrorRoot);
        }
        if (indexService.getDocumentCount() == 0) {
            logger.info("Building search index...");
            final int indexed = rebuildIndex(mirrorRoot);
            logger.info("Search index built successfully ({} pages)", indexed);
            return indexed;
        }
        return 0;
    }

    /**
     * Index every {@code .html} file below {@code mirrorRoot}. Files that cannot be read are logged and skipped.
     * A single commit ends the run.
     */
    public int rebuildIndex(final Path mirrorRoot) throws IOException {
        final Path root = mirrorRoot.toAbsolutePath().normalize();
        final Path indexPath = indexService.getIndexPath().toAbsolutePath().normalize();
        final List<Path> htmlFiles;
        try (Stream<Path> stream = Files.walk(root)) {
            htmlFiles = stream
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".html"))
                    .filter(p -> !p.startsWith(indexPath))
                    .sorted()
                    .collect(Collectors.toList());
        }

        int indexed = 0;
        for (final Path file : htmlFiles) {
            try {
                indexFile(root, file);
                indexed++;
            } catch (final IOException | RuntimeException e) {
                logger.warn("Failed to index {}: {}", file, e.getMessage());
            }
        }
        indexService.commit();
        return indexed;
    }

    private void indexFile(final Path root, final Path file) throws IOException {
        final String relativePath = toRelativePath(root, file);
        final String html = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        final ParsedPage page = pageParser.parse(html, "",
                JsoupPageParser.fallbackTitle(file.getFileName().toString()));
        final long lastModified = Files.getLastModifiedTime(file).toMillis();

        indexService.upsert(relativePath,
                documentIndexer.createDocument(relativePath, page, lastModified, indexService.isRankedSearch()));
    }

    static String toRelativePath(final Path root, final Path file) {
        final Path relative = root.relativize(file);
        final StringBuilder result = new StringBuilder();
        for (final Path segment : relative) {
            if (result.length() > 0) {
                result.append('/');
            }
            result.append(segment);
        }
        return result.toString();
    }
}
