package de.mirkosertic.mcp.spicedocs.crawler;

import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import de.mirkosertic.mcp.spicedocs.cache.CacheManifest;
import de.mirkosertic.mcp.spicedocs.config.ApplicationConfig;
import de.mirkosertic.mcp.spicedocs.indexer.PageLink;
import de.mirkosertic.mcp.spicedocs.indexer.PageParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Mirrors one documentation tree by breadth-first traversal.
 * <p>
 * Pages are written into a fresh temporary directory next to the cache directory. Only after the whole
 * tree was fetched is the manifest written and the temporary directory moved onto the cache directory,
 * so readers either see the previous mirror or the complete new one. Any failure removes the temporary
 * directory before the exception propagates.
 */
public class ScopedCrawler {

    private static final Logger logger = LoggerFactory.getLogger(ScopedCrawler.class);

    static final String DOWNLOAD_PREFIX = ".spicedocs-download-";
    static final String PREVIOUS_PREFIX = ".spicedocs-previous-";

    private final ApplicationConfig config;
    private final RetryingPageFetcher fetcher;
    private final PageParser pageParser;
    private final Clock clock;

    public ScopedCrawler(final ApplicationConfig config, final RetryingPageFetcher fetcher,
                         final PageParser pageParser, final Clock clock) {
        this.config = config;
        this.fetcher = fetcher;
        this.pageParser = pageParser;
        this.clock = clock;
    }

    /**
     * Crawl {@code baseUrl} and publish the result as {@code cacheDirectory}.
     *
     * @return the manifest written with the published mirror
     * @throws PreconditionFailedException if there is not enough free disk space
     * @throws IOException                 on non-retryable HTTP failures, exhausted retries or local I/O errors
     */
    public CacheManifest crawl(final String baseUrl, final Path cacheDirectory) throws IOException {
        final Path destination = cacheDirectory.toAbsolutePath().normalize();
        final Path parent = destination.getParent();
        if (parent == null) {
            throw new PreconditionFailedException("Cache directory must not be a file system root: " + destination);
        }
        Files.createDirectories(parent);

        removeStaleDownloads(parent, Duration.ofMillis(config.getStaleDownloadMaxAgeMs()));
        ensureFreeSpace(parent);

        logger.info("Downloading documentation from {}", baseUrl);
        logger.info("Cache directory: {}", destination);

        final Path tempDir = Files.createTempDirectory(parent, DOWNLOAD_PREFIX);
        try {
            final int fileCount = traverse(baseUrl, tempDir.resolve(config.getHostSegment()));
            logger.info("Downloaded {} files successfully", fileCount);

            final CacheManifest manifest = CacheManifest.completed(baseUrl, fileCount, clock);
            manifest.write(tempDir.resolve(CacheManifest.FILE_NAME));

            publish(tempDir, destination);
            logger.info("Documentation cached successfully at {}", destination);
            return manifest;

        } catch (final IOException | RuntimeException e) {
            logger.error("Crawl of {} failed, discarding partial download {}", baseUrl, tempDir);
            deleteAfterFailure(tempDir, e);
            throw e;
        }
    }

    private int traverse(final String baseUrl, final Path mirrorRoot) throws IOException {
        final UrlScope scope = new UrlScope(baseUrl, config.getPathPrefix());
        final Set<String> visited = new HashSet<>();
        final Set<Path> written = new HashSet<>();
        final Deque<String> queue = new ArrayDeque<>();
        queue.add(baseUrl);

        final int progressInterval = Math.max(1, config.getProgressLogInterval());

        while (!queue.isEmpty()) {
            final String url = queue.poll();

            if (!visited.add(UrlScope.visitKey(url))) {
                continue;
            }
            if (!scope.shouldDownload(url)) {
                continue;
            }

            final FetchedPage page;
            try {
                page = fetcher.fetch(url);
            } catch (final FetchStatusException e) {
                if (e.isNotFound()) {
                    continue;
                }
                throw e;
            }

            final Path target = mirrorRoot.resolve(UrlScope.relativeFilePath(url)).normalize();
            if (!target.startsWith(mirrorRoot)) {
                logger.warn("Skipping {}: resolves outside the mirror", url);
                continue;
            }
            Files.createDirectories(target.getParent());
            Files.write(target, page.body());

            // A directory URL and its index.html land in the same file
            if (written.add(target) && written.size() % progressInterval == 0) {
                logger.info("Downloaded {} files...", written.size());
            }

            enqueueLinks(url, page, scope, visited, queue);
        }
        return written.size();
    }

    private void enqueueLinks(final String url, final FetchedPage page, final UrlScope scope,
                              final Set<String> visited, final Deque<String> queue) {
        try {
            final String html = new String(page.body(), StandardCharsets.UTF_8);
            for (final PageLink link : pageParser.parse(html, url, "").links()) {
                if (link.absoluteHref().isEmpty()) {
                    continue;
                }
                final String candidate = UrlScope.stripFragment(link.absoluteHref());
                if (scope.shouldDownload(candidate) && !visited.contains(UrlScope.visitKey(candidate))) {
                    queue.add(candidate);
                }
            }
        } catch (final RuntimeException e) {
            logger.warn("Failed to parse links from {}: {}", url, e.getMessage());
        }
    }

    /**
     * Replace {@code destination} with {@code source}. The previous tree is first renamed aside so that the
     * final step is a single atomic rename; if that rename fails the previous tree is put back.
     */
    void publish(final Path source, final Path destination) throws IOException {
        Path previous = null;
        if (Files.exists(destination)) {
            previous = destination.resolveSibling(PREVIOUS_PREFIX + UUID.randomUUID());
            Files.move(destination, previous, StandardCopyOption.ATOMIC_MOVE);
        }

        try {
            Files.move(source, destination, StandardCopyOption.ATOMIC_MOVE);
        } catch (final IOException e) {
            if (previous != null) {
                try {
                    Files.move(previous, destination, StandardCopyOption.ATOMIC_MOVE);
                } catch (final IOException restoreFailure) {
                    e.addSuppressed(restoreFailure);
                }
            }
            throw e;
        }

        if (previous != null) {
            try {
                MoreFiles.deleteRecursively(previous, RecursiveDeleteOption.ALLOW_INSECURE);
            } catch (final IOException e) {
                // The new mirror is live; the leftover is removed by the next stale-download sweep
                logger.warn("Failed to remove previous mirror {}: {}", previous, e.getMessage());
            }
        }
    }

    /**
     * Delete temporary directories left behind by crawls that were killed, if they are older than {@code minAge}.
     */
    public void removeStaleDownloads(final Path parent, final Duration minAge) throws IOException {
        if (!Files.isDirectory(parent)) {
            return;
        }
        final Instant cutoff = clock.instant().minus(minAge);
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(parent,
                entry -> isCrawlerLeftover(entry.getFileName().toString()))) {
            for (final Path entry : entries) {
                if (!minAge.isZero() && !Files.getLastModifiedTime(entry).toInstant().isBefore(cutoff)) {
                    continue;
                }
                logger.warn("Removing incomplete download: {}", entry);
                MoreFiles.deleteRecursively(entry, RecursiveDeleteOption.ALLOW_INSECURE);
            }
        }
    }

    private static boolean isCrawlerLeftover(final String name) {
        return name.startsWith(DOWNLOAD_PREFIX) || name.startsWith(PREVIOUS_PREFIX);
    }

    private void ensureFreeSpace(final Path directory) throws IOException {
        final long usableBytes = Files.getFileStore(directory).getUsableSpace();
        final long usableMb = usableBytes / (1024 * 1024);
        if (usableMb < config.getMinFreeSpaceMb()) {
            throw new PreconditionFailedException(String.format(
                    "Insufficient disk space: %d MB available, %d MB required", usableMb, config.getMinFreeSpaceMb()));
        }
    }

    private static void deleteAfterFailure(final Path tempDir, final Exception failure) {
        if (!Files.exists(tempDir)) {
            return;
        }
        try {
            MoreFiles.deleteRecursively(tempDir, RecursiveDeleteOption.ALLOW_INSECURE);
        } catch (final IOException cleanupFailure) {
            failure.addSuppressed(cleanupFailure);
        }
    }
}
