package de.mirkosertic.mcp.spicedocs.cache;

import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import de.mirkosertic.mcp.spicedocs.config.ApplicationConfig;
import de.mirkosertic.mcp.spicedocs.crawler.PreconditionFailedException;
import de.mirkosertic.mcp.spicedocs.crawler.ScopedCrawler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;

/**
 * Hands out a usable mirror, downloading it first when the cache is missing or incomplete.
 * <p>
 * When locking is enabled the validate-crawl-publish sequence runs under an exclusive lock on a file next to
 * the cache directory, so concurrent server processes do not crawl the same tree twice.
 */
public class CacheOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(CacheOrchestrator.class);

    static final String WRITE_PROBE = ".write_test";
    static final String LOCK_FILE = ".spicedocs.lock";

    private final ApplicationConfig config;
    private final CacheValidator validator;
    private final ScopedCrawler crawler;

    public CacheOrchestrator(final ApplicationConfig config, final CacheValidator validator,
                             final ScopedCrawler crawler) {
        this.config = config;
        this.validator = validator;
        this.crawler = crawler;
    }

    /**
     * @return the mirror root ({@code <cacheDirectory>/<host segment>})
     * @throws PreconditionFailedException if the cache is not writable or downloads are disabled
     * @throws IOException                 if the crawl fails
     */
    public Path getOrRefresh(final Path cacheDirectory) throws IOException {
        if (validator.isValid(cacheDirectory)) {
            logger.debug("Using existing documentation cache");
            return mirrorRoot(cacheDirectory);
        }

        logger.info("Documentation cache not found or invalid: {}", cacheDirectory);
        ensureWritable(cacheDirectory);

        if (config.isSkipDownload()) {
            throw new PreconditionFailedException("Cache invalid and download skipped ("
                    + ApplicationConfig.ENV_SKIP_DOWNLOAD + "=true): " + cacheDirectory);
        }

        final Path parent = cacheDirectory.toAbsolutePath().normalize().getParent();
        if (!config.isLockEnabled() || parent == null) {
            crawler.crawl(config.getBaseUrl(), cacheDirectory);
            return mirrorRoot(cacheDirectory);
        }

        final Path lockFile = parent.resolve(LOCK_FILE);
        try (FileChannel channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
             FileLock ignored = channel.lock()) {
            // Another process may have published a mirror while this one waited for the lock
            if (validator.isValid(cacheDirectory)) {
                logger.info("Documentation cache was published by another process");
                return mirrorRoot(cacheDirectory);
            }
            // Holding the lock means no other crawl is running, so every leftover is stale
            crawler.removeStaleDownloads(parent, Duration.ZERO);
            crawler.crawl(config.getBaseUrl(), cacheDirectory);
        }
        return mirrorRoot(cacheDirectory);
    }

    /**
     * Delete the cache and download it again.
     */
    public Path refresh(final Path cacheDirectory) throws IOException {
        if (Files.exists(cacheDirectory)) {
            logger.info("Removing existing cache at: {}", cacheDirectory);
            MoreFiles.deleteRecursively(cacheDirectory, RecursiveDeleteOption.ALLOW_INSECURE);
        }
        return getOrRefresh(cacheDirectory);
    }

    public Path mirrorRoot(final Path cacheDirectory) {
        return cacheDirectory.resolve(config.getHostSegment());
    }

    private void ensureWritable(final Path cacheDirectory) throws PreconditionFailedException {
        try {
            Files.createDirectories(cacheDirectory);
            final Path probe = cacheDirectory.resolve(WRITE_PROBE);
            Files.deleteIfExists(probe);
            Files.createFile(probe);
            Files.delete(probe);
        } catch (final IOException e) {
            throw new PreconditionFailedException("No write permission for cache directory: " + cacheDirectory, e);
        }
    }
}
