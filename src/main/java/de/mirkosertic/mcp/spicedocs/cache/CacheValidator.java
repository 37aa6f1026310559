package de.mirkosertic.mcp.spicedocs.cache;

import de.mirkosertic.mcp.spicedocs.config.ApplicationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

/**
 * Decides whether a cache directory holds a usable mirror. Never throws and never modifies the cache.
 */
public class CacheValidator {

    private static final Logger logger = LoggerFactory.getLogger(CacheValidator.class);

    private final String hostSegment;
    private final int minFileCount;

    public CacheValidator(final ApplicationConfig config) {
        this(config.getHostSegment(), config.getMinFileCount());
    }

    public CacheValidator(final String hostSegment, final int minFileCount) {
        this.hostSegment = hostSegment;
        this.minFileCount = minFileCount;
    }

    /**
     * Checks, in order: manifest present and parsable, manifest marked completed,
     * host directory present, enough HTML files under it.
     */
    public boolean isValid(final Path cacheDirectory) {
        final Path manifestFile = cacheDirectory.resolve(CacheManifest.FILE_NAME);
        if (!Files.isRegularFile(manifestFile)) {
            logger.debug("Cache version file not found: {}", manifestFile);
            return false;
        }

        final CacheManifest manifest;
        try {
            manifest = CacheManifest.read(manifestFile);
        } catch (final IOException e) {
            logger.debug("Failed to read cache version file {}: {}", manifestFile, e.getMessage());
            return false;
        }
        if (!manifest.completed()) {
            logger.debug("Cache download not completed");
            return false;
        }

        final Path mirrorRoot = cacheDirectory.resolve(hostSegment);
        if (!Files.isDirectory(mirrorRoot)) {
            logger.debug("Documentation directory not found: {}", mirrorRoot);
            return false;
        }

        final long htmlCount;
        try {
            htmlCount = countHtmlFiles(mirrorRoot);
        } catch (final IOException | UncheckedIOException e) {
            logger.debug("Failed to scan documentation directory {}: {}", mirrorRoot, e.getMessage());
            return false;
        }
        if (htmlCount < minFileCount) {
            logger.debug("Insufficient HTML files: {} < {}", htmlCount, minFileCount);
            return false;
        }

        logger.debug("Cache is valid with {} HTML files", htmlCount);
        return true;
    }

    static long countHtmlFiles(final Path root) throws IOException {
        try (Stream<Path> files = Files.walk(root)) {
            return files.filter(Files::isRegularFile)
                    .filter(file -> file.getFileName().toString().endsWith(".html"))
                    .count();
        }
    }
}
