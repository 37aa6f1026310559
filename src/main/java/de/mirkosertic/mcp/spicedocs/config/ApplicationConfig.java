package de.mirkosertic.mcp.spicedocs.config;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;

/**
 * Central configuration for the SpiceDocs MCP Server.
 * Loads configuration from YAML files and environment variables.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. System properties
 * 2. Environment variables
 * 3. User config file (~/.spicedocs/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    public static final String ENV_CACHE_DIR = "SPICEDOCS_CACHE_DIR";
    public static final String ENV_BASE_URL = "SPICEDOCS_BASE_URL";
    public static final String ENV_SKIP_DOWNLOAD = "SPICEDOCS_SKIP_DOWNLOAD";
    public static final String ENV_INDEX_PATH = "SPICEDOCS_INDEX_PATH";

    private static final String PROP_CACHE_DIR = "spicedocs.cache.dir";
    private static final String PROP_INDEX_PATH = "spicedocs.index.path";
    private static final String CONFIG_DIR = ".spicedocs";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";
    private static final String APP_NAME = "spicedocs-mcp";
    private static final String INDEX_DIR_NAME = ".archive_index";

    private final Map<String, String> environment;

    // Cache settings
    private String cacheDir = "";
    private String hostSegment = "naif.jpl.nasa.gov";
    private int minFileCount = 500;
    private boolean skipDownload = false;
    private boolean lockEnabled = true;
    private long staleDownloadMaxAgeMs = 24L * 60 * 60 * 1000;

    // Crawler settings
    private String baseUrl = "https://naif.jpl.nasa.gov/pub/naif/toolkit_docs/C/";
    private String pathPrefix = "/pub/naif/toolkit_docs/C/";
    private String userAgent = "SpiceDocs-MCP/0.1.0";
    private int maxAttempts = 3;
    private long backoffBaseMs = 1000;
    private int timeoutMs = 30000;
    private long minFreeSpaceMb = 100;
    private int progressLogInterval = 50;

    // Index settings
    private String indexPath = "";
    private boolean rankedSearch = true;

    // Profile settings

    private ApplicationConfig(final Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        return load(System.getenv());
    }

    /**
     * Load configuration using the given environment instead of the process environment.
     */
    public static ApplicationConfig load(final Map<String, String> environment) {
        final ApplicationConfig config = new ApplicationConfig(environment);

        config.loadFromClasspath();
        config.loadFromUserConfig();
        config.applyEnvironmentOverrides();

        logger.info("Configuration loaded: cacheDir={}, baseUrl={}, skipDownload={}, rankedSearch={}",
                config.getCacheDirectory(), config.baseUrl, config.skipDownload, config.rankedSearch);

        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
                }
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromUserConfig() {
        final Path userConfigPath = getUserConfigPath();
        if (Files.exists(userConfigPath)) {
            try (final InputStream is = Files.newInputStream(userConfigPath)) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded user config from: {}", userConfigPath);
                }
            } catch (final IOException e) {
                logger.warn("Failed to load user config from: {}", userConfigPath, e);
            }
        }
    }

    @SuppressWarnings("unchecked")
    void applyYamlConfig(final Map<String, Object> config) {
        final Map<String, Object> root = (Map<String, Object>) config.get("spicedocs");
        if (root == null) {
            return;
        }

        final Map<String, Object> cacheConfig = (Map<String, Object>) root.get("cache");
        if (cacheConfig != null) {
            applyCacheConfig(cacheConfig);
        }

        final Map<String, Object> crawlerConfig = (Map<String, Object>) root.get("crawler");
        if (crawlerConfig != null) {
            applyCrawlerConfig(crawlerConfig);
        }

        final Map<String, Object> indexConfig = (Map<String, Object>) root.get("index");
        if (indexConfig != null) {
            if (indexConfig.containsKey("path")) {
                this.indexPath = stringValue(indexConfig.get("path"));
            }
            if (indexConfig.containsKey("ranked-search")) {
                this.rankedSearch = (Boolean) indexConfig.get("ranked-search");
            }
        }
    }

    private void applyCacheConfig(final Map<String, Object> cacheConfig) {
        if (cacheConfig.containsKey("dir")) {
            this.cacheDir = stringValue(cacheConfig.get("dir"));
        }
        if (cacheConfig.containsKey("host-segment")) {
            this.hostSegment = stringValue(cacheConfig.get("host-segment"));
        }
        if (cacheConfig.containsKey("min-file-count")) {
            this.minFileCount = ((Number) cacheConfig.get("min-file-count")).intValue();
        }
        if (cacheConfig.containsKey("skip-download")) {
            this.skipDownload = (Boolean) cacheConfig.get("skip-download");
        }
        if (cacheConfig.containsKey("lock-enabled")) {
            this.lockEnabled = (Boolean) cacheConfig.get("lock-enabled");
        }
        if (cacheConfig.containsKey("stale-download-max-age-ms")) {
            this.staleDownloadMaxAgeMs = ((Number) cacheConfig.get("stale-download-max-age-ms")).longValue();
        }
    }

    private void applyCrawlerConfig(final Map<String, Object> crawlerConfig) {
        if (crawlerConfig.containsKey("base-url")) {
            this.baseUrl = stringValue(crawlerConfig.get("base-url"));
        }
        if (crawlerConfig.containsKey("path-prefix")) {
            this.pathPrefix = stringValue(crawlerConfig.get("path-prefix"));
        }
        if (crawlerConfig.containsKey("user-agent")) {
            this.userAgent = stringValue(crawlerConfig.get("user-agent"));
        }
        if (crawlerConfig.containsKey("max-attempts")) {
            this.maxAttempts = ((Number) crawlerConfig.get("max-attempts")).intValue();
        }
        if (crawlerConfig.containsKey("backoff-base-ms")) {
            this.backoffBaseMs = ((Number) crawlerConfig.get("backoff-base-ms")).longValue();
        }
        if (crawlerConfig.containsKey("timeout-ms")) {
            this.timeoutMs = ((Number) crawlerConfig.get("timeout-ms")).intValue();
        }
        if (crawlerConfig.containsKey("min-free-space-mb")) {
            this.minFreeSpaceMb = ((Number) crawlerConfig.get("min-free-space-mb")).longValue();
        }
        if (crawlerConfig.containsKey("progress-log-interval")) {
            this.progressLogInterval = ((Number) crawlerConfig.get("progress-log-interval")).intValue();
        }
    }

    private String stringValue(final Object value) {
        return value == null ? "" : resolveVariables(value.toString()).trim();
    }

    private void applyEnvironmentOverrides() {
        final String envCacheDir = environment.get(ENV_CACHE_DIR);
        if (envCacheDir != null && !envCacheDir.trim().isEmpty()) {
            this.cacheDir = envCacheDir.trim();
            logger.info("Cache directory from environment: {}", this.cacheDir);
        }

        final String envBaseUrl = environment.get(ENV_BASE_URL);
        if (envBaseUrl != null && !envBaseUrl.trim().isEmpty()) {
            this.baseUrl = envBaseUrl.trim();
            logger.info("Documentation base URL from environment: {}", this.baseUrl);
        }

        final String envSkip = environment.get(ENV_SKIP_DOWNLOAD);
        if (envSkip != null && !envSkip.trim().isEmpty()) {
            this.skipDownload = "true".equals(envSkip.trim().toLowerCase(Locale.ROOT));
        }

        final String envIndexPath = environment.get(ENV_INDEX_PATH);
        if (envIndexPath != null && !envIndexPath.trim().isEmpty()) {
            this.indexPath = envIndexPath.trim();
        }

        final String propCacheDir = System.getProperty(PROP_CACHE_DIR);
        if (propCacheDir != null && !propCacheDir.isEmpty()) {
            this.cacheDir = propCacheDir;
        }

        final String propIndexPath = System.getProperty(PROP_INDEX_PATH);
        if (propIndexPath != null && !propIndexPath.isEmpty()) {
            this.indexPath = propIndexPath;
        }
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    private String resolveVariables(final String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }

        String result = value;
        int start;
        while ((start = result.indexOf("${")) >= 0) {
            final int end = result.indexOf("}", start);
            if (end < 0) {
                break;
            }

            final String varExpr = result.substring(start + 2, end);
            final String[] parts = varExpr.split(":", 2);
            final String varName = parts[0];
            final String defaultValue = parts.length > 1 ? parts[1] : "";

            // Check environment first, then system properties
            String replacement = environment.get(varName);
            if (replacement == null || replacement.isEmpty()) {
                replacement = System.getProperty(varName, defaultValue);
            }

            if (replacement.contains("${")) {
                replacement = resolveVariables(replacement);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    /**
     * Platform cache directory, following the usual conventions:
     * Linux {@code $XDG_CACHE_HOME/spicedocs-mcp} (or {@code ~/.cache/spicedocs-mcp}),
     * macOS {@code ~/Library/Caches/spicedocs-mcp},
     * Windows {@code %LOCALAPPDATA%\spicedocs\spicedocs-mcp\Cache}.
     */
    Path defaultCacheDirectory() {
        final String home = System.getProperty("user.home");
        final String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);

        if (os.contains("win")) {
            final String localAppData = environment.get("LOCALAPPDATA");
            final Path base = localAppData != null && !localAppData.isEmpty()
                    ? Paths.get(localAppData)
                    : Paths.get(home, "AppData", "Local");
            return base.resolve("spicedocs").resolve(APP_NAME).resolve("Cache");
        }
        if (os.contains("mac")) {
            return Paths.get(home, "Library", "Caches", APP_NAME);
        }
        final String xdgCache = environment.get("XDG_CACHE_HOME");
        if (xdgCache != null && !xdgCache.isEmpty()) {
            return Paths.get(xdgCache, APP_NAME);
        }
        return Paths.get(home, ".cache", APP_NAME);
    }

    public static Path getUserConfigPath() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR, USER_CONFIG_FILE);
    }

    public static Path getConfigDirectory() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR);
    }

    /**
     * Directory holding the manifest and the mirrored host segment.
     */
    public Path getCacheDirectory() {
        if (cacheDir == null || cacheDir.isEmpty()) {
            return defaultCacheDirectory();
        }
        return Paths.get(cacheDir);
    }

    /**
     * Location of the Lucene index for the given archive.
     *
     * @param archiveRoot   the mirror root being served
     * @param fromCache     true if the archive is the mirror inside the cache directory
     */
    public Path resolveIndexPath(final Path archiveRoot, final boolean fromCache) {
        if (indexPath != null && !indexPath.isEmpty()) {
            return Paths.get(indexPath);
        }
        if (fromCache) {
            return getCacheDirectory().resolve(INDEX_DIR_NAME);
        }
        return archiveRoot.resolve(INDEX_DIR_NAME);
    }

    @Nullable
    public String getConfiguredIndexPath() {
        return indexPath == null || indexPath.isEmpty() ? null : indexPath;
    }

    // Getters
    public String getHostSegment() {
        return hostSegment;
    }

    public int getMinFileCount() {
        return minFileCount;
    }

    public boolean isSkipDownload() {
        return skipDownload;
    }

    public boolean isLockEnabled() {
        return lockEnabled;
    }

    public long getStaleDownloadMaxAgeMs() {
        return staleDownloadMaxAgeMs;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public String getPathPrefix() {
        return pathPrefix;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getBackoffBaseMs() {
        return backoffBaseMs;
    }

    public int getTimeoutMs() {
        return timeoutMs;
    }

    public long getMinFreeSpaceMb() {
        return minFreeSpaceMb;
    }

    public int getProgressLogInterval() {
        return progressLogInterval;
    }

    public boolean isRankedSearch() {
        return rankedSearch;
    }
}
