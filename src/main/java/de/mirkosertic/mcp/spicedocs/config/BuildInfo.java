package de.mirkosertic.mcp.spicedocs.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Version and build timestamp from the Maven-filtered build-info.properties.
 * Falls back to "dev"/"unknown" when the file is missing or still unfiltered (IDE runs).
 */
public final class BuildInfo {

    private static final Logger logger = LoggerFactory.getLogger(BuildInfo.class);

    private static final String BUILD_INFO_FILE = "build-info.properties";

    private static final String version;
    private static final String buildTimestamp;

    static {
        final Properties props = new Properties();
        try (final InputStream input = BuildInfo.class.getClassLoader().getResourceAsStream(BUILD_INFO_FILE)) {
            if (input != null) {
                props.load(input);
            }
        } catch (final IOException e) {
            logger.warn("Failed to load {}, using defaults", BUILD_INFO_FILE, e);
        }
        version = filteredOrDefault(props.getProperty("build.version"), "dev");
        buildTimestamp = filteredOrDefault(props.getProperty("build.timestamp"), "unknown");
    }

    private BuildInfo() {
    }

    private static String filteredOrDefault(final String value, final String fallback) {
        if (value == null || value.isBlank() || value.startsWith("${")) {
            return fallback;
        }
        return value;
    }

    public static String getVersion() {
        return version;
    }

    public static String getBuildTimestamp() {
        return buildTimestamp;
    }

    /**
     * One-line description used in help output and server info, e.g. {@code 0.1.0 (built 2026-01-02T10:00:00Z)}.
     */
    public static String describe() {
        return version + " (built " + buildTimestamp + ")";
    }
}
