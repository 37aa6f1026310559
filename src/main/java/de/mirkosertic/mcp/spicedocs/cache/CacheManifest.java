package de.mirkosertic.mcp.spicedocs.cache;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Completion record of a mirror, stored as {@code .cache_version} next to the mirrored host directory.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CacheManifest(
        @JsonProperty("version") String version,
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("base_url") String baseUrl,
        @JsonProperty("file_count") int fileCount,
        @JsonProperty("completed") boolean completed
) {

    public static final String FILE_NAME = ".cache_version";
    public static final String CURRENT_VERSION = "1.0";

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Manifest for a crawl that finished now.
     */
    public static CacheManifest completed(final String baseUrl, final int fileCount, final Clock clock) {
        final String timestamp = OffsetDateTime.now(clock.withZone(ZoneOffset.UTC))
                .format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        return new CacheManifest(CURRENT_VERSION, timestamp, baseUrl, fileCount, true);
    }

    /**
     * @throws IOException if the file is missing or not a JSON object of the expected shape
     */
    public static CacheManifest read(final Path file) throws IOException {
        final CacheManifest manifest = OBJECT_MAPPER.readValue(file.toFile(), CacheManifest.class);
        if (manifest == null) {
            throw new IOException("Cache version file holds no manifest: " + file);
        }
        return manifest;
    }

    public void write(final Path file) throws IOException {
        Files.write(file, OBJECT_MAPPER.writeValueAsBytes(this));
    }
}
