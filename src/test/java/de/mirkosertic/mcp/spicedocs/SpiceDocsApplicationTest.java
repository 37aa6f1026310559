package de.mirkosertic.mcp.spicedocs;

import de.mirkosertic.mcp.spicedocs.config.ApplicationConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Command line handling")
class SpiceDocsApplicationTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("No arguments should use the cached documentation")
    void noArgumentsShouldUseCache() {
        assertThat(SpiceDocsApplication.parseArguments(new String[0]))
                .isEqualTo(new SpiceDocsApplication.Invocation(SpiceDocsApplication.Mode.CACHED, null));
    }

    @Test
    @DisplayName("Options should select their modes")
    void optionsShouldSelectModes() {
        assertThat(SpiceDocsApplication.parseArguments(new String[]{"--help"}).mode())
                .isEqualTo(SpiceDocsApplication.Mode.HELP);
        assertThat(SpiceDocsApplication.parseArguments(new String[]{"-h"}).mode())
                .isEqualTo(SpiceDocsApplication.Mode.HELP);
        assertThat(SpiceDocsApplication.parseArguments(new String[]{"--refresh"}).mode())
                .isEqualTo(SpiceDocsApplication.Mode.REFRESH);
        assertThat(SpiceDocsApplication.parseArguments(new String[]{"--cache-dir"}).mode())
                .isEqualTo(SpiceDocsApplication.Mode.SHOW_CACHE_DIR);
    }

    @Test
    @DisplayName("A positional argument should name a local archive")
    void positionalArgumentShouldNameArchive() {
        assertThat(SpiceDocsApplication.parseArguments(new String[]{"/data/spice_docs"}))
                .isEqualTo(new SpiceDocsApplication.Invocation(SpiceDocsApplication.Mode.ARCHIVE, "/data/spice_docs"));
    }

    @Test
    @DisplayName("More than one argument should be rejected")
    void tooManyArgumentsShouldBeInvalid() {
        assertThat(SpiceDocsApplication.parseArguments(new String[]{"--refresh", "/data"}).mode())
                .isEqualTo(SpiceDocsApplication.Mode.INVALID);
    }

    @Test
    @DisplayName("Help should describe every option")
    void helpShouldDescribeOptions() {
        final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        SpiceDocsApplication.printHelp(new PrintStream(buffer, true, StandardCharsets.UTF_8));

        assertThat(buffer.toString(StandardCharsets.UTF_8))
                .contains(SpiceDocsApplication.USAGE)
                .contains("--refresh")
                .contains("--cache-dir")
                .contains("--help, -h")
                .contains("ARCHIVE_PATH");
    }

    @Test
    @DisplayName("A server context should build the index for a local archive")
    void serverContextShouldIndexLocalArchive() throws IOException {
        final Path archive = ArchiveFixture.create(tempDir.resolve("docs"));
        final ApplicationConfig config = ApplicationConfig.load(Map.of());

        try (ServerContext context = ServerContext.open(config, archive, false)) {
            assertThat(context.indexService().getIndexPath()).isEqualTo(archive.resolve(".archive_index"));
            assertThat(context.indexService().getDocumentCount()).isEqualTo(6);
            assertThat(context.queryService().isInitialized()).isTrue();
            assertThat(context.tools().getToolSpecifications()).hasSize(5);
        }
    }
}
