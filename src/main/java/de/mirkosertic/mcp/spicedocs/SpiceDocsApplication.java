package de.mirkosertic.mcp.spicedocs;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.mcp.spicedocs.cache.CacheOrchestrator;
import de.mirkosertic.mcp.spicedocs.cache.CacheValidator;
import de.mirkosertic.mcp.spicedocs.config.ApplicationConfig;
import de.mirkosertic.mcp.spicedocs.config.BuildInfo;
import de.mirkosertic.mcp.spicedocs.config.LoggingConfigurator;
import de.mirkosertic.mcp.spicedocs.crawler.JsoupPageFetcher;
import de.mirkosertic.mcp.spicedocs.crawler.RetryingPageFetcher;
import de.mirkosertic.mcp.spicedocs.crawler.ScopedCrawler;
import de.mirkosertic.mcp.spicedocs.indexer.JsoupPageParser;
import de.mirkosertic.mcp.spicedocs.mcp.LatestProtocolStdioServerTransportProvider;
import io.modelcontextprotocol.json.jackson.JacksonMcpJsonMapper;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.spec.McpSchema;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Main entry point for the SpiceDocs MCP server.
 * Resolves the archive (downloading it if needed), opens the index and serves the tools over STDIO.
 */
public class SpiceDocsApplication {

    private static final Logger logger = LoggerFactory.getLogger(SpiceDocsApplication.class);

    static final String USAGE = "Usage: spicedocs-mcp [OPTIONS] [ARCHIVE_PATH]";

    enum Mode {
        CACHED, ARCHIVE, REFRESH, SHOW_CACHE_DIR, HELP, INVALID
    }

    record Invocation(Mode mode, @Nullable String archivePath) {
    }

    private final ServerContext context;
    private McpSyncServer mcpServer;

    public SpiceDocsApplication(final ServerContext context) {
        this.context = context;
    }

    static Invocation parseArguments(final String[] args) {
        if (args.length == 0) {
            return new Invocation(Mode.CACHED, null);
        }
        if (args.length > 1) {
            return new Invocation(Mode.INVALID, null);
        }
        return switch (args[0]) {
            case "--help", "-h" -> new Invocation(Mode.HELP, null);
            case "--cache-dir" -> new Invocation(Mode.SHOW_CACHE_DIR, null);
            case "--refresh" -> new Invocation(Mode.REFRESH, null);
            default -> new Invocation(Mode.ARCHIVE, args[0]);
        };
    }

    static void printHelp(final PrintStream out) {
        out.println("SpiceDocs MCP Server " + BuildInfo.describe());
        out.println("Search and browse NAIF SPICE documentation.");
        out.println();
        out.println(USAGE);
        out.println();
        out.println("Options:");
        out.println("  ARCHIVE_PATH      Path to local SPICE documentation archive (optional)");
        out.println("  --refresh         Force re-download of cached documentation");
        out.println("  --cache-dir       Show cache directory location and exit");
        out.println("  --help, -h        Show this help message");
        out.println();
        out.println("If ARCHIVE_PATH is not provided, documentation will be automatically");
        out.println("downloaded to a platform-appropriate cache directory on first run.");
    }

    static void printUsageError(final PrintStream err) {
        err.println(USAGE);
        err.println("Try 'spicedocs-mcp --help' for more information.");
    }

    static CacheOrchestrator createOrchestrator(final ApplicationConfig config) {
        final JsoupPageParser pageParser = new JsoupPageParser();
        final RetryingPageFetcher fetcher = new RetryingPageFetcher(new JsoupPageFetcher(config), config);
        final ScopedCrawler crawler = new ScopedCrawler(config, fetcher, pageParser, Clock.systemUTC());
        return new CacheOrchestrator(config, new CacheValidator(config), crawler);
    }

    /**
     * Start the MCP server and block until the process ends.
     */
    public void start() {
        logger.info("Starting MCP server with STDIO transport...");

        final McpSchema.ServerCapabilities capabilities = McpSchema.ServerCapabilities.builder()
                .tools(false)
                .build();

        final McpSchema.Implementation serverInfo = new McpSchema.Implementation("spicedocs", BuildInfo.getVersion());

        final LatestProtocolStdioServerTransportProvider transportProvider =
                new LatestProtocolStdioServerTransportProvider(new JacksonMcpJsonMapper(new ObjectMapper()));

        mcpServer = McpServer.sync(transportProvider)
                .serverInfo(serverInfo)
                .instructions("Search and browse NAIF SPICE documentation")
                .capabilities(capabilities)
                .tools(context.tools().getToolSpecifications())
                .build();

        logger.info("MCP server started successfully");

        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "shutdown-hook"));

        // The STDIO transport runs on its own threads
        try {
            Thread.currentThread().join();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Main thread interrupted, shutting down...");
        }
    }

    public void shutdown() {
        logger.info("Shutting down SpiceDocs MCP server...");
        try {
            if (mcpServer != null) {
                mcpServer.close();
            }
        } catch (final Exception e) {
            logger.error("Error closing MCP server", e);
        }
        try {
            context.close();
        } catch (final Exception e) {
            logger.error("Error closing index service", e);
        }
        logger.info("SpiceDocs MCP server shutdown complete");
    }

    public static void main(final String[] args) {
        final Invocation invocation = parseArguments(args);
        switch (invocation.mode()) {
            case HELP -> {
                printHelp(System.out);
                return;
            }
            case INVALID -> {
                printUsageError(System.err);
                System.exit(1);
                return;
            }
            default -> {
                // continue below
            }
        }

        // Configure logging FIRST, before any other code that might log
        final boolean deployedMode = "deployed".equals(System.getProperty("profile"));
        LoggingConfigurator.configure(deployedMode);

        final ApplicationConfig config = ApplicationConfig.load();
        if (invocation.mode() == Mode.SHOW_CACHE_DIR) {
            System.out.println(config.getCacheDirectory());
            return;
        }

        final Path archiveRoot;
        final boolean fromCache;
        try {
            switch (invocation.mode()) {
                case REFRESH -> {
                    archiveRoot = createOrchestrator(config).refresh(config.getCacheDirectory());
                    logger.info("Cache refreshed successfully");
                    fromCache = true;
                }
                case ARCHIVE -> {
                    archiveRoot = Path.of(invocation.archivePath()).toAbsolutePath().normalize();
                    if (!Files.exists(archiveRoot)) {
                        logger.error("Archive path does not exist: {}", archiveRoot);
                        System.exit(1);
                        return;
                    }
                    logger.info("Using local archive at: {}", archiveRoot);
                    fromCache = false;
                }
                default -> {
                    archiveRoot = createOrchestrator(config).getOrRefresh(config.getCacheDirectory());
                    logger.info("Using cached documentation at: {}", archiveRoot);
                    fromCache = true;
                }
            }
        } catch (final IOException | RuntimeException e) {
            logger.error("Failed to initialize documentation cache: {}", e.getMessage(), e);
            logger.error("Check your network connection and try again.");
            System.exit(1);
            return;
        }

        try {
            logger.info("Initializing SpiceDocs MCP server {} with archive: {}", BuildInfo.describe(), archiveRoot);
            final ServerContext context = ServerContext.open(config, archiveRoot, fromCache);
            new SpiceDocsApplication(context).start();
        } catch (final Exception e) {
            // In deployed mode, we can't log to console, so write to stderr
            System.err.println("Failed to start SpiceDocs MCP server: " + e.getMessage());
            e.printStackTrace(System.err);
            System.exit(1);
        }
    }
}
