package de.mirkosertic.mcp.spicedocs.crawler;

import de.mirkosertic.mcp.spicedocs.config.ApplicationConfig;
import org.jsoup.Connection;
import org.jsoup.Jsoup;

import java.io.IOException;

/**
 * {@link PageFetcher} using jsoup's HTTP connection. Redirects are followed and bodies are not size-limited.
 */
public class JsoupPageFetcher implements PageFetcher {

    private final String userAgent;
    private final int timeoutMs;

    public JsoupPageFetcher(final ApplicationConfig config) {
        this(config.getUserAgent(), config.getTimeoutMs());
    }

    public JsoupPageFetcher(final String userAgent, final int timeoutMs) {
        this.userAgent = userAgent;
        this.timeoutMs = timeoutMs;
    }

    @Override
    public FetchedPage fetch(final String url) throws IOException {
        final Connection.Response response = Jsoup.connect(url)
                .userAgent(userAgent)
                .timeout(timeoutMs)
                .followRedirects(true)
                .ignoreHttpErrors(true)
                .ignoreContentType(true)
                .maxBodySize(0)
                .execute();
        return new FetchedPage(url, response.statusCode(), response.bodyAsBytes());
    }
}
