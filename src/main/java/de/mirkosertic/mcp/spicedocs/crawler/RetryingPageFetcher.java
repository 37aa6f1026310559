package de.mirkosertic.mcp.spicedocs.crawler;

import de.mirkosertic.mcp.spicedocs.config.ApplicationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;

/**
 * Wraps a {@link PageFetcher} with bounded retry and exponential backoff.
 * <ul>
 *   <li>2xx: returned</li>
 *   <li>404: thrown at once as {@link FetchStatusException}, never retried</li>
 *   <li>5xx and network errors: retried after {@code backoffBase * 2^attempt} ms, thrown once attempts are used up</li>
 *   <li>any other status: thrown at once</li>
 * </ul>
 */
public class RetryingPageFetcher {

    private static final Logger logger = LoggerFactory.getLogger(RetryingPageFetcher.class);

    /**
     * Blocks the crawl thread between attempts.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final PageFetcher delegate;
    private final int maxAttempts;
    private final long backoffBaseMs;
    private final Sleeper sleeper;

    public RetryingPageFetcher(final PageFetcher delegate, final ApplicationConfig config) {
        this(delegate, config.getMaxAttempts(), config.getBackoffBaseMs(), Thread::sleep);
    }

    public RetryingPageFetcher(final PageFetcher delegate, final int maxAttempts, final long backoffBaseMs,
                               final Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, was " + maxAttempts);
        }
        this.delegate = delegate;
        this.maxAttempts = maxAttempts;
        this.backoffBaseMs = backoffBaseMs;
        this.sleeper = sleeper;
    }

    public FetchedPage fetch(final String url) throws IOException {
        for (int attempt = 0; ; attempt++) {
            final boolean lastAttempt = attempt >= maxAttempts - 1;

            final FetchedPage page;
            try {
                page = delegate.fetch(url);
            } catch (final IOException e) {
                if (lastAttempt) {
                    logger.error("Network error after {} attempts: {}", maxAttempts, url);
                    throw e;
                }
                final long delay = backoffDelay(attempt);
                logger.warn("Network error for {}, retrying in {}ms: {}", url, delay, e.getMessage());
                pause(delay);
                continue;
            }

            if (page.isSuccess()) {
                return page;
            }

            final int status = page.statusCode();
            if (status == 404) {
                logger.warn("File not found (404): {}", url);
                throw new FetchStatusException(status, "Not found (404): " + url);
            }
            if (status < 500 || status >= 600) {
                throw new FetchStatusException(status, "HTTP " + status + " for " + url);
            }
            if (lastAttempt) {
                logger.error("Server error {} after {} attempts: {}", status, maxAttempts, url);
                throw new FetchStatusException(status,
                        "Server error " + status + " after " + maxAttempts + " attempts: " + url);
            }
            final long delay = backoffDelay(attempt);
            logger.warn("Server error {} for {}, retrying in {}ms", status, url, delay);
            pause(delay);
        }
    }

    long backoffDelay(final int attempt) {
        return backoffBaseMs * (1L << attempt);
    }

    private void pause(final long millis) throws IOException {
        try {
            sleeper.sleep(millis);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            final InterruptedIOException interrupted = new InterruptedIOException("Interrupted during retry backoff");
            interrupted.initCause(e);
            throw interrupted;
        }
    }
}
