package de.mirkosertic.mcp.spicedocs.crawler;

import java.io.IOException;

/**
 * A page request ended with a non-success HTTP status.
 */
public class FetchStatusException extends IOException {

    private final int statusCode;

    public FetchStatusException(final int statusCode, final String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }
}
