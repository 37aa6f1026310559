package de.mirkosertic.mcp.spicedocs.crawler;

import java.io.IOException;

/**
 * A mirror cannot be obtained because a local precondition does not hold
 * (disk space, write permission, downloads disabled). Raised before any network activity.
 */
public class PreconditionFailedException extends IOException {

    public PreconditionFailedException(final String message) {
        super(message);
    }

    public PreconditionFailedException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
