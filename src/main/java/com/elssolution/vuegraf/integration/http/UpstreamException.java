package com.elssolution.vuegraf.integration.http;

import java.io.IOException;

/**
 * A remote call failed after retries. Recoverable: the caller skips its cycle and tries again later.
 */
public class UpstreamException extends IOException {

    /** HTTP status, or -1 when no response was received. */
    private final int status;

    public UpstreamException(String message) {
        this(message, -1, null);
    }

    public UpstreamException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public UpstreamException(String message, int status, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }
}
