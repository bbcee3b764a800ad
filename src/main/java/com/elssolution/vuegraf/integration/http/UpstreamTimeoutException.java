package com.elssolution.vuegraf.integration.http;

/** The remote side did not answer within the request timeout. */
public class UpstreamTimeoutException extends UpstreamException {

    public UpstreamTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
