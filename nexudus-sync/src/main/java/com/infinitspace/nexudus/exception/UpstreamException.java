package com.infinitspace.nexudus.exception;

/**
 * Failure talking to the Nexudus API. Subclasses decide whether a retry can help.
 */
public abstract class UpstreamException extends RuntimeException {

    private final int status;

    protected UpstreamException(String message, int status, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    /** HTTP status, or 0 when the request never got a response. */
    public int getStatus() {
        return status;
    }

    public abstract boolean isRetryable();
}
