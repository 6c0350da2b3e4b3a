package com.infinitspace.nexudus.exception;

import java.time.Duration;
import java.util.Optional;

/**
 * Throttling (429), a 5xx gateway/server error, or a network failure. Safe to retry.
 */
public class TransientUpstreamException extends UpstreamException {

    private final Duration retryAfter;

    public TransientUpstreamException(String message, int status, Duration retryAfter, Throwable cause) {
        super(message, status, cause);
        this.retryAfter = retryAfter;
    }

    public TransientUpstreamException(String message, int status, Throwable cause) {
        this(message, status, null, cause);
    }

    /** Server-requested wait, only present for 429. */
    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
