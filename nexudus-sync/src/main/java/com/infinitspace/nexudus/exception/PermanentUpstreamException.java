package com.infinitspace.nexudus.exception;

public class PermanentUpstreamException extends UpstreamException {

    public PermanentUpstreamException(String message, int status, Throwable cause) {
        super(message, status, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
