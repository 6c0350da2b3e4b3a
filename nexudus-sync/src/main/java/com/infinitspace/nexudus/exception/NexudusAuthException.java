package com.infinitspace.nexudus.exception;

/**
 * No usable Nexudus credentials: none configured, the token exchange failed,
 * or a fresh token was still rejected. Nothing downstream can succeed without one.
 */
public class NexudusAuthException extends RuntimeException {

    public NexudusAuthException(String message) {
        super(message);
    }

    public NexudusAuthException(String message, Throwable cause) {
        super(message, cause);
    }
}
