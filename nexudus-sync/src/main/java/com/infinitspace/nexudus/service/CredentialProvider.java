package com.infinitspace.nexudus.service;

/**
 * Supplies the bearer token for Nexudus API calls.
 */
public interface CredentialProvider {

    /**
     * @return a token believed to be valid now
     * @throws com.infinitspace.nexudus.exception.NexudusAuthException if no token can be obtained
     */
    String getToken();

    /** Forget the cached token so the next {@link #getToken()} fetches a fresh one. */
    void invalidate();
}
