package com.listenpulse.ingestor.auth;

import com.listenpulse.ingestor.error.IngestionException;

/**
 * Source of bearer tokens for API calls.
 */
public interface AccessTokenProvider {

    /**
     * Returns an access token that is valid for the next network call, refreshing
     * (and persisting the refreshed credential) first when necessary.
     */
    String ensureValidToken() throws IngestionException;

    /**
     * Marks the current access token as unusable, e.g. after the provider answered 401,
     * so that the next {@link #ensureValidToken()} refreshes it.
     */
    void invalidateAccessToken();
}
