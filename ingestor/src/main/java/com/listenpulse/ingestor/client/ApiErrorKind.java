package com.listenpulse.ingestor.client;

/**
 * Provider error variants that callers match on explicitly.
 */
public enum ApiErrorKind {
    UNAUTHORIZED,
    FORBIDDEN,
    NOT_FOUND,
    RATE_LIMITED,
    SERVER_ERROR,
    /** OAuth {@code invalid_grant}: the code or refresh token is expired, revoked or already used. */
    INVALID_GRANT,
    CLIENT_ERROR;

    public static ApiErrorKind fromStatus(int statusCode) {
        if (statusCode == 401) return UNAUTHORIZED;
        if (statusCode == 403) return FORBIDDEN;
        if (statusCode == 404) return NOT_FOUND;
        if (statusCode == 429) return RATE_LIMITED;
        if (statusCode >= 500) return SERVER_ERROR;
        return CLIENT_ERROR;
    }
}
