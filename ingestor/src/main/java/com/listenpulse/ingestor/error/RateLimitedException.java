package com.listenpulse.ingestor.error;

import java.time.Duration;

/**
 * The provider kept declining requests after the internal retry budget was spent.
 */
public class RateLimitedException extends IngestionException {

    private final Duration retryAfter;

    public RateLimitedException(String message, Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.retryAfter = retryAfter;
    }

    /**
     * Last delay the provider asked for, or {@code null} if it gave none.
     */
    public Duration retryAfter() {
        return retryAfter;
    }

    @Override
    public FailureKind kind() {
        return FailureKind.RATE_LIMITED;
    }
}
