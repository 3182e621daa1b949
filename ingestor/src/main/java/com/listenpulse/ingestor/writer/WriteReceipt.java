package com.listenpulse.ingestor.writer;

import java.time.Instant;
import java.util.Objects;

/**
 * Proof that a batch is durably stored. Only {@link ObjectWriter} creates these.
 */
public final class WriteReceipt {

    private final String key;
    private final String location;
    private final Instant fetchedAt;
    private final int eventCount;
    private final Instant maxPlayedAt;

    WriteReceipt(String key, String location, Instant fetchedAt, int eventCount, Instant maxPlayedAt) {
        this.key = Objects.requireNonNull(key, "key");
        this.location = location;
        this.fetchedAt = fetchedAt;
        this.eventCount = eventCount;
        this.maxPlayedAt = Objects.requireNonNull(maxPlayedAt, "maxPlayedAt");
    }

    public String key() {
        return key;
    }

    /**
     * Full location for display, e.g. {@code s3://bucket/raw/...}.
     */
    public String location() {
        return location;
    }

    public Instant fetchedAt() {
        return fetchedAt;
    }

    public int eventCount() {
        return eventCount;
    }

    public Instant maxPlayedAt() {
        return maxPlayedAt;
    }

    @Override
    public String toString() {
        return "WriteReceipt[" + location + ", events=" + eventCount + ", maxPlayedAt=" + maxPlayedAt + "]";
    }
}
