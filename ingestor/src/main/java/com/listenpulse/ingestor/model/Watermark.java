package com.listenpulse.ingestor.model;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Ingestion progress marker: everything played at or before {@code lastPlayedAt}
 * has been durably written. Held at millisecond precision, the precision it is
 * persisted and sent to the provider with.
 */
public record Watermark(Instant lastPlayedAt) {

    public Watermark {
        Objects.requireNonNull(lastPlayedAt, "lastPlayedAt");
        lastPlayedAt = lastPlayedAt.truncatedTo(ChronoUnit.MILLIS);
    }

    /**
     * Value of the provider's {@code after} query parameter (epoch milliseconds).
     */
    public long afterParam() {
        return lastPlayedAt.toEpochMilli();
    }

    public boolean covers(Instant playedAt) {
        return !playedAt.isAfter(lastPlayedAt);
    }
}
