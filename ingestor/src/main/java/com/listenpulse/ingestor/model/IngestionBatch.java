package com.listenpulse.ingestor.model;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * The deduplicated, played_at-ordered events of one run plus the batch metadata.
 *
 * @param sourceWatermark the watermark the fetch started from, or {@code null} on a first run
 */
public record IngestionBatch(
        List<PlayEvent> events,
        Instant fetchedAt,
        Watermark sourceWatermark
) {

    public IngestionBatch {
        events = List.copyOf(events);
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    public int size() {
        return events.size();
    }

    public Optional<Instant> maxPlayedAt() {
        return events.stream().map(PlayEvent::playedAt).max(Comparator.naturalOrder());
    }

    public Optional<Instant> minPlayedAt() {
        return events.stream().map(PlayEvent::playedAt).min(Comparator.naturalOrder());
    }

    public long uniqueTracks() {
        return events.stream().map(PlayEvent::trackId).distinct().count();
    }

    public long uniqueArtists() {
        return events.stream().map(PlayEvent::artistId).distinct().count();
    }
}
