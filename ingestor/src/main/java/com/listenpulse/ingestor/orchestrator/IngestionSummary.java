package com.listenpulse.ingestor.orchestrator;

import com.listenpulse.ingestor.error.FailureKind;
import com.listenpulse.ingestor.model.Watermark;

import java.time.Instant;

/**
 * Result of one ingestion run, for logging, the console summary and tests.
 *
 * @param eventsFetched    valid events delivered by the provider across all pages
 * @param alreadyIngested  events at or before the starting watermark, discarded
 * @param duplicatesDropped repeated (track_id, played_at) pairs removed in memory
 * @param malformedDropped provider items that could not be normalized
 * @param outputLocation   where the batch was written, {@code null} if nothing was written
 * @param failureKind      {@code null} unless the run failed
 */
public record IngestionSummary(
        RunOutcome outcome,
        int pagesFetched,
        int eventsFetched,
        int alreadyIngested,
        int duplicatesDropped,
        int malformedDropped,
        int eventsWritten,
        long uniqueTracks,
        long uniqueArtists,
        Instant oldestPlayedAt,
        Instant newestPlayedAt,
        Watermark watermarkBefore,
        Watermark watermarkAfter,
        String outputLocation,
        FailureKind failureKind,
        String errorMessage,
        long totalDurationMs
) {

    public boolean hasFailure() {
        return !outcome.isSuccess();
    }

    public boolean watermarkAdvanced() {
        return watermarkAfter != null && !watermarkAfter.equals(watermarkBefore);
    }

    static Builder builder() {
        return new Builder();
    }

    static final class Builder {
        private int pagesFetched;
        private int eventsFetched;
        private int alreadyIngested;
        private int duplicatesDropped;
        private int malformedDropped;
        private int eventsWritten;
        private long uniqueTracks;
        private long uniqueArtists;
        private Instant oldestPlayedAt;
        private Instant newestPlayedAt;
        private Watermark watermarkBefore;
        private Watermark watermarkAfter;
        private String outputLocation;

        Builder pagesFetched(int value) { this.pagesFetched = value; return this; }
        Builder eventsFetched(int value) { this.eventsFetched = value; return this; }
        Builder alreadyIngested(int value) { this.alreadyIngested = value; return this; }
        Builder duplicatesDropped(int value) { this.duplicatesDropped = value; return this; }
        Builder malformedDropped(int value) { this.malformedDropped = value; return this; }
        Builder eventsWritten(int value) { this.eventsWritten = value; return this; }
        Builder uniqueTracks(long value) { this.uniqueTracks = value; return this; }
        Builder uniqueArtists(long value) { this.uniqueArtists = value; return this; }
        Builder oldestPlayedAt(Instant value) { this.oldestPlayedAt = value; return this; }
        Builder newestPlayedAt(Instant value) { this.newestPlayedAt = value; return this; }
        Builder outputLocation(String value) { this.outputLocation = value; return this; }

        Builder watermarkBefore(Watermark value) {
            this.watermarkBefore = value;
            this.watermarkAfter = value;
            return this;
        }

        Builder watermarkAfter(Watermark value) { this.watermarkAfter = value; return this; }

        IngestionSummary success(RunOutcome outcome, long durationMs) {
            return build(outcome, null, null, durationMs);
        }

        IngestionSummary failure(RunOutcome outcome, FailureKind kind, String message, long durationMs) {
            return build(outcome, kind, message, durationMs);
        }

        private IngestionSummary build(RunOutcome outcome, FailureKind kind, String message, long durationMs) {
            return new IngestionSummary(outcome, pagesFetched, eventsFetched, alreadyIngested,
                    duplicatesDropped, malformedDropped, eventsWritten, uniqueTracks, uniqueArtists,
                    oldestPlayedAt, newestPlayedAt, watermarkBefore, watermarkAfter, outputLocation,
                    kind, message, durationMs);
        }
    }
}
