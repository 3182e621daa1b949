package com.listenpulse.ingestor.orchestrator;

import com.listenpulse.ingestor.auth.AccessTokenProvider;
import com.listenpulse.ingestor.error.IngestionException;
import com.listenpulse.ingestor.error.StorageWriteFailedException;
import com.listenpulse.ingestor.error.TransientNetworkException;
import com.listenpulse.ingestor.fetcher.EventFetcher;
import com.listenpulse.ingestor.fetcher.FetchedPage;
import com.listenpulse.ingestor.fetcher.PageStream;
import com.listenpulse.ingestor.model.IngestionBatch;
import com.listenpulse.ingestor.model.PlayEvent;
import com.listenpulse.ingestor.model.PlayKey;
import com.listenpulse.ingestor.model.Watermark;
import com.listenpulse.ingestor.state.CursorStore;
import com.listenpulse.ingestor.writer.ObjectWriter;
import com.listenpulse.ingestor.writer.WriteReceipt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Coordinates one ingestion run: auth -> watermark -> fetch -> dedup -> write -> advance.
 *
 * <p>The watermark is only advanced with the receipt of a completed write, and
 * nothing is written or advanced when a step before it fails. A failed run can
 * therefore always be repeated: at worst the next run re-fetches and re-writes a
 * window that the downstream deduplication absorbs.</p>
 */
public class IngestionOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(IngestionOrchestrator.class);

    private final AccessTokenProvider tokenProvider;
    private final CursorStore cursorStore;
    private final EventFetcher fetcher;
    private final ObjectWriter writer;
    private final Clock clock;
    private final Watermark initialWatermark;

    public IngestionOrchestrator(AccessTokenProvider tokenProvider, CursorStore cursorStore,
                                 EventFetcher fetcher, ObjectWriter writer, Clock clock) {
        this(tokenProvider, cursorStore, fetcher, writer, clock, null);
    }

    /**
     * @param initialWatermark start point used when no watermark is stored yet, instead of
     *                         the single most-recent page; may be {@code null}
     */
    public IngestionOrchestrator(AccessTokenProvider tokenProvider, CursorStore cursorStore,
                                 EventFetcher fetcher, ObjectWriter writer, Clock clock,
                                 Watermark initialWatermark) {
        this.tokenProvider = tokenProvider;
        this.cursorStore = cursorStore;
        this.fetcher = fetcher;
        this.writer = writer;
        this.clock = clock;
        this.initialWatermark = initialWatermark;
    }

    /**
     * Runs the pipeline once. Never throws; the outcome and any failure are in the summary.
     */
    public IngestionSummary run() {
        long runStart = System.currentTimeMillis();
        IngestionSummary.Builder summary = IngestionSummary.builder();
        logger.info("Starting Spotify data ingestion");

        try {
            RunOutcome outcome = ingest(summary);
            IngestionSummary result = summary.success(outcome, elapsed(runStart));
            logSummary(result);
            return result;
        } catch (IngestionException e) {
            RunOutcome outcome = e.kind().operatorRequired() ? RunOutcome.NEEDS_OPERATOR : RunOutcome.RETRY_LATER;
            logger.error("Ingestion failed ({}): {}", e.kind(), e.getMessage(), e);
            IngestionSummary result = summary.failure(outcome, e.kind(), e.getMessage(), elapsed(runStart));
            logSummary(result);
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("Ingestion interrupted");
            IngestionSummary result = summary.failure(RunOutcome.RETRY_LATER, null, "Interrupted", elapsed(runStart));
            logSummary(result);
            return result;
        } catch (RuntimeException e) {
            logger.error("Unexpected failure during ingestion", e);
            IngestionSummary result = summary.failure(RunOutcome.RETRY_LATER, null,
                    String.valueOf(e.getMessage()), elapsed(runStart));
            logSummary(result);
            return result;
        }
    }

    private RunOutcome ingest(IngestionSummary.Builder summary) throws IngestionException, InterruptedException {
        // Step 1: a usable token before anything else touches the provider
        logger.info("Authenticating with Spotify...");
        tokenProvider.ensureValidToken();

        // Step 2: start point
        Watermark stored = loadWatermark();
        summary.watermarkBefore(stored);
        Watermark startFrom = stored;
        if (stored == null && initialWatermark != null) {
            logger.info("No stored watermark; starting from configured initial watermark {}",
                    initialWatermark.lastPlayedAt());
            startFrom = initialWatermark;
        }

        // Step 3: fetch every page
        Instant fetchedAt = clock.instant();
        PageStream pages = fetcher.fetchSince(startFrom);
        List<PlayEvent> delivered = new ArrayList<>();
        int malformed = 0;
        Optional<FetchedPage> page;
        while ((page = pages.next()).isPresent()) {
            delivered.addAll(page.get().events());
            malformed += page.get().malformedCount();
        }
        summary.pagesFetched(pages.pagesFetched())
                .eventsFetched(delivered.size())
                .malformedDropped(malformed);

        // Step 4: drop what is already ingested, dedup, order
        List<PlayEvent> fresh = filterAfter(delivered, startFrom);
        List<PlayEvent> unique = deduplicate(fresh);
        List<PlayEvent> ordered = sortByPlayedAt(unique);
        summary.alreadyIngested(delivered.size() - fresh.size())
                .duplicatesDropped(fresh.size() - unique.size());

        IngestionBatch batch = new IngestionBatch(ordered, fetchedAt, startFrom);

        // Step 5: nothing new is a successful no-op
        if (batch.isEmpty()) {
            logger.info("No new tracks found");
            return RunOutcome.NO_NEW_EVENTS;
        }

        summary.uniqueTracks(batch.uniqueTracks())
                .uniqueArtists(batch.uniqueArtists())
                .oldestPlayedAt(batch.minPlayedAt().orElse(null))
                .newestPlayedAt(batch.maxPlayedAt().orElse(null));

        // Step 6: write, then advance with the write receipt
        WriteReceipt receipt = writer.write(batch);
        summary.outputLocation(receipt.location()).eventsWritten(receipt.eventCount());

        try {
            summary.watermarkAfter(cursorStore.advance(receipt));
        } catch (IOException e) {
            throw new StorageWriteFailedException("Batch written to " + receipt.location()
                    + " but the watermark could not be advanced; the next run re-fetches this window", e);
        }
        return RunOutcome.INGESTED;
    }

    private Watermark loadWatermark() throws TransientNetworkException {
        logger.info("Checking for previous state...");
        try {
            return cursorStore.loadWatermark().orElse(null);
        } catch (IOException e) {
            throw new TransientNetworkException("Could not read the stored watermark: " + e.getMessage(), e);
        }
    }

    static List<PlayEvent> filterAfter(List<PlayEvent> events, Watermark watermark) {
        if (watermark == null) {
            return events;
        }
        return events.stream()
                .filter(e -> !watermark.covers(e.playedAt()))
                .toList();
    }

    /**
     * Keeps the first occurrence of each (track_id, played_at) in provider order.
     */
    static List<PlayEvent> deduplicate(List<PlayEvent> events) {
        Map<PlayKey, PlayEvent> firstSeen = new LinkedHashMap<>();
        for (PlayEvent event : events) {
            firstSeen.putIfAbsent(event.key(), event);
        }
        return new ArrayList<>(firstSeen.values());
    }

    static List<PlayEvent> sortByPlayedAt(List<PlayEvent> events) {
        return events.stream()
                .sorted(Comparator.comparing(PlayEvent::playedAt))
                .toList();
    }

    private void logSummary(IngestionSummary summary) {
        logger.info("=== Ingestion Summary ===");
        logger.info("Outcome: {} in {}ms", summary.outcome(), summary.totalDurationMs());
        logger.info("  pages={}, fetched={}, alreadyIngested={}, duplicates={}, malformed={}, written={}",
                summary.pagesFetched(), summary.eventsFetched(), summary.alreadyIngested(),
                summary.duplicatesDropped(), summary.malformedDropped(), summary.eventsWritten());
        if (summary.outputLocation() != null) {
            logger.info("  output: {}", summary.outputLocation());
        }
        logger.info("  watermark: {} -> {}",
                summary.watermarkBefore() != null ? summary.watermarkBefore().lastPlayedAt() : "none",
                summary.watermarkAfter() != null ? summary.watermarkAfter().lastPlayedAt() : "none");
        if (summary.hasFailure()) {
            logger.warn("  FAILED: {}: {}", summary.failureKind(), summary.errorMessage());
        }
    }

    private long elapsed(long startMillis) {
        return System.currentTimeMillis() - startMillis;
    }
}
