package com.listenpulse.ingestor.orchestrator;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.databind.JsonNode;
import com.listenpulse.ingestor.auth.AccessTokenProvider;
import com.listenpulse.ingestor.client.SpotifyApiClient;
import com.listenpulse.ingestor.error.AuthExpiredUnrecoverableException;
import com.listenpulse.ingestor.error.FailureKind;
import com.listenpulse.ingestor.error.RateLimitedException;
import com.listenpulse.ingestor.error.StorageWriteFailedException;
import com.listenpulse.ingestor.fetcher.EventFetcher;
import com.listenpulse.ingestor.fetcher.FetchedPage;
import com.listenpulse.ingestor.fetcher.PageStream;
import com.listenpulse.ingestor.model.IngestionBatch;
import com.listenpulse.ingestor.model.PlayEvent;
import com.listenpulse.ingestor.model.Watermark;
import com.listenpulse.ingestor.state.CursorStore;
import com.listenpulse.ingestor.state.ObjectStoreCursorStore;
import com.listenpulse.ingestor.storage.LocalObjectStore;
import com.listenpulse.ingestor.writer.ObjectWriter;
import com.listenpulse.ingestor.writer.WriteReceipt;
import com.listenpulse.ingestor.writer.WriteReceipts;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

import static com.listenpulse.ingestor.PlayHistoryFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Run-level tests for {@link IngestionOrchestrator}. The end-to-end cases use the
 * real stores and writer over a temporary directory with a simulated provider;
 * the ordering cases use mocks for every collaborator.
 */
@ExtendWith(MockitoExtension.class)
class IngestionOrchestratorTest {

    private static final Instant T0 = Instant.parse("2025-12-25T07:00:00Z");
    private static final Instant T1 = Instant.parse("2025-12-25T08:00:00Z");
    private static final Instant T2 = Instant.parse("2025-12-25T08:05:00Z");
    private static final Instant T3 = Instant.parse("2025-12-25T08:10:00Z");

    @TempDir
    Path root;

    @Mock
    private AccessTokenProvider tokenProvider;

    @Mock
    private SpotifyApiClient apiClient;

    @Mock
    private EventFetcher fetcher;

    @Mock
    private PageStream pageStream;

    @Mock
    private ObjectWriter writer;

    @Mock
    private CursorStore cursorStore;

    private final List<JsonNode> history = new ArrayList<>();

    /**
     * Answers like the provider: plays strictly after {@code after} oldest first,
     * or the most recent ones when no cursor is given.
     */
    private void serveHistory() throws Exception {
        when(apiClient.getRecentlyPlayed(anyString(), anyInt(), any())).thenAnswer(inv -> {
            int limit = inv.getArgument(1);
            Long after = inv.getArgument(2);
            List<JsonNode> matching = history.stream()
                    .filter(i -> after == null || Instant.parse(i.get("played_at").asText()).toEpochMilli() > after)
                    .toList();
            List<JsonNode> window = after == null
                    ? matching.subList(Math.max(0, matching.size() - limit), matching.size())
                    : matching.subList(0, Math.min(limit, matching.size()));
            return page(new ArrayList<>(window));
        });
    }

    private IngestionOrchestrator realOrchestrator(Instant now, CursorStore cursors) {
        LocalObjectStore store = new LocalObjectStore(root);
        Clock clock = Clock.fixed(now, ZoneOffset.UTC);
        return new IngestionOrchestrator(tokenProvider, cursors,
                new EventFetcher(apiClient, tokenProvider, 10),
                new ObjectWriter(store, "raw", 1), clock);
    }

    private ObjectStoreCursorStore realCursorStore() {
        return new ObjectStoreCursorStore(new LocalObjectStore(root), Clock.fixed(T0, ZoneOffset.UTC));
    }

    private IngestionOrchestrator mockedOrchestrator(Watermark initialWatermark) {
        return new IngestionOrchestrator(tokenProvider, cursorStore, fetcher, writer,
                Clock.fixed(T3, ZoneOffset.UTC), initialWatermark);
    }

    private List<Path> outputFiles() throws IOException {
        Path raw = root.resolve("raw");
        if (!Files.exists(raw)) {
            return List.of();
        }
        try (Stream<Path> files = Files.walk(raw)) {
            return files.filter(Files::isRegularFile).sorted().toList();
        }
    }

    private Set<String> trackKeys(Path file) throws IOException {
        Set<String> keys = new HashSet<>();
        for (JsonNode track : MAPPER.readTree(Files.readAllBytes(file)).get("tracks")) {
            keys.add(track.get("track_id").asText() + "@" + track.get("played_at").asText());
        }
        return keys;
    }

    // =========================================================================
    // End-to-end with real stores
    // =========================================================================

    @Test
    @DisplayName("First run ingests, second run with no new plays is a no-op")
    void endToEnd_thenIdempotent() throws Exception {
        when(tokenProvider.ensureValidToken()).thenReturn("token");
        history.add(item("a", T1));
        history.add(item("b", T2));
        serveHistory();
        ObjectStoreCursorStore cursors = realCursorStore();

        IngestionSummary first = realOrchestrator(Instant.parse("2025-12-25T09:00:00Z"), cursors).run();

        assertEquals(RunOutcome.INGESTED, first.outcome());
        assertEquals(2, first.eventsWritten());
        assertEquals(new Watermark(T2), first.watermarkAfter());
        assertTrue(first.watermarkAdvanced());
        assertEquals(Optional.of(new Watermark(T2)), cursors.loadWatermark());
        assertEquals(1, outputFiles().size());

        IngestionSummary second = realOrchestrator(Instant.parse("2025-12-25T10:00:00Z"), cursors).run();

        assertEquals(RunOutcome.NO_NEW_EVENTS, second.outcome());
        assertEquals(0, second.outcome().exitCode());
        assertEquals(0, second.eventsWritten());
        assertNull(second.outputLocation());
        assertFalse(second.watermarkAdvanced());
        assertEquals(Optional.of(new Watermark(T2)), cursors.loadWatermark());
        assertEquals(1, outputFiles().size());
    }

    @Test
    @DisplayName("Crash after write but before advance is repaired by the next run")
    void crashBetweenWriteAndAdvance_nextRunWritesSuperset() throws Exception {
        when(tokenProvider.ensureValidToken()).thenReturn("token");
        history.add(item("a", T1));
        history.add(item("b", T2));
        serveHistory();
        ObjectStoreCursorStore realCursors = realCursorStore();
        realCursors.advance(WriteReceipts.receipt("raw/seed.json", T0, 1, T0));

        when(cursorStore.loadWatermark()).thenReturn(Optional.of(new Watermark(T0)));
        when(cursorStore.advance(any())).thenThrow(new IOException("connection lost"));

        IngestionSummary crashed = realOrchestrator(Instant.parse("2025-12-25T09:00:00Z"), cursorStore).run();

        assertEquals(RunOutcome.RETRY_LATER, crashed.outcome());
        assertEquals(FailureKind.STORAGE_WRITE_FAILED, crashed.failureKind());
        assertNotNull(crashed.outputLocation());
        assertEquals(Optional.of(new Watermark(T0)), realCursors.loadWatermark());

        history.add(item("c", T3));
        IngestionSummary retried = realOrchestrator(Instant.parse("2025-12-25T10:00:00Z"), realCursors).run();

        assertEquals(RunOutcome.INGESTED, retried.outcome());
        assertEquals(new Watermark(T3), retried.watermarkAfter());

        List<Path> files = outputFiles();
        assertEquals(2, files.size());
        Set<String> crashedKeys = trackKeys(files.get(0));
        Set<String> retriedKeys = trackKeys(files.get(1));
        assertEquals(2, crashedKeys.size());
        assertEquals(3, retriedKeys.size());
        assertTrue(retriedKeys.containsAll(crashedKeys));
    }

    @Test
    @DisplayName("Two runs within the same second keep both output files")
    void sameSecondRuns_bothFilesKept() throws Exception {
        when(tokenProvider.ensureValidToken()).thenReturn("token");
        history.add(item("a", T1));
        serveHistory();
        ObjectStoreCursorStore cursors = realCursorStore();

        IngestionSummary first = realOrchestrator(Instant.parse("2025-12-25T09:00:00.100Z"), cursors).run();
        history.add(item("b", T2));
        IngestionSummary second = realOrchestrator(Instant.parse("2025-12-25T09:00:00.900Z"), cursors).run();

        assertEquals(RunOutcome.INGESTED, first.outcome());
        assertEquals(RunOutcome.INGESTED, second.outcome());
        assertNotEquals(first.outputLocation(), second.outputLocation());
        assertEquals(Optional.of(new Watermark(T2)), cursors.loadWatermark());

        List<Path> files = outputFiles();
        assertEquals(2, files.size());
        Set<String> written = new HashSet<>();
        for (Path file : files) {
            written.addAll(trackKeys(file));
        }
        assertEquals(Set.of("a@" + T1, "b@" + T2), written);
    }

    @Test
    @DisplayName("Duplicates from the provider are written once")
    void duplicatesDropped() throws Exception {
        when(tokenProvider.ensureValidToken()).thenReturn("token");
        history.add(item("a", T1));
        history.add(item("a", T1));
        history.add(item("b", T2));
        serveHistory();

        IngestionSummary summary = realOrchestrator(Instant.parse("2025-12-25T09:00:00Z"), realCursorStore()).run();

        assertEquals(3, summary.eventsFetched());
        assertEquals(1, summary.duplicatesDropped());
        assertEquals(2, summary.eventsWritten());
        assertEquals(2, summary.uniqueTracks());
        assertEquals(T1, summary.oldestPlayedAt());
        assertEquals(T2, summary.newestPlayedAt());
    }

    // =========================================================================
    // Step ordering with mocked collaborators
    // =========================================================================

    @Test
    @DisplayName("Watermark is advanced only after the write, with the write's receipt")
    void writeBeforeAdvance() throws Exception {
        when(tokenProvider.ensureValidToken()).thenReturn("token");
        when(cursorStore.loadWatermark()).thenReturn(Optional.of(new Watermark(T0)));
        when(fetcher.fetchSince(new Watermark(T0))).thenReturn(pageStream);
        when(pageStream.next()).thenReturn(
                Optional.of(new FetchedPage(1, List.of(event("b", T2), event("a", T1)), 2, 0)),
                Optional.empty());
        WriteReceipt receipt = WriteReceipts.receipt("raw/x.json", T3, 2, T2);
        when(writer.write(any())).thenReturn(receipt);
        when(cursorStore.advance(receipt)).thenReturn(new Watermark(T2));

        IngestionSummary summary = mockedOrchestrator(null).run();

        assertEquals(RunOutcome.INGESTED, summary.outcome());
        InOrder order = inOrder(tokenProvider, cursorStore, fetcher, writer);
        order.verify(tokenProvider).ensureValidToken();
        order.verify(cursorStore).loadWatermark();
        order.verify(fetcher).fetchSince(new Watermark(T0));
        order.verify(writer).write(any());
        order.verify(cursorStore).advance(receipt);

        ArgumentCaptor<IngestionBatch> batch = ArgumentCaptor.forClass(IngestionBatch.class);
        verify(writer).write(batch.capture());
        assertEquals(List.of(T1, T2), batch.getValue().events().stream().map(PlayEvent::playedAt).toList());
        assertEquals(new Watermark(T0), batch.getValue().sourceWatermark());
        assertEquals(T3, batch.getValue().fetchedAt());
    }

    @Test
    @DisplayName("Failed write leaves the watermark untouched")
    void writeFailure_noAdvance() throws Exception {
        when(tokenProvider.ensureValidToken()).thenReturn("token");
        when(cursorStore.loadWatermark()).thenReturn(Optional.of(new Watermark(T0)));
        when(fetcher.fetchSince(any())).thenReturn(pageStream);
        when(pageStream.next()).thenReturn(
                Optional.of(new FetchedPage(1, List.of(event("a", T1)), 1, 0)), Optional.empty());
        when(writer.write(any())).thenThrow(new StorageWriteFailedException("disk full", new IOException("disk full")));

        IngestionSummary summary = mockedOrchestrator(null).run();

        assertEquals(RunOutcome.RETRY_LATER, summary.outcome());
        assertEquals(1, summary.outcome().exitCode());
        assertEquals(FailureKind.STORAGE_WRITE_FAILED, summary.failureKind());
        verify(cursorStore, never()).advance(any());
    }

    @Test
    @DisplayName("Events at or before the watermark are not written again")
    void alreadyIngested_filtered() throws Exception {
        when(tokenProvider.ensureValidToken()).thenReturn("token");
        when(cursorStore.loadWatermark()).thenReturn(Optional.of(new Watermark(T1)));
        when(fetcher.fetchSince(any())).thenReturn(pageStream);
        when(pageStream.next()).thenReturn(
                Optional.of(new FetchedPage(1, List.of(event("a", T0), event("b", T1)), 2, 0)),
                Optional.empty());

        IngestionSummary summary = mockedOrchestrator(null).run();

        assertEquals(RunOutcome.NO_NEW_EVENTS, summary.outcome());
        assertEquals(2, summary.alreadyIngested());
        verifyNoInteractions(writer);
        verify(cursorStore, never()).advance(any());
    }

    @Test
    @DisplayName("Configured initial watermark is used when nothing is stored")
    void initialWatermark_usedOnFirstRun() throws Exception {
        when(tokenProvider.ensureValidToken()).thenReturn("token");
        when(cursorStore.loadWatermark()).thenReturn(Optional.empty());
        when(fetcher.fetchSince(new Watermark(T0))).thenReturn(pageStream);
        when(pageStream.next()).thenReturn(Optional.empty());

        IngestionSummary summary = mockedOrchestrator(new Watermark(T0)).run();

        assertEquals(RunOutcome.NO_NEW_EVENTS, summary.outcome());
        assertNull(summary.watermarkBefore());
        verify(fetcher).fetchSince(new Watermark(T0));
    }

    // =========================================================================
    // Failure classification
    // =========================================================================

    @Test
    @DisplayName("Unrecoverable auth needs an operator and touches nothing else")
    void authFailure_needsOperator() throws Exception {
        when(tokenProvider.ensureValidToken()).thenThrow(new AuthExpiredUnrecoverableException("revoked"));

        IngestionSummary summary = mockedOrchestrator(null).run();

        assertEquals(RunOutcome.NEEDS_OPERATOR, summary.outcome());
        assertEquals(2, summary.outcome().exitCode());
        assertEquals(FailureKind.AUTH_EXPIRED_UNRECOVERABLE, summary.failureKind());
        verifyNoInteractions(cursorStore, fetcher, writer);
    }

    @Test
    @DisplayName("Unexpected and interrupted failures still log the run summary")
    void unexpectedFailures_logSummary() throws Exception {
        Logger orchestratorLogger = (Logger) LoggerFactory.getLogger(IngestionOrchestrator.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        orchestratorLogger.addAppender(appender);
        try {
            when(tokenProvider.ensureValidToken())
                    .thenThrow(new IllegalStateException("boom"))
                    .thenReturn("token");
            when(cursorStore.loadWatermark()).thenReturn(Optional.empty());
            when(fetcher.fetchSince(any())).thenReturn(pageStream);
            when(pageStream.next()).thenThrow(new InterruptedException());

            IngestionSummary crashed = mockedOrchestrator(null).run();
            IngestionSummary interrupted = mockedOrchestrator(null).run();
            assertTrue(Thread.interrupted());

            assertEquals(RunOutcome.RETRY_LATER, crashed.outcome());
            assertEquals("boom", crashed.errorMessage());
            assertEquals(RunOutcome.RETRY_LATER, interrupted.outcome());
            long summaryBlocks = appender.list.stream()
                    .filter(e -> e.getFormattedMessage().equals("=== Ingestion Summary ==="))
                    .count();
            assertEquals(2, summaryBlocks);
        } finally {
            orchestratorLogger.detachAppender(appender);
        }
    }

    @Test
    @DisplayName("Unreadable watermark is a retry-later failure without fetching")
    void cursorReadFailure_retryLater() throws Exception {
        when(tokenProvider.ensureValidToken()).thenReturn("token");
        when(cursorStore.loadWatermark()).thenThrow(new IOException("bucket unreachable"));

        IngestionSummary summary = mockedOrchestrator(null).run();

        assertEquals(RunOutcome.RETRY_LATER, summary.outcome());
        assertEquals(FailureKind.TRANSIENT_NETWORK, summary.failureKind());
        verifyNoInteractions(fetcher, writer);
    }

    @Test
    @DisplayName("Rate limiting mid-pagination writes nothing")
    void rateLimited_midPagination() throws Exception {
        when(tokenProvider.ensureValidToken()).thenReturn("token");
        when(cursorStore.loadWatermark()).thenReturn(Optional.of(new Watermark(T0)));
        when(fetcher.fetchSince(any())).thenReturn(pageStream);
        when(pageStream.next())
                .thenReturn(Optional.of(new FetchedPage(1, List.of(event("a", T1)), 1, 0)))
                .thenThrow(new RateLimitedException("slow down", Duration.ofSeconds(30), null));

        IngestionSummary summary = mockedOrchestrator(null).run();

        assertEquals(RunOutcome.RETRY_LATER, summary.outcome());
        assertEquals(FailureKind.RATE_LIMITED, summary.failureKind());
        verifyNoInteractions(writer);
        verify(cursorStore, never()).advance(any());
    }

    // =========================================================================
    // Dedup helpers
    // =========================================================================

    @Test
    @DisplayName("Deduplication keeps the first occurrence in provider order")
    void deduplicate_keepsFirst() {
        PlayEvent first = new PlayEvent(T1, "a", "first", "ar", "Artist", "al", "Album", null, 1000, null);
        PlayEvent second = new PlayEvent(T1, "a", "second", "ar", "Artist", "al", "Album", null, 1000, null);
        PlayEvent other = event("b", T1);

        List<PlayEvent> unique = IngestionOrchestrator.deduplicate(List.of(first, other, second));

        assertEquals(List.of(first, other), unique);
    }

    @Test
    @DisplayName("Sorting is by played_at ascending and stable for ties")
    void sortByPlayedAt_stable() {
        PlayEvent late = event("z", T2);
        PlayEvent tieA = event("a", T1);
        PlayEvent tieB = event("b", T1);

        assertEquals(List.of(tieA, tieB, late), IngestionOrchestrator.sortByPlayedAt(List.of(late, tieA, tieB)));
    }
}
