package com.listenpulse.ingestor.orchestrator;

import com.listenpulse.ingestor.auth.AuthManager;
import com.listenpulse.ingestor.auth.ObjectStoreCredentialStore;
import com.listenpulse.ingestor.client.SpotifyAccountsClient;
import com.listenpulse.ingestor.client.SpotifyApiClient;
import com.listenpulse.ingestor.config.AppConfig;
import com.listenpulse.ingestor.fetcher.EventFetcher;
import com.listenpulse.ingestor.model.Watermark;
import com.listenpulse.ingestor.state.ObjectStoreCursorStore;
import com.listenpulse.ingestor.storage.LocalObjectStore;
import com.listenpulse.ingestor.storage.ObjectStore;
import com.listenpulse.ingestor.storage.S3ObjectStore;
import com.listenpulse.ingestor.writer.ObjectWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Main entry point for the ListenPulse ingestor. Wires the components from
 * configuration, runs one ingestion and exits with the run's status code.
 *
 * <p>Exit codes:
 * <pre>
 *   0  new events ingested, or nothing new
 *   1  transient failure or bad configuration; the next scheduled run retries
 *   2  credentials need operator action (authorization or a new refresh token)
 * </pre>
 */
public class IngestorApp {

    private static final Logger logger = LoggerFactory.getLogger(IngestorApp.class);

    public static void main(String[] args) {
        logger.info("Starting ListenPulse Ingestor");

        try {
            AppConfig config = new AppConfig();
            IngestionOrchestrator orchestrator = createOrchestrator(config, Clock.systemUTC());
            IngestionSummary summary = orchestrator.run();

            printSummary(summary);

            if (summary.hasFailure()) {
                logger.warn("Ingestion did not complete: {}", summary.outcome());
            } else {
                logger.info("ListenPulse Ingestor finished successfully.");
            }
            System.exit(summary.outcome().exitCode());

        } catch (Exception e) {
            logger.error("Fatal error during ingestion", e);
            System.exit(1);
        }
    }

    static IngestionOrchestrator createOrchestrator(AppConfig config, Clock clock) {
        ObjectStore objectStore = createObjectStore(config);

        SpotifyAccountsClient accountsClient = new SpotifyAccountsClient(
                config.getSpotifyClientId(), config.getSpotifyClientSecret(), config.getSpotifyRedirectUri());
        AuthManager authManager = new AuthManager(new ObjectStoreCredentialStore(objectStore), accountsClient,
                clock, config.getAuthorizationCode(), config.getBootstrapRefreshToken());

        EventFetcher fetcher = new EventFetcher(new SpotifyApiClient(), authManager, config.getMaxPages());
        Watermark initialWatermark = config.getInitialWatermark() != null
                ? new Watermark(config.getInitialWatermark())
                : null;

        return new IngestionOrchestrator(authManager, new ObjectStoreCursorStore(objectStore, clock),
                fetcher, new ObjectWriter(objectStore), clock, initialWatermark);
    }

    static ObjectStore createObjectStore(AppConfig config) {
        if (AppConfig.BACKEND_LOCAL.equals(config.getStorageBackend())) {
            logger.info("Using local storage under {}", config.getLocalDataDir());
            return new LocalObjectStore(Path.of(config.getLocalDataDir()));
        }
        logger.info("Using S3 bucket {}", config.getS3Bucket());
        return new S3ObjectStore(config.getS3Bucket(), config.getAwsRegion());
    }

    private static void printSummary(IngestionSummary summary) {
        System.out.println();
        System.out.println("=== ListenPulse Ingestion Summary ===");
        System.out.println("Outcome:  " + summary.outcome() + " (exit " + summary.outcome().exitCode() + ")");
        System.out.println("Duration: " + summary.totalDurationMs() + "ms");

        System.out.println();
        System.out.printf("  %-18s %d%n", "pages", summary.pagesFetched());
        System.out.printf("  %-18s %d%n", "fetched", summary.eventsFetched());
        System.out.printf("  %-18s %d%n", "already ingested", summary.alreadyIngested());
        System.out.printf("  %-18s %d%n", "duplicates", summary.duplicatesDropped());
        System.out.printf("  %-18s %d%n", "malformed", summary.malformedDropped());
        System.out.printf("  %-18s %d%n", "written", summary.eventsWritten());

        if (summary.eventsWritten() > 0) {
            System.out.println();
            System.out.println("Unique tracks:  " + summary.uniqueTracks());
            System.out.println("Unique artists: " + summary.uniqueArtists());
            System.out.println("Time range:     " + summary.oldestPlayedAt() + " to " + summary.newestPlayedAt());
            System.out.println("Output:         " + summary.outputLocation());
        }

        if (summary.hasFailure()) {
            System.out.println();
            System.out.println("Failure:");
            System.out.println("  - " + summary.failureKind() + ": " + summary.errorMessage());
        }
        System.out.println();
    }
}
