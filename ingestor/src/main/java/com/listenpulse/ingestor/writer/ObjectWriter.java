package com.listenpulse.ingestor.writer;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.listenpulse.ingestor.config.ObjectMappers;
import com.listenpulse.ingestor.error.StorageWriteFailedException;
import com.listenpulse.ingestor.model.IngestionBatch;
import com.listenpulse.ingestor.model.PlayEvent;
import com.listenpulse.ingestor.storage.ObjectStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

/**
 * Writes one batch as a single JSON document under a date-partitioned key.
 * The document is only visible once fully written (see {@link ObjectStore#put}),
 * and failed writes are retried a bounded number of times before the batch is
 * given up. An existing data file is never replaced: if the key for the fetch
 * instant is taken, the next free sequence-suffixed key is used.
 */
public class ObjectWriter {

    private static final Logger logger = LoggerFactory.getLogger(ObjectWriter.class);

    static final int MAX_ATTEMPTS = 3;
    static final int MAX_KEY_SEQUENCE = 100;
    private static final long INITIAL_BACKOFF_MS = 500;

    private final ObjectStore objectStore;
    private final ObjectMapper objectMapper;
    private final String prefix;
    private final long initialBackoffMs;

    public ObjectWriter(ObjectStore objectStore) {
        this(objectStore, PartitionPaths.DEFAULT_PREFIX, INITIAL_BACKOFF_MS);
    }

    public ObjectWriter(ObjectStore objectStore, String prefix, long initialBackoffMs) {
        this.objectStore = objectStore;
        this.prefix = prefix;
        this.initialBackoffMs = initialBackoffMs;
        this.objectMapper = ObjectMappers.create();
    }

    /**
     * Serializes and stores the batch.
     *
     * @return receipt for the stored batch, required to advance the watermark
     * @throws StorageWriteFailedException when every attempt failed; nothing is visible at the key
     */
    public WriteReceipt write(IngestionBatch batch) throws StorageWriteFailedException, InterruptedException {
        if (batch.isEmpty()) {
            throw new IllegalArgumentException("Refusing to write an empty batch");
        }

        String key = freeKey(batch.fetchedAt());
        byte[] payload;
        try {
            payload = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(toDocument(batch));
        } catch (IOException e) {
            throw new StorageWriteFailedException("Could not serialize batch for " + key, e);
        }

        long backoffMs = initialBackoffMs;
        IOException lastFailure = null;

        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            try {
                objectStore.put(key, payload, "application/json");
                logger.info("Saved {} tracks to {}", batch.size(), objectStore.describe(key));
                return new WriteReceipt(key, objectStore.describe(key), batch.fetchedAt(), batch.size(),
                        batch.maxPlayedAt().orElseThrow());
            } catch (IOException e) {
                lastFailure = e;
                if (attempt < MAX_ATTEMPTS) {
                    logger.warn("Write to {} failed: {}. Retrying in {}ms (attempt {}/{})",
                            objectStore.describe(key), e.getMessage(), backoffMs, attempt, MAX_ATTEMPTS);
                    Thread.sleep(backoffMs);
                    backoffMs *= 2;
                }
            }
        }

        throw new StorageWriteFailedException("Failed to write batch to " + objectStore.describe(key)
                + " after " + MAX_ATTEMPTS + " attempts", lastFailure);
    }

    private String freeKey(Instant fetchedAt) throws StorageWriteFailedException {
        for (int sequence = 0; sequence <= MAX_KEY_SEQUENCE; sequence++) {
            String key = PartitionPaths.objectKey(prefix, fetchedAt, sequence);
            try {
                if (!objectStore.exists(key)) {
                    return key;
                }
            } catch (IOException e) {
                throw new StorageWriteFailedException("Could not check " + objectStore.describe(key), e);
            }
            logger.warn("{} already exists, trying the next key", objectStore.describe(key));
        }
        throw new StorageWriteFailedException("No free output key for fetch instant " + fetchedAt
                + " after " + MAX_KEY_SEQUENCE + " suffixes", null);
    }

    static BatchDocument toDocument(IngestionBatch batch) {
        return new BatchDocument(
                batch.fetchedAt(),
                batch.size(),
                batch.sourceWatermark() != null ? batch.sourceWatermark().lastPlayedAt() : null,
                batch.events());
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record BatchDocument(
            @JsonProperty("fetched_at") Instant fetchedAt,
            @JsonProperty("track_count") int trackCount,
            @JsonProperty("source_watermark") Instant sourceWatermark,
            @JsonProperty("tracks") List<PlayEvent> tracks
    ) {}
}
