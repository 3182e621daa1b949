package com.listenpulse.ingestor.state;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.listenpulse.ingestor.config.ObjectMappers;
import com.listenpulse.ingestor.model.Watermark;
import com.listenpulse.ingestor.storage.ObjectStore;
import com.listenpulse.ingestor.writer.WriteReceipt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Keeps the watermark as a small JSON document in the {@link ObjectStore}.
 *
 * Path format:
 *   state/last_run_state.json
 */
public class ObjectStoreCursorStore implements CursorStore {

    private static final Logger logger = LoggerFactory.getLogger(ObjectStoreCursorStore.class);

    public static final String DEFAULT_KEY = "state/last_run_state.json";

    private final ObjectStore objectStore;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String key;

    public ObjectStoreCursorStore(ObjectStore objectStore, Clock clock) {
        this(objectStore, clock, DEFAULT_KEY);
    }

    public ObjectStoreCursorStore(ObjectStore objectStore, Clock clock, String key) {
        this.objectStore = objectStore;
        this.clock = clock;
        this.key = key;
        this.objectMapper = ObjectMappers.create();
    }

    @Override
    public Optional<Watermark> loadWatermark() throws IOException {
        Optional<byte[]> content = objectStore.get(key);
        if (content.isEmpty()) {
            logger.info("No previous state found at {} - this is the first run", objectStore.describe(key));
            return Optional.empty();
        }

        StateDocument state = objectMapper.readValue(content.get(), StateDocument.class);
        if (state.lastProcessedTimestamp() == null) {
            throw new IOException("State at " + objectStore.describe(key) + " has no last_processed_timestamp");
        }

        Watermark watermark = new Watermark(Instant.ofEpochMilli(state.lastProcessedTimestamp()));
        logger.info("Loaded state: last_processed_at={}", watermark.lastPlayedAt());
        return Optional.of(watermark);
    }

    @Override
    public Watermark advance(WriteReceipt receipt) throws IOException {
        Watermark watermark = new Watermark(receipt.maxPlayedAt());
        StateDocument state = new StateDocument(
                watermark.afterParam(),
                watermark.lastPlayedAt(),
                clock.instant(),
                receipt.key());

        objectStore.put(key, objectMapper.writeValueAsBytes(state), "application/json");
        logger.info("Saved state to {}: last_processed_at={}", objectStore.describe(key), watermark.lastPlayedAt());
        return watermark;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record StateDocument(
            @JsonProperty("last_processed_timestamp") Long lastProcessedTimestamp,
            @JsonProperty("last_processed_at") Instant lastProcessedAt,
            @JsonProperty("updated_at") Instant updatedAt,
            @JsonProperty("last_output_key") String lastOutputKey
    ) {}
}
