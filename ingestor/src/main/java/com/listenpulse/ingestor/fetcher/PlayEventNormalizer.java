package com.listenpulse.ingestor.fetcher;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.listenpulse.ingestor.model.PlayEvent;
import com.listenpulse.ingestor.model.PlayHistoryItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Turns a raw recently-played item into a {@link PlayEvent}. Items missing any
 * identity or required field (local files have no track id, for instance) are
 * rejected rather than half-filled. Popularity and release date may be absent.
 */
public class PlayEventNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(PlayEventNormalizer.class);

    private final ObjectMapper objectMapper;

    public PlayEventNormalizer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Optional<PlayEvent> normalize(JsonNode rawItem) {
        PlayHistoryItem item;
        try {
            item = objectMapper.treeToValue(rawItem, PlayHistoryItem.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return reject("unreadable item: " + e.getMessage());
        }

        if (item == null) return reject("null item");
        Instant playedAt = parsePlayedAt(item.playedAt());
        if (playedAt == null) return reject("missing or invalid played_at: " + item.playedAt());

        PlayHistoryItem.Track track = item.track();
        if (track == null) return reject("missing track at " + playedAt);
        if (isBlank(track.id())) return reject("track without id at " + playedAt);
        if (track.name() == null) return reject("track " + track.id() + " without name");
        if (track.durationMs() == null) return reject("track " + track.id() + " without duration_ms");
        if (track.artists() == null || track.artists().isEmpty() || track.artists().get(0) == null
                || isBlank(track.artists().get(0).id())) {
            return reject("track " + track.id() + " without primary artist");
        }
        if (track.album() == null || isBlank(track.album().id())) {
            return reject("track " + track.id() + " without album");
        }

        PlayHistoryItem.Artist artist = track.artists().get(0);
        PlayHistoryItem.Album album = track.album();
        return Optional.of(new PlayEvent(
                playedAt,
                track.id(),
                track.name(),
                artist.id(),
                artist.name(),
                album.id(),
                album.name(),
                album.releaseDate(),
                track.durationMs(),
                track.popularity()));
    }

    private static Instant parsePlayedAt(String value) {
        if (isBlank(value)) {
            return null;
        }
        try {
            return Instant.parse(value).truncatedTo(ChronoUnit.MILLIS);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static Optional<PlayEvent> reject(String reason) {
        logger.warn("Dropping malformed record: {}", reason);
        return Optional.empty();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
