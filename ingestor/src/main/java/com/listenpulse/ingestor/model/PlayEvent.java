package com.listenpulse.ingestor.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * One normalized listening event. Serialized field names are the column names
 * the downstream staging model reads from the raw files.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlayEvent(
        @JsonProperty("played_at") Instant playedAt,
        @JsonProperty("track_id") String trackId,
        @JsonProperty("track_name") String trackName,
        @JsonProperty("artist_id") String artistId,
        @JsonProperty("artist_name") String artistName,
        @JsonProperty("album_id") String albumId,
        @JsonProperty("album_name") String albumName,
        @JsonProperty("release_date") String releaseDate,
        @JsonProperty("duration_ms") int durationMs,
        @JsonProperty("popularity") Integer popularity
) {

    public PlayEvent {
        Objects.requireNonNull(playedAt, "playedAt");
        Objects.requireNonNull(trackId, "trackId");
    }

    @JsonProperty("played_at_timestamp")
    public long playedAtTimestamp() {
        return playedAt.toEpochMilli();
    }

    @JsonIgnore
    public PlayKey key() {
        return new PlayKey(trackId, playedAt);
    }
}
