package com.listenpulse.ingestor.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Data transfer object for one entry of the recently-played feed.
 * Maps from the nested provider payload: item -> track -> artists[] / album.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlayHistoryItem(
        @JsonProperty("played_at") String playedAt,
        @JsonProperty("track") Track track
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Track(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("duration_ms") Integer durationMs,
            @JsonProperty("popularity") Integer popularity,
            @JsonProperty("artists") List<Artist> artists,
            @JsonProperty("album") Album album
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Artist(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Album(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("release_date") String releaseDate
    ) {}
}
