package com.listenpulse.ingestor.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Envelope of GET /v1/me/player/recently-played.
 *
 * <p>Items stay as raw JSON so that a single malformed item can be dropped
 * without failing the whole page.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RecentlyPlayedResponse(
        @JsonProperty("items") List<JsonNode> items,
        @JsonProperty("next") String next,
        @JsonProperty("cursors") Cursors cursors,
        @JsonProperty("limit") Integer limit
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Cursors(
            @JsonProperty("after") String after,
            @JsonProperty("before") String before
    ) {}

    public List<JsonNode> itemsOrEmpty() {
        return items != null ? items : List.of();
    }
}
