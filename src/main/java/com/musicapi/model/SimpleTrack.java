package com.musicapi.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Track as listed inside an album, without album or popularity data.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SimpleTrack(
        String id,
        String name,
        String uri,
        @JsonProperty("duration_ms") int durationMs,
        @JsonProperty("track_number") int trackNumber,
        boolean explicit
) {
    @JsonCreator
    public SimpleTrack(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("uri") String uri,
            @JsonProperty("duration_ms") int durationMs,
            @JsonProperty("track_number") int trackNumber,
            @JsonProperty("explicit") boolean explicit
    ) {
        this.id = id;
        this.name = name;
        this.uri = uri;
        this.durationMs = durationMs;
        this.trackNumber = trackNumber;
        this.explicit = explicit;
    }
}
