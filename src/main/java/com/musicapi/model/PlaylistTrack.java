package com.musicapi.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Entry of a playlist. Local files have {@code local == true} and a track without id.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlaylistTrack(
        @JsonProperty("added_at") String addedAt,
        @JsonProperty("is_local") boolean local,
        Track track
) {
    @JsonCreator
    public PlaylistTrack(
            @JsonProperty("added_at") String addedAt,
            @JsonProperty("is_local") boolean local,
            @JsonProperty("track") Track track
    ) {
        this.addedAt = addedAt;
        this.local = local;
        this.track = track;
    }
}
