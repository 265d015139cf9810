package com.musicapi.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One play of a track, as returned by the recently played history.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlayHistory(
        Track track,
        @JsonProperty("played_at") String playedAt
) {
    @JsonCreator
    public PlayHistory(
            @JsonProperty("track") Track track,
            @JsonProperty("played_at") String playedAt
    ) {
        this.track = track;
        this.playedAt = playedAt;
    }
}
