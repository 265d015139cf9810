package com.musicapi.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Track in the user's library, with the time it was saved.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SavedTrack(
        @JsonProperty("added_at") String addedAt,
        Track track
) {
    @JsonCreator
    public SavedTrack(
            @JsonProperty("added_at") String addedAt,
            @JsonProperty("track") Track track
    ) {
        this.addedAt = addedAt;
        this.track = track;
    }
}
