package com.musicapi.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SavedAlbum(
        @JsonProperty("added_at") String addedAt,
        SimpleAlbum album
) {
    @JsonCreator
    public SavedAlbum(
            @JsonProperty("added_at") String addedAt,
            @JsonProperty("album") SimpleAlbum album
    ) {
        this.addedAt = addedAt;
        this.album = album;
    }
}
