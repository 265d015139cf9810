package com.musicapi.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SimpleAlbum(
        String id,
        String name,
        String uri,
        @JsonProperty("album_type") String albumType,
        @JsonProperty("release_date") String releaseDate,
        @JsonProperty("total_tracks") Integer totalTracks
) {
    @JsonCreator
    public SimpleAlbum(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("uri") String uri,
            @JsonProperty("album_type") String albumType,
            @JsonProperty("release_date") String releaseDate,
            @JsonProperty("total_tracks") Integer totalTracks
    ) {
        this.id = id;
        this.name = name;
        this.uri = uri;
        this.albumType = albumType;
        this.releaseDate = releaseDate;
        this.totalTracks = totalTracks;
    }
}
