package com.musicapi.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Track(
        String id,
        String name,
        String uri,
        @JsonProperty("duration_ms") int durationMs,
        Integer popularity,
        SimpleAlbum album,
        List<Artist> artists
) {
    @JsonCreator
    public Track(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("uri") String uri,
            @JsonProperty("duration_ms") int durationMs,
            @JsonProperty("popularity") Integer popularity,
            @JsonProperty("album") SimpleAlbum album,
            @JsonProperty("artists") List<Artist> artists
    ) {
        this.id = id;
        this.name = name;
        this.uri = uri;
        this.durationMs = durationMs;
        this.popularity = popularity;
        this.album = album;
        this.artists = artists != null ? List.copyOf(artists) : List.of();
    }
}
