package com.musicapi.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Artist object. Simplified artist objects nested in tracks and albums carry
 * no genres or popularity; those fields are then empty and null.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Artist(
        String id,
        String name,
        String uri,
        List<String> genres,
        Integer popularity
) {
    @JsonCreator
    public Artist(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("uri") String uri,
            @JsonProperty("genres") List<String> genres,
            @JsonProperty("popularity") Integer popularity
    ) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.name = name;
        this.uri = uri;
        this.genres = genres != null ? List.copyOf(genres) : List.of();
        this.popularity = popularity;
    }
}
