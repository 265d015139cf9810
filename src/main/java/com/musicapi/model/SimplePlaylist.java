package com.musicapi.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SimplePlaylist(
        String id,
        String name,
        String uri,
        boolean collaborative,
        @JsonProperty("public") Boolean isPublic
) {
    @JsonCreator
    public SimplePlaylist(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("uri") String uri,
            @JsonProperty("collaborative") boolean collaborative,
            @JsonProperty("public") Boolean isPublic
    ) {
        this.id = id;
        this.name = name;
        this.uri = uri;
        this.collaborative = collaborative;
        this.isPublic = isPublic;
    }
}
