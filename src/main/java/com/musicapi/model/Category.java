package com.musicapi.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Browse category used to tag items in the catalog.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Category(
        String id,
        String name,
        String href
) {
    @JsonCreator
    public Category(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("href") String href
    ) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.name = name;
        this.href = href;
    }
}
