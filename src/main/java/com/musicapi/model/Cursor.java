package com.musicapi.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Opaque keys the service uses to locate the pages around a cursor-based page.
 *
 * @param before key of the page before this one, may be null
 * @param after key of the page after this one, may be null
 */
public record Cursor(String before, String after) {

    public static final Cursor EMPTY = new Cursor(null, null);

    @JsonCreator
    public Cursor(
            @JsonProperty("before") String before,
            @JsonProperty("after") String after
    ) {
        this.before = before;
        this.after = after;
    }
}
