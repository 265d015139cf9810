package com.musicapi.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Wire shape shared by offset-based and cursor-based paging objects.
 * Decoded once per response and then wrapped into a {@link Page} or {@link CursorPage}.
 *
 * <p>Null entries in {@code items} are dropped. The service sends them in place of
 * items it can no longer resolve, such as deleted playlists.
 *
 * @param <T> the type of items in the page
 */
public record PagingPayload<T>(
        String href,
        List<T> items,
        int limit,
        String next,
        int offset,
        String previous,
        int total,
        Cursor cursors
) {
    @JsonCreator
    public PagingPayload(
            @JsonProperty("href") String href,
            @JsonProperty("items") List<T> items,
            @JsonProperty("limit") int limit,
            @JsonProperty("next") String next,
            @JsonProperty("offset") int offset,
            @JsonProperty("previous") String previous,
            @JsonProperty("total") int total,
            @JsonProperty("cursors") Cursor cursors
    ) {
        this.href = href;
        this.items = items != null
                ? items.stream().filter(Objects::nonNull).collect(Collectors.toUnmodifiableList())
                : List.of();
        this.limit = limit;
        this.next = next;
        this.offset = offset;
        this.previous = previous;
        this.total = total;
        this.cursors = cursors;
    }
}
