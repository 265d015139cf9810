package com.musicapi.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Static helpers over sequences of pages.
 */
public final class Pages {

    private Pages() {
    }

    /**
     * Concatenates the items of every page in encounter order. Items are not
     * de-duplicated.
     *
     * @param pages pages, typically from {@link AbstractPage#collectAll()} or
     *              {@link AbstractPage#collectForward(int)}
     * @return all items, in page order then item order
     */
    public static <T> List<T> flattenItems(List<? extends List<T>> pages) {
        List<T> items = new ArrayList<>();
        for (List<T> page : pages) {
            items.addAll(page);
        }
        return Collections.unmodifiableList(items);
    }
}
