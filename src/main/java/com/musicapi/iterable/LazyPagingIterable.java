package com.musicapi.iterable;

import com.musicapi.iterable.iterator.PaginatedItemIterator;
import com.musicapi.model.AbstractPage;

import java.util.Iterator;

/**
 * A lazy Iterable over the items of a page and every page after it.
 *
 * <p><b>Reusability:</b> This Iterable can be iterated multiple times. Each call to
 * {@link #iterator()} starts again from the start page and fetches the following
 * pages afresh, so every iteration makes its own requests.
 *
 * <p>Example usage:
 * <pre>{@code
 * Page<SavedTrack> first = api.library().getSavedTracks(50, 0, null);
 *
 * for (SavedTrack saved : LazyPagingIterable.of(first)) {
 *     process(saved);
 *     if (shouldStop(saved)) {
 *         break; // no further pages are fetched
 *     }
 * }
 * }</pre>
 *
 * @param <T> the type of items in each page
 */
public class LazyPagingIterable<T> implements Iterable<T> {

    private final AbstractPage<T, ?> start;

    /**
     * Creates a new LazyPagingIterable.
     *
     * @param start the first page; its items come first
     */
    public LazyPagingIterable(AbstractPage<T, ?> start) {
        this.start = start;
    }

    public static <T> LazyPagingIterable<T> of(AbstractPage<T, ?> start) {
        return new LazyPagingIterable<>(start);
    }

    /**
     * Returns a fresh iterator that starts from the start page.
     *
     * @return a new iterator
     */
    @Override
    public Iterator<T> iterator() {
        return new PaginatedItemIterator<>(start.pagesForward().iterator());
    }
}
