package com.musicapi.streaming.spliterator;

import com.musicapi.model.AbstractPage;

import java.util.Iterator;
import java.util.Spliterator;
import java.util.function.Consumer;

/**
 * A Spliterator that lazily fetches pages and streams their individual items.
 *
 * <p>Pages are only fetched when the current one runs out of items, and only one
 * page is held at a time.
 *
 * @param <T> the type of items in each page
 */
public class PaginatedSpliterator<T> implements Spliterator<T> {

    private final Iterator<? extends AbstractPage<T, ?>> pages;
    private Iterator<T> currentPageIterator;

    /**
     * Creates a new PaginatedSpliterator.
     *
     * @param pages the pages to stream items from, fetched as they are advanced to
     */
    public PaginatedSpliterator(Iterator<? extends AbstractPage<T, ?>> pages) {
        this.pages = pages;
    }

    @Override
    public boolean tryAdvance(Consumer<? super T> action) {
        while (!hasCurrentItem()) {
            if (!pages.hasNext()) {
                return false;
            }
            currentPageIterator = pages.next().iterator();
        }

        action.accept(currentPageIterator.next());
        return true;
    }

    private boolean hasCurrentItem() {
        return currentPageIterator != null && currentPageIterator.hasNext();
    }

    /**
     * Returns null: the next page's link is only known once the current page is
     * fetched, so the work cannot be split.
     */
    @Override
    public Spliterator<T> trySplit() {
        return null;
    }

    /**
     * Returns MAX_VALUE: item counts reported by the service are not authoritative.
     */
    @Override
    public long estimateSize() {
        return Long.MAX_VALUE;
    }

    @Override
    public int characteristics() {
        return ORDERED | IMMUTABLE;
    }
}
