package com.musicapi.iterable.iterator;

import com.musicapi.model.AbstractPage;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * An Iterator over the individual items of a sequence of lazily fetched pages.
 *
 * <p>Only the page currently being consumed is held; the next one is fetched when
 * its predecessor runs out of items. Empty pages in the middle of a result set are
 * skipped.
 *
 * <p><b>Thread Safety:</b> This class is NOT thread-safe. It must be used from a single thread.
 *
 * @param <T> the type of items in each page
 */
public class PaginatedItemIterator<T> implements Iterator<T> {

    private final Iterator<? extends AbstractPage<T, ?>> pages;
    private Iterator<T> currentPageIterator;

    /**
     * Creates a new PaginatedItemIterator.
     *
     * @param pages the pages to read items from, typically a {@link PageIterator}
     */
    public PaginatedItemIterator(Iterator<? extends AbstractPage<T, ?>> pages) {
        this.pages = pages;
    }

    @Override
    public boolean hasNext() {
        while (!hasCurrentItem()) {
            if (!pages.hasNext()) {
                return false;
            }
            currentPageIterator = pages.next().iterator();
        }
        return true;
    }

    @Override
    public T next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more items available");
        }
        return currentPageIterator.next();
    }

    private boolean hasCurrentItem() {
        return currentPageIterator != null && currentPageIterator.hasNext();
    }
}
