package com.musicapi.model;

import com.musicapi.iterable.iterator.PageIterator;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.ListIterator;
import java.util.Objects;
import java.util.Optional;
import java.util.RandomAccess;
import java.util.Set;

/**
 * One fetched slice of a larger ordered result set.
 *
 * <p>A page is a read-only {@link List} of its items: {@code size}, {@code get},
 * {@code contains}, {@code subList} and iteration all delegate to {@link #items()}.
 * It is immutable and knows how to reach its neighbours: each step issues exactly
 * one request against the link the service returned, and produces a new page bound
 * to the same {@link ItemKind} and {@link PageRequester}.
 *
 * <p>Example usage:
 * <pre>{@code
 * Page<SavedTrack> first = api.library().getSavedTracks(50, 0, null);
 *
 * // Lazily walk forward, one request per page
 * for (Page<SavedTrack> page : first.pagesForward()) {
 *     page.forEach(this::process);
 * }
 *
 * // Or materialise every page of the result set
 * List<SavedTrack> all = first.getAllItems();
 * }</pre>
 *
 * <p>Walks stop at a page whose href, or whose link, was already visited. Some endpoints
 * return a link back to the same page at the end of a collection; such a page is never
 * counted twice and never loops.
 *
 * @param <T> the type of items in the page
 * @param <P> the concrete page type returned by traversal
 */
public abstract class AbstractPage<T, P extends AbstractPage<T, P>> extends AbstractList<T>
        implements RandomAccess {

    private final String href;
    private final List<T> items;
    private final int limit;
    private final String nextUrl;
    private final int total;
    private final ItemKind itemKind;
    private final PageRequester requester;

    protected AbstractPage(
            String href,
            List<T> items,
            int limit,
            String nextUrl,
            int total,
            ItemKind itemKind,
            PageRequester requester
    ) {
        this.itemKind = Objects.requireNonNull(itemKind, "itemKind");
        this.requester = Objects.requireNonNull(requester, "requester");
        this.href = href;
        this.items = items != null ? List.copyOf(items) : List.of();
        this.limit = limit;
        this.nextUrl = nextUrl;
        this.total = total;
    }

    /**
     * Returns the canonical URL of the request that produced this page.
     */
    public String href() {
        return href;
    }

    public List<T> items() {
        return items;
    }

    /**
     * Returns the maximum number of items the service was asked for.
     */
    public int limit() {
        return limit;
    }

    /**
     * Returns the total number of items available, as reported by the service.
     */
    public int total() {
        return total;
    }

    /**
     * Returns the link to the following page, or null on the last page.
     */
    public String nextUrl() {
        return nextUrl;
    }

    public ItemKind itemKind() {
        return itemKind;
    }

    public PageRequester requester() {
        return requester;
    }

    public boolean hasNextPage() {
        return nextUrl != null;
    }

    /**
     * Fetches the following page.
     *
     * @return the next page, or empty without any request when this is the last page
     */
    public Optional<P> getNext() {
        return traverse(TraversalDirection.FORWARDS);
    }

    /**
     * Fetches the preceding page.
     *
     * @return the previous page, or empty without any request when this is the first page
     */
    public Optional<P> getPrevious() {
        return traverse(TraversalDirection.BACKWARDS);
    }

    /**
     * Takes one step in the given direction, issuing at most one request.
     */
    public Optional<P> traverse(TraversalDirection direction) {
        String url = link(direction);
        if (url == null) {
            return Optional.empty();
        }
        return Optional.of(fetch(url));
    }

    /**
     * Returns the link for a step in the given direction, or null when there is none.
     */
    public abstract String link(TraversalDirection direction);

    /**
     * Whether this paging style can be walked backwards at all.
     */
    public abstract boolean supportsBackwardTraversal();

    /**
     * Fetches and decodes the page behind {@code url} with this page's item kind.
     */
    protected abstract P fetch(String url);

    protected abstract P self();

    /**
     * Returns a lazy view of this page followed by every page after it.
     * Each iteration starts again from this page and issues its own requests.
     */
    public Iterable<P> pagesForward() {
        return () -> new PageIterator<>(self(), TraversalDirection.FORWARDS, true);
    }

    /**
     * Collects this page and up to {@code maxCount - 1} following pages.
     *
     * @param maxCount the maximum number of pages to return, this page included
     * @return the pages in traversal order, this page first
     * @throws IllegalArgumentException if {@code maxCount < 1}
     */
    public List<P> collectForward(int maxCount) {
        if (maxCount < 1) {
            throw new IllegalArgumentException("maxCount must be at least 1: " + maxCount);
        }
        List<P> pages = new ArrayList<>();
        Iterator<P> iterator = new PageIterator<>(self(), TraversalDirection.FORWARDS, true);
        while (pages.size() < maxCount && iterator.hasNext()) {
            pages.add(iterator.next());
        }
        return Collections.unmodifiableList(pages);
    }

    /**
     * Collects this page and every page after it.
     */
    public List<P> collectForward() {
        List<P> pages = new ArrayList<>();
        new PageIterator<>(self(), TraversalDirection.FORWARDS, true).forEachRemaining(pages::add);
        return Collections.unmodifiableList(pages);
    }

    /**
     * Collects every page of the result set in order: the pages before this one,
     * this page, then the pages after it. Paging styles without a backward
     * direction start at this page.
     */
    public List<P> collectAll() {
        Set<String> visited = new HashSet<>();
        List<P> pages = new ArrayList<>();

        if (supportsBackwardTraversal()) {
            new PageIterator<>(self(), TraversalDirection.BACKWARDS, false, visited)
                    .forEachRemaining(pages::add);
            // closest to this page first
            Collections.reverse(pages);
        }

        pages.add(self());
        new PageIterator<>(self(), TraversalDirection.FORWARDS, false, visited)
                .forEachRemaining(pages::add);
        return Collections.unmodifiableList(pages);
    }

    /**
     * Returns the items of every page of the result set, in order.
     */
    public List<T> getAllItems() {
        return Pages.flattenItems(collectAll());
    }

    // List view

    @Override
    public T get(int index) {
        return items.get(index);
    }

    @Override
    public int size() {
        return items.size();
    }

    @Override
    public boolean isEmpty() {
        return items.isEmpty();
    }

    @Override
    public boolean contains(Object o) {
        return items.contains(o);
    }

    @Override
    public int indexOf(Object o) {
        return items.indexOf(o);
    }

    @Override
    public int lastIndexOf(Object o) {
        return items.lastIndexOf(o);
    }

    @Override
    public Iterator<T> iterator() {
        return items.iterator();
    }

    @Override
    public ListIterator<T> listIterator(int index) {
        return items.listIterator(index);
    }

    @Override
    public List<T> subList(int fromIndex, int toIndex) {
        return items.subList(fromIndex, toIndex);
    }
}
