package com.musicapi.iterable.iterator;

import com.musicapi.model.AbstractPage;
import com.musicapi.model.TraversalDirection;

import java.util.HashSet;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;

/**
 * An Iterator that walks from a start page in one direction, fetching each page lazily.
 *
 * <p>This is the single traversal loop behind every page walk. It ensures that:
 * <ul>
 *   <li>Pages are only fetched when needed: each {@link #hasNext()} that has to
 *       look past the current page issues exactly one request</li>
 *   <li>No page href is returned twice, and a link pointing back at a visited
 *       page ends the walk without a request</li>
 *   <li>Walks of any length run in constant stack depth</li>
 * </ul>
 *
 * <p>Example usage:
 * <pre>{@code
 * Iterator<Page<Track>> pages = new PageIterator<>(firstPage, TraversalDirection.FORWARDS, true);
 * while (pages.hasNext()) {
 *     Page<Track> page = pages.next();
 *     // Process page
 * }
 * }</pre>
 *
 * <p><b>Thread Safety:</b> This class is NOT thread-safe. It must be used from a single thread.
 *
 * @param <P> the page type
 */
public class PageIterator<P extends AbstractPage<?, P>> implements Iterator<P> {

    private final TraversalDirection direction;
    private final Set<String> visited;

    private P current;
    private P pending;
    private boolean finished = false;

    /**
     * Creates a new PageIterator with its own set of visited hrefs.
     *
     * @param start the page to walk from
     * @param direction the direction to walk in
     * @param includeStart whether {@code start} itself is the first element
     */
    public PageIterator(P start, TraversalDirection direction, boolean includeStart) {
        this(start, direction, includeStart, new HashSet<>());
    }

    /**
     * Creates a new PageIterator sharing {@code visited} with other walks, so pages
     * seen by an earlier walk end this one.
     *
     * @param start the page to walk from
     * @param direction the direction to walk in
     * @param includeStart whether {@code start} itself is the first element
     * @param visited hrefs already returned; the start href is added to it
     */
    public PageIterator(P start, TraversalDirection direction, boolean includeStart, Set<String> visited) {
        this.current = start;
        this.direction = direction;
        this.visited = visited;
        visited.add(start.href());
        if (includeStart) {
            pending = start;
        }
    }

    /**
     * Returns {@code true} if there is another page in this direction.
     *
     * <p>May issue one request when the page after the last returned one has
     * not been fetched yet.
     *
     * @return {@code true} if there are more pages
     */
    @Override
    public boolean hasNext() {
        if (pending != null) {
            return true;
        }
        if (finished) {
            return false;
        }

        String link = current.link(direction);
        if (link == null || visited.contains(link)) {
            finished = true;
            return false;
        }

        Optional<P> fetched = current.traverse(direction);
        if (fetched.isEmpty() || !visited.add(fetched.get().href())) {
            finished = true;
            return false;
        }

        pending = fetched.get();
        return true;
    }

    /**
     * Returns the next page.
     *
     * @return the next page
     * @throws NoSuchElementException if no more pages are available
     */
    @Override
    public P next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more pages " + direction.name().toLowerCase()
                    + " from " + current.href());
        }
        current = pending;
        pending = null;
        return current;
    }
}
