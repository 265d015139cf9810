package com.musicapi.model;

import com.musicapi.MusicApiException.UnsupportedDirectionException;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Cursor-based page. The service locates the following page from {@link #cursor()},
 * so these pages can only be walked forwards: {@link #getPrevious()} always fails.
 *
 * @param <T> the type of items in the page
 */
public final class CursorPage<T> extends AbstractPage<T, CursorPage<T>> {

    private final Cursor cursor;

    /**
     * Builds a page from a decoded payload.
     *
     * @param payload the decoded body
     * @param requestUrl the URL that was requested, used as href when the body carries none
     * @param itemKind the kind of items on this page and its neighbours
     * @param requester the capability used to fetch neighbours
     * @throws com.musicapi.MusicApiException.UnrecognizedItemKindException if the requester's
     *         decoder has no cursor-page decoder for {@code itemKind}
     */
    public CursorPage(PagingPayload<T> payload, String requestUrl, ItemKind itemKind, PageRequester requester) {
        this(
                payload.href() != null ? payload.href() : requestUrl,
                payload.items(),
                payload.limit(),
                payload.total(),
                payload.next(),
                payload.cursors(),
                itemKind,
                requester
        );
    }

    public CursorPage(
            String href,
            List<T> items,
            int limit,
            int total,
            String nextUrl,
            Cursor cursor,
            ItemKind itemKind,
            PageRequester requester
    ) {
        super(href, items, limit, nextUrl, total, itemKind, requester);
        requester.decoder().resolveCursorPageType(itemKind);
        this.cursor = Objects.requireNonNullElse(cursor, Cursor.EMPTY);
    }

    public Cursor cursor() {
        return cursor;
    }

    /**
     * Always fails: cursor-based pages have no backward direction.
     *
     * @throws UnsupportedDirectionException unconditionally
     */
    @Override
    public Optional<CursorPage<T>> getPrevious() {
        throw backwardsUnsupported();
    }

    @Override
    public String link(TraversalDirection direction) {
        if (direction == TraversalDirection.BACKWARDS) {
            throw backwardsUnsupported();
        }
        return nextUrl();
    }

    @Override
    public boolean supportsBackwardTraversal() {
        return false;
    }

    @Override
    protected CursorPage<T> fetch(String url) {
        return requester().fetchCursorPage(url, itemKind());
    }

    @Override
    protected CursorPage<T> self() {
        return this;
    }

    private UnsupportedDirectionException backwardsUnsupported() {
        return new UnsupportedDirectionException("Cursor-based pages can only be traversed forwards: " + href());
    }

    @Override
    public String toString() {
        return "CursorPage[href=" + href() + ", cursor=" + cursor + ", limit=" + limit()
                + ", items=" + items() + "]";
    }
}
