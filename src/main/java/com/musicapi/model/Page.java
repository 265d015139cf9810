package com.musicapi.model;

import java.util.List;

/**
 * Offset-based page that can be walked in both directions.
 *
 * <p>Pages are created by decoding a response body (see
 * {@link com.musicapi.codec.PageDecoder#decodePage}). The decoder for the item
 * kind is resolved when the page is built, so a page that could not decode its
 * neighbours never exists.
 *
 * @param <T> the type of items in the page
 */
public final class Page<T> extends AbstractPage<T, Page<T>> {

    private final int offset;
    private final String previousUrl;

    /**
     * Builds a page from a decoded payload.
     *
     * @param payload the decoded body
     * @param requestUrl the URL that was requested, used as href when the body carries none
     * @param itemKind the kind of items on this page and its neighbours
     * @param requester the capability used to fetch neighbours
     * @throws com.musicapi.MusicApiException.UnrecognizedItemKindException if the requester's
     *         decoder has no offset-page decoder for {@code itemKind}
     */
    public Page(PagingPayload<T> payload, String requestUrl, ItemKind itemKind, PageRequester requester) {
        this(
                payload.href() != null ? payload.href() : requestUrl,
                payload.items(),
                payload.limit(),
                payload.offset(),
                payload.total(),
                payload.next(),
                payload.previous(),
                itemKind,
                requester
        );
    }

    public Page(
            String href,
            List<T> items,
            int limit,
            int offset,
            int total,
            String nextUrl,
            String previousUrl,
            ItemKind itemKind,
            PageRequester requester
    ) {
        super(href, items, limit, nextUrl, total, itemKind, requester);
        requester.decoder().resolvePageType(itemKind);
        this.offset = offset;
        this.previousUrl = previousUrl;
    }

    /**
     * Returns the index of this page's first item within the whole result set.
     */
    public int offset() {
        return offset;
    }

    /**
     * Returns the link to the preceding page, or null on the first page.
     */
    public String previousUrl() {
        return previousUrl;
    }

    public boolean hasPreviousPage() {
        return previousUrl != null;
    }

    @Override
    public String link(TraversalDirection direction) {
        return direction == TraversalDirection.FORWARDS ? nextUrl() : previousUrl;
    }

    @Override
    public boolean supportsBackwardTraversal() {
        return true;
    }

    @Override
    protected Page<T> fetch(String url) {
        return requester().fetchPage(url, itemKind());
    }

    @Override
    protected Page<T> self() {
        return this;
    }

    @Override
    public String toString() {
        return "Page[href=" + href() + ", offset=" + offset + ", limit=" + limit() + ", total=" + total()
                + ", items=" + items() + "]";
    }
}
