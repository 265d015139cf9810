package com.musicapi.model;

import com.musicapi.client.RequestExecutor;
import com.musicapi.codec.PageDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Issues the GET for a page link and decodes the body into the next page.
 *
 * <p>Every page holds the requester it was decoded with, so pages reached from it
 * use the same executor and decoders. The requester is shared read-only by all
 * pages and holds no per-traversal state.
 */
public class PageRequester {

    private static final Logger log = LoggerFactory.getLogger(PageRequester.class);

    private final RequestExecutor executor;
    private final PageDecoder decoder;

    public PageRequester(RequestExecutor executor, PageDecoder decoder) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
    }

    /**
     * Fetches and decodes an offset-based page.
     *
     * @param url the page URL, usually a next/previous link returned by the service
     * @param itemKind the kind of items on the page
     * @return the decoded page, bound to this requester
     */
    public <T> Page<T> fetchPage(String url, ItemKind itemKind) {
        log.debug("Fetching {} page {}", itemKind, url);
        return decoder.decodePage(executor.get(url), url, itemKind, this);
    }

    /**
     * Fetches and decodes a cursor-based page.
     *
     * @param url the page URL, usually a next link returned by the service
     * @param itemKind the kind of items on the page
     * @return the decoded page, bound to this requester
     */
    public <T> CursorPage<T> fetchCursorPage(String url, ItemKind itemKind) {
        log.debug("Fetching {} cursor page {}", itemKind, url);
        return decoder.decodeCursorPage(executor.get(url), url, itemKind, this);
    }

    public RequestExecutor executor() {
        return executor;
    }

    public PageDecoder decoder() {
        return decoder;
    }
}
