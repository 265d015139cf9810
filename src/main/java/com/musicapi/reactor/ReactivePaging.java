package com.musicapi.reactor;

import com.musicapi.iterable.iterator.PageIterator;
import com.musicapi.model.AbstractPage;
import com.musicapi.model.TraversalDirection;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Reactive views over page traversal, built on Project Reactor.
 *
 * <p>Each flow uses {@link Flux#generate} over a {@link PageIterator}, so a page is
 * only fetched when a subscriber requests it. The blocking requests run on
 * {@link Schedulers#boundedElastic()}. Pages are emitted strictly in traversal order.
 *
 * <p>Example usage:
 * <pre>{@code
 * ReactivePaging.flowForward(firstPage)
 *     .flatMapIterable(page -> page)
 *     .take(100)
 *     .subscribe(this::process);
 * }</pre>
 */
public final class ReactivePaging {

    private ReactivePaging() {
    }

    /**
     * Emits the pages after {@code page}, nearest first. Completes immediately
     * when {@code page} has no next link.
     */
    public static <P extends AbstractPage<?, P>> Flux<P> flowForward(P page) {
        return flow(page, TraversalDirection.FORWARDS);
    }

    /**
     * Emits the pages before {@code page}, nearest first. Errors with
     * {@link com.musicapi.MusicApiException.UnsupportedDirectionException} on
     * cursor-based pages.
     */
    public static <P extends AbstractPage<?, P>> Flux<P> flowBackward(P page) {
        return flow(page, TraversalDirection.BACKWARDS);
    }

    /**
     * Emits the pages before {@code page} in result-set order, starting at the
     * first page. Fetches the whole backward chain before the first emission.
     */
    public static <P extends AbstractPage<?, P>> Flux<P> flowStartOrdered(P page) {
        return flowBackward(page)
                .collectList()
                .flatMapMany(pages -> {
                    List<P> ordered = new ArrayList<>(pages);
                    Collections.reverse(ordered);
                    return Flux.fromIterable(ordered);
                });
    }

    /**
     * Emits the pages after {@code page} in result-set order. Same as {@link #flowForward}.
     */
    public static <P extends AbstractPage<?, P>> Flux<P> flowEndOrdered(P page) {
        return flowForward(page);
    }

    private static <P extends AbstractPage<?, P>> Flux<P> flow(P page, TraversalDirection direction) {
        return Flux.<P, PageIterator<P>>generate(
                        () -> new PageIterator<>(page, direction, false),
                        (iterator, sink) -> {
                            if (iterator.hasNext()) {
                                sink.next(iterator.next());
                            } else {
                                sink.complete();
                            }
                            return iterator;
                        })
                .subscribeOn(Schedulers.boundedElastic());
    }
}
