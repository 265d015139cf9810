package com.musicapi.streaming;

import com.musicapi.model.AbstractPage;
import com.musicapi.streaming.spliterator.PaginatedSpliterator;

import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * {@link Stream} views over a page and the pages after it.
 *
 * <p>The streams are lazy and sequential: pages are fetched as the terminal
 * operation consumes items, so {@code limit()} or {@code findFirst()} stop
 * further requests.
 *
 * <pre>{@code
 * Page<Artist> top = api.personalization().getTopArtists(50, 0, TimeRange.LONG_TERM);
 *
 * List<String> rockArtists = PagingStreams.items(top)
 *     .filter(artist -> artist.genres().contains("rock"))
 *     .map(Artist::name)
 *     .limit(10)
 *     .toList();
 * }</pre>
 */
public final class PagingStreams {

    private PagingStreams() {
    }

    /**
     * Streams the items of {@code start} followed by the items of every later page.
     */
    public static <T> Stream<T> items(AbstractPage<T, ?> start) {
        return StreamSupport.stream(new PaginatedSpliterator<>(start.pagesForward().iterator()), false);
    }

    /**
     * Streams {@code start} followed by every later page.
     */
    public static <P extends AbstractPage<?, P>> Stream<P> pages(P start) {
        Spliterator<P> spliterator = Spliterators.spliteratorUnknownSize(
                start.pagesForward().iterator(),
                Spliterator.ORDERED | Spliterator.NONNULL | Spliterator.IMMUTABLE
        );
        return StreamSupport.stream(spliterator, false);
    }
}
