package com.musicapi.bulk;

import com.musicapi.MusicApiException.TooManyIdentifiersException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Splits identifier lists into the batch sizes the service accepts.
 *
 * <p>Splitting is opt-in: with bulk requests turned off, a list larger than one
 * request allows is rejected by {@link #checkBulkSize(int, int)} before any request.
 *
 * <p>Example usage:
 * <pre>{@code
 * chunker.checkBulkSize(50, ids.size());
 * List<Boolean> saved = chunker.chunkedRequest(50, ids, chunk ->
 *     decoder.decodeList(executor.get(containsUrl(chunk)), Boolean.class));
 * }</pre>
 *
 * <p>Chunks are sent one after another on the calling thread. The first failing chunk
 * aborts the operation with its exception; no partial result is returned.
 */
public class BulkRequestChunker {

    private static final Logger log = LoggerFactory.getLogger(BulkRequestChunker.class);

    private final boolean allowBulkRequests;

    public BulkRequestChunker(boolean allowBulkRequests) {
        this.allowBulkRequests = allowBulkRequests;
    }

    public boolean allowBulkRequests() {
        return allowBulkRequests;
    }

    /**
     * Fails fast when more identifiers are requested than one call accepts and
     * bulk requests are off.
     *
     * @throws TooManyIdentifiersException naming both limits
     */
    public void checkBulkSize(int maxPerRequest, int requestedCount) {
        if (requestedCount > maxPerRequest && !allowBulkRequests) {
            throw new TooManyIdentifiersException(maxPerRequest, requestedCount);
        }
    }

    /**
     * Calls {@code perChunk} once per contiguous chunk of at most {@code maxPerRequest}
     * identifiers and concatenates the results in input order.
     *
     * @param maxPerRequest the largest chunk the service accepts
     * @param identifiers the identifiers, in the order results should come back
     * @param perChunk issues the request for one chunk and returns its ordered results
     * @return the results of all chunks, concatenated
     */
    public <I, R> List<R> chunkedRequest(int maxPerRequest, List<I> identifiers, Function<List<I>, List<R>> perChunk) {
        List<R> results = new ArrayList<>(identifiers.size());
        for (List<I> chunk : partition(identifiers, maxPerRequest)) {
            results.addAll(perChunk.apply(chunk));
        }
        return Collections.unmodifiableList(results);
    }

    /**
     * Calls {@code perChunk} once per contiguous chunk, for requests without a per-id result.
     */
    public <I> void forEachChunk(int maxPerRequest, List<I> identifiers, Consumer<List<I>> perChunk) {
        for (List<I> chunk : partition(identifiers, maxPerRequest)) {
            perChunk.accept(chunk);
        }
    }

    /**
     * Splits {@code identifiers} into contiguous sublists of at most {@code size} elements.
     */
    public static <I> List<List<I>> partition(List<I> identifiers, int size) {
        if (size < 1) {
            throw new IllegalArgumentException("chunk size must be at least 1: " + size);
        }
        List<List<I>> chunks = new ArrayList<>();
        for (int from = 0; from < identifiers.size(); from += size) {
            int to = Math.min(from + size, identifiers.size());
            chunks.add(List.copyOf(identifiers.subList(from, to)));
        }
        if (chunks.size() > 1) {
            log.debug("Split {} ids into {} requests of at most {}", identifiers.size(), chunks.size(), size);
        }
        return chunks;
    }
}
