package com.musicapi.bulk;

import com.musicapi.MusicApiException.RemoteRequestFailedException;
import com.musicapi.MusicApiException.TooManyIdentifiersException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for BulkRequestChunker.
 */
class BulkRequestChunkerTest {

    private static List<String> ids(int count) {
        return IntStream.range(0, count).mapToObj(i -> "id-" + i).collect(Collectors.toList());
    }

    // =========================================================================
    // SIZE CHECK
    // =========================================================================

    @Test
    @DisplayName("Should reject too many ids when bulk requests are off")
    void shouldRejectOversizedListWithoutBulk() {
        BulkRequestChunker chunker = new BulkRequestChunker(false);

        assertThatThrownBy(() -> chunker.checkBulkSize(50, 51))
                .isInstanceOfSatisfying(TooManyIdentifiersException.class, e -> {
                    assertThat(e.getMaxPerRequest()).isEqualTo(50);
                    assertThat(e.getRequestedCount()).isEqualTo(51);
                });
    }

    @Test
    @DisplayName("Should accept lists up to the limit, or any size with bulk requests on")
    void shouldAcceptAllowedSizes() {
        new BulkRequestChunker(false).checkBulkSize(50, 50);
        new BulkRequestChunker(false).checkBulkSize(50, 0);
        new BulkRequestChunker(true).checkBulkSize(50, 500);
    }

    // =========================================================================
    // CHUNKED REQUESTS
    // =========================================================================

    @Test
    @DisplayName("Should split 120 ids into calls of 50, 50 and 20 and keep result order")
    void shouldSplitIntoOrderedChunks() {
        // Given
        BulkRequestChunker chunker = new BulkRequestChunker(true);
        List<String> ids = ids(120);
        List<Integer> chunkSizes = new ArrayList<>();

        // When: each chunk answers with its own ids upper-cased
        List<String> results = chunker.chunkedRequest(50, ids, chunk -> {
            chunkSizes.add(chunk.size());
            return chunk.stream().map(String::toUpperCase).collect(Collectors.toList());
        });

        // Then
        assertThat(chunkSizes).containsExactly(50, 50, 20);
        assertThat(results).hasSize(120);
        assertThat(results.get(0)).isEqualTo("ID-0");
        assertThat(results.get(50)).isEqualTo("ID-50");
        assertThat(results.get(119)).isEqualTo("ID-119");
        assertThatThrownBy(() -> results.add("x")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Should make no call for an empty list")
    void shouldMakeNoCallForEmptyList() {
        BulkRequestChunker chunker = new BulkRequestChunker(true);
        List<List<String>> calls = new ArrayList<>();

        List<Boolean> results = chunker.chunkedRequest(50, List.<String>of(), chunk -> {
            calls.add(chunk);
            return List.of();
        });

        assertThat(results).isEmpty();
        assertThat(calls).isEmpty();
    }

    @Test
    @DisplayName("Should abort on the first failing chunk")
    void shouldAbortOnFirstFailure() {
        BulkRequestChunker chunker = new BulkRequestChunker(true);
        RemoteRequestFailedException failure = new RemoteRequestFailedException(502, "Bad gateway");
        List<Integer> calls = new ArrayList<>();

        assertThatThrownBy(() -> chunker.forEachChunk(10, ids(35), chunk -> {
            calls.add(chunk.size());
            if (calls.size() == 2) {
                throw failure;
            }
        })).isSameAs(failure);

        assertThat(calls).containsExactly(10, 10);
    }

    @Test
    @DisplayName("Should partition into contiguous copies")
    void shouldPartitionContiguously() {
        List<String> source = new ArrayList<>(ids(5));

        List<List<String>> chunks = BulkRequestChunker.partition(source, 2);
        source.set(0, "changed");

        assertThat(chunks).containsExactly(
                List.of("id-0", "id-1"),
                List.of("id-2", "id-3"),
                List.of("id-4"));
        assertThatThrownBy(() -> BulkRequestChunker.partition(source, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
