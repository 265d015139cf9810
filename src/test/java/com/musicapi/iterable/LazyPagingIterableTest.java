package com.musicapi.iterable;

import com.musicapi.client.RecordingRequestExecutor;
import com.musicapi.model.Category;
import com.musicapi.model.ItemKind;
import com.musicapi.model.Page;
import com.musicapi.model.PageBodies;
import com.musicapi.model.PageRequester;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for LazyPagingIterable - item-level for-each over a page and its successors.
 */
class LazyPagingIterableTest {

    private final RecordingRequestExecutor executor = new RecordingRequestExecutor();
    private final PageRequester requester = PageBodies.requester(executor);

    @Test
    @DisplayName("Should iterate all items across pages in order")
    void shouldIterateAllItems() {
        // Given: three pages of two items
        List<String> urls = PageBodies.categoryChain(executor, 3, 2);
        Page<Category> first = requester.fetchPage(urls.get(0), ItemKind.CATEGORY);

        // When
        List<String> ids = new ArrayList<>();
        for (Category category : LazyPagingIterable.of(first)) {
            ids.add(category.id());
        }

        // Then
        assertThat(ids).containsExactly("c0", "c1", "c2", "c3", "c4", "c5");
        assertThat(executor.requestCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should not fetch further pages after break")
    void shouldStopFetchingOnBreak() {
        List<String> urls = PageBodies.categoryChain(executor, 10, 2);
        Page<Category> first = requester.fetchPage(urls.get(0), ItemKind.CATEGORY);

        int consumed = 0;
        for (Category ignored : LazyPagingIterable.of(first)) {
            consumed++;
            if (consumed == 3) {
                break;
            }
        }

        // Only the second page was needed
        assertThat(executor.requestCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should skip empty pages in the middle of the result set")
    void shouldSkipEmptyPages() {
        executor.respond("/x?offset=1", PageBodies.offsetPage(
                "/x?offset=1", List.of(), 1, 1, 2, "/x?offset=2", null));
        executor.respond("/x?offset=2", PageBodies.offsetPage(
                "/x?offset=2", List.of("b"), 1, 2, 2, null, null));
        Page<Category> first = new Page<>("/x?offset=0", PageBodies.categories("a"), 1, 0, 2,
                "/x?offset=1", null, ItemKind.CATEGORY, requester);

        List<String> ids = new ArrayList<>();
        LazyPagingIterable.of(first).forEach(category -> ids.add(category.id()));

        assertThat(ids).containsExactly("a", "b");
    }

    @Test
    @DisplayName("Should start again from the first page on every iteration")
    void shouldBeReusable() {
        List<String> urls = PageBodies.categoryChain(executor, 2, 2);
        Page<Category> first = requester.fetchPage(urls.get(0), ItemKind.CATEGORY);
        LazyPagingIterable<Category> iterable = LazyPagingIterable.of(first);

        List<Category> once = new ArrayList<>();
        iterable.forEach(once::add);
        List<Category> twice = new ArrayList<>();
        iterable.forEach(twice::add);

        assertThat(twice).isEqualTo(once).hasSize(4);
        // the second page is fetched again by the second iteration
        assertThat(executor.requests()).containsExactly(
                "GET " + urls.get(0), "GET " + urls.get(1), "GET " + urls.get(1));
    }

    @Test
    @DisplayName("Should throw NoSuchElementException past the last item")
    void shouldThrowWhenExhausted() {
        Page<Category> only = new Page<>("/x", PageBodies.categories("a"), 1, 0, 1, null, null,
                ItemKind.CATEGORY, requester);
        Iterator<Category> iterator = LazyPagingIterable.of(only).iterator();

        assertThat(iterator.next().id()).isEqualTo("a");
        assertThat(iterator.hasNext()).isFalse();
        assertThatThrownBy(iterator::next).isInstanceOf(NoSuchElementException.class);
    }
}
