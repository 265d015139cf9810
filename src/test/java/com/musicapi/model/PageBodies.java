package com.musicapi.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.musicapi.client.RecordingRequestExecutor;
import com.musicapi.codec.PageDecoder;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds paging response bodies for tests.
 */
public final class PageBodies {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private PageBodies() {
    }

    public static PageRequester requester(RecordingRequestExecutor executor) {
        return new PageRequester(executor, new PageDecoder());
    }

    public static Category category(String id) {
        return new Category(id, "Category " + id, "/browse/categories/" + id);
    }

    public static List<Category> categories(String... ids) {
        List<Category> result = new ArrayList<>();
        for (String id : ids) {
            result.add(category(id));
        }
        return result;
    }

    /**
     * Offset page of categories. Null href, next or previous are left out of the body.
     */
    public static String offsetPage(String href, List<String> ids, int limit, int offset, int total,
                                    String next, String previous) {
        Map<String, Object> page = new LinkedHashMap<>();
        if (href != null) {
            page.put("href", href);
        }
        page.put("items", ids.stream().map(PageBodies::category).collect(Collectors.toList()));
        page.put("limit", limit);
        page.put("offset", offset);
        page.put("total", total);
        page.put("next", next);
        page.put("previous", previous);
        return write(page);
    }

    /**
     * Cursor page of artists.
     */
    public static String cursorPage(String href, List<String> ids, int limit, String next, String after) {
        Map<String, Object> page = new LinkedHashMap<>();
        page.put("href", href);
        page.put("items", ids.stream()
                .map(id -> new Artist(id, "Artist " + id, "spotify:artist:" + id, List.of(), null))
                .collect(Collectors.toList()));
        page.put("limit", limit);
        page.put("next", next);
        Map<String, Object> cursors = new LinkedHashMap<>();
        cursors.put("after", after);
        page.put("cursors", cursors);
        return write(page);
    }

    /**
     * Registers a chain of {@code pageCount} category pages of {@code pageSize} items
     * under {@code /categories?offset=N} and returns their URLs in order.
     * Item ids are {@code c0, c1, ...} across the whole chain.
     */
    public static List<String> categoryChain(RecordingRequestExecutor executor, int pageCount, int pageSize) {
        List<String> urls = new ArrayList<>();
        for (int page = 0; page < pageCount; page++) {
            urls.add(url(page * pageSize));
        }
        int total = pageCount * pageSize;
        for (int page = 0; page < pageCount; page++) {
            List<String> ids = new ArrayList<>();
            for (int i = 0; i < pageSize; i++) {
                ids.add("c" + (page * pageSize + i));
            }
            executor.respond(urls.get(page), offsetPage(
                    urls.get(page),
                    ids,
                    pageSize,
                    page * pageSize,
                    total,
                    page + 1 < pageCount ? urls.get(page + 1) : null,
                    page > 0 ? urls.get(page - 1) : null
            ));
        }
        return urls;
    }

    public static String url(int offset) {
        return "https://api.test/v1/categories?offset=" + offset;
    }

    public static List<String> ids(List<Category> categories) {
        return categories.stream().map(Category::id).collect(Collectors.toList());
    }

    private static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
