package com.musicapi.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.musicapi.MusicApiException.ResponseParseException;
import com.musicapi.MusicApiException.UnrecognizedItemKindException;
import com.musicapi.model.CursorPage;
import com.musicapi.model.ItemKind;
import com.musicapi.model.Page;
import com.musicapi.model.PageRequester;
import com.musicapi.model.PagingPayload;

import java.io.IOException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns response bodies into typed pages and models.
 *
 * <p>Decoding is driven by an explicit registry from {@link ItemKind} to the Jackson
 * {@link JavaType} of its paging payload, built once from the kinds' declared paging
 * styles. A kind missing from the registry is a schema mismatch between this client
 * and the service and fails with {@link UnrecognizedItemKindException}; no fallback
 * decoding is attempted.
 */
public class PageDecoder {

    private final ObjectMapper objectMapper;
    private final Map<ItemKind, JavaType> pageTypes;
    private final Map<ItemKind, JavaType> cursorPageTypes;

    /**
     * Creates a decoder with a mapper that ignores unknown properties.
     */
    public PageDecoder() {
        this(defaultObjectMapper());
    }

    public PageDecoder(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");

        Map<ItemKind, JavaType> pages = new EnumMap<>(ItemKind.class);
        Map<ItemKind, JavaType> cursorPages = new EnumMap<>(ItemKind.class);
        for (ItemKind kind : ItemKind.values()) {
            JavaType payloadType = objectMapper.getTypeFactory()
                    .constructParametricType(PagingPayload.class, kind.itemType());
            if (kind.offsetPaged()) {
                pages.put(kind, payloadType);
            }
            if (kind.cursorPaged()) {
                cursorPages.put(kind, payloadType);
            }
        }
        this.pageTypes = Collections.unmodifiableMap(pages);
        this.cursorPageTypes = Collections.unmodifiableMap(cursorPages);
    }

    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    /**
     * Returns the payload type for offset-based pages of {@code itemKind}.
     *
     * @throws UnrecognizedItemKindException if no offset-page decoder is registered
     */
    public JavaType resolvePageType(ItemKind itemKind) {
        JavaType type = pageTypes.get(Objects.requireNonNull(itemKind, "itemKind"));
        if (type == null) {
            throw new UnrecognizedItemKindException(itemKind, "offset-page");
        }
        return type;
    }

    /**
     * Returns the payload type for cursor-based pages of {@code itemKind}.
     *
     * @throws UnrecognizedItemKindException if no cursor-page decoder is registered
     */
    public JavaType resolveCursorPageType(ItemKind itemKind) {
        JavaType type = cursorPageTypes.get(Objects.requireNonNull(itemKind, "itemKind"));
        if (type == null) {
            throw new UnrecognizedItemKindException(itemKind, "cursor-page");
        }
        return type;
    }

    /**
     * Decodes an offset-based page.
     *
     * @param body the response body
     * @param requestUrl the URL the body was fetched from
     * @param itemKind the kind of items on the page
     * @param requester the requester the page uses to reach its neighbours
     * @return the decoded page
     */
    public <T> Page<T> decodePage(String body, String requestUrl, ItemKind itemKind, PageRequester requester) {
        PagingPayload<T> payload = readPayload(body, resolvePageType(itemKind), itemKind);
        return new Page<>(payload, requestUrl, itemKind, requester);
    }

    /**
     * Decodes a cursor-based page.
     *
     * @param body the response body
     * @param requestUrl the URL the body was fetched from
     * @param itemKind the kind of items on the page
     * @param requester the requester the page uses to reach its neighbours
     * @return the decoded page
     */
    public <T> CursorPage<T> decodeCursorPage(
            String body,
            String requestUrl,
            ItemKind itemKind,
            PageRequester requester
    ) {
        PagingPayload<T> payload = readPayload(body, resolveCursorPageType(itemKind), itemKind);
        return new CursorPage<>(payload, requestUrl, itemKind, requester);
    }

    public <T> T decodeObject(String body, Class<T> type) {
        try {
            return objectMapper.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new ResponseParseException("Unable to parse " + type.getSimpleName() + " from " + abbreviate(body), e);
        }
    }

    public <T> List<T> decodeList(String body, Class<T> elementType) {
        JavaType listType = objectMapper.getTypeFactory().constructCollectionType(List.class, elementType);
        try {
            return objectMapper.readValue(body, listType);
        } catch (JsonProcessingException e) {
            throw new ResponseParseException(
                    "Unable to parse list of " + elementType.getSimpleName() + " from " + abbreviate(body), e);
        }
    }

    private <T> PagingPayload<T> readPayload(String body, JavaType payloadType, ItemKind itemKind) {
        try {
            JsonNode root = objectMapper.readTree(body);
            if (root == null || !root.isObject()) {
                throw new ResponseParseException("Expected a paging object for " + itemKind + " but got "
                        + abbreviate(body), null);
            }
            String wrapperKey = itemKind.wrapperKey();
            if (wrapperKey != null && !root.has("items") && root.path(wrapperKey).isObject()) {
                root = root.get(wrapperKey);
            }
            return objectMapper.readerFor(payloadType).readValue(root);
        } catch (IOException e) {
            throw new ResponseParseException("Unable to parse " + itemKind + " page from " + abbreviate(body), e);
        }
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "<null>";
        }
        return body.length() <= 200 ? body : body.substring(0, 200) + "...";
    }
}
