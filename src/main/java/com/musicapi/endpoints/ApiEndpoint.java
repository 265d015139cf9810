package com.musicapi.endpoints;

import com.musicapi.MusicApiClient;
import com.musicapi.auth.Scope;
import com.musicapi.model.CursorPage;
import com.musicapi.model.ItemKind;
import com.musicapi.model.Page;

import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Base class of the endpoint groups. Gives subclasses URL building, scope and
 * bulk-size checks, chunked dispatch and page decoding on top of the client's
 * shared executor.
 */
public abstract class ApiEndpoint {

    protected final MusicApiClient client;

    protected ApiEndpoint(MusicApiClient client) {
        this.client = client;
    }

    protected EndpointBuilder endpointBuilder(String path) {
        return new EndpointBuilder(path);
    }

    protected Integer limitOrDefault(Integer limit) {
        return limit != null ? limit : client.options().defaultLimit();
    }

    protected void requireScopes(Scope... scopes) {
        client.scopeGuard().requireScopes(scopes);
    }

    protected void requireAnyScope(Scope... scopes) {
        client.scopeGuard().requireScopes(Set.of(scopes), true);
    }

    protected void checkBulkRequesting(int maxPerRequest, int requestedCount) {
        client.bulkRequestChunker().checkBulkSize(maxPerRequest, requestedCount);
    }

    protected <R> List<R> bulkRequest(int maxPerRequest, List<String> ids, Function<List<String>, List<R>> perChunk) {
        return client.bulkRequestChunker().chunkedRequest(maxPerRequest, ids, perChunk);
    }

    protected void bulkForEach(int maxPerRequest, List<String> ids, Consumer<List<String>> perChunk) {
        client.bulkRequestChunker().forEachChunk(maxPerRequest, ids, perChunk);
    }

    protected String get(String url) {
        return client.executor().get(url);
    }

    protected String put(String url, String body) {
        return client.executor().put(url, body);
    }

    protected String delete(String url) {
        return client.executor().delete(url);
    }

    protected <T> Page<T> getPage(String url, ItemKind itemKind) {
        return client.pageRequester().fetchPage(url, itemKind);
    }

    protected <T> CursorPage<T> getCursorPage(String url, ItemKind itemKind) {
        return client.pageRequester().fetchCursorPage(url, itemKind);
    }

    protected List<Boolean> decodeBooleans(String body) {
        return client.decoder().decodeList(body, Boolean.class);
    }

    /**
     * Reduces {@code spotify:<type>:<id>} style URIs to the bare id.
     */
    protected static String idOf(String idOrUri, String type) {
        String prefix = "spotify:" + type + ":";
        return idOrUri.startsWith(prefix) ? idOrUri.substring(prefix.length()) : idOrUri;
    }
}
