package com.musicapi;

import com.musicapi.auth.AccessToken;
import com.musicapi.auth.Scope;
import com.musicapi.bulk.BulkRequestChunker;
import com.musicapi.bulk.ScopeGuard;
import com.musicapi.client.HttpRequestExecutor;
import com.musicapi.client.RequestExecutor;
import com.musicapi.codec.PageDecoder;
import com.musicapi.endpoints.FollowingApi;
import com.musicapi.endpoints.LibraryApi;
import com.musicapi.endpoints.PersonalizationApi;
import com.musicapi.model.PageRequester;

import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Entry point of the client. Wires one executor, decoder, scope guard and chunker
 * and shares them, read-only, with every endpoint group and every page.
 *
 * <p>Example usage:
 * <pre>{@code
 * MusicApiClient api = new MusicApiClient(
 *     ClientOptions.defaults().withAllowBulkRequests(true),
 *     AccessToken.of(token, "user-library-read user-follow-read")
 * );
 *
 * List<SavedTrack> library = api.library().getSavedTracks().getAllItems();
 * List<Boolean> saved = api.library().contains(LibraryType.TRACK, trackIds);
 * }</pre>
 */
public class MusicApiClient {

    private final ClientOptions options;
    private final RequestExecutor executor;
    private final PageDecoder decoder;
    private final PageRequester pageRequester;
    private final ScopeGuard scopeGuard;
    private final BulkRequestChunker bulkRequestChunker;

    private final LibraryApi library;
    private final FollowingApi following;
    private final PersonalizationApi personalization;

    /**
     * Creates a client with default options over HTTP.
     */
    public MusicApiClient(AccessToken token) {
        this(ClientOptions.defaults(), token);
    }

    /**
     * Creates a client over HTTP that uses {@code token} for every request.
     */
    public MusicApiClient(ClientOptions options, AccessToken token) {
        this(options, new HttpRequestExecutor(options, () -> token), token::grantedScopes);
    }

    /**
     * Creates a client over a custom executor.
     *
     * @param options client options
     * @param executor issues the requests
     * @param grantedScopes supplies the scopes of the credential the executor uses
     */
    public MusicApiClient(ClientOptions options, RequestExecutor executor, Supplier<Set<Scope>> grantedScopes) {
        this.options = Objects.requireNonNull(options, "options");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.decoder = new PageDecoder();
        this.pageRequester = new PageRequester(executor, decoder);
        this.scopeGuard = new ScopeGuard(grantedScopes);
        this.bulkRequestChunker = new BulkRequestChunker(options.allowBulkRequests());

        this.library = new LibraryApi(this);
        this.following = new FollowingApi(this);
        this.personalization = new PersonalizationApi(this);
    }

    public LibraryApi library() {
        return library;
    }

    public FollowingApi following() {
        return following;
    }

    public PersonalizationApi personalization() {
        return personalization;
    }

    public ClientOptions options() {
        return options;
    }

    public RequestExecutor executor() {
        return executor;
    }

    public PageDecoder decoder() {
        return decoder;
    }

    public PageRequester pageRequester() {
        return pageRequester;
    }

    public ScopeGuard scopeGuard() {
        return scopeGuard;
    }

    public BulkRequestChunker bulkRequestChunker() {
        return bulkRequestChunker;
    }
}
