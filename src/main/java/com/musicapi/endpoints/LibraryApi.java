package com.musicapi.endpoints;

import com.musicapi.MusicApiClient;
import com.musicapi.MusicApiException.MissingScopeException;
import com.musicapi.MusicApiException.TooManyIdentifiersException;
import com.musicapi.auth.Scope;
import com.musicapi.model.ItemKind;
import com.musicapi.model.Page;
import com.musicapi.model.SavedAlbum;
import com.musicapi.model.SavedTrack;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Endpoints for reading and managing the items saved in the current user's library.
 */
public class LibraryApi extends ApiEndpoint {

    /**
     * Largest number of ids the library endpoints accept per request.
     */
    public static final int MAX_IDS_PER_REQUEST = 50;

    public LibraryApi(MusicApiClient client) {
        super(client);
    }

    /**
     * Returns the first page of saved tracks with the default limit.
     */
    public Page<SavedTrack> getSavedTracks() {
        return getSavedTracks(null, null, null);
    }

    /**
     * Returns a page of the tracks saved in the current user's library.
     *
     * <p><b>Requires</b> {@link Scope#USER_LIBRARY_READ}.
     *
     * @param limit items per page, 1 to 50; null for the configured default
     * @param offset index of the first item; null for 0
     * @param market country code to relink tracks for; null for none
     * @return page of saved tracks, most recently saved first
     * @throws MissingScopeException if the scope is not granted
     */
    public Page<SavedTrack> getSavedTracks(Integer limit, Integer offset, String market) {
        requireScopes(Scope.USER_LIBRARY_READ);

        return getPage(
                endpointBuilder("/me/tracks")
                        .with("limit", limitOrDefault(limit))
                        .with("offset", offset)
                        .with("market", market)
                        .toString(),
                ItemKind.SAVED_TRACK
        );
    }

    /**
     * Returns a page of the albums saved in the current user's library.
     *
     * <p><b>Requires</b> {@link Scope#USER_LIBRARY_READ}.
     */
    public Page<SavedAlbum> getSavedAlbums(Integer limit, Integer offset, String market) {
        requireScopes(Scope.USER_LIBRARY_READ);

        return getPage(
                endpointBuilder("/me/albums")
                        .with("limit", limitOrDefault(limit))
                        .with("offset", offset)
                        .with("market", market)
                        .toString(),
                ItemKind.SAVED_ALBUM
        );
    }

    public boolean contains(LibraryType type, String id) {
        return contains(type, List.of(id)).get(0);
    }

    /**
     * Checks which of {@code ids} are saved in the current user's library.
     *
     * <p><b>Requires</b> {@link Scope#USER_LIBRARY_READ}. More than {@value #MAX_IDS_PER_REQUEST}
     * ids need bulk requests enabled.
     *
     * @param type the kind of objects
     * @param ids ids or URIs
     * @return one flag per id, in the order of {@code ids}
     * @throws TooManyIdentifiersException if too many ids are given and bulk requests are off
     */
    public List<Boolean> contains(LibraryType type, List<String> ids) {
        requireScopes(Scope.USER_LIBRARY_READ);
        checkBulkRequesting(MAX_IDS_PER_REQUEST, ids.size());

        return bulkRequest(MAX_IDS_PER_REQUEST, ids, chunk -> decodeBooleans(get(
                endpointBuilder("/me/" + type.path() + "/contains")
                        .withIds("ids", toIds(type, chunk))
                        .toString()
        )));
    }

    /**
     * Saves objects to the current user's library.
     *
     * <p><b>Requires</b> {@link Scope#USER_LIBRARY_MODIFY}.
     */
    public void add(LibraryType type, String... ids) {
        requireScopes(Scope.USER_LIBRARY_MODIFY);
        checkBulkRequesting(MAX_IDS_PER_REQUEST, ids.length);

        bulkForEach(MAX_IDS_PER_REQUEST, Arrays.asList(ids), chunk -> put(
                endpointBuilder("/me/" + type.path()).withIds("ids", toIds(type, chunk)).toString(),
                null
        ));
    }

    /**
     * Removes objects from the current user's library. Changes may take a while
     * to show up in other applications.
     *
     * <p><b>Requires</b> {@link Scope#USER_LIBRARY_MODIFY}.
     */
    public void remove(LibraryType type, String... ids) {
        requireScopes(Scope.USER_LIBRARY_MODIFY);
        checkBulkRequesting(MAX_IDS_PER_REQUEST, ids.length);

        bulkForEach(MAX_IDS_PER_REQUEST, Arrays.asList(ids), chunk -> delete(
                endpointBuilder("/me/" + type.path()).withIds("ids", toIds(type, chunk)).toString()
        ));
    }

    private static List<String> toIds(LibraryType type, List<String> idsOrUris) {
        return idsOrUris.stream().map(type::id).collect(Collectors.toList());
    }
}
