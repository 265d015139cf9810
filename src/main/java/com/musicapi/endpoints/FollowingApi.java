package com.musicapi.endpoints;

import com.musicapi.MusicApiClient;
import com.musicapi.auth.Scope;
import com.musicapi.model.Artist;
import com.musicapi.model.CursorPage;
import com.musicapi.model.ItemKind;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Endpoints for the artists, users and playlists the current user follows.
 */
public class FollowingApi extends ApiEndpoint {

    public static final int MAX_IDS_PER_REQUEST = 50;

    public FollowingApi(MusicApiClient client) {
        super(client);
    }

    /**
     * Checks whether the current user follows each of {@code artists}.
     *
     * <p><b>Requires</b> {@link Scope#USER_FOLLOW_READ}.
     *
     * @return one flag per artist, in input order
     */
    public List<Boolean> isFollowingArtists(String... artists) {
        return isFollowing("artist", artists);
    }

    /**
     * Checks whether the current user follows each of {@code users}.
     *
     * <p><b>Requires</b> {@link Scope#USER_FOLLOW_READ}.
     *
     * @return one flag per user, in input order
     */
    public List<Boolean> isFollowingUsers(String... users) {
        return isFollowing("user", users);
    }

    /**
     * Returns the first page of artists the current user follows. Followed
     * artists are cursor paged, so the result can only be walked forwards.
     *
     * <p><b>Requires</b> {@link Scope#USER_FOLLOW_READ}.
     *
     * @param limit items per page, 1 to 50; null for the configured default
     * @param after id of the last artist of the previous page; null to start at the beginning
     */
    public CursorPage<Artist> getFollowedArtists(Integer limit, String after) {
        requireScopes(Scope.USER_FOLLOW_READ);

        return getCursorPage(
                endpointBuilder("/me/following")
                        .with("type", "artist")
                        .with("limit", limitOrDefault(limit))
                        .with("after", after)
                        .toString(),
                ItemKind.ARTIST
        );
    }

    /**
     * <b>Requires</b> {@link Scope#USER_FOLLOW_MODIFY}.
     */
    public void followArtists(String... artists) {
        modifyFollowing("artist", artists, true);
    }

    /**
     * <b>Requires</b> {@link Scope#USER_FOLLOW_MODIFY}.
     */
    public void unfollowArtists(String... artists) {
        modifyFollowing("artist", artists, false);
    }

    public void followUsers(String... users) {
        modifyFollowing("user", users, true);
    }

    public void unfollowUsers(String... users) {
        modifyFollowing("user", users, false);
    }

    /**
     * Follows a playlist. Needs either {@link Scope#PLAYLIST_MODIFY_PUBLIC} or
     * {@link Scope#PLAYLIST_MODIFY_PRIVATE}; which one decides only whether the
     * follow shows up publicly, not whether the playlist is public.
     *
     * @param playlist playlist id or URI
     * @param followPublicly whether the playlist appears among the user's public playlists
     */
    public void followPlaylist(String playlist, boolean followPublicly) {
        requireAnyScope(Scope.PLAYLIST_MODIFY_PUBLIC, Scope.PLAYLIST_MODIFY_PRIVATE);

        put(
                endpointBuilder("/playlists/" + EndpointBuilder.encode(idOf(playlist, "playlist")) + "/followers")
                        .toString(),
                "{\"public\": " + followPublicly + "}"
        );
    }

    public void unfollowPlaylist(String playlist) {
        requireAnyScope(Scope.PLAYLIST_MODIFY_PUBLIC, Scope.PLAYLIST_MODIFY_PRIVATE);

        delete(endpointBuilder("/playlists/" + EndpointBuilder.encode(idOf(playlist, "playlist")) + "/followers")
                .toString());
    }

    private List<Boolean> isFollowing(String type, String[] ids) {
        requireScopes(Scope.USER_FOLLOW_READ);
        checkBulkRequesting(MAX_IDS_PER_REQUEST, ids.length);

        return bulkRequest(MAX_IDS_PER_REQUEST, Arrays.asList(ids), chunk -> decodeBooleans(get(
                endpointBuilder("/me/following/contains")
                        .with("type", type)
                        .withIds("ids", toIds(type, chunk))
                        .toString()
        )));
    }

    private void modifyFollowing(String type, String[] ids, boolean follow) {
        requireScopes(Scope.USER_FOLLOW_MODIFY);
        checkBulkRequesting(MAX_IDS_PER_REQUEST, ids.length);

        bulkForEach(MAX_IDS_PER_REQUEST, Arrays.asList(ids), chunk -> {
            String url = endpointBuilder("/me/following")
                    .with("type", type)
                    .withIds("ids", toIds(type, chunk))
                    .toString();
            if (follow) {
                put(url, null);
            } else {
                delete(url);
            }
        });
    }

    private static List<String> toIds(String type, List<String> idsOrUris) {
        return idsOrUris.stream().map(id -> idOf(id, type)).collect(Collectors.toList());
    }
}
