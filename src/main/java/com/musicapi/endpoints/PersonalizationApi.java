package com.musicapi.endpoints;

import com.musicapi.MusicApiClient;
import com.musicapi.auth.Scope;
import com.musicapi.model.Artist;
import com.musicapi.model.ItemKind;
import com.musicapi.model.Page;
import com.musicapi.model.Track;

/**
 * Endpoints for the current user's listening habits.
 */
public class PersonalizationApi extends ApiEndpoint {

    /**
     * Time frame over which affinities are computed.
     */
    public enum TimeRange {
        /** Several years of data, including new data as it becomes available. */
        LONG_TERM("long_term"),
        /** Approximately the last 6 months. */
        MEDIUM_TERM("medium_term"),
        /** Approximately the last 4 weeks. */
        SHORT_TERM("short_term");

        private final String id;

        TimeRange(String id) {
            this.id = id;
        }

        public String id() {
            return id;
        }

        @Override
        public String toString() {
            return id;
        }
    }

    public PersonalizationApi(MusicApiClient client) {
        super(client);
    }

    /**
     * Returns the current user's top artists, sorted by affinity.
     *
     * <p><b>Requires</b> {@link Scope#USER_TOP_READ}.
     *
     * @param limit items per page, 1 to 50; null for the configured default
     * @param offset index of the first item; null for 0
     * @param timeRange null for the service default, {@link TimeRange#MEDIUM_TERM}
     */
    public Page<Artist> getTopArtists(Integer limit, Integer offset, TimeRange timeRange) {
        requireScopes(Scope.USER_TOP_READ);

        return getPage(
                endpointBuilder("/me/top/artists")
                        .with("limit", limitOrDefault(limit))
                        .with("offset", offset)
                        .with("time_range", timeRange)
                        .toString(),
                ItemKind.ARTIST
        );
    }

    /**
     * Returns the current user's top tracks, sorted by affinity.
     *
     * <p><b>Requires</b> {@link Scope#USER_TOP_READ}.
     */
    public Page<Track> getTopTracks(Integer limit, Integer offset, TimeRange timeRange) {
        requireScopes(Scope.USER_TOP_READ);

        return getPage(
                endpointBuilder("/me/top/tracks")
                        .with("limit", limitOrDefault(limit))
                        .with("offset", offset)
                        .with("time_range", timeRange)
                        .toString(),
                ItemKind.TRACK
        );
    }
}
