package com.musicapi.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Permission grants an access token can carry.
 */
public enum Scope {
    UGC_IMAGE_UPLOAD("ugc-image-upload"),
    PLAYLIST_READ_PRIVATE("playlist-read-private"),
    PLAYLIST_READ_COLLABORATIVE("playlist-read-collaborative"),
    PLAYLIST_MODIFY_PUBLIC("playlist-modify-public"),
    PLAYLIST_MODIFY_PRIVATE("playlist-modify-private"),
    USER_FOLLOW_READ("user-follow-read"),
    USER_FOLLOW_MODIFY("user-follow-modify"),
    USER_LIBRARY_READ("user-library-read"),
    USER_LIBRARY_MODIFY("user-library-modify"),
    USER_READ_PRIVATE("user-read-private"),
    USER_READ_EMAIL("user-read-email"),
    USER_TOP_READ("user-top-read"),
    USER_READ_RECENTLY_PLAYED("user-read-recently-played"),
    USER_READ_PLAYBACK_POSITION("user-read-playback-position"),
    USER_READ_PLAYBACK_STATE("user-read-playback-state"),
    USER_MODIFY_PLAYBACK_STATE("user-modify-playback-state"),
    USER_READ_CURRENTLY_PLAYING("user-read-currently-playing"),
    STREAMING("streaming");

    private static final Logger log = LoggerFactory.getLogger(Scope.class);

    private final String id;

    Scope(String id) {
        this.id = id;
    }

    /**
     * Returns the identifier the service uses on the wire.
     */
    public String id() {
        return id;
    }

    public static Optional<Scope> fromId(String id) {
        return Arrays.stream(values())
                .filter(scope -> scope.id.equals(id))
                .findFirst();
    }

    /**
     * Parses the space separated {@code scope} field of a token response.
     * Identifiers this client does not know are skipped.
     *
     * @param scopeField the raw field, may be null or blank
     * @return the recognised scopes
     */
    public static Set<Scope> parse(String scopeField) {
        if (scopeField == null || scopeField.isBlank()) {
            return Collections.emptySet();
        }
        Set<Scope> scopes = EnumSet.noneOf(Scope.class);
        for (String id : scopeField.trim().split("\\s+")) {
            Optional<Scope> scope = fromId(id);
            if (scope.isPresent()) {
                scopes.add(scope.get());
            } else {
                log.debug("Ignoring unknown scope '{}'", id);
            }
        }
        return scopes;
    }

    @Override
    public String toString() {
        return id;
    }
}
