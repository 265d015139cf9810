package com.musicapi.endpoints;

/**
 * Kind of object stored in the user's library.
 */
public enum LibraryType {
    TRACK("tracks", "track"),
    ALBUM("albums", "album"),
    EPISODE("episodes", "episode"),
    SHOW("shows", "show");

    private final String path;
    private final String uriType;

    LibraryType(String path, String uriType) {
        this.path = path;
        this.uriType = uriType;
    }

    /**
     * Returns the path segment under {@code /me}.
     */
    public String path() {
        return path;
    }

    String id(String idOrUri) {
        return ApiEndpoint.idOf(idOrUri, uriType);
    }

    @Override
    public String toString() {
        return path;
    }
}
