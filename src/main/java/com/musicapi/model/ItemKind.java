package com.musicapi.model;

/**
 * Tag selecting the item schema of a page, and with it the decoder used for
 * the pages reached from it.
 *
 * <p>Some endpoints nest the paging object under a single property, for example
 * {@code {"albums": {"items": [...], ...}}}. {@link #wrapperKey()} names that
 * property; the decoder unwraps it when present.
 */
public enum ItemKind {
    SIMPLE_TRACK(SimpleTrack.class, true, false, null),
    TRACK(Track.class, true, false, null),
    SIMPLE_ALBUM(SimpleAlbum.class, true, false, "albums"),
    SAVED_TRACK(SavedTrack.class, true, false, null),
    SAVED_ALBUM(SavedAlbum.class, true, false, null),
    ARTIST(Artist.class, true, true, "artists"),
    SIMPLE_PLAYLIST(SimplePlaylist.class, true, false, "playlists"),
    PLAYLIST_TRACK(PlaylistTrack.class, true, false, null),
    CATEGORY(Category.class, true, false, "categories"),
    PLAY_HISTORY(PlayHistory.class, false, true, null);

    private final Class<?> itemType;
    private final boolean offsetPaged;
    private final boolean cursorPaged;
    private final String wrapperKey;

    ItemKind(Class<?> itemType, boolean offsetPaged, boolean cursorPaged, String wrapperKey) {
        this.itemType = itemType;
        this.offsetPaged = offsetPaged;
        this.cursorPaged = cursorPaged;
        this.wrapperKey = wrapperKey;
    }

    public Class<?> itemType() {
        return itemType;
    }

    /**
     * Whether the service returns this kind in offset-based pages.
     */
    public boolean offsetPaged() {
        return offsetPaged;
    }

    /**
     * Whether the service returns this kind in cursor-based pages.
     */
    public boolean cursorPaged() {
        return cursorPaged;
    }

    /**
     * Returns the property the paging object may be nested under, or null.
     */
    public String wrapperKey() {
        return wrapperKey;
    }
}
