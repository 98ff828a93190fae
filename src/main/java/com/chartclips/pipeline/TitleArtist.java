package com.chartclips.pipeline;

/**
 * The (title, artist) key of a track.
 */
public record TitleArtist(String title, String artist) {

    /**
     * Builds the free-text search query used to find the track's media.
     * @return "{title} {artist}"
     */
    public String searchQuery() {
        return title + " " + artist;
    }
}
