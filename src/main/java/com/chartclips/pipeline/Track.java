package com.chartclips.pipeline;

/**
 * Immutable record representing one chart row: a track url plus its title and artist.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Raw rows are read from the chart CSV by {@link CsvService}; columns other than url, title and artist are dropped.</li>
 *   <li>{@link CanonicalizerService} turns the raw rows into canonical tracks where url and (title, artist) are both keys.</li>
 *   <li>The canonical track is the unit of work for {@link ClipDownloader}; its {@link #id()} names the clip file.</li>
 * </ul>
 *
 * @author Chart Clips Team
 * @since 1.0
 */
public record Track(String url, String title, String artist) {

    /**
     * Returns the track id, i.e. the final path segment of the url.
     * @return Filesystem-safe identifier used as the clip file name
     */
    public String id() {
        return Utils.trackIdFromUrl(url);
    }

    /**
     * Returns the (title, artist) key of this track.
     * @return TitleArtist pair
     */
    public TitleArtist titleArtist() {
        return new TitleArtist(title, artist);
    }
}
