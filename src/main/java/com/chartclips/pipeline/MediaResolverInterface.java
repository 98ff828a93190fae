package com.chartclips.pipeline;

import java.nio.file.Path;

/**
 * External search-and-download engine. Search is best effort: the first hit is taken as the track.
 */
public interface MediaResolverInterface {
    /**
     * Finds the single best match for a query without downloading it.
     * @param query Free-text query, "{title} {artist}"
     * @return Duration and locator of the match
     * @throws ResolutionException if nothing matched or the search failed
     */
    ResolvedMedia resolve(String query) throws ResolutionException;

    /**
     * Downloads only the given window of a resolved resource and saves it as {@code {destDir}/{fileId}.{ext}}.
     * @param locator Locator from {@link #resolve}
     * @param window Range to keep
     * @param destDir Directory to write to
     * @param fileId Base name of the output file
     * @param format Target codec and quality
     * @return Path of the saved clip
     * @throws DownloadException if the window could not be downloaded, transcoded or written
     */
    Path download(String locator, ClipWindow window, Path destDir, String fileId, ClipFormat format) throws DownloadException;
}
