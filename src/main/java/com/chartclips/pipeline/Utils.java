package com.chartclips.pipeline;

/**
 * Utility class for common helper methods used for track ids and file names.
 *
 * @author Chart Clips Team
 * @since 1.0
 */
public class Utils {

    private Utils() {}

    /**
     * Derives a track id from a track url by taking the text after the last '/'.
     * A url without '/' is returned unchanged.
     * @param url Track url, e.g. https://open.spotify.com/track/4uLU6hMCjMI75M1A2tKUQC
     * @return Track id, e.g. 4uLU6hMCjMI75M1A2tKUQC
     */
    public static String trackIdFromUrl(String url) {
        if (url == null) {
            throw new IllegalArgumentException("Track url cannot be null");
        }
        return url.substring(url.lastIndexOf('/') + 1);
    }

    /**
     * Returns the file name with the given extension removed, or null if it does not end with it.
     * @param fileName File name, e.g. abc.mp3
     * @param extension Extension without the dot, e.g. mp3
     * @return Base name, e.g. abc
     */
    public static String stripExtension(String fileName, String extension) {
        String suffix = "." + extension;
        if (fileName == null || !fileName.endsWith(suffix)) {
            return null;
        }
        return fileName.substring(0, fileName.length() - suffix.length());
    }
}
