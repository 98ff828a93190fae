package com.chartclips.pipeline;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Consumer;

/**
 * Interface for reading chart rows from, and writing tracks to, CSV files.
 */
public interface CsvServiceInterface {
    /**
     * Streams every row of a chart CSV as a {@link Track}, in file order.
     * @param csvPath CSV file with at least the columns url, title and artist
     * @param consumer Receives each row
     * @return Number of rows read
     * @throws MalformedDatasetException if a required column is missing or a row is too short
     * @throws IOException if the file cannot be read
     */
    long forEachTrack(Path csvPath, Consumer<Track> consumer) throws IOException;

    /**
     * Reads every row of a chart CSV into memory.
     * @param csvPath CSV file with at least the columns url, title and artist
     * @return Rows in file order
     * @throws IOException if the file cannot be read or is malformed
     */
    List<Track> readTracks(Path csvPath) throws IOException;

    /**
     * Writes tracks to a CSV file with a url,title,artist header, replacing any existing file.
     * @param tracks Tracks to export
     * @param csvPath Output CSV file
     * @throws IOException if file writing fails
     */
    void writeTracks(List<Track> tracks, Path csvPath) throws IOException;
}
