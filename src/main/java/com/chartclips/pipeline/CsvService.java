package com.chartclips.pipeline;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.CSVWriter;
import com.opencsv.RFC4180ParserBuilder;
import com.opencsv.exceptions.CsvValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Service for reading chart rows and exporting track tables using OpenCSV.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Parses strictly per RFC 4180: only double quotes are special, so backslashes in titles survive.</li>
 *   <li>Locates the url, title and artist columns by header name; all other columns are ignored.</li>
 *   <li>Streams rows one at a time so multi-gigabyte chart dumps never sit in memory.</li>
 *   <li>Exports canonical and diagnostic track tables with the same three-column header.</li>
 * </ul>
 *
 * @author Chart Clips Team
 * @since 1.0
 */
public class CsvService implements CsvServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(CsvService.class);

    static final String URL = "url";
    static final String TITLE = "title";
    static final String ARTIST = "artist";

    // Header of every exported table, and the columns a chart file must carry
    private static final List<String> CSV_FIELDS = List.of(URL, TITLE, ARTIST);

    @Override
    public long forEachTrack(Path csvPath, Consumer<Track> consumer) throws IOException {
        if (csvPath == null) {
            throw new IllegalArgumentException("CSV path cannot be null");
        }
        try (Reader in = Files.newBufferedReader(csvPath, StandardCharsets.UTF_8);
             CSVReader reader = new CSVReaderBuilder(in)
                 .withCSVParser(new RFC4180ParserBuilder().build())
                 .build()) {
            String[] header = reader.readNext();
            if (header == null) {
                throw new MalformedDatasetException("CSV file is empty: " + csvPath);
            }
            int[] columns = locateColumns(header, csvPath);
            int width = Math.max(columns[0], Math.max(columns[1], columns[2])) + 1;
            long rows = 0;
            String[] line;
            while ((line = reader.readNext()) != null) {
                if (line.length == 1 && line[0].isEmpty()) {
                    continue; // blank line
                }
                if (line.length < width) {
                    throw new MalformedDatasetException(String.format(
                        "Row %d of %s has %d columns, expected at least %d", reader.getLinesRead(), csvPath, line.length, width));
                }
                consumer.accept(new Track(line[columns[0]], line[columns[1]], line[columns[2]]));
                rows++;
            }
            logger.info("Read {} rows from {}", rows, csvPath);
            return rows;
        } catch (CsvValidationException e) {
            throw new MalformedDatasetException("Invalid CSV content in " + csvPath + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<Track> readTracks(Path csvPath) throws IOException {
        List<Track> tracks = new ArrayList<>();
        forEachTrack(csvPath, tracks::add);
        return tracks;
    }

    @Override
    public void writeTracks(List<Track> tracks, Path csvPath) throws IOException {
        if (tracks == null) {
            throw new IllegalArgumentException("Track list cannot be null");
        }
        if (csvPath == null) {
            throw new IllegalArgumentException("CSV path cannot be null");
        }
        Path parent = csvPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer out = Files.newBufferedWriter(csvPath, StandardCharsets.UTF_8);
             CSVWriter writer = new CSVWriter(out)) {
            writer.writeNext(CSV_FIELDS.toArray(String[]::new), false);
            for (Track track : tracks) {
                writer.writeNext(new String[]{track.url(), track.title(), track.artist()}, false);
            }
        }
        logger.info("Wrote {} tracks to CSV file: {}", tracks.size(), csvPath);
    }

    private static int[] locateColumns(String[] header, Path csvPath) throws MalformedDatasetException {
        int[] columns = new int[CSV_FIELDS.size()];
        List<String> missing = new ArrayList<>();
        for (int i = 0; i < CSV_FIELDS.size(); i++) {
            columns[i] = indexOf(header, CSV_FIELDS.get(i));
            if (columns[i] < 0) missing.add(CSV_FIELDS.get(i));
        }
        if (!missing.isEmpty()) {
            throw new MalformedDatasetException("CSV file " + csvPath + " is missing required columns: " + missing);
        }
        return columns;
    }

    private static int indexOf(String[] header, String name) {
        for (int i = 0; i < header.length; i++) {
            // strip a UTF-8 byte order mark on the first column
            String column = header[i].replace("\uFEFF", "").trim();
            if (column.equals(name)) return i;
        }
        return -1;
    }
}
