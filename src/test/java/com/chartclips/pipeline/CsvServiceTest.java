package com.chartclips.pipeline;

import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvServiceTest {
    @TempDir
    Path tempDir;

    private final CsvService csvService = new CsvService();

    @Test
    void testReadTracksIgnoresExtraColumnsAndHandlesQuoting() throws IOException {
        Path csv = tempDir.resolve("charts.csv");
        Files.writeString(csv, String.join("\n",
            "title,rank,date,artist,url,region,chart,trend,streams",
            "\"Chantaje (feat. Maluma)\",1,2017-01-01,Shakira,https://open.spotify.com/track/6mICuAdrwEjh6Y6lroV2Kg,Argentina,top200,SAME_POSITION,253019",
            "\"Hello, Goodbye\",2,2017-01-01,The Beatles,https://open.spotify.com/track/0KpWiHVmIFDTvai20likX4,Argentina,top200,MOVE_UP,1000",
            ""));

        List<Track> tracks = csvService.readTracks(csv);

        assertEquals(List.of(
            new Track("https://open.spotify.com/track/6mICuAdrwEjh6Y6lroV2Kg", "Chantaje (feat. Maluma)", "Shakira"),
            new Track("https://open.spotify.com/track/0KpWiHVmIFDTvai20likX4", "Hello, Goodbye", "The Beatles")), tracks);
    }

    @Test
    void testForEachTrackStreamsInFileOrder() throws IOException {
        Path csv = tempDir.resolve("charts.csv");
        Files.writeString(csv, "url,title,artist\nu1,A,x\nu2,B,y\nu1,A2,x\n");
        List<String> urls = new ArrayList<>();

        long rows = csvService.forEachTrack(csv, track -> urls.add(track.url()));

        assertEquals(3, rows);
        assertEquals(List.of("u1", "u2", "u1"), urls);
    }

    @Test
    void testMissingColumnIsMalformed() throws IOException {
        Path csv = tempDir.resolve("charts.csv");
        Files.writeString(csv, "url,name,artist\nu1,A,x\n");

        MalformedDatasetException e = assertThrows(MalformedDatasetException.class, () -> csvService.readTracks(csv));
        assertTrue(e.getMessage().contains("title"));
    }

    @Test
    void testEmptyFileIsMalformed() throws IOException {
        Path csv = tempDir.resolve("charts.csv");
        Files.writeString(csv, "");
        assertThrows(MalformedDatasetException.class, () -> csvService.readTracks(csv));
    }

    @Test
    void testShortRowIsMalformed() throws IOException {
        Path csv = tempDir.resolve("charts.csv");
        Files.writeString(csv, "url,title,artist\nu1,A\n");
        assertThrows(MalformedDatasetException.class, () -> csvService.readTracks(csv));
    }

    @Test
    void testByteOrderMarkInHeader() throws IOException {
        Path csv = tempDir.resolve("charts.csv");
        Files.writeString(csv, "\uFEFFurl,title,artist\nu1,A,x\n");
        assertEquals(List.of(new Track("u1", "A", "x")), csvService.readTracks(csv));
    }

    @Test
    void testWriteTracksRoundTripsThroughOpenCsv() throws IOException, CsvException {
        Path csv = tempDir.resolve("out/canonical_tracks.csv");
        List<Track> tracks = List.of(
            new Track("u1", "Hello, Goodbye", "The Beatles"),
            new Track("u2", "Say \"Yes\"", "Elliott Smith"));

        csvService.writeTracks(tracks, csv);

        try (Reader in = Files.newBufferedReader(csv); CSVReader reader = new CSVReader(in)) {
            List<String[]> lines = reader.readAll();
            assertArrayEquals(new String[]{"url", "title", "artist"}, lines.get(0));
            assertArrayEquals(new String[]{"u1", "Hello, Goodbye", "The Beatles"}, lines.get(1));
            assertArrayEquals(new String[]{"u2", "Say \"Yes\"", "Elliott Smith"}, lines.get(2));
        }
        assertEquals(tracks, csvService.readTracks(csv));
    }

    @Test
    void testBackslashesSurviveWriteAndRead() throws IOException {
        Path csv = tempDir.resolve("canonical_tracks.csv");
        List<Track> tracks = List.of(
            new Track("u1", "AC\\DC Live", "AC\\DC"),
            new Track("u2", "End\\", "x"),
            new Track("u3", "Next", "y"));

        csvService.writeTracks(tracks, csv);

        assertEquals(tracks, csvService.readTracks(csv));
    }

    @Test
    void testBackslashInRawChartIsLiteral() throws IOException {
        Path csv = tempDir.resolve("charts.csv");
        Files.writeString(csv, "url,title,artist\nu1,Back\\,Slash\\\nu2,\"Say \"\"Hi\"\"\",AC\\DC\n");

        assertEquals(List.of(
            new Track("u1", "Back\\", "Slash\\"),
            new Track("u2", "Say \"Hi\"", "AC\\DC")), csvService.readTracks(csv));
    }

    @Test
    void testWriteTracksRejectsNullList() {
        assertThrows(IllegalArgumentException.class, () -> csvService.writeTracks(null, tempDir.resolve("x.csv")));
    }
}
