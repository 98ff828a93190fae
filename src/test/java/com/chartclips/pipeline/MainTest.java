package com.chartclips.pipeline;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the small helpers shared across the pipeline.
 */
public class MainTest {
    @Test
    void testTrackIdFromUrl() {
        assertEquals("4uLU6hMCjMI75M1A2tKUQC", Utils.trackIdFromUrl("https://open.spotify.com/track/4uLU6hMCjMI75M1A2tKUQC"));
        assertEquals("plain-id", Utils.trackIdFromUrl("plain-id"));
        assertEquals("", Utils.trackIdFromUrl("https://open.spotify.com/track/"));
        assertThrows(IllegalArgumentException.class, () -> Utils.trackIdFromUrl(null));
    }

    @Test
    void testStripExtension() {
        assertEquals("abc", Utils.stripExtension("abc.mp3", "mp3"));
        assertEquals("abc.webm", Utils.stripExtension("abc.webm.mp3", "mp3"));
        assertNull(Utils.stripExtension("abc.webm", "mp3"));
        assertNull(Utils.stripExtension(null, "mp3"));
    }

    @Test
    void testTrackRecord() {
        Track track = new Track("https://open.spotify.com/track/X", "Hello", "Adele");
        assertEquals("X", track.id());
        assertEquals(new TitleArtist("Hello", "Adele"), track.titleArtist());
        assertEquals("Hello Adele", track.titleArtist().searchQuery());
    }

    @Test
    void testFetchOutcomeFactories() {
        assertTrue(FetchOutcome.success("X").isSuccess());
        FetchOutcome failure = FetchOutcome.failure("X", null);
        assertFalse(failure.isSuccess());
        assertEquals("unknown error", failure.error());
    }

    @Test
    void testDownloadReportIsImmutable() {
        java.util.List<String> failed = new java.util.ArrayList<>(java.util.List.of("u1"));
        DownloadReport report = new DownloadReport(3, failed);
        failed.add("u2");
        assertEquals(4, report.total());
        assertThrows(UnsupportedOperationException.class, () -> report.failed().add("u3"));
    }

    @Test
    void testMalformedDatasetKeepsCause() {
        Exception cause = new IllegalStateException("bad quote");
        MalformedDatasetException e = new MalformedDatasetException("Invalid CSV content", cause);
        assertSame(cause, e.getCause());
        assertEquals("Invalid CSV content", e.getMessage());
    }
}
