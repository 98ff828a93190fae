package com.chartclips.pipeline;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CanonicalizerServiceTest {
    private final CanonicalizerService canonicalizer = new CanonicalizerService();

    private static Track row(String url, String title, String artist) {
        return new Track(url, title, artist);
    }

    @Test
    void testMetadataDriftKeepsFirstSeenSpelling() {
        List<Track> raw = List.of(
            row("https://s/track/a", "Blinding Lights", "The Weeknd"),
            row("https://s/track/a", "Blinding Lights - Remastered", "The Weeknd"),
            row("https://s/track/a", "Blinding Lights", "Weeknd"));

        List<Track> canonical = canonicalizer.canonicalize(raw);

        assertEquals(List.of(row("https://s/track/a", "Blinding Lights", "The Weeknd")), canonical);
    }

    @Test
    void testReReleaseKeepsFirstSeenUrl() {
        List<Track> raw = List.of(
            row("https://s/track/b", "Hello", "Adele"),
            row("https://s/track/a", "Hello", "Adele"),
            row("https://s/track/b", "Hello", "Adele"));

        List<Track> canonical = canonicalizer.canonicalize(raw);

        assertEquals(List.of(row("https://s/track/b", "Hello", "Adele")), canonical);
    }

    @Test
    void testSecondPassGroupsOnFirstPassOutput() {
        // url c is first listed under a different spelling, so after pass 1 it no longer collides with a
        List<Track> raw = List.of(
            row("https://s/track/a", "Song", "X"),
            row("https://s/track/c", "Song (Live)", "X"),
            row("https://s/track/c", "Song", "X"),
            row("https://s/track/d", "Song", "X"));

        Map<String, TitleArtist> byUrl = UrlMetadataIndex.of(raw).canonicalMetadataByUrl();
        assertEquals(new TitleArtist("Song (Live)", "X"), byUrl.get("https://s/track/c"));

        Map<TitleArtist, String> byPair = canonicalizer.canonicalUrlByTitleArtist(byUrl);
        assertEquals("https://s/track/a", byPair.get(new TitleArtist("Song", "X")));
        assertEquals("https://s/track/c", byPair.get(new TitleArtist("Song (Live)", "X")));

        assertEquals(List.of(
            row("https://s/track/a", "Song", "X"),
            row("https://s/track/c", "Song (Live)", "X")), canonicalizer.canonicalize(raw));
    }

    @Test
    void testOutputHasUrlAndTitleArtistAsKeys() {
        List<Track> raw = List.of(
            row("u1", "A", "x"), row("u2", "A", "x"), row("u1", "B", "y"),
            row("u3", "B", "y"), row("u3", "C", "z"), row("u4", "C", "z"),
            row("u5", "D", "w"), row("u4", "D", "w"), row("u2", "E", "v"));

        List<Track> canonical = canonicalizer.canonicalize(raw);

        Set<String> urls = new HashSet<>();
        Set<TitleArtist> pairs = new HashSet<>();
        for (Track track : canonical) {
            assertTrue(urls.add(track.url()), "duplicate url " + track.url());
            assertTrue(pairs.add(track.titleArtist()), "duplicate pair " + track.titleArtist());
        }
        // u1,u2 -> (A,x); u3 -> (B,y); u4 -> (C,z); u5 -> (D,w)
        assertEquals(List.of(
            row("u1", "A", "x"),
            row("u3", "B", "y"),
            row("u4", "C", "z"),
            row("u5", "D", "w")), canonical);
    }

    @Test
    void testCanonicalizationIsIdempotent() {
        List<Track> raw = List.of(
            row("u1", "A", "x"), row("u2", "A", "x"), row("u1", "B", "y"),
            row("u3", "B", "y"), row("u3", "C", "z"), row("u4", "C", "z"));

        List<Track> once = canonicalizer.canonicalize(raw);
        List<Track> twice = canonicalizer.canonicalize(once);

        assertEquals(new HashSet<>(once), new HashSet<>(twice));
    }

    @Test
    void testEmptyTable() {
        assertTrue(canonicalizer.canonicalize(List.of()).isEmpty());
    }

    @Test
    void testNullFieldIsRejected() {
        List<Track> raw = List.of(row("u1", null, "x"));
        assertThrows(IllegalArgumentException.class, () -> canonicalizer.canonicalize(raw));
    }

    @Test
    void testMetadataDriftReportIsSorted() {
        List<Track> raw = List.of(
            row("u2", "Zeta", "b"),
            row("u1", "Same", "a"),
            row("u2", "Alpha", "b"),
            row("u1", "Same", "a"),
            row("u3", "One", "c"),
            row("u3", "One", "C"));

        List<Track> drift = canonicalizer.metadataDrift(UrlMetadataIndex.of(raw));

        assertEquals(List.of(
            row("u2", "Alpha", "b"),
            row("u2", "Zeta", "b"),
            row("u3", "One", "C"),
            row("u3", "One", "c")), drift);
    }

    @Test
    void testIndexCounts() {
        UrlMetadataIndex index = UrlMetadataIndex.of(List.of(row("u1", "A", "x"), row("u1", "A", "x"), row("u2", "B", "y")));
        assertEquals(3, index.rowCount());
        assertEquals(2, index.urlCount());
        assertTrue(index.driftingUrls().isEmpty());
    }
}
