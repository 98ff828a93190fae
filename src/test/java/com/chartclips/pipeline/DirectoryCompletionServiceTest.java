package com.chartclips.pipeline;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DirectoryCompletionServiceTest {
    @TempDir
    Path tempDir;

    private final DirectoryCompletionService completionService = new DirectoryCompletionService("mp3");

    @Test
    void testPendingExcludesCompletedTracks() throws IOException {
        Files.writeString(tempDir.resolve("A.mp3"), "clip");
        Files.writeString(tempDir.resolve("C.mp3"), "clip");
        Track a = new Track("https://open.spotify.com/track/A", "a", "x");
        Track b = new Track("https://open.spotify.com/track/B", "b", "y");
        Track c = new Track("https://open.spotify.com/track/C", "c", "z");

        List<Track> pending = completionService.pending(List.of(a, b, c), tempDir);

        assertEquals(List.of(b), pending);
    }

    @Test
    void testOnlyConfiguredExtensionCounts() throws IOException {
        Files.writeString(tempDir.resolve("A.webm.part"), "partial");
        Files.writeString(tempDir.resolve("B.txt"), "notes");
        Files.createDirectory(tempDir.resolve("C.mp3"));
        Files.writeString(tempDir.resolve("D.mp3"), "clip");

        assertEquals(Set.of("D"), completionService.completedIds(tempDir));
    }

    @Test
    void testPendingKeepsCanonicalOrder() throws IOException {
        List<Track> tracks = List.of(
            new Track("u/3", "c", "z"), new Track("u/1", "a", "x"), new Track("u/2", "b", "y"));
        assertEquals(tracks, completionService.pending(tracks, tempDir));
    }

    @Test
    void testMissingStorageRootIsStorageError() {
        assertThrows(StorageException.class, () -> completionService.completedIds(tempDir.resolve("missing")));
    }

    @Test
    void testEnsureStorageRootCreatesDirectories() throws IOException {
        Path songs = tempDir.resolve("data/songs");
        completionService.ensureStorageRoot(songs);
        assertTrue(Files.isDirectory(songs));
        assertTrue(completionService.completedIds(songs).isEmpty());
    }

    @Test
    void testEnsureStorageRootOverFileFails() throws IOException {
        Path file = tempDir.resolve("songs");
        Files.writeString(file, "not a directory");
        assertThrows(StorageException.class, () -> completionService.ensureStorageRoot(file));
    }
}
