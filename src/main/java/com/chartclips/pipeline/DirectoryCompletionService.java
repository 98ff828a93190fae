package com.chartclips.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Directory-backed completion ledger: a track is done when {@code {storageRoot}/{id}.{extension}} exists.
 * <p>
 * The listing is taken once, before any download starts, so it never races with the workers of the same run.
 * Partial files are removed by {@link ClipDownloader} on failure and are therefore never counted as done.
 *
 * @author Chart Clips Team
 * @since 1.0
 */
public class DirectoryCompletionService implements CompletionServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(DirectoryCompletionService.class);

    private final String extension;

    /**
     * @param extension Clip file extension without the dot, e.g. mp3
     */
    public DirectoryCompletionService(String extension) {
        if (extension == null || extension.isBlank()) {
            throw new IllegalArgumentException("Extension cannot be null or empty");
        }
        this.extension = extension;
    }

    @Override
    public void ensureStorageRoot(Path storageRoot) throws StorageException {
        try {
            Files.createDirectories(storageRoot);
        } catch (IOException e) {
            throw new StorageException("Cannot create storage directory " + storageRoot, e);
        }
    }

    @Override
    public Set<String> completedIds(Path storageRoot) throws StorageException {
        Set<String> ids = new HashSet<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(storageRoot, "*." + extension)) {
            for (Path entry : entries) {
                if (!Files.isRegularFile(entry)) continue;
                String id = Utils.stripExtension(entry.getFileName().toString(), extension);
                if (id != null) ids.add(id);
            }
        } catch (IOException e) {
            throw new StorageException("Cannot list storage directory " + storageRoot, e);
        }
        return ids;
    }

    @Override
    public List<Track> pending(List<Track> canonicalTracks, Path storageRoot) throws StorageException {
        Set<String> existing = completedIds(storageRoot);
        List<Track> pending = canonicalTracks.stream()
            .filter(track -> !existing.contains(track.id()))
            .collect(Collectors.toList());
        logger.info("Downloading {} songs ({} already downloaded)", pending.size(), existing.size());
        return pending;
    }
}
