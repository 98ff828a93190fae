package com.chartclips.pipeline;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Decides which canonical tracks still need a clip.
 * <p>
 * Completion is currently read from the clip directory itself; implementations backed by another
 * ledger can be swapped in without touching {@link ClipDownloader} or {@link ClipDownloadOrchestrator}.
 */
public interface CompletionServiceInterface {
    /**
     * Creates the storage root if it does not exist.
     * @param storageRoot Clip directory
     * @throws StorageException if the directory cannot be created
     */
    void ensureStorageRoot(Path storageRoot) throws StorageException;

    /**
     * Returns the ids of all tracks that already have a completed clip.
     * @param storageRoot Clip directory
     * @return Completed track ids
     * @throws StorageException if the directory cannot be listed
     */
    Set<String> completedIds(Path storageRoot) throws StorageException;

    /**
     * Returns the tracks without a completed clip, in the order given.
     * @param canonicalTracks Canonical tracks
     * @param storageRoot Clip directory
     * @return Pending tracks
     * @throws StorageException if the directory cannot be listed
     */
    List<Track> pending(List<Track> canonicalTracks, Path storageRoot) throws StorageException;
}
