package com.chartclips.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Downloads a fixed-length clip from the middle of one track.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Resolves "{title} {artist}" to a single best match without downloading it.</li>
 *   <li>Centers a {@code clipSeconds} window in the match's duration (see {@link ClipWindow#centered}).</li>
 *   <li>Downloads only that window and saves it as {@code {storageRoot}/{trackId}.{ext}}.</li>
 * </ul>
 * <p>
 * Error Handling:
 * <ul>
 *   <li>Nothing is thrown: every failure, checked or not, is returned as a {@link FetchOutcome} message so one
 *       track can never abort the batch.</li>
 *   <li>On failure every {@code {trackId}.*} file in the storage root is deleted, so a partial clip is never
 *       taken for a completed one.</li>
 * </ul>
 * Holds no mutable state; a single instance is shared by all workers.
 *
 * @author Chart Clips Team
 * @since 1.0
 */
public class ClipDownloader {
    private static final Logger logger = LoggerFactory.getLogger(ClipDownloader.class);

    public static final int DEFAULT_CLIP_SECONDS = 30;

    private final MediaResolverInterface resolver;
    private final int clipSeconds;
    private final ClipFormat format;

    public ClipDownloader(MediaResolverInterface resolver, int clipSeconds, ClipFormat format) {
        if (resolver == null) {
            throw new IllegalArgumentException("Resolver cannot be null");
        }
        if (clipSeconds <= 0) {
            throw new IllegalArgumentException("Clip length must be positive: " + clipSeconds);
        }
        this.resolver = resolver;
        this.clipSeconds = clipSeconds;
        this.format = format == null ? ClipFormat.MP3_192 : format;
    }

    public ClipDownloader(MediaResolverInterface resolver) {
        this(resolver, DEFAULT_CLIP_SECONDS, ClipFormat.MP3_192);
    }

    /**
     * Fetches the clip of a canonical track.
     * @param track Canonical track
     * @param storageRoot Clip directory
     * @return Outcome keyed by the track id
     */
    public FetchOutcome fetch(Track track, Path storageRoot) {
        return fetch(track.title(), track.artist(), track.id(), storageRoot);
    }

    /**
     * Fetches one clip.
     * @param title Track title
     * @param artist Track artist
     * @param trackId File name of the clip, without extension
     * @param storageRoot Clip directory
     * @return Success, or failure with the error message
     */
    public FetchOutcome fetch(String title, String artist, String trackId, Path storageRoot) {
        String query = new TitleArtist(title, artist).searchQuery();
        try {
            ResolvedMedia media = resolver.resolve(query);
            ClipWindow window = ClipWindow.centered(media.durationSeconds(), clipSeconds);
            resolver.download(media.locator(), window, storageRoot, trackId, format);
            return FetchOutcome.success(trackId);
        } catch (ResolutionException | DownloadException e) {
            removePartialFiles(trackId, storageRoot);
            return FetchOutcome.failure(trackId, e.getMessage());
        } catch (RuntimeException e) {
            logger.debug("Unexpected error while fetching {}", trackId, e);
            removePartialFiles(trackId, storageRoot);
            return FetchOutcome.failure(trackId, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private void removePartialFiles(String trackId, Path storageRoot) {
        if (trackId == null || trackId.isBlank()) {
            // a blank id would match every dotfile in the storage root
            logger.warn("Skipping partial file cleanup for blank track id in {}", storageRoot);
            return;
        }
        String prefix = trackId + ".";
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(storageRoot,
                entry -> entry.getFileName().toString().startsWith(prefix))) {
            for (Path entry : entries) {
                try {
                    Files.deleteIfExists(entry);
                    logger.debug("Removed partial file {}", entry);
                } catch (IOException e) {
                    logger.warn("Failed to remove partial file {}: {}", entry, e.getMessage());
                }
            }
        } catch (IOException e) {
            logger.warn("Failed to scan {} for partial files of {}: {}", storageRoot, trackId, e.getMessage());
        }
    }
}
