package com.chartclips.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs {@link ClipDownloader} for every pending track on a bounded worker pool and aggregates the outcomes.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Submits each pending track exactly once to a fixed pool of {@code concurrency} threads; nothing is retried.</li>
 *   <li>Consumes outcomes in completion order, logging every failure at once and progress every
 *       {@value #PROGRESS_EVERY} completions.</li>
 *   <li>Writes the failed urls, one per line in completion order, to the failure manifest. A run without failures
 *       writes no manifest and removes the one left by an earlier run.</li>
 * </ul>
 * The run returns only after every submitted track has produced an outcome.
 * <p>
 * Interrupting the calling thread cancels the remaining downloads; clips that were in flight at that moment may
 * leave partial files behind.
 *
 * @author Chart Clips Team
 * @since 1.0
 */
public class ClipDownloadOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(ClipDownloadOrchestrator.class);

    public static final int DEFAULT_CONCURRENCY = 12;
    static final int PROGRESS_EVERY = 50;

    private final ClipDownloader downloader;
    private final Path manifestPath;

    /**
     * @param downloader Per-track worker
     * @param manifestPath Where the failed urls of a run are written
     */
    public ClipDownloadOrchestrator(ClipDownloader downloader, Path manifestPath) {
        if (downloader == null) {
            throw new IllegalArgumentException("Downloader cannot be null");
        }
        if (manifestPath == null) {
            throw new IllegalArgumentException("Manifest path cannot be null");
        }
        this.downloader = downloader;
        this.manifestPath = manifestPath;
    }

    /**
     * Downloads the clips of all pending tracks.
     * @param pending Tracks without a completed clip
     * @param concurrency Maximum number of downloads in flight
     * @param storageRoot Clip directory
     * @return Number of successes and urls of failures
     * @throws IOException if the failure manifest cannot be written
     * @throws InterruptedException if the calling thread is interrupted while waiting for outcomes
     */
    public DownloadReport run(List<Track> pending, int concurrency, Path storageRoot) throws IOException, InterruptedException {
        if (concurrency < 1) {
            throw new IllegalArgumentException("Concurrency must be at least 1: " + concurrency);
        }
        int total = pending.size();
        List<String> failed = new ArrayList<>();
        int succeeded = 0;

        ExecutorService pool = newWorkerPool(concurrency);
        try {
            CompletionService<FetchOutcome> completions = new ExecutorCompletionService<>(pool);
            Map<Future<FetchOutcome>, Track> submitted = new HashMap<>();
            for (Track track : pending) {
                submitted.put(completions.submit(() -> downloader.fetch(track, storageRoot)), track);
            }

            for (int i = 1; i <= total; i++) {
                Future<FetchOutcome> future = completions.take();
                Track track = submitted.remove(future);
                FetchOutcome outcome = outcomeOf(future, track);
                if (outcome.isSuccess()) {
                    succeeded++;
                    if (i % PROGRESS_EVERY == 0 || i == total) {
                        logger.info("  [{}/{}] downloaded", i, total);
                    }
                } else {
                    failed.add(track.url());
                    logger.warn("  [{}/{}] FAILED {}: {}", i, total, outcome.trackId(), outcome.error());
                }
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            logger.warn("Download run interrupted; in-flight clips may leave partial files");
            throw e;
        } finally {
            pool.shutdown();
        }

        writeManifest(failed);
        if (!failed.isEmpty()) {
            logger.warn("{} songs failed to download, urls written to {}", failed.size(), manifestPath);
        }
        logger.info("Download run complete: {} succeeded, {} failed", succeeded, failed.size());
        return new DownloadReport(succeeded, failed);
    }

    private static FetchOutcome outcomeOf(Future<FetchOutcome> future, Track track) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            // ClipDownloader never throws; an Error thrown by a worker still counts as a failure of its track
            Throwable cause = e.getCause() == null ? e : e.getCause();
            return FetchOutcome.failure(track.id(), cause.toString());
        }
    }

    private void writeManifest(List<String> failedUrls) throws IOException {
        if (failedUrls.isEmpty()) {
            Files.deleteIfExists(manifestPath);
            return;
        }
        Path parent = manifestPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(manifestPath, String.join("\n", failedUrls), StandardCharsets.UTF_8);
    }

    private static ExecutorService newWorkerPool(int size) {
        AtomicInteger index = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("clip-worker-" + index.getAndIncrement());
            thread.setDaemon(false);
            return thread;
        };
        return new ThreadPoolExecutor(size, size, 0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>(), factory);
    }
}
