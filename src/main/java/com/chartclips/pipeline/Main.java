package com.chartclips.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Main entry point for the chart clip downloader.
 * <p>
 * Modes (first argument):
 * <ul>
 *   <li>{@code download} (default): fetch the chart dataset, canonicalize it, skip tracks that already have a clip
 *       and download a 30 second clip for every other track.</li>
 *   <li>{@code canonicalize}: write the canonical url/title/artist table only.</li>
 *   <li>{@code audit}: write the urls whose title/artist drifts in the raw data only.</li>
 * </ul>
 *
 * @author Chart Clips Team
 * @since 1.0
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    /**
     * Main application entry point.
     * @param args Command-line arguments
     */
    public static void main(String[] args) {
        String mode = (args != null && args.length > 0) ? args[0].trim().toLowerCase() : "download";
        PipelineConfig config = PipelineConfig.load();
        logger.info("Starting in '{}' mode with {}", mode, config);
        try {
            switch (mode) {
                case "download" -> download(config);
                case "canonicalize" -> canonicalize(config);
                case "audit" -> audit(config);
                default -> {
                    logger.error("Unknown mode '{}'. Expected one of: download, canonicalize, audit", mode);
                    System.exit(2);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("Interrupted, exiting");
            System.exit(130);
        } catch (IOException | IllegalArgumentException e) {
            logger.error("Fatal error: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    /**
     * Streams the raw chart CSV through the first canonicalization pass.
     * @param config Configuration
     * @return First pass result
     * @throws IOException if the dataset cannot be fetched, read, or is malformed
     */
    static UrlMetadataIndex indexDataset(PipelineConfig config) throws IOException {
        DatasetSourceInterface datasetSource = new KaggleDatasetSource(
            HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NORMAL).connectTimeout(Duration.ofSeconds(30)).build(),
            config.kaggleApiBase(), config.kaggleDataset(), config.kaggleFile(), config.dataDir(),
            config.kaggleUsername(), config.kaggleKey());
        Path csvPath = datasetSource.fetchDataset();
        CsvServiceInterface csvService = new CsvService();
        UrlMetadataIndex index = new UrlMetadataIndex();
        csvService.forEachTrack(csvPath, index);
        return index;
    }

    private static void download(PipelineConfig config) throws IOException, InterruptedException {
        List<Track> canonical = new CanonicalizerService().canonicalize(indexDataset(config));
        Path songsDir = config.songsDir();
        CompletionServiceInterface completionService = new DirectoryCompletionService(config.format().extension());
        completionService.ensureStorageRoot(songsDir);
        List<Track> pending = completionService.pending(canonical, songsDir);

        MediaResolverInterface resolver = new YtDlpMediaResolver(config.ytDlpPath(), config.ytDlpTimeout());
        ClipDownloader downloader = new ClipDownloader(resolver, config.clipSeconds(), config.format());
        ClipDownloadOrchestrator orchestrator = new ClipDownloadOrchestrator(downloader, config.failedManifest());
        DownloadReport report = orchestrator.run(pending, config.concurrency(), songsDir);
        if (!report.failed().isEmpty()) {
            logger.warn("{} of {} songs failed to download", report.failed().size(), report.total());
        }
    }

    private static void canonicalize(PipelineConfig config) throws IOException {
        List<Track> canonical = new CanonicalizerService().canonicalize(indexDataset(config));
        new CsvService().writeTracks(canonical, config.canonicalTracks());
    }

    private static void audit(PipelineConfig config) throws IOException {
        UrlMetadataIndex index = indexDataset(config);
        List<Track> drift = new CanonicalizerService().metadataDrift(index);
        logger.info("{} of {} urls have more than one title/artist", index.driftingUrls().size(), index.urlCount());
        new CsvService().writeTracks(drift, config.metadataDriftReport());
    }
}
