package com.chartclips.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;

/**
 * Runtime settings of the pipeline.
 * <p>
 * Each key is looked up as a JVM system property, then as an environment variable, then in a {@code .env}
 * file of the working directory, and finally falls back to its default.
 *
 * @author Chart Clips Team
 * @since 1.0
 */
public record PipelineConfig(
    Path dataDir,
    int concurrency,
    int clipSeconds,
    ClipFormat format,
    String ytDlpPath,
    Duration ytDlpTimeout,
    String kaggleApiBase,
    String kaggleDataset,
    String kaggleFile,
    String kaggleUsername,
    String kaggleKey
) {
    private static final Logger logger = LoggerFactory.getLogger(PipelineConfig.class);

    static final Path DOT_ENV = Paths.get(".env");

    /**
     * Loads the configuration from system properties, the environment and {@code ./.env}.
     * @return Configuration
     */
    public static PipelineConfig load() {
        return load(System.getProperties(), System.getenv(), readDotEnv(DOT_ENV));
    }

    static PipelineConfig load(Properties system, Map<String, String> env, Properties dotEnv) {
        Lookup lookup = new Lookup(system, env, dotEnv);
        return new PipelineConfig(
            Paths.get(lookup.get("CHARTS_DATA_DIR", "data")),
            lookup.getPositiveInt("CHARTS_CONCURRENCY", ClipDownloadOrchestrator.DEFAULT_CONCURRENCY),
            lookup.getPositiveInt("CLIP_SECONDS", ClipDownloader.DEFAULT_CLIP_SECONDS),
            new ClipFormat(lookup.get("AUDIO_CODEC", "mp3"), lookup.getPositiveInt("AUDIO_QUALITY", 192)),
            lookup.get("YT_DLP_PATH", "yt-dlp"),
            Duration.ofSeconds(lookup.getPositiveInt("YT_DLP_TIMEOUT_SECONDS", 600)),
            lookup.get("KAGGLE_API_BASE", "https://www.kaggle.com/api/v1"),
            lookup.get("KAGGLE_DATASET", "dhruvildave/spotify-charts"),
            lookup.get("KAGGLE_FILE", "charts.csv"),
            lookup.get("KAGGLE_USERNAME", null),
            lookup.get("KAGGLE_KEY", null)
        );
    }

    static Properties readDotEnv(Path file) {
        Properties properties = new Properties();
        if (!Files.isRegularFile(file)) {
            return properties;
        }
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            properties.load(reader);
            // .env values are often quoted
            properties.replaceAll((k, v) -> unquote(v.toString().trim()));
        } catch (IOException e) {
            logger.warn("Failed to read {}: {}", file, e.getMessage());
        }
        return properties;
    }

    private static String unquote(String value) {
        if (value.length() >= 2 && (value.startsWith("\"") && value.endsWith("\"")
            || value.startsWith("'") && value.endsWith("'"))) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }

    /** Directory the clips are saved in. */
    public Path songsDir() {
        return dataDir.resolve("songs");
    }

    /** Failed urls of the last run. */
    public Path failedManifest() {
        return dataDir.resolve("failed_urls.txt");
    }

    /** Urls with more than one title/artist spelling in the raw data. */
    public Path metadataDriftReport() {
        return dataDir.resolve("metadata_drift.csv");
    }

    /** Canonical url/title/artist table. */
    public Path canonicalTracks() {
        return dataDir.resolve("canonical_tracks.csv");
    }

    @Override
    public String toString() {
        return "PipelineConfig[dataDir=" + dataDir + ", concurrency=" + concurrency + ", clipSeconds=" + clipSeconds
            + ", format=" + format + ", ytDlpPath=" + ytDlpPath + ", kaggleDataset=" + kaggleDataset
            + ", kaggleFile=" + kaggleFile + ", kaggleUsername=" + kaggleUsername
            + ", kaggleKey=" + (kaggleKey == null ? "unset" : "****") + "]";
    }

    private record Lookup(Properties system, Map<String, String> env, Properties dotEnv) {
        String get(String key, String defaultValue) {
            String value = system.getProperty(key);
            if (value == null || value.isBlank()) value = env.get(key);
            if (value == null || value.isBlank()) value = dotEnv.getProperty(key);
            return value == null || value.isBlank() ? defaultValue : value.trim();
        }

        int getInt(String key, int defaultValue) {
            String value = get(key, null);
            if (value == null) return defaultValue;
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                logger.warn("Ignoring invalid integer {}={}, using {}", key, value, defaultValue);
                return defaultValue;
            }
        }

        int getPositiveInt(String key, int defaultValue) {
            int value = getInt(key, defaultValue);
            if (value < 1) {
                logger.warn("Ignoring non-positive {}={}, using {}", key, value, defaultValue);
                return defaultValue;
            }
            return value;
        }
    }
}
