package com.chartclips.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Base64;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Downloads one file of a Kaggle dataset through the Kaggle REST API and caches it in the data directory.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Returns {@code {dataDir}/{fileName}} at once when it already exists.</li>
 *   <li>Otherwise sends {@code GET {apiBase}/datasets/download/{owner}/{dataset}/{fileName}} with HTTP basic auth.</li>
 *   <li>Kaggle serves large files zipped; a zip response is unpacked, anything else is stored as is.</li>
 *   <li>The body goes to a temporary file first and is moved into place, so an interrupted download is never
 *       mistaken for a cached dataset.</li>
 * </ul>
 *
 * @author Chart Clips Team
 * @since 1.0
 */
public class KaggleDatasetSource implements DatasetSourceInterface {
    private static final Logger logger = LoggerFactory.getLogger(KaggleDatasetSource.class);

    private final HttpClient client;
    private final String apiBase;
    private final String dataset;
    private final String fileName;
    private final Path dataDir;
    private final String username;
    private final String key;

    /**
     * @param client HTTP client
     * @param apiBase Kaggle API base url, e.g. https://www.kaggle.com/api/v1
     * @param dataset Dataset handle, e.g. dhruvildave/spotify-charts
     * @param fileName File inside the dataset, e.g. charts.csv
     * @param dataDir Local cache directory
     * @param username Kaggle user name, may be null for public mirrors
     * @param key Kaggle API key, may be null for public mirrors
     */
    public KaggleDatasetSource(HttpClient client, String apiBase, String dataset, String fileName, Path dataDir,
                               String username, String key) {
        this.client = client;
        this.apiBase = apiBase.endsWith("/") ? apiBase.substring(0, apiBase.length() - 1) : apiBase;
        this.dataset = dataset;
        this.fileName = fileName;
        this.dataDir = dataDir;
        this.username = username;
        this.key = key;
    }

    @Override
    public Path fetchDataset() throws IOException {
        Path target = dataDir.resolve(fileName);
        if (Files.isRegularFile(target)) {
            logger.info("Using cached dataset {}", target);
            return target;
        }
        Files.createDirectories(dataDir);
        URI uri = URI.create(apiBase + "/datasets/download/" + dataset + "/" + fileName);
        HttpRequest.Builder request = HttpRequest.newBuilder().uri(uri).header("User-Agent", "ChartClips/1.0").GET();
        if (username != null && !username.isBlank() && key != null && !key.isBlank()) {
            String credentials = Base64.getEncoder().encodeToString((username + ":" + key).getBytes(StandardCharsets.UTF_8));
            request.header("Authorization", "Basic " + credentials);
        } else {
            logger.warn("No Kaggle credentials configured; trying an anonymous download of {}", uri);
        }

        logger.info("Downloading dataset {} from {}", fileName, uri);
        Path download = Files.createTempFile(dataDir, fileName, ".download");
        try {
            HttpResponse<Path> response;
            try {
                response = client.send(request.build(),
                    HttpResponse.BodyHandlers.ofFile(download));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("Interrupted while downloading " + uri, e);
            }
            if (response.statusCode() != 200) {
                throw new IOException("Dataset download from " + uri + " failed with HTTP " + response.statusCode());
            }
            if (isZip(download)) {
                unzip(download, target);
            } else {
                Files.move(download, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            }
        } finally {
            Files.deleteIfExists(download);
        }
        logger.info("Dataset saved to {} ({} bytes)", target, Files.size(target));
        return target;
    }

    private static boolean isZip(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            byte[] magic = in.readNBytes(4);
            return magic.length == 4 && magic[0] == 'P' && magic[1] == 'K' && magic[2] == 3 && magic[3] == 4;
        }
    }

    private void unzip(Path archive, Path target) throws IOException {
        Path unpacked = Files.createTempFile(dataDir, fileName, ".unzip");
        try (ZipInputStream zip = new ZipInputStream(Files.newInputStream(archive))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                if (!entry.isDirectory() && Path.of(entry.getName()).getFileName().toString().equals(fileName)) {
                    Files.copy(zip, unpacked, StandardCopyOption.REPLACE_EXISTING);
                    Files.move(unpacked, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                    return;
                }
            }
            throw new IOException("Downloaded archive does not contain " + fileName);
        } finally {
            Files.deleteIfExists(unpacked);
        }
    }
}
