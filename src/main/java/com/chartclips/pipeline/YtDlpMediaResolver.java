package com.chartclips.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Resolves and downloads track audio by running the yt-dlp executable.
 * <p>
 * Workflow:
 * <ul>
 *   <li>{@link #resolve}: {@code yt-dlp --dump-single-json --skip-download ytsearch1:<query>}; the JSON is parsed
 *       with Jackson and the first search entry gives the duration and page url.</li>
 *   <li>{@link #download}: extracts audio for the requested section only
 *       ({@code --download-sections *start-end}) and converts it with ffmpeg to the target codec.</li>
 * </ul>
 * <p>
 * Error Handling:
 * <ul>
 *   <li>A non-zero exit code becomes a {@link ResolutionException} or {@link DownloadException}
 *       carrying the last line yt-dlp wrote to stderr.</li>
 *   <li>A process exceeding the timeout, or a caller interrupted while waiting, kills yt-dlp and its ffmpeg
 *       children and waits for them to exit before reporting.</li>
 * </ul>
 * Instances hold no mutable state and are shared by all download workers.
 *
 * @author Chart Clips Team
 * @since 1.0
 */
public class YtDlpMediaResolver implements MediaResolverInterface {
    private static final Logger logger = LoggerFactory.getLogger(YtDlpMediaResolver.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String SEARCH_PREFIX = "ytsearch1:";
    private static final long KILL_WAIT_SECONDS = 10;

    private final String executable;
    private final Duration timeout;

    /**
     * @param executable yt-dlp binary name or path
     * @param timeout Maximum run time of a single yt-dlp invocation
     */
    public YtDlpMediaResolver(String executable, Duration timeout) {
        if (executable == null || executable.isBlank()) {
            throw new IllegalArgumentException("yt-dlp executable cannot be null or empty");
        }
        this.executable = executable;
        this.timeout = timeout;
    }

    @Override
    public ResolvedMedia resolve(String query) throws ResolutionException {
        ProcessResult result;
        try {
            result = run(buildResolveCommand(query));
        } catch (IOException e) {
            throw new ResolutionException("yt-dlp search failed for '" + query + "': " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ResolutionException("Interrupted while searching for '" + query + "'", e);
        }
        if (result.exitCode() != 0) {
            throw new ResolutionException("yt-dlp search exited with " + result.exitCode() + ": " + result.lastErrorLine());
        }
        return parseResolution(query, result.stdout());
    }

    @Override
    public Path download(String locator, ClipWindow window, Path destDir, String fileId, ClipFormat format) throws DownloadException {
        Path expected = destDir.resolve(fileId + "." + format.extension());
        ProcessResult result;
        try {
            result = run(buildDownloadCommand(locator, window, destDir, fileId, format));
        } catch (IOException e) {
            throw new DownloadException("yt-dlp download failed for " + locator + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DownloadException("Interrupted while downloading " + locator, e);
        }
        if (result.exitCode() != 0) {
            throw new DownloadException("yt-dlp download exited with " + result.exitCode() + ": " + result.lastErrorLine());
        }
        if (!Files.isRegularFile(expected)) {
            throw new DownloadException("yt-dlp finished but " + expected + " was not written");
        }
        logger.debug("Saved clip {} [{}s-{}s] from {}", expected, window.startSeconds(), window.endSeconds(), locator);
        return expected;
    }

    List<String> buildResolveCommand(String query) {
        return List.of(executable, "--quiet", "--no-warnings", "--skip-download", "--dump-single-json",
            SEARCH_PREFIX + query);
    }

    List<String> buildDownloadCommand(String locator, ClipWindow window, Path destDir, String fileId, ClipFormat format) {
        List<String> command = new ArrayList<>();
        command.add(executable);
        command.add("--quiet");
        command.add("--no-warnings");
        command.add("--no-playlist");
        command.add("-f");
        command.add("bestaudio/best");
        command.add("-x");
        command.add("--audio-format");
        command.add(format.codec());
        command.add("--audio-quality");
        command.add(format.qualityKbps() + "K");
        command.add("--download-sections");
        command.add("*" + window.startSeconds() + "-" + window.endSeconds());
        command.add("-o");
        command.add(destDir.resolve(fileId + ".%(ext)s").toString());
        command.add(locator);
        return command;
    }

    /**
     * Parses the JSON printed by {@code --dump-single-json}. A search result is a playlist whose
     * first entry is the match; a direct url yields the video object itself.
     */
    static ResolvedMedia parseResolution(String query, String json) throws ResolutionException {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (IOException e) {
            throw new ResolutionException("Unreadable yt-dlp output for '" + query + "'", e);
        }
        if (root == null || !root.isObject()) {
            throw new ResolutionException("No match for '" + query + "'");
        }
        JsonNode info = root;
        if (root.has("entries")) {
            JsonNode entries = root.path("entries");
            if (!entries.isArray() || entries.size() == 0 || entries.get(0).isNull()) {
                throw new ResolutionException("No match for '" + query + "'");
            }
            info = entries.get(0);
        }
        int duration = (int) info.path("duration").asDouble(0);
        String locator = info.path("webpage_url").asText("");
        if (locator.isBlank()) {
            locator = info.path("original_url").asText("");
        }
        if (locator.isBlank()) {
            throw new ResolutionException("Match for '" + query + "' has no page url");
        }
        return new ResolvedMedia(Math.max(duration, 0), locator);
    }

    private ProcessResult run(List<String> command) throws IOException, InterruptedException {
        Path out = Files.createTempFile("yt-dlp-", ".out");
        Path err = Files.createTempFile("yt-dlp-", ".err");
        try {
            Process process = new ProcessBuilder(command)
                .redirectOutput(out.toFile())
                .redirectError(err.toFile())
                .start();
            boolean exited;
            try {
                exited = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                destroyTree(process);
                throw e;
            }
            if (!exited) {
                destroyTree(process);
                throw new IOException("yt-dlp timed out after " + timeout.toSeconds() + "s");
            }
            return new ProcessResult(process.exitValue(),
                Files.readString(out, StandardCharsets.UTF_8),
                Files.readString(err, StandardCharsets.UTF_8));
        } finally {
            Files.deleteIfExists(out);
            Files.deleteIfExists(err);
        }
    }

    /**
     * Kills yt-dlp together with its children (ffmpeg) and waits for all of them to exit, so nothing
     * writes into the storage root once the caller starts removing partial files.
     */
    private static void destroyTree(Process process) {
        List<ProcessHandle> tree = process.descendants().collect(Collectors.toList());
        tree.forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        List<CompletableFuture<?>> exits = new ArrayList<>();
        exits.add(process.onExit());
        tree.forEach(handle -> exits.add(handle.onExit()));
        try {
            CompletableFuture.allOf(exits.toArray(CompletableFuture[]::new)).get(KILL_WAIT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            logger.warn("yt-dlp process {} did not exit within {}s of being killed", process.pid(), KILL_WAIT_SECONDS);
        }
    }

    record ProcessResult(int exitCode, String stdout, String stderr) {
        String lastErrorLine() {
            String[] lines = stderr.strip().split("\\R");
            String last = lines[lines.length - 1];
            return last.isBlank() ? "(no output)" : last;
        }
    }
}
