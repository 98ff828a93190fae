package com.chartclips.pipeline;

/**
 * Thrown when a resolved media resource could not be downloaded, trimmed or saved.
 * Recorded against a single track; the batch continues after partial files are removed.
 */
public class DownloadException extends Exception {
    public DownloadException(String message) {
        super(message);
    }

    public DownloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
