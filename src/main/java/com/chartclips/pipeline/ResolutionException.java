package com.chartclips.pipeline;

/**
 * Thrown when a search query found no media or the search itself failed.
 * Recorded against a single track; the batch continues.
 */
public class ResolutionException extends Exception {
    public ResolutionException(String message) {
        super(message);
    }

    public ResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
