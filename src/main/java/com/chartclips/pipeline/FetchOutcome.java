package com.chartclips.pipeline;

/**
 * Result of fetching one track's clip.
 * @param trackId Id of the track
 * @param error Failure message, or null on success
 */
public record FetchOutcome(String trackId, String error) {

    public static FetchOutcome success(String trackId) {
        return new FetchOutcome(trackId, null);
    }

    public static FetchOutcome failure(String trackId, String error) {
        return new FetchOutcome(trackId, error == null ? "unknown error" : error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
