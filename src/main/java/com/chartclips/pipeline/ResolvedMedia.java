package com.chartclips.pipeline;

/**
 * Best search match for a track: its duration and where to download it from.
 * @param durationSeconds Media length in seconds, 0 when unknown
 * @param locator Page url or other locator understood by the downloader
 */
public record ResolvedMedia(int durationSeconds, String locator) {}
