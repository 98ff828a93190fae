package com.chartclips.pipeline;

/**
 * The [start, end) range, in seconds, of the source media to keep.
 */
public record ClipWindow(int startSeconds, int endSeconds) {

    public ClipWindow {
        if (startSeconds < 0 || endSeconds < startSeconds) {
            throw new IllegalArgumentException("Invalid clip window [" + startSeconds + ", " + endSeconds + ")");
        }
    }

    /**
     * Centers a clip of {@code clipSeconds} in media of the given duration.
     * <ul>
     *   <li>duration &lt;= 0 (unknown): [0, clip], the downloader stops at the real end</li>
     *   <li>duration &lt;= clip: the whole media, [0, duration]</li>
     *   <li>otherwise: start = floor((duration - clip) / 2), [start, start + clip]</li>
     * </ul>
     * @param durationSeconds Media duration
     * @param clipSeconds Clip length, must be positive
     * @return Trim window
     */
    public static ClipWindow centered(int durationSeconds, int clipSeconds) {
        if (clipSeconds <= 0) {
            throw new IllegalArgumentException("Clip length must be positive: " + clipSeconds);
        }
        if (durationSeconds <= 0) {
            return new ClipWindow(0, clipSeconds);
        }
        if (durationSeconds <= clipSeconds) {
            return new ClipWindow(0, durationSeconds);
        }
        int start = (durationSeconds - clipSeconds) / 2;
        return new ClipWindow(start, start + clipSeconds);
    }

    public int lengthSeconds() {
        return endSeconds - startSeconds;
    }
}
