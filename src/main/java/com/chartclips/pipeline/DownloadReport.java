package com.chartclips.pipeline;

import java.util.List;

/**
 * Aggregate result of a download run.
 * @param succeeded Number of tracks whose clip was saved
 * @param failed Urls of the tracks that failed, in completion order
 */
public record DownloadReport(int succeeded, List<String> failed) {

    public DownloadReport {
        failed = List.copyOf(failed);
    }

    public int total() {
        return succeeded + failed.size();
    }
}
