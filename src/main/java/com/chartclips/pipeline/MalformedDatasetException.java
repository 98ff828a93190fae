package com.chartclips.pipeline;

import java.io.IOException;

/**
 * Thrown when the chart table lacks a required column or holds a row too short to read it.
 * Fatal: the run is aborted before any download starts.
 */
public class MalformedDatasetException extends IOException {
    public MalformedDatasetException(String message) {
        super(message);
    }

    public MalformedDatasetException(String message, Throwable cause) {
        super(message, cause);
    }
}
