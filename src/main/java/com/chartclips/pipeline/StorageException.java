package com.chartclips.pipeline;

import java.io.IOException;

/**
 * Thrown when the clip storage directory cannot be created or listed.
 * Fatal: the run is aborted before any download starts.
 */
public class StorageException extends IOException {
    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
