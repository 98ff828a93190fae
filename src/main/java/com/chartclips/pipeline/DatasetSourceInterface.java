package com.chartclips.pipeline;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Provides the raw chart CSV on local disk.
 */
public interface DatasetSourceInterface {
    /**
     * Makes the dataset available locally. Idempotent: a cached copy is returned without downloading again.
     * @return Path of the local CSV file
     * @throws IOException if the dataset cannot be fetched
     */
    Path fetchDataset() throws IOException;
}
