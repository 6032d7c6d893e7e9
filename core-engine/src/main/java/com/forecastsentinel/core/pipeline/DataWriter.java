package com.forecastsentinel.core.pipeline;

import com.forecastsentinel.core.model.Dataset;

/**
 * Sink for a dataset.
 */
@FunctionalInterface
public interface DataWriter {

    /**
     * Write the dataset.
     *
     * @param dataset rows to write
     */
    void write(Dataset dataset);
}
