package com.forecastsentinel.core.pipeline;

import com.forecastsentinel.core.model.Dataset;

/**
 * Source of a dataset: a file, a table, a query result.
 */
@FunctionalInterface
public interface DataReader {

    /**
     * Load the dataset.
     *
     * @return loaded rows; never {@code null}
     */
    Dataset load();
}
