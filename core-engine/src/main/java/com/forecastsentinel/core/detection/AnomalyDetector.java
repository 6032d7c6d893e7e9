package com.forecastsentinel.core.detection;

import com.forecastsentinel.core.model.Dataset;

/**
 * Contract for all anomaly detectors.
 * <p>
 * A detector compares a forecast dataset with the actual dataset observed
 * later and returns one output row per compared cell. Implementations hold no
 * state between calls and never modify their inputs.
 * </p>
 */
public interface AnomalyDetector {

    /**
     * Compare forecasts with actuals.
     *
     * @param forecast forecast dataset: a date column plus one quantile-text
     *                 column per metric
     * @param actual   actual dataset, in whatever shape the detector's
     *                 {@code before} stage turns into the forecast's shape
     * @return comparison rows
     */
    Dataset detect(Dataset forecast, Dataset actual);

    /**
     * Return the name of this detector, used in logs and error messages.
     *
     * @return detector name
     */
    String getName();
}
