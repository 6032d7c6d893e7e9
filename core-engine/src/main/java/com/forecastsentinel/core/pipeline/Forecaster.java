package com.forecastsentinel.core.pipeline;

import com.forecastsentinel.core.model.Dataset;

/**
 * Forecasting model boundary.
 *
 * <p>
 * Output cells for future dates hold quantile text in the format of
 * {@link com.forecastsentinel.core.codec.QuantileCodec}.
 * </p>
 */
@FunctionalInterface
public interface Forecaster {

    /**
     * @param history observed values, one column per metric
     * @param horizon number of future periods to forecast, {@code > 0}
     * @return forecast rows
     */
    Dataset forecast(Dataset history, int horizon);
}
