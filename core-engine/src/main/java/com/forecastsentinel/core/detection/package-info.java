/**
 * Forecast-versus-actual comparison.
 *
 * <p>
 * {@link com.forecastsentinel.core.detection.ForecastActualDetector} aligns
 * the two datasets, decodes the quantile cells and classifies every actual
 * value; {@link com.forecastsentinel.core.detection.DimensionSplitter} and
 * {@link com.forecastsentinel.core.detection.DimensionMapping} turn composite
 * metric keys back into labelled dimensions.
 * </p>
 *
 * @since 1.0.0
 */
package com.forecastsentinel.core.detection;
