package com.forecastsentinel.core.model;

/**
 * Outcome of comparing one actual value with its forecast interval.
 *
 * @since 1.0.0
 */
public enum AnomalyStatus {

    /** Actual lies within {@code [lower, upper]}, bounds inclusive. */
    IN_RANGE,

    /** Actual is strictly below the lower bound. */
    BELOW_LOWER,

    /** Actual is strictly above the upper bound. */
    ABOVE_UPPER,

    /** Forecast is absent or degenerate ({@code lower == upper == 0}). */
    NO_FORECAST;

    /**
     * Classify an actual value against a forecast interval.
     *
     * @param actual observed value
     * @param lower  lower bound of the interval
     * @param upper  upper bound of the interval
     * @return exactly one status
     */
    public static AnomalyStatus classify(double actual, double lower, double upper) {
        if (lower == 0 && upper == 0) {
            return NO_FORECAST;
        }
        if (actual < lower) {
            return BELOW_LOWER;
        }
        if (actual > upper) {
            return ABOVE_UPPER;
        }
        return IN_RANGE;
    }

    /** @return {@code true} for {@link #BELOW_LOWER} and {@link #ABOVE_UPPER} */
    public boolean isAnomaly() {
        return this == BELOW_LOWER || this == ABOVE_UPPER;
    }
}
