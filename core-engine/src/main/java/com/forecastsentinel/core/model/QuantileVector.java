package com.forecastsentinel.core.model;

import java.util.Arrays;

/**
 * Fixed-length quantile forecast for one (date, metric) cell.
 *
 * <p>
 * Index 0 holds the point estimate; indices 1–9 hold ascending quantile
 * levels, nominally q10 … q90. Values are not required to be monotonic;
 * {@link #isMonotonic()} reports whether they are.
 * </p>
 *
 * @since 1.0.0
 */
public final class QuantileVector {

    /** Number of values in every vector. */
    public static final int SIZE = 10;

    /** Index of the point estimate. */
    public static final int POINT_INDEX = 0;

    private final double[] values;

    private QuantileVector(double[] values) {
        this.values = values;
    }

    /**
     * @param values exactly {@value #SIZE} values, point estimate first
     * @return new vector (the array is copied)
     * @throws IllegalArgumentException if the length is not {@value #SIZE}
     */
    public static QuantileVector of(double... values) {
        if (values.length != SIZE) {
            throw new IllegalArgumentException(
                    "Quantile vector requires exactly " + SIZE + " values, got: " + values.length);
        }
        return new QuantileVector(values.clone());
    }

    /** @return the all-zero vector used for absent forecasts */
    public static QuantileVector zero() {
        return new QuantileVector(new double[SIZE]);
    }

    public double point() {
        return values[POINT_INDEX];
    }

    /**
     * @param index position in {@code [0, 9]}
     * @return the value at that position
     * @throws IndexOutOfBoundsException if the index is outside the vector
     */
    public double get(int index) {
        return values[index];
    }

    /** @return a copy of the underlying values */
    public double[] values() {
        return values.clone();
    }

    /** @return {@code true} if the quantile levels (indices 1–9) never decrease */
    public boolean isMonotonic() {
        for (int i = 2; i < SIZE; i++) {
            if (values[i] < values[i - 1]) {
                return false;
            }
        }
        return true;
    }

    /** @return {@code true} if every value is zero */
    public boolean isZero() {
        for (double v : values) {
            if (v != 0) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof QuantileVector that))
            return false;
        return Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "QuantileVector" + Arrays.toString(values);
    }
}
