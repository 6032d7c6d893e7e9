package com.forecastsentinel.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One row of detector output: the comparison of a single (date, metric) cell.
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code metric} and {@code status} are required;
 * omitting either throws a {@link NullPointerException} at build time.
 * Instances are immutable.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyRecord {

    public static final String COL_METRIC = "metric";
    public static final String COL_ACTUAL = "actual";
    public static final String COL_FORECAST = "forecast";
    public static final String COL_LOWER = "lower";
    public static final String COL_UPPER = "upper";
    public static final String COL_STATUS = "status";
    public static final String COL_ABS_DEVIATION = "abs_deviation";
    public static final String COL_DEVIATION = "deviation";

    /** Columns that follow the date and metric/dimension columns. */
    public static final List<String> MEASURE_COLUMNS = List.of(
            COL_ACTUAL, COL_FORECAST, COL_LOWER, COL_UPPER, COL_STATUS, COL_ABS_DEVIATION, COL_DEVIATION);

    private final Object date;
    private final String metric;
    private final Map<String, String> dimensions;
    private final double actual;
    private final double forecast;
    private final double lower;
    private final double upper;
    private final AnomalyStatus status;
    private final double absoluteDeviation;
    private final double deviation;

    private AnomalyRecord(Builder builder) {
        this.date = builder.date;
        this.metric = Objects.requireNonNull(builder.metric, "metric must not be null");
        this.status = Objects.requireNonNull(builder.status, "status must not be null");
        this.dimensions = Collections.unmodifiableMap(new LinkedHashMap<>(builder.dimensions));
        this.actual = builder.actual;
        this.forecast = builder.forecast;
        this.lower = builder.lower;
        this.upper = builder.upper;
        this.absoluteDeviation = builder.absoluteDeviation;
        this.deviation = builder.deviation;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Column layout of a detector output dataset.
     *
     * @param dateColumn     name of the date column
     * @param dimensionNames dimension columns replacing {@code metric}; empty to
     *                       keep the composite metric key
     * @return ordered column names
     */
    public static List<String> columns(String dateColumn, List<String> dimensionNames) {
        List<String> columns = new ArrayList<>();
        columns.add(dateColumn);
        if (dimensionNames.isEmpty()) {
            columns.add(COL_METRIC);
        } else {
            columns.addAll(dimensionNames);
        }
        columns.addAll(MEASURE_COLUMNS);
        return columns;
    }

    /**
     * Render this record as a dataset row matching {@link #columns}.
     *
     * @param dateColumn name of the date column
     * @return row map in column order
     */
    public Map<String, Object> toRow(String dateColumn) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(dateColumn, date);
        if (dimensions.isEmpty()) {
            row.put(COL_METRIC, metric);
        } else {
            row.putAll(dimensions);
        }
        row.put(COL_ACTUAL, actual);
        row.put(COL_FORECAST, forecast);
        row.put(COL_LOWER, lower);
        row.put(COL_UPPER, upper);
        row.put(COL_STATUS, status.name());
        row.put(COL_ABS_DEVIATION, absoluteDeviation);
        row.put(COL_DEVIATION, deviation);
        return row;
    }

    /**
     * Fluent builder for {@link AnomalyRecord} instances.
     */
    public static final class Builder {
        private Object date;
        private String metric;
        private final Map<String, String> dimensions = new LinkedHashMap<>();
        private double actual;
        private double forecast;
        private double lower;
        private double upper;
        private AnomalyStatus status;
        private double absoluteDeviation;
        private double deviation;

        public Builder date(Object date) {
            this.date = date;
            return this;
        }

        public Builder metric(String metric) {
            this.metric = metric;
            return this;
        }

        public Builder dimension(String name, String value) {
            this.dimensions.put(name, value);
            return this;
        }

        public Builder actual(double actual) {
            this.actual = actual;
            return this;
        }

        public Builder forecast(double forecast) {
            this.forecast = forecast;
            return this;
        }

        public Builder lower(double lower) {
            this.lower = lower;
            return this;
        }

        public Builder upper(double upper) {
            this.upper = upper;
            return this;
        }

        public Builder status(AnomalyStatus status) {
            this.status = status;
            return this;
        }

        public Builder absoluteDeviation(double absoluteDeviation) {
            this.absoluteDeviation = absoluteDeviation;
            return this;
        }

        public Builder deviation(double deviation) {
            this.deviation = deviation;
            return this;
        }

        /**
         * @return a new {@link AnomalyRecord}
         * @throws NullPointerException if {@code metric} or {@code status} is
         *                              {@code null}
         */
        public AnomalyRecord build() {
            return new AnomalyRecord(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public Object getDate() {
        return date;
    }

    public String getMetric() {
        return metric;
    }

    /** @return unmodifiable dimension name → label map, empty when not split */
    public Map<String, String> getDimensions() {
        return dimensions;
    }

    public double getActual() {
        return actual;
    }

    public double getForecast() {
        return forecast;
    }

    public double getLower() {
        return lower;
    }

    public double getUpper() {
        return upper;
    }

    public AnomalyStatus getStatus() {
        return status;
    }

    public double getAbsoluteDeviation() {
        return absoluteDeviation;
    }

    public double getDeviation() {
        return deviation;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyRecord that))
            return false;
        return Objects.equals(date, that.date)
                && metric.equals(that.metric)
                && status == that.status
                && Double.compare(actual, that.actual) == 0
                && Double.compare(lower, that.lower) == 0
                && Double.compare(upper, that.upper) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(date, metric, status, actual, lower, upper);
    }

    @Override
    public String toString() {
        return "AnomalyRecord{" +
                "date=" + date +
                ", metric='" + metric + '\'' +
                ", actual=" + actual +
                ", lower=" + lower +
                ", upper=" + upper +
                ", status=" + status +
                ", deviation=" + deviation +
                '}';
    }
}
