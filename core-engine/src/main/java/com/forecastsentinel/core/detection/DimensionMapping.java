package com.forecastsentinel.core.detection;

import com.forecastsentinel.core.model.Dataset;
import com.forecastsentinel.core.transform.PivotTransformer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Display labels for the raw tokens of one dimension.
 *
 * <p>
 * A metric key produced by a normalising pivot carries tokens such as
 * {@code producta}; the mapping turns them back into {@code Product A}.
 * Instances are immutable.
 * </p>
 *
 * @since 1.0.0
 */
public final class DimensionMapping {

    private final String dimension;
    private final Map<String, String> labels;

    private DimensionMapping(String dimension, Map<String, String> labels) {
        this.dimension = Objects.requireNonNull(dimension, "Dimension name must not be null");
        this.labels = Collections.unmodifiableMap(new LinkedHashMap<>(labels));
    }

    public static DimensionMapping of(String dimension, Map<String, String> labels) {
        return new DimensionMapping(dimension, Objects.requireNonNull(labels, "Labels must not be null"));
    }

    /**
     * Derive labels from the distinct values of a dataset column: each value's
     * normalised token maps to the first value seen with that token.
     *
     * @param dataset source dataset, typically the raw actuals
     * @param column  column holding the dimension values
     * @return mapping named after {@code column}
     */
    public static DimensionMapping fromDataset(Dataset dataset, String column) {
        Objects.requireNonNull(dataset, "Dataset must not be null");
        dataset.requireColumns("dimension-mapping", List.of(column));
        Map<String, String> labels = new LinkedHashMap<>();
        for (Object value : dataset.columnValues(column)) {
            if (value != null) {
                labels.putIfAbsent(PivotTransformer.normalizeToken(value), String.valueOf(value).trim());
            }
        }
        return new DimensionMapping(column, labels);
    }

    /**
     * @param overrides labels that replace or extend this mapping's
     * @return merged mapping
     */
    public DimensionMapping withOverride(Map<String, String> overrides) {
        Map<String, String> merged = new LinkedHashMap<>(labels);
        merged.putAll(overrides);
        return new DimensionMapping(dimension, merged);
    }

    /**
     * @param token raw token from a metric key
     * @return its label, or empty if unmapped
     */
    public Optional<String> label(String token) {
        return Optional.ofNullable(labels.get(token));
    }

    public String getDimension() {
        return dimension;
    }

    public Map<String, String> getLabels() {
        return labels;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DimensionMapping that))
            return false;
        return dimension.equals(that.dimension) && labels.equals(that.labels);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dimension, labels);
    }

    @Override
    public String toString() {
        return "DimensionMapping{dimension='" + dimension + "', labels=" + labels + '}';
    }
}
