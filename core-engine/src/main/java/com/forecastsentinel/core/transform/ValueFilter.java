package com.forecastsentinel.core.transform;

import com.forecastsentinel.core.error.ConfigurationException;
import com.forecastsentinel.core.error.ValidationException;
import com.forecastsentinel.core.model.Dataset;
import com.forecastsentinel.core.model.Values;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Keeps rows by the value of one column.
 *
 * <p>
 * Exactly one mode is active per instance:
 * </p>
 * <ul>
 * <li><b>categorical</b>: {@link #include} keeps rows whose value is in the
 * set, {@link #exclude} keeps rows whose value is not</li>
 * <li><b>numeric</b>: {@link #range} keeps rows whose value lies within
 * {@code [min, max]}, either bound optional; {@code null} cells are dropped,
 * non-numeric text is an error</li>
 * </ul>
 * <p>
 * {@link #alwaysKeeping} exempts rows by the value of a second column, e.g.
 * keep every {@code IN_RANGE} row while thresholding the deviation of the
 * others.
 * </p>
 *
 * @since 1.0.0
 */
public class ValueFilter implements Transformer {

    /** Matching mode: categorical include / exclude, or numeric range. */
    public enum Mode {
        INCLUDE, EXCLUDE, RANGE
    }

    private final String column;
    private final Mode mode;
    private final List<Object> values;
    private final Double min;
    private final Double max;
    private final String exemptColumn;
    private final List<Object> exemptValues;

    private ValueFilter(String column, Mode mode, Collection<?> values, Double min, Double max) {
        this(column, mode, values, min, max, null, List.of());
    }

    private ValueFilter(String column, Mode mode, Collection<?> values, Double min, Double max,
            String exemptColumn, Collection<?> exemptValues) {
        if (column == null || column.isBlank()) {
            throw new ConfigurationException(name(), "'column' is required");
        }
        this.column = column;
        this.mode = mode;
        this.values = values == null ? List.of() : new ArrayList<>(values);
        this.min = min;
        this.max = max;
        this.exemptColumn = exemptColumn;
        this.exemptValues = new ArrayList<>(exemptValues);
    }

    /**
     * @param column column to test
     * @param values values to keep
     * @return categorical include filter
     * @throws ConfigurationException if {@code values} is empty
     */
    public static ValueFilter include(String column, Collection<?> values) {
        return categorical(column, Mode.INCLUDE, values);
    }

    /**
     * @param column column to test
     * @param values values to drop
     * @return categorical exclude filter
     * @throws ConfigurationException if {@code values} is empty
     */
    public static ValueFilter exclude(String column, Collection<?> values) {
        return categorical(column, Mode.EXCLUDE, values);
    }

    /**
     * @param column column to test
     * @param min    inclusive minimum, or {@code null}
     * @param max    inclusive maximum, or {@code null}
     * @return numeric range filter
     * @throws ConfigurationException if both bounds are {@code null} or
     *                                {@code min > max}
     */
    public static ValueFilter range(String column, Double min, Double max) {
        if (min == null && max == null) {
            throw new ConfigurationException(TransformerKind.VALUE_FILTER.tag(),
                    "Numeric filter on '" + column + "' requires 'min' and/or 'max'");
        }
        if (min != null && max != null && min > max) {
            throw new ConfigurationException(TransformerKind.VALUE_FILTER.tag(),
                    "min (" + min + ") must be <= max (" + max + ") for column '" + column + "'");
        }
        return new ValueFilter(column, Mode.RANGE, null, min, max);
    }

    /**
     * Copy of this filter that keeps, whatever its own test says, every row
     * whose {@code exemptColumn} holds one of {@code exemptValues}.
     *
     * @param exemptColumn column checked first
     * @param exemptValues values that exempt a row
     * @return new filter
     * @throws ConfigurationException if the column is blank or no value is
     *                                given
     */
    public ValueFilter alwaysKeeping(String exemptColumn, Collection<?> exemptValues) {
        if (exemptColumn == null || exemptColumn.isBlank()) {
            throw new ConfigurationException(name(), "Exempt column is required");
        }
        if (exemptValues == null || exemptValues.isEmpty()) {
            throw new ConfigurationException(name(),
                    "Exemption on '" + exemptColumn + "' requires at least one value");
        }
        return new ValueFilter(column, mode, values, min, max, exemptColumn, exemptValues);
    }

    private static ValueFilter categorical(String column, Mode mode, Collection<?> values) {
        if (values == null || values.isEmpty()) {
            throw new ConfigurationException(TransformerKind.VALUE_FILTER.tag(),
                    "Categorical filter on '" + column + "' requires at least one value");
        }
        return new ValueFilter(column, mode, values, null, null);
    }

    @Override
    public Dataset apply(Dataset dataset) {
        Objects.requireNonNull(dataset, "Dataset must not be null");
        dataset.requireColumns(name(), exemptColumn == null ? List.of(column) : List.of(column, exemptColumn));
        return dataset.filter(row -> isExempt(row) || matches(row));
    }

    private boolean matches(Map<String, Object> row) {
        return switch (mode) {
            case INCLUDE -> contains(values, row.get(column));
            case EXCLUDE -> !contains(values, row.get(column));
            case RANGE -> withinRange(row);
        };
    }

    private boolean isExempt(Map<String, Object> row) {
        return exemptColumn != null && contains(exemptValues, row.get(exemptColumn));
    }

    private static boolean contains(List<Object> candidates, Object cell) {
        for (Object value : candidates) {
            if (Values.sameValue(cell, value)) {
                return true;
            }
        }
        return false;
    }

    private boolean withinRange(Map<String, Object> row) {
        Object raw = row.get(column);
        if (raw == null) {
            return false;
        }
        Optional<Double> number = Values.asDouble(raw);
        if (number.isEmpty()) {
            throw new ValidationException(name(),
                    "Value '" + raw + "' in column '" + column + "' is not numeric");
        }
        double v = number.get();
        return (min == null || v >= min) && (max == null || v <= max);
    }

    @Override
    public TransformerKind kind() {
        return TransformerKind.VALUE_FILTER;
    }

    public String getColumn() {
        return column;
    }

    public Mode getMode() {
        return mode;
    }

    public Optional<String> getExemptColumn() {
        return Optional.ofNullable(exemptColumn);
    }

    @Override
    public String toString() {
        String test = mode == Mode.RANGE
                ? "min=" + min + ", max=" + max
                : mode.name().toLowerCase(Locale.ROOT) + "=" + values;
        String exemption = exemptColumn == null ? "" : ", exempt " + exemptColumn + "=" + exemptValues;
        return "ValueFilter{column='" + column + "', " + test + exemption + '}';
    }
}
