package com.forecastsentinel.core.transform;

import com.forecastsentinel.core.error.ConfigurationException;
import com.forecastsentinel.core.error.ValidationException;
import com.forecastsentinel.core.model.Dataset;
import com.forecastsentinel.core.model.Values;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Maps the cells of named columns through a value-to-text function.
 *
 * <p>
 * {@code null} cells are left as {@code null}. Every configured column must
 * exist in the dataset.
 * </p>
 *
 * @since 1.0.0
 */
public class ColumnFormatter implements Transformer {

    private final Map<String, Function<Object, String>> formatters;

    public ColumnFormatter(Map<String, Function<Object, String>> formatters) {
        if (formatters == null || formatters.isEmpty()) {
            throw new ConfigurationException(name(), "At least one column formatter is required");
        }
        this.formatters = Collections.unmodifiableMap(new LinkedHashMap<>(formatters));
    }

    /**
     * Percentage formatter for a set of columns: optionally multiplies by 100,
     * then renders {@code decimalPlaces} decimals followed by {@code %}
     * ({@code 0.1234 -> "12.34%"}).
     *
     * @param columns       columns to format
     * @param decimalPlaces number of decimals, {@code >= 0}
     * @param multiplyBy100 whether cells hold fractions
     * @return formatter over {@code columns}
     * @throws ConfigurationException if {@code columns} is empty or
     *                                {@code decimalPlaces} is negative
     */
    public static ColumnFormatter percentage(List<String> columns, int decimalPlaces, boolean multiplyBy100) {
        if (columns == null || columns.isEmpty()) {
            throw new ConfigurationException(TransformerKind.COLUMN_FORMATTER.tag(),
                    "Percentage formatter requires at least one column");
        }
        Function<Object, String> format = percentageFunction(decimalPlaces, multiplyBy100);
        Map<String, Function<Object, String>> formatters = new LinkedHashMap<>();
        for (String column : columns) {
            formatters.put(column, format);
        }
        return new ColumnFormatter(formatters);
    }

    /**
     * @param decimalPlaces number of decimals, {@code >= 0}
     * @param multiplyBy100 whether values are fractions
     * @return the percentage rendering function
     */
    public static Function<Object, String> percentageFunction(int decimalPlaces, boolean multiplyBy100) {
        if (decimalPlaces < 0) {
            throw new ConfigurationException(TransformerKind.COLUMN_FORMATTER.tag(),
                    "decimalPlaces must be >= 0, got " + decimalPlaces);
        }
        String pattern = "%." + decimalPlaces + "f%%";
        return value -> {
            double v = Values.asDouble(value).orElseThrow(() -> new ValidationException(
                    TransformerKind.COLUMN_FORMATTER.tag(), "Value '" + value + "' is not numeric"));
            return String.format(Locale.ROOT, pattern, multiplyBy100 ? v * 100.0 : v);
        };
    }

    @Override
    public Dataset apply(Dataset dataset) {
        Objects.requireNonNull(dataset, "Dataset must not be null");
        dataset.requireColumns(name(), formatters.keySet());
        return dataset.withRows(dataset.rows().stream().map(this::formatRow).toList());
    }

    private Map<String, Object> formatRow(Map<String, Object> row) {
        Map<String, Object> out = new LinkedHashMap<>(row);
        formatters.forEach((column, formatter) -> {
            Object cell = row.get(column);
            out.put(column, cell == null ? null : formatter.apply(cell));
        });
        return out;
    }

    @Override
    public TransformerKind kind() {
        return TransformerKind.COLUMN_FORMATTER;
    }

    public Map<String, Function<Object, String>> getFormatters() {
        return formatters;
    }

    @Override
    public String toString() {
        return "ColumnFormatter{columns=" + formatters.keySet() + '}';
    }
}
