package com.forecastsentinel.core.transform;

import com.forecastsentinel.core.error.ConfigurationException;
import com.forecastsentinel.core.error.ValidationException;
import com.forecastsentinel.core.model.Dataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Reshapes long rows into wide rows.
 *
 * <p>
 * The output has one row per distinct {@code index} tuple (in order of first
 * appearance) and one value column per distinct combination of the
 * {@code columns} keys (sorted lexicographically), holding the matching
 * {@code values} cell. Combinations that never occur for an index are
 * {@code null}.
 * </p>
 *
 * <h3>Column names</h3>
 * <p>
 * With {@code normalizeNames} (the default) every token is lower-cased and
 * stripped of whitespace, so {@code "Product A"} becomes {@code producta}.
 * Multiple keys are joined with the separator ({@code _} by default); a token
 * that itself contains the separator is rejected in that case because the
 * resulting name could not be split back into its parts.
 * </p>
 *
 * <h3>Duplicates</h3>
 * <p>
 * Several rows for the same (index, combination) pair resolve
 * last-write-wins in source row order. The number of overwritten cells and
 * the first duplicate key are logged at WARN.
 * </p>
 *
 * @since 1.0.0
 */
public class PivotTransformer implements Transformer {

    private static final Logger LOG = LoggerFactory.getLogger(PivotTransformer.class);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public static final String DEFAULT_SEPARATOR = "_";

    private final List<String> index;
    private final List<String> columns;
    private final String values;
    private final String separator;
    private final boolean normalizeNames;

    public PivotTransformer(List<String> index, List<String> columns, String values) {
        this(index, columns, values, DEFAULT_SEPARATOR, true);
    }

    /**
     * @param index          row-grouping columns, typically the date
     * @param columns        columns whose combined values become column names
     * @param values         column supplying the cell contents
     * @param separator      joins multiple {@code columns} tokens
     * @param normalizeNames lower-case and strip whitespace from tokens
     * @throws ConfigurationException if a key is empty or keys overlap
     */
    public PivotTransformer(List<String> index, List<String> columns, String values,
            String separator, boolean normalizeNames) {
        Objects.requireNonNull(index, "index must not be null");
        Objects.requireNonNull(columns, "columns must not be null");
        if (index.isEmpty()) {
            throw new ConfigurationException(name(), "'index' requires at least one column");
        }
        if (columns.isEmpty()) {
            throw new ConfigurationException(name(), "'columns' requires at least one column");
        }
        if (values == null || values.isBlank()) {
            throw new ConfigurationException(name(), "'values' column is required");
        }
        if (separator == null || separator.isEmpty()) {
            throw new ConfigurationException(name(), "'separator' must not be empty");
        }
        Set<String> seen = new HashSet<>();
        List<String> all = new ArrayList<>(index);
        all.addAll(columns);
        all.add(values);
        for (String column : all) {
            if (!seen.add(column)) {
                throw new ConfigurationException(name(),
                        "Column '" + column + "' is used more than once across index/columns/values");
            }
        }
        this.index = List.copyOf(index);
        this.columns = List.copyOf(columns);
        this.values = values;
        this.separator = separator;
        this.normalizeNames = normalizeNames;
    }

    /**
     * Normalise a dimension value into a column-name token: lower-case, no
     * whitespace.
     *
     * @param value raw cell value
     * @return token
     */
    public static String normalizeToken(Object value) {
        return WHITESPACE.matcher(String.valueOf(value)).replaceAll("").toLowerCase(Locale.ROOT);
    }

    @Override
    public Dataset apply(Dataset dataset) {
        dataset.requireNonEmpty(name(), "Pivot input");
        List<String> required = new ArrayList<>(index);
        required.addAll(columns);
        required.add(values);
        dataset.requireColumns(name(), required);

        Map<List<Object>, Map<String, Object>> grouped = new LinkedHashMap<>();
        Set<String> valueColumns = new TreeSet<>();
        int duplicates = 0;
        String firstDuplicate = null;

        List<Map<String, Object>> rows = dataset.rows();
        for (int i = 0; i < rows.size(); i++) {
            Map<String, Object> row = rows.get(i);
            List<Object> key = new ArrayList<>(index.size());
            for (String column : index) {
                key.add(row.get(column));
            }
            String metric = metricKey(row, i);
            Map<String, Object> cells = grouped.computeIfAbsent(key, k -> new HashMap<>());
            if (cells.containsKey(metric)) {
                duplicates++;
                if (firstDuplicate == null) {
                    firstDuplicate = key + "/" + metric;
                }
            }
            cells.put(metric, row.get(values));
            valueColumns.add(metric);
        }

        for (String column : index) {
            if (valueColumns.contains(column)) {
                throw new ValidationException(name(), "Pivoted column '" + column
                        + "' collides with index column of the same name");
            }
        }
        if (duplicates > 0) {
            LOG.warn("Pivot resolved {} duplicate cell(s) last-write-wins; first duplicate: {}",
                    duplicates, firstDuplicate);
        }

        List<String> outputColumns = new ArrayList<>(index);
        outputColumns.addAll(valueColumns);

        List<Map<String, Object>> output = new ArrayList<>(grouped.size());
        for (Map.Entry<List<Object>, Map<String, Object>> entry : grouped.entrySet()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 0; i < index.size(); i++) {
                row.put(index.get(i), entry.getKey().get(i));
            }
            for (String column : valueColumns) {
                row.put(column, entry.getValue().get(column));
            }
            output.add(row);
        }
        LOG.debug("Pivot: {} long row(s) -> {} wide row(s) x {} value column(s)",
                rows.size(), output.size(), valueColumns.size());
        return Dataset.of(outputColumns, output);
    }

    private String metricKey(Map<String, Object> row, int rowIndex) {
        StringBuilder key = new StringBuilder();
        for (int i = 0; i < columns.size(); i++) {
            String column = columns.get(i);
            Object value = row.get(column);
            if (value == null) {
                throw new ValidationException(name(),
                        "Row " + rowIndex + " has no value in pivot column '" + column + "'");
            }
            String token = normalizeNames ? normalizeToken(value) : String.valueOf(value);
            if (token.isEmpty()) {
                throw new ValidationException(name(),
                        "Row " + rowIndex + " has a blank value in pivot column '" + column + "'");
            }
            if (columns.size() > 1 && token.contains(separator)) {
                throw new ValidationException(name(), "Value '" + value + "' in column '" + column
                        + "' contains the separator '" + separator + "'");
            }
            if (i > 0) {
                key.append(separator);
            }
            key.append(token);
        }
        return key.toString();
    }

    @Override
    public TransformerKind kind() {
        return TransformerKind.PIVOT;
    }

    public List<String> getIndex() {
        return index;
    }

    public List<String> getColumns() {
        return columns;
    }

    public String getValues() {
        return values;
    }

    public String getSeparator() {
        return separator;
    }

    @Override
    public String toString() {
        return "PivotTransformer{index=" + index + ", columns=" + columns + ", values='" + values + "'}";
    }
}
