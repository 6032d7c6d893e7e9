package com.forecastsentinel.core.model;

import com.forecastsentinel.core.error.ValidationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Immutable in-memory table shared by every pipeline component.
 *
 * <p>
 * A dataset is an ordered list of rows over a fixed, ordered set of unique
 * column names. Each row is a map from column name to a cell value (a
 * {@link Number}, {@link String}, {@link java.time.LocalDate} or
 * {@code null}). Column set and order are identical for all rows.
 * </p>
 *
 * <h3>Value semantics</h3>
 * <p>
 * Rows and the column list are unmodifiable. Every transformation produces a
 * new {@code Dataset}; nothing is ever changed in place, so a dataset can be
 * handed from one stage to the next without aliasing concerns.
 * </p>
 *
 * @since 1.0.0
 */
public final class Dataset {

    private static final String COMPONENT = "dataset";

    private final List<String> columns;
    private final List<Map<String, Object>> rows;

    private Dataset(List<String> columns, List<Map<String, Object>> rows) {
        this.columns = columns;
        this.rows = rows;
    }

    // ---------------------------------------------------------------
    // Factories
    // ---------------------------------------------------------------

    /**
     * Create a dataset with the given columns and no rows.
     *
     * @param columns column names; must be unique
     * @return empty dataset
     * @throws ValidationException if a column name is blank or duplicated
     */
    public static Dataset empty(List<String> columns) {
        return of(columns, List.of());
    }

    /**
     * Create a dataset from column names and row maps.
     *
     * <p>
     * Cells missing from a row map are filled with {@code null}. A row key that
     * is not one of {@code columns} is rejected.
     * </p>
     *
     * @param columns column names in output order; must be unique
     * @param rows    row maps keyed by column name
     * @return new dataset
     * @throws NullPointerException if {@code columns} or {@code rows} is
     *                              {@code null}
     * @throws ValidationException  if a column name is blank or duplicated, or
     *                              a row carries an unknown column
     */
    public static Dataset of(List<String> columns, List<? extends Map<String, ?>> rows) {
        Objects.requireNonNull(columns, "Columns must not be null");
        Objects.requireNonNull(rows, "Rows must not be null");

        List<String> columnList = List.copyOf(columns);
        Set<String> seen = new HashSet<>();
        for (String column : columnList) {
            if (column.isBlank()) {
                throw new ValidationException(COMPONENT, "Column names must not be blank: " + columnList);
            }
            if (!seen.add(column)) {
                throw new ValidationException(COMPONENT,
                        "Duplicate column name '" + column + "' in " + columnList);
            }
        }

        List<Map<String, Object>> rowList = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            Map<String, ?> source = Objects.requireNonNull(rows.get(i), "Row at index " + i + " is null");
            for (String key : source.keySet()) {
                if (!seen.contains(key)) {
                    throw new ValidationException(COMPONENT, "Row " + i + " has unknown column '" + key
                            + "'. Available columns: " + columnList);
                }
            }
            Map<String, Object> row = new LinkedHashMap<>();
            for (String column : columnList) {
                row.put(column, source.get(column));
            }
            rowList.add(Collections.unmodifiableMap(row));
        }
        return new Dataset(columnList, Collections.unmodifiableList(rowList));
    }

    /**
     * Create a {@link Builder} over the given columns.
     *
     * @param columns column names in output order
     * @return builder instance
     */
    public static Builder builder(String... columns) {
        return new Builder(List.of(columns));
    }

    public static Builder builder(List<String> columns) {
        return new Builder(List.copyOf(columns));
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public List<String> columns() {
        return columns;
    }

    public List<Map<String, Object>> rows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    public Map<String, Object> row(int index) {
        return rows.get(index);
    }

    /**
     * Return all values of one column in row order.
     *
     * @param column column name
     * @return unmodifiable list of values (may contain {@code null})
     * @throws ValidationException if the column does not exist
     */
    public List<Object> columnValues(String column) {
        requireColumns(COMPONENT, List.of(column));
        List<Object> values = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            values.add(row.get(column));
        }
        return Collections.unmodifiableList(values);
    }

    // ---------------------------------------------------------------
    // Validation helpers
    // ---------------------------------------------------------------

    /**
     * Verify that every named column is present.
     *
     * @param component name reported in the error
     * @param required  columns that must exist
     * @throws ValidationException naming the missing and the available columns
     */
    public void requireColumns(String component, Collection<String> required) {
        List<String> missing = new ArrayList<>();
        for (String name : required) {
            if (!columns.contains(name)) {
                missing.add(name);
            }
        }
        if (!missing.isEmpty()) {
            throw new ValidationException(component,
                    "Missing column(s) " + missing + ". Available columns: " + columns);
        }
    }

    /**
     * Verify that the dataset has at least one row.
     *
     * @param component name reported in the error
     * @param label     what the dataset represents (e.g. "actual dataset")
     * @throws ValidationException if the dataset has no rows
     */
    public void requireNonEmpty(String component, String label) {
        if (rows.isEmpty()) {
            throw new ValidationException(component, label + " has no rows; at least one row is required");
        }
    }

    // ---------------------------------------------------------------
    // Derivation
    // ---------------------------------------------------------------

    /**
     * @param predicate row predicate
     * @return new dataset with the same columns holding only matching rows
     */
    public Dataset filter(Predicate<Map<String, Object>> predicate) {
        List<Map<String, Object>> kept = new ArrayList<>();
        for (Map<String, Object> row : rows) {
            if (predicate.test(row)) {
                kept.add(row);
            }
        }
        return new Dataset(columns, Collections.unmodifiableList(kept));
    }

    /**
     * @param newRows replacement rows over the same columns
     * @return new dataset with this dataset's columns and the given rows
     */
    public Dataset withRows(List<? extends Map<String, ?>> newRows) {
        return of(columns, newRows);
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Row-by-row builder. Positional {@link #row(Object...)} values follow
     * the column order given at construction.
     */
    public static final class Builder {
        private final List<String> columns;
        private final List<Map<String, Object>> rows = new ArrayList<>();

        private Builder(List<String> columns) {
            this.columns = columns;
        }

        public Builder row(Object... values) {
            if (values.length != columns.size()) {
                throw new ValidationException(COMPONENT, "Row has " + values.length
                        + " value(s) but dataset has " + columns.size() + " column(s): " + columns);
            }
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 0; i < values.length; i++) {
                row.put(columns.get(i), values[i]);
            }
            rows.add(row);
            return this;
        }

        public Builder row(Map<String, ?> row) {
            rows.add(new LinkedHashMap<>(row));
            return this;
        }

        public Dataset build() {
            return of(columns, rows);
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Dataset that))
            return false;
        return columns.equals(that.columns) && rows.equals(that.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns, rows);
    }

    @Override
    public String toString() {
        return "Dataset{columns=" + columns + ", rows=" + rows.size() + '}';
    }
}
