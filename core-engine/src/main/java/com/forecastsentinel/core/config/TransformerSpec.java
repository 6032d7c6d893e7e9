package com.forecastsentinel.core.config;

import com.forecastsentinel.core.error.ConfigurationException;
import com.forecastsentinel.core.transform.TransformerKind;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Describes a single transformer loaded from configuration.
 *
 * <p>
 * One flat bean covers every transformer type; only the fields relevant to
 * the declared {@code type} are read:
 * </p>
 * <ul>
 * <li>{@code pivot}: {@code index}, {@code columns}, {@code values},
 * optional {@code separator} and {@code normalizeNames}</li>
 * <li>{@code date_range}: optional {@code start} / {@code end} (ISO dates)
 * and {@code dateColumn}</li>
 * <li>{@code value_filter}: {@code column} plus either {@code include},
 * {@code exclude} or {@code min} / {@code max}</li>
 * <li>{@code cumulative_threshold}: {@code column} and {@code threshold}</li>
 * <li>{@code column_formatter}: percentage format of {@code columns} with
 * {@code decimalPlaces} and {@code multiplyBy100}</li>
 * <li>{@code column_selector}: either {@code keep} or {@code drop}</li>
 * </ul>
 *
 * <p>
 * Call {@link #validate()} after deserialization.
 * </p>
 *
 * @since 1.0.0
 */
public class TransformerSpec {

    private String type;

    // --- Pivot ---
    private List<String> index = new ArrayList<>();
    private List<String> columns = new ArrayList<>();
    private String values;
    private String separator = "_";
    private boolean normalizeNames = true;

    // --- Filters ---
    private String column;
    private List<Object> include;
    private List<Object> exclude;
    private Double min;
    private Double max;
    private String start;
    private String end;
    private String dateColumn = "date";
    private Double threshold;

    // --- Formatting / selection ---
    private int decimalPlaces = 2;
    private boolean multiplyBy100 = true;
    private List<String> keep;
    private List<String> drop;

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate that the fields required by the declared type are present and
     * legal.
     *
     * @throws ConfigurationException listing every problem found
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (type == null || type.isBlank()) {
            errors.add("Transformer 'type' is required");
        } else {
            TransformerKind kind = TransformerKind.fromTag(type);
            switch (kind) {
                case PIVOT -> {
                    if (index == null || index.isEmpty()) {
                        errors.add("pivot requires 'index'");
                    }
                    if (columns == null || columns.isEmpty()) {
                        errors.add("pivot requires 'columns'");
                    }
                    if (values == null || values.isBlank()) {
                        errors.add("pivot requires 'values'");
                    }
                    if (separator == null || separator.isEmpty()) {
                        errors.add("pivot 'separator' must not be empty");
                    }
                }
                case DATE_RANGE_FILTER -> {
                    LocalDate from = parseDate("start", start, errors);
                    LocalDate to = parseDate("end", end, errors);
                    if (from != null && to != null && from.isAfter(to)) {
                        errors.add("date_range 'start' (" + start + ") is after 'end' (" + end + ")");
                    }
                }
                case VALUE_FILTER -> {
                    requireColumn(kind, errors);
                    boolean categorical = include != null || exclude != null;
                    boolean numeric = min != null || max != null;
                    if (include != null && exclude != null) {
                        errors.add("value_filter accepts 'include' or 'exclude', not both");
                    }
                    if (categorical && numeric) {
                        errors.add("value_filter cannot mix 'include'/'exclude' with 'min'/'max'");
                    }
                    if (!categorical && !numeric) {
                        errors.add("value_filter requires 'include', 'exclude', 'min' or 'max'");
                    }
                    if (min != null && max != null && min > max) {
                        errors.add("value_filter 'min' (" + min + ") is greater than 'max' (" + max + ")");
                    }
                }
                case CUMULATIVE_THRESHOLD_FILTER -> {
                    requireColumn(kind, errors);
                    if (threshold == null || !(threshold > 0.0 && threshold <= 1.0)) {
                        errors.add("cumulative_threshold requires 'threshold' in (0, 1], got " + threshold);
                    }
                }
                case COLUMN_FORMATTER -> {
                    if (columns == null || columns.isEmpty()) {
                        errors.add("column_formatter requires 'columns'");
                    }
                    if (decimalPlaces < 0) {
                        errors.add("column_formatter 'decimalPlaces' must be >= 0");
                    }
                }
                case COLUMN_SELECTOR -> {
                    boolean hasKeep = keep != null && !keep.isEmpty();
                    boolean hasDrop = drop != null && !drop.isEmpty();
                    if (hasKeep == hasDrop) {
                        errors.add("column_selector requires exactly one of 'keep' or 'drop'");
                    }
                }
            }
        }

        if (!errors.isEmpty()) {
            throw new ConfigurationException("transformer",
                    "Invalid transformer '" + type + "': " + String.join("; ", errors));
        }
    }

    private void requireColumn(TransformerKind kind, List<String> errors) {
        if (column == null || column.isBlank()) {
            errors.add(kind.tag() + " requires 'column'");
        }
    }

    private static LocalDate parseDate(String field, String text, List<String> errors) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(text.trim());
        } catch (DateTimeParseException e) {
            errors.add("date_range '" + field + "' is not an ISO date: '" + text + "'");
            return null;
        }
    }

    /** @return {@link #getStart()} as a date, or {@code null} if unset */
    public LocalDate startDate() {
        return start == null || start.isBlank() ? null : LocalDate.parse(start.trim());
    }

    /** @return {@link #getEnd()} as a date, or {@code null} if unset */
    public LocalDate endDate() {
        return end == null || end.isBlank() ? null : LocalDate.parse(end.trim());
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getType() {
        return type;
    }

    /**
     * Set the transformer type, normalised to lowercase.
     *
     * @param type transformer type string
     */
    public void setType(String type) {
        this.type = type != null ? type.trim().toLowerCase(Locale.ROOT) : null;
    }

    public List<String> getIndex() {
        return index;
    }

    public void setIndex(List<String> index) {
        this.index = index;
    }

    public List<String> getColumns() {
        return columns;
    }

    public void setColumns(List<String> columns) {
        this.columns = columns;
    }

    public String getValues() {
        return values;
    }

    public void setValues(String values) {
        this.values = values;
    }

    public String getSeparator() {
        return separator;
    }

    public void setSeparator(String separator) {
        this.separator = separator;
    }

    public boolean isNormalizeNames() {
        return normalizeNames;
    }

    public void setNormalizeNames(boolean normalizeNames) {
        this.normalizeNames = normalizeNames;
    }

    public String getColumn() {
        return column;
    }

    public void setColumn(String column) {
        this.column = column;
    }

    public List<Object> getInclude() {
        return include;
    }

    public void setInclude(List<Object> include) {
        this.include = include;
    }

    public List<Object> getExclude() {
        return exclude;
    }

    public void setExclude(List<Object> exclude) {
        this.exclude = exclude;
    }

    public Double getMin() {
        return min;
    }

    public void setMin(Double min) {
        this.min = min;
    }

    public Double getMax() {
        return max;
    }

    public void setMax(Double max) {
        this.max = max;
    }

    public String getStart() {
        return start;
    }

    public void setStart(String start) {
        this.start = start;
    }

    public String getEnd() {
        return end;
    }

    public void setEnd(String end) {
        this.end = end;
    }

    public String getDateColumn() {
        return dateColumn;
    }

    public void setDateColumn(String dateColumn) {
        this.dateColumn = dateColumn;
    }

    public Double getThreshold() {
        return threshold;
    }

    public void setThreshold(Double threshold) {
        this.threshold = threshold;
    }

    public int getDecimalPlaces() {
        return decimalPlaces;
    }

    public void setDecimalPlaces(int decimalPlaces) {
        this.decimalPlaces = decimalPlaces;
    }

    public boolean isMultiplyBy100() {
        return multiplyBy100;
    }

    public void setMultiplyBy100(boolean multiplyBy100) {
        this.multiplyBy100 = multiplyBy100;
    }

    public List<String> getKeep() {
        return keep;
    }

    public void setKeep(List<String> keep) {
        this.keep = keep;
    }

    public List<String> getDrop() {
        return drop;
    }

    public void setDrop(List<String> drop) {
        this.drop = drop;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TransformerSpec that))
            return false;
        return normalizeNames == that.normalizeNames
                && decimalPlaces == that.decimalPlaces
                && multiplyBy100 == that.multiplyBy100
                && Objects.equals(type, that.type)
                && Objects.equals(index, that.index)
                && Objects.equals(columns, that.columns)
                && Objects.equals(values, that.values)
                && Objects.equals(separator, that.separator)
                && Objects.equals(column, that.column)
                && Objects.equals(include, that.include)
                && Objects.equals(exclude, that.exclude)
                && Objects.equals(min, that.min)
                && Objects.equals(max, that.max)
                && Objects.equals(start, that.start)
                && Objects.equals(end, that.end)
                && Objects.equals(dateColumn, that.dateColumn)
                && Objects.equals(threshold, that.threshold)
                && Objects.equals(keep, that.keep)
                && Objects.equals(drop, that.drop);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, column, columns, values, threshold);
    }

    @Override
    public String toString() {
        return "TransformerSpec{" +
                "type='" + type + '\'' +
                ", column='" + column + '\'' +
                ", columns=" + columns +
                ", index=" + index +
                ", values='" + values + '\'' +
                ", threshold=" + threshold +
                '}';
    }
}
