package com.forecastsentinel.core.transform;

import com.forecastsentinel.core.error.ConfigurationException;
import com.forecastsentinel.core.error.ValidationException;
import com.forecastsentinel.core.model.Dataset;
import com.forecastsentinel.core.model.Values;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Keeps rows whose date lies in {@code [start, end]}.
 *
 * <p>
 * Either bound may be {@code null}; both bounds are inclusive. With neither
 * bound set the filter passes every row through. Cells are read from the
 * configured date column and coerced with {@link Values#asDate(Object)}; a
 * {@code null} date never satisfies a bound, an unparseable one is an error.
 * </p>
 *
 * @since 1.0.0
 */
public class DateRangeFilter implements Transformer {

    public static final String DEFAULT_DATE_COLUMN = "date";

    private final LocalDate start;
    private final LocalDate end;
    private final String dateColumn;

    public DateRangeFilter(LocalDate start, LocalDate end) {
        this(start, end, DEFAULT_DATE_COLUMN);
    }

    /**
     * @param start      inclusive lower bound, or {@code null}
     * @param end        inclusive upper bound, or {@code null}
     * @param dateColumn column holding the dates
     * @throws ConfigurationException if {@code start} is after {@code end} or the
     *                                column name is blank
     */
    public DateRangeFilter(LocalDate start, LocalDate end, String dateColumn) {
        if (dateColumn == null || dateColumn.isBlank()) {
            throw new ConfigurationException(name(), "'dateColumn' must not be blank");
        }
        if (start != null && end != null && start.isAfter(end)) {
            throw new ConfigurationException(name(),
                    "start (" + start + ") must be before or equal to end (" + end + ")");
        }
        this.start = start;
        this.end = end;
        this.dateColumn = dateColumn;
    }

    @Override
    public Dataset apply(Dataset dataset) {
        Objects.requireNonNull(dataset, "Dataset must not be null");
        if (start == null && end == null) {
            return dataset;
        }
        dataset.requireColumns(name(), List.of(dateColumn));
        return dataset.filter(this::inRange);
    }

    private boolean inRange(Map<String, Object> row) {
        Object raw = row.get(dateColumn);
        if (raw == null) {
            return false;
        }
        Optional<LocalDate> parsed = Values.asDate(raw);
        if (parsed.isEmpty()) {
            throw new ValidationException(name(),
                    "Value '" + raw + "' in column '" + dateColumn + "' is not a date");
        }
        LocalDate date = parsed.get();
        return (start == null || !date.isBefore(start)) && (end == null || !date.isAfter(end));
    }

    @Override
    public TransformerKind kind() {
        return TransformerKind.DATE_RANGE_FILTER;
    }

    public LocalDate getStart() {
        return start;
    }

    public LocalDate getEnd() {
        return end;
    }

    public String getDateColumn() {
        return dateColumn;
    }

    @Override
    public String toString() {
        return "DateRangeFilter{column='" + dateColumn + "', start=" + start + ", end=" + end + '}';
    }
}
