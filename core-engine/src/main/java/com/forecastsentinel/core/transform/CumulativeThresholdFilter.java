package com.forecastsentinel.core.transform;

import com.forecastsentinel.core.error.ConfigurationException;
import com.forecastsentinel.core.error.ValidationException;
import com.forecastsentinel.core.model.Dataset;
import com.forecastsentinel.core.model.Values;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Keeps the smallest set of top-ranked rows whose values add up to a fraction
 * of the column total.
 *
 * <p>
 * Rows are ranked descending by the target column (stable for ties). The scan
 * accumulates a running sum and stops at the first row where
 * {@code running >= thresholdPct * total}; that row is kept. Retained rows are
 * returned in their original relative order.
 * </p>
 *
 * <p>
 * If the column total is zero or negative there is no meaningful ranking and
 * every row is kept. Every cell must be numeric.
 * </p>
 *
 * @since 1.0.0
 */
public class CumulativeThresholdFilter implements Transformer {

    private static final Logger LOG = LoggerFactory.getLogger(CumulativeThresholdFilter.class);

    private final String column;
    private final double thresholdPct;

    /**
     * @param column       numeric column to rank by
     * @param thresholdPct fraction of the total to reach, in {@code (0, 1]}
     * @throws ConfigurationException if the column is blank or the fraction is
     *                                out of range
     */
    public CumulativeThresholdFilter(String column, double thresholdPct) {
        if (column == null || column.isBlank()) {
            throw new ConfigurationException(name(), "'column' is required");
        }
        if (!(thresholdPct > 0.0 && thresholdPct <= 1.0)) {
            throw new ConfigurationException(name(),
                    "threshold must be in (0, 1], got " + thresholdPct);
        }
        this.column = column;
        this.thresholdPct = thresholdPct;
    }

    @Override
    public Dataset apply(Dataset dataset) {
        Objects.requireNonNull(dataset, "Dataset must not be null");
        dataset.requireColumns(name(), List.of(column));
        if (dataset.isEmpty()) {
            return dataset;
        }

        List<Map<String, Object>> rows = dataset.rows();
        double[] values = new double[rows.size()];
        double total = 0.0;
        for (int i = 0; i < rows.size(); i++) {
            values[i] = numeric(rows.get(i).get(column));
            total += values[i];
        }
        if (total <= 0.0) {
            LOG.debug("Column '{}' totals {}; keeping all {} row(s)", column, total, rows.size());
            return dataset;
        }

        List<Integer> ranked = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            ranked.add(i);
        }
        // List.sort is stable, so ties keep source order
        ranked.sort(Comparator.comparingDouble((Integer i) -> values[i]).reversed());

        double target = thresholdPct * total;
        double running = 0.0;
        boolean[] keep = new boolean[rows.size()];
        for (int i : ranked) {
            keep[i] = true;
            running += values[i];
            if (running >= target) {
                break;
            }
        }

        List<Map<String, Object>> retained = new ArrayList<>();
        for (int i = 0; i < rows.size(); i++) {
            if (keep[i]) {
                retained.add(rows.get(i));
            }
        }
        LOG.debug("Cumulative threshold {} on '{}' kept {} of {} row(s)",
                thresholdPct, column, retained.size(), rows.size());
        return dataset.withRows(retained);
    }

    private double numeric(Object raw) {
        return Values.asDouble(raw).orElseThrow(() -> new ValidationException(name(),
                "Value '" + raw + "' in column '" + column + "' is not numeric"));
    }

    @Override
    public TransformerKind kind() {
        return TransformerKind.CUMULATIVE_THRESHOLD_FILTER;
    }

    public String getColumn() {
        return column;
    }

    public double getThresholdPct() {
        return thresholdPct;
    }

    @Override
    public String toString() {
        return "CumulativeThresholdFilter{column='" + column + "', thresholdPct=" + thresholdPct + '}';
    }
}
