package com.forecastsentinel.core.transform;

import com.forecastsentinel.core.error.ConfigurationException;
import com.forecastsentinel.core.model.Dataset;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Keeps or drops a named set of columns.
 *
 * <p>
 * Include mode keeps exactly the named columns, in the dataset's existing
 * order; naming a column the dataset does not have is a configuration error.
 * Exclude mode drops the named columns and ignores names it does not find.
 * </p>
 *
 * @since 1.0.0
 */
public class ColumnSelector implements Transformer {

    private final Set<String> names;
    private final boolean include;

    private ColumnSelector(Collection<String> names, boolean include) {
        if (names == null || names.isEmpty()) {
            throw new ConfigurationException(name(), "At least one column name is required");
        }
        this.names = new LinkedHashSet<>(names);
        this.include = include;
    }

    public static ColumnSelector include(Collection<String> columns) {
        return new ColumnSelector(columns, true);
    }

    public static ColumnSelector include(String... columns) {
        return include(List.of(columns));
    }

    public static ColumnSelector exclude(Collection<String> columns) {
        return new ColumnSelector(columns, false);
    }

    public static ColumnSelector exclude(String... columns) {
        return exclude(List.of(columns));
    }

    @Override
    public Dataset apply(Dataset dataset) {
        Objects.requireNonNull(dataset, "Dataset must not be null");
        if (include) {
            List<String> missing = names.stream().filter(c -> !dataset.hasColumn(c)).toList();
            if (!missing.isEmpty()) {
                throw new ConfigurationException(name(),
                        "Cannot select missing column(s) " + missing + ". Available: " + dataset.columns());
            }
        }

        List<String> kept = new ArrayList<>();
        for (String column : dataset.columns()) {
            if (names.contains(column) == include) {
                kept.add(column);
            }
        }
        if (kept.size() == dataset.columns().size()) {
            return dataset;
        }

        List<Map<String, Object>> rows = new ArrayList<>(dataset.size());
        for (Map<String, Object> row : dataset.rows()) {
            Map<String, Object> projected = new LinkedHashMap<>();
            for (String column : kept) {
                projected.put(column, row.get(column));
            }
            rows.add(projected);
        }
        return Dataset.of(kept, rows);
    }

    @Override
    public TransformerKind kind() {
        return TransformerKind.COLUMN_SELECTOR;
    }

    public Set<String> getNames() {
        return names;
    }

    public boolean isInclude() {
        return include;
    }

    @Override
    public String toString() {
        return "ColumnSelector{" + (include ? "include=" : "exclude=") + names + '}';
    }
}
