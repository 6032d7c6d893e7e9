package com.forecastsentinel.core.config;

import com.forecastsentinel.core.transform.ColumnFormatter;
import com.forecastsentinel.core.transform.ColumnSelector;
import com.forecastsentinel.core.transform.CumulativeThresholdFilter;
import com.forecastsentinel.core.transform.DateRangeFilter;
import com.forecastsentinel.core.transform.PivotTransformer;
import com.forecastsentinel.core.transform.Transformer;
import com.forecastsentinel.core.transform.TransformerKind;
import com.forecastsentinel.core.transform.TransformerStages;
import com.forecastsentinel.core.transform.ValueFilter;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Factory that creates {@link Transformer} instances from
 * {@link TransformerSpec} configurations.
 *
 * <p>
 * This is the single point of extension when adding new transformer types:
 * register the new {@link TransformerKind} here and create the corresponding
 * transformer.
 * </p>
 *
 * @since 1.0.0
 */
public final class TransformerFactory {

    private TransformerFactory() {
        // utility class
    }

    /**
     * Create a transformer for the given spec.
     *
     * @param spec transformer configuration; must not be {@code null}
     * @return configured transformer
     * @throws com.forecastsentinel.core.error.ConfigurationException if the spec
     *                                                                is invalid
     */
    public static Transformer create(TransformerSpec spec) {
        Objects.requireNonNull(spec, "TransformerSpec must not be null");
        spec.validate();

        return switch (TransformerKind.fromTag(spec.getType())) {
            case PIVOT -> new PivotTransformer(spec.getIndex(), spec.getColumns(), spec.getValues(),
                    spec.getSeparator(), spec.isNormalizeNames());
            case DATE_RANGE_FILTER -> new DateRangeFilter(spec.startDate(), spec.endDate(), spec.getDateColumn());
            case VALUE_FILTER -> {
                if (spec.getInclude() != null) {
                    yield ValueFilter.include(spec.getColumn(), spec.getInclude());
                }
                if (spec.getExclude() != null) {
                    yield ValueFilter.exclude(spec.getColumn(), spec.getExclude());
                }
                yield ValueFilter.range(spec.getColumn(), spec.getMin(), spec.getMax());
            }
            case CUMULATIVE_THRESHOLD_FILTER -> new CumulativeThresholdFilter(spec.getColumn(), spec.getThreshold());
            case COLUMN_FORMATTER -> ColumnFormatter.percentage(spec.getColumns(), spec.getDecimalPlaces(),
                    spec.isMultiplyBy100());
            case COLUMN_SELECTOR -> spec.getKeep() != null && !spec.getKeep().isEmpty()
                    ? ColumnSelector.include(spec.getKeep())
                    : ColumnSelector.exclude(spec.getDrop());
        };
    }

    /**
     * Create transformers for every spec, preserving order.
     *
     * @param specs transformer configurations; must not be {@code null}
     * @return unmodifiable list of transformers (one per spec)
     */
    public static List<Transformer> createAll(List<TransformerSpec> specs) {
        Objects.requireNonNull(specs, "Transformer spec list must not be null");
        return Collections.unmodifiableList(specs.stream()
                .map(TransformerFactory::create)
                .toList());
    }

    /**
     * @param config a component's {@code transformers} block
     * @return both stages, instantiated
     */
    public static TransformerStages createStages(StageConfig config) {
        Objects.requireNonNull(config, "StageConfig must not be null");
        return TransformerStages.of(createAll(config.getBefore()), createAll(config.getAfter()));
    }
}
