package com.forecastsentinel.core.detection;

import com.forecastsentinel.core.config.DetectorSettings;
import com.forecastsentinel.core.config.TransformerFactory;
import com.forecastsentinel.core.model.AnomalyRecord;
import com.forecastsentinel.core.model.AnomalyStatus;
import com.forecastsentinel.core.transform.ColumnFormatter;
import com.forecastsentinel.core.transform.CumulativeThresholdFilter;
import com.forecastsentinel.core.transform.Transformer;
import com.forecastsentinel.core.transform.TransformerStages;
import com.forecastsentinel.core.transform.ValueFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Factory that creates {@link AnomalyDetector} instances from
 * {@link DetectorSettings}.
 *
 * <p>
 * The settings' shorthands become after-stage transformers, in this order and
 * ahead of the explicitly configured ones:
 * </p>
 * <ol>
 * <li>{@code cumulativeThreshold}: {@link CumulativeThresholdFilter} on the
 * forecast point</li>
 * <li>{@code onlyAnomalies}: {@link ValueFilter} keeping
 * {@code BELOW_LOWER} / {@code ABOVE_UPPER}</li>
 * <li>{@code minDeviation}: {@link ValueFilter} on {@code deviation};
 * {@code IN_RANGE} rows are kept, dropping them is {@code onlyAnomalies}'
 * job</li>
 * <li>{@code percentDecimals}: percentage {@link ColumnFormatter} on
 * {@code deviation}</li>
 * </ol>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    private DetectorFactory() {
        // utility class
    }

    /**
     * Create a detector for the given settings.
     *
     * @param settings detector configuration; must not be {@code null}
     * @return configured detector
     * @throws com.forecastsentinel.core.error.ConfigurationException if the
     *                                                                settings
     *                                                                are invalid
     */
    public static ForecastActualDetector create(DetectorSettings settings) {
        Objects.requireNonNull(settings, "DetectorSettings must not be null");
        settings.validate();

        List<Transformer> before = TransformerFactory.createAll(settings.getTransformers().getBefore());
        List<Transformer> after = new ArrayList<>(shorthandTransformers(settings));
        after.addAll(TransformerFactory.createAll(settings.getTransformers().getAfter()));

        ForecastActualDetector.Builder builder = ForecastActualDetector.builder()
                .name(settings.getName())
                .dateColumn(settings.getDateColumn())
                .quantileIndices(settings.getLowerQuantileIndex(), settings.getUpperQuantileIndex())
                .excludeColumns(settings.getExcludeColumns())
                .dimensionNames(settings.getDimensionNames())
                .metricDelimiter(settings.getMetricDelimiter())
                .titleCaseDimensions(settings.isTitleCaseDimensions())
                .deriveDimensionLabels(settings.isDeriveDimensionLabels())
                .reportUnforecastedMetrics(settings.isReportUnforecastedMetrics())
                .stages(TransformerStages.of(before, after));
        settings.getDimensionLabels().forEach((dimension, labels) ->
                builder.dimensionMapping(DimensionMapping.of(dimension, asLabels(labels))));

        ForecastActualDetector detector = builder.build();
        LOG.info("Created detector '{}' with {} before / {} after transformer(s)",
                detector.getName(), before.size(), after.size());
        return detector;
    }

    static List<Transformer> shorthandTransformers(DetectorSettings settings) {
        List<Transformer> transformers = new ArrayList<>();
        if (settings.getCumulativeThreshold() != null) {
            transformers.add(new CumulativeThresholdFilter(AnomalyRecord.COL_FORECAST,
                    settings.getCumulativeThreshold()));
        }
        if (settings.isOnlyAnomalies()) {
            transformers.add(ValueFilter.include(AnomalyRecord.COL_STATUS,
                    List.of(AnomalyStatus.BELOW_LOWER.name(), AnomalyStatus.ABOVE_UPPER.name())));
        }
        if (settings.getMinDeviation() != null) {
            transformers.add(ValueFilter.range(AnomalyRecord.COL_DEVIATION, settings.getMinDeviation(), null)
                    .alwaysKeeping(AnomalyRecord.COL_STATUS, List.of(AnomalyStatus.IN_RANGE.name())));
        }
        if (settings.getPercentDecimals() != null) {
            transformers.add(ColumnFormatter.percentage(List.of(AnomalyRecord.COL_DEVIATION),
                    settings.getPercentDecimals(), true));
        }
        return transformers;
    }

    // YAML may hand over numeric keys and values despite the declared types
    private static Map<String, String> asLabels(Map<?, ?> raw) {
        Map<String, String> labels = new LinkedHashMap<>();
        if (raw != null) {
            raw.forEach((token, label) -> labels.put(String.valueOf(token), String.valueOf(label)));
        }
        return labels;
    }
}
