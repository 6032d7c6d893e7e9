package com.forecastsentinel.core.detection;

import com.forecastsentinel.core.codec.QuantileCodec;
import com.forecastsentinel.core.error.AlignmentException;
import com.forecastsentinel.core.error.ConfigurationException;
import com.forecastsentinel.core.error.DecodingException;
import com.forecastsentinel.core.error.ValidationException;
import com.forecastsentinel.core.model.AnomalyRecord;
import com.forecastsentinel.core.model.AnomalyStatus;
import com.forecastsentinel.core.model.Dataset;
import com.forecastsentinel.core.model.QuantileVector;
import com.forecastsentinel.core.model.Values;
import com.forecastsentinel.core.transform.Stage;
import com.forecastsentinel.core.transform.TransformerStages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Compares quantile forecasts with observed actuals.
 *
 * <h3>Detection steps</h3>
 * <ol>
 * <li>Reject empty forecast or actual datasets.</li>
 * <li>Run the {@code before} stage on the actuals (typically a pivot into the
 * forecast's wide shape).</li>
 * <li>Align rows on the date column and check that every forecast metric has
 * an actual column.</li>
 * <li>Decode each forecast cell; a missing or blank cell is the all-zero
 * vector.</li>
 * <li>Classify the actual against {@code [q[lower], q[upper]]} and compute the
 * deviation.</li>
 * <li>Optionally split the metric key into named dimensions.</li>
 * <li>Run the {@code after} stage on the result.</li>
 * </ol>
 *
 * <h3>Deviation</h3>
 * <p>
 * {@code (lower - actual) / lower} below the interval,
 * {@code (actual - upper) / upper} above it and {@code 0} otherwise. When the
 * violated bound is {@code 0} the absolute distance is reported instead of a
 * ratio.
 * </p>
 *
 * <h3>Alignment</h3>
 * <p>
 * Forecast dates without an actual row are skipped, since forecasts usually
 * run past the last observation; if no date overlaps at all the run fails.
 * A {@code null} actual cell counts as {@code 0}.
 * </p>
 *
 * @since 1.0.0
 */
public class ForecastActualDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(ForecastActualDetector.class);

    public static final int DEFAULT_LOWER_QUANTILE_INDEX = 1;
    public static final int DEFAULT_UPPER_QUANTILE_INDEX = 9;

    private final String name;
    private final String dateColumn;
    private final int lowerQuantileIndex;
    private final int upperQuantileIndex;
    private final Set<String> excludeColumns;
    private final List<String> dimensionNames;
    private final String metricDelimiter;
    private final Map<String, DimensionMapping> dimensionMappings;
    private final boolean titleCaseDimensions;
    private final boolean deriveDimensionLabels;
    private final boolean reportUnforecastedMetrics;
    private final TransformerStages stages;

    private ForecastActualDetector(Builder builder) {
        this.name = builder.name;
        this.dateColumn = builder.dateColumn;
        this.lowerQuantileIndex = builder.lowerQuantileIndex;
        this.upperQuantileIndex = builder.upperQuantileIndex;
        this.excludeColumns = new LinkedHashSet<>(builder.excludeColumns);
        this.dimensionNames = List.copyOf(builder.dimensionNames);
        this.metricDelimiter = builder.metricDelimiter;
        this.dimensionMappings = new LinkedHashMap<>(builder.dimensionMappings);
        this.titleCaseDimensions = builder.titleCaseDimensions;
        this.deriveDimensionLabels = builder.deriveDimensionLabels;
        this.reportUnforecastedMetrics = builder.reportUnforecastedMetrics;
        this.stages = builder.stages;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Detection
    // ---------------------------------------------------------------

    @Override
    public Dataset detect(Dataset forecast, Dataset actual) {
        Objects.requireNonNull(forecast, "Forecast dataset must not be null");
        Objects.requireNonNull(actual, "Actual dataset must not be null");
        forecast.requireNonEmpty(name, "Forecast dataset");
        actual.requireNonEmpty(name, "Actual dataset");

        DimensionSplitter splitter = dimensionNames.isEmpty() ? null
                : new DimensionSplitter(dimensionNames, metricDelimiter, resolveMappings(actual), titleCaseDimensions);

        Dataset wideActual = stages.apply(name, Stage.BEFORE, actual);
        forecast.requireColumns(name, List.of(dateColumn));
        wideActual.requireColumns(name, List.of(dateColumn));

        List<String> forecastMetrics = metricColumns(forecast);
        if (forecastMetrics.isEmpty()) {
            throw new ValidationException(name, "Forecast dataset has no metric columns besides '" + dateColumn
                    + "'. Columns: " + forecast.columns());
        }
        List<String> metrics = alignMetrics(forecastMetrics, metricColumns(wideActual));
        Map<Object, Map<String, Object>> actualByDate = indexByDate(wideActual);

        List<Map<String, Object>> rows = new ArrayList<>();
        Map<AnomalyStatus, Integer> counts = new EnumMap<>(AnomalyStatus.class);
        int skippedDates = 0;
        int invertedIntervals = 0;
        for (Map<String, Object> forecastRow : forecast.rows()) {
            Object date = forecastRow.get(dateColumn);
            if (date == null) {
                throw new ValidationException(name, "Forecast row has a null '" + dateColumn + "'");
            }
            Map<String, Object> actualRow = actualByDate.get(Values.dateKey(date));
            if (actualRow == null) {
                skippedDates++;
                continue;
            }
            for (String metric : metrics) {
                QuantileVector vector = decodeCell(forecastRow.get(metric), date, metric);
                double actualValue = actualValue(actualRow.get(metric), date, metric);
                AnomalyRecord record = compare(date, metric, actualValue, vector, splitter);
                if (record.getLower() > record.getUpper()) {
                    invertedIntervals++;
                }
                counts.merge(record.getStatus(), 1, Integer::sum);
                rows.add(record.toRow(dateColumn));
            }
        }
        if (rows.isEmpty()) {
            throw new AlignmentException(name, "No forecast date in column '" + dateColumn
                    + "' has a matching actual row");
        }
        if (invertedIntervals > 0) {
            LOG.warn("[{}] {} cell(s) have q[{}] > q[{}]; classification treats them as-is",
                    name, invertedIntervals, lowerQuantileIndex, upperQuantileIndex);
        }
        LOG.debug("[{}] Compared {} cell(s), skipped {} forecast date(s) without actuals: {}",
                name, rows.size(), skippedDates, counts);

        Dataset result = Dataset.of(AnomalyRecord.columns(dateColumn, dimensionNames), rows);
        return stages.apply(name, Stage.AFTER, result);
    }

    /**
     * Classify one cell.
     *
     * @param date     alignment date, copied to the record
     * @param metric   metric key
     * @param actual   observed value
     * @param vector   decoded forecast
     * @param splitter dimension splitter, or {@code null} to keep the key
     * @return the comparison record
     */
    AnomalyRecord compare(Object date, String metric, double actual, QuantileVector vector,
            DimensionSplitter splitter) {
        double lower = vector.get(lowerQuantileIndex);
        double upper = vector.get(upperQuantileIndex);
        AnomalyStatus status = AnomalyStatus.classify(actual, lower, upper);

        double absoluteDeviation = switch (status) {
            case BELOW_LOWER -> lower - actual;
            case ABOVE_UPPER -> actual - upper;
            default -> 0.0;
        };
        double deviation = switch (status) {
            case BELOW_LOWER -> lower == 0 ? absoluteDeviation : absoluteDeviation / lower;
            case ABOVE_UPPER -> upper == 0 ? absoluteDeviation : absoluteDeviation / upper;
            default -> 0.0;
        };

        AnomalyRecord.Builder builder = AnomalyRecord.builder()
                .date(date)
                .metric(metric)
                .actual(actual)
                .forecast(vector.point())
                .lower(lower)
                .upper(upper)
                .status(status)
                .absoluteDeviation(absoluteDeviation)
                .deviation(deviation);
        if (splitter != null) {
            splitter.labels(metric).forEach(builder::dimension);
        }
        return builder.build();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Map<String, DimensionMapping> resolveMappings(Dataset rawActual) {
        Map<String, DimensionMapping> resolved = new LinkedHashMap<>();
        if (deriveDimensionLabels) {
            for (String dimension : dimensionNames) {
                if (rawActual.hasColumn(dimension)) {
                    resolved.put(dimension, DimensionMapping.fromDataset(rawActual, dimension));
                }
            }
        }
        dimensionMappings.forEach((dimension, explicit) -> resolved.merge(dimension, explicit,
                (derived, override) -> derived.withOverride(override.getLabels())));
        return resolved;
    }

    private List<String> metricColumns(Dataset dataset) {
        List<String> metrics = new ArrayList<>();
        for (String column : dataset.columns()) {
            if (!column.equals(dateColumn) && !excludeColumns.contains(column)) {
                metrics.add(column);
            }
        }
        return metrics;
    }

    private List<String> alignMetrics(List<String> forecastMetrics, List<String> actualMetrics) {
        Set<String> actualSet = new HashSet<>(actualMetrics);
        List<String> missing = forecastMetrics.stream().filter(m -> !actualSet.contains(m)).toList();
        if (!missing.isEmpty()) {
            throw new AlignmentException(name, "Forecast metric(s) " + missing
                    + " have no actual column. Available actual columns: " + actualMetrics);
        }

        Set<String> forecastSet = new HashSet<>(forecastMetrics);
        List<String> unforecasted = actualMetrics.stream().filter(m -> !forecastSet.contains(m)).toList();
        if (unforecasted.isEmpty()) {
            return forecastMetrics;
        }
        if (!reportUnforecastedMetrics) {
            throw new AlignmentException(name, "Actual metric(s) " + unforecasted
                    + " have no forecast column. Exclude them or enable reporting of unforecasted metrics");
        }
        LOG.info("[{}] Reporting {} unforecasted metric(s) as {}", name, unforecasted.size(),
                AnomalyStatus.NO_FORECAST);
        List<String> all = new ArrayList<>(forecastMetrics);
        all.addAll(unforecasted);
        return all;
    }

    private Map<Object, Map<String, Object>> indexByDate(Dataset wideActual) {
        Map<Object, Map<String, Object>> byDate = new HashMap<>();
        for (Map<String, Object> row : wideActual.rows()) {
            Object date = row.get(dateColumn);
            if (date == null) {
                continue;
            }
            if (byDate.put(Values.dateKey(date), row) != null) {
                throw new ValidationException(name, "Actual dataset has more than one row for date '" + date
                        + "'. Pivot or aggregate the actuals in the 'before' stage");
            }
        }
        return byDate;
    }

    private QuantileVector decodeCell(Object cell, Object date, String metric) {
        if (cell == null || (cell instanceof String s && s.isBlank())) {
            return QuantileVector.zero();
        }
        try {
            return QuantileCodec.decode(String.valueOf(cell));
        } catch (DecodingException e) {
            throw new DecodingException(name,
                    "Bad forecast cell at date=" + date + ", metric=" + metric + ": " + e.getMessage(),
                    e.getRawText(), e.getSegmentCount(), e);
        }
    }

    private double actualValue(Object cell, Object date, String metric) {
        if (cell == null) {
            return 0.0;
        }
        return Values.asDouble(cell).orElseThrow(() -> new ValidationException(name,
                "Actual value '" + cell + "' at date=" + date + ", metric=" + metric + " is not numeric"));
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    @Override
    public String getName() {
        return name;
    }

    public String getDateColumn() {
        return dateColumn;
    }

    public int getLowerQuantileIndex() {
        return lowerQuantileIndex;
    }

    public int getUpperQuantileIndex() {
        return upperQuantileIndex;
    }

    public List<String> getDimensionNames() {
        return dimensionNames;
    }

    public TransformerStages getStages() {
        return stages;
    }

    @Override
    public String toString() {
        return "ForecastActualDetector{" +
                "name='" + name + '\'' +
                ", dateColumn='" + dateColumn + '\'' +
                ", lowerQuantileIndex=" + lowerQuantileIndex +
                ", upperQuantileIndex=" + upperQuantileIndex +
                ", dimensionNames=" + dimensionNames +
                ", stages=" + stages +
                '}';
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder. {@link #build()} validates the configuration and throws
     * a {@link ConfigurationException} on the first problem.
     */
    public static final class Builder {
        private String name = "forecast-actual";
        private String dateColumn = "date";
        private int lowerQuantileIndex = DEFAULT_LOWER_QUANTILE_INDEX;
        private int upperQuantileIndex = DEFAULT_UPPER_QUANTILE_INDEX;
        private final Set<String> excludeColumns = new LinkedHashSet<>();
        private final List<String> dimensionNames = new ArrayList<>();
        private String metricDelimiter = "_";
        private final Map<String, DimensionMapping> dimensionMappings = new LinkedHashMap<>();
        private boolean titleCaseDimensions;
        private boolean deriveDimensionLabels;
        private boolean reportUnforecastedMetrics;
        private TransformerStages stages = TransformerStages.empty();

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder dateColumn(String dateColumn) {
            this.dateColumn = dateColumn;
            return this;
        }

        public Builder quantileIndices(int lower, int upper) {
            this.lowerQuantileIndex = lower;
            this.upperQuantileIndex = upper;
            return this;
        }

        public Builder excludeColumns(List<String> columns) {
            this.excludeColumns.addAll(columns);
            return this;
        }

        public Builder dimensionNames(List<String> names) {
            this.dimensionNames.clear();
            this.dimensionNames.addAll(names);
            return this;
        }

        public Builder metricDelimiter(String metricDelimiter) {
            this.metricDelimiter = metricDelimiter;
            return this;
        }

        public Builder dimensionMapping(DimensionMapping mapping) {
            this.dimensionMappings.put(mapping.getDimension(), mapping);
            return this;
        }

        public Builder titleCaseDimensions(boolean titleCaseDimensions) {
            this.titleCaseDimensions = titleCaseDimensions;
            return this;
        }

        public Builder deriveDimensionLabels(boolean deriveDimensionLabels) {
            this.deriveDimensionLabels = deriveDimensionLabels;
            return this;
        }

        public Builder reportUnforecastedMetrics(boolean reportUnforecastedMetrics) {
            this.reportUnforecastedMetrics = reportUnforecastedMetrics;
            return this;
        }

        public Builder stages(TransformerStages stages) {
            this.stages = Objects.requireNonNull(stages, "Stages must not be null");
            return this;
        }

        /**
         * @return a new detector
         * @throws ConfigurationException if indices, names or dimensions are
         *                                invalid
         */
        public ForecastActualDetector build() {
            if (name == null || name.isBlank()) {
                throw new ConfigurationException("detector", "Detector name must not be blank");
            }
            if (dateColumn == null || dateColumn.isBlank()) {
                throw new ConfigurationException(name, "Date column must not be blank");
            }
            int max = QuantileVector.SIZE - 1;
            if (lowerQuantileIndex < 0 || lowerQuantileIndex > max || upperQuantileIndex < 0
                    || upperQuantileIndex > max) {
                throw new ConfigurationException(name, "Quantile indices must be in [0, " + max + "], got lower="
                        + lowerQuantileIndex + ", upper=" + upperQuantileIndex);
            }
            if (lowerQuantileIndex >= upperQuantileIndex) {
                throw new ConfigurationException(name, "Lower quantile index (" + lowerQuantileIndex
                        + ") must be less than upper quantile index (" + upperQuantileIndex + ")");
            }
            if (!dimensionNames.isEmpty()) {
                if (metricDelimiter == null || metricDelimiter.isEmpty()) {
                    throw new ConfigurationException(name, "Metric delimiter must not be empty");
                }
                Set<String> reserved = new HashSet<>(AnomalyRecord.MEASURE_COLUMNS);
                reserved.add(dateColumn);
                Set<String> seen = new HashSet<>();
                for (String dimension : dimensionNames) {
                    if (reserved.contains(dimension) || !seen.add(dimension)) {
                        throw new ConfigurationException(name, "Dimension name '" + dimension
                                + "' collides with another output column. Reserved: " + reserved);
                    }
                }
            }
            for (String dimension : dimensionMappings.keySet()) {
                if (!dimensionNames.contains(dimension)) {
                    throw new ConfigurationException(name, "Mapping for unknown dimension '" + dimension
                            + "'. Configured dimensions: " + dimensionNames);
                }
            }
            return new ForecastActualDetector(this);
        }
    }
}
