package com.forecastsentinel.core.config;

import com.forecastsentinel.core.error.ConfigurationException;
import com.forecastsentinel.core.model.QuantileVector;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Detector configuration loaded from the {@code detector} block of the
 * pipeline YAML.
 *
 * <pre>
 * detector:
 *   dateColumn: date
 *   lowerQuantileIndex: 1
 *   upperQuantileIndex: 9
 *   dimensionNames: [platform, channel]
 *   dimensionLabels:
 *     platform: { ios: iOS }
 *   deriveDimensionLabels: true
 *   cumulativeThreshold: 0.95
 *   onlyAnomalies: true
 *   minDeviation: 0.05
 *   percentDecimals: 2
 * </pre>
 *
 * <p>
 * {@code cumulativeThreshold}, {@code onlyAnomalies}, {@code minDeviation}
 * and {@code percentDecimals} are shorthands for after-stage transformers;
 * they run in that order ahead of any explicit {@code transformers.after}
 * list. {@code minDeviation} only thresholds out-of-range rows;
 * {@code IN_RANGE} rows are dropped by {@code onlyAnomalies} alone.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectorSettings {

    private String name = "forecast-actual";
    private String dateColumn = "date";
    private int lowerQuantileIndex = 1;
    private int upperQuantileIndex = 9;
    private List<String> excludeColumns = new ArrayList<>();

    // --- Dimension splitting ---
    private List<String> dimensionNames = new ArrayList<>();
    private String metricDelimiter = "_";
    private Map<String, Map<String, Object>> dimensionLabels = new LinkedHashMap<>();
    private boolean titleCaseDimensions;
    private boolean deriveDimensionLabels;

    private boolean reportUnforecastedMetrics;

    // --- After-stage shorthands ---
    private Double cumulativeThreshold;
    private boolean onlyAnomalies;
    private Double minDeviation;
    private Integer percentDecimals;

    private StageConfig transformers = new StageConfig();

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * @throws ConfigurationException listing every problem found, including
     *                                those of nested transformers
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (name == null || name.isBlank()) {
            errors.add("'name' is required");
        }
        if (dateColumn == null || dateColumn.isBlank()) {
            errors.add("'dateColumn' is required");
        }
        if (lowerQuantileIndex < 0 || lowerQuantileIndex >= QuantileVector.SIZE
                || upperQuantileIndex < 0 || upperQuantileIndex >= QuantileVector.SIZE) {
            errors.add("quantile indices must be in [0, " + (QuantileVector.SIZE - 1) + "], got lower="
                    + lowerQuantileIndex + ", upper=" + upperQuantileIndex);
        } else if (lowerQuantileIndex >= upperQuantileIndex) {
            errors.add("'lowerQuantileIndex' (" + lowerQuantileIndex + ") must be less than 'upperQuantileIndex' ("
                    + upperQuantileIndex + ")");
        }
        if (metricDelimiter == null || metricDelimiter.isEmpty()) {
            errors.add("'metricDelimiter' must not be empty");
        }
        for (String dimension : dimensionLabels.keySet()) {
            if (!dimensionNames.contains(dimension)) {
                errors.add("'dimensionLabels' names unknown dimension '" + dimension + "'. Known: "
                        + dimensionNames);
            }
        }
        if (cumulativeThreshold != null && !(cumulativeThreshold > 0.0 && cumulativeThreshold <= 1.0)) {
            errors.add("'cumulativeThreshold' must be in (0, 1], got " + cumulativeThreshold);
        }
        if (minDeviation != null && minDeviation < 0.0) {
            errors.add("'minDeviation' must be >= 0, got " + minDeviation);
        }
        if (percentDecimals != null && percentDecimals < 0) {
            errors.add("'percentDecimals' must be >= 0, got " + percentDecimals);
        }
        errors.addAll(transformers.collectErrors("detector"));

        if (!errors.isEmpty()) {
            throw new ConfigurationException(name,
                    "Invalid detector settings: " + String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDateColumn() {
        return dateColumn;
    }

    public void setDateColumn(String dateColumn) {
        this.dateColumn = dateColumn;
    }

    public int getLowerQuantileIndex() {
        return lowerQuantileIndex;
    }

    public void setLowerQuantileIndex(int lowerQuantileIndex) {
        this.lowerQuantileIndex = lowerQuantileIndex;
    }

    public int getUpperQuantileIndex() {
        return upperQuantileIndex;
    }

    public void setUpperQuantileIndex(int upperQuantileIndex) {
        this.upperQuantileIndex = upperQuantileIndex;
    }

    public List<String> getExcludeColumns() {
        return Collections.unmodifiableList(excludeColumns);
    }

    public void setExcludeColumns(List<String> excludeColumns) {
        this.excludeColumns = excludeColumns != null ? new ArrayList<>(excludeColumns) : new ArrayList<>();
    }

    public List<String> getDimensionNames() {
        return Collections.unmodifiableList(dimensionNames);
    }

    public void setDimensionNames(List<String> dimensionNames) {
        this.dimensionNames = dimensionNames != null ? new ArrayList<>(dimensionNames) : new ArrayList<>();
    }

    public String getMetricDelimiter() {
        return metricDelimiter;
    }

    public void setMetricDelimiter(String metricDelimiter) {
        this.metricDelimiter = metricDelimiter;
    }

    /**
     * Labels per dimension, token to display label. YAML scalars may arrive
     * as numbers, so values are kept as objects and rendered with
     * {@link String#valueOf(Object)} when used.
     *
     * @return unmodifiable label map
     */
    public Map<String, Map<String, Object>> getDimensionLabels() {
        return Collections.unmodifiableMap(dimensionLabels);
    }

    public void setDimensionLabels(Map<String, Map<String, Object>> dimensionLabels) {
        this.dimensionLabels = dimensionLabels != null ? new LinkedHashMap<>(dimensionLabels) : new LinkedHashMap<>();
    }

    public boolean isTitleCaseDimensions() {
        return titleCaseDimensions;
    }

    public void setTitleCaseDimensions(boolean titleCaseDimensions) {
        this.titleCaseDimensions = titleCaseDimensions;
    }

    public boolean isDeriveDimensionLabels() {
        return deriveDimensionLabels;
    }

    public void setDeriveDimensionLabels(boolean deriveDimensionLabels) {
        this.deriveDimensionLabels = deriveDimensionLabels;
    }

    public boolean isReportUnforecastedMetrics() {
        return reportUnforecastedMetrics;
    }

    public void setReportUnforecastedMetrics(boolean reportUnforecastedMetrics) {
        this.reportUnforecastedMetrics = reportUnforecastedMetrics;
    }

    public Double getCumulativeThreshold() {
        return cumulativeThreshold;
    }

    public void setCumulativeThreshold(Double cumulativeThreshold) {
        this.cumulativeThreshold = cumulativeThreshold;
    }

    public boolean isOnlyAnomalies() {
        return onlyAnomalies;
    }

    public void setOnlyAnomalies(boolean onlyAnomalies) {
        this.onlyAnomalies = onlyAnomalies;
    }

    public Double getMinDeviation() {
        return minDeviation;
    }

    public void setMinDeviation(Double minDeviation) {
        this.minDeviation = minDeviation;
    }

    public Integer getPercentDecimals() {
        return percentDecimals;
    }

    public void setPercentDecimals(Integer percentDecimals) {
        this.percentDecimals = percentDecimals;
    }

    public StageConfig getTransformers() {
        return transformers;
    }

    public void setTransformers(StageConfig transformers) {
        this.transformers = transformers != null ? transformers : new StageConfig();
    }

    @Override
    public String toString() {
        return "DetectorSettings{" +
                "name='" + name + '\'' +
                ", dateColumn='" + dateColumn + '\'' +
                ", lowerQuantileIndex=" + lowerQuantileIndex +
                ", upperQuantileIndex=" + upperQuantileIndex +
                ", dimensionNames=" + dimensionNames +
                ", cumulativeThreshold=" + cumulativeThreshold +
                ", onlyAnomalies=" + onlyAnomalies +
                ", minDeviation=" + minDeviation +
                ", percentDecimals=" + percentDecimals +
                '}';
    }
}
