package com.forecastsentinel.core.detection;

import com.forecastsentinel.core.config.DetectorSettings;
import com.forecastsentinel.core.config.StageConfig;
import com.forecastsentinel.core.config.TransformerSpec;
import com.forecastsentinel.core.error.ConfigurationException;
import com.forecastsentinel.core.model.Dataset;
import com.forecastsentinel.core.transform.ColumnFormatter;
import com.forecastsentinel.core.transform.ColumnSelector;
import com.forecastsentinel.core.transform.CumulativeThresholdFilter;
import com.forecastsentinel.core.transform.Transformer;
import com.forecastsentinel.core.transform.ValueFilter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DetectorFactory}.
 */
class DetectorFactoryTest {

    @Test
    @DisplayName("Default settings create a detector with no transformers")
    void shouldCreateDefaultDetector() {
        ForecastActualDetector detector = DetectorFactory.create(new DetectorSettings());

        assertThat(detector.getName()).isEqualTo("forecast-actual");
        assertThat(detector.getLowerQuantileIndex()).isEqualTo(1);
        assertThat(detector.getUpperQuantileIndex()).isEqualTo(9);
        assertThat(detector.getStages().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Shorthands become after transformers in a fixed order")
    void shorthandsShouldKeepOrder() {
        DetectorSettings settings = new DetectorSettings();
        settings.setPercentDecimals(1);
        settings.setMinDeviation(0.05);
        settings.setOnlyAnomalies(true);
        settings.setCumulativeThreshold(0.8);

        List<Transformer> transformers = DetectorFactory.shorthandTransformers(settings);

        assertThat(transformers).hasSize(4);
        assertThat(transformers.get(0)).isInstanceOf(CumulativeThresholdFilter.class);
        assertThat(((ValueFilter) transformers.get(1)).getMode()).isEqualTo(ValueFilter.Mode.INCLUDE);
        assertThat(((ValueFilter) transformers.get(2)).getMode()).isEqualTo(ValueFilter.Mode.RANGE);
        assertThat(((ValueFilter) transformers.get(2)).getExemptColumn()).contains("status");
        assertThat(transformers.get(3)).isInstanceOf(ColumnFormatter.class);
    }

    @Test
    @DisplayName("Minimum deviation thresholds anomalies but keeps in-range rows")
    void minDeviationShouldKeepInRangeRows() {
        DetectorSettings settings = new DetectorSettings();
        settings.setMinDeviation(0.05);
        LocalDate day = LocalDate.of(2024, 3, 1);
        String band = "100|90|92|95|98|100|102|105|108|110";
        Dataset forecast = Dataset.builder("date", "a", "b", "c").row(day, band, band, band).build();
        // a in range, b far below, c just above (deviation 0.01)
        Dataset actual = Dataset.builder("date", "a", "b", "c").row(day, 95, 50, 111.1).build();

        Dataset result = DetectorFactory.create(settings).detect(forecast, actual);

        assertThat(result.columnValues("metric")).containsExactly("a", "b");
        assertThat(result.columnValues("status")).containsExactly("IN_RANGE", "BELOW_LOWER");
    }

    @Test
    @DisplayName("Only anomalies combined with minimum deviation drops in-range rows")
    void onlyAnomaliesShouldStillDropInRangeRows() {
        DetectorSettings settings = new DetectorSettings();
        settings.setMinDeviation(0.05);
        settings.setOnlyAnomalies(true);
        LocalDate day = LocalDate.of(2024, 3, 1);
        String band = "100|90|92|95|98|100|102|105|108|110";
        Dataset forecast = Dataset.builder("date", "a", "b").row(day, band, band).build();
        Dataset actual = Dataset.builder("date", "a", "b").row(day, 95, 50).build();

        Dataset result = DetectorFactory.create(settings).detect(forecast, actual);

        assertThat(result.columnValues("metric")).containsExactly("b");
    }

    @Test
    @DisplayName("Explicit after transformers run behind the shorthands")
    void explicitTransformersShouldFollowShorthands() {
        TransformerSpec drop = new TransformerSpec();
        drop.setType("column_selector");
        drop.setDrop(List.of("abs_deviation"));
        StageConfig stages = new StageConfig();
        stages.setAfter(List.of(drop));
        DetectorSettings settings = new DetectorSettings();
        settings.setOnlyAnomalies(true);
        settings.setTransformers(stages);

        ForecastActualDetector detector = DetectorFactory.create(settings);

        assertThat(detector.getStages().after()).hasSize(2);
        assertThat(detector.getStages().after().get(1)).isInstanceOf(ColumnSelector.class);
    }

    @Test
    @DisplayName("Configured labels reach the dimension columns, whatever their YAML type")
    void shouldApplyDimensionLabels() {
        Map<String, Object> productLabels = new LinkedHashMap<>();
        productLabels.put("producta", "Product A");
        Map<String, Object> yearLabels = new LinkedHashMap<>();
        yearLabels.put("2024", 2024);
        Map<String, Map<String, Object>> labels = new LinkedHashMap<>();
        labels.put("product", productLabels);
        labels.put("year", yearLabels);

        DetectorSettings settings = new DetectorSettings();
        settings.setDimensionNames(List.of("product", "year"));
        settings.setDimensionLabels(labels);
        settings.setPercentDecimals(0);

        LocalDate day = LocalDate.of(2024, 3, 1);
        Dataset forecast = Dataset.builder("date", "producta_2024")
                .row(day, "100|90|92|95|98|100|102|105|108|110")
                .build();
        Dataset actual = Dataset.builder("date", "producta_2024").row(day, 120).build();

        Dataset result = DetectorFactory.create(settings).detect(forecast, actual);

        assertThat(result.row(0)).containsEntry("product", "Product A")
                .containsEntry("year", "2024")
                .containsEntry("deviation", "9%");
    }

    @Test
    @DisplayName("Invalid settings are reported together")
    void shouldRejectInvalidSettings() {
        DetectorSettings settings = new DetectorSettings();
        settings.setLowerQuantileIndex(9);
        settings.setUpperQuantileIndex(1);
        settings.setCumulativeThreshold(1.5);

        assertThatThrownBy(() -> DetectorFactory.create(settings))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("lowerQuantileIndex")
                .hasMessageContaining("cumulativeThreshold");
    }
}
