package com.forecastsentinel.batch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.forecastsentinel.core.config.PipelineLoader;
import com.forecastsentinel.core.error.AlignmentException;
import com.forecastsentinel.core.error.ConfigurationException;
import com.forecastsentinel.core.model.AnomalyStatus;
import com.forecastsentinel.core.model.Dataset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests for {@link ForecastSentinelJob}.
 */
class ForecastSentinelJobTest {

    private static final String QUANTILES = "100|90|92|95|98|100|102|105|108|110";

    @TempDir
    Path dir;

    private Path forecast;
    private Path actual;

    @BeforeEach
    void setUp() throws IOException {
        forecast = write("forecast.csv",
                "date,desktop_organic,mobileapp_paid",
                "2024-01-15," + QUANTILES + "," + QUANTILES,
                "2024-01-22," + QUANTILES + "," + QUANTILES);
        actual = write("actual.csv",
                "date,platform,channel,sessions",
                "2024-01-15,Desktop,Organic,100",
                "2024-01-15,Mobile App,Paid,150");
    }

    @Test
    @DisplayName("Pivots, detects, filters and writes only the anomalies as CSV")
    void shouldWriteAnomaliesAsCsv() throws IOException {
        Path pipeline = write("pipeline.yml",
                "detector:",
                "  dimensionNames: [platform, channel]",
                "  deriveDimensionLabels: true",
                "  onlyAnomalies: true",
                "  percentDecimals: 1",
                "  transformers:",
                "    before:",
                "      - type: pivot",
                "        index: [date]",
                "        columns: [platform, channel]",
                "        values: sessions",
                "writer:",
                "  transformers:",
                "    before:",
                "      - type: column_selector",
                "        drop: [abs_deviation]");
        Path output = dir.resolve("out/anomalies.csv");

        DetectionSummary summary = ForecastSentinelJob.run(config(pipeline, output, OutputFormat.CSV));

        assertThat(summary.getTotal()).isEqualTo(1);
        assertThat(summary.getCount(AnomalyStatus.ABOVE_UPPER)).isEqualTo(1);

        Dataset written = new CsvDatasetReader(output, List.of("date")).load();
        assertThat(written.columns()).containsExactly("date", "platform", "channel", "actual", "forecast",
                "lower", "upper", "status", "deviation");
        assertThat(written.row(0)).containsEntry("platform", "Mobile App")
                .containsEntry("channel", "Paid")
                .containsEntry("actual", 150.0)
                .containsEntry("upper", 110.0)
                .containsEntry("status", "ABOVE_UPPER")
                .containsEntry("deviation", "36.4%");
    }

    @Test
    @DisplayName("Writes every comparison as JSON when no filter is configured")
    void shouldWriteAllRowsAsJson() throws IOException {
        Path pipeline = write("pipeline.yml",
                "detector:",
                "  transformers:",
                "    before:",
                "      - type: pivot",
                "        index: [date]",
                "        columns: [platform, channel]",
                "        values: sessions");
        Path output = dir.resolve("anomalies.json");

        DetectionSummary summary = ForecastSentinelJob.run(config(pipeline, output, OutputFormat.JSON));

        assertThat(summary.getTotal()).isEqualTo(2);
        assertThat(summary.getAnomalyCount()).isEqualTo(1);
        JsonNode rows = new ObjectMapper().readTree(output.toFile());
        assertThat(rows).hasSize(2);
        assertThat(rows.get(0).get("metric").asText()).isEqualTo("desktop_organic");
        assertThat(rows.get(0).get("status").asText()).isEqualTo("IN_RANGE");
        assertThat(rows.get(1).get("date").asText()).isEqualTo("2024-01-15");
    }

    @Test
    @DisplayName("Long actuals without a pivot cannot be aligned")
    void shouldFailWithoutPivot() throws IOException {
        Path pipeline = write("pipeline.yml", "detector:", "  name: no-pivot");
        Path output = dir.resolve("anomalies.csv");

        assertThatThrownBy(() -> ForecastSentinelJob.run(config(pipeline, output, OutputFormat.CSV)))
                .isInstanceOf(AlignmentException.class)
                .hasMessageContaining("desktop_organic");
        assertThat(output).doesNotExist();
    }

    @Test
    @DisplayName("An invalid pipeline fails before any file is read")
    void shouldFailOnInvalidPipeline() throws IOException {
        Path pipeline = write("pipeline.yml",
                "forecastReader:",
                "  transformers:",
                "    before:",
                "      - type: column_selector",
                "        keep: [date]");
        JobConfig config = new JobConfig.Builder()
                .forecastPath(dir.resolve("missing.csv").toString())
                .actualPath(actual.toString())
                .outputPath(dir.resolve("anomalies.csv").toString())
                .pipelineConfigPath(pipeline.toString())
                .build();

        assertThatThrownBy(() -> ForecastSentinelJob.run(config))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("forecastReader accepts only 'after' transformers");
    }

    @Test
    @DisplayName("Bundled default pipeline loads from the classpath")
    void defaultPipelineShouldLoad() {
        assertThat(PipelineLoader.fromClasspath(PipelineLoader.DEFAULT_RESOURCE).getDetector().getName())
                .isEqualTo("forecast-actual");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private JobConfig config(Path pipeline, Path output, OutputFormat format) {
        return new JobConfig.Builder()
                .forecastPath(forecast.toString())
                .actualPath(actual.toString())
                .outputPath(output.toString())
                .outputFormat(format)
                .pipelineConfigPath(pipeline.toString())
                .build();
    }

    private Path write(String name, String... lines) throws IOException {
        Path file = dir.resolve(name);
        Files.write(file, List.of(lines));
        return file;
    }
}
