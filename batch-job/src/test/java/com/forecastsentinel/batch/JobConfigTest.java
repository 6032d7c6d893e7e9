package com.forecastsentinel.batch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JobConfig}.
 */
class JobConfigTest {

    @Test
    @DisplayName("Builder defaults match the documented environment defaults")
    void builderShouldUseDefaults() {
        JobConfig config = new JobConfig.Builder().build();

        assertThat(config.getForecastPath()).isEqualTo("forecast.csv");
        assertThat(config.getActualPath()).isEqualTo("actual.csv");
        assertThat(config.getOutputPath()).isEqualTo("anomalies.csv");
        assertThat(config.getOutputFormat()).isEqualTo(OutputFormat.CSV);
        assertThat(config.getPipelineConfigPath()).isEmpty();
        assertThat(config.getDateColumns()).containsExactly("date");
    }

    @Test
    @DisplayName("Builder rejects blank paths and empty date columns")
    void builderShouldValidate() {
        assertThatThrownBy(() -> new JobConfig.Builder().forecastPath(" ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("forecastPath");
        assertThatThrownBy(() -> new JobConfig.Builder().outputPath(null).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("outputPath");
        assertThatThrownBy(() -> new JobConfig.Builder().dateColumns(List.of()).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Null pipeline path falls back to the classpath default")
    void nullPipelinePathShouldBecomeBlank() {
        JobConfig config = new JobConfig.Builder().pipelineConfigPath(null).build();

        assertThat(config.getPipelineConfigPath()).isEmpty();
    }

    @Test
    @DisplayName("Comma-separated lists are trimmed and skip empty entries")
    void parseListShouldTrim() {
        assertThat(JobConfig.parseList(" date, week_start ,,")).containsExactly("date", "week_start");
    }

    @Test
    @DisplayName("Output format parsing is case-insensitive")
    void outputFormatShouldParse() {
        assertThat(OutputFormat.parse(" Json ")).isEqualTo(OutputFormat.JSON);
        assertThatThrownBy(() -> OutputFormat.parse("parquet"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("parquet");
    }
}
