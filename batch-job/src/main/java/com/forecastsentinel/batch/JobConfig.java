package com.forecastsentinel.batch;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Typed, immutable configuration object for the Forecast Sentinel batch job.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults,
 * so the job can be driven from a scheduler, a container {@code -e} flag or a
 * shell environment without any command-line parsing.
 * </p>
 *
 * <h3>Environment</h3>
 * <ul>
 * <li>{@code FORECAST_PATH}: forecast CSV (default {@code forecast.csv})</li>
 * <li>{@code ACTUAL_PATH}: actual CSV (default {@code actual.csv})</li>
 * <li>{@code OUTPUT_PATH}: result file (default {@code anomalies.csv})</li>
 * <li>{@code OUTPUT_FORMAT}: {@code csv} or {@code json} (default
 * {@code csv})</li>
 * <li>{@code PIPELINE_CONFIG_PATH}: pipeline YAML; blank means classpath
 * {@code pipeline.yml}</li>
 * <li>{@code DATE_COLUMNS}: comma-separated columns parsed as dates (default
 * {@code date})</li>
 * </ul>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig {

    // ---------------------------------------------------------------
    // Inputs
    // ---------------------------------------------------------------
    private final String forecastPath;
    private final String actualPath;
    private final List<String> dateColumns;

    // ---------------------------------------------------------------
    // Output
    // ---------------------------------------------------------------
    private final String outputPath;
    private final OutputFormat outputFormat;

    // ---------------------------------------------------------------
    // Pipeline
    // ---------------------------------------------------------------
    private final String pipelineConfigPath;

    private JobConfig(Builder b) {
        this.forecastPath = b.forecastPath;
        this.actualPath = b.actualPath;
        this.dateColumns = Collections.unmodifiableList(new ArrayList<>(b.dateColumns));
        this.outputPath = b.outputPath;
        this.outputFormat = b.outputFormat;
        this.pipelineConfigPath = b.pipelineConfigPath;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalArgumentException if a value is invalid
     */
    public static JobConfig fromEnvironment() {
        return new Builder()
                .forecastPath(env("FORECAST_PATH", "forecast.csv"))
                .actualPath(env("ACTUAL_PATH", "actual.csv"))
                .outputPath(env("OUTPUT_PATH", "anomalies.csv"))
                .outputFormat(OutputFormat.parse(env("OUTPUT_FORMAT", "csv")))
                .pipelineConfigPath(env("PIPELINE_CONFIG_PATH", ""))
                .dateColumns(parseList(env("DATE_COLUMNS", "date")))
                .build();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getForecastPath() {
        return forecastPath;
    }

    public String getActualPath() {
        return actualPath;
    }

    public List<String> getDateColumns() {
        return dateColumns;
    }

    public String getOutputPath() {
        return outputPath;
    }

    public OutputFormat getOutputFormat() {
        return outputFormat;
    }

    public String getPipelineConfigPath() {
        return pipelineConfigPath;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * The {@link #build()} method validates that all paths are non-blank and
     * that at least one date column is named.
     * </p>
     */
    public static class Builder {
        private String forecastPath = "forecast.csv";
        private String actualPath = "actual.csv";
        private String outputPath = "anomalies.csv";
        private OutputFormat outputFormat = OutputFormat.CSV;
        private String pipelineConfigPath = "";
        private List<String> dateColumns = List.of("date");

        public Builder forecastPath(String v) {
            this.forecastPath = v;
            return this;
        }

        public Builder actualPath(String v) {
            this.actualPath = v;
            return this;
        }

        public Builder outputPath(String v) {
            this.outputPath = v;
            return this;
        }

        public Builder outputFormat(OutputFormat v) {
            this.outputFormat = v;
            return this;
        }

        public Builder pipelineConfigPath(String v) {
            this.pipelineConfigPath = v;
            return this;
        }

        public Builder dateColumns(List<String> v) {
            this.dateColumns = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            requireNonBlank(forecastPath, "forecastPath");
            requireNonBlank(actualPath, "actualPath");
            requireNonBlank(outputPath, "outputPath");
            Objects.requireNonNull(outputFormat, "outputFormat required");
            Objects.requireNonNull(dateColumns, "dateColumns required");

            if (dateColumns.isEmpty()) {
                throw new IllegalArgumentException("dateColumns must name at least one column");
            }
            if (pipelineConfigPath == null) {
                pipelineConfigPath = "";
            }

            return new JobConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    static List<String> parseList(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "forecastPath='" + forecastPath + '\'' +
                ", actualPath='" + actualPath + '\'' +
                ", outputPath='" + outputPath + '\'' +
                ", outputFormat=" + outputFormat +
                ", pipelineConfigPath='" + pipelineConfigPath + '\'' +
                ", dateColumns=" + dateColumns +
                '}';
    }
}
