package com.forecastsentinel.core.config;

import com.forecastsentinel.core.error.ConfigurationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Top-level POJO for the pipeline YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * forecastReader:
 *   transformers:
 *     after: [...]
 * actualReader:
 *   transformers:
 *     after: [...]
 * detector:
 *   lowerQuantileIndex: 1
 *   transformers:
 *     before: [...]
 *     after: [...]
 * writer:
 *   transformers:
 *     before: [...]
 * </pre>
 *
 * <p>
 * Readers have no input, so only their {@code after} stage is accepted;
 * writers have no output, so only their {@code before} stage is accepted.
 * </p>
 *
 * @since 1.0.0
 */
public class PipelineConfig {

    private ComponentConfig forecastReader = new ComponentConfig();
    private ComponentConfig actualReader = new ComponentConfig();
    private DetectorSettings detector = new DetectorSettings();
    private ComponentConfig writer = new ComponentConfig();

    /**
     * Validate every component. Collects all errors and throws once.
     *
     * @throws ConfigurationException if any component is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        checkReader("forecastReader", forecastReader, errors);
        checkReader("actualReader", actualReader, errors);
        try {
            detector.validate();
        } catch (ConfigurationException e) {
            errors.add(e.getMessage());
        }
        if (!writer.getTransformers().getAfter().isEmpty()) {
            errors.add("writer accepts only 'before' transformers");
        }
        errors.addAll(writer.getTransformers().collectErrors("writer"));

        if (!errors.isEmpty()) {
            throw new ConfigurationException("pipeline-config",
                    "Pipeline configuration validation failed:\n  - " + String.join("\n  - ", errors));
        }
    }

    private static void checkReader(String name, ComponentConfig reader, List<String> errors) {
        if (!reader.getTransformers().getBefore().isEmpty()) {
            errors.add(name + " accepts only 'after' transformers");
        }
        errors.addAll(reader.getTransformers().collectErrors(name));
    }

    public ComponentConfig getForecastReader() {
        return forecastReader;
    }

    public void setForecastReader(ComponentConfig forecastReader) {
        this.forecastReader = forecastReader != null ? forecastReader : new ComponentConfig();
    }

    public ComponentConfig getActualReader() {
        return actualReader;
    }

    public void setActualReader(ComponentConfig actualReader) {
        this.actualReader = actualReader != null ? actualReader : new ComponentConfig();
    }

    public DetectorSettings getDetector() {
        return detector;
    }

    public void setDetector(DetectorSettings detector) {
        this.detector = detector != null ? detector : new DetectorSettings();
    }

    public ComponentConfig getWriter() {
        return writer;
    }

    public void setWriter(ComponentConfig writer) {
        this.writer = writer != null ? writer : new ComponentConfig();
    }

    @Override
    public String toString() {
        return "PipelineConfig{" +
                "forecastReader=" + forecastReader +
                ", actualReader=" + actualReader +
                ", detector=" + detector +
                ", writer=" + writer +
                '}';
    }
}
