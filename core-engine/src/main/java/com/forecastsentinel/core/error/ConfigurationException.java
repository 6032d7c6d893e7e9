package com.forecastsentinel.core.error;

/**
 * Raised for invalid transformer parameters, quantile indices, stage keys or
 * malformed pipeline configuration. Thrown eagerly at construction whenever
 * the problem is detectable there.
 *
 * @since 1.0.0
 */
public class ConfigurationException extends PipelineException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String component, String message) {
        super(component, message);
    }

    public ConfigurationException(String component, String message, Throwable cause) {
        super(component, message, cause);
    }
}
