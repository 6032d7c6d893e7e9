package com.forecastsentinel.core.error;

/**
 * Raised when the forecast and actual datasets cannot be lined up: a metric
 * present on one side only, no overlapping dates, or a metric key whose part
 * count does not match the configured dimension names.
 *
 * @since 1.0.0
 */
public class AlignmentException extends PipelineException {

    private static final long serialVersionUID = 1L;

    public AlignmentException(String component, String message) {
        super(component, message);
    }

    public AlignmentException(String component, String message, Throwable cause) {
        super(component, message, cause);
    }
}
