package com.forecastsentinel.core.error;

/**
 * Raised when a dataset does not have the shape an operation requires: empty
 * input, missing or duplicate columns, or cell values of the wrong type.
 *
 * @since 1.0.0
 */
public class ValidationException extends PipelineException {

    private static final long serialVersionUID = 1L;

    public ValidationException(String component, String message) {
        super(component, message);
    }

    public ValidationException(String component, String message, Throwable cause) {
        super(component, message, cause);
    }
}
