package com.forecastsentinel.core.error;

/**
 * Root of the pipeline error hierarchy.
 *
 * <p>
 * Every failure raised by a transformer, the quantile codec, the detector or
 * a workflow is surfaced to the caller as a subclass of this type. No
 * component recovers from these locally.
 * </p>
 *
 * @since 1.0.0
 */
public class PipelineException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Name of the transformer, stage or component that raised the error. */
    private final String component;

    public PipelineException(String component, String message) {
        super(prefix(component) + message);
        this.component = component;
    }

    public PipelineException(String component, String message, Throwable cause) {
        super(prefix(component) + message, cause);
        this.component = component;
    }

    /**
     * @return the component that raised the error, or {@code null} if unknown
     */
    public String getComponent() {
        return component;
    }

    private static String prefix(String component) {
        return component == null || component.isBlank() ? "" : "[" + component + "] ";
    }
}
