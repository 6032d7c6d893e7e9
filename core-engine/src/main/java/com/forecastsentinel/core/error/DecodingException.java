package com.forecastsentinel.core.error;

/**
 * Raised when packed quantile text cannot be decoded.
 *
 * <p>
 * Carries the offending raw text and the number of segments it split into,
 * so the bad record can be located without re-reading the source.
 * </p>
 *
 * @since 1.0.0
 */
public class DecodingException extends PipelineException {

    private static final long serialVersionUID = 1L;

    private final String rawText;
    private final int segmentCount;

    public DecodingException(String component, String message, String rawText, int segmentCount) {
        super(component, message);
        this.rawText = rawText;
        this.segmentCount = segmentCount;
    }

    public DecodingException(String component, String message, String rawText, int segmentCount,
            Throwable cause) {
        super(component, message, cause);
        this.rawText = rawText;
        this.segmentCount = segmentCount;
    }

    public String getRawText() {
        return rawText;
    }

    public int getSegmentCount() {
        return segmentCount;
    }
}
