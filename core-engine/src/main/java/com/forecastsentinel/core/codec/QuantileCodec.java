package com.forecastsentinel.core.codec;

import com.forecastsentinel.core.error.DecodingException;
import com.forecastsentinel.core.error.ValidationException;
import com.forecastsentinel.core.model.QuantileVector;

import java.util.Objects;
import java.util.StringJoiner;
import java.util.regex.Pattern;

/**
 * Packs a {@link QuantileVector} into delimiter-joined text and back.
 *
 * <h3>Format</h3>
 * <p>
 * Exactly {@value QuantileVector#SIZE} numeric segments joined by
 * {@value #DELIMITER}, ordered {@code point|q10|q20|...|q90}. Whitespace
 * around a segment is ignored. Integral values are written without a
 * fraction ({@code 100}, not {@code 100.0}); every other value uses the
 * shortest text that parses back to the same {@code double}, so
 * {@code decode(encode(v))} always equals {@code v}.
 * </p>
 *
 * @since 1.0.0
 */
public final class QuantileCodec {

    public static final String DELIMITER = "|";

    private static final String COMPONENT = "quantile-codec";
    private static final Pattern SPLIT = Pattern.compile(Pattern.quote(DELIMITER));
    private static final double LONG_RENDER_LIMIT = 1e15;

    private QuantileCodec() {
        // utility class
    }

    /**
     * Decode packed quantile text.
     *
     * @param text packed text, e.g. {@code "100|90|92|95|98|100|102|105|108|110"}
     * @return decoded vector
     * @throws DecodingException if the text is blank, does not split into
     *                           exactly {@value QuantileVector#SIZE} segments,
     *                           or a segment is not a finite number
     */
    public static QuantileVector decode(String text) {
        if (text == null || text.isBlank()) {
            throw new DecodingException(COMPONENT, "Quantile text is empty", text, 0);
        }
        String[] segments = SPLIT.split(text, -1);
        if (segments.length != QuantileVector.SIZE) {
            throw new DecodingException(COMPONENT,
                    "Expected " + QuantileVector.SIZE + " segments but got " + segments.length
                            + " in '" + text + "'",
                    text, segments.length);
        }

        double[] values = new double[QuantileVector.SIZE];
        for (int i = 0; i < segments.length; i++) {
            String segment = segments[i].trim();
            double value;
            try {
                value = Double.parseDouble(segment);
            } catch (NumberFormatException e) {
                throw new DecodingException(COMPONENT,
                        "Segment " + i + " ('" + segment + "') is not numeric in '" + text + "'",
                        text, segments.length, e);
            }
            if (!Double.isFinite(value)) {
                throw new DecodingException(COMPONENT,
                        "Segment " + i + " ('" + segment + "') is not finite in '" + text + "'",
                        text, segments.length);
            }
            values[i] = value;
        }
        return QuantileVector.of(values);
    }

    /**
     * Encode a vector as packed text.
     *
     * @param vector vector to encode; must not be {@code null}
     * @return delimiter-joined text
     * @throws ValidationException if a value is NaN or infinite
     */
    public static String encode(QuantileVector vector) {
        Objects.requireNonNull(vector, "QuantileVector must not be null");
        StringJoiner joiner = new StringJoiner(DELIMITER);
        double[] values = vector.values();
        for (int i = 0; i < values.length; i++) {
            double v = values[i];
            if (!Double.isFinite(v)) {
                throw new ValidationException(COMPONENT, "Cannot encode non-finite value at index " + i + ": " + v);
            }
            joiner.add(render(v));
        }
        return joiner.toString();
    }

    private static String render(double v) {
        boolean negativeZero = v == 0.0 && Double.doubleToRawLongBits(v) != 0L;
        if (!negativeZero && v == Math.rint(v) && Math.abs(v) < LONG_RENDER_LIMIT) {
            return Long.toString((long) v);
        }
        return Double.toString(v);
    }
}
