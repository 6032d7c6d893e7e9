package com.forecastsentinel.core.model;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Coercion helpers for dataset cell values.
 *
 * @since 1.0.0
 */
public final class Values {

    private Values() {
        // utility class
    }

    /**
     * Coerce a cell to a {@code double}.
     *
     * <p>
     * Handles {@link Number} subclasses natively and attempts
     * {@link Double#parseDouble(String)} for string-encoded numbers.
     * </p>
     *
     * @param value cell value
     * @return the numeric value, or empty if the cell is {@code null} or not
     *         numeric
     */
    public static Optional<Double> asDouble(Object value) {
        if (value instanceof Number n) {
            return Optional.of(n.doubleValue());
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Optional.of(Double.parseDouble(s.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * Coerce a cell to a {@link LocalDate}.
     *
     * <p>
     * Accepts {@code LocalDate}, {@code LocalDateTime}, {@link Date} and ISO-8601
     * strings (date, local date-time with {@code 'T'} or a space, or offset
     * date-time). Date-times are truncated to their date.
     * </p>
     *
     * @param value cell value
     * @return the date, or empty if the cell is {@code null} or not a date
     */
    public static Optional<LocalDate> asDate(Object value) {
        if (value instanceof LocalDate d) {
            return Optional.of(d);
        }
        if (value instanceof LocalDateTime dt) {
            return Optional.of(dt.toLocalDate());
        }
        if (value instanceof Date d) {
            return Optional.of(d.toInstant().atOffset(ZoneOffset.UTC).toLocalDate());
        }
        if (value instanceof String s && !s.isBlank()) {
            String text = s.trim();
            String isoText = text.replace(' ', 'T');
            return tryParse(() -> LocalDate.parse(text))
                    .or(() -> tryParse(() -> LocalDateTime.parse(isoText).toLocalDate()))
                    .or(() -> tryParse(() -> OffsetDateTime.parse(isoText).toLocalDate()));
        }
        return Optional.empty();
    }

    /**
     * Key used to line rows up by date: the parsed date when the cell is a
     * date, otherwise its string form.
     *
     * @param value cell value
     * @return comparable alignment key
     */
    public static Object dateKey(Object value) {
        return asDate(value).<Object>map(d -> d).orElse(String.valueOf(value));
    }

    /**
     * Compare two cell values: numerically when both are numbers, otherwise
     * by their string form.
     *
     * @param cell       dataset cell
     * @param configured configured value
     * @return {@code true} if they denote the same value
     */
    public static boolean sameValue(Object cell, Object configured) {
        if (cell == null || configured == null) {
            return cell == configured;
        }
        if (cell instanceof Number a && configured instanceof Number b) {
            return Double.compare(a.doubleValue(), b.doubleValue()) == 0;
        }
        return String.valueOf(cell).equals(String.valueOf(configured));
    }

    /**
     * Title-case every word of a token; words are separated by spaces.
     *
     * @param text raw text
     * @return text with each word capitalised and the rest lower-cased
     */
    public static String titleCase(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        boolean startOfWord = true;
        for (char c : text.toCharArray()) {
            if (Character.isWhitespace(c)) {
                startOfWord = true;
                sb.append(c);
            } else if (startOfWord) {
                sb.append(Character.toUpperCase(c));
                startOfWord = false;
            } else {
                sb.append(Character.toLowerCase(c));
            }
        }
        return sb.toString();
    }

    private static Optional<LocalDate> tryParse(Supplier<LocalDate> parser) {
        try {
            return Optional.of(parser.get());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
