package com.forecastsentinel.core.transform;

import com.forecastsentinel.core.error.ConfigurationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Variant tags of the built-in {@link Transformer} implementations, with the
 * type strings used in pipeline configuration.
 *
 * @since 1.0.0
 */
public enum TransformerKind {

    PIVOT("pivot"),
    DATE_RANGE_FILTER("date_range"),
    VALUE_FILTER("value_filter"),
    CUMULATIVE_THRESHOLD_FILTER("cumulative_threshold"),
    COLUMN_FORMATTER("column_formatter"),
    COLUMN_SELECTOR("column_selector");

    private final String tag;

    TransformerKind(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    /**
     * Resolve a configuration type string (case-insensitive).
     *
     * @param tag type string, e.g. {@code "value_filter"}
     * @return matching kind
     * @throws ConfigurationException listing the supported types if unknown
     */
    public static TransformerKind fromTag(String tag) {
        if (tag != null) {
            String normalised = tag.trim().toLowerCase(Locale.ROOT);
            for (TransformerKind kind : values()) {
                if (kind.tag.equals(normalised)) {
                    return kind;
                }
            }
        }
        throw new ConfigurationException("transformer",
                "Unknown transformer type: '" + tag + "'. Supported: " + supportedTags());
    }

    static String supportedTags() {
        return Arrays.stream(values()).map(TransformerKind::tag).collect(Collectors.joining(", "));
    }
}
