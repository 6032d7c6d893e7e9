package com.forecastsentinel.batch;

import java.util.Locale;

/**
 * File format of the detection output.
 */
public enum OutputFormat {
    CSV,
    JSON;

    /**
     * @param value case-insensitive format name
     * @return matching format
     * @throws IllegalArgumentException if the name is unknown
     */
    public static OutputFormat parse(String value) {
        if (value != null) {
            for (OutputFormat format : values()) {
                if (format.name().equals(value.trim().toUpperCase(Locale.ROOT))) {
                    return format;
                }
            }
        }
        throw new IllegalArgumentException("Unknown output format: '" + value + "'. Supported: csv, json");
    }
}
