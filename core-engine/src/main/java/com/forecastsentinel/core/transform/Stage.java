package com.forecastsentinel.core.transform;

import com.forecastsentinel.core.error.ConfigurationException;

import java.util.Locale;

/**
 * Point relative to a component's primary operation at which configured
 * transformers run.
 *
 * @since 1.0.0
 */
public enum Stage {

    /** Runs on the input of the primary operation. */
    BEFORE("before"),

    /** Runs on the output of the primary operation. */
    AFTER("after");

    private final String key;

    Stage(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    /**
     * @param key configuration key, {@code before} or {@code after}
     * @return matching stage
     * @throws ConfigurationException for any other key
     */
    public static Stage fromKey(String key) {
        if (key != null) {
            String normalised = key.trim().toLowerCase(Locale.ROOT);
            for (Stage stage : values()) {
                if (stage.key.equals(normalised)) {
                    return stage;
                }
            }
        }
        throw new ConfigurationException("transformers",
                "Invalid stage key: '" + key + "'. Supported: before, after");
    }
}
