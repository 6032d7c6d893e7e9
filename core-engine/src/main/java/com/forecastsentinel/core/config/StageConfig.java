package com.forecastsentinel.core.config;

import com.forecastsentinel.core.error.ConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The {@code transformers} block of a component: an ordered {@code before}
 * and {@code after} list. An absent key is an empty stage.
 *
 * <pre>
 * transformers:
 *   before:
 *     - type: pivot
 *       index: [date]
 *       columns: [platform]
 *       values: sessions
 *   after:
 *     - type: value_filter
 *       column: status
 *       include: [ABOVE_UPPER, BELOW_LOWER]
 * </pre>
 *
 * @since 1.0.0
 */
public class StageConfig {

    private List<TransformerSpec> before = new ArrayList<>();
    private List<TransformerSpec> after = new ArrayList<>();

    public List<TransformerSpec> getBefore() {
        return Collections.unmodifiableList(before);
    }

    public void setBefore(List<TransformerSpec> before) {
        this.before = before != null ? new ArrayList<>(before) : new ArrayList<>();
    }

    public List<TransformerSpec> getAfter() {
        return Collections.unmodifiableList(after);
    }

    public void setAfter(List<TransformerSpec> after) {
        this.after = after != null ? new ArrayList<>(after) : new ArrayList<>();
    }

    /**
     * Validate every transformer in both stages.
     *
     * @param owner component name used in error messages
     * @return collected error messages; empty if valid
     */
    List<String> collectErrors(String owner) {
        List<String> errors = new ArrayList<>();
        collect(owner, "before", before, errors);
        collect(owner, "after", after, errors);
        return errors;
    }

    private static void collect(String owner, String stage, List<TransformerSpec> specs, List<String> errors) {
        for (int i = 0; i < specs.size(); i++) {
            TransformerSpec spec = specs.get(i);
            if (spec == null) {
                errors.add(owner + "." + stage + "[" + i + "]: transformer entry is empty");
                continue;
            }
            try {
                spec.validate();
            } catch (ConfigurationException e) {
                errors.add(owner + "." + stage + "[" + i + "]: " + e.getMessage());
            }
        }
    }

    @Override
    public String toString() {
        return "StageConfig{before=" + before + ", after=" + after + '}';
    }
}
