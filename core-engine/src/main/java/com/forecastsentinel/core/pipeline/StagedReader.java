package com.forecastsentinel.core.pipeline;

import com.forecastsentinel.core.error.ConfigurationException;
import com.forecastsentinel.core.model.Dataset;
import com.forecastsentinel.core.transform.Stage;
import com.forecastsentinel.core.transform.TransformerStages;

import java.util.Objects;

/**
 * Runs the {@code after} stage on whatever a reader loads. A reader has no
 * input, so a {@code before} stage is rejected.
 *
 * @since 1.0.0
 */
public class StagedReader implements DataReader {

    private final String name;
    private final DataReader delegate;
    private final TransformerStages stages;

    public StagedReader(String name, DataReader delegate, TransformerStages stages) {
        this.name = Objects.requireNonNull(name, "Reader name must not be null");
        this.delegate = Objects.requireNonNull(delegate, "Reader must not be null");
        this.stages = Objects.requireNonNull(stages, "Stages must not be null");
        if (!stages.before().isEmpty()) {
            throw new ConfigurationException(name,
                    "Readers accept only 'after' transformers; got " + stages.before().size() + " 'before'");
        }
    }

    @Override
    public Dataset load() {
        Dataset loaded = Objects.requireNonNull(delegate.load(), "Reader '" + name + "' returned null");
        return stages.apply(name, Stage.AFTER, loaded);
    }

    public String getName() {
        return name;
    }
}
