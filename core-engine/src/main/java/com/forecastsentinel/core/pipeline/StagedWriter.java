package com.forecastsentinel.core.pipeline;

import com.forecastsentinel.core.error.ConfigurationException;
import com.forecastsentinel.core.model.Dataset;
import com.forecastsentinel.core.transform.Stage;
import com.forecastsentinel.core.transform.TransformerStages;

import java.util.Objects;

/**
 * Runs the {@code before} stage on a dataset and hands the result to a
 * writer. A writer has no output, so an {@code after} stage is rejected.
 *
 * @since 1.0.0
 */
public class StagedWriter implements DataWriter {

    private final String name;
    private final DataWriter delegate;
    private final TransformerStages stages;

    public StagedWriter(String name, DataWriter delegate, TransformerStages stages) {
        this.name = Objects.requireNonNull(name, "Writer name must not be null");
        this.delegate = Objects.requireNonNull(delegate, "Writer must not be null");
        this.stages = Objects.requireNonNull(stages, "Stages must not be null");
        if (!stages.after().isEmpty()) {
            throw new ConfigurationException(name,
                    "Writers accept only 'before' transformers; got " + stages.after().size() + " 'after'");
        }
    }

    @Override
    public void write(Dataset dataset) {
        Objects.requireNonNull(dataset, "Dataset must not be null");
        delegate.write(stages.apply(name, Stage.BEFORE, dataset));
    }

    public String getName() {
        return name;
    }
}
