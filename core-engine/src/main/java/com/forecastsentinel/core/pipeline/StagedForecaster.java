package com.forecastsentinel.core.pipeline;

import com.forecastsentinel.core.model.Dataset;
import com.forecastsentinel.core.transform.Stage;
import com.forecastsentinel.core.transform.TransformerStages;

import java.util.Objects;

/**
 * Wraps a forecaster with its {@code before} stage (on the history) and
 * {@code after} stage (on the forecast).
 *
 * @since 1.0.0
 */
public class StagedForecaster implements Forecaster {

    private final String name;
    private final Forecaster delegate;
    private final TransformerStages stages;

    public StagedForecaster(String name, Forecaster delegate, TransformerStages stages) {
        this.name = Objects.requireNonNull(name, "Forecaster name must not be null");
        this.delegate = Objects.requireNonNull(delegate, "Forecaster must not be null");
        this.stages = Objects.requireNonNull(stages, "Stages must not be null");
    }

    @Override
    public Dataset forecast(Dataset history, int horizon) {
        Dataset input = stages.apply(name, Stage.BEFORE, history);
        Dataset output = Objects.requireNonNull(delegate.forecast(input, horizon),
                "Forecaster '" + name + "' returned null");
        return stages.apply(name, Stage.AFTER, output);
    }
}
