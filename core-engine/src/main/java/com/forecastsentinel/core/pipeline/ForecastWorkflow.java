package com.forecastsentinel.core.pipeline;

import com.forecastsentinel.core.error.ConfigurationException;
import com.forecastsentinel.core.error.ValidationException;
import com.forecastsentinel.core.model.Dataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Loads history, forecasts {@code horizon} periods ahead and writes the
 * forecast.
 *
 * @since 1.0.0
 */
public class ForecastWorkflow {

    private static final Logger LOG = LoggerFactory.getLogger(ForecastWorkflow.class);
    private static final String COMPONENT = "forecast-workflow";

    private final DataReader reader;
    private final Forecaster forecaster;
    private final DataWriter writer;
    private final int horizon;

    /**
     * @throws ConfigurationException if {@code horizon} is not positive
     */
    public ForecastWorkflow(DataReader reader, Forecaster forecaster, DataWriter writer, int horizon) {
        this.reader = Objects.requireNonNull(reader, "Reader must not be null");
        this.forecaster = Objects.requireNonNull(forecaster, "Forecaster must not be null");
        this.writer = Objects.requireNonNull(writer, "Writer must not be null");
        if (horizon <= 0) {
            throw new ConfigurationException(COMPONENT, "horizon must be positive, got " + horizon);
        }
        this.horizon = horizon;
    }

    /**
     * @return the forecast that was written
     * @throws ValidationException if the reader or the forecaster returns no
     *                             rows
     */
    public Dataset run() {
        Dataset history = reader.load();
        if (history == null || history.isEmpty()) {
            throw new ValidationException(COMPONENT, "Reader returned empty dataset. Cannot forecast.");
        }
        Dataset forecast = forecaster.forecast(history, horizon);
        if (forecast == null || forecast.isEmpty()) {
            throw new ValidationException(COMPONENT, "Forecaster returned empty results for horizon " + horizon);
        }
        writer.write(forecast);
        LOG.info("Forecast {} period(s) from {} history row(s); wrote {} row(s)",
                horizon, history.size(), forecast.size());
        return forecast;
    }

    public int getHorizon() {
        return horizon;
    }
}
