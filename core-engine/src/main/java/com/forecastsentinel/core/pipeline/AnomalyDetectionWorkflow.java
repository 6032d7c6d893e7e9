package com.forecastsentinel.core.pipeline;

import com.forecastsentinel.core.detection.AnomalyDetector;
import com.forecastsentinel.core.error.ValidationException;
import com.forecastsentinel.core.model.Dataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Loads forecasts and actuals, runs the detector and writes the result.
 *
 * <h3>Pipeline</h3>
 * <ol>
 * <li>Load the forecast dataset; reject it if empty.</li>
 * <li>Load the actual dataset; reject it if empty.</li>
 * <li>Detect (the detector runs its own stages).</li>
 * <li>Write the result, unless {@link #runWithoutOutput()} is used.</li>
 * </ol>
 *
 * <p>
 * An empty detection result is legitimate, for instance when an after-stage
 * filter keeps anomalies only and there are none; it is written as is.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyDetectionWorkflow {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyDetectionWorkflow.class);
    private static final String COMPONENT = "anomaly-workflow";

    private final DataReader forecastReader;
    private final DataReader actualReader;
    private final AnomalyDetector detector;
    private final DataWriter writer;

    public AnomalyDetectionWorkflow(DataReader forecastReader, DataReader actualReader,
            AnomalyDetector detector, DataWriter writer) {
        this.forecastReader = Objects.requireNonNull(forecastReader, "Forecast reader must not be null");
        this.actualReader = Objects.requireNonNull(actualReader, "Actual reader must not be null");
        this.detector = Objects.requireNonNull(detector, "Detector must not be null");
        this.writer = Objects.requireNonNull(writer, "Writer must not be null");
    }

    /**
     * Execute the workflow and write the result.
     *
     * @return the detection result that was written
     */
    public Dataset run() {
        Dataset result = execute();
        writer.write(result);
        LOG.info("Wrote {} detection row(s)", result.size());
        return result;
    }

    /**
     * Execute the workflow without writing, e.g. to inspect results first.
     *
     * @return the detection result
     */
    public Dataset runWithoutOutput() {
        return execute();
    }

    private Dataset execute() {
        Dataset forecast = forecastReader.load();
        if (forecast == null || forecast.isEmpty()) {
            throw new ValidationException(COMPONENT,
                    "Forecast reader returned empty dataset. Cannot proceed with anomaly detection.");
        }
        Dataset actual = actualReader.load();
        if (actual == null || actual.isEmpty()) {
            throw new ValidationException(COMPONENT,
                    "Actual reader returned empty dataset. Cannot proceed with anomaly detection.");
        }
        LOG.info("Loaded {} forecast row(s) and {} actual row(s)", forecast.size(), actual.size());

        Dataset result = Objects.requireNonNull(detector.detect(forecast, actual),
                "Detector '" + detector.getName() + "' returned null");
        LOG.info("Detector '{}' produced {} row(s)", detector.getName(), result.size());
        return result;
    }
}
