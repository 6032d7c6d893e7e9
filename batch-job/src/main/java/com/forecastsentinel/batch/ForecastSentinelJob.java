package com.forecastsentinel.batch;

import com.forecastsentinel.core.config.PipelineConfig;
import com.forecastsentinel.core.config.PipelineLoader;
import com.forecastsentinel.core.config.TransformerFactory;
import com.forecastsentinel.core.detection.AnomalyDetector;
import com.forecastsentinel.core.detection.DetectorFactory;
import com.forecastsentinel.core.error.PipelineException;
import com.forecastsentinel.core.model.Dataset;
import com.forecastsentinel.core.pipeline.AnomalyDetectionWorkflow;
import com.forecastsentinel.core.pipeline.DataReader;
import com.forecastsentinel.core.pipeline.DataWriter;
import com.forecastsentinel.core.pipeline.StagedReader;
import com.forecastsentinel.core.pipeline.StagedWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Main entry point for the Forecast Sentinel batch job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   forecast CSV → forecastReader.after ┐
 *                                       ├→ detector (before → detect → after)
 *   actual CSV   → actualReader.after   ┘
 *     → writer.before → CSV / JSON file
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * File locations come from environment variables via {@link JobConfig};
 * transformers and detector settings come from the pipeline YAML loaded by
 * {@link PipelineLoader}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ForecastSentinelJob {

    private static final Logger LOG = LoggerFactory.getLogger(ForecastSentinelJob.class);

    private ForecastSentinelJob() {
        // entry point only
    }

    public static void main(String[] args) {
        // 1. Load configuration
        JobConfig config = JobConfig.fromEnvironment();
        LOG.info("Starting Forecast Sentinel with config: {}", config);

        try {
            run(config);
        } catch (PipelineException e) {
            LOG.error("Forecast Sentinel run failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    /**
     * Run one detection pass.
     *
     * @param config job configuration
     * @return status counts of the written result
     */
    static DetectionSummary run(JobConfig config) {
        // 2. Load pipeline configuration
        PipelineConfig pipeline = loadPipeline(config);

        // 3. Assemble components
        AnomalyDetectionWorkflow workflow = buildWorkflow(config, pipeline);

        // 4. Execute
        Dataset result = workflow.run();
        DetectionSummary summary = DetectionSummary.of(result);
        LOG.info("Forecast Sentinel finished: {} row(s), {} anomal{} -> {}",
                summary.getTotal(), summary.getAnomalyCount(), summary.getAnomalyCount() == 1 ? "y" : "ies",
                config.getOutputPath());
        LOG.debug("Status breakdown: {}", summary);
        return summary;
    }

    // ---------------------------------------------------------------
    // Pipeline assembly
    // ---------------------------------------------------------------

    static AnomalyDetectionWorkflow buildWorkflow(JobConfig config, PipelineConfig pipeline) {
        DataReader forecastReader = new StagedReader("forecast-reader",
                new CsvDatasetReader(Path.of(config.getForecastPath()), config.getDateColumns()),
                TransformerFactory.createStages(pipeline.getForecastReader().getTransformers()));
        DataReader actualReader = new StagedReader("actual-reader",
                new CsvDatasetReader(Path.of(config.getActualPath()), config.getDateColumns()),
                TransformerFactory.createStages(pipeline.getActualReader().getTransformers()));

        AnomalyDetector detector = DetectorFactory.create(pipeline.getDetector());

        Path output = Path.of(config.getOutputPath());
        DataWriter sink = switch (config.getOutputFormat()) {
            case CSV -> new CsvDatasetWriter(output);
            case JSON -> new JsonDatasetWriter(output);
        };
        DataWriter writer = new StagedWriter("writer", sink,
                TransformerFactory.createStages(pipeline.getWriter().getTransformers()));

        return new AnomalyDetectionWorkflow(forecastReader, actualReader, detector, writer);
    }

    private static PipelineConfig loadPipeline(JobConfig config) {
        String pipelinePath = config.getPipelineConfigPath();
        if (pipelinePath != null && !pipelinePath.isBlank()) {
            return PipelineLoader.fromFile(pipelinePath);
        }
        return PipelineLoader.load();
    }
}
