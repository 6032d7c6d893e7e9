package com.forecastsentinel.core.transform;

import com.forecastsentinel.core.error.PipelineException;
import com.forecastsentinel.core.model.Dataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Applies an ordered list of {@link Transformer}s, each to the output of the
 * previous one.
 *
 * <p>
 * Order is part of the contract: transformers are not assumed to commute.
 * An empty list returns the input unchanged. The first failure aborts the run
 * and propagates; no partial dataset is returned. Failures that are not
 * already {@link PipelineException}s are wrapped in one naming the
 * component, stage and transformer.
 * </p>
 *
 * @since 1.0.0
 */
public final class StageRunner {

    private static final Logger LOG = LoggerFactory.getLogger(StageRunner.class);

    private StageRunner() {
        // utility class
    }

    /**
     * Run a list of transformers.
     *
     * @param component    owning component, used in logs and errors
     * @param stage        stage being run
     * @param transformers transformers in application order
     * @param dataset      input dataset
     * @return the output of the last transformer, or {@code dataset} if the list
     *         is empty
     */
    public static Dataset run(String component, Stage stage, List<Transformer> transformers, Dataset dataset) {
        Objects.requireNonNull(transformers, "Transformer list must not be null");
        Objects.requireNonNull(dataset, "Dataset must not be null");

        Dataset current = dataset;
        for (int i = 0; i < transformers.size(); i++) {
            Transformer transformer = transformers.get(i);
            int before = current.size();
            try {
                current = Objects.requireNonNull(transformer.apply(current),
                        "Transformer '" + transformer.name() + "' returned null");
            } catch (PipelineException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new PipelineException(component,
                        "Transformer #" + i + " '" + transformer.name() + "' failed in stage '"
                                + stage.key() + "': " + e.getMessage(),
                        e);
            }
            LOG.debug("[{}:{}] {} -> {} row(s) via '{}'",
                    component, stage.key(), before, current.size(), transformer.name());
        }
        return current;
    }
}
