package com.forecastsentinel.core.transform;

import com.forecastsentinel.core.model.Dataset;

/**
 * A single pure operation over a {@link Dataset}.
 *
 * <p>
 * Implementations never modify their input; they return a new dataset.
 * The set of implementations is closed and enumerated by
 * {@link TransformerKind}; {@link com.forecastsentinel.core.config.TransformerFactory} is the single place
 * that maps configuration onto them.
 * </p>
 *
 * @since 1.0.0
 */
public interface Transformer {

    /**
     * Apply this transformation.
     *
     * @param dataset input dataset
     * @return a new dataset
     * @throws com.forecastsentinel.core.error.PipelineException if the input
     *                                                           cannot be
     *                                                           transformed
     */
    Dataset apply(Dataset dataset);

    /**
     * @return the variant tag of this transformer
     */
    TransformerKind kind();

    /**
     * @return name used in log lines and error messages
     */
    default String name() {
        return kind().tag();
    }
}
