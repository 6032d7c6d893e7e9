/**
 * Dataset transformers and the stage runner that chains them.
 *
 * <p>
 * Every {@link com.forecastsentinel.core.transform.Transformer} is a pure
 * {@code Dataset -> Dataset} function tagged with a
 * {@link com.forecastsentinel.core.transform.TransformerKind}. Components own
 * a {@link com.forecastsentinel.core.transform.TransformerStages} pair and run
 * it through {@link com.forecastsentinel.core.transform.StageRunner}.
 * </p>
 *
 * @since 1.0.0
 */
package com.forecastsentinel.core.transform;
