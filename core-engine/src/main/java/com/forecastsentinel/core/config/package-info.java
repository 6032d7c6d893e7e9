/**
 * YAML configuration of a pipeline: readers, detector and writer, each with
 * its {@code before} / {@code after} transformer lists.
 *
 * <p>
 * {@link com.forecastsentinel.core.config.PipelineLoader} parses and
 * validates the document; {@link com.forecastsentinel.core.config.TransformerFactory}
 * turns transformer specs into instances.
 * </p>
 *
 * @since 1.0.0
 */
package com.forecastsentinel.core.config;
