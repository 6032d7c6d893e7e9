/**
 * Reader, forecaster and writer boundaries, their stage-aware wrappers, and
 * the forecast and anomaly-detection workflows that chain them.
 *
 * @since 1.0.0
 */
package com.forecastsentinel.core.pipeline;
