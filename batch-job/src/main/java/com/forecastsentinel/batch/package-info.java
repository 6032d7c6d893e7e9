/**
 * Batch entry point: reads forecast and actual CSV files, runs the configured
 * detector and writes the result as CSV or JSON.
 *
 * @since 1.0.0
 */
package com.forecastsentinel.batch;
