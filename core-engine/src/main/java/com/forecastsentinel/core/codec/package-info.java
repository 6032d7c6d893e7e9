/**
 * Text encoding of quantile forecasts.
 *
 * @since 1.0.0
 */
package com.forecastsentinel.core.codec;
