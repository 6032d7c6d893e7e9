/**
 * Error taxonomy shared by every pipeline component.
 *
 * <ul>
 * <li>{@link com.forecastsentinel.core.error.ConfigurationException}: bad
 * parameters, detected at construction</li>
 * <li>{@link com.forecastsentinel.core.error.ValidationException}: dataset
 * shape problems, detected before any work is done</li>
 * <li>{@link com.forecastsentinel.core.error.DecodingException}: malformed
 * quantile text</li>
 * <li>{@link com.forecastsentinel.core.error.AlignmentException}: forecast and
 * actual data do not line up</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.forecastsentinel.core.error;
