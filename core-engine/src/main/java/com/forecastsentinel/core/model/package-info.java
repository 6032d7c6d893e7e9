/**
 * Value types shared by every pipeline component.
 *
 * <ul>
 * <li>{@link com.forecastsentinel.core.model.Dataset}: immutable in-memory
 * table</li>
 * <li>{@link com.forecastsentinel.core.model.QuantileVector}: ten-value
 * forecast for one cell</li>
 * <li>{@link com.forecastsentinel.core.model.AnomalyRecord}: one detector
 * output row</li>
 * <li>{@link com.forecastsentinel.core.model.AnomalyStatus}: comparison
 * outcome</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.forecastsentinel.core.model;
