/**
 * Immutable value types shared by the engines and the Flink job.
 *
 * <ul>
 * <li>{@link com.spanlens.core.model.SpanEvent}: raw open/close span</li>
 * <li>{@link com.spanlens.core.model.EntityLocation}: static entity
 * coordinates</li>
 * <li>{@link com.spanlens.core.model.AnalyticsRecord}: per-bucket
 * statistics</li>
 * <li>{@link com.spanlens.core.model.CascadeRecord}: directed cascade
 * instance</li>
 * <li>{@link com.spanlens.core.model.Forecast}: short-horizon forecast</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.spanlens.core.model;
