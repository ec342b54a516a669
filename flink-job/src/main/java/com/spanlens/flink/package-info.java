/**
 * Apache Flink streaming job for Span Lens.
 *
 * <p>
 * This package wires the core engines into a Flink pipeline that consumes
 * span events from Kafka, forecasts each entity's next opening, detects
 * cascades across nearby entities, and publishes both result streams back
 * to Kafka.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.spanlens.flink.SpanLensJob}: main entry point</li>
 * <li>{@link com.spanlens.flink.ForecastProcessFunction}: keyed forecasting
 * function</li>
 * <li>{@link com.spanlens.flink.CascadeWindowFunction}: windowed cascade
 * detection</li>
 * <li>{@link com.spanlens.flink.JobConfig}: environment-driven
 * configuration</li>
 * <li>{@link com.spanlens.flink.HealthServer}: HTTP health/readiness
 * endpoints</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.spanlens.flink;
