/**
 * Per-entity, per-time-bucket opening statistics, their seasonal
 * decomposition and the insights drawn from it.
 *
 * @since 1.0.0
 */
package com.spanlens.core.analytics;
