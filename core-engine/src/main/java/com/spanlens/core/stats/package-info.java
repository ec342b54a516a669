/**
 * Shared statistics: quantile thresholds and the duration severity bands
 * built on them.
 *
 * @since 1.0.0
 */
package com.spanlens.core.stats;
