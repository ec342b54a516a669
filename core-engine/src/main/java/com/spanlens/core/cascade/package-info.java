/**
 * Spatial-temporal cascade detection between nearby entities, plus the
 * per-entity insights and short-term alerts derived from detected cascades.
 *
 * <h3>Key classes</h3>
 * <ul>
 * <li>{@link com.spanlens.core.cascade.CascadeEngine}: detection</li>
 * <li>{@link com.spanlens.core.cascade.CascadeInsights}: per-entity profile</li>
 * <li>{@link com.spanlens.core.cascade.CascadeAlerts}: projected openings</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.spanlens.core.cascade;
