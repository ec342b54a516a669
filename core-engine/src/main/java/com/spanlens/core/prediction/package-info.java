/**
 * Tiered ARMA forecasting of an entity's next opening.
 *
 * <p>
 * {@link com.spanlens.core.prediction.PredictionEngine} is the entry point;
 * estimators are package-private and chosen per
 * {@link com.spanlens.core.model.ComputeTier}.
 * </p>
 *
 * @since 1.0.0
 */
package com.spanlens.core.prediction;
