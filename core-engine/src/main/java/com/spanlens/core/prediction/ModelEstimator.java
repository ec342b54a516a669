package com.spanlens.core.prediction;

import com.spanlens.core.CancellationToken;
import com.spanlens.core.model.ComputeTier;

import java.util.Optional;

/**
 * Contract for the per-tier ARMA estimation methods.
 *
 * <p>
 * An estimator reports failure (a near-singular system, a non-finite
 * coefficient) by returning empty; the caller then falls back to the
 * estimator of the next lower tier.
 * </p>
 */
interface ModelEstimator {

    /**
     * Fit a model to {@code series}.
     *
     * @param series       raw series, at least two values
     * @param cancellation cooperative cancellation token
     * @return the fitted model, or empty when estimation failed
     */
    Optional<ArmaModel> fit(double[] series, CancellationToken cancellation);

    /**
     * @return the tier this estimator implements
     */
    ComputeTier getTier();

    /**
     * Largest AR order that a series of length {@code n} supports, capped at
     * {@code requested}.
     */
    static int effectiveOrder(int requested, int n) {
        return Math.max(1, Math.min(requested, (n - 1) / 2));
    }
}
