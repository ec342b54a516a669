package com.spanlens.core.prediction;

import com.spanlens.core.CancellationToken;
import com.spanlens.core.model.ComputeTier;

import java.util.Optional;

/**
 * {@link ComputeTier#MINIMAL} estimator: AR(1) with the coefficient taken
 * straight from the lag-1 autocorrelation and a fixed MA coefficient.
 *
 * <p>
 * This estimator cannot fail; it is the end of every fallback chain.
 * </p>
 */
final class CorrelationEstimator implements ModelEstimator {

    /** Keeps the AR(1) coefficient strictly inside the stationary region. */
    static final double MAX_AR = 0.99;

    private final double maCoefficient;

    CorrelationEstimator(double maCoefficient) {
        this.maCoefficient = maCoefficient;
    }

    @Override
    public Optional<ArmaModel> fit(double[] series, CancellationToken cancellation) {
        double r1 = SeriesStatistics.autocorrelation(series, 1);
        double phi = Math.max(-MAX_AR, Math.min(MAX_AR, r1));
        return Optional.of(new ArmaModel(new double[] { phi }, maCoefficient, series, ComputeTier.MINIMAL));
    }

    @Override
    public ComputeTier getTier() {
        return ComputeTier.MINIMAL;
    }
}
