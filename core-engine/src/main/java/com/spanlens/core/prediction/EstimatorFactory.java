package com.spanlens.core.prediction;

import com.spanlens.core.config.PredictionSettings;
import com.spanlens.core.model.ComputeTier;

import java.io.Serializable;
import java.util.Objects;

/**
 * Maps a {@link ComputeTier} to its estimation method.
 *
 * <table>
 * <caption>Tier methods</caption>
 * <tr><th>Tier</th><th>Model</th><th>Method</th></tr>
 * <tr><td>MINIMAL</td><td>AR(1)+MA(1)</td><td>lag-1 autocorrelation, fixed MA</td></tr>
 * <tr><td>STANDARD</td><td>AR(2)+MA(1)</td><td>Yule-Walker</td></tr>
 * <tr><td>ADVANCED</td><td>AR(3)+MA(1)</td><td>Yule-Walker</td></tr>
 * <tr><td>EXPERT</td><td>AR(4)+MA(1)</td><td>Levenberg-Marquardt</td></tr>
 * </table>
 *
 * <p>
 * The numeric settings are copied at construction.
 * </p>
 */
class EstimatorFactory implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double defaultMaCoefficient;
    private final double singularityThreshold;
    private final int maxIterations;
    private final double convergenceTolerance;

    EstimatorFactory(PredictionSettings settings) {
        Objects.requireNonNull(settings, "PredictionSettings must not be null");
        this.defaultMaCoefficient = settings.getDefaultMaCoefficient();
        this.singularityThreshold = settings.getSingularityThreshold();
        this.maxIterations = settings.getMaxIterations();
        this.convergenceTolerance = settings.getConvergenceTolerance();
    }

    ModelEstimator create(ComputeTier tier) {
        Objects.requireNonNull(tier, "tier must not be null");
        LinearSolver solver = new LinearSolver(singularityThreshold);
        return switch (tier) {
            case MINIMAL -> new CorrelationEstimator(defaultMaCoefficient);
            case STANDARD -> new YuleWalkerEstimator(2, ComputeTier.STANDARD, solver);
            case ADVANCED -> new YuleWalkerEstimator(3, ComputeTier.ADVANCED, solver);
            case EXPERT -> new LevenbergMarquardtEstimator(4, solver, maxIterations, convergenceTolerance);
        };
    }
}
