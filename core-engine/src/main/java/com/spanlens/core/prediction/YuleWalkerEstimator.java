package com.spanlens.core.prediction;

import com.spanlens.core.CancellationToken;
import com.spanlens.core.model.ComputeTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * AR(p) by the Yule-Walker equations plus an MA(1) term matched to the
 * lag-1 autocorrelation of the AR residuals.
 *
 * <h3>MA(1) from a residual autocorrelation</h3>
 * <p>
 * An MA(1) process has {@code rho = theta / (1 + theta^2)}. For
 * {@code |rho| < 0.5} the invertible root is
 * {@code theta = (1 - sqrt(1 - 4 rho^2)) / (2 rho)}; otherwise no real root
 * exists and {@code theta} is pushed to {@code sign(rho)}. The result is then
 * clamped to {@code [-0.9, 0.9]}.
 * </p>
 */
class YuleWalkerEstimator implements ModelEstimator {

    private static final Logger LOG = LoggerFactory.getLogger(YuleWalkerEstimator.class);

    static final double MAX_MA = 0.9;

    private final int order;
    private final ComputeTier tier;
    private final LinearSolver solver;

    YuleWalkerEstimator(int order, ComputeTier tier, LinearSolver solver) {
        if (order < 1) {
            throw new IllegalArgumentException("AR order must be >= 1, got: " + order);
        }
        this.order = order;
        this.tier = tier;
        this.solver = solver;
    }

    @Override
    public Optional<ArmaModel> fit(double[] series, CancellationToken cancellation) {
        int p = ModelEstimator.effectiveOrder(order, series.length);
        Optional<double[]> ar = arCoefficients(series, p);
        if (ar.isEmpty()) {
            LOG.debug("Yule-Walker AR({}) system is singular for a series of {} value(s)", p, series.length);
            return Optional.empty();
        }
        double theta = maFromResiduals(ar.get(), series);
        ArmaModel model = new ArmaModel(ar.get(), theta, series, tier);
        return model.isFinite() ? Optional.of(model) : Optional.empty();
    }

    /**
     * Solve {@code R phi = r} where {@code R} is the Toeplitz matrix of
     * autocovariances {@code gamma(0..p-1)} and {@code r = gamma(1..p)}.
     */
    Optional<double[]> arCoefficients(double[] series, int p) {
        double[] gamma = new double[p + 1];
        for (int lag = 0; lag <= p; lag++) {
            gamma[lag] = SeriesStatistics.autocovariance(series, lag);
        }
        double[][] toeplitz = new double[p][p];
        double[] rhs = new double[p];
        for (int i = 0; i < p; i++) {
            for (int j = 0; j < p; j++) {
                toeplitz[i][j] = gamma[Math.abs(i - j)];
            }
            rhs[i] = gamma[i + 1];
        }
        return solver.solve(toeplitz, rhs);
    }

    static double maFromResiduals(double[] ar, double[] series) {
        double[] residuals = ArmaModel.residuals(ar, 0.0, SeriesStatistics.centered(series));
        if (residuals.length < 2) {
            return 0.0;
        }
        return invertMa(SeriesStatistics.autocorrelation(residuals, 1));
    }

    static double invertMa(double rho) {
        if (rho == 0.0 || !Double.isFinite(rho)) {
            return 0.0;
        }
        double theta = Math.abs(rho) < 0.5
                ? (1.0 - Math.sqrt(1.0 - 4.0 * rho * rho)) / (2.0 * rho)
                : Math.signum(rho);
        return Math.max(-MAX_MA, Math.min(MAX_MA, theta));
    }

    @Override
    public ComputeTier getTier() {
        return tier;
    }

    int getOrder() {
        return order;
    }
}
