package com.spanlens.core.prediction;

import com.spanlens.core.CancellationToken;
import com.spanlens.core.model.ComputeTier;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.fitting.leastsquares.EvaluationRmsChecker;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.optim.ConvergenceChecker;
import org.apache.commons.math3.util.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * {@link ComputeTier#EXPERT} estimator: AR(p)+MA(1) refined by
 * Levenberg-Marquardt on the conditional residual sum of squares.
 *
 * <h3>Iteration</h3>
 * <p>
 * The problem is handed to the commons-math {@link LevenbergMarquardtOptimizer}
 * starting from the Yule-Walker solution, with the conditional residuals as
 * the model value, a zero target and a forward-difference Jacobian. The MA
 * coefficient is kept in {@code [-0.9, 0.9]} by a parameter validator. The
 * loop stops after {@code maxIterations} or once the residual RMS changes by
 * less than {@code tolerance} relative to the previous evaluation.
 * </p>
 *
 * <p>
 * When cancellation is requested, or the optimizer gives up, the best
 * evaluation seen so far is kept. The refined model replaces the
 * Yule-Walker start only when its error is no larger.
 * </p>
 */
final class LevenbergMarquardtEstimator implements ModelEstimator {

    private static final Logger LOG = LoggerFactory.getLogger(LevenbergMarquardtEstimator.class);

    static final double FINITE_DIFFERENCE_STEP = 1e-6;

    /** Evaluation cap; the optimizer evaluates more often than it iterates. */
    private static final int EVALUATIONS_PER_ITERATION = 50;

    private final YuleWalkerEstimator start;
    private final int maxIterations;
    private final double tolerance;

    LevenbergMarquardtEstimator(int order, LinearSolver solver, int maxIterations, double tolerance) {
        this.start = new YuleWalkerEstimator(order, ComputeTier.EXPERT, solver);
        this.maxIterations = maxIterations;
        this.tolerance = tolerance;
    }

    @Override
    public Optional<ArmaModel> fit(double[] series, CancellationToken cancellation) {
        Optional<ArmaModel> initial = start.fit(series, cancellation);
        if (initial.isEmpty()) {
            return Optional.empty();
        }
        double[] y = SeriesStatistics.centered(series);
        int p = initial.get().getOrder();

        double[] params = new double[p + 1];
        System.arraycopy(initial.get().getArCoefficients(), 0, params, 0, p);
        params[p] = initial.get().getMaCoefficient();

        BestSoFar checker = new BestSoFar(maxIterations, tolerance, cancellation);
        LeastSquaresProblem problem = new LeastSquaresBuilder()
                .start(params)
                .model(residualModel(y, p))
                .target(new double[residuals(params, y, p).length])
                .parameterValidator(point -> clampMa(point, p))
                .checker(checker)
                .maxIterations(maxIterations + 1)
                .maxEvaluations((maxIterations + 1) * EVALUATIONS_PER_ITERATION)
                .lazyEvaluation(false)
                .build();

        double[] refined;
        try {
            LeastSquaresOptimizer.Optimum optimum = new LevenbergMarquardtOptimizer().optimize(problem);
            refined = optimum.getPoint().toArray();
            LOG.debug("Levenberg-Marquardt finished after {} iteration(s), rms={}",
                    optimum.getIterations(), optimum.getRMS());
        } catch (MathIllegalStateException | MathIllegalArgumentException e) {
            LOG.debug("Levenberg-Marquardt stopped early ({}); keeping the best point so far", e.getMessage());
            refined = checker.best != null ? checker.best : params;
        }

        ArmaModel model = toModel(refined, series, p);
        if (!model.isFinite() || model.getRmse() > initial.get().getRmse()) {
            model = toModel(params, series, p);
        }
        return model.isFinite() ? Optional.of(model) : Optional.empty();
    }

    @Override
    public ComputeTier getTier() {
        return ComputeTier.EXPERT;
    }

    // ---------------------------------------------------------------
    // Least-squares helpers
    // ---------------------------------------------------------------

    private static ArmaModel toModel(double[] params, double[] series, int p) {
        double[] ar = new double[p];
        System.arraycopy(params, 0, ar, 0, p);
        return new ArmaModel(ar, params[p], series, ComputeTier.EXPERT);
    }

    private static double[] residuals(double[] params, double[] y, int p) {
        double[] ar = new double[p];
        System.arraycopy(params, 0, ar, 0, p);
        return ArmaModel.residuals(ar, params[p], y);
    }

    /** Conditional residuals and their forward-difference Jacobian. */
    private static MultivariateJacobianFunction residualModel(double[] y, int p) {
        return point -> {
            double[] params = point.toArray();
            double[] base = residuals(params, y, p);
            RealMatrix jacobian = new Array2DRowRealMatrix(base.length, params.length);
            for (int k = 0; k < params.length; k++) {
                double[] shifted = params.clone();
                shifted[k] += FINITE_DIFFERENCE_STEP;
                double[] r = residuals(shifted, y, p);
                for (int t = 0; t < base.length; t++) {
                    jacobian.setEntry(t, k, (r[t] - base[t]) / FINITE_DIFFERENCE_STEP);
                }
            }
            return new Pair<>(new ArrayRealVector(base, false), jacobian);
        };
    }

    private static RealVector clampMa(RealVector point, int p) {
        RealVector clamped = point.copy();
        double theta = clamped.getEntry(p);
        clamped.setEntry(p, Math.max(-YuleWalkerEstimator.MAX_MA, Math.min(YuleWalkerEstimator.MAX_MA, theta)));
        return clamped;
    }

    /**
     * Relative RMS convergence that also stops at the iteration cap or on
     * cancellation, remembering the lowest-cost point it was shown.
     */
    private static final class BestSoFar implements ConvergenceChecker<LeastSquaresProblem.Evaluation> {

        private final int maxIterations;
        private final EvaluationRmsChecker rms;
        private final CancellationToken cancellation;
        private double bestCost = Double.POSITIVE_INFINITY;
        private double[] best;

        BestSoFar(int maxIterations, double tolerance, CancellationToken cancellation) {
            this.maxIterations = maxIterations;
            this.rms = new EvaluationRmsChecker(tolerance, 0.0);
            this.cancellation = cancellation;
        }

        @Override
        public boolean converged(int iteration, LeastSquaresProblem.Evaluation previous,
                LeastSquaresProblem.Evaluation current) {
            if (Double.isFinite(current.getCost()) && current.getCost() < bestCost) {
                bestCost = current.getCost();
                best = current.getPoint().toArray();
            }
            if (cancellation.isCancelled()) {
                LOG.debug("Levenberg-Marquardt cancelled after {} iteration(s)", iteration);
                return true;
            }
            return iteration >= maxIterations || rms.converged(iteration, previous, current);
        }
    }
}
