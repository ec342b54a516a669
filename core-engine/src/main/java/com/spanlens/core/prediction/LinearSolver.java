package com.spanlens.core.prediction;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * LU solve of the small dense systems the estimators produce.
 *
 * <p>
 * The system is first scaled by its 1-norm, so the singularity threshold
 * handed to {@link LUDecomposition} acts on pivots relative to the size of
 * the matrix rather than on their absolute value. A system counts as
 * singular when a scaled pivot falls below the threshold. Inputs are never
 * modified.
 * </p>
 */
final class LinearSolver {

    private static final Logger LOG = LoggerFactory.getLogger(LinearSolver.class);

    private final double singularityThreshold;

    LinearSolver(double singularityThreshold) {
        this.singularityThreshold = singularityThreshold;
    }

    /**
     * Solve {@code a * x = b}.
     *
     * @return the solution, or empty when the system is singular or the
     *         result is not finite
     */
    Optional<double[]> solve(double[][] a, double[] b) {
        int n = b.length;
        if (n == 0 || a.length != n) {
            return Optional.empty();
        }
        for (double[] row : a) {
            if (row.length != n) {
                return Optional.empty();
            }
        }

        RealMatrix matrix = new Array2DRowRealMatrix(a);
        double scale = matrix.getNorm();
        if (!(scale > 0.0) || !Double.isFinite(scale)) {
            return Optional.empty();
        }

        DecompositionSolver solver = new LUDecomposition(matrix.scalarMultiply(1.0 / scale), singularityThreshold)
                .getSolver();
        if (!solver.isNonSingular()) {
            return Optional.empty();
        }
        try {
            double[] x = solver.solve(new ArrayRealVector(b).mapDivide(scale)).toArray();
            return SeriesStatistics.allFinite(x) ? Optional.of(x) : Optional.empty();
        } catch (SingularMatrixException e) {
            LOG.debug("LU solve of a {}x{} system failed: {}", n, n, e.getMessage());
            return Optional.empty();
        }
    }
}
