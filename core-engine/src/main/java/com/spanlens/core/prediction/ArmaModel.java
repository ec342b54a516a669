package com.spanlens.core.prediction;

import com.spanlens.core.model.ComputeTier;

import java.util.Arrays;
import java.util.Objects;

/**
 * A fitted ARMA(p, 1) model over a mean-centred series.
 *
 * <p>
 * Residuals are conditional: the first {@code p} observations seed the
 * recursion and the residual before the first fitted point is taken as zero,
 * so {@code e[t] = y[t] - sum(phi[i] * y[t-1-i]) - theta * e[t-1]}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ArmaModel {

    private final double[] ar;
    private final double ma;
    private final double mean;
    private final ComputeTier tier;
    private final double rmse;
    private final double seriesStddev;

    ArmaModel(double[] ar, double ma, double[] series, ComputeTier tier) {
        this.ar = ar.clone();
        this.ma = ma;
        this.tier = Objects.requireNonNull(tier, "tier must not be null");
        this.mean = SeriesStatistics.mean(series);
        this.seriesStddev = SeriesStatistics.stddev(series);
        this.rmse = SeriesStatistics.rms(residuals(ar, ma, SeriesStatistics.centered(series)));
    }

    /**
     * Model that always predicts the series mean; used when the series is too
     * short to estimate any coefficient.
     */
    static ArmaModel meanOnly(double[] series) {
        return new ArmaModel(new double[0], 0.0, series, ComputeTier.MINIMAL);
    }

    /**
     * Conditional residuals of a centred series.
     */
    static double[] residuals(double[] ar, double ma, double[] y) {
        int p = ar.length;
        int n = y.length;
        if (n <= p) {
            return new double[0];
        }
        double[] e = new double[n - p];
        double previous = 0.0;
        for (int t = p; t < n; t++) {
            double fitted = ma * previous;
            for (int i = 0; i < p; i++) {
                fitted += ar[i] * y[t - 1 - i];
            }
            double residual = y[t] - fitted;
            e[t - p] = residual;
            previous = residual;
        }
        return e;
    }

    static double rss(double[] ar, double ma, double[] y) {
        double sum = 0;
        for (double r : residuals(ar, ma, y)) {
            sum += r * r;
        }
        return sum;
    }

    /**
     * One-step-ahead forecast following the last observation of
     * {@code series}.
     *
     * @param series the series the model was fitted on
     * @return forecast value in the series' own units
     */
    public double forecastNext(double[] series) {
        double[] y = SeriesStatistics.centered(series);
        int n = y.length;
        double next = 0.0;
        for (int i = 0; i < ar.length && n - 1 - i >= 0; i++) {
            next += ar[i] * y[n - 1 - i];
        }
        double[] e = residuals(ar, ma, y);
        if (e.length > 0) {
            next += ma * e[e.length - 1];
        }
        return mean + next;
    }

    /**
     * @return {@code clamp(1 - rmse / stddev)}, or {@code 1} for a constant
     *         series
     */
    public double fitQuality() {
        if (!(seriesStddev > 0)) {
            return 1.0;
        }
        return Math.max(0.0, Math.min(1.0, 1.0 - rmse / seriesStddev));
    }

    boolean isFinite() {
        return SeriesStatistics.allFinite(ar) && Double.isFinite(ma) && Double.isFinite(rmse);
    }

    public double[] getArCoefficients() {
        return ar.clone();
    }

    public double getMaCoefficient() {
        return ma;
    }

    public int getOrder() {
        return ar.length;
    }

    public ComputeTier getTier() {
        return tier;
    }

    public double getRmse() {
        return rmse;
    }

    /**
     * @return e.g. {@code AR(2)+MA(1)}
     */
    public String describe() {
        if (ar.length == 0) {
            return "mean";
        }
        return "AR(" + ar.length + ")+MA(1)";
    }

    @Override
    public String toString() {
        return "ArmaModel{" + describe() +
                ", ar=" + Arrays.toString(ar) +
                ", ma=" + ma +
                ", tier=" + tier +
                ", rmse=" + rmse +
                '}';
    }
}
