package com.spanlens.core.prediction;

/**
 * Moments and autocorrelation of a univariate series.
 *
 * <p>
 * Autocovariances use the biased {@code 1/n} normalisation, which keeps the
 * Yule-Walker Toeplitz matrix positive semi-definite.
 * </p>
 */
final class SeriesStatistics {

    private SeriesStatistics() {
        // utility class, not instantiable
    }

    static double mean(double[] x) {
        if (x.length == 0) {
            return 0.0;
        }
        double sum = 0;
        for (double v : x) {
            sum += v;
        }
        return sum / x.length;
    }

    static double variance(double[] x) {
        return autocovariance(x, 0);
    }

    static double stddev(double[] x) {
        return Math.sqrt(variance(x));
    }

    static double autocovariance(double[] x, int lag) {
        int n = x.length;
        if (n == 0 || lag >= n) {
            return 0.0;
        }
        double m = mean(x);
        double sum = 0;
        for (int t = lag; t < n; t++) {
            sum += (x[t] - m) * (x[t - lag] - m);
        }
        return sum / n;
    }

    /**
     * @return lag autocorrelation, {@code 0} for a constant series
     */
    static double autocorrelation(double[] x, int lag) {
        double c0 = variance(x);
        if (!(c0 > 0)) {
            return 0.0;
        }
        return autocovariance(x, lag) / c0;
    }

    static double[] centered(double[] x) {
        double m = mean(x);
        double[] y = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            y[i] = x[i] - m;
        }
        return y;
    }

    static double rms(double[] x) {
        if (x.length == 0) {
            return 0.0;
        }
        double sum = 0;
        for (double v : x) {
            sum += v * v;
        }
        return Math.sqrt(sum / x.length);
    }

    static boolean allFinite(double[] x) {
        for (double v : x) {
            if (!Double.isFinite(v)) {
                return false;
            }
        }
        return true;
    }
}
