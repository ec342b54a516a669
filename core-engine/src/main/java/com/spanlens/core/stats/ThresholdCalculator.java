package com.spanlens.core.stats;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Quantile-based breakpoints over a numeric sample.
 *
 * <p>
 * For every requested quantile {@code q} the calculator returns
 * {@code sorted[floor((n - 1) * q)]}, the lower nearest-rank order statistic.
 * Because the sample is fully sorted first, the result depends only on the
 * multiset of values and never on their input order.
 * </p>
 *
 * <h3>Edge cases</h3>
 * <ul>
 * <li>Empty sample: {@code 0.0} for every quantile.</li>
 * <li>{@code null}, {@code NaN} and infinite samples are ignored.</li>
 * <li>Quantiles outside {@code [0, 1]} are clamped.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class ThresholdCalculator {

    /** Lower quartile, median and upper quartile. */
    public static final List<Double> STANDARD_QUANTILES = List.of(0.25, 0.50, 0.75);

    private ThresholdCalculator() {
        // utility class, not instantiable
    }

    /**
     * Compute one threshold per requested quantile.
     *
     * @param samples   sample values; must not be {@code null}
     * @param quantiles requested quantiles; must not be {@code null}
     * @return thresholds, positionally matching {@code quantiles}
     */
    public static List<Double> quantileThresholds(Collection<Double> samples, List<Double> quantiles) {
        Objects.requireNonNull(samples, "samples must not be null");
        Objects.requireNonNull(quantiles, "quantiles must not be null");

        double[] sorted = samples.stream()
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .filter(Double::isFinite)
                .sorted()
                .toArray();

        List<Double> thresholds = new ArrayList<>(quantiles.size());
        for (Double q : quantiles) {
            thresholds.add(select(sorted, q == null ? 0.0 : q));
        }
        return thresholds;
    }

    /**
     * Single-quantile convenience over an already materialised array.
     *
     * @param samples  sample values; not modified
     * @param quantile requested quantile
     * @return the threshold, or {@code 0.0} for an empty sample
     */
    public static double quantile(double[] samples, double quantile) {
        Objects.requireNonNull(samples, "samples must not be null");
        double[] sorted = java.util.Arrays.stream(samples).filter(Double::isFinite).sorted().toArray();
        return select(sorted, quantile);
    }

    /**
     * Compute the lower/median/upper cut points for a sample.
     *
     * @param samples   sample values; must not be {@code null}
     * @param quantiles exactly three ascending quantiles
     * @return the cut points
     * @throws IllegalArgumentException if {@code quantiles} does not hold three
     *                                  values
     */
    public static QuantileCutPoints cutPoints(Collection<Double> samples, List<Double> quantiles) {
        if (quantiles == null || quantiles.size() != 3) {
            throw new IllegalArgumentException("Exactly three quantiles are required, got: " + quantiles);
        }
        List<Double> t = quantileThresholds(samples, quantiles);
        return new QuantileCutPoints(t.get(0), t.get(1), t.get(2));
    }

    /**
     * Cut points at {@link #STANDARD_QUANTILES}.
     */
    public static QuantileCutPoints cutPoints(Collection<Double> samples) {
        return cutPoints(samples, STANDARD_QUANTILES);
    }

    private static double select(double[] sorted, double q) {
        if (sorted.length == 0) {
            return 0.0;
        }
        double clamped = Double.isNaN(q) ? 0.0 : Math.max(0.0, Math.min(1.0, q));
        int index = (int) Math.floor((sorted.length - 1) * clamped);
        return sorted[index];
    }
}
