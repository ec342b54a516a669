package com.spanlens.core.stats;

import com.spanlens.core.model.CascadeStrength;

import java.io.Serializable;

/**
 * Three ascending cut points splitting a sample into four bands.
 *
 * @since 1.0.0
 */
public final class QuantileCutPoints implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double lower;
    private final double median;
    private final double upper;

    public QuantileCutPoints(double lower, double median, double upper) {
        if (lower > median || median > upper) {
            throw new IllegalArgumentException(
                    "Cut points must be ascending, got: " + lower + ", " + median + ", " + upper);
        }
        this.lower = lower;
        this.median = median;
        this.upper = upper;
    }

    /**
     * Band index of a value: 0 below {@code lower}, 1 below {@code median},
     * 2 below {@code upper}, 3 otherwise.
     *
     * @param value value to place
     * @return band index in {@code [0, 3]}
     */
    public int band(double value) {
        if (value < lower) {
            return 0;
        }
        if (value < median) {
            return 1;
        }
        return value < upper ? 2 : 3;
    }

    /**
     * Three-way strength bucket: {@code WEAK} below {@code lower},
     * {@code MODERATE} below {@code upper}, {@code STRONG} otherwise.
     *
     * @param value value to classify
     * @return the strength bucket
     */
    public CascadeStrength classify(double value) {
        if (value < lower) {
            return CascadeStrength.WEAK;
        }
        return value < upper ? CascadeStrength.MODERATE : CascadeStrength.STRONG;
    }

    public double getLower() {
        return lower;
    }

    public double getMedian() {
        return median;
    }

    public double getUpper() {
        return upper;
    }

    @Override
    public String toString() {
        return "QuantileCutPoints{" + lower + " / " + median + " / " + upper + '}';
    }
}
