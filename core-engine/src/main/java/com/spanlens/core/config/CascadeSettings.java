package com.spanlens.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Tunables of the cascade engine.
 *
 * <pre>
 * cascade:
 *   windowMinMinutes: 30
 *   windowMaxMinutes: 90
 *   maxDistanceKm: 5.0
 *   temporalWeight: 0.25
 *   spatialWeight: 0.25
 *   durationWeight: 0.25
 *   historicalWeight: 0.25
 *   immediateThresholdMinutes: 35
 *   cutPointQuantiles: [0.25, 0.5, 0.75]
 *   alertLookaheadMinutes: 15
 * </pre>
 *
 * <p>
 * The four weights must be non-negative and sum to 1 so that a strength
 * stays inside {@code [0, 1]}.
 * </p>
 *
 * @since 1.0.0
 */
public class CascadeSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final double WEIGHT_TOLERANCE = 1e-6;

    private double windowMinMinutes = 30;
    private double windowMaxMinutes = 90;
    private double maxDistanceKm = 5.0;

    private double temporalWeight = 0.25;
    private double spatialWeight = 0.25;
    private double durationWeight = 0.25;
    private double historicalWeight = 0.25;

    /** Delays strictly below this are tagged IMMEDIATE. */
    private double immediateThresholdMinutes = 35;

    /** Lower, median and upper cut-point quantiles for strength buckets. */
    private List<Double> cutPointQuantiles = new ArrayList<>(List.of(0.25, 0.5, 0.75));

    private double alertLookaheadMinutes = 15;

    void collectErrors(List<String> errors) {
        if (windowMinMinutes < 0) {
            errors.add("cascade.windowMinMinutes must be >= 0, got: " + windowMinMinutes);
        }
        if (windowMaxMinutes <= 0 || windowMaxMinutes < windowMinMinutes) {
            errors.add("cascade.windowMaxMinutes must be > 0 and >= windowMinMinutes, got: "
                    + windowMaxMinutes);
        }
        if (maxDistanceKm <= 0) {
            errors.add("cascade.maxDistanceKm must be > 0, got: " + maxDistanceKm);
        }
        if (temporalWeight < 0 || spatialWeight < 0 || durationWeight < 0 || historicalWeight < 0) {
            errors.add("cascade weights must be >= 0");
        }
        double sum = temporalWeight + spatialWeight + durationWeight + historicalWeight;
        if (Math.abs(sum - 1.0) > WEIGHT_TOLERANCE) {
            errors.add("cascade weights must sum to 1.0, got: " + sum);
        }
        if (cutPointQuantiles == null || cutPointQuantiles.size() != 3) {
            errors.add("cascade.cutPointQuantiles must hold exactly 3 values");
        } else {
            double previous = 0.0;
            for (Double q : cutPointQuantiles) {
                if (q == null || q < previous || q > 1.0) {
                    errors.add("cascade.cutPointQuantiles must be ascending values in [0, 1], got: "
                            + cutPointQuantiles);
                    break;
                }
                previous = q;
            }
        }
        if (alertLookaheadMinutes <= 0) {
            errors.add("cascade.alertLookaheadMinutes must be > 0, got: " + alertLookaheadMinutes);
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for SnakeYAML)
    // ---------------------------------------------------------------

    public double getWindowMinMinutes() {
        return windowMinMinutes;
    }

    public void setWindowMinMinutes(double windowMinMinutes) {
        this.windowMinMinutes = windowMinMinutes;
    }

    public double getWindowMaxMinutes() {
        return windowMaxMinutes;
    }

    public void setWindowMaxMinutes(double windowMaxMinutes) {
        this.windowMaxMinutes = windowMaxMinutes;
    }

    public double getMaxDistanceKm() {
        return maxDistanceKm;
    }

    public void setMaxDistanceKm(double maxDistanceKm) {
        this.maxDistanceKm = maxDistanceKm;
    }

    public double getTemporalWeight() {
        return temporalWeight;
    }

    public void setTemporalWeight(double temporalWeight) {
        this.temporalWeight = temporalWeight;
    }

    public double getSpatialWeight() {
        return spatialWeight;
    }

    public void setSpatialWeight(double spatialWeight) {
        this.spatialWeight = spatialWeight;
    }

    public double getDurationWeight() {
        return durationWeight;
    }

    public void setDurationWeight(double durationWeight) {
        this.durationWeight = durationWeight;
    }

    public double getHistoricalWeight() {
        return historicalWeight;
    }

    public void setHistoricalWeight(double historicalWeight) {
        this.historicalWeight = historicalWeight;
    }

    public double getImmediateThresholdMinutes() {
        return immediateThresholdMinutes;
    }

    public void setImmediateThresholdMinutes(double immediateThresholdMinutes) {
        this.immediateThresholdMinutes = immediateThresholdMinutes;
    }

    public List<Double> getCutPointQuantiles() {
        return cutPointQuantiles;
    }

    public void setCutPointQuantiles(List<Double> cutPointQuantiles) {
        this.cutPointQuantiles = cutPointQuantiles != null ? new ArrayList<>(cutPointQuantiles) : null;
    }

    public double getAlertLookaheadMinutes() {
        return alertLookaheadMinutes;
    }

    public void setAlertLookaheadMinutes(double alertLookaheadMinutes) {
        this.alertLookaheadMinutes = alertLookaheadMinutes;
    }

    @Override
    public String toString() {
        return "CascadeSettings{" +
                "window=[" + windowMinMinutes + ", " + windowMaxMinutes + "]" +
                ", maxDistanceKm=" + maxDistanceKm +
                ", weights=[" + temporalWeight + ", " + spatialWeight + ", "
                + durationWeight + ", " + historicalWeight + "]" +
                ", immediateThresholdMinutes=" + immediateThresholdMinutes +
                ", cutPointQuantiles=" + cutPointQuantiles +
                '}';
    }
}
