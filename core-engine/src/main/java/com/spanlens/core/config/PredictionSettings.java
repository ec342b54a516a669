package com.spanlens.core.config;

import java.io.Serializable;
import java.util.List;

/**
 * Tunables of the adaptive prediction engine.
 *
 * <pre>
 * prediction:
 *   horizonMinutes: 60
 *   minimumEvents: 3
 *   defaultMaCoefficient: 0.2
 *   missingAnalyticsPenalty: 0.7
 *   cascadeBoostFactor: 0.15
 *   cascadeBoostCap: 0.95
 *   maxIterations: 20
 *   convergenceTolerance: 1.0e-6
 *   singularityThreshold: 1.0e-10
 * </pre>
 *
 * @since 1.0.0
 */
public class PredictionSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private long horizonMinutes = 60;
    private int minimumEvents = 3;
    private double defaultMaCoefficient = 0.2;
    private double missingAnalyticsPenalty = 0.7;
    private double cascadeBoostFactor = 0.15;
    private double cascadeBoostCap = 0.95;
    private int maxIterations = 20;
    private double convergenceTolerance = 1.0e-6;
    private double singularityThreshold = 1.0e-10;

    void collectErrors(List<String> errors) {
        if (horizonMinutes < 1) {
            errors.add("prediction.horizonMinutes must be >= 1, got: " + horizonMinutes);
        }
        if (minimumEvents < 3) {
            errors.add("prediction.minimumEvents must be >= 3, got: " + minimumEvents);
        }
        if (defaultMaCoefficient <= -1 || defaultMaCoefficient >= 1) {
            errors.add("prediction.defaultMaCoefficient must be in (-1, 1), got: " + defaultMaCoefficient);
        }
        if (missingAnalyticsPenalty < 0 || missingAnalyticsPenalty > 1) {
            errors.add("prediction.missingAnalyticsPenalty must be in [0, 1], got: " + missingAnalyticsPenalty);
        }
        if (cascadeBoostFactor < 0 || cascadeBoostFactor > 1) {
            errors.add("prediction.cascadeBoostFactor must be in [0, 1], got: " + cascadeBoostFactor);
        }
        if (cascadeBoostCap <= 0 || cascadeBoostCap > 1) {
            errors.add("prediction.cascadeBoostCap must be in (0, 1], got: " + cascadeBoostCap);
        }
        if (maxIterations < 1) {
            errors.add("prediction.maxIterations must be >= 1, got: " + maxIterations);
        }
        if (convergenceTolerance <= 0) {
            errors.add("prediction.convergenceTolerance must be > 0, got: " + convergenceTolerance);
        }
        if (singularityThreshold <= 0) {
            errors.add("prediction.singularityThreshold must be > 0, got: " + singularityThreshold);
        }
    }

    public long getHorizonMinutes() {
        return horizonMinutes;
    }

    public void setHorizonMinutes(long horizonMinutes) {
        this.horizonMinutes = horizonMinutes;
    }

    public int getMinimumEvents() {
        return minimumEvents;
    }

    public void setMinimumEvents(int minimumEvents) {
        this.minimumEvents = minimumEvents;
    }

    public double getDefaultMaCoefficient() {
        return defaultMaCoefficient;
    }

    public void setDefaultMaCoefficient(double defaultMaCoefficient) {
        this.defaultMaCoefficient = defaultMaCoefficient;
    }

    public double getMissingAnalyticsPenalty() {
        return missingAnalyticsPenalty;
    }

    public void setMissingAnalyticsPenalty(double missingAnalyticsPenalty) {
        this.missingAnalyticsPenalty = missingAnalyticsPenalty;
    }

    public double getCascadeBoostFactor() {
        return cascadeBoostFactor;
    }

    public void setCascadeBoostFactor(double cascadeBoostFactor) {
        this.cascadeBoostFactor = cascadeBoostFactor;
    }

    public double getCascadeBoostCap() {
        return cascadeBoostCap;
    }

    public void setCascadeBoostCap(double cascadeBoostCap) {
        this.cascadeBoostCap = cascadeBoostCap;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public void setMaxIterations(int maxIterations) {
        this.maxIterations = maxIterations;
    }

    public double getConvergenceTolerance() {
        return convergenceTolerance;
    }

    public void setConvergenceTolerance(double convergenceTolerance) {
        this.convergenceTolerance = convergenceTolerance;
    }

    public double getSingularityThreshold() {
        return singularityThreshold;
    }

    public void setSingularityThreshold(double singularityThreshold) {
        this.singularityThreshold = singularityThreshold;
    }

    @Override
    public String toString() {
        return "PredictionSettings{" +
                "horizonMinutes=" + horizonMinutes +
                ", minimumEvents=" + minimumEvents +
                ", cascadeBoostFactor=" + cascadeBoostFactor +
                ", maxIterations=" + maxIterations +
                '}';
    }
}
