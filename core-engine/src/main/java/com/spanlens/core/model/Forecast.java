package com.spanlens.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Short-horizon forecast for one entity.
 *
 * <p>
 * {@code modelTier} is the tier whose estimation method actually produced
 * the model. It can be lower than the requested tier when fitting fell back
 * to a simpler method.
 * </p>
 *
 * @since 1.0.0
 */
public final class Forecast implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String entityId;
    private final double probability;
    private final double expectedDurationMinutes;
    private final double confidence;
    private final ComputeTier modelTier;
    private final String rationale;
    private final long horizonMinutes;
    private final Instant generatedAt;
    private final String boostingEntityId;

    private Forecast(Builder b) {
        this.entityId = Objects.requireNonNull(b.entityId, "entityId must not be null");
        this.modelTier = Objects.requireNonNull(b.modelTier, "modelTier must not be null");
        this.rationale = Objects.requireNonNull(b.rationale, "rationale must not be null");
        this.generatedAt = Objects.requireNonNull(b.generatedAt, "generatedAt must not be null");
        if (!(b.probability >= 0.0 && b.probability <= 1.0)) {
            throw new IllegalArgumentException("probability must be in [0, 1], got: " + b.probability);
        }
        if (!(b.confidence >= 0.0 && b.confidence <= 1.0)) {
            throw new IllegalArgumentException("confidence must be in [0, 1], got: " + b.confidence);
        }
        if (!(b.expectedDurationMinutes >= 0.0)) {
            throw new IllegalArgumentException(
                    "expectedDurationMinutes must be >= 0, got: " + b.expectedDurationMinutes);
        }
        this.probability = b.probability;
        this.confidence = b.confidence;
        this.expectedDurationMinutes = b.expectedDurationMinutes;
        this.horizonMinutes = b.horizonMinutes;
        this.boostingEntityId = b.boostingEntityId;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Forecast}.
     */
    public static class Builder {
        private String entityId;
        private double probability;
        private double expectedDurationMinutes;
        private double confidence;
        private ComputeTier modelTier;
        private String rationale;
        private long horizonMinutes;
        private Instant generatedAt;
        private String boostingEntityId;

        public Builder entityId(String v) {
            this.entityId = v;
            return this;
        }

        public Builder probability(double v) {
            this.probability = v;
            return this;
        }

        public Builder expectedDurationMinutes(double v) {
            this.expectedDurationMinutes = v;
            return this;
        }

        public Builder confidence(double v) {
            this.confidence = v;
            return this;
        }

        public Builder modelTier(ComputeTier v) {
            this.modelTier = v;
            return this;
        }

        public Builder rationale(String v) {
            this.rationale = v;
            return this;
        }

        public Builder horizonMinutes(long v) {
            this.horizonMinutes = v;
            return this;
        }

        public Builder generatedAt(Instant v) {
            this.generatedAt = v;
            return this;
        }

        public Builder boostingEntityId(String v) {
            this.boostingEntityId = v;
            return this;
        }

        public Forecast build() {
            return new Forecast(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getEntityId() {
        return entityId;
    }

    public double getProbability() {
        return probability;
    }

    public double getExpectedDurationMinutes() {
        return expectedDurationMinutes;
    }

    public double getConfidence() {
        return confidence;
    }

    public ComputeTier getModelTier() {
        return modelTier;
    }

    public String getRationale() {
        return rationale;
    }

    public long getHorizonMinutes() {
        return horizonMinutes;
    }

    public Instant getGeneratedAt() {
        return generatedAt;
    }

    /**
     * @return the trigger entity whose recent cascade raised the probability,
     *         or {@code null}
     */
    public String getBoostingEntityId() {
        return boostingEntityId;
    }

    public boolean isCascadeBoosted() {
        return boostingEntityId != null;
    }

    // ---------------------------------------------------------------
    // Display levels
    // ---------------------------------------------------------------

    /** Coarse probability wording used by consumers of the forecast. */
    public enum ProbabilityLevel {
        VERY_LOW, LOW, MODERATE, HIGH, VERY_HIGH
    }

    /** Coarse confidence wording used by consumers of the forecast. */
    public enum ConfidenceLevel {
        LOW, MEDIUM, HIGH
    }

    @JsonIgnore
    public ProbabilityLevel getProbabilityLevel() {
        if (probability < 0.15) {
            return ProbabilityLevel.VERY_LOW;
        }
        if (probability < 0.35) {
            return ProbabilityLevel.LOW;
        }
        if (probability < 0.65) {
            return ProbabilityLevel.MODERATE;
        }
        return probability < 0.85 ? ProbabilityLevel.HIGH : ProbabilityLevel.VERY_HIGH;
    }

    @JsonIgnore
    public ConfidenceLevel getConfidenceLevel() {
        if (confidence < 0.6) {
            return ConfidenceLevel.LOW;
        }
        return confidence < 0.8 ? ConfidenceLevel.MEDIUM : ConfidenceLevel.HIGH;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Forecast that))
            return false;
        return Double.compare(probability, that.probability) == 0
                && Double.compare(expectedDurationMinutes, that.expectedDurationMinutes) == 0
                && Double.compare(confidence, that.confidence) == 0
                && entityId.equals(that.entityId)
                && modelTier == that.modelTier
                && generatedAt.equals(that.generatedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityId, probability, expectedDurationMinutes, confidence, modelTier, generatedAt);
    }

    @Override
    public String toString() {
        return "Forecast{" +
                "entityId='" + entityId + '\'' +
                ", probability=" + String.format("%.3f", probability) +
                ", expectedDurationMinutes=" + String.format("%.1f", expectedDurationMinutes) +
                ", confidence=" + String.format("%.3f", confidence) +
                ", modelTier=" + modelTier +
                '}';
    }
}
