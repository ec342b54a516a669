package com.spanlens.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * One directed trigger &rarr; target cascade instance.
 *
 * <p>
 * {@code delayMinutes} is always derived from the two open times; the builder
 * rejects records whose trigger and target are the same entity or whose
 * target does not open strictly after the trigger.
 * </p>
 *
 * <p>
 * Besides the combined {@code strength}, the record keeps the four factor
 * scores it was built from so consumers can explain a relationship.
 * </p>
 *
 * @since 1.0.0
 */
public final class CascadeRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String triggerEntityId;
    private final String triggerLabel;
    private final Instant triggerTime;
    private final Double triggerDuration;

    private final String targetEntityId;
    private final String targetLabel;
    private final Instant targetTime;
    private final Double targetDuration;

    private final double delayMinutes;
    private final double distanceKm;
    private final double strength;
    private final CascadeStrength strengthClass;
    private final CascadeTiming timing;

    private final double temporalFactor;
    private final double spatialFactor;
    private final double durationFactor;
    private final double historicalFactor;

    private CascadeRecord(Builder b) {
        this.triggerEntityId = Objects.requireNonNull(b.triggerEntityId, "triggerEntityId must not be null");
        this.targetEntityId = Objects.requireNonNull(b.targetEntityId, "targetEntityId must not be null");
        this.triggerTime = Objects.requireNonNull(b.triggerTime, "triggerTime must not be null");
        this.targetTime = Objects.requireNonNull(b.targetTime, "targetTime must not be null");
        this.strengthClass = Objects.requireNonNull(b.strengthClass, "strengthClass must not be null");
        this.timing = Objects.requireNonNull(b.timing, "timing must not be null");

        if (triggerEntityId.equals(targetEntityId)) {
            throw new IllegalArgumentException("Cascade trigger and target must differ: " + triggerEntityId);
        }
        if (!triggerTime.isBefore(targetTime)) {
            throw new IllegalArgumentException(
                    "Cascade target must open after trigger: " + triggerTime + " >= " + targetTime);
        }
        if (!(b.strength >= 0.0 && b.strength <= 1.0)) {
            throw new IllegalArgumentException("strength must be in [0, 1], got: " + b.strength);
        }

        this.triggerLabel = b.triggerLabel != null ? b.triggerLabel : triggerEntityId;
        this.targetLabel = b.targetLabel != null ? b.targetLabel : targetEntityId;
        this.triggerDuration = b.triggerDuration;
        this.targetDuration = b.targetDuration;
        this.delayMinutes = Duration.between(triggerTime, targetTime).toMillis() / 60_000.0;
        this.distanceKm = b.distanceKm;
        this.strength = b.strength;
        this.temporalFactor = b.temporalFactor;
        this.spatialFactor = b.spatialFactor;
        this.durationFactor = b.durationFactor;
        this.historicalFactor = b.historicalFactor;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link CascadeRecord}.
     */
    public static class Builder {
        private String triggerEntityId;
        private String triggerLabel;
        private Instant triggerTime;
        private Double triggerDuration;
        private String targetEntityId;
        private String targetLabel;
        private Instant targetTime;
        private Double targetDuration;
        private double distanceKm;
        private double strength;
        private CascadeStrength strengthClass;
        private CascadeTiming timing;
        private double temporalFactor;
        private double spatialFactor;
        private double durationFactor;
        private double historicalFactor;

        /**
         * Copy the trigger side from an event.
         */
        public Builder trigger(SpanEvent event) {
            this.triggerEntityId = event.getEntityId();
            this.triggerLabel = event.getEntityLabel();
            this.triggerTime = event.getOpenTime();
            this.triggerDuration = event.getDurationMinutes();
            return this;
        }

        /**
         * Copy the target side from an event.
         */
        public Builder target(SpanEvent event) {
            this.targetEntityId = event.getEntityId();
            this.targetLabel = event.getEntityLabel();
            this.targetTime = event.getOpenTime();
            this.targetDuration = event.getDurationMinutes();
            return this;
        }

        public Builder triggerEntityId(String v) {
            this.triggerEntityId = v;
            return this;
        }

        public Builder triggerTime(Instant v) {
            this.triggerTime = v;
            return this;
        }

        public Builder triggerDuration(Double v) {
            this.triggerDuration = v;
            return this;
        }

        public Builder targetEntityId(String v) {
            this.targetEntityId = v;
            return this;
        }

        public Builder targetTime(Instant v) {
            this.targetTime = v;
            return this;
        }

        public Builder targetDuration(Double v) {
            this.targetDuration = v;
            return this;
        }

        public Builder labels(String trigger, String target) {
            this.triggerLabel = trigger;
            this.targetLabel = target;
            return this;
        }

        public Builder distanceKm(double v) {
            this.distanceKm = v;
            return this;
        }

        public Builder strength(double v) {
            this.strength = v;
            return this;
        }

        public Builder strengthClass(CascadeStrength v) {
            this.strengthClass = v;
            return this;
        }

        public Builder timing(CascadeTiming v) {
            this.timing = v;
            return this;
        }

        public Builder factors(double temporal, double spatial, double duration, double historical) {
            this.temporalFactor = temporal;
            this.spatialFactor = spatial;
            this.durationFactor = duration;
            this.historicalFactor = historical;
            return this;
        }

        /**
         * @return a validated {@link CascadeRecord}
         * @throws NullPointerException     if a required field is missing
         * @throws IllegalArgumentException if trigger equals target, the target
         *                                  does not open after the trigger, or
         *                                  strength is outside {@code [0, 1]}
         */
        public CascadeRecord build() {
            return new CascadeRecord(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getTriggerEntityId() {
        return triggerEntityId;
    }

    public String getTriggerLabel() {
        return triggerLabel;
    }

    public Instant getTriggerTime() {
        return triggerTime;
    }

    public Double getTriggerDuration() {
        return triggerDuration;
    }

    public String getTargetEntityId() {
        return targetEntityId;
    }

    public String getTargetLabel() {
        return targetLabel;
    }

    public Instant getTargetTime() {
        return targetTime;
    }

    public Double getTargetDuration() {
        return targetDuration;
    }

    public double getDelayMinutes() {
        return delayMinutes;
    }

    public double getDistanceKm() {
        return distanceKm;
    }

    public double getStrength() {
        return strength;
    }

    public CascadeStrength getStrengthClass() {
        return strengthClass;
    }

    public CascadeTiming getTiming() {
        return timing;
    }

    public double getTemporalFactor() {
        return temporalFactor;
    }

    public double getSpatialFactor() {
        return spatialFactor;
    }

    public double getDurationFactor() {
        return durationFactor;
    }

    public double getHistoricalFactor() {
        return historicalFactor;
    }

    /**
     * Copy this record with a new strength bucket.
     *
     * @param newClass the bucket to assign
     * @return a new record
     */
    public CascadeRecord withStrengthClass(CascadeStrength newClass) {
        return builder()
                .triggerEntityId(triggerEntityId)
                .triggerTime(triggerTime)
                .triggerDuration(triggerDuration)
                .targetEntityId(targetEntityId)
                .targetTime(targetTime)
                .targetDuration(targetDuration)
                .labels(triggerLabel, targetLabel)
                .distanceKm(distanceKm)
                .strength(strength)
                .strengthClass(newClass)
                .timing(timing)
                .factors(temporalFactor, spatialFactor, durationFactor, historicalFactor)
                .build();
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CascadeRecord that))
            return false;
        return triggerEntityId.equals(that.triggerEntityId)
                && targetEntityId.equals(that.targetEntityId)
                && triggerTime.equals(that.triggerTime)
                && targetTime.equals(that.targetTime);
    }

    @Override
    public int hashCode() {
        return Objects.hash(triggerEntityId, targetEntityId, triggerTime, targetTime);
    }

    @Override
    public String toString() {
        return "CascadeRecord{" +
                triggerEntityId + " -> " + targetEntityId +
                ", delayMinutes=" + delayMinutes +
                ", strength=" + String.format("%.3f", strength) +
                ", class=" + strengthClass +
                ", timing=" + timing +
                '}';
    }
}
