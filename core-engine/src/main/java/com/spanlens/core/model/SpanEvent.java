package com.spanlens.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A single span: an entity opening at {@code openTime} and, once finished,
 * closing at {@code closeTime}.
 *
 * <p>
 * Instances are immutable and are never modified by the engines. Events are
 * produced by the external event source and may arrive in any order.
 * </p>
 *
 * <h3>Duration</h3>
 * <p>
 * {@code durationMinutes} is only defined once the event has closed. When the
 * source supplies a close time but no explicit duration, the duration is
 * derived from the two timestamps. A negative duration is kept as delivered
 * but flags the event as {@linkplain #isMalformed() malformed}; every engine
 * skips malformed events.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SpanEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String entityId;
    private final String entityLabel;
    private final Instant openTime;
    private final Instant closeTime;
    private final Double durationMinutes;
    private final double latitude;
    private final double longitude;

    @JsonCreator
    SpanEvent(@JsonProperty("entityId") String entityId,
            @JsonProperty("entityLabel") String entityLabel,
            @JsonProperty("openTime") Instant openTime,
            @JsonProperty("closeTime") Instant closeTime,
            @JsonProperty("durationMinutes") Double durationMinutes,
            @JsonProperty("latitude") double latitude,
            @JsonProperty("longitude") double longitude) {
        this.entityId = Objects.requireNonNull(entityId, "entityId must not be null");
        this.openTime = Objects.requireNonNull(openTime, "openTime must not be null");
        this.entityLabel = entityLabel != null ? entityLabel : entityId;
        this.closeTime = closeTime;
        this.durationMinutes = durationMinutes != null
                ? durationMinutes
                : derivedDuration(openTime, closeTime);
        this.latitude = latitude;
        this.longitude = longitude;
    }

    private static Double derivedDuration(Instant open, Instant close) {
        if (close == null) {
            return null;
        }
        return Duration.between(open, close).toMillis() / 60_000.0;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Create a new {@link Builder}.
     *
     * @return builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link SpanEvent}.
     *
     * <p>
     * {@code entityId} and {@code openTime} are <strong>required</strong>.
     * </p>
     */
    public static class Builder {
        private String entityId;
        private String entityLabel;
        private Instant openTime;
        private Instant closeTime;
        private Double durationMinutes;
        private double latitude;
        private double longitude;

        public Builder entityId(String entityId) {
            this.entityId = entityId;
            return this;
        }

        public Builder entityLabel(String entityLabel) {
            this.entityLabel = entityLabel;
            return this;
        }

        public Builder openTime(Instant openTime) {
            this.openTime = openTime;
            return this;
        }

        public Builder closeTime(Instant closeTime) {
            this.closeTime = closeTime;
            return this;
        }

        public Builder durationMinutes(Double durationMinutes) {
            this.durationMinutes = durationMinutes;
            return this;
        }

        public Builder location(double latitude, double longitude) {
            this.latitude = latitude;
            this.longitude = longitude;
            return this;
        }

        /**
         * Build the event.
         *
         * @return a new {@link SpanEvent}
         * @throws NullPointerException if {@code entityId} or {@code openTime}
         *                              is {@code null}
         */
        public SpanEvent build() {
            return new SpanEvent(entityId, entityLabel, openTime, closeTime,
                    durationMinutes, latitude, longitude);
        }
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public String getEntityId() {
        return entityId;
    }

    public String getEntityLabel() {
        return entityLabel;
    }

    public Instant getOpenTime() {
        return openTime;
    }

    /**
     * @return the close time, or {@code null} while the event is still open
     */
    public Instant getCloseTime() {
        return closeTime;
    }

    /**
     * @return the duration in minutes, or {@code null} while the event is
     *         still open
     */
    public Double getDurationMinutes() {
        return durationMinutes;
    }

    public double getLatitude() {
        return latitude;
    }

    public double getLongitude() {
        return longitude;
    }

    /**
     * @return {@code true} if a non-negative duration is known
     */
    @JsonIgnore
    public boolean hasKnownDuration() {
        return durationMinutes != null && durationMinutes >= 0 && !durationMinutes.isNaN();
    }

    /**
     * @return {@code true} while no close time has been reported
     */
    @JsonIgnore
    public boolean isOpen() {
        return closeTime == null && durationMinutes == null;
    }

    /**
     * An event is malformed when its reported duration is negative or not a
     * number, or when it closes before it opens.
     *
     * @return {@code true} if the engines must ignore this event
     */
    @JsonIgnore
    public boolean isMalformed() {
        if (durationMinutes != null && (durationMinutes < 0 || durationMinutes.isNaN())) {
            return true;
        }
        return closeTime != null && closeTime.isBefore(openTime);
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SpanEvent that))
            return false;
        return Objects.equals(entityId, that.entityId)
                && Objects.equals(openTime, that.openTime)
                && Objects.equals(closeTime, that.closeTime)
                && Objects.equals(durationMinutes, that.durationMinutes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityId, openTime, closeTime, durationMinutes);
    }

    @Override
    public String toString() {
        return "SpanEvent{" +
                "entityId='" + entityId + '\'' +
                ", openTime=" + openTime +
                ", closeTime=" + closeTime +
                ", durationMinutes=" + durationMinutes +
                '}';
    }
}
