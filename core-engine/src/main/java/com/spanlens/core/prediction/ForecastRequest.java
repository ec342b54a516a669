package com.spanlens.core.prediction;

import com.spanlens.core.model.AnalyticsRecord;
import com.spanlens.core.model.CascadeRecord;
import com.spanlens.core.model.ComputeTier;
import com.spanlens.core.model.SpanEvent;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Inputs of one {@link PredictionEngine#forecast(ForecastRequest)} call.
 *
 * <p>
 * {@code entityId}, {@code events} and {@code now} are required. Analytics
 * and cascades default to empty, the tier to {@link ComputeTier#STANDARD} and
 * the horizon to the engine's configured default.
 * </p>
 *
 * @since 1.0.0
 */
public final class ForecastRequest {

    private final String entityId;
    private final List<SpanEvent> events;
    private final List<AnalyticsRecord> analytics;
    private final List<CascadeRecord> cascades;
    private final ComputeTier tier;
    private final Long horizonMinutes;
    private final Instant now;

    private ForecastRequest(Builder b) {
        this.entityId = Objects.requireNonNull(b.entityId, "entityId must not be null");
        this.events = Objects.requireNonNull(b.events, "events must not be null");
        this.now = Objects.requireNonNull(b.now, "now must not be null");
        this.analytics = b.analytics != null ? b.analytics : Collections.emptyList();
        this.cascades = b.cascades != null ? b.cascades : Collections.emptyList();
        this.tier = b.tier != null ? b.tier : ComputeTier.STANDARD;
        if (b.horizonMinutes != null && b.horizonMinutes <= 0) {
            throw new IllegalArgumentException("horizonMinutes must be > 0, got: " + b.horizonMinutes);
        }
        this.horizonMinutes = b.horizonMinutes;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link ForecastRequest}.
     */
    public static class Builder {
        private String entityId;
        private List<SpanEvent> events;
        private List<AnalyticsRecord> analytics;
        private List<CascadeRecord> cascades;
        private ComputeTier tier;
        private Long horizonMinutes;
        private Instant now;

        public Builder entityId(String v) {
            this.entityId = v;
            return this;
        }

        public Builder events(List<SpanEvent> v) {
            this.events = v;
            return this;
        }

        public Builder analytics(List<AnalyticsRecord> v) {
            this.analytics = v;
            return this;
        }

        public Builder cascades(List<CascadeRecord> v) {
            this.cascades = v;
            return this;
        }

        /** A {@code null} tier is treated as {@code STANDARD}. */
        public Builder tier(ComputeTier v) {
            this.tier = v;
            return this;
        }

        public Builder horizonMinutes(long v) {
            this.horizonMinutes = v;
            return this;
        }

        public Builder now(Instant v) {
            this.now = v;
            return this;
        }

        public ForecastRequest build() {
            return new ForecastRequest(this);
        }
    }

    public String getEntityId() {
        return entityId;
    }

    public List<SpanEvent> getEvents() {
        return events;
    }

    public List<AnalyticsRecord> getAnalytics() {
        return analytics;
    }

    public List<CascadeRecord> getCascades() {
        return cascades;
    }

    public ComputeTier getTier() {
        return tier;
    }

    /**
     * @return the requested horizon, or {@code null} for the engine default
     */
    public Long getHorizonMinutes() {
        return horizonMinutes;
    }

    public Instant getNow() {
        return now;
    }
}
