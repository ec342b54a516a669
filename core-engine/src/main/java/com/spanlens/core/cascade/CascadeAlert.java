package com.spanlens.core.cascade;

import com.spanlens.core.model.CascadeRecord;
import com.spanlens.core.model.SpanEvent;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * A target opening projected from a trigger that has just opened.
 *
 * @since 1.0.0
 */
public final class CascadeAlert implements Serializable {

    private static final long serialVersionUID = 1L;

    private final SpanEvent triggerEvent;
    private final CascadeRecord pattern;
    private final Instant expectedTime;

    CascadeAlert(SpanEvent triggerEvent, CascadeRecord pattern, Instant expectedTime) {
        this.triggerEvent = Objects.requireNonNull(triggerEvent, "triggerEvent must not be null");
        this.pattern = Objects.requireNonNull(pattern, "pattern must not be null");
        this.expectedTime = Objects.requireNonNull(expectedTime, "expectedTime must not be null");
    }

    public SpanEvent getTriggerEvent() {
        return triggerEvent;
    }

    /**
     * @return the historical cascade the projection is based on
     */
    public CascadeRecord getPattern() {
        return pattern;
    }

    public String getTargetEntityId() {
        return pattern.getTargetEntityId();
    }

    public Instant getExpectedTime() {
        return expectedTime;
    }

    public String getMessage() {
        return pattern.getTargetLabel() + " may open around " + expectedTime
                + " following " + triggerEvent.getEntityLabel();
    }

    @Override
    public String toString() {
        return "CascadeAlert{" + triggerEvent.getEntityId() + " -> " + getTargetEntityId()
                + " @ " + expectedTime + '}';
    }
}
