package com.spanlens.core.cascade;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Cascade behaviour of one entity, summarised over a set of cascade records.
 *
 * <p>
 * {@code influence} is the mean strength of the cascades the entity
 * triggered; {@code susceptibility} the mean strength of those it received.
 * Both are {@code 0} when there are none.
 * </p>
 *
 * @since 1.0.0
 */
public final class CascadeProfile implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Influence or susceptibility above this is reported as high. */
    public static final double HIGH_THRESHOLD = 0.5;

    private final String entityId;
    private final double influence;
    private final double susceptibility;
    private final int triggeredCount;
    private final int receivedCount;
    private final String primaryTargetId;
    private final String primaryTargetLabel;
    private final int primaryTargetCount;
    private final String primaryTriggerId;
    private final String primaryTriggerLabel;
    private final int primaryTriggerCount;
    private final double averageDelayToPrimaryTarget;
    private final double immediateShare;

    CascadeProfile(String entityId, double influence, double susceptibility,
            int triggeredCount, int receivedCount,
            String primaryTargetId, String primaryTargetLabel, int primaryTargetCount,
            String primaryTriggerId, String primaryTriggerLabel, int primaryTriggerCount,
            double averageDelayToPrimaryTarget, double immediateShare) {
        this.entityId = Objects.requireNonNull(entityId, "entityId must not be null");
        this.influence = influence;
        this.susceptibility = susceptibility;
        this.triggeredCount = triggeredCount;
        this.receivedCount = receivedCount;
        this.primaryTargetId = primaryTargetId;
        this.primaryTargetLabel = primaryTargetLabel;
        this.primaryTargetCount = primaryTargetCount;
        this.primaryTriggerId = primaryTriggerId;
        this.primaryTriggerLabel = primaryTriggerLabel;
        this.primaryTriggerCount = primaryTriggerCount;
        this.averageDelayToPrimaryTarget = averageDelayToPrimaryTarget;
        this.immediateShare = immediateShare;
    }

    /**
     * Human-readable observations about this profile. Empty when the entity
     * took part in no cascade.
     *
     * @return insight sentences
     */
    public List<String> describe() {
        if (triggeredCount == 0 && receivedCount == 0) {
            return Collections.emptyList();
        }
        List<String> insights = new ArrayList<>();
        if (triggeredCount > 0) {
            if (influence > HIGH_THRESHOLD) {
                insights.add("High cascade influence - frequently triggers openings of nearby entities");
            }
            insights.add("Most frequently triggers " + primaryTargetLabel
                    + " (" + primaryTargetCount + " cascade events)");
        }
        if (receivedCount > 0) {
            if (susceptibility > HIGH_THRESHOLD) {
                insights.add("High cascade susceptibility - often opens in response to nearby entities");
            }
            insights.add("Most frequently triggered by " + primaryTriggerLabel
                    + " (" + primaryTriggerCount + " cascade events)");
        }
        if (triggeredCount > 0 && immediateShare > 0.5) {
            insights.add("Tends to trigger immediate cascade responses");
        }
        return insights;
    }

    public String getEntityId() {
        return entityId;
    }

    public double getInfluence() {
        return influence;
    }

    public double getSusceptibility() {
        return susceptibility;
    }

    public int getTriggeredCount() {
        return triggeredCount;
    }

    public int getReceivedCount() {
        return receivedCount;
    }

    /**
     * @return the entity this one triggers most often, or {@code null}
     */
    public String getPrimaryTargetId() {
        return primaryTargetId;
    }

    /**
     * @return the entity that triggers this one most often, or {@code null}
     */
    public String getPrimaryTriggerId() {
        return primaryTriggerId;
    }

    public double getAverageDelayToPrimaryTarget() {
        return averageDelayToPrimaryTarget;
    }

    /**
     * @return share of triggered cascades tagged {@code IMMEDIATE}
     */
    public double getImmediateShare() {
        return immediateShare;
    }

    @Override
    public String toString() {
        return "CascadeProfile{" +
                "entityId='" + entityId + '\'' +
                ", influence=" + String.format("%.3f", influence) +
                ", susceptibility=" + String.format("%.3f", susceptibility) +
                ", triggered=" + triggeredCount +
                ", received=" + receivedCount +
                '}';
    }
}
