package com.spanlens.core.config;

import java.io.Serializable;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.List;

/**
 * Tunables of the analytics aggregator.
 *
 * <pre>
 * analytics:
 *   zoneId: UTC
 *   minimumSampleSize: 10
 * </pre>
 *
 * @since 1.0.0
 */
public class AnalyticsSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Zone used to derive the calendar bucket of an open time. */
    private String zoneId = "UTC";

    /** Observations per bucket at which confidence saturates at 1.0. */
    private int minimumSampleSize = 10;

    void collectErrors(List<String> errors) {
        if (zoneId == null || zoneId.isBlank()) {
            errors.add("analytics.zoneId is required");
        } else {
            try {
                ZoneId.of(zoneId);
            } catch (DateTimeException e) {
                errors.add("analytics.zoneId is not a valid zone: '" + zoneId + "'");
            }
        }
        if (minimumSampleSize < 1) {
            errors.add("analytics.minimumSampleSize must be >= 1, got: " + minimumSampleSize);
        }
    }

    /**
     * @return the parsed zone
     * @throws DateTimeException if the configured zone is invalid
     */
    public ZoneId zone() {
        return ZoneId.of(zoneId);
    }

    public String getZoneId() {
        return zoneId;
    }

    public void setZoneId(String zoneId) {
        this.zoneId = zoneId;
    }

    public int getMinimumSampleSize() {
        return minimumSampleSize;
    }

    public void setMinimumSampleSize(int minimumSampleSize) {
        this.minimumSampleSize = minimumSampleSize;
    }

    @Override
    public String toString() {
        return "AnalyticsSettings{zoneId='" + zoneId + "', minimumSampleSize=" + minimumSampleSize + '}';
    }
}
