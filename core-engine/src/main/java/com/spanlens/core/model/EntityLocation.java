package com.spanlens.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Static coordinates of an entity, used to build the cascade proximity graph.
 *
 * @since 1.0.0
 */
public final class EntityLocation implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String entityId;
    private final double latitude;
    private final double longitude;

    /**
     * @param entityId  the entity identifier; must not be {@code null}
     * @param latitude  latitude in degrees
     * @param longitude longitude in degrees
     */
    public EntityLocation(String entityId, double latitude, double longitude) {
        this.entityId = Objects.requireNonNull(entityId, "entityId must not be null");
        this.latitude = latitude;
        this.longitude = longitude;
    }

    /**
     * Derive one location per entity from the coordinates carried by the
     * events. The first event seen for an entity wins.
     *
     * @param events events to scan; must not be {@code null}
     * @return locations in first-seen order
     */
    public static List<EntityLocation> fromEvents(Collection<SpanEvent> events) {
        Objects.requireNonNull(events, "events must not be null");
        Map<String, EntityLocation> byEntity = new LinkedHashMap<>();
        for (SpanEvent event : events) {
            if (event != null) {
                byEntity.putIfAbsent(event.getEntityId(),
                        new EntityLocation(event.getEntityId(), event.getLatitude(), event.getLongitude()));
            }
        }
        return new ArrayList<>(byEntity.values());
    }

    public String getEntityId() {
        return entityId;
    }

    public double getLatitude() {
        return latitude;
    }

    public double getLongitude() {
        return longitude;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EntityLocation that))
            return false;
        return Double.compare(latitude, that.latitude) == 0
                && Double.compare(longitude, that.longitude) == 0
                && entityId.equals(that.entityId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityId, latitude, longitude);
    }

    @Override
    public String toString() {
        return "EntityLocation{" + entityId + " @ " + latitude + "," + longitude + '}';
    }
}
