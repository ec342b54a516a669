package com.spanlens.core.cascade;

import com.spanlens.core.model.EntityLocation;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Undirected graph joining every pair of distinct entities that lie within
 * {@code maxDistanceKm} of each other. Edge weights are the distances.
 */
final class ProximityGraph {

    private final Map<String, Map<String, Double>> edges;

    private ProximityGraph(Map<String, Map<String, Double>> edges) {
        this.edges = edges;
    }

    /**
     * Build the graph. When an entity appears more than once, its first
     * location wins; locations with non-finite coordinates are ignored.
     */
    static ProximityGraph build(Collection<EntityLocation> locations, double maxDistanceKm) {
        Map<String, EntityLocation> unique = new LinkedHashMap<>();
        for (EntityLocation location : locations) {
            if (location != null
                    && Double.isFinite(location.getLatitude())
                    && Double.isFinite(location.getLongitude())) {
                unique.putIfAbsent(location.getEntityId(), location);
            }
        }

        EntityLocation[] nodes = unique.values().toArray(new EntityLocation[0]);
        Map<String, Map<String, Double>> edges = new HashMap<>();
        for (int i = 0; i < nodes.length; i++) {
            for (int j = i + 1; j < nodes.length; j++) {
                double d = GeoDistance.haversineKm(nodes[i].getLatitude(), nodes[i].getLongitude(),
                        nodes[j].getLatitude(), nodes[j].getLongitude());
                if (d <= maxDistanceKm) {
                    edges.computeIfAbsent(nodes[i].getEntityId(), k -> new TreeMap<>()).put(nodes[j].getEntityId(), d);
                    edges.computeIfAbsent(nodes[j].getEntityId(), k -> new TreeMap<>()).put(nodes[i].getEntityId(), d);
                }
            }
        }
        return new ProximityGraph(edges);
    }

    boolean isEmpty() {
        return edges.isEmpty();
    }

    /**
     * @return neighbours of {@code entityId}, in identifier order
     */
    Set<String> neighbours(String entityId) {
        Map<String, Double> adjacent = edges.get(entityId);
        return adjacent == null ? Collections.emptySet() : adjacent.keySet();
    }

    /**
     * @return the distance between two adjacent entities, or {@code null} when
     *         they are not adjacent
     */
    Double distance(String from, String to) {
        Map<String, Double> adjacent = edges.get(from);
        return adjacent == null ? null : adjacent.get(to);
    }

    int edgeCount() {
        return edges.values().stream().mapToInt(Map::size).sum() / 2;
    }
}
