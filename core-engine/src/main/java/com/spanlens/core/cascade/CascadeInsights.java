package com.spanlens.core.cascade;

import com.spanlens.core.model.CascadeRecord;
import com.spanlens.core.model.CascadeTiming;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Summarises detected cascades per entity.
 *
 * @since 1.0.0
 */
public final class CascadeInsights {

    private CascadeInsights() {
        // utility class, not instantiable
    }

    /**
     * Build the cascade profile of one entity.
     *
     * @param entityId  entity to profile; must not be {@code null}
     * @param cascades  detected cascades; must not be {@code null}
     * @return the profile, all zeros when the entity took part in no cascade
     */
    public static CascadeProfile profile(String entityId, Collection<CascadeRecord> cascades) {
        Objects.requireNonNull(entityId, "entityId must not be null");
        Objects.requireNonNull(cascades, "cascades must not be null");

        List<CascadeRecord> triggered = cascades.stream()
                .filter(c -> entityId.equals(c.getTriggerEntityId()))
                .collect(Collectors.toList());
        List<CascadeRecord> received = cascades.stream()
                .filter(c -> entityId.equals(c.getTargetEntityId()))
                .collect(Collectors.toList());

        List<CascadeRecord> primaryTarget = mostFrequent(triggered, CascadeRecord::getTargetEntityId);
        List<CascadeRecord> primaryTrigger = mostFrequent(received, CascadeRecord::getTriggerEntityId);

        double immediateShare = triggered.isEmpty() ? 0.0
                : (double) triggered.stream().filter(c -> c.getTiming() == CascadeTiming.IMMEDIATE).count()
                        / triggered.size();

        return new CascadeProfile(entityId,
                meanStrength(triggered),
                meanStrength(received),
                triggered.size(),
                received.size(),
                primaryTarget.isEmpty() ? null : primaryTarget.get(0).getTargetEntityId(),
                primaryTarget.isEmpty() ? null : primaryTarget.get(0).getTargetLabel(),
                primaryTarget.size(),
                primaryTrigger.isEmpty() ? null : primaryTrigger.get(0).getTriggerEntityId(),
                primaryTrigger.isEmpty() ? null : primaryTrigger.get(0).getTriggerLabel(),
                primaryTrigger.size(),
                primaryTarget.stream().mapToDouble(CascadeRecord::getDelayMinutes).average().orElse(0.0),
                immediateShare);
    }

    private static double meanStrength(List<CascadeRecord> records) {
        return records.stream().mapToDouble(CascadeRecord::getStrength).average().orElse(0.0);
    }

    /**
     * Largest group by {@code key}; ties go to the smallest key so the result
     * is deterministic.
     */
    private static List<CascadeRecord> mostFrequent(List<CascadeRecord> records,
            Function<CascadeRecord, String> key) {
        Map<String, List<CascadeRecord>> groups = records.stream()
                .collect(Collectors.groupingBy(key, TreeMap::new, Collectors.toList()));
        List<CascadeRecord> best = List.of();
        for (List<CascadeRecord> group : groups.values()) {
            if (group.size() > best.size()) {
                best = group;
            }
        }
        return best;
    }
}
