package com.spanlens.core.cascade;

import com.spanlens.core.CancellationToken;
import com.spanlens.core.config.CascadeSettings;
import com.spanlens.core.config.EngineConfig;
import com.spanlens.core.model.CascadeRecord;
import com.spanlens.core.model.CascadeTiming;
import com.spanlens.core.model.EntityLocation;
import com.spanlens.core.model.SpanEvent;
import com.spanlens.core.stats.QuantileCutPoints;
import com.spanlens.core.stats.ThresholdCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Detects directed trigger &rarr; target relationships between nearby
 * entities whose openings follow each other within a time window.
 *
 * <h3>Algorithm</h3>
 * <ol>
 * <li>Build an undirected proximity graph over the supplied locations
 * (haversine distance &le; {@code maxDistanceKm}).</li>
 * <li>Sort well-formed events by open time, ties broken by entity id.</li>
 * <li>For every trigger event, scan forward while the delay stays within
 * {@code windowMax}; every event of an adjacent, different entity whose delay
 * is positive and at least {@code windowMin} becomes a candidate.</li>
 * <li>Score each candidate as the weighted sum of four factors in
 * {@code [0, 1]}: temporal (peaks at the window midpoint), spatial
 * ({@code 1 - d / maxDistance}), duration correlation and the running
 * historical frequency of the ordered pair.</li>
 * <li>Bucket strengths against quantile cut points computed over the whole
 * run and tag the timing.</li>
 * </ol>
 *
 * <p>
 * Every candidate is reported; repeated relationships are not merged.
 * </p>
 *
 * <h3>Thread safety</h3>
 * <p>
 * Immutable after construction. All scan state is local to a call.
 * </p>
 *
 * @since 1.0.0
 */
public class CascadeEngine implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(CascadeEngine.class);

    /** Trigger events between two cancellation checks. */
    static final int CANCELLATION_CHECK_INTERVAL = 256;

    /** Prior used for a pair that has never been observed and for unknown durations. */
    static final double NEUTRAL_FACTOR = 0.5;

    private static final Comparator<SpanEvent> SCAN_ORDER = Comparator
            .comparing(SpanEvent::getOpenTime)
            .thenComparing(SpanEvent::getEntityId);

    private final double windowMinMinutes;
    private final double windowMaxMinutes;
    private final double maxDistanceKm;
    private final double temporalWeight;
    private final double spatialWeight;
    private final double durationWeight;
    private final double historicalWeight;
    private final double immediateThresholdMinutes;
    private final List<Double> cutPointQuantiles;

    public CascadeEngine() {
        this(new CascadeSettings());
    }

    public CascadeEngine(EngineConfig config) {
        this(Objects.requireNonNull(config, "EngineConfig must not be null").getCascade());
    }

    /**
     * @param settings cascade settings; must not be {@code null}
     */
    public CascadeEngine(CascadeSettings settings) {
        Objects.requireNonNull(settings, "CascadeSettings must not be null");
        this.windowMinMinutes = settings.getWindowMinMinutes();
        this.windowMaxMinutes = settings.getWindowMaxMinutes();
        this.maxDistanceKm = settings.getMaxDistanceKm();
        this.temporalWeight = settings.getTemporalWeight();
        this.spatialWeight = settings.getSpatialWeight();
        this.durationWeight = settings.getDurationWeight();
        this.historicalWeight = settings.getHistoricalWeight();
        this.immediateThresholdMinutes = settings.getImmediateThresholdMinutes();
        this.cutPointQuantiles = List.copyOf(settings.getCutPointQuantiles());
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Detect cascades with the configured window and distance.
     */
    public List<CascadeRecord> detectCascades(List<SpanEvent> events, Collection<EntityLocation> locations) {
        return detectCascades(events, locations, windowMinMinutes, windowMaxMinutes, maxDistanceKm,
                CancellationToken.NONE);
    }

    /**
     * Detect cascades with an explicit window and distance.
     */
    public List<CascadeRecord> detectCascades(List<SpanEvent> events, Collection<EntityLocation> locations,
            double windowMin, double windowMax, double maxDistance) {
        return detectCascades(events, locations, windowMin, windowMax, maxDistance, CancellationToken.NONE);
    }

    /**
     * Detect cascades.
     *
     * <p>
     * When {@code cancellation} fires the scan stops and the candidates found
     * so far are classified and returned.
     * </p>
     *
     * @param events       events in any order; must not be {@code null}
     * @param locations    entity coordinates; must not be {@code null}
     * @param windowMin    minimum delay in minutes
     * @param windowMax    maximum delay in minutes
     * @param maxDistance  adjacency radius in kilometres
     * @param cancellation cooperative cancellation token
     * @return one record per accepted candidate, in scan order
     * @throws IllegalArgumentException if the window or distance is invalid
     */
    public List<CascadeRecord> detectCascades(List<SpanEvent> events, Collection<EntityLocation> locations,
            double windowMin, double windowMax, double maxDistance, CancellationToken cancellation) {
        Objects.requireNonNull(events, "events must not be null");
        Objects.requireNonNull(locations, "locations must not be null");
        if (windowMin < 0 || windowMax < windowMin) {
            throw new IllegalArgumentException(
                    "Invalid cascade window [" + windowMin + ", " + windowMax + "]");
        }
        if (!(maxDistance > 0)) {
            throw new IllegalArgumentException("maxDistance must be > 0, got: " + maxDistance);
        }
        CancellationToken token = cancellation != null ? cancellation : CancellationToken.NONE;

        List<SpanEvent> sorted = new ArrayList<>(events.size());
        for (SpanEvent event : events) {
            if (event != null && !event.isMalformed()) {
                sorted.add(event);
            }
        }
        if (sorted.size() < 2 || locations.isEmpty()) {
            LOG.debug("Cascade detection skipped: {} usable event(s), {} location(s)",
                    sorted.size(), locations.size());
            return Collections.emptyList();
        }

        ProximityGraph graph = ProximityGraph.build(locations, maxDistance);
        if (graph.isEmpty()) {
            LOG.debug("No entities within {} km of each other", maxDistance);
            return Collections.emptyList();
        }
        sorted.sort(SCAN_ORDER);

        List<Candidate> candidates = scan(sorted, graph, windowMin, windowMax, maxDistance, token);
        List<CascadeRecord> records = classify(candidates);
        LOG.debug("Detected {} cascade(s) over {} event(s) and {} edge(s)",
                records.size(), sorted.size(), graph.edgeCount());
        return records;
    }

    // ---------------------------------------------------------------
    // Scan
    // ---------------------------------------------------------------

    private List<Candidate> scan(List<SpanEvent> sorted, ProximityGraph graph,
            double windowMin, double windowMax, double maxDistance, CancellationToken token) {
        List<Candidate> candidates = new ArrayList<>();
        Map<String, PairHistory> history = new HashMap<>();
        double mid = (windowMin + windowMax) / 2.0;
        double half = (windowMax - windowMin) / 2.0;

        for (int i = 0; i < sorted.size(); i++) {
            if (i % CANCELLATION_CHECK_INTERVAL == 0 && token.isCancelled()) {
                LOG.debug("Cascade scan cancelled at trigger {} of {}", i, sorted.size());
                break;
            }
            SpanEvent trigger = sorted.get(i);
            Set<String> neighbours = graph.neighbours(trigger.getEntityId());
            if (neighbours.isEmpty()) {
                continue;
            }

            Set<String> responded = new HashSet<>();
            for (int j = i + 1; j < sorted.size(); j++) {
                SpanEvent target = sorted.get(j);
                double delay = minutesBetween(trigger, target);
                if (delay > windowMax) {
                    break;
                }
                if (delay <= 0 || delay < windowMin
                        || target.getEntityId().equals(trigger.getEntityId())
                        || !neighbours.contains(target.getEntityId())) {
                    continue;
                }

                double distance = graph.distance(trigger.getEntityId(), target.getEntityId());
                PairHistory pair = history.get(pairKey(trigger.getEntityId(), target.getEntityId()));

                Candidate c = new Candidate(trigger, target, distance);
                c.temporal = temporalFactor(delay, mid, half);
                c.spatial = clamp(1.0 - distance / maxDistance);
                c.duration = durationFactor(trigger, target);
                c.historical = pair != null ? pair.rate() : NEUTRAL_FACTOR;
                c.strength = clamp(temporalWeight * c.temporal
                        + spatialWeight * c.spatial
                        + durationWeight * c.duration
                        + historicalWeight * c.historical);
                candidates.add(c);
                responded.add(target.getEntityId());
            }

            // priors for later triggers only see earlier outcomes
            for (String neighbour : neighbours) {
                history.computeIfAbsent(pairKey(trigger.getEntityId(), neighbour), k -> new PairHistory())
                        .record(responded.contains(neighbour));
            }
        }
        return candidates;
    }

    private List<CascadeRecord> classify(List<Candidate> candidates) {
        if (candidates.isEmpty()) {
            return Collections.emptyList();
        }
        List<Double> strengths = new ArrayList<>(candidates.size());
        for (Candidate c : candidates) {
            strengths.add(c.strength);
        }
        QuantileCutPoints cuts = ThresholdCalculator.cutPoints(strengths, cutPointQuantiles);

        List<CascadeRecord> records = new ArrayList<>(candidates.size());
        for (Candidate c : candidates) {
            double delay = minutesBetween(c.trigger, c.target);
            records.add(CascadeRecord.builder()
                    .trigger(c.trigger)
                    .target(c.target)
                    .distanceKm(c.distanceKm)
                    .strength(c.strength)
                    .strengthClass(cuts.classify(c.strength))
                    .timing(delay < immediateThresholdMinutes ? CascadeTiming.IMMEDIATE : CascadeTiming.DELAYED)
                    .factors(c.temporal, c.spatial, c.duration, c.historical)
                    .build());
        }
        return records;
    }

    // ---------------------------------------------------------------
    // Factors
    // ---------------------------------------------------------------

    static double temporalFactor(double delay, double mid, double half) {
        if (half <= 0) {
            return 1.0;
        }
        return clamp(1.0 - Math.abs(delay - mid) / half);
    }

    static double durationFactor(SpanEvent trigger, SpanEvent target) {
        if (!trigger.hasKnownDuration() || !target.hasKnownDuration()) {
            return NEUTRAL_FACTOR;
        }
        double a = trigger.getDurationMinutes();
        double b = target.getDurationMinutes();
        return clamp(1.0 - Math.abs(a - b) / Math.max(Math.max(a, b), 1.0));
    }

    private static double minutesBetween(SpanEvent from, SpanEvent to) {
        return Duration.between(from.getOpenTime(), to.getOpenTime()).toMillis() / 60_000.0;
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }

    private static String pairKey(String trigger, String target) {
        return trigger + '\u0000' + target;
    }

    // ---------------------------------------------------------------
    // Scan state
    // ---------------------------------------------------------------

    private static final class Candidate {
        final SpanEvent trigger;
        final SpanEvent target;
        final double distanceKm;
        double temporal;
        double spatial;
        double duration;
        double historical;
        double strength;

        Candidate(SpanEvent trigger, SpanEvent target, double distanceKm) {
            this.trigger = trigger;
            this.target = target;
            this.distanceKm = distanceKm;
        }
    }

    /** How often a target responded when its trigger opened. */
    private static final class PairHistory {
        int opportunities;
        int responses;

        void record(boolean responded) {
            opportunities++;
            if (responded) {
                responses++;
            }
        }

        double rate() {
            return opportunities == 0 ? NEUTRAL_FACTOR : (double) responses / opportunities;
        }
    }
}
