package com.spanlens.core.cascade;

import com.spanlens.core.CancellationSignal;
import com.spanlens.core.model.CascadeRecord;
import com.spanlens.core.model.CascadeStrength;
import com.spanlens.core.model.CascadeTiming;
import com.spanlens.core.model.EntityLocation;
import com.spanlens.core.model.SpanEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link CascadeEngine}.
 */
class CascadeEngineTest {

    private static final Instant T0 = Instant.parse("2024-06-03T08:00:00Z");

    private static final double LAT = 47.60;
    private static final double LON = -122.30;
    /** Roughly 2 km north of (LAT, LON). */
    private static final double LAT_2KM = LAT + 0.018;
    /** Roughly 10 km north of (LAT, LON). */
    private static final double LAT_10KM = LAT + 0.09;

    private CascadeEngine engine;

    @BeforeEach
    void setUp() {
        engine = new CascadeEngine();
    }

    private static SpanEvent event(String entity, Instant open, double minutes) {
        return SpanEvent.builder().entityId(entity).openTime(open).durationMinutes(minutes).build();
    }

    @Test
    @DisplayName("Should detect one cascade between entities 2 km apart opening 45 minutes apart")
    void shouldDetectSingleCascade() {
        List<SpanEvent> events = List.of(
                event("A", T0, 10),
                event("B", T0.plusSeconds(45 * 60), 10));
        List<EntityLocation> locations = List.of(
                new EntityLocation("A", LAT, LON),
                new EntityLocation("B", LAT_2KM, LON));

        List<CascadeRecord> cascades = engine.detectCascades(events, locations);

        assertThat(cascades).hasSize(1);
        CascadeRecord c = cascades.get(0);
        assertThat(c.getTriggerEntityId()).isEqualTo("A");
        assertThat(c.getTargetEntityId()).isEqualTo("B");
        assertThat(c.getDelayMinutes()).isEqualTo(45.0);
        assertThat(c.getDistanceKm()).isCloseTo(2.0, within(0.05));
        assertThat(c.getTiming()).isEqualTo(CascadeTiming.DELAYED);
        assertThat(c.getTemporalFactor()).isCloseTo(0.5, within(1e-9));
        assertThat(c.getDurationFactor()).isEqualTo(1.0);
        assertThat(c.getHistoricalFactor()).isEqualTo(0.5);
        assertThat(c.getStrength()).isCloseTo(0.25 * (0.5 + c.getSpatialFactor() + 1.0 + 0.5), within(1e-9));
        // a single strength sits on every cut point
        assertThat(c.getStrengthClass()).isEqualTo(CascadeStrength.STRONG);
    }

    @Test
    @DisplayName("Should detect nothing between entities 10 km apart")
    void shouldIgnoreDistantEntities() {
        List<SpanEvent> events = List.of(
                event("A", T0, 10),
                event("B", T0.plusSeconds(45 * 60), 10));
        List<EntityLocation> locations = List.of(
                new EntityLocation("A", LAT, LON),
                new EntityLocation("B", LAT_10KM, LON));

        assertThat(engine.detectCascades(events, locations)).isEmpty();
    }

    @Test
    @DisplayName("Should return empty for fewer than two events or no locations")
    void shouldReturnEmptyForInsufficientInput() {
        List<EntityLocation> locations = List.of(
                new EntityLocation("A", LAT, LON),
                new EntityLocation("B", LAT_2KM, LON));

        assertThat(engine.detectCascades(List.of(event("A", T0, 5)), locations)).isEmpty();
        assertThat(engine.detectCascades(List.of(), locations)).isEmpty();
        assertThat(engine.detectCascades(
                List.of(event("A", T0, 5), event("B", T0.plusSeconds(2_400), 5)), List.of())).isEmpty();
    }

    @Test
    @DisplayName("Should ignore openings outside the window and openings of the same entity")
    void shouldRespectWindowAndEntity() {
        List<SpanEvent> events = List.of(
                event("A", T0, 10),
                event("B", T0.plusSeconds(10 * 60), 10),
                event("A", T0.plusSeconds(45 * 60), 10),
                event("B", T0.plusSeconds(200 * 60), 10));
        List<EntityLocation> locations = List.of(
                new EntityLocation("A", LAT, LON),
                new EntityLocation("B", LAT_2KM, LON));

        List<CascadeRecord> cascades = engine.detectCascades(events, locations);

        // only B(+10) -> A(+45), a delay of 35 minutes
        assertThat(cascades).hasSize(1);
        assertThat(cascades.get(0).getTriggerEntityId()).isEqualTo("B");
        assertThat(cascades.get(0).getDelayMinutes()).isEqualTo(35.0);
        assertThat(cascades.get(0).getTiming()).isEqualTo(CascadeTiming.DELAYED);
    }

    @Test
    @DisplayName("Should learn the historical factor from earlier triggers of the same pair")
    void shouldLearnHistoricalFactor() {
        long day = 24 * 3600L;
        List<SpanEvent> events = List.of(
                event("A", T0, 10),
                event("B", T0.plusSeconds(45 * 60), 10),
                event("A", T0.plusSeconds(day), 10),
                event("B", T0.plusSeconds(day + 45 * 60), 10));
        List<EntityLocation> locations = List.of(
                new EntityLocation("A", LAT, LON),
                new EntityLocation("B", LAT_2KM, LON));

        List<CascadeRecord> cascades = engine.detectCascades(events, locations);

        assertThat(cascades).hasSize(2);
        assertThat(cascades.get(0).getHistoricalFactor()).isEqualTo(0.5);
        assertThat(cascades.get(1).getHistoricalFactor()).isEqualTo(1.0);
        assertThat(cascades.get(1).getStrength()).isGreaterThan(cascades.get(0).getStrength());
    }

    @Test
    @DisplayName("Should use the neutral duration factor when a duration is unknown")
    void shouldUseNeutralDurationFactor() {
        List<SpanEvent> events = List.of(
                SpanEvent.builder().entityId("A").openTime(T0).build(),
                event("B", T0.plusSeconds(60 * 60), 10));
        List<EntityLocation> locations = List.of(
                new EntityLocation("A", LAT, LON),
                new EntityLocation("B", LAT_2KM, LON));

        CascadeRecord c = engine.detectCascades(events, locations).get(0);

        assertThat(c.getDurationFactor()).isEqualTo(0.5);
        assertThat(c.getTemporalFactor()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    @DisplayName("Should keep every delay inside the window on a random workload")
    void shouldKeepDelaysInsideWindow() {
        Random random = new Random(42);
        List<EntityLocation> locations = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            locations.add(new EntityLocation("E" + i, LAT + random.nextDouble() * 0.05,
                    LON + random.nextDouble() * 0.05));
        }
        List<SpanEvent> events = new ArrayList<>();
        for (int i = 0; i < 400; i++) {
            events.add(event("E" + random.nextInt(6), T0.plusSeconds(random.nextInt(7 * 24 * 3600)),
                    1 + random.nextInt(30)));
        }

        List<CascadeRecord> cascades = engine.detectCascades(events, locations);

        assertThat(cascades).isNotEmpty();
        assertThat(cascades).allSatisfy(c -> {
            assertThat(c.getDelayMinutes()).isBetween(30.0, 90.0);
            assertThat(c.getTriggerEntityId()).isNotEqualTo(c.getTargetEntityId());
            assertThat(c.getStrength()).isBetween(0.0, 1.0);
            assertThat(c.getDistanceKm()).isLessThanOrEqualTo(5.0);
        });
        assertThat(cascades).extracting(CascadeRecord::getStrengthClass)
                .contains(CascadeStrength.WEAK, CascadeStrength.STRONG);
    }

    @Test
    @DisplayName("Should return what was found so far when cancelled")
    void shouldStopWhenCancelled() {
        CancellationSignal signal = new CancellationSignal();
        signal.cancel();
        List<SpanEvent> events = List.of(
                event("A", T0, 10),
                event("B", T0.plusSeconds(45 * 60), 10));
        List<EntityLocation> locations = List.of(
                new EntityLocation("A", LAT, LON),
                new EntityLocation("B", LAT_2KM, LON));

        assertThat(engine.detectCascades(events, locations, 30, 90, 5.0, signal)).isEmpty();
    }

    @Test
    @DisplayName("Should reject an inverted window")
    void shouldRejectInvertedWindow() {
        assertThatThrownBy(() -> engine.detectCascades(List.of(), List.of(), 90, 30, 5.0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("window");
    }

    @Test
    @DisplayName("Should compute haversine distances")
    void shouldComputeHaversine() {
        // one degree of latitude
        assertThat(GeoDistance.haversineKm(0, 0, 1, 0)).isCloseTo(111.195, within(0.01));
        assertThat(GeoDistance.haversineKm(LAT, LON, LAT, LON)).isZero();
    }
}
