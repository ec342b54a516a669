package com.spanlens.core.prediction;

import com.spanlens.core.CancellationSignal;
import com.spanlens.core.CancellationToken;
import com.spanlens.core.config.EngineConfig;
import com.spanlens.core.model.AnalyticsRecord;
import com.spanlens.core.model.CascadeRecord;
import com.spanlens.core.model.CascadeStrength;
import com.spanlens.core.model.CascadeTiming;
import com.spanlens.core.model.ComputeTier;
import com.spanlens.core.model.Forecast;
import com.spanlens.core.model.SpanEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link PredictionEngine}.
 */
class PredictionEngineTest {

    private static final Instant T0 = Instant.parse("2024-06-03T00:00:00Z");

    private PredictionEngine engine;

    @BeforeEach
    void setUp() {
        engine = new PredictionEngine();
    }

    /** Openings roughly every hour with noisy ten-minute durations. */
    private static List<SpanEvent> noisyHistory(int count) {
        Random random = new Random(3);
        List<SpanEvent> events = new ArrayList<>();
        long offset = 0;
        for (int i = 0; i < count; i++) {
            offset += 45 * 60 + random.nextInt(30 * 60);
            events.add(SpanEvent.builder()
                    .entityId("bridge-1")
                    .entityLabel("Ballard")
                    .openTime(T0.plusSeconds(offset))
                    .durationMinutes(8 + random.nextDouble() * 4)
                    .build());
        }
        return events;
    }

    /** Openings exactly every hour, each lasting twelve minutes. */
    private static List<SpanEvent> regularHistory(int count) {
        List<SpanEvent> events = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            events.add(SpanEvent.builder()
                    .entityId("bridge-1")
                    .openTime(T0.plusSeconds(i * 3600L))
                    .durationMinutes(12.0)
                    .build());
        }
        return events;
    }

    private static Instant lastOpen(List<SpanEvent> events) {
        return events.get(events.size() - 1).getOpenTime();
    }

    @Test
    @DisplayName("Should return empty with fewer than three events")
    void shouldReturnEmptyForShortHistory() {
        List<SpanEvent> events = regularHistory(2);

        Optional<Forecast> forecast = engine.forecast(ForecastRequest.builder()
                .entityId("bridge-1").events(events).now(lastOpen(events)).build());

        assertThat(forecast).isEmpty();
    }

    @Test
    @DisplayName("Should keep the settings it was built with when the config changes later")
    void shouldIgnoreLaterSettingsChanges() {
        EngineConfig config = EngineConfig.defaults();
        PredictionEngine built = new PredictionEngine(config);
        config.getPrediction().setMinimumEvents(1000);
        config.getPrediction().setHorizonMinutes(5);
        List<SpanEvent> events = regularHistory(10);

        Optional<Forecast> forecast = built.forecast(ForecastRequest.builder()
                .entityId("bridge-1").events(events).now(lastOpen(events)).build());

        assertThat(forecast).isPresent();
        assertThat(forecast.get().getHorizonMinutes()).isEqualTo(60);
    }

    @Test
    @DisplayName("Should ignore events of other entities and malformed events")
    void shouldOnlyUseWellFormedEventsOfEntity() {
        List<SpanEvent> events = new ArrayList<>(regularHistory(2));
        events.add(SpanEvent.builder().entityId("bridge-2").openTime(T0.plusSeconds(7_200)).build());
        events.add(SpanEvent.builder().entityId("bridge-1").openTime(T0.plusSeconds(9_000))
                .durationMinutes(-1.0).build());

        assertThat(engine.forecast(ForecastRequest.builder()
                .entityId("bridge-1").events(events).now(T0.plusSeconds(10_000)).build())).isEmpty();
    }

    @ParameterizedTest
    @EnumSource(ComputeTier.class)
    @DisplayName("Should forecast from 100 events with the requested tier's model")
    void shouldForecastAtEveryTier(ComputeTier tier) {
        List<SpanEvent> events = noisyHistory(100);

        Optional<Forecast> forecast = engine.forecast(ForecastRequest.builder()
                .entityId("bridge-1").events(events).tier(tier)
                .now(lastOpen(events).plusSeconds(20 * 60)).build());

        assertThat(forecast).isPresent();
        Forecast f = forecast.get();
        assertThat(f.getProbability()).isBetween(0.0, 1.0);
        assertThat(f.getConfidence()).isBetween(0.0, 1.0);
        assertThat(f.getExpectedDurationMinutes()).isBetween(0.0, 30.0);
        assertThat(f.getModelTier()).isEqualTo(tier);
        assertThat(f.getHorizonMinutes()).isEqualTo(60L);
        assertThat(f.isCascadeBoosted()).isFalse();
    }

    @Test
    @DisplayName("Should fall back to MINIMAL for a constant series")
    void shouldFallBackForConstantSeries() {
        List<SpanEvent> events = regularHistory(50);

        Forecast f = engine.forecast(ForecastRequest.builder()
                .entityId("bridge-1").events(events).tier(ComputeTier.EXPERT)
                .now(lastOpen(events).plusSeconds(30 * 60)).build()).orElseThrow();

        assertThat(f.getModelTier()).isEqualTo(ComputeTier.MINIMAL);
        assertThat(f.getExpectedDurationMinutes()).isCloseTo(12.0, within(1e-9));
    }

    @Test
    @DisplayName("Should drop one tier at a time when an estimator fails")
    void shouldFallBackOneTierAtATime() {
        double[] intervals = new Random(11).doubles(80, 40, 80).toArray();

        PredictionEngine expertFails = new PredictionEngine(EngineConfig.defaults(),
                new FailingEstimators(ComputeTier.EXPERT));
        PredictionEngine expertAndAdvancedFail = new PredictionEngine(EngineConfig.defaults(),
                new FailingEstimators(ComputeTier.EXPERT, ComputeTier.ADVANCED));

        assertThat(expertFails.fitWithFallback(intervals, ComputeTier.EXPERT, CancellationToken.NONE).getTier())
                .isEqualTo(ComputeTier.ADVANCED);
        assertThat(expertAndAdvancedFail
                .fitWithFallback(intervals, ComputeTier.EXPERT, CancellationToken.NONE).getTier())
                .isEqualTo(ComputeTier.STANDARD);
    }

    @Test
    @DisplayName("Should report the tier that actually produced the forecast")
    void shouldReportFallbackTierOnForecast() {
        List<SpanEvent> events = noisyHistory(100);
        PredictionEngine expertFails = new PredictionEngine(EngineConfig.defaults(),
                new FailingEstimators(ComputeTier.EXPERT));

        Forecast f = expertFails.forecast(ForecastRequest.builder()
                .entityId("bridge-1").events(events).tier(ComputeTier.EXPERT)
                .now(lastOpen(events).plusSeconds(20 * 60)).build()).orElseThrow();

        assertThat(f.getModelTier()).isEqualTo(ComputeTier.ADVANCED);
        assertThat(f.getRationale()).contains("(ADVANCED)");
    }

    /** Estimators of the given tiers always fail; the rest are the real ones. */
    private static final class FailingEstimators extends EstimatorFactory {

        private static final long serialVersionUID = 1L;

        private final Set<ComputeTier> failing;

        FailingEstimators(ComputeTier first, ComputeTier... rest) {
            super(EngineConfig.defaults().getPrediction());
            this.failing = EnumSet.of(first, rest);
        }

        @Override
        ModelEstimator create(ComputeTier tier) {
            if (!failing.contains(tier)) {
                return super.create(tier);
            }
            return new ModelEstimator() {
                @Override
                public Optional<ArmaModel> fit(double[] series, CancellationToken cancellation) {
                    return Optional.empty();
                }

                @Override
                public ComputeTier getTier() {
                    return tier;
                }
            };
        }
    }

    @Test
    @DisplayName("Should raise probability as the horizon covers the expected wait")
    void shouldScaleProbabilityWithHorizon() {
        List<SpanEvent> events = regularHistory(50);
        Instant now = lastOpen(events).plusSeconds(30 * 60);

        Forecast shortHorizon = engine.forecast(ForecastRequest.builder()
                .entityId("bridge-1").events(events).horizonMinutes(10).now(now).build()).orElseThrow();
        Forecast longHorizon = engine.forecast(ForecastRequest.builder()
                .entityId("bridge-1").events(events).horizonMinutes(60).now(now).build()).orElseThrow();

        // next opening is 30 minutes away with no residual spread
        assertThat(shortHorizon.getProbability()).isLessThan(0.01);
        assertThat(longHorizon.getProbability()).isGreaterThan(0.99);
    }

    @Test
    @DisplayName("Should treat a null tier as STANDARD")
    void shouldTreatNullTierAsStandard() {
        ForecastRequest request = ForecastRequest.builder()
                .entityId("bridge-1").events(noisyHistory(10)).tier(null).now(T0).build();

        assertThat(request.getTier()).isEqualTo(ComputeTier.STANDARD);
    }

    @Test
    @DisplayName("Should boost probability from a recent cascade and cap it")
    void shouldApplyCascadeBoost() {
        List<SpanEvent> events = noisyHistory(100);
        Instant now = lastOpen(events).plusSeconds(10 * 60);
        CascadeRecord cascade = CascadeRecord.builder()
                .triggerEntityId("bridge-2")
                .triggerTime(now.minusSeconds(20 * 60))
                .targetEntityId("bridge-1")
                .targetTime(now.plusSeconds(20 * 60))
                .labels("Fremont", "Ballard")
                .strength(1.0)
                .strengthClass(CascadeStrength.STRONG)
                .timing(CascadeTiming.DELAYED)
                .build();

        Forecast plain = engine.forecast(ForecastRequest.builder()
                .entityId("bridge-1").events(events).now(now).build()).orElseThrow();
        Forecast boosted = engine.forecast(ForecastRequest.builder()
                .entityId("bridge-1").events(events).cascades(List.of(cascade)).now(now).build()).orElseThrow();

        assertThat(boosted.getProbability())
                .isCloseTo(Math.min(plain.getProbability() + 0.15, 0.95), within(1e-9));
        assertThat(boosted.getProbability()).isLessThanOrEqualTo(0.95);
        assertThat(boosted.getBoostingEntityId()).isEqualTo("bridge-2");
        assertThat(boosted.getRationale()).contains("bridge-2").contains("Fremont");
    }

    @Test
    @DisplayName("Should ignore cascades triggered before the cascade window")
    void shouldIgnoreStaleCascades() {
        List<SpanEvent> events = noisyHistory(30);
        Instant now = lastOpen(events).plusSeconds(10 * 60);
        CascadeRecord stale = CascadeRecord.builder()
                .triggerEntityId("bridge-2")
                .triggerTime(now.minusSeconds(3 * 3600))
                .targetEntityId("bridge-1")
                .targetTime(now.minusSeconds(2 * 3600))
                .strength(1.0)
                .strengthClass(CascadeStrength.STRONG)
                .timing(CascadeTiming.DELAYED)
                .build();

        Forecast f = engine.forecast(ForecastRequest.builder()
                .entityId("bridge-1").events(events).cascades(List.of(stale)).now(now).build()).orElseThrow();

        assertThat(f.isCascadeBoosted()).isFalse();
    }

    @Test
    @DisplayName("Should blend analytics confidence and penalise its absence")
    void shouldBlendAnalyticsConfidence() {
        List<SpanEvent> events = noisyHistory(60);
        Instant now = lastOpen(events).plusSeconds(5 * 60);
        java.time.ZonedDateTime at = now.atZone(java.time.ZoneOffset.UTC);
        AnalyticsRecord bucket = AnalyticsRecord.builder()
                .entityId("bridge-1")
                .bucket(at.getYear(), at.getMonthValue(), at.getDayOfWeek().getValue(), at.getHour())
                .openingCount(12)
                .probabilityOfOpening(0.8)
                .expectedDuration(10)
                .confidence(1.0)
                .build();

        Forecast without = engine.forecast(ForecastRequest.builder()
                .entityId("bridge-1").events(events).now(now).build()).orElseThrow();
        Forecast with = engine.forecast(ForecastRequest.builder()
                .entityId("bridge-1").events(events).analytics(List.of(bucket)).now(now).build()).orElseThrow();

        assertThat(without.getConfidence()).isLessThanOrEqualTo(0.7);
        assertThat(with.getConfidence()).isGreaterThanOrEqualTo(0.5);
        assertThat(with.getConfidence()).isCloseTo(0.5 + without.getConfidence() / 0.7 / 2, within(1e-9));
        assertThat(with.getRationale()).contains("12 historical openings");
    }

    @Test
    @DisplayName("Should mention the holiday adjustment of the matching bucket")
    void shouldMentionHolidayAdjustment() {
        List<SpanEvent> events = regularHistory(40);
        Instant now = lastOpen(events).plusSeconds(5 * 60);
        java.time.ZonedDateTime at = now.atZone(java.time.ZoneOffset.UTC);
        AnalyticsRecord bucket = AnalyticsRecord.builder()
                .entityId("bridge-1")
                .bucket(at.getYear(), at.getMonthValue(), at.getDayOfWeek().getValue(), at.getHour())
                .openingCount(5)
                .probabilityOfOpening(0.5)
                .confidence(0.5)
                .holidayAdjustment(0.3)
                .build();

        Forecast f = engine.forecast(ForecastRequest.builder()
                .entityId("bridge-1").events(events).analytics(List.of(bucket)).now(now).build()).orElseThrow();

        assertThat(f.getRationale()).contains("5 historical openings").endsWith("(holiday adjustment +30%)");
    }

    @Test
    @DisplayName("Should return empty when cancelled before fitting")
    void shouldReturnEmptyWhenCancelled() {
        CancellationSignal signal = new CancellationSignal();
        signal.cancel();

        assertThat(engine.forecast(ForecastRequest.builder()
                .entityId("bridge-1").events(noisyHistory(20)).now(T0).build(), signal)).isEmpty();
    }
}
