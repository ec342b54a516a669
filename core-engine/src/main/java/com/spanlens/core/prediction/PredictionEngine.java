package com.spanlens.core.prediction;

import com.spanlens.core.CancellationToken;
import com.spanlens.core.config.EngineConfig;
import com.spanlens.core.config.PredictionSettings;
import com.spanlens.core.model.AnalyticsRecord;
import com.spanlens.core.model.CascadeRecord;
import com.spanlens.core.model.ComputeTier;
import com.spanlens.core.model.Forecast;
import com.spanlens.core.model.SpanEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Short-horizon opening forecasts from an entity's own history.
 *
 * <p>
 * Two series are modelled per call: the minutes between consecutive
 * openings and the known durations. The requested {@link ComputeTier}
 * selects the estimation method; when a method fails numerically the next
 * lower tier is tried, down to {@code MINIMAL}, which always succeeds.
 * </p>
 *
 * <h3>Outputs</h3>
 * <ul>
 * <li>{@code probability}: logistic in
 * {@code (horizon - expectedWait) / max(1, intervalRmse)}, where
 * {@code expectedWait} is the forecast interval minus the minutes already
 * elapsed since the last opening.</li>
 * <li>{@code expectedDurationMinutes}: one-step forecast of the duration
 * series, floored at zero.</li>
 * <li>{@code confidence}: the mean of the matching analytics bucket's
 * confidence and the model's fit quality, or the fit quality scaled by a
 * penalty when no bucket matches.</li>
 * </ul>
 *
 * <h3>Cascade boost</h3>
 * <p>
 * A cascade targeting the entity whose trigger opened within the cascade
 * window before {@code now} adds {@code strength * boostFactor} to the
 * probability; the boosted probability is capped.
 * </p>
 *
 * <h3>Thread safety</h3>
 * <p>
 * Immutable after construction.
 * </p>
 *
 * @since 1.0.0
 */
public class PredictionEngine implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(PredictionEngine.class);

    /** Shortest duration series that is modelled rather than averaged. */
    static final int MIN_DURATION_SERIES = 3;

    private final long horizonMinutes;
    private final int minimumEvents;
    private final double missingAnalyticsPenalty;
    private final double cascadeBoostFactor;
    private final double cascadeBoostCap;
    private final EstimatorFactory estimators;
    private final String zoneId;
    private final double cascadeWindowMaxMinutes;

    public PredictionEngine() {
        this(EngineConfig.defaults());
    }

    /**
     * @param config engine configuration; the analytics zone and the cascade
     *               window are read from it as well
     */
    public PredictionEngine(EngineConfig config) {
        this(config, new EstimatorFactory(
                Objects.requireNonNull(config, "EngineConfig must not be null").getPrediction()));
    }

    PredictionEngine(EngineConfig config, EstimatorFactory estimators) {
        Objects.requireNonNull(config, "EngineConfig must not be null");
        PredictionSettings settings = Objects.requireNonNull(config.getPrediction(),
                "PredictionSettings must not be null");
        this.horizonMinutes = settings.getHorizonMinutes();
        this.minimumEvents = settings.getMinimumEvents();
        this.missingAnalyticsPenalty = settings.getMissingAnalyticsPenalty();
        this.cascadeBoostFactor = settings.getCascadeBoostFactor();
        this.cascadeBoostCap = settings.getCascadeBoostCap();
        this.estimators = Objects.requireNonNull(estimators, "estimators must not be null");
        this.zoneId = config.getAnalytics().zone().getId();
        this.cascadeWindowMaxMinutes = config.getCascade().getWindowMaxMinutes();
    }

    /**
     * Forecast without cancellation.
     */
    public Optional<Forecast> forecast(ForecastRequest request) {
        return forecast(request, CancellationToken.NONE);
    }

    /**
     * Forecast the next opening of {@code request.entityId}.
     *
     * @param request      forecast inputs; must not be {@code null}
     * @param cancellation cooperative cancellation token
     * @return the forecast, or empty when the entity has too few well-formed
     *         events or the call was cancelled
     */
    public Optional<Forecast> forecast(ForecastRequest request, CancellationToken cancellation) {
        Objects.requireNonNull(request, "ForecastRequest must not be null");
        CancellationToken token = cancellation != null ? cancellation : CancellationToken.NONE;
        if (token.isCancelled()) {
            return Optional.empty();
        }

        List<SpanEvent> history = history(request.getEntityId(), request.getEvents());
        if (history.size() < minimumEvents) {
            LOG.debug("Not enough history for {}: {} event(s)", request.getEntityId(), history.size());
            return Optional.empty();
        }

        double[] intervals = intervals(history);
        double[] durations = knownDurations(history);
        ComputeTier tier = request.getTier();
        long horizon = request.getHorizonMinutes() != null
                ? request.getHorizonMinutes()
                : horizonMinutes;
        Instant now = request.getNow();

        ArmaModel intervalModel = fitWithFallback(intervals, tier, token);
        if (token.isCancelled()) {
            return Optional.empty();
        }

        double forecastInterval = Math.max(0.0, intervalModel.forecastNext(intervals));
        SpanEvent last = history.get(history.size() - 1);
        double sinceLast = Math.max(0.0, minutesBetween(last.getOpenTime(), now));
        double expectedWait = Math.max(0.0, forecastInterval - sinceLast);
        double scale = Math.max(1.0, intervalModel.getRmse());
        double probability = logistic((horizon - expectedWait) / scale);

        double expectedDuration = expectedDuration(durations, tier, token);

        double fitQuality = intervalModel.fitQuality();
        Optional<AnalyticsRecord> bucket = matchingBucket(request.getEntityId(), request.getAnalytics(), now);
        double confidence = bucket
                .map(b -> (b.getConfidence() + fitQuality) / 2.0)
                .orElse(fitQuality * missingAnalyticsPenalty);

        StringBuilder rationale = new StringBuilder()
                .append(intervalModel.describe())
                .append(" model (").append(intervalModel.getTier()).append(") over ")
                .append(history.size()).append(" openings; next opening expected in ")
                .append(String.format(Locale.ROOT, "%.0f", expectedWait)).append(" min");
        bucket.ifPresent(b -> rationale.append("; ").append(describeBucket(b)));

        Optional<CascadeRecord> booster = strongestRecentCascade(request.getEntityId(), request.getCascades(), now);
        String boostingEntityId = null;
        if (booster.isPresent()) {
            CascadeRecord c = booster.get();
            double boosted = probability + c.getStrength() * cascadeBoostFactor;
            probability = Math.min(boosted, cascadeBoostCap);
            boostingEntityId = c.getTriggerEntityId();
            rationale.append("; cascade effect from ").append(c.getTriggerLabel())
                    .append(" (").append(c.getTriggerEntityId()).append(") opened at ")
                    .append(c.getTriggerTime());
        }

        Forecast forecast = Forecast.builder()
                .entityId(request.getEntityId())
                .probability(clamp(probability))
                .expectedDurationMinutes(Math.max(0.0, expectedDuration))
                .confidence(clamp(confidence))
                .modelTier(intervalModel.getTier())
                .rationale(rationale.toString())
                .horizonMinutes(horizon)
                .generatedAt(now)
                .boostingEntityId(boostingEntityId)
                .build();
        LOG.debug("Forecast for {}: {}", request.getEntityId(), forecast);
        return Optional.of(forecast);
    }

    // ---------------------------------------------------------------
    // Model fitting
    // ---------------------------------------------------------------

    /**
     * Fit {@code series} with the estimator of {@code requested}, falling
     * back one tier at a time until a fit succeeds.
     */
    ArmaModel fitWithFallback(double[] series, ComputeTier requested, CancellationToken token) {
        if (series.length < 2) {
            return ArmaModel.meanOnly(series);
        }
        ComputeTier tier = requested;
        while (true) {
            Optional<ArmaModel> model = estimators.create(tier).fit(series, token);
            if (model.isPresent() && model.get().isFinite()) {
                return model.get();
            }
            if (tier == ComputeTier.MINIMAL) {
                return ArmaModel.meanOnly(series);
            }
            LOG.debug("{} estimation failed for a series of {} value(s); falling back to {}",
                    tier, series.length, tier.lower());
            tier = tier.lower();
        }
    }

    private double expectedDuration(double[] durations, ComputeTier tier, CancellationToken token) {
        if (durations.length < MIN_DURATION_SERIES) {
            return SeriesStatistics.mean(durations);
        }
        double next = fitWithFallback(durations, tier, token).forecastNext(durations);
        return Double.isFinite(next) ? Math.max(0.0, next) : SeriesStatistics.mean(durations);
    }

    // ---------------------------------------------------------------
    // Inputs
    // ---------------------------------------------------------------

    private static List<SpanEvent> history(String entityId, List<SpanEvent> events) {
        List<SpanEvent> history = new ArrayList<>();
        for (SpanEvent event : events) {
            if (event != null && entityId.equals(event.getEntityId()) && !event.isMalformed()) {
                history.add(event);
            }
        }
        history.sort(Comparator.comparing(SpanEvent::getOpenTime));
        return history;
    }

    private static double[] intervals(List<SpanEvent> history) {
        double[] out = new double[history.size() - 1];
        for (int i = 1; i < history.size(); i++) {
            out[i - 1] = minutesBetween(history.get(i - 1).getOpenTime(), history.get(i).getOpenTime());
        }
        return out;
    }

    private static double[] knownDurations(List<SpanEvent> history) {
        return history.stream()
                .filter(SpanEvent::hasKnownDuration)
                .mapToDouble(SpanEvent::getDurationMinutes)
                .toArray();
    }

    /**
     * Analytics bucket for {@code now}'s day of week and hour. A bucket of
     * the same month wins over others; ties go to the highest confidence.
     */
    private Optional<AnalyticsRecord> matchingBucket(String entityId, List<AnalyticsRecord> analytics,
            Instant now) {
        ZonedDateTime at = now.atZone(ZoneId.of(zoneId));
        int dow = at.getDayOfWeek().getValue();
        int hour = at.getHour();
        int month = at.getMonthValue();
        return analytics.stream()
                .filter(Objects::nonNull)
                .filter(r -> entityId.equals(r.getEntityId())
                        && r.getDayOfWeek() == dow
                        && r.getHourOfDay() == hour)
                .max(Comparator.comparing((AnalyticsRecord r) -> r.getMonth() == month)
                        .thenComparingDouble(AnalyticsRecord::getConfidence));
    }

    private Optional<CascadeRecord> strongestRecentCascade(String entityId, List<CascadeRecord> cascades,
            Instant now) {
        Instant earliest = now.minusMillis(Math.round(cascadeWindowMaxMinutes * 60_000.0));
        return cascades.stream()
                .filter(Objects::nonNull)
                .filter(c -> entityId.equals(c.getTargetEntityId())
                        && !c.getTriggerTime().isBefore(earliest)
                        && !c.getTriggerTime().isAfter(now))
                .max(Comparator.comparingDouble(CascadeRecord::getStrength));
    }

    private static String describeBucket(AnalyticsRecord b) {
        String day = DayOfWeek.of(b.getDayOfWeek()).getDisplayName(TextStyle.FULL, Locale.ENGLISH);
        StringBuilder text = new StringBuilder()
                .append("based on ").append(b.getOpeningCount()).append(" historical openings on ")
                .append(day).append("s at ").append(String.format(Locale.ROOT, "%02d:00", b.getHourOfDay()));
        if (b.isSummerPattern()) {
            text.append(" (summer pattern)");
        }
        if (b.isWeekendPattern()) {
            text.append(" (weekend pattern)");
        }
        if (b.isRushHourPattern()) {
            text.append(" (rush hour period)");
        }
        if (b.getHolidayAdjustment() > 0) {
            text.append(" (holiday adjustment +")
                    .append(Math.round(b.getHolidayAdjustment() * 100)).append("%)");
        }
        return text.toString();
    }

    private static double minutesBetween(Instant from, Instant to) {
        return Duration.between(from, to).toMillis() / 60_000.0;
    }

    private static double logistic(double x) {
        return 1.0 / (1.0 + Math.exp(-x));
    }

    private static double clamp(double v) {
        if (Double.isNaN(v)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, v));
    }
}
