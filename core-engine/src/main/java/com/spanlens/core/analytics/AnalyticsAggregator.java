package com.spanlens.core.analytics;

import com.spanlens.core.CancellationToken;
import com.spanlens.core.config.AnalyticsSettings;
import com.spanlens.core.config.EngineConfig;
import com.spanlens.core.model.AnalyticsRecord;
import com.spanlens.core.model.SpanEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.time.DayOfWeek;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Folds raw span events into per-entity, per-time-bucket statistics.
 *
 * <p>
 * A bucket is {@code (entityId, year, month, dayOfWeek, hourOfDay)} of the
 * event's open time, evaluated in the configured zone (UTC by default).
 * Every well-formed event counts towards the bucket's opening count; only
 * events with a known duration feed the duration statistics.
 * </p>
 *
 * <h3>Derived values</h3>
 * <ul>
 * <li>{@code probabilityOfOpening}: the bucket's share of the entity's
 * openings across all buckets with the same day-of-week and hour.</li>
 * <li>{@code confidence}: {@code min(1, n / minimumSampleSize)}.</li>
 * <li>{@code expectedDuration}: the average known duration.</li>
 * </ul>
 *
 * <p>
 * The finished records are passed through {@link SeasonalDecomposition},
 * which fills in trend, seasonal, residual and holiday values.
 * </p>
 *
 * <h3>Thread safety</h3>
 * <p>
 * Immutable after construction; every call works on local state only.
 * </p>
 *
 * @since 1.0.0
 */
public class AnalyticsAggregator implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(AnalyticsAggregator.class);

    /** Events between two cancellation checks. */
    static final int CANCELLATION_CHECK_INTERVAL = 256;

    private static final Comparator<BucketKey> KEY_ORDER = Comparator
            .comparing((BucketKey k) -> k.entityId)
            .thenComparingInt(k -> k.year)
            .thenComparingInt(k -> k.month)
            .thenComparingInt(k -> k.dayOfWeek)
            .thenComparingInt(k -> k.hourOfDay);

    private final String zoneId;
    private final int minimumSampleSize;

    public AnalyticsAggregator() {
        this(new AnalyticsSettings());
    }

    public AnalyticsAggregator(EngineConfig config) {
        this(Objects.requireNonNull(config, "EngineConfig must not be null").getAnalytics());
    }

    /**
     * @param settings analytics settings
     * @throws NullPointerException     if {@code settings} is {@code null}
     * @throws IllegalArgumentException if the minimum sample size is not
     *                                  positive
     */
    public AnalyticsAggregator(AnalyticsSettings settings) {
        Objects.requireNonNull(settings, "AnalyticsSettings must not be null");
        if (settings.getMinimumSampleSize() < 1) {
            throw new IllegalArgumentException(
                    "minimumSampleSize must be >= 1, got: " + settings.getMinimumSampleSize());
        }
        this.zoneId = settings.zone().getId();
        this.minimumSampleSize = settings.getMinimumSampleSize();
    }

    /**
     * Aggregate a batch of events.
     *
     * @param events events in any order; must not be {@code null}
     * @return one record per non-empty bucket, sorted by bucket key
     */
    public List<AnalyticsRecord> aggregate(List<SpanEvent> events) {
        return aggregate(events, CancellationToken.NONE);
    }

    /**
     * Aggregate a batch of events, giving up with an empty result when
     * {@code cancellation} fires.
     *
     * @param events       events in any order; must not be {@code null}
     * @param cancellation cooperative cancellation token
     * @return one record per non-empty bucket, sorted by bucket key
     */
    public List<AnalyticsRecord> aggregate(List<SpanEvent> events, CancellationToken cancellation) {
        Objects.requireNonNull(events, "events must not be null");
        CancellationToken token = cancellation != null ? cancellation : CancellationToken.NONE;
        ZoneId zone = ZoneId.of(zoneId);

        Map<BucketKey, BucketStats> buckets = new TreeMap<>(KEY_ORDER);
        int skipped = 0;
        int seen = 0;
        for (SpanEvent event : events) {
            if (++seen % CANCELLATION_CHECK_INTERVAL == 0 && token.isCancelled()) {
                LOG.debug("Aggregation cancelled after {} of {} event(s)", seen, events.size());
                return Collections.emptyList();
            }
            if (event == null || event.isMalformed()) {
                skipped++;
                continue;
            }
            ZonedDateTime at = event.getOpenTime().atZone(zone);
            BucketKey key = new BucketKey(event.getEntityId(), at.getYear(), at.getMonthValue(),
                    at.getDayOfWeek().getValue(), at.getHour());
            buckets.computeIfAbsent(key, k -> new BucketStats(event.getEntityLabel())).add(event);
        }
        if (token.isCancelled()) {
            return Collections.emptyList();
        }
        if (skipped > 0) {
            LOG.debug("Skipped {} malformed event(s) during aggregation", skipped);
        }

        // openings per (entity, dayOfWeek, hour) across every year and month
        Map<SlotKey, Integer> slotTotals = new HashMap<>();
        buckets.forEach((key, stats) -> slotTotals.merge(key.slot(), stats.count, Integer::sum));

        List<AnalyticsRecord> records = new ArrayList<>(buckets.size());
        for (Map.Entry<BucketKey, BucketStats> entry : buckets.entrySet()) {
            records.add(toRecord(entry.getKey(), entry.getValue(), slotTotals.get(entry.getKey().slot())));
        }
        LOG.debug("Aggregated {} event(s) into {} bucket(s)", seen - skipped, records.size());
        return SeasonalDecomposition.decompose(records);
    }

    private AnalyticsRecord toRecord(BucketKey key, BucketStats stats, int slotTotal) {
        double average = stats.knownDurations > 0 ? stats.totalMinutes / stats.knownDurations : 0.0;
        double probability = slotTotal > 0 ? (double) stats.count / slotTotal : 0.0;
        double confidence = Math.min(1.0, (double) stats.count / minimumSampleSize);

        return AnalyticsRecord.builder()
                .entityId(key.entityId)
                .entityLabel(stats.label)
                .bucket(key.year, key.month, key.dayOfWeek, key.hourOfDay)
                .openingCount(stats.count)
                .totalMinutesOpen(stats.totalMinutes)
                .averageMinutesPerOpening(average)
                .longestMinutes(stats.knownDurations > 0 ? stats.longest : 0.0)
                .shortestMinutes(stats.knownDurations > 0 ? stats.shortest : 0.0)
                .probabilityOfOpening(probability)
                .expectedDuration(average)
                .confidence(confidence)
                .patterns(isWeekend(key.dayOfWeek), isRushHour(key.dayOfWeek, key.hourOfDay),
                        isSummer(key.month))
                .build();
    }

    // ---------------------------------------------------------------
    // Seasonal pattern flags
    // ---------------------------------------------------------------

    static boolean isWeekend(int isoDayOfWeek) {
        return isoDayOfWeek == DayOfWeek.SATURDAY.getValue() || isoDayOfWeek == DayOfWeek.SUNDAY.getValue();
    }

    /** Weekday mornings 07:00-09:59 and evenings 16:00-18:59. */
    static boolean isRushHour(int isoDayOfWeek, int hourOfDay) {
        if (isWeekend(isoDayOfWeek)) {
            return false;
        }
        return (hourOfDay >= 7 && hourOfDay <= 9) || (hourOfDay >= 16 && hourOfDay <= 18);
    }

    /** May through September. */
    static boolean isSummer(int month) {
        return month >= 5 && month <= 9;
    }

    // ---------------------------------------------------------------
    // Internal accumulators
    // ---------------------------------------------------------------

    private static final class BucketKey {
        final String entityId;
        final int year;
        final int month;
        final int dayOfWeek;
        final int hourOfDay;

        BucketKey(String entityId, int year, int month, int dayOfWeek, int hourOfDay) {
            this.entityId = entityId;
            this.year = year;
            this.month = month;
            this.dayOfWeek = dayOfWeek;
            this.hourOfDay = hourOfDay;
        }

        SlotKey slot() {
            return new SlotKey(entityId, dayOfWeek, hourOfDay);
        }
    }

    private static final class SlotKey {
        final String entityId;
        final int dayOfWeek;
        final int hourOfDay;

        SlotKey(String entityId, int dayOfWeek, int hourOfDay) {
            this.entityId = entityId;
            this.dayOfWeek = dayOfWeek;
            this.hourOfDay = hourOfDay;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof SlotKey that))
                return false;
            return dayOfWeek == that.dayOfWeek && hourOfDay == that.hourOfDay && entityId.equals(that.entityId);
        }

        @Override
        public int hashCode() {
            return Objects.hash(entityId, dayOfWeek, hourOfDay);
        }
    }

    private static final class BucketStats {
        final String label;
        int count;
        int knownDurations;
        double totalMinutes;
        double longest = Double.NEGATIVE_INFINITY;
        double shortest = Double.POSITIVE_INFINITY;

        BucketStats(String label) {
            this.label = label;
        }

        void add(SpanEvent event) {
            count++;
            if (event.hasKnownDuration()) {
                double d = event.getDurationMinutes();
                knownDurations++;
                totalMinutes += d;
                longest = Math.max(longest, d);
                shortest = Math.min(shortest, d);
            }
        }
    }
}
