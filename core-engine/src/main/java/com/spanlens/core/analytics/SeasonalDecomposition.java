package com.spanlens.core.analytics;

import com.spanlens.core.model.AnalyticsRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DayOfWeek;
import java.time.Month;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.ToIntFunction;

/**
 * Splits each entity's bucket counts into trend, seasonal and residual parts.
 *
 * <p>
 * An entity's records are ordered by {@code (year, month, dayOfWeek, hour)}
 * and treated as one series of opening counts.
 * </p>
 * <ul>
 * <li><b>trend</b>: centered moving average over {@value #TREND_WINDOW}
 * buckets, clipped at both ends of the series.</li>
 * <li><b>seasonal</b>: the sum, over day of week, month and hour, of the
 * bucket's group average minus the mean of all group averages.</li>
 * <li><b>residual</b>: {@code openingCount - (trend + seasonal)}.</li>
 * </ul>
 *
 * <p>
 * Buckets in July, and Monday buckets in May and September, additionally
 * carry a holiday adjustment of {@value #HOLIDAY_ADJUSTMENT}.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeasonalDecomposition {

    private static final Logger LOG = LoggerFactory.getLogger(SeasonalDecomposition.class);

    /** Buckets covered by the trend moving average. */
    static final int TREND_WINDOW = 24;

    static final double HOLIDAY_ADJUSTMENT = 0.3;

    private static final Comparator<AnalyticsRecord> TIME_ORDER = Comparator
            .comparingInt(AnalyticsRecord::getYear)
            .thenComparingInt(AnalyticsRecord::getMonth)
            .thenComparingInt(AnalyticsRecord::getDayOfWeek)
            .thenComparingInt(AnalyticsRecord::getHourOfDay);

    private SeasonalDecomposition() {
    }

    /**
     * Decompose every entity's series independently.
     *
     * @param records analytics records of any number of entities; must not be
     *                {@code null}
     * @return new records carrying the decomposition, grouped by entity in
     *         order of first appearance and time-ordered within an entity
     */
    public static List<AnalyticsRecord> decompose(List<AnalyticsRecord> records) {
        Objects.requireNonNull(records, "records must not be null");
        Map<String, List<AnalyticsRecord>> byEntity = new LinkedHashMap<>();
        for (AnalyticsRecord record : records) {
            if (record != null) {
                byEntity.computeIfAbsent(record.getEntityId(), k -> new ArrayList<>()).add(record);
            }
        }

        List<AnalyticsRecord> out = new ArrayList<>(records.size());
        byEntity.forEach((entityId, series) -> {
            out.addAll(decomposeEntity(series));
            LOG.debug("Decomposed {} bucket(s) of {}", series.size(), entityId);
        });
        return out;
    }

    private static List<AnalyticsRecord> decomposeEntity(List<AnalyticsRecord> records) {
        List<AnalyticsRecord> sorted = new ArrayList<>(records);
        sorted.sort(TIME_ORDER);

        double[] counts = new double[sorted.size()];
        for (int i = 0; i < counts.length; i++) {
            counts[i] = sorted.get(i).getOpeningCount();
        }
        double[] trend = centeredMovingAverage(counts, TREND_WINDOW / 2);

        GroupAverages weekly = new GroupAverages(sorted, AnalyticsRecord::getDayOfWeek);
        GroupAverages monthly = new GroupAverages(sorted, AnalyticsRecord::getMonth);
        GroupAverages hourly = new GroupAverages(sorted, AnalyticsRecord::getHourOfDay);

        List<AnalyticsRecord> out = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            AnalyticsRecord r = sorted.get(i);
            double w = weekly.average(r);
            double m = monthly.average(r);
            double h = hourly.average(r);
            double seasonal = (w - weekly.overall) + (m - monthly.overall) + (h - hourly.overall);
            out.add(r.toBuilder()
                    .decomposition(trend[i], seasonal, counts[i] - (trend[i] + seasonal))
                    .seasonality(w, m, h)
                    .holidayAdjustment(holidayAdjustment(r.getMonth(), r.getDayOfWeek()))
                    .build());
        }
        return out;
    }

    /**
     * Mean of {@code values[i - halfWindow .. i + halfWindow]}, clipped to the
     * array bounds.
     */
    static double[] centeredMovingAverage(double[] values, int halfWindow) {
        double[] prefix = new double[values.length + 1];
        for (int i = 0; i < values.length; i++) {
            prefix[i + 1] = prefix[i] + values[i];
        }
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            int from = Math.max(0, i - halfWindow);
            int to = Math.min(values.length - 1, i + halfWindow);
            out[i] = (prefix[to + 1] - prefix[from]) / (to - from + 1);
        }
        return out;
    }

    /**
     * Holiday uplift for a bucket: all of July, and the Mondays of May and
     * September.
     *
     * @param month        1-12
     * @param isoDayOfWeek 1 = Monday ... 7 = Sunday
     */
    static double holidayAdjustment(int month, int isoDayOfWeek) {
        boolean holidayMonday = isoDayOfWeek == DayOfWeek.MONDAY.getValue()
                && (month == Month.MAY.getValue() || month == Month.SEPTEMBER.getValue());
        return month == Month.JULY.getValue() || holidayMonday ? HOLIDAY_ADJUSTMENT : 0.0;
    }

    /** Average opening count per value of one calendar field. */
    private static final class GroupAverages {
        private final ToIntFunction<AnalyticsRecord> field;
        private final Map<Integer, Double> averages = new HashMap<>();
        private final double overall;

        GroupAverages(List<AnalyticsRecord> records, ToIntFunction<AnalyticsRecord> field) {
            this.field = field;
            Map<Integer, double[]> sums = new HashMap<>();
            for (AnalyticsRecord r : records) {
                double[] acc = sums.computeIfAbsent(field.applyAsInt(r), k -> new double[2]);
                acc[0] += r.getOpeningCount();
                acc[1]++;
            }
            double total = 0.0;
            for (Map.Entry<Integer, double[]> e : sums.entrySet()) {
                double avg = e.getValue()[0] / e.getValue()[1];
                averages.put(e.getKey(), avg);
                total += avg;
            }
            this.overall = averages.isEmpty() ? 0.0 : total / averages.size();
        }

        double average(AnalyticsRecord r) {
            return averages.getOrDefault(field.applyAsInt(r), overall);
        }
    }
}
