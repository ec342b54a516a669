package com.spanlens.core.analytics;

import com.spanlens.core.model.AnalyticsRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Plain-language observations about an entity's seasonal patterns, drawn
 * from the average opening probability of its analytics buckets.
 *
 * @since 1.0.0
 */
public final class SeasonalInsights {

    /** Weekend buckets must beat weekday buckets by this factor. */
    static final double WEEKEND_RATIO = 1.2;
    /** Summer buckets must beat the rest of the year by this factor. */
    static final double SUMMER_RATIO = 1.1;
    /** Rush-hour buckets below this average probability count as quiet. */
    static final double QUIET_RUSH_HOUR = 0.1;

    private SeasonalInsights() {
    }

    /**
     * @param entityId entity to describe
     * @param records  analytics records; records of other entities are
     *                 ignored
     * @return zero or more insights, weekend first, then summer, then rush
     *         hour
     */
    public static List<String> generate(String entityId, List<AnalyticsRecord> records) {
        Objects.requireNonNull(entityId, "entityId must not be null");
        Objects.requireNonNull(records, "records must not be null");
        List<AnalyticsRecord> own = new ArrayList<>();
        for (AnalyticsRecord r : records) {
            if (r != null && entityId.equals(r.getEntityId())) {
                own.add(r);
            }
        }

        List<String> insights = new ArrayList<>();
        double weekend = averageProbability(own, AnalyticsRecord::isWeekendPattern);
        double weekday = averageProbability(own, r -> !r.isWeekendPattern());
        if (weekday > 0 && weekend > weekday * WEEKEND_RATIO) {
            insights.add("Weekend openings are " + percentAbove(weekend, weekday)
                    + "% more frequent than weekdays");
        }

        double summer = averageProbability(own, AnalyticsRecord::isSummerPattern);
        double rest = averageProbability(own, r -> !r.isSummerPattern());
        if (rest > 0 && summer > rest * SUMMER_RATIO) {
            insights.add("Summer months show " + percentAbove(summer, rest) + "% increase in activity");
        }

        double rushHour = averageProbability(own, AnalyticsRecord::isRushHourPattern);
        if (!Double.isNaN(rushHour) && rushHour < QUIET_RUSH_HOUR) {
            insights.add("Activity is significantly reduced during rush hours");
        }
        return insights;
    }

    private static int percentAbove(double value, double base) {
        return (int) ((value / base - 1) * 100);
    }

    /** @return the mean probability of matching records, NaN when none match */
    private static double averageProbability(List<AnalyticsRecord> records, Predicate<AnalyticsRecord> filter) {
        return records.stream()
                .filter(filter)
                .mapToDouble(AnalyticsRecord::getProbabilityOfOpening)
                .average()
                .orElse(Double.NaN);
    }
}
