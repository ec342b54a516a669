package com.spanlens.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Statistics for one entity within one time bucket
 * {@code (year, month, dayOfWeek, hourOfDay)}.
 *
 * <p>
 * Records are derived wholesale by the analytics aggregator; only buckets
 * with at least one observation are materialized.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. Probability and confidence must lie in
 * {@code [0, 1]}; duration statistics must be non-negative.
 * </p>
 *
 * <h3>Decomposition</h3>
 * <p>
 * The trend, seasonal and residual components split the bucket's opening
 * count so that {@code openingCount == trend + seasonal + residual}. They
 * stay zero until the seasonal decomposition has run over the entity's
 * records.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnalyticsRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String entityId;
    private final String entityLabel;
    private final int year;
    private final int month;
    /** ISO-8601 day of week, 1 = Monday ... 7 = Sunday. */
    private final int dayOfWeek;
    private final int hourOfDay;

    private final int openingCount;
    private final double totalMinutesOpen;
    private final double averageMinutesPerOpening;
    private final double longestMinutes;
    private final double shortestMinutes;

    private final double probabilityOfOpening;
    private final double expectedDuration;
    private final double confidence;

    private final boolean weekendPattern;
    private final boolean rushHourPattern;
    private final boolean summerPattern;

    private final double trendComponent;
    private final double seasonalComponent;
    private final double residualComponent;
    private final double weeklySeasonality;
    private final double monthlySeasonality;
    private final double hourlySeasonality;
    private final double holidayAdjustment;

    private AnalyticsRecord(Builder b) {
        this.entityId = Objects.requireNonNull(b.entityId, "entityId must not be null");
        this.entityLabel = b.entityLabel != null ? b.entityLabel : b.entityId;
        this.year = b.year;
        this.month = b.month;
        this.dayOfWeek = b.dayOfWeek;
        this.hourOfDay = b.hourOfDay;
        this.openingCount = b.openingCount;
        this.totalMinutesOpen = b.totalMinutesOpen;
        this.averageMinutesPerOpening = b.averageMinutesPerOpening;
        this.longestMinutes = b.longestMinutes;
        this.shortestMinutes = b.shortestMinutes;
        this.probabilityOfOpening = b.probabilityOfOpening;
        this.expectedDuration = b.expectedDuration;
        this.confidence = b.confidence;
        this.weekendPattern = b.weekendPattern;
        this.rushHourPattern = b.rushHourPattern;
        this.summerPattern = b.summerPattern;
        this.trendComponent = b.trendComponent;
        this.seasonalComponent = b.seasonalComponent;
        this.residualComponent = b.residualComponent;
        this.weeklySeasonality = b.weeklySeasonality;
        this.monthlySeasonality = b.monthlySeasonality;
        this.hourlySeasonality = b.hourlySeasonality;
        this.holidayAdjustment = b.holidayAdjustment;

        requireUnit(probabilityOfOpening, "probabilityOfOpening");
        requireUnit(confidence, "confidence");
        if (expectedDuration < 0) {
            throw new IllegalArgumentException("expectedDuration must be >= 0, got: " + expectedDuration);
        }
        if (openingCount < 1) {
            throw new IllegalArgumentException("openingCount must be >= 1, got: " + openingCount);
        }
        if (holidayAdjustment < 0) {
            throw new IllegalArgumentException("holidayAdjustment must be >= 0, got: " + holidayAdjustment);
        }
    }

    private static void requireUnit(double value, String name) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new IllegalArgumentException(name + " must be in [0, 1], got: " + value);
        }
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-filled with every value of this record
     */
    public Builder toBuilder() {
        Builder b = new Builder();
        b.entityId = entityId;
        b.entityLabel = entityLabel;
        b.year = year;
        b.month = month;
        b.dayOfWeek = dayOfWeek;
        b.hourOfDay = hourOfDay;
        b.openingCount = openingCount;
        b.totalMinutesOpen = totalMinutesOpen;
        b.averageMinutesPerOpening = averageMinutesPerOpening;
        b.longestMinutes = longestMinutes;
        b.shortestMinutes = shortestMinutes;
        b.probabilityOfOpening = probabilityOfOpening;
        b.expectedDuration = expectedDuration;
        b.confidence = confidence;
        b.weekendPattern = weekendPattern;
        b.rushHourPattern = rushHourPattern;
        b.summerPattern = summerPattern;
        b.trendComponent = trendComponent;
        b.seasonalComponent = seasonalComponent;
        b.residualComponent = residualComponent;
        b.weeklySeasonality = weeklySeasonality;
        b.monthlySeasonality = monthlySeasonality;
        b.hourlySeasonality = hourlySeasonality;
        b.holidayAdjustment = holidayAdjustment;
        return b;
    }

    /**
     * Fluent builder for {@link AnalyticsRecord}.
     */
    public static class Builder {
        private String entityId;
        private String entityLabel;
        private int year;
        private int month;
        private int dayOfWeek;
        private int hourOfDay;
        private int openingCount;
        private double totalMinutesOpen;
        private double averageMinutesPerOpening;
        private double longestMinutes;
        private double shortestMinutes;
        private double probabilityOfOpening;
        private double expectedDuration;
        private double confidence;
        private boolean weekendPattern;
        private boolean rushHourPattern;
        private boolean summerPattern;
        private double trendComponent;
        private double seasonalComponent;
        private double residualComponent;
        private double weeklySeasonality;
        private double monthlySeasonality;
        private double hourlySeasonality;
        private double holidayAdjustment;

        public Builder entityId(String v) {
            this.entityId = v;
            return this;
        }

        public Builder entityLabel(String v) {
            this.entityLabel = v;
            return this;
        }

        public Builder bucket(int year, int month, int dayOfWeek, int hourOfDay) {
            this.year = year;
            this.month = month;
            this.dayOfWeek = dayOfWeek;
            this.hourOfDay = hourOfDay;
            return this;
        }

        public Builder openingCount(int v) {
            this.openingCount = v;
            return this;
        }

        public Builder totalMinutesOpen(double v) {
            this.totalMinutesOpen = v;
            return this;
        }

        public Builder averageMinutesPerOpening(double v) {
            this.averageMinutesPerOpening = v;
            return this;
        }

        public Builder longestMinutes(double v) {
            this.longestMinutes = v;
            return this;
        }

        public Builder shortestMinutes(double v) {
            this.shortestMinutes = v;
            return this;
        }

        public Builder probabilityOfOpening(double v) {
            this.probabilityOfOpening = v;
            return this;
        }

        public Builder expectedDuration(double v) {
            this.expectedDuration = v;
            return this;
        }

        public Builder confidence(double v) {
            this.confidence = v;
            return this;
        }

        public Builder patterns(boolean weekend, boolean rushHour, boolean summer) {
            this.weekendPattern = weekend;
            this.rushHourPattern = rushHour;
            this.summerPattern = summer;
            return this;
        }

        public Builder decomposition(double trend, double seasonal, double residual) {
            this.trendComponent = trend;
            this.seasonalComponent = seasonal;
            this.residualComponent = residual;
            return this;
        }

        /**
         * Group averages behind the seasonal component: the mean opening
         * count of the bucket's day of week, month and hour.
         */
        public Builder seasonality(double weekly, double monthly, double hourly) {
            this.weeklySeasonality = weekly;
            this.monthlySeasonality = monthly;
            this.hourlySeasonality = hourly;
            return this;
        }

        public Builder holidayAdjustment(double v) {
            this.holidayAdjustment = v;
            return this;
        }

        /**
         * @return a validated {@link AnalyticsRecord}
         * @throws NullPointerException     if {@code entityId} is {@code null}
         * @throws IllegalArgumentException if a statistic is out of range
         */
        public AnalyticsRecord build() {
            return new AnalyticsRecord(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    /**
     * @return stable bucket identifier {@code entity-year-month-dow-hour}
     */
    public String getId() {
        return entityId + "-" + year + "-" + month + "-" + dayOfWeek + "-" + hourOfDay;
    }

    public String getEntityId() {
        return entityId;
    }

    public String getEntityLabel() {
        return entityLabel;
    }

    public int getYear() {
        return year;
    }

    public int getMonth() {
        return month;
    }

    public int getDayOfWeek() {
        return dayOfWeek;
    }

    public int getHourOfDay() {
        return hourOfDay;
    }

    public int getOpeningCount() {
        return openingCount;
    }

    public double getTotalMinutesOpen() {
        return totalMinutesOpen;
    }

    public double getAverageMinutesPerOpening() {
        return averageMinutesPerOpening;
    }

    public double getLongestMinutes() {
        return longestMinutes;
    }

    public double getShortestMinutes() {
        return shortestMinutes;
    }

    public double getProbabilityOfOpening() {
        return probabilityOfOpening;
    }

    public double getExpectedDuration() {
        return expectedDuration;
    }

    public double getConfidence() {
        return confidence;
    }

    public boolean isWeekendPattern() {
        return weekendPattern;
    }

    public boolean isRushHourPattern() {
        return rushHourPattern;
    }

    public boolean isSummerPattern() {
        return summerPattern;
    }

    public double getTrendComponent() {
        return trendComponent;
    }

    public double getSeasonalComponent() {
        return seasonalComponent;
    }

    public double getResidualComponent() {
        return residualComponent;
    }

    public double getWeeklySeasonality() {
        return weeklySeasonality;
    }

    public double getMonthlySeasonality() {
        return monthlySeasonality;
    }

    public double getHourlySeasonality() {
        return hourlySeasonality;
    }

    /**
     * @return expected relative uplift of the bucket on holiday periods,
     *         {@code 0.3} for +30%
     */
    public double getHolidayAdjustment() {
        return holidayAdjustment;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnalyticsRecord that))
            return false;
        return year == that.year
                && month == that.month
                && dayOfWeek == that.dayOfWeek
                && hourOfDay == that.hourOfDay
                && openingCount == that.openingCount
                && Double.compare(totalMinutesOpen, that.totalMinutesOpen) == 0
                && Double.compare(longestMinutes, that.longestMinutes) == 0
                && Double.compare(shortestMinutes, that.shortestMinutes) == 0
                && Double.compare(probabilityOfOpening, that.probabilityOfOpening) == 0
                && Double.compare(confidence, that.confidence) == 0
                && entityId.equals(that.entityId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityId, year, month, dayOfWeek, hourOfDay, openingCount,
                totalMinutesOpen, probabilityOfOpening, confidence);
    }

    @Override
    public String toString() {
        return "AnalyticsRecord{" +
                "id='" + getId() + '\'' +
                ", openingCount=" + openingCount +
                ", averageMinutesPerOpening=" + averageMinutesPerOpening +
                ", probabilityOfOpening=" + probabilityOfOpening +
                ", confidence=" + confidence +
                ", trend=" + trendComponent +
                ", seasonal=" + seasonalComponent +
                ", residual=" + residualComponent +
                '}';
    }
}
