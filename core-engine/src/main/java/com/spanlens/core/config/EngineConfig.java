package com.spanlens.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Top-level POJO for the engine YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * analytics:
 *   minimumSampleSize: 10
 * cascade:
 *   windowMinMinutes: 30
 *   windowMaxMinutes: 90
 *   maxDistanceKm: 5.0
 * prediction:
 *   horizonMinutes: 60
 * </pre>
 *
 * <p>
 * Every section is optional; omitted values keep their defaults. Call
 * {@link #validate()} after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class EngineConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private AnalyticsSettings analytics = new AnalyticsSettings();
    private CascadeSettings cascade = new CascadeSettings();
    private PredictionSettings prediction = new PredictionSettings();

    /**
     * @return a configuration holding every default value
     */
    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    /**
     * Validate every section.
     *
     * <p>
     * Collects all errors and throws a single exception if any setting is
     * invalid.
     * </p>
     *
     * @throws IllegalStateException if one or more settings are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        analytics.collectErrors(errors);
        cascade.collectErrors(errors);
        prediction.collectErrors(errors);

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Engine configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    public AnalyticsSettings getAnalytics() {
        return analytics;
    }

    public void setAnalytics(AnalyticsSettings analytics) {
        this.analytics = analytics != null ? analytics : new AnalyticsSettings();
    }

    public CascadeSettings getCascade() {
        return cascade;
    }

    public void setCascade(CascadeSettings cascade) {
        this.cascade = cascade != null ? cascade : new CascadeSettings();
    }

    public PredictionSettings getPrediction() {
        return prediction;
    }

    public void setPrediction(PredictionSettings prediction) {
        this.prediction = prediction != null ? prediction : new PredictionSettings();
    }

    @Override
    public String toString() {
        return "EngineConfig{" + analytics + ", " + cascade + ", " + prediction + '}';
    }
}
