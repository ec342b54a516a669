package com.spanlens.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link EngineConfigLoader}.
 */
class EngineConfigLoaderTest {

    @Test
    @DisplayName("Should load overrides from classpath and keep defaults for the rest")
    void shouldLoadFromClasspath() {
        EngineConfig config = EngineConfigLoader.fromClasspath("test-engine.yml");

        assertThat(config.getAnalytics().getZoneId()).isEqualTo("Europe/Amsterdam");
        assertThat(config.getAnalytics().getMinimumSampleSize()).isEqualTo(5);
        assertThat(config.getCascade().getWindowMinMinutes()).isEqualTo(20.0);
        assertThat(config.getCascade().getWindowMaxMinutes()).isEqualTo(120.0);
        assertThat(config.getCascade().getMaxDistanceKm()).isEqualTo(3.5);
        assertThat(config.getCascade().getTemporalWeight()).isEqualTo(0.4);
        assertThat(config.getCascade().getCutPointQuantiles()).containsExactly(0.1, 0.5, 0.9);
        assertThat(config.getCascade().getImmediateThresholdMinutes()).isEqualTo(35.0);
        assertThat(config.getPrediction().getHorizonMinutes()).isEqualTo(30L);
        assertThat(config.getPrediction().getCascadeBoostCap()).isEqualTo(0.95);
    }

    @Test
    @DisplayName("Should load the bundled default resource")
    void shouldLoadBundledDefaults() {
        EngineConfig config = EngineConfigLoader.fromClasspath(EngineConfigLoader.DEFAULT_RESOURCE);

        assertThat(config.getCascade().getWindowMinMinutes()).isEqualTo(30.0);
        assertThat(config.getCascade().getWindowMaxMinutes()).isEqualTo(90.0);
        assertThat(config.getPrediction().getMinimumEvents()).isEqualTo(3);
        assertThat(config.getPrediction().getSingularityThreshold()).isEqualTo(1e-10);
    }

    @Test
    @DisplayName("Should report every invalid setting in one exception")
    void shouldFailFastOnInvalidSettings() {
        assertThatThrownBy(() -> EngineConfigLoader.fromClasspath("invalid-engine.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("validation failed")
                .hasMessageContaining("analytics.minimumSampleSize")
                .hasMessageContaining("cascade.windowMaxMinutes")
                .hasMessageContaining("sum to 1.0");
    }

    @Test
    @DisplayName("Should reject malformed YAML")
    void shouldRejectMalformedYaml() {
        assertThatThrownBy(() -> EngineConfigLoader.fromClasspath("malformed-engine.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Malformed engine config");
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> EngineConfigLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should throw when the config file does not exist")
    void shouldThrowForMissingFile() {
        assertThatThrownBy(() -> EngineConfigLoader.fromFile("/no/such/engine.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should validate the built-in defaults")
    void defaultsShouldBeValid() {
        EngineConfig config = EngineConfig.defaults();
        config.validate();

        assertThat(config.getCascade().getCutPointQuantiles()).isEqualTo(List.of(0.25, 0.5, 0.75));
    }

    @Test
    @DisplayName("Should reject cut-point quantiles that are not ascending")
    void shouldRejectDescendingQuantiles() {
        EngineConfig config = EngineConfig.defaults();
        config.getCascade().setCutPointQuantiles(List.of(0.75, 0.5, 0.25));

        assertThatThrownBy(config::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("cutPointQuantiles");
    }
}
