package com.spanlens.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link Forecast}.
 */
class ForecastTest {

    private static Forecast.Builder base() {
        return Forecast.builder()
                .entityId("bridge-1")
                .probability(0.5)
                .expectedDurationMinutes(10)
                .confidence(0.7)
                .modelTier(ComputeTier.STANDARD)
                .rationale("test")
                .horizonMinutes(60)
                .generatedAt(Instant.parse("2024-06-03T08:00:00Z"));
    }

    @Test
    @DisplayName("Should reject probability and confidence outside [0, 1]")
    void shouldRejectOutOfRangeValues() {
        assertThatThrownBy(() -> base().probability(1.2).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("probability");
        assertThatThrownBy(() -> base().confidence(-0.1).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("confidence");
        assertThatThrownBy(() -> base().expectedDurationMinutes(-1).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("expectedDurationMinutes");
    }

    @Test
    @DisplayName("Should map probability and confidence to display levels")
    void shouldMapLevels() {
        assertThat(base().probability(0.1).build().getProbabilityLevel())
                .isEqualTo(Forecast.ProbabilityLevel.VERY_LOW);
        assertThat(base().probability(0.5).build().getProbabilityLevel())
                .isEqualTo(Forecast.ProbabilityLevel.MODERATE);
        assertThat(base().probability(0.9).build().getProbabilityLevel())
                .isEqualTo(Forecast.ProbabilityLevel.VERY_HIGH);
        assertThat(base().confidence(0.5).build().getConfidenceLevel())
                .isEqualTo(Forecast.ConfidenceLevel.LOW);
        assertThat(base().confidence(0.85).build().getConfidenceLevel())
                .isEqualTo(Forecast.ConfidenceLevel.HIGH);
    }

    @Test
    @DisplayName("Should report a cascade boost only when a boosting entity is set")
    void shouldReportCascadeBoost() {
        assertThat(base().build().isCascadeBoosted()).isFalse();
        assertThat(base().boostingEntityId("bridge-2").build().isCascadeBoosted()).isTrue();
    }
}
