package com.spanlens.core.cascade;

import com.spanlens.core.model.CascadeRecord;
import com.spanlens.core.model.CascadeStrength;
import com.spanlens.core.model.CascadeTiming;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link CascadeInsights}.
 */
class CascadeInsightsTest {

    private static final Instant T0 = Instant.parse("2024-06-03T08:00:00Z");

    static CascadeRecord cascade(String trigger, String target, long offsetMinutes, long delayMinutes,
            double strength) {
        Instant triggerTime = T0.plusSeconds(offsetMinutes * 60);
        return CascadeRecord.builder()
                .triggerEntityId(trigger)
                .triggerTime(triggerTime)
                .targetEntityId(target)
                .targetTime(triggerTime.plusSeconds(delayMinutes * 60))
                .labels(trigger + " Bridge", target + " Bridge")
                .strength(strength)
                .strengthClass(CascadeStrength.MODERATE)
                .timing(delayMinutes < 35 ? CascadeTiming.IMMEDIATE : CascadeTiming.DELAYED)
                .build();
    }

    private static List<CascadeRecord> cascades() {
        return List.of(
                cascade("A", "B", 0, 30, 0.8),
                cascade("A", "B", 600, 32, 0.8),
                cascade("A", "C", 1200, 60, 0.6),
                cascade("C", "A", 1800, 50, 0.4));
    }

    @Test
    @DisplayName("Should summarise influence and susceptibility of an entity")
    void shouldBuildProfile() {
        CascadeProfile profile = CascadeInsights.profile("A", cascades());

        assertThat(profile.getTriggeredCount()).isEqualTo(3);
        assertThat(profile.getReceivedCount()).isEqualTo(1);
        assertThat(profile.getInfluence()).isCloseTo(2.2 / 3, within(1e-9));
        assertThat(profile.getSusceptibility()).isCloseTo(0.4, within(1e-9));
        assertThat(profile.getPrimaryTargetId()).isEqualTo("B");
        assertThat(profile.getPrimaryTriggerId()).isEqualTo("C");
        assertThat(profile.getAverageDelayToPrimaryTarget()).isCloseTo(31.0, within(1e-9));
        assertThat(profile.getImmediateShare()).isCloseTo(2.0 / 3, within(1e-9));
    }

    @Test
    @DisplayName("Should describe high influence, primary partners and immediate responses")
    void shouldDescribeProfile() {
        List<String> insights = CascadeInsights.profile("A", cascades()).describe();

        assertThat(insights).anyMatch(s -> s.contains("High cascade influence"));
        assertThat(insights).anyMatch(s -> s.contains("Most frequently triggers B Bridge (2 cascade events)"));
        assertThat(insights).anyMatch(s -> s.contains("Most frequently triggered by C Bridge"));
        assertThat(insights).anyMatch(s -> s.contains("immediate"));
        assertThat(insights).noneMatch(s -> s.contains("High cascade susceptibility"));
    }

    @Test
    @DisplayName("Should return an empty profile for an uninvolved entity")
    void shouldReturnEmptyProfile() {
        CascadeProfile profile = CascadeInsights.profile("Z", cascades());

        assertThat(profile.getInfluence()).isZero();
        assertThat(profile.getSusceptibility()).isZero();
        assertThat(profile.getPrimaryTargetId()).isNull();
        assertThat(profile.describe()).isEmpty();
    }
}
