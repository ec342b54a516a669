package com.spanlens.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link CascadeRecord}.
 */
class CascadeRecordTest {

    private static final Instant T0 = Instant.parse("2024-06-03T08:00:00Z");

    private static CascadeRecord.Builder base() {
        return CascadeRecord.builder()
                .triggerEntityId("a")
                .triggerTime(T0)
                .targetEntityId("b")
                .targetTime(T0.plusSeconds(45 * 60))
                .strength(0.6)
                .strengthClass(CascadeStrength.MODERATE)
                .timing(CascadeTiming.DELAYED);
    }

    @Test
    @DisplayName("Should derive the delay from the open times")
    void shouldDeriveDelay() {
        CascadeRecord record = base().build();

        assertThat(record.getDelayMinutes()).isEqualTo(45.0);
        assertThat(record.getTriggerLabel()).isEqualTo("a");
    }

    @Test
    @DisplayName("Should reject self-cascades and non-positive delays")
    void shouldRejectInvalidRecords() {
        assertThatThrownBy(() -> base().targetEntityId("a").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must differ");
        assertThatThrownBy(() -> base().targetTime(T0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("after trigger");
        assertThatThrownBy(() -> base().strength(1.5).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("strength");
    }

    @Test
    @DisplayName("Should copy every field when re-classifying")
    void shouldCopyOnReclassify() {
        CascadeRecord original = base().labels("Ballard", "Fremont").distanceKm(2.1).build();
        CascadeRecord strong = original.withStrengthClass(CascadeStrength.STRONG);

        assertThat(strong.getStrengthClass()).isEqualTo(CascadeStrength.STRONG);
        assertThat(strong.getTargetLabel()).isEqualTo("Fremont");
        assertThat(strong.getDistanceKm()).isEqualTo(2.1);
        assertThat(strong).isEqualTo(original);
    }
}
