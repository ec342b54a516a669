package com.spanlens.flink;

import com.spanlens.core.model.ComputeTier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JobConfig}.
 */
class JobConfigTest {

    @Test
    @DisplayName("Should apply defaults when nothing is overridden")
    void shouldApplyDefaults() {
        JobConfig config = new JobConfig.Builder().build();

        assertThat(config.getKafkaInputTopic()).isEqualTo("span-events");
        assertThat(config.getKafkaForecastTopic()).isEqualTo("forecasts");
        assertThat(config.getKafkaCascadeTopic()).isEqualTo("cascades");
        assertThat(config.getComputeTier()).isEqualTo(ComputeTier.STANDARD);
        assertThat(config.getHistorySize()).isEqualTo(500);
        assertThat(config.getCascadeWindowMinutes()).isEqualTo(360);
        assertThat(config.getHealthPort()).isEqualTo(8080);
    }

    @Test
    @DisplayName("Should fall back to STANDARD when the tier is null")
    void shouldDefaultNullTier() {
        JobConfig config = new JobConfig.Builder().computeTier(null).build();

        assertThat(config.getComputeTier()).isEqualTo(ComputeTier.STANDARD);
    }

    @Test
    @DisplayName("Should reject out-of-range values")
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> new JobConfig.Builder().parallelism(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("parallelism");
        assertThatThrownBy(() -> new JobConfig.Builder().historySize(2).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("historySize");
        assertThatThrownBy(() -> new JobConfig.Builder().cascadeWindowMinutes(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("cascadeWindowMinutes");
        assertThatThrownBy(() -> new JobConfig.Builder().healthPort(70_000).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("healthPort");
    }

    @Test
    @DisplayName("Should reject blank topic names")
    void shouldRejectBlankTopics() {
        assertThatThrownBy(() -> new JobConfig.Builder().kafkaCascadeTopic(" ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("kafkaCascadeTopic");
    }

    @Test
    @DisplayName("Should expose the bootstrap servers in producer properties")
    void shouldBuildProducerProperties() {
        JobConfig config = new JobConfig.Builder().kafkaBootstrapServers("broker:29092").build();

        assertThat(config.kafkaProducerProperties().getProperty("bootstrap.servers"))
                .isEqualTo("broker:29092");
    }
}
