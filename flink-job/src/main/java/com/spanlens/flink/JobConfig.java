package com.spanlens.flink;

import com.spanlens.core.model.ComputeTier;

import java.io.Serializable;
import java.util.Objects;
import java.util.Properties;

/**
 * Typed, immutable configuration object for the Span Lens Flink job.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the job is configurable through Deployment env vars, Docker {@code -e}
 * flags or a shell environment. Engine tunables (windows, weights, model
 * settings) live in the YAML file named by {@code ENGINE_CONFIG_PATH}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    // ---------------------------------------------------------------
    // Kafka
    // ---------------------------------------------------------------
    private final String kafkaBootstrapServers;
    private final String kafkaInputTopic;
    private final String kafkaForecastTopic;
    private final String kafkaCascadeTopic;
    private final String kafkaGroupId;

    // ---------------------------------------------------------------
    // Flink
    // ---------------------------------------------------------------
    private final int parallelism;
    private final long checkpointIntervalMs;

    // ---------------------------------------------------------------
    // Engines
    // ---------------------------------------------------------------
    private final String engineConfigPath;
    private final ComputeTier computeTier;
    private final int historySize;
    private final long cascadeWindowMinutes;

    // ---------------------------------------------------------------
    // Health / Metrics
    // ---------------------------------------------------------------
    private final int healthPort;

    private JobConfig(Builder b) {
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.kafkaInputTopic = b.kafkaInputTopic;
        this.kafkaForecastTopic = b.kafkaForecastTopic;
        this.kafkaCascadeTopic = b.kafkaCascadeTopic;
        this.kafkaGroupId = b.kafkaGroupId;
        this.parallelism = b.parallelism;
        this.checkpointIntervalMs = b.checkpointIntervalMs;
        this.engineConfigPath = b.engineConfigPath;
        this.computeTier = b.computeTier;
        this.historySize = b.historySize;
        this.cascadeWindowMinutes = b.cascadeWindowMinutes;
        this.healthPort = b.healthPort;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static JobConfig fromEnvironment() {
        try {
            return new Builder()
                    .kafkaBootstrapServers(env("KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"))
                    .kafkaInputTopic(env("KAFKA_INPUT_TOPIC", "span-events"))
                    .kafkaForecastTopic(env("KAFKA_FORECAST_TOPIC", "forecasts"))
                    .kafkaCascadeTopic(env("KAFKA_CASCADE_TOPIC", "cascades"))
                    .kafkaGroupId(env("KAFKA_GROUP_ID", "span-lens"))
                    .parallelism(parseIntEnv("FLINK_PARALLELISM", "1"))
                    .checkpointIntervalMs(parseLongEnv("FLINK_CHECKPOINT_INTERVAL_MS", "60000"))
                    .engineConfigPath(env("ENGINE_CONFIG_PATH", ""))
                    .computeTier(ComputeTier.parse(env("COMPUTE_TIER", "STANDARD")))
                    .historySize(parseIntEnv("HISTORY_SIZE", "500"))
                    .cascadeWindowMinutes(parseLongEnv("CASCADE_WINDOW_MINUTES", "360"))
                    .healthPort(parseIntEnv("HEALTH_PORT", "8080"))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Kafka properties helpers
    // ---------------------------------------------------------------

    /**
     * Build Kafka producer {@link Properties}.
     *
     * @return new Properties instance configured for production
     */
    public Properties kafkaProducerProperties() {
        Properties props = new Properties();
        props.setProperty("bootstrap.servers", kafkaBootstrapServers);
        props.setProperty("transaction.timeout.ms", "900000");
        return props;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getKafkaInputTopic() {
        return kafkaInputTopic;
    }

    public String getKafkaForecastTopic() {
        return kafkaForecastTopic;
    }

    public String getKafkaCascadeTopic() {
        return kafkaCascadeTopic;
    }

    public String getKafkaGroupId() {
        return kafkaGroupId;
    }

    public int getParallelism() {
        return parallelism;
    }

    public long getCheckpointIntervalMs() {
        return checkpointIntervalMs;
    }

    public String getEngineConfigPath() {
        return engineConfigPath;
    }

    public ComputeTier getComputeTier() {
        return computeTier;
    }

    /**
     * @return most recent events kept per entity for forecasting
     */
    public int getHistorySize() {
        return historySize;
    }

    public long getCascadeWindowMinutes() {
        return cascadeWindowMinutes;
    }

    public int getHealthPort() {
        return healthPort;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * The {@link #build()} method validates that all values are within legal
     * ranges (parallelism &gt; 0, checkpoint interval &gt; 0, history of at
     * least three events, positive cascade window, port in [1, 65535],
     * non-blank topic names).
     * </p>
     */
    public static class Builder {
        private String kafkaBootstrapServers = "localhost:9092";
        private String kafkaInputTopic = "span-events";
        private String kafkaForecastTopic = "forecasts";
        private String kafkaCascadeTopic = "cascades";
        private String kafkaGroupId = "span-lens";
        private int parallelism = 1;
        private long checkpointIntervalMs = 60_000;
        private String engineConfigPath = "";
        private ComputeTier computeTier = ComputeTier.STANDARD;
        private int historySize = 500;
        private long cascadeWindowMinutes = 360;
        private int healthPort = 8080;

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v;
            return this;
        }

        public Builder kafkaInputTopic(String v) {
            this.kafkaInputTopic = v;
            return this;
        }

        public Builder kafkaForecastTopic(String v) {
            this.kafkaForecastTopic = v;
            return this;
        }

        public Builder kafkaCascadeTopic(String v) {
            this.kafkaCascadeTopic = v;
            return this;
        }

        public Builder kafkaGroupId(String v) {
            this.kafkaGroupId = v;
            return this;
        }

        public Builder parallelism(int v) {
            this.parallelism = v;
            return this;
        }

        public Builder checkpointIntervalMs(long v) {
            this.checkpointIntervalMs = v;
            return this;
        }

        public Builder engineConfigPath(String v) {
            this.engineConfigPath = v;
            return this;
        }

        public Builder computeTier(ComputeTier v) {
            this.computeTier = v;
            return this;
        }

        public Builder historySize(int v) {
            this.historySize = v;
            return this;
        }

        public Builder cascadeWindowMinutes(long v) {
            this.cascadeWindowMinutes = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            Objects.requireNonNull(kafkaBootstrapServers, "kafkaBootstrapServers required");
            requireNonBlank(kafkaInputTopic, "kafkaInputTopic");
            requireNonBlank(kafkaForecastTopic, "kafkaForecastTopic");
            requireNonBlank(kafkaCascadeTopic, "kafkaCascadeTopic");
            requireNonBlank(kafkaGroupId, "kafkaGroupId");
            if (computeTier == null) {
                computeTier = ComputeTier.STANDARD;
            }

            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
            }
            if (checkpointIntervalMs < 1) {
                throw new IllegalArgumentException(
                        "checkpointIntervalMs must be >= 1, got: " + checkpointIntervalMs);
            }
            if (historySize < 3) {
                throw new IllegalArgumentException("historySize must be >= 3, got: " + historySize);
            }
            if (cascadeWindowMinutes < 1) {
                throw new IllegalArgumentException(
                        "cascadeWindowMinutes must be >= 1, got: " + cascadeWindowMinutes);
            }
            if (healthPort < 1 || healthPort > 65_535) {
                throw new IllegalArgumentException(
                        "healthPort must be in [1, 65535], got: " + healthPort);
            }

            return new JobConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static int parseIntEnv(String name, String defaultValue) {
        return Integer.parseInt(env(name, defaultValue));
    }

    private static long parseLongEnv(String name, String defaultValue) {
        return Long.parseLong(env(name, defaultValue));
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "kafkaBootstrapServers='" + kafkaBootstrapServers + '\'' +
                ", kafkaInputTopic='" + kafkaInputTopic + '\'' +
                ", kafkaForecastTopic='" + kafkaForecastTopic + '\'' +
                ", kafkaCascadeTopic='" + kafkaCascadeTopic + '\'' +
                ", kafkaGroupId='" + kafkaGroupId + '\'' +
                ", parallelism=" + parallelism +
                ", checkpointIntervalMs=" + checkpointIntervalMs +
                ", computeTier=" + computeTier +
                ", historySize=" + historySize +
                ", cascadeWindowMinutes=" + cascadeWindowMinutes +
                ", healthPort=" + healthPort +
                '}';
    }
}
