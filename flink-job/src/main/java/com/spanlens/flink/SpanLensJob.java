package com.spanlens.flink;

import com.spanlens.core.config.EngineConfig;
import com.spanlens.core.config.EngineConfigLoader;
import com.spanlens.core.model.CascadeRecord;
import com.spanlens.core.model.Forecast;
import com.spanlens.core.model.SpanEvent;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.connector.kafka.sink.KafkaRecordSerializationSchema;
import org.apache.flink.connector.kafka.sink.KafkaSink;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.streaming.api.CheckpointingMode;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.CheckpointConfig;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.apache.flink.streaming.api.windowing.assigners.TumblingEventTimeWindows;
import org.apache.flink.streaming.api.windowing.time.Time;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Main entry point for the Span Lens Flink job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Kafka (span-events topic)
 *     -&gt; Deserialize JSON -&gt; SpanEvent
 *     +-&gt; Key by entity id
 *     |     -&gt; ForecastProcessFunction -&gt; Kafka (forecasts topic)
 *     +-&gt; Tumbling event-time window (all entities)
 *           -&gt; CascadeWindowFunction -&gt; Kafka (cascades topic)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Job wiring is resolved from environment variables via {@link JobConfig};
 * engine tunables come from the YAML file loaded by
 * {@link EngineConfigLoader}.
 * </p>
 *
 * <h3>Checkpointing</h3>
 * <p>
 * Exactly-once checkpointing keeps the per-entity span history consistent
 * across failures.
 * </p>
 *
 * @since 1.0.0
 */
public final class SpanLensJob {

        private static final Logger LOG = LoggerFactory.getLogger(SpanLensJob.class);

        /** Span events may arrive this far behind the newest open time seen. */
        private static final Duration MAX_OUT_OF_ORDERNESS = Duration.ofMinutes(5);

        private SpanLensJob() {
                // entry-point class, not instantiable
        }

        public static void main(String[] args) throws Exception {
                // 1. Load configuration
                JobConfig config = JobConfig.fromEnvironment();
                LOG.info("Starting Span Lens with config: {}", config);

                // 2. Load engine tunables
                EngineConfig engineConfig = loadEngineConfig(config);
                LOG.info("Loaded engine configuration: {}", engineConfig);

                // 3. Start health server (for K8s health checks) with shutdown hook
                HealthServer healthServer = new HealthServer(config.getComputeTier());
                healthServer.start(config.getHealthPort());
                Runtime.getRuntime().addShutdownHook(new Thread(healthServer::stop, "health-shutdown"));

                // 4. Set up Flink execution environment
                StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
                env.setParallelism(config.getParallelism());
                configureCheckpointing(env, config);

                // 5. Build pipeline
                buildPipeline(env, config, engineConfig);
                healthServer.markReady();

                // 6. Execute
                env.execute("Span Lens - Forecasts and Cascades");
        }

        // ---------------------------------------------------------------
        // Pipeline assembly
        // ---------------------------------------------------------------

        /**
         * Build the Kafka -&gt; Flink -&gt; Kafka pipeline with its forecasting
         * and cascade branches.
         */
        static void buildPipeline(StreamExecutionEnvironment env,
                        JobConfig config,
                        EngineConfig engineConfig) {
                KafkaSource<SpanEvent> kafkaSource = KafkaSource.<SpanEvent>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setTopics(config.getKafkaInputTopic())
                                .setGroupId(config.getKafkaGroupId())
                                .setStartingOffsets(OffsetsInitializer.earliest())
                                .setValueOnlyDeserializer(new SpanEventDeserializationSchema())
                                .build();

                DataStream<SpanEvent> events = env.fromSource(
                                kafkaSource,
                                WatermarkStrategy.<SpanEvent>forBoundedOutOfOrderness(MAX_OUT_OF_ORDERNESS)
                                                .withTimestampAssigner((event, ts) -> event.getOpenTime().toEpochMilli())
                                                .withIdleness(Duration.ofMinutes(1)),
                                "kafka-span-events-source")
                                .filter(Objects::nonNull) // drop deserialization failures
                                .name("drop-invalid-spans");

                // Forecasting branch: one history per entity
                DataStream<Forecast> forecasts = events
                                .keyBy(SpanEvent::getEntityId)
                                .process(new ForecastProcessFunction(
                                                engineConfig, config.getComputeTier(), config.getHistorySize()))
                                .name("forecasting");

                forecasts.sinkTo(resultSink(config, config.getKafkaForecastTopic(),
                                new ResultSerializationSchema<Forecast>()))
                                .name("kafka-forecasts-sink");

                // Cascade branch: every entity in one event-time window
                DataStream<CascadeRecord> cascades = events
                                .windowAll(TumblingEventTimeWindows.of(Time.minutes(config.getCascadeWindowMinutes())))
                                .process(new CascadeWindowFunction(engineConfig))
                                .name("cascade-detection");

                cascades.sinkTo(resultSink(config, config.getKafkaCascadeTopic(),
                                new ResultSerializationSchema<CascadeRecord>()))
                                .name("kafka-cascades-sink");
        }

        // ---------------------------------------------------------------
        // Helpers
        // ---------------------------------------------------------------

        private static <T> KafkaSink<T> resultSink(JobConfig config, String topic,
                        ResultSerializationSchema<T> serializer) {
                return KafkaSink.<T>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setKafkaProducerConfig(config.kafkaProducerProperties())
                                .setRecordSerializer(
                                                KafkaRecordSerializationSchema.<T>builder()
                                                                .setTopic(topic)
                                                                .setValueSerializationSchema(serializer)
                                                                .build())
                                .build();
        }

        private static EngineConfig loadEngineConfig(JobConfig config) {
                String path = config.getEngineConfigPath();
                if (path != null && !path.isBlank()) {
                        return EngineConfigLoader.fromFile(path);
                }
                return EngineConfigLoader.load();
        }

        private static void configureCheckpointing(StreamExecutionEnvironment env, JobConfig config) {
                long interval = config.getCheckpointIntervalMs();
                env.enableCheckpointing(interval, CheckpointingMode.EXACTLY_ONCE);

                CheckpointConfig cpConfig = env.getCheckpointConfig();
                cpConfig.setMinPauseBetweenCheckpoints(interval / 2);
                cpConfig.setCheckpointTimeout(interval * 2);
                cpConfig.setMaxConcurrentCheckpoints(1);
                // Retain checkpoints on cancellation so state can be restored
                cpConfig.setExternalizedCheckpointCleanup(
                                CheckpointConfig.ExternalizedCheckpointCleanup.RETAIN_ON_CANCELLATION);
        }
}
