package com.supplysentinel.flink;

import com.supplysentinel.core.ensemble.AnomalyEnsemble;
import com.supplysentinel.core.model.AnomalyAlert;
import com.supplysentinel.core.model.TelemetryEvent;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.connector.kafka.sink.KafkaSink;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.streaming.api.CheckpointingMode;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.CheckpointConfig;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Main entry point for the Supply Sentinel Flink job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Kafka (telemetry topic)
 *     -&gt; Deserialize JSON -&gt; TelemetryEvent
 *     -&gt; Count windows of SCORING_BATCH_SIZE records
 *     -&gt; EnsembleScoringFunction (trained ensemble, one batch per window)
 *     -&gt; Serialize AnomalyAlert -&gt; JSON
 *     -&gt; Kafka (anomalies topic)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * All configuration is resolved from environment variables via
 * {@link JobConfig}. The ensemble itself comes from the YAML roster and the
 * bundle written by {@link EnsembleTrainer}; both are checked before the job
 * is submitted.
 * </p>
 *
 * @since 1.0.0
 */
public final class SupplySentinelJob {

        private static final Logger LOG = LoggerFactory.getLogger(SupplySentinelJob.class);

        private SupplySentinelJob() {
                // entry-point class, not instantiable
        }

        public static void main(String[] args) throws Exception {
                // 1. Load configuration
                JobConfig config = JobConfig.fromEnvironment();
                LOG.info("Starting Supply Sentinel with config: {}", config);

                // 2. Fail fast on a missing or mismatched bundle before submitting
                AnomalyEnsemble ensemble = EnsembleBootstrap.loadFitted(
                                config.getEnsembleConfigPath(), config.getEnsembleBundlePath());

                // 3. Start health server (for K8s probes) with shutdown hook
                HealthServer healthServer = new HealthServer(ensemble);
                healthServer.start(config.getHealthPort());
                Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                        healthServer.stop();
                        ensemble.close();
                }, "health-shutdown"));

                // 4. Set up Flink execution environment
                StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
                env.setParallelism(config.getParallelism());
                configureCheckpointing(env, config);

                // 5. Build pipeline
                buildPipeline(env, config);

                // 6. Execute
                env.execute("Supply Sentinel - Ensemble Anomaly Detection");
        }

        // ---------------------------------------------------------------
        // Pipeline assembly
        // ---------------------------------------------------------------

        /**
         * Build the full Kafka -&gt; Flink -&gt; Kafka pipeline.
         */
        static void buildPipeline(StreamExecutionEnvironment env, JobConfig config) {
                KafkaSource<TelemetryEvent> kafkaSource = KafkaSource.<TelemetryEvent>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setTopics(config.getKafkaInputTopic())
                                .setGroupId(config.getKafkaGroupId())
                                .setStartingOffsets(OffsetsInitializer.earliest())
                                .setDeserializer(new TelemetryDeserializationSchema(config.getKeyField()))
                                .build();

                DataStream<TelemetryEvent> telemetry = env.fromSource(
                                kafkaSource,
                                WatermarkStrategy.noWatermarks(),
                                "kafka-telemetry-source");

                // per-batch normalization: the whole batch goes through one function instance
                DataStream<AnomalyAlert> alerts = telemetry
                                .countWindowAll(config.getBatchSize())
                                .process(new EnsembleScoringFunction(config))
                                .name("ensemble-scoring");

                KafkaSink<AnomalyAlert> kafkaSink = KafkaSink.<AnomalyAlert>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setRecordSerializer(new AlertSerializationSchema(config.getKafkaAlertTopic()))
                                .build();

                alerts.sinkTo(kafkaSink).name("kafka-anomalies-sink");
        }

        // ---------------------------------------------------------------
        // Helpers
        // ---------------------------------------------------------------

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
