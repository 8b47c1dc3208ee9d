package com.szwego.ecommerce.flink.job;

import com.szwego.ecommerce.flink.config.PipelineConfig;
import com.szwego.ecommerce.flink.function.CsvEventLineParser;
import com.szwego.ecommerce.flink.function.EcommerceEventDeserializer;
import com.szwego.ecommerce.flink.function.MicroBatchPostgresqlSink;
import com.szwego.ecommerce.flink.function.MicroBatchWindowFunction;
import com.szwego.ecommerce.flink.model.EcommerceEvent;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.connector.file.src.FileSource;
import org.apache.flink.connector.file.src.reader.TextLineInputFormat;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.core.fs.Path;
import org.apache.flink.streaming.api.CheckpointingMode;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.apache.flink.streaming.api.windowing.assigners.TumblingProcessingTimeWindows;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * 电商事件 → PostgreSQL 微批入库 Flink Job
 *
 * <p>链路: File(CSV 目录监控) | Kafka(JSON) → WindowAll(N s) → MicroBatch → PG stage + merge
 * <p>windowAll + sink 并行度 1: 批按 batch_id 顺序逐个提交
 */
public class EcommerceIngestJob {

    private static final Logger LOG = LoggerFactory.getLogger(EcommerceIngestJob.class);

    public static void main(String[] args) throws Exception {
        PipelineConfig config = PipelineConfig.fromEnv();
        StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();

        // Checkpoint 配置
        env.enableCheckpointing(config.getCheckpointIntervalMs(), CheckpointingMode.EXACTLY_ONCE);
        env.getCheckpointConfig().setCheckpointTimeout(60_000L);
        env.getCheckpointConfig().setMinPauseBetweenCheckpoints(5_000L);
        env.getCheckpointConfig().setMaxConcurrentCheckpoints(1);

        buildPipeline(env, config);

        LOG.info("Starting EcommerceIngestJob: {}", config);
        env.execute("EcommerceEventIngest");
    }

    static void buildPipeline(StreamExecutionEnvironment env, PipelineConfig config) {
        source(env, config)
            .filter(Objects::nonNull)
            .name("drop-unparseable")

            .windowAll(TumblingProcessingTimeWindows.of(Duration.ofSeconds(config.getWindowSeconds())))
            .process(new MicroBatchWindowFunction())
            .name("micro-batch")
            .uid("micro-batch-uid")

            .addSink(new MicroBatchPostgresqlSink(config))
            .name("pg-sink")
            .uid("pg-sink-uid")
            .setParallelism(1);
    }

    private static DataStream<EcommerceEvent> source(StreamExecutionEnvironment env, PipelineConfig config) {
        if (config.getSourceType() == PipelineConfig.SourceType.KAFKA) {
            KafkaSource<EcommerceEvent> kafkaSource = KafkaSource.<EcommerceEvent>builder()
                .setBootstrapServers(config.getKafkaBrokers())
                .setTopics(config.getKafkaTopic())
                .setGroupId("flink-ecommerce-ingest")
                .setStartingOffsets(OffsetsInitializer.committedOffsets(OffsetResetStrategy.EARLIEST))
                .setValueOnlyDeserializer(new EcommerceEventDeserializer())
                .build();
            return env.fromSource(kafkaSource, WatermarkStrategy.noWatermarks(), "Kafka-EcommerceEvents")
                .name("kafka-source")
                .uid("kafka-source-uid");
        }

        // 目录持续监控, 新文件按行读取
        FileSource<String> fileSource = FileSource
            .forRecordStreamFormat(new TextLineInputFormat(), new Path(config.getInputDir()))
            .monitorContinuously(Duration.ofSeconds(config.getFileMonitorSeconds()))
            .build();
        return env.fromSource(fileSource, WatermarkStrategy.noWatermarks(), "File-EcommerceEvents")
            .name("file-source")
            .uid("file-source-uid")
            .flatMap(new CsvEventLineParser())
            .name("csv-parse")
            .uid("csv-parse-uid");
    }
}
