package com.szwego.ecommerce.flink.function;

import com.szwego.ecommerce.flink.batch.BatchOutcome;
import com.szwego.ecommerce.flink.batch.MicroBatchProcessor;
import com.szwego.ecommerce.flink.config.PipelineConfig;
import com.szwego.ecommerce.flink.model.EventBatch;
import com.szwego.ecommerce.flink.sink.IdempotentBatchSink;
import com.szwego.ecommerce.flink.sink.PostgresEventStore;
import com.szwego.ecommerce.flink.stats.IngestStatistics;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.micrometer.core.instrument.Metrics;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.sink.RichSinkFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

/**
 * PG Sink: 每个微批交给 MicroBatchProcessor (stage → merge, 带重试)
 *
 * <ul>
 *   <li>HikariCP 连接池, autoCommit=false, 事务由 PostgresEventStore 控制</li>
 *   <li>open() 时探活并检查目标表列, 不可达直接失败</li>
 *   <li>批失败只计入统计, 不抛出: 单批失败不应拖垮整个作业</li>
 * </ul>
 */
public class MicroBatchPostgresqlSink extends RichSinkFunction<EventBatch> {

    private static final Logger LOG = LoggerFactory.getLogger(MicroBatchPostgresqlSink.class);
    private static final long serialVersionUID = 1L;

    private final PipelineConfig config;
    private transient HikariDataSource dataSource;
    private transient MicroBatchProcessor processor;

    public MicroBatchPostgresqlSink(PipelineConfig config) {
        this.config = config;
    }

    @Override
    public void open(Configuration parameters) throws Exception {
        HikariConfig hikari = new HikariConfig();
        hikari.setJdbcUrl(config.getJdbcUrl());
        hikari.setUsername(config.getDbUser());
        hikari.setPassword(config.getDbPassword());
        hikari.setMinimumIdle(1);
        hikari.setMaximumPoolSize(3);
        hikari.setConnectionTimeout(5_000);          // 5s 获取连接超时
        hikari.setIdleTimeout(300_000);               // 5min
        hikari.setMaxLifetime(600_000);               // 10min
        hikari.setValidationTimeout(3_000);
        hikari.setConnectionTestQuery("SELECT 1");
        hikari.setAutoCommit(false);
        hikari.setPoolName("flink-ecommerce-pg");
        hikari.setLeakDetectionThreshold(60_000);     // 大批 stage 可能较慢

        dataSource = new HikariDataSource(hikari);
        LOG.info("HikariCP pool created: {} (min={}, max={})",
                config.getJdbcUrl(), hikari.getMinimumIdle(), hikari.getMaximumPoolSize());

        PostgresEventStore store = new PostgresEventStore(dataSource);
        store.verifyConnection();
        Set<String> missing = store.missingTargetColumns(config.getTargetTable());
        if (!missing.isEmpty()) {
            LOG.warn("Target table {} is missing columns {}; merges will fail until the schema is fixed",
                    config.getTargetTable(), missing);
        }

        IngestStatistics statistics = new IngestStatistics();
        statistics.bindTo(Metrics.globalRegistry);
        processor = new MicroBatchProcessor(config,
                new IdempotentBatchSink(store, config.getTargetTable()), statistics);
        LOG.info("Sink ready: {}", config);
    }

    @Override
    public void invoke(EventBatch batch, Context context) {
        BatchOutcome outcome = processor.process(batch);
        LOG.debug("Batch {} finished: {}", batch.getBatchId(), outcome);
    }

    @Override
    public void close() throws Exception {
        if (processor != null) {
            processor.shutdown();
        }
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            LOG.info("HikariCP pool closed");
        }
    }
}
