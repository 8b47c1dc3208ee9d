package com.szwego.ecommerce.flink.stats;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 进程级累计统计 (批次 / 记录 成功与失败)
 *
 * <p>单写多读: 只有驱动批处理的线程写入; 报表线程和 Micrometer gauge 只读
 * <p>纯观测, 不影响控制流
 */
public class IngestStatistics implements MeterBinder {

    private static final Logger LOG = LoggerFactory.getLogger(IngestStatistics.class);

    private final Clock clock;
    private final Instant startTime;

    private final AtomicLong batchesProcessed = new AtomicLong();
    private final AtomicLong batchesFailed = new AtomicLong();
    private final AtomicLong recordsProcessed = new AtomicLong();
    private final AtomicLong recordsFailed = new AtomicLong();

    public IngestStatistics() {
        this(Clock.systemUTC());
    }

    public IngestStatistics(Clock clock) {
        this.clock = clock;
        this.startTime = clock.instant();
    }

    /** 一批写入成功, recordCount 为实际持久化的记录数 */
    public void recordSuccess(int recordCount) {
        batchesProcessed.incrementAndGet();
        recordsProcessed.addAndGet(recordCount);
    }

    /** 一批被拒绝或重试用尽, 整批记录计为失败 */
    public void recordFailure(int recordCount) {
        batchesFailed.incrementAndGet();
        recordsFailed.addAndGet(recordCount);
    }

    /** 已接受批次内被记录级校验丢弃的记录 */
    public void recordDroppedRecords(long recordCount) {
        recordsFailed.addAndGet(recordCount);
    }

    public StatisticsSnapshot snapshot() {
        return new StatisticsSnapshot(
                batchesProcessed.get(), batchesFailed.get(),
                recordsProcessed.get(), recordsFailed.get(),
                Duration.between(startTime, clock.instant()));
    }

    public void logSummary(String title) {
        StatisticsSnapshot s = snapshot();
        LOG.info("=== {} (Runtime: {}) ===", title, s.getElapsed());
        LOG.info("Total batches processed: {}", s.getBatchesProcessed());
        LOG.info("Total batches failed: {}", s.getBatchesFailed());
        LOG.info("Total records processed: {}", s.getRecordsProcessed());
        LOG.info("Total records failed: {}", s.getRecordsFailed());
        LOG.info("Success rate: {}%", String.format("%.2f", s.getSuccessRate() * 100));
        LOG.info("Average records/second: {}", String.format("%.2f", s.getThroughput()));
        LOG.info("=== END {} ===", title);
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        Gauge.builder("ingest.batches.processed", batchesProcessed, AtomicLong::get)
                .description("Micro-batches committed to the target table")
                .register(registry);
        Gauge.builder("ingest.batches.failed", batchesFailed, AtomicLong::get)
                .description("Micro-batches rejected or failed after retries")
                .register(registry);
        Gauge.builder("ingest.records.processed", recordsProcessed, AtomicLong::get)
                .description("Records persisted")
                .register(registry);
        Gauge.builder("ingest.records.failed", recordsFailed, AtomicLong::get)
                .description("Records dropped or lost with a failed batch")
                .register(registry);
    }
}
