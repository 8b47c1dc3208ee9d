package com.szwego.ecommerce.flink.batch;

import com.szwego.ecommerce.flink.config.PipelineConfig;
import com.szwego.ecommerce.flink.dedup.BatchDeduplicator;
import com.szwego.ecommerce.flink.model.DeviceType;
import com.szwego.ecommerce.flink.model.EcommerceEvent;
import com.szwego.ecommerce.flink.model.EventBatch;
import com.szwego.ecommerce.flink.retry.RetryController;
import com.szwego.ecommerce.flink.retry.RetryOutcome;
import com.szwego.ecommerce.flink.sink.IdempotentBatchSink;
import com.szwego.ecommerce.flink.sink.SinkResult;
import com.szwego.ecommerce.flink.stats.IngestStatistics;
import com.szwego.ecommerce.flink.stats.StatisticsSnapshot;
import com.szwego.ecommerce.flink.transform.EventEnricher;
import com.szwego.ecommerce.flink.validate.BatchValidator;
import com.szwego.ecommerce.flink.validate.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 每个微批的回调: enrich → validate → dedup → retry(stage → merge → cleanup) → 统计
 *
 * <p>上游按批顺序同步调用, 第 N 批结束 (成功或重试用尽) 后才会开始第 N+1 批
 * <p>shutdown(): 正在进行的尝试跑完, 不再安排新的重试, 之后的批直接跳过
 */
public class MicroBatchProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(MicroBatchProcessor.class);
    private static final int SAMPLE_ROWS = 3;

    private final EventEnricher enricher = new EventEnricher();
    private final BatchValidator validator;
    private final BatchDeduplicator deduplicator = new BatchDeduplicator();
    private final RetryController retryController;
    private final IdempotentBatchSink sink;
    private final IngestStatistics statistics;
    private final int reportIntervalBatches;
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    public MicroBatchProcessor(PipelineConfig config, IdempotentBatchSink sink,
                               IngestStatistics statistics) {
        this(config, sink, statistics, d -> Thread.sleep(d.toMillis()));
    }

    public MicroBatchProcessor(PipelineConfig config, IdempotentBatchSink sink,
                               IngestStatistics statistics, RetryController.Sleeper sleeper) {
        this.validator = new BatchValidator(config.getPriceCeiling());
        this.retryController = new RetryController(config.getMaxAttempts(),
                Duration.ofMillis(config.getBaseBackoffMs()), sleeper, shutdown::get);
        this.sink = sink;
        this.statistics = statistics;
        this.reportIntervalBatches = config.getReportIntervalBatches();
    }

    public BatchOutcome process(EventBatch batch) {
        long batchId = batch.getBatchId();
        if (shutdown.get()) {
            LOG.warn("Batch {}: processor is shut down, skipping {} records", batchId, batch.size());
            return BatchOutcome.SKIPPED_SHUTDOWN;
        }
        if (batch.isEmpty()) {
            LOG.info("Batch {}: No records to process", batchId);
            return BatchOutcome.EMPTY;
        }

        long startNanos = System.nanoTime();
        int recordCount = batch.size();
        LOG.info("Batch {}: Processing {} records", batchId, recordCount);

        List<EcommerceEvent> enriched = enricher.enrich(batch.getEvents());
        ValidationResult validation = validator.validate(new EventBatch(batchId, enriched));
        if (!validation.isAccepted()) {
            LOG.error("Batch {}: Failed quality validation: {} (price stats {})",
                    batchId, validation.getReason(), validation.getPriceStats());
            statistics.recordFailure(recordCount);
            reportIfDue();
            return BatchOutcome.REJECTED;
        }

        List<EcommerceEvent> unique = deduplicator.deduplicate(validation.getRetained());
        if (unique.isEmpty()) {
            LOG.error("Batch {}: No valid records left after record-level checks ({} dropped)",
                    batchId, validation.getDroppedCount());
            statistics.recordFailure(recordCount);
            reportIfDue();
            return BatchOutcome.REJECTED;
        }
        logBatchProfile(batchId, unique);

        AtomicReference<SinkResult> written = new AtomicReference<>();
        RetryOutcome outcome = retryController.execute("Batch " + batchId,
                attempt -> written.set(sink.write(batchId, unique)));

        if (!outcome.isSuccess()) {
            LOG.error("Batch {}: {} after {} attempts, {} records lost",
                    batchId, outcome.getState(), outcome.getAttempts(), recordCount);
            statistics.recordFailure(recordCount);
            reportIfDue();
            return BatchOutcome.FAILED;
        }

        statistics.recordSuccess(unique.size());
        statistics.recordDroppedRecords(validation.getDroppedCount());

        double seconds = Math.max((System.nanoTime() - startNanos) / 1e9, 1e-3);
        LOG.info("Batch {}: Successfully wrote {} records in {}s ({} records/sec) {}",
                batchId, unique.size(), String.format("%.2f", seconds),
                String.format("%.2f", unique.size() / seconds), written.get());
        reportIfDue();
        return BatchOutcome.COMMITTED;
    }

    /** 外部关闭信号; 幂等 */
    public void shutdown() {
        if (shutdown.compareAndSet(false, true)) {
            LOG.info("MicroBatchProcessor shutting down");
            statistics.logSummary("FINAL STATISTICS");
        }
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    private void reportIfDue() {
        if (reportIntervalBatches <= 0) return;
        StatisticsSnapshot s = statistics.snapshot();
        long total = s.getBatchesProcessed() + s.getBatchesFailed();
        if (total > 0 && total % reportIntervalBatches == 0) {
            statistics.logSummary("PERIODIC SUMMARY");
        }
    }

    private void logBatchProfile(long batchId, List<EcommerceEvent> events) {
        if (!LOG.isInfoEnabled()) return;
        LOG.info("Batch {} statistics: event types {}, categories {}, devices {}",
                batchId,
                distribution(events, EcommerceEvent::getEventType),
                distribution(events, EcommerceEvent::getCategory),
                distribution(events, e -> e.getDeviceType() == null
                        ? DeviceType.UNKNOWN.getLabel() : e.getDeviceType().getLabel()));
        if (LOG.isDebugEnabled()) {
            events.stream().limit(SAMPLE_ROWS)
                    .forEach(e -> LOG.debug("Batch {} sample: {}", batchId, e));
        }
    }

    private static Map<String, Long> distribution(List<EcommerceEvent> events,
                                                  Function<EcommerceEvent, String> key) {
        return events.stream().collect(Collectors.groupingBy(
                e -> String.valueOf(key.apply(e)), TreeMap::new, Collectors.counting()));
    }
}
