package com.szwego.ecommerce.flink.stats;

import java.time.Duration;

public class StatisticsSnapshot {

    private final long batchesProcessed;
    private final long batchesFailed;
    private final long recordsProcessed;
    private final long recordsFailed;
    private final Duration elapsed;

    public StatisticsSnapshot(long batchesProcessed, long batchesFailed,
                              long recordsProcessed, long recordsFailed, Duration elapsed) {
        this.batchesProcessed = batchesProcessed;
        this.batchesFailed = batchesFailed;
        this.recordsProcessed = recordsProcessed;
        this.recordsFailed = recordsFailed;
        this.elapsed = elapsed;
    }

    public long getBatchesProcessed() { return batchesProcessed; }
    public long getBatchesFailed() { return batchesFailed; }
    public long getRecordsProcessed() { return recordsProcessed; }
    public long getRecordsFailed() { return recordsFailed; }
    public Duration getElapsed() { return elapsed; }

    /** records/sec, 耗时下限 1s 防止除零 */
    public double getThroughput() {
        double seconds = Math.max(elapsed.toMillis() / 1000.0, 1.0);
        return recordsProcessed / seconds;
    }

    /** 0..1; 还没有任何记录时为 0 */
    public double getSuccessRate() {
        long total = recordsProcessed + recordsFailed;
        return total == 0 ? 0.0 : (double) recordsProcessed / total;
    }

    @Override
    public String toString() {
        return "StatisticsSnapshot{batchesOk=" + batchesProcessed + ", batchesFailed=" + batchesFailed
            + ", recordsOk=" + recordsProcessed + ", recordsFailed=" + recordsFailed
            + ", elapsed=" + elapsed + "}";
    }
}
