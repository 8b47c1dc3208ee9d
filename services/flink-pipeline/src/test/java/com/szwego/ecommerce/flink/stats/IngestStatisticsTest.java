package com.szwego.ecommerce.flink.stats;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class IngestStatisticsTest {

    private static final Instant START = Instant.parse("2024-03-01T00:00:00Z");

    @Test
    void countersAccumulate() {
        IngestStatistics stats = new IngestStatistics(Clock.fixed(START, ZoneOffset.UTC));
        stats.recordSuccess(10);
        stats.recordSuccess(5);
        stats.recordFailure(4);
        stats.recordDroppedRecords(1);

        StatisticsSnapshot s = stats.snapshot();
        assertEquals(2, s.getBatchesProcessed());
        assertEquals(1, s.getBatchesFailed());
        assertEquals(15, s.getRecordsProcessed());
        assertEquals(5, s.getRecordsFailed());
        assertEquals(0.75, s.getSuccessRate(), 1e-9);
    }

    @Test
    void throughputFloorsElapsedAtOneSecond() {
        IngestStatistics stats = new IngestStatistics(Clock.fixed(START, ZoneOffset.UTC));
        stats.recordSuccess(7);
        assertEquals(Duration.ZERO, stats.snapshot().getElapsed());
        assertEquals(7.0, stats.snapshot().getThroughput(), 1e-9);
    }

    @Test
    void throughputOverElapsedTime() {
        StatisticsSnapshot s = new StatisticsSnapshot(1, 0, 100, 0, Duration.ofSeconds(20));
        assertEquals(5.0, s.getThroughput(), 1e-9);
    }

    @Test
    void successRateZeroWithoutRecords() {
        assertEquals(0.0, new IngestStatistics().snapshot().getSuccessRate());
    }

    @Test
    void gaugesReflectCounters() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        IngestStatistics stats = new IngestStatistics();
        stats.bindTo(registry);

        stats.recordSuccess(3);
        stats.recordFailure(2);

        assertEquals(1.0, registry.get("ingest.batches.processed").gauge().value());
        assertEquals(1.0, registry.get("ingest.batches.failed").gauge().value());
        assertEquals(3.0, registry.get("ingest.records.processed").gauge().value());
        assertEquals(2.0, registry.get("ingest.records.failed").gauge().value());
    }

    @Test
    void logSummaryDoesNotThrow() {
        IngestStatistics stats = new IngestStatistics();
        stats.recordSuccess(1);
        assertDoesNotThrow(() -> stats.logSummary("TEST SUMMARY"));
    }
}
