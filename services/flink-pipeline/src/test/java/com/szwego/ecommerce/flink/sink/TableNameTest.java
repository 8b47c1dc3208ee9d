package com.szwego.ecommerce.flink.sink;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class TableNameTest {

    @Test
    void unqualifiedUsesPublicSchema() {
        TableName t = TableName.parse("ecommerce_events");
        assertEquals("public", t.getSchema());
        assertEquals("ecommerce_events", t.getTable());
        assertEquals("\"public\".\"ecommerce_events\"", t.quoted());
    }

    @Test
    void qualifiedNameIsLowerCased() {
        TableName t = TableName.parse("Ecommerce.Events");
        assertEquals("ecommerce.events", t.toString());
    }

    @Test
    void stagingNameCarriesBatchId() {
        TableName staging = TableName.parse("ecommerce.events").stagingFor(1700000000000L);
        assertEquals("ecommerce", staging.getSchema());
        assertEquals("events_staging_1700000000000", staging.getTable());
        assertEquals(staging, TableName.parse("ecommerce.events").stagingFor(1700000000000L));
    }

    @Test
    void negativeBatchIdRejected() {
        TableName t = TableName.parse("events");
        assertThrows(IllegalArgumentException.class, () -> t.stagingFor(-1));
    }

    @Test
    void injectionRejected() {
        assertThrows(IllegalArgumentException.class, () -> TableName.parse("events; DROP TABLE x"));
        assertThrows(IllegalArgumentException.class, () -> TableName.parse("ev\"ents"));
        assertThrows(IllegalArgumentException.class, () -> TableName.parse("1events"));
        assertThrows(IllegalArgumentException.class, () -> TableName.parse(""));
        assertThrows(IllegalArgumentException.class, () -> TableName.parse("a.b.c"));
    }

    @Test
    void stagingCapacityCoversLargestBatchId() {
        TableName fits = TableName.parse("t".repeat(35));
        assertSame(fits, fits.requireStagingCapacity());
        assertEquals(63, fits.stagingFor(Long.MAX_VALUE).getTable().length());

        TableName tooLong = TableName.parse("ecommerce_events_clickstream_archive_2024_q1");
        assertThrows(IllegalArgumentException.class, tooLong::requireStagingCapacity);
    }

    @Test
    void overlongIdentifierRejected() {
        String name = "t".repeat(TableName.MAX_IDENTIFIER_LENGTH - 5);
        TableName t = TableName.parse(name);
        assertThrows(IllegalArgumentException.class, () -> t.stagingFor(123L));
    }
}
