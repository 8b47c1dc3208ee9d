package com.szwego.ecommerce.flink.sink;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * stage / merge SQL 生成
 */
@Tag("unit")
class PostgresEventStoreTest {

    private static final TableName TARGET = TableName.parse("ecommerce_events");
    private static final TableName STAGING = TARGET.stagingFor(5L);

    @Test
    void columnsIncludeDerivedFields() {
        List<String> cols = PostgresEventStore.columnNames();
        assertEquals(18, cols.size());
        assertEquals("event_id", cols.get(0));
        assertTrue(cols.contains("price_category"));
        assertTrue(cols.contains("device_type"));
        assertFalse(cols.contains("created_at"));
    }

    @Test
    void stagingCopiesTargetColumnTypes() {
        String sql = PostgresEventStore.createStagingSql(STAGING, TARGET);
        assertTrue(sql.startsWith("CREATE UNLOGGED TABLE \"public\".\"ecommerce_events_staging_5\""));
        assertTrue(sql.contains("FROM \"public\".\"ecommerce_events\""));
        assertTrue(sql.endsWith("WITH NO DATA"));
    }

    @Test
    void mergeIgnoresConflictsOnEventId() {
        String sql = PostgresEventStore.mergeSql(STAGING, TARGET);
        assertTrue(sql.startsWith("INSERT INTO \"public\".\"ecommerce_events\" (\"event_id\""));
        assertTrue(sql.contains("FROM \"public\".\"ecommerce_events_staging_5\""));
        assertTrue(sql.endsWith("ON CONFLICT (\"event_id\") DO NOTHING"));
        assertFalse(sql.contains("DO UPDATE"));
    }

    @Test
    void insertHasOnePlaceholderPerColumn() {
        String sql = PostgresEventStore.insertSql(STAGING);
        long placeholders = sql.chars().filter(c -> c == '?').count();
        assertEquals(PostgresEventStore.columnNames().size(), placeholders);
    }

    @Test
    void dropIsIdempotent() {
        assertEquals("DROP TABLE IF EXISTS \"public\".\"ecommerce_events_staging_5\"",
                PostgresEventStore.dropSql(STAGING));
    }
}
