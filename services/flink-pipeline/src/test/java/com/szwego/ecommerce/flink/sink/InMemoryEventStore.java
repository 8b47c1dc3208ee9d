package com.szwego.ecommerce.flink.sink;

import com.szwego.ecommerce.flink.model.EcommerceEvent;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 内存版 EventStore, 语义与 PostgresEventStore 一致 (stage 覆盖写, merge 按 event_id 忽略冲突)
 *
 * <p>故障注入: 接下来 N 次 stage / merge / drop 失败; merge 可以先写入部分行再失败
 */
public class InMemoryEventStore implements EventStore {

    private final Map<String, EcommerceEvent> target = new LinkedHashMap<>();
    private final Map<TableName, List<EcommerceEvent>> stagingTables = new HashMap<>();
    private final List<TableName> dropped = new ArrayList<>();

    private int stageFailures;
    private int mergeFailures;
    private int mergeRowsBeforeFailure;
    private int dropFailures;
    private int stageCalls;
    private int mergeCalls;

    public void failNextStages(int n) { this.stageFailures = n; }
    public void failNextDrops(int n) { this.dropFailures = n; }

    /** 接下来 n 次 merge: 先写入 rowsBeforeFailure 行, 然后失败 */
    public void failNextMerges(int n, int rowsBeforeFailure) {
        this.mergeFailures = n;
        this.mergeRowsBeforeFailure = rowsBeforeFailure;
    }

    @Override
    public int stage(TableName staging, TableName targetTable, List<EcommerceEvent> events)
            throws SQLException {
        stageCalls++;
        stagingTables.remove(staging);
        if (stageFailures > 0) {
            stageFailures--;
            throw new SQLException("injected stage failure");
        }
        stagingTables.put(staging, new ArrayList<>(events));
        return events.size();
    }

    @Override
    public int mergeIgnoringConflicts(TableName staging, TableName targetTable) throws SQLException {
        mergeCalls++;
        List<EcommerceEvent> rows = stagingTables.get(staging);
        if (rows == null) {
            throw new SQLException("relation " + staging + " does not exist");
        }
        int limit = mergeFailures > 0 ? Math.min(mergeRowsBeforeFailure, rows.size()) : rows.size();
        int inserted = 0;
        for (int i = 0; i < limit; i++) {
            EcommerceEvent e = rows.get(i);
            if (target.putIfAbsent(e.getEventId(), e) == null) {
                inserted++;
            }
        }
        if (mergeFailures > 0) {
            mergeFailures--;
            throw new SQLException("injected merge failure after " + inserted + " rows");
        }
        return inserted;
    }

    @Override
    public void dropIfExists(TableName table) throws SQLException {
        if (dropFailures > 0) {
            dropFailures--;
            throw new SQLException("injected drop failure");
        }
        stagingTables.remove(table);
        dropped.add(table);
    }

    public Map<String, EcommerceEvent> getTarget() { return target; }
    public Map<TableName, List<EcommerceEvent>> getStagingTables() { return stagingTables; }
    public List<TableName> getDropped() { return dropped; }
    public int getStageCalls() { return stageCalls; }
    public int getMergeCalls() { return mergeCalls; }
}
