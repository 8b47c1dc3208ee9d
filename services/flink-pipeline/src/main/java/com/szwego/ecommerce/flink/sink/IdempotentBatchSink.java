package com.szwego.ecommerce.flink.sink;

import com.szwego.ecommerce.flink.model.EcommerceEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.List;

/**
 * 幂等批写入: stage → merge → cleanup
 *
 * <p>目标存储只保证 at-least-once (一次尝试可能部分生效后失败, 整批也可能被上游重投)。
 * 每一步都可以安全重做:
 * <ul>
 *   <li>stage: 每次都删表重建, 覆盖写, 不追加</li>
 *   <li>merge: ON CONFLICT (event_id) DO NOTHING, 已存在的 event_id 零副作用</li>
 *   <li>cleanup: finally 中 DROP TABLE IF EXISTS, 失败只记日志</li>
 * </ul>
 * 不需要跨 stage/merge 的事务: 同一批写 N 次, 目标表对每个 event_id 收敛到恰好一行。
 */
public class IdempotentBatchSink {

    private static final Logger LOG = LoggerFactory.getLogger(IdempotentBatchSink.class);

    private final EventStore store;
    private final TableName target;

    public IdempotentBatchSink(EventStore store, TableName target) {
        this.store = store;
        this.target = target.requireStagingCapacity();
    }

    /**
     * @param events 已增强、已校验、已去重的记录
     * @throws SQLException stage / merge 失败 (可重试)
     */
    public SinkResult write(long batchId, List<EcommerceEvent> events) throws SQLException {
        TableName staging = target.stagingFor(batchId);
        try {
            int staged = store.stage(staging, target, events);
            LOG.debug("Batch {}: staged {} rows into {}", batchId, staged, staging);

            int inserted = store.mergeIgnoringConflicts(staging, target);
            SinkResult result = new SinkResult(batchId, staged, inserted);
            if (result.getAlreadyPresentRows() > 0) {
                LOG.info("Batch {}: {} of {} rows already present in {}, skipped",
                        batchId, result.getAlreadyPresentRows(), staged, target);
            }
            return result;
        } finally {
            cleanup(batchId, staging);
        }
    }

    private void cleanup(long batchId, TableName staging) {
        try {
            store.dropIfExists(staging);
        } catch (Exception e) {
            // 孤儿 staging 表只是清理欠账: 下一次同 batchId 的 stage 会先删表再重建
            LOG.warn("Batch {}: failed to drop staging table {}: {}",
                    batchId, staging, e.getMessage());
        }
    }
}
