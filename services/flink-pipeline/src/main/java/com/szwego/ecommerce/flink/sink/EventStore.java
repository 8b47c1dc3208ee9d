package com.szwego.ecommerce.flink.sink;

import com.szwego.ecommerce.flink.model.EcommerceEvent;

import java.sql.SQLException;
import java.util.List;

/**
 * stage-then-merge 协议依赖的最小存储操作
 *
 * <p>每次调用都可能部分生效后失败 (at-least-once), 由调用方整体重试
 */
public interface EventStore {

    /**
     * 覆盖写入 staging 表: 先删再建 (列布局与目标表一致), 再批量插入; 从不追加
     *
     * @return 写入 staging 的行数
     */
    int stage(TableName staging, TableName target, List<EcommerceEvent> events) throws SQLException;

    /**
     * INSERT INTO target SELECT ... FROM staging ON CONFLICT (event_id) DO NOTHING
     *
     * @return 实际新插入目标表的行数
     */
    int mergeIgnoringConflicts(TableName staging, TableName target) throws SQLException;

    /** DROP TABLE IF EXISTS */
    void dropIfExists(TableName table) throws SQLException;
}
