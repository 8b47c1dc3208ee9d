package com.szwego.ecommerce.flink.batch;

public enum BatchOutcome {
    /** stage + merge 成功 (含全部 event_id 已存在的重投批) */
    COMMITTED,
    /** 校验拒绝 (结构 / 统计), 或记录级检查后没有剩余记录; 不重试 */
    REJECTED,
    /** 重试用尽或关闭时中止 */
    FAILED,
    /** 空批, 不计数 */
    EMPTY,
    /** 已关闭, 不再接收新批 */
    SKIPPED_SHUTDOWN
}
