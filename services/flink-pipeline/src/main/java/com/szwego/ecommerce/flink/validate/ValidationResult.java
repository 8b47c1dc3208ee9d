package com.szwego.ecommerce.flink.validate;

import com.szwego.ecommerce.flink.model.EcommerceEvent;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 批次校验结果: 无论接受或拒绝, 都带上价格统计与空值/重复计数
 */
public class ValidationResult {

    private final boolean accepted;
    private final String reason;
    private final PriceStats priceStats;
    private final Map<String, Long> nullCounts;
    private final long nullDroppedCount;
    private final long duplicateCount;
    private final long invalidCount;
    private final List<EcommerceEvent> retained;

    private ValidationResult(boolean accepted, String reason, PriceStats priceStats,
                             Map<String, Long> nullCounts, long nullDroppedCount,
                             long duplicateCount, long invalidCount,
                             List<EcommerceEvent> retained) {
        this.accepted = accepted;
        this.reason = reason;
        this.priceStats = priceStats;
        this.nullCounts = Collections.unmodifiableMap(nullCounts);
        this.nullDroppedCount = nullDroppedCount;
        this.duplicateCount = duplicateCount;
        this.invalidCount = invalidCount;
        this.retained = Collections.unmodifiableList(retained);
    }

    static ValidationResult accepted(PriceStats priceStats, Map<String, Long> nullCounts,
                                     long nullDroppedCount, long duplicateCount,
                                     long invalidCount, List<EcommerceEvent> retained) {
        return new ValidationResult(true, null, priceStats, nullCounts,
                nullDroppedCount, duplicateCount, invalidCount, retained);
    }

    static ValidationResult rejected(String reason, PriceStats priceStats,
                                     Map<String, Long> nullCounts, long nullDroppedCount,
                                     long duplicateCount) {
        return new ValidationResult(false, reason, priceStats, nullCounts,
                nullDroppedCount, duplicateCount, 0, List.of());
    }

    public boolean isAccepted() { return accepted; }
    public String getReason() { return reason; }
    public PriceStats getPriceStats() { return priceStats; }
    public Map<String, Long> getNullCounts() { return nullCounts; }
    public long getNullDroppedCount() { return nullDroppedCount; }
    public long getDuplicateCount() { return duplicateCount; }
    public long getInvalidCount() { return invalidCount; }
    public List<EcommerceEvent> getRetained() { return retained; }

    /** 记录级丢弃数 (关键字段为空 + 格式/范围不合法), 一条记录只计一次 */
    public long getDroppedCount() {
        return nullDroppedCount + invalidCount;
    }
}
