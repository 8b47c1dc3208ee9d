package com.szwego.ecommerce.flink.validate;

import java.math.BigDecimal;

/**
 * 批内价格聚合 (min / max / avg), 只统计非空价格
 */
public class PriceStats {

    private final BigDecimal min;
    private final BigDecimal max;
    private final BigDecimal avg;
    private final long count;

    public PriceStats(BigDecimal min, BigDecimal max, BigDecimal avg, long count) {
        this.min = min;
        this.max = max;
        this.avg = avg;
        this.count = count;
    }

    public BigDecimal getMin() { return min; }
    public BigDecimal getMax() { return max; }
    public BigDecimal getAvg() { return avg; }
    public long getCount() { return count; }

    /** 无行或极值为 null: 批次为空或已损坏 */
    public boolean isEmpty() {
        return count == 0 || min == null || max == null;
    }

    @Override
    public String toString() {
        return "{min=" + min + ", max=" + max + ", avg=" + avg + ", count=" + count + "}";
    }
}
