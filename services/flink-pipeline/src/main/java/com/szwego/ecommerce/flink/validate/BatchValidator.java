package com.szwego.ecommerce.flink.validate;

import com.szwego.ecommerce.flink.model.EcommerceEvent;
import com.szwego.ecommerce.flink.model.EventBatch;
import com.szwego.ecommerce.flink.model.EventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * 批次质量校验 (结构 + 统计), 只返回结果, 从不抛异常
 *
 * <p>顺序 (结构性失败短路):
 * <ol>
 *   <li>必需列缺失 (所有记录都没有该列) → 整批拒绝</li>
 *   <li>关键字段空值 (event_id / product_id / price / event_timestamp) → 丢弃该记录</li>
 *   <li>批内重复 event_id → 仅告警, 由 BatchDeduplicator 处理</li>
 *   <li>价格聚合 (全批非空价格): 无行 / min &lt; 0 / max &gt; ceiling → 整批拒绝</li>
 *   <li>记录级格式与范围检查 → 丢弃该记录</li>
 * </ol>
 */
public class BatchValidator {

    private static final Logger LOG = LoggerFactory.getLogger(BatchValidator.class);

    public static final BigDecimal DEFAULT_PRICE_CEILING = BigDecimal.valueOf(10_000);

    private static final Map<String, Function<EcommerceEvent, Object>> CRITICAL_FIELDS =
        new LinkedHashMap<>();

    static {
        CRITICAL_FIELDS.put("event_id", EcommerceEvent::getEventId);
        CRITICAL_FIELDS.put("product_id", EcommerceEvent::getProductId);
        CRITICAL_FIELDS.put("price", EcommerceEvent::getPrice);
        CRITICAL_FIELDS.put("event_timestamp", EcommerceEvent::getEventTimestamp);
    }

    private final BigDecimal priceCeiling;

    public BatchValidator() {
        this(DEFAULT_PRICE_CEILING);
    }

    public BatchValidator(BigDecimal priceCeiling) {
        if (priceCeiling == null || priceCeiling.signum() <= 0) {
            throw new IllegalArgumentException("priceCeiling must be > 0, got " + priceCeiling);
        }
        this.priceCeiling = priceCeiling;
    }

    public ValidationResult validate(EventBatch batch) {
        long batchId = batch.getBatchId();
        List<EcommerceEvent> events = batch.getEvents();

        if (events.isEmpty()) {
            LOG.warn("Batch {}: empty batch", batchId);
            return ValidationResult.rejected("empty batch", null, Map.of(), 0, 0);
        }

        // 1. 必需列
        Set<String> missing = missingColumns(events);
        if (!missing.isEmpty()) {
            LOG.error("Batch {}: Missing columns: {}", batchId, missing);
            return ValidationResult.rejected("missing columns: " + missing, null, Map.of(), 0, 0);
        }

        // 2. 关键字段空值
        Map<String, Long> nullCounts = new LinkedHashMap<>();
        List<EcommerceEvent> nonNull = new ArrayList<>(events.size());
        for (EcommerceEvent e : events) {
            boolean complete = true;
            for (Map.Entry<String, Function<EcommerceEvent, Object>> f : CRITICAL_FIELDS.entrySet()) {
                if (f.getValue().apply(e) == null) {
                    nullCounts.merge(f.getKey(), 1L, Long::sum);
                    complete = false;
                }
            }
            if (complete) {
                nonNull.add(e);
            }
        }
        long nullDropped = events.size() - nonNull.size();
        if (!nullCounts.isEmpty()) {
            LOG.warn("Batch {}: Null values found: {} ({} records dropped)",
                    batchId, nullCounts, nullDropped);
        }

        // 3. 批内重复
        long duplicates = duplicateCount(nonNull);
        if (duplicates > 0) {
            LOG.warn("Batch {}: Found {} duplicate event_ids", batchId, duplicates);
        }

        // 4. 价格聚合: 全批非空价格, 其他关键字段为空的记录也参与
        PriceStats stats = priceStats(events);
        if (stats.isEmpty()) {
            LOG.warn("Batch {}: Price aggregation returned no rows: {}", batchId, stats);
            return ValidationResult.rejected("price aggregation returned no rows",
                    stats, nullCounts, nullDropped, duplicates);
        }
        if (stats.getMin().signum() < 0) {
            LOG.error("Batch {}: Found negative min price: {}", batchId, stats.getMin());
            return ValidationResult.rejected("negative min price " + stats.getMin(),
                    stats, nullCounts, nullDropped, duplicates);
        }
        if (stats.getMax().compareTo(priceCeiling) > 0) {
            LOG.error("Batch {}: Found implausible max price: {} > {}",
                    batchId, stats.getMax(), priceCeiling);
            return ValidationResult.rejected("max price " + stats.getMax() + " exceeds " + priceCeiling,
                    stats, nullCounts, nullDropped, duplicates);
        }

        // 5. 记录级格式/范围
        List<EcommerceEvent> retained = new ArrayList<>(nonNull.size());
        for (EcommerceEvent e : nonNull) {
            if (isWellFormed(e)) {
                retained.add(e);
            } else {
                LOG.debug("Batch {}: dropping invalid record {}", batchId, e);
            }
        }
        long invalid = nonNull.size() - retained.size();
        if (invalid > 0) {
            LOG.warn("Batch {}: Dropped {} records failing range/format checks", batchId, invalid);
        }

        LOG.debug("Batch {}: validation passed, price stats {}", batchId, stats);
        return ValidationResult.accepted(stats, nullCounts, nullDropped, duplicates, invalid, retained);
    }

    /** 所有记录都缺失的列 */
    static Set<String> missingColumns(List<EcommerceEvent> events) {
        Set<String> present = new HashSet<>();
        for (EcommerceEvent e : events) {
            present.addAll(e.getSourceFields());
        }
        Set<String> missing = new LinkedHashSet<>(EcommerceEvent.SOURCE_COLUMNS);
        missing.removeAll(present);
        return missing;
    }

    static long duplicateCount(List<EcommerceEvent> events) {
        Set<String> distinct = new HashSet<>();
        for (EcommerceEvent e : events) {
            distinct.add(e.getEventId());
        }
        return events.size() - distinct.size();
    }

    static PriceStats priceStats(List<EcommerceEvent> events) {
        BigDecimal min = null;
        BigDecimal max = null;
        BigDecimal sum = BigDecimal.ZERO;
        long count = 0;
        for (EcommerceEvent e : events) {
            BigDecimal p = e.getPrice();
            if (p == null) continue;
            min = min == null ? p : min.min(p);
            max = max == null ? p : max.max(p);
            sum = sum.add(p);
            count++;
        }
        BigDecimal avg = count == 0 ? null : sum.divide(BigDecimal.valueOf(count), MathContext.DECIMAL64);
        return new PriceStats(min, max, avg, count);
    }

    boolean isWellFormed(EcommerceEvent e) {
        if (isBlank(e.getEventId())) return false;
        if (e.getProductId() == null || e.getProductId() <= 0) return false;
        if (EventType.fromValue(e.getEventType()).isEmpty()) return false;
        if (e.getPrice() == null || e.getPrice().signum() <= 0) return false;
        if (e.getPrice().compareTo(priceCeiling) > 0) return false;
        if (e.getEventTimestamp() == null) return false;
        String email = e.getCustomerEmail();
        if (email == null || !email.contains("@") || !email.contains(".")) return false;
        if (isBlank(e.getProductName())) return false;
        return !isBlank(e.getCategory());
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
