package com.szwego.ecommerce.flink.util;

import com.szwego.ecommerce.flink.model.EcommerceEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * 原始字段 (列名 → 文本) → EcommerceEvent
 *
 * <p>宽松解析: 无法转换的数值 / 时间置为 null, 交给 BatchValidator 按空值处理, 不在这里丢记录
 * <p>无时区的时间戳按 UTC 解释
 */
public final class EventFieldParser {

    private static final Logger LOG = LoggerFactory.getLogger(EventFieldParser.class);

    // 2024-01-01 12:00:00[.SSS]
    private static final DateTimeFormatter SPACE_SEPARATED = new DateTimeFormatterBuilder()
            .appendPattern("yyyy-MM-dd HH:mm:ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .optionalEnd()
            .toFormatter();

    // 依次尝试: 带偏移 ISO-8601 → 无时区 ISO-8601 → 空格分隔
    private static final List<Function<String, Instant>> TIMESTAMP_PARSERS = List.of(
            v -> OffsetDateTime.parse(v).toInstant(),
            v -> LocalDateTime.parse(v).toInstant(ZoneOffset.UTC),
            v -> LocalDateTime.parse(v, SPACE_SEPARATED).toInstant(ZoneOffset.UTC));

    private EventFieldParser() {}

    /**
     * @param fields 列名 → 原始文本; 不存在的键视为该列缺失 (记入 sourceFields 之外)
     */
    public static EcommerceEvent fromFields(Map<String, String> fields) {
        EcommerceEvent event = new EcommerceEvent();
        Set<String> present = new LinkedHashSet<>();
        for (String column : EcommerceEvent.SOURCE_COLUMNS) {
            if (fields.containsKey(column)) present.add(column);
        }
        event.setSourceFields(present);

        event.setEventId(text(fields.get("event_id")));
        event.setEventType(text(fields.get("event_type")));
        event.setProductId(parseInteger(fields.get("product_id")));
        event.setProductName(text(fields.get("product_name")));
        event.setCategory(text(fields.get("category")));
        event.setBrand(text(fields.get("brand")));
        event.setSku(text(fields.get("sku")));
        event.setPrice(parseDecimal(fields.get("price")));
        event.setCustomerId(text(fields.get("customer_id")));
        event.setCustomerEmail(text(fields.get("customer_email")));
        event.setCustomerName(text(fields.get("customer_name")));
        event.setCustomerAddress(text(fields.get("customer_address")));
        event.setSessionId(text(fields.get("session_id")));
        event.setUserAgent(text(fields.get("user_agent")));
        event.setIpAddress(text(fields.get("ip_address")));
        event.setEventTimestamp(parseTimestamp(fields.get("event_timestamp")));
        return event;
    }

    /** 空串按 null 处理 */
    static String text(String raw) {
        return raw == null || raw.isEmpty() ? null : raw;
    }

    static Integer parseInteger(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return Integer.valueOf(raw.trim());
        } catch (NumberFormatException e) {
            LOG.debug("Unparseable product_id '{}': {}", raw, e.getMessage());
            return null;
        }
    }

    static BigDecimal parseDecimal(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return new BigDecimal(raw.trim());
        } catch (NumberFormatException e) {
            LOG.debug("Unparseable price '{}': {}", raw, e.getMessage());
            return null;
        }
    }

    static Instant parseTimestamp(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String value = raw.trim();
        DateTimeParseException last = null;
        for (Function<String, Instant> parser : TIMESTAMP_PARSERS) {
            try {
                return parser.apply(value);
            } catch (DateTimeParseException e) {
                last = e;
            }
        }
        LOG.debug("Unparseable event_timestamp '{}': {}", raw, last.getMessage());
        return null;
    }
}
