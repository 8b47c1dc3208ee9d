package com.szwego.ecommerce.flink.sink;

import java.io.Serializable;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 结构化校验过的表名 (schema.table), SQL 中统一以带引号的标识符输出
 *
 * <p>只接受 [A-Za-z_][A-Za-z0-9_]*, 统一小写 (与 PG 对未加引号标识符的折叠一致)
 * <p>长度上限 63 (PG NAMEDATALEN - 1), 超长直接报错而不是被 PG 静默截断
 * <p>staging 表命名: {@code <table>_staging_<batchId>}, 同一 batchId 的重试复用同一张表
 */
public final class TableName implements Serializable {
    private static final long serialVersionUID = 1L;

    public static final String DEFAULT_SCHEMA = "public";
    static final int MAX_IDENTIFIER_LENGTH = 63;

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final String schema;
    private final String table;

    private TableName(String schema, String table) {
        this.schema = checkIdentifier(schema);
        this.table = checkIdentifier(table);
    }

    /** "events" → public.events; "ecommerce.events" → ecommerce.events */
    public static TableName parse(String qualified) {
        if (qualified == null || qualified.isBlank()) {
            throw new IllegalArgumentException("Table name cannot be empty");
        }
        String trimmed = qualified.trim();
        int dot = trimmed.indexOf('.');
        if (dot < 0) {
            return new TableName(DEFAULT_SCHEMA, trimmed);
        }
        return new TableName(trimmed.substring(0, dot), trimmed.substring(dot + 1));
    }

    public TableName stagingFor(long batchId) {
        if (batchId < 0) {
            throw new IllegalArgumentException("batchId must be >= 0, got " + batchId);
        }
        return new TableName(schema, table + "_staging_" + batchId);
    }

    /**
     * 以最长 batchId (Long.MAX_VALUE, 19 位) 构造 staging 名, 超过 63 字符时抛 IllegalArgumentException
     *
     * <p>目标表名的可用长度因此是 63 - "_staging_".length() - 19 = 35
     */
    public TableName requireStagingCapacity() {
        stagingFor(Long.MAX_VALUE);
        return this;
    }

    public String getSchema() { return schema; }
    public String getTable() { return table; }

    /** "schema"."table" */
    public String quoted() {
        return quote(schema) + "." + quote(table);
    }

    static String quote(String identifier) {
        return "\"" + identifier + "\"";
    }

    private static String checkIdentifier(String identifier) {
        if (identifier == null || !IDENTIFIER.matcher(identifier).matches()) {
            throw new IllegalArgumentException("Invalid SQL identifier: '" + identifier + "'");
        }
        if (identifier.length() > MAX_IDENTIFIER_LENGTH) {
            throw new IllegalArgumentException("SQL identifier longer than "
                    + MAX_IDENTIFIER_LENGTH + " chars: '" + identifier + "'");
        }
        return identifier.toLowerCase(Locale.ROOT);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TableName)) return false;
        TableName that = (TableName) o;
        return schema.equals(that.schema) && table.equals(that.table);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schema, table);
    }

    @Override
    public String toString() {
        return schema + "." + table;
    }
}
