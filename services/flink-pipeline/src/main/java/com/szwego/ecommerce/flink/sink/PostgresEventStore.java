package com.szwego.ecommerce.flink.sink;

import com.szwego.ecommerce.flink.model.EcommerceEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * PG 实现: HikariCP 连接池 + JDBC 批量写入
 *
 * <p>每个操作单独取连接、单独提交; 连接池 autoCommit=false, 这里显式 commit / rollback
 */
public class PostgresEventStore implements EventStore {

    private static final Logger LOG = LoggerFactory.getLogger(PostgresEventStore.class);

    private static final int INSERT_CHUNK_SIZE = 1_000;

    @FunctionalInterface
    interface Binder {
        void bind(PreparedStatement ps, int index, EcommerceEvent e) throws SQLException;
    }

    static final class Column {
        final String name;
        final Binder binder;

        Column(String name, Binder binder) {
            this.name = name;
            this.binder = binder;
        }
    }

    /** 写入列 (目标表另有 created_at 等默认列, 不由 sink 写) */
    static final List<Column> COLUMNS = Collections.unmodifiableList(Arrays.asList(
        new Column("event_id", (ps, i, e) -> ps.setString(i, e.getEventId())),
        new Column("event_type", (ps, i, e) -> ps.setString(i, e.getEventType())),
        new Column("product_id", (ps, i, e) -> setInteger(ps, i, e.getProductId())),
        new Column("product_name", (ps, i, e) -> ps.setString(i, e.getProductName())),
        new Column("category", (ps, i, e) -> ps.setString(i, e.getCategory())),
        new Column("brand", (ps, i, e) -> ps.setString(i, e.getBrand())),
        new Column("sku", (ps, i, e) -> ps.setString(i, e.getSku())),
        new Column("price", (ps, i, e) -> setDecimal(ps, i, e.getPrice())),
        new Column("customer_id", (ps, i, e) -> ps.setString(i, e.getCustomerId())),
        new Column("customer_email", (ps, i, e) -> ps.setString(i, e.getCustomerEmail())),
        new Column("customer_name", (ps, i, e) -> ps.setString(i, e.getCustomerName())),
        new Column("customer_address", (ps, i, e) -> ps.setString(i, e.getCustomerAddress())),
        new Column("session_id", (ps, i, e) -> ps.setString(i, e.getSessionId())),
        new Column("user_agent", (ps, i, e) -> ps.setString(i, e.getUserAgent())),
        new Column("ip_address", (ps, i, e) -> ps.setString(i, e.getIpAddress())),
        new Column("price_category", (ps, i, e) -> ps.setString(i,
                e.getPriceCategory() == null ? null : e.getPriceCategory().getLabel())),
        new Column("device_type", (ps, i, e) -> ps.setString(i,
                e.getDeviceType() == null ? null : e.getDeviceType().getLabel())),
        new Column("event_timestamp", (ps, i, e) -> setTimestamp(ps, i, e.getEventTimestamp()))
    ));

    private final DataSource dataSource;

    public PostgresEventStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public int stage(TableName staging, TableName target, List<EcommerceEvent> events)
            throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                try (Statement stmt = conn.createStatement()) {
                    stmt.execute(dropSql(staging));
                    stmt.execute(createStagingSql(staging, target));
                }
                int rows = 0;
                try (PreparedStatement ps = conn.prepareStatement(insertSql(staging))) {
                    for (EcommerceEvent e : events) {
                        for (int c = 0; c < COLUMNS.size(); c++) {
                            COLUMNS.get(c).binder.bind(ps, c + 1, e);
                        }
                        ps.addBatch();
                        if (++rows % INSERT_CHUNK_SIZE == 0) {
                            ps.executeBatch();
                        }
                    }
                    ps.executeBatch();
                }
                conn.commit();
                return rows;
            } catch (SQLException e) {
                rollbackQuietly(conn, e);
                throw e;
            }
        }
    }

    @Override
    public int mergeIgnoringConflicts(TableName staging, TableName target) throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try (Statement stmt = conn.createStatement()) {
                int inserted = stmt.executeUpdate(mergeSql(staging, target));
                conn.commit();
                return inserted;
            } catch (SQLException e) {
                rollbackQuietly(conn, e);
                throw e;
            }
        }
    }

    @Override
    public void dropIfExists(TableName table) throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try (Statement stmt = conn.createStatement()) {
                stmt.execute(dropSql(table));
                conn.commit();
            } catch (SQLException e) {
                rollbackQuietly(conn, e);
                throw e;
            }
        }
    }

    /** 启动时连通性检查 (SELECT 1) */
    public void verifyConnection() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT 1")) {
            if (!rs.next() || rs.getInt(1) != 1) {
                throw new SQLException("Database connection test failed");
            }
        }
    }

    /**
     * 目标表缺少的写入列; 表不存在时返回全部列
     */
    public Set<String> missingTargetColumns(TableName target) throws SQLException {
        Set<String> existing = new HashSet<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(
                     "SELECT column_name FROM information_schema.columns "
                     + "WHERE table_schema = ? AND table_name = ?")) {
            ps.setString(1, target.getSchema());
            ps.setString(2, target.getTable());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    existing.add(rs.getString(1));
                }
            }
        }
        Set<String> missing = new LinkedHashSet<>(columnNames());
        missing.removeAll(existing);
        return missing;
    }

    // ── SQL ──

    static List<String> columnNames() {
        List<String> names = new ArrayList<>(COLUMNS.size());
        for (Column c : COLUMNS) {
            names.add(c.name);
        }
        return names;
    }

    static String columnList() {
        return columnNames().stream().map(TableName::quote).collect(Collectors.joining(", "));
    }

    static String dropSql(TableName table) {
        return "DROP TABLE IF EXISTS " + table.quoted();
    }

    /** 与目标表相同的列类型, 不带约束/默认值 */
    static String createStagingSql(TableName staging, TableName target) {
        return "CREATE UNLOGGED TABLE " + staging.quoted()
            + " AS SELECT " + columnList() + " FROM " + target.quoted() + " WITH NO DATA";
    }

    static String insertSql(TableName table) {
        String placeholders = String.join(", ", Collections.nCopies(COLUMNS.size(), "?"));
        return "INSERT INTO " + table.quoted() + " (" + columnList() + ") VALUES (" + placeholders + ")";
    }

    static String mergeSql(TableName staging, TableName target) {
        String cols = columnList();
        return "INSERT INTO " + target.quoted() + " (" + cols + ")"
            + " SELECT " + cols + " FROM " + staging.quoted()
            + " ON CONFLICT (" + TableName.quote("event_id") + ") DO NOTHING";
    }

    // ── 参数绑定 ──

    private static void setInteger(PreparedStatement ps, int i, Integer v) throws SQLException {
        if (v == null) {
            ps.setNull(i, Types.INTEGER);
        } else {
            ps.setInt(i, v);
        }
    }

    private static void setDecimal(PreparedStatement ps, int i, BigDecimal v) throws SQLException {
        if (v == null) {
            ps.setNull(i, Types.NUMERIC);
        } else {
            ps.setBigDecimal(i, v);
        }
    }

    private static void setTimestamp(PreparedStatement ps, int i, Instant v) throws SQLException {
        if (v == null) {
            ps.setNull(i, Types.TIMESTAMP_WITH_TIMEZONE);
        } else {
            ps.setObject(i, OffsetDateTime.ofInstant(v, ZoneOffset.UTC));
        }
    }

    private static void rollbackQuietly(Connection conn, SQLException cause) {
        try {
            conn.rollback();
        } catch (SQLException rollbackErr) {
            cause.addSuppressed(rollbackErr);
            LOG.warn("Rollback failed: {}", rollbackErr.getMessage());
        }
    }
}
