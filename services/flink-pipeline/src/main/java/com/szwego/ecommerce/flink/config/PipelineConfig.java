package com.szwego.ecommerce.flink.config;

import com.szwego.ecommerce.flink.sink.TableName;

import java.io.Serializable;
import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;

/**
 * 作业配置: 环境变量 + 默认值, 启动时校验 (fail fast)
 *
 * <p>Serializable: 随 Flink 算子一起分发到 TaskManager
 */
public class PipelineConfig implements Serializable {
    private static final long serialVersionUID = 1L;

    public enum SourceType { FILE, KAFKA }

    private final String jdbcUrl;
    private final String dbUser;
    private final String dbPassword;
    private final TableName targetTable;
    private final BigDecimal priceCeiling;
    private final int maxAttempts;
    private final long baseBackoffMs;
    private final int reportIntervalBatches;
    private final SourceType sourceType;
    private final String inputDir;
    private final int fileMonitorSeconds;
    private final String kafkaBrokers;
    private final String kafkaTopic;
    private final int windowSeconds;
    private final long checkpointIntervalMs;

    private PipelineConfig(Map<String, String> env) {
        this.jdbcUrl = env.getOrDefault("PG_JDBC_URL",
            "jdbc:postgresql://localhost:5432/ecommerce_analytics");
        this.dbUser = env.getOrDefault("PG_USER", "postgres");
        this.dbPassword = env.getOrDefault("PG_PASSWORD", "");
        this.targetTable = TableName.parse(env.getOrDefault("DB_TABLE", "ecommerce_events"));
        this.priceCeiling = new BigDecimal(env.getOrDefault("PRICE_CEILING", "10000").trim());
        this.maxAttempts = intValue(env, "MAX_ATTEMPTS", 3);
        this.baseBackoffMs = longValue(env, "BASE_BACKOFF_MS", 1_000L);
        this.reportIntervalBatches = intValue(env, "REPORT_INTERVAL_BATCHES", 10);
        this.sourceType = sourceType(env.getOrDefault("SOURCE_TYPE", "file"));
        this.inputDir = env.getOrDefault("INPUT_DATA_DIR", "/app/data/incoming");
        this.fileMonitorSeconds = intValue(env, "FILE_MONITOR_SECONDS", 5);
        this.kafkaBrokers = env.getOrDefault("KAFKA_BROKERS", "localhost:9092");
        this.kafkaTopic = env.getOrDefault("KAFKA_TOPIC", "ecommerce-events");
        this.windowSeconds = intValue(env, "WINDOW_SECONDS", 10);
        this.checkpointIntervalMs = longValue(env, "CHECKPOINT_INTERVAL_MS", 10_000L);
        validate();
    }

    public static PipelineConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    public static PipelineConfig fromEnv(Map<String, String> env) {
        return new PipelineConfig(env);
    }

    private void validate() {
        if (!jdbcUrl.startsWith("jdbc:postgresql://")) {
            throw new IllegalArgumentException("Invalid PostgreSQL JDBC URL: " + jdbcUrl);
        }
        if (dbUser.isBlank()) {
            throw new IllegalArgumentException("PG_USER cannot be empty");
        }
        if (priceCeiling.signum() <= 0) {
            throw new IllegalArgumentException("PRICE_CEILING must be > 0, got " + priceCeiling);
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("MAX_ATTEMPTS must be >= 1, got " + maxAttempts);
        }
        if (baseBackoffMs < 0) {
            throw new IllegalArgumentException("BASE_BACKOFF_MS must be >= 0, got " + baseBackoffMs);
        }
        if (windowSeconds < 1) {
            throw new IllegalArgumentException("WINDOW_SECONDS must be >= 1, got " + windowSeconds);
        }
        try {
            targetTable.requireStagingCapacity();
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("DB_TABLE '" + targetTable.getTable()
                + "' is too long: staging table names '<table>_staging_<batchId>' must fit in 63 chars", e);
        }
        if (sourceType == SourceType.FILE && inputDir.isBlank()) {
            throw new IllegalArgumentException("INPUT_DATA_DIR cannot be empty");
        }
    }

    private static SourceType sourceType(String raw) {
        try {
            return SourceType.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("SOURCE_TYPE must be 'file' or 'kafka', got '" + raw + "'", e);
        }
    }

    private static int intValue(Map<String, String> env, String key, int defaultValue) {
        String raw = env.get(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, got '" + raw + "'", e);
        }
    }

    private static long longValue(Map<String, String> env, String key, long defaultValue) {
        String raw = env.get(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, got '" + raw + "'", e);
        }
    }

    public String getJdbcUrl() { return jdbcUrl; }
    public String getDbUser() { return dbUser; }
    public String getDbPassword() { return dbPassword; }
    public TableName getTargetTable() { return targetTable; }
    public BigDecimal getPriceCeiling() { return priceCeiling; }
    public int getMaxAttempts() { return maxAttempts; }
    public long getBaseBackoffMs() { return baseBackoffMs; }
    public int getReportIntervalBatches() { return reportIntervalBatches; }
    public SourceType getSourceType() { return sourceType; }
    public String getInputDir() { return inputDir; }
    public int getFileMonitorSeconds() { return fileMonitorSeconds; }
    public String getKafkaBrokers() { return kafkaBrokers; }
    public String getKafkaTopic() { return kafkaTopic; }
    public int getWindowSeconds() { return windowSeconds; }
    public long getCheckpointIntervalMs() { return checkpointIntervalMs; }

    /** 日志用, 不含密码 */
    @Override
    public String toString() {
        return "PipelineConfig{jdbcUrl=" + jdbcUrl + ", user=" + dbUser + ", table=" + targetTable
            + ", priceCeiling=" + priceCeiling + ", maxAttempts=" + maxAttempts
            + ", baseBackoffMs=" + baseBackoffMs + ", reportInterval=" + reportIntervalBatches
            + ", source=" + sourceType + ", inputDir=" + inputDir + ", kafkaTopic=" + kafkaTopic
            + ", windowSeconds=" + windowSeconds + "}";
    }
}
