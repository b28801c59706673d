package io.rowaudit.sql.sink;

import com.typesafe.config.Config;
import io.rowaudit.sql.common.AuditSink;
import io.rowaudit.sql.common.command.ConnectionSupplier;
import io.rowaudit.sql.common.config.ConfigConstants;
import io.rowaudit.sql.common.model.AuditRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Persists audit records into a relational table, one row per record. The table is created on
 * the first write when the catalog does not list it. Parameters, images and custom properties are
 * stored as JSON text.
 *
 * <p>Column types default to SQL Server's; other databases set {@code text_type} and
 * {@code timestamp_type}:
 * <pre>{@code
 * sink {
 *   class = "io.rowaudit.sql.sink.JdbcAuditSink"
 *   connection { url = "jdbc:duckdb:/tmp/audit.db" }
 *   table_name = "audit_logs"
 *   text_type = "VARCHAR"
 *   timestamp_type = "TIMESTAMP"
 * }
 * }</pre>
 */
public class JdbcAuditSink implements AuditSink {

    private static final Logger logger = LoggerFactory.getLogger(JdbcAuditSink.class);

    public static final String DEFAULT_TABLE_NAME = "audit_logs";
    public static final String DEFAULT_TEXT_TYPE = "NVARCHAR(MAX)";
    public static final String DEFAULT_TIMESTAMP_TYPE = "DATETIME2";

    static final List<String> COLUMNS = List.of("id", "timestamp", "event_name", "query", "parameters",
            "before_image", "after_image", "schema_name", "table_name", "operation_type", "capture_mode",
            "rows_affected", "user_id", "user_name", "ip_address", "user_agent", "machine_name",
            "process_id", "thread_id", "custom_properties", "created_at");

    private final ConnectionSupplier connectionSupplier;
    private final String tableName;
    private final String textType;
    private final String timestampType;
    private final String insertSql;
    private volatile boolean tableReady;

    public JdbcAuditSink(ConnectionSupplier connectionSupplier) {
        this(connectionSupplier, DEFAULT_TABLE_NAME, DEFAULT_TEXT_TYPE, DEFAULT_TIMESTAMP_TYPE);
    }

    public JdbcAuditSink(ConnectionSupplier connectionSupplier, String tableName, String textType, String timestampType) {
        this.connectionSupplier = connectionSupplier;
        this.tableName = tableName;
        this.textType = textType;
        this.timestampType = timestampType;
        this.insertSql = "INSERT INTO " + quoteName(tableName) + " ("
                + String.join(", ", COLUMNS.stream().map(JdbcAuditSink::quote).toList())
                + ") VALUES (" + String.join(", ", COLUMNS.stream().map(c -> "?").toList()) + ")";
    }

    public JdbcAuditSink(Config config) {
        this(connectionSupplier(config.getConfig(ConfigConstants.CONNECTION_PREFIX)),
                getString(config, ConfigConstants.TABLE_NAME_KEY, DEFAULT_TABLE_NAME),
                getString(config, ConfigConstants.TEXT_TYPE_KEY, DEFAULT_TEXT_TYPE),
                getString(config, ConfigConstants.TIMESTAMP_TYPE_KEY, DEFAULT_TIMESTAMP_TYPE));
    }

    private static ConnectionSupplier connectionSupplier(Config connection) {
        String url = connection.getString(ConfigConstants.URL_KEY);
        if (!connection.hasPath(ConfigConstants.USERNAME_KEY)) {
            return () -> DriverManager.getConnection(url);
        }
        String username = connection.getString(ConfigConstants.USERNAME_KEY);
        String password = getString(connection, ConfigConstants.PASSWORD_KEY, "");
        return () -> DriverManager.getConnection(url, username, password);
    }

    private static String getString(Config config, String key, String defaultValue) {
        return config.hasPath(key) ? config.getString(key) : defaultValue;
    }

    public String getTableName() {
        return tableName;
    }

    @Override
    public void write(AuditRecord record) throws Exception {
        try (Connection connection = connectionSupplier.get()) {
            ensureTable(connection);
            try (PreparedStatement statement = connection.prepareStatement(insertSql)) {
                bind(statement, record);
                statement.executeUpdate();
            }
        }
    }

    private void bind(PreparedStatement statement, AuditRecord record) throws Exception {
        int i = 1;
        statement.setString(i++, UUID.randomUUID().toString());
        statement.setTimestamp(i++, Timestamp.from(record.timestamp()));
        statement.setString(i++, record.eventName());
        statement.setString(i++, record.query());
        statement.setString(i++, json(record.parameters()));
        statement.setString(i++, json(record.beforeImage().asMap()));
        statement.setString(i++, json(record.afterImage().asMap()));
        statement.setString(i++, record.schemaName());
        statement.setString(i++, record.tableName());
        statement.setString(i++, record.operationType().name());
        if (record.captureMode() == null) {
            statement.setNull(i++, Types.VARCHAR);
        } else {
            statement.setString(i++, record.captureMode().name());
        }
        statement.setLong(i++, record.rowsAffected());
        statement.setString(i++, record.userId());
        statement.setString(i++, record.userName());
        statement.setString(i++, record.ipAddress());
        statement.setString(i++, record.userAgent());
        statement.setString(i++, record.machineName());
        statement.setLong(i++, record.processId());
        statement.setLong(i++, record.threadId());
        statement.setString(i++, json(record.customProperties()));
        statement.setTimestamp(i, Timestamp.from(Instant.now()));
    }

    private static String json(Map<String, Object> map) throws Exception {
        return AuditJson.write(map);
    }

    private void ensureTable(Connection connection) throws SQLException {
        if (tableReady) {
            return;
        }
        synchronized (this) {
            if (tableReady) {
                return;
            }
            if (!tableExists(connection)) {
                logger.atInfo().log("Creating audit table {}", tableName);
                try (var statement = connection.createStatement()) {
                    statement.execute(createTableSql());
                }
            }
            tableReady = true;
        }
    }

    private boolean tableExists(Connection connection) throws SQLException {
        int dot = tableName.lastIndexOf('.');
        String schema = dot < 0 ? null : tableName.substring(0, dot);
        String table = dot < 0 ? tableName : tableName.substring(dot + 1);
        DatabaseMetaData metaData = connection.getMetaData();
        // catalogs differ in how they fold unquoted names
        for (String candidate : List.of(table, table.toLowerCase(Locale.ROOT), table.toUpperCase(Locale.ROOT))) {
            try (ResultSet tables = metaData.getTables(null, schema, candidate, null)) {
                if (tables.next()) {
                    return true;
                }
            }
        }
        return false;
    }

    String createTableSql() {
        return "CREATE TABLE " + quoteName(tableName) + " ("
                + quote("id") + " VARCHAR(36) NOT NULL PRIMARY KEY, "
                + quote("timestamp") + " " + timestampType + " NOT NULL, "
                + quote("event_name") + " VARCHAR(256), "
                + quote("query") + " " + textType + ", "
                + quote("parameters") + " " + textType + ", "
                + quote("before_image") + " " + textType + ", "
                + quote("after_image") + " " + textType + ", "
                + quote("schema_name") + " VARCHAR(128), "
                + quote("table_name") + " VARCHAR(128), "
                + quote("operation_type") + " VARCHAR(16), "
                + quote("capture_mode") + " VARCHAR(16), "
                + quote("rows_affected") + " BIGINT, "
                + quote("user_id") + " VARCHAR(64), "
                + quote("user_name") + " VARCHAR(128), "
                + quote("ip_address") + " VARCHAR(45), "
                + quote("user_agent") + " VARCHAR(512), "
                + quote("machine_name") + " VARCHAR(128), "
                + quote("process_id") + " BIGINT, "
                + quote("thread_id") + " BIGINT, "
                + quote("custom_properties") + " " + textType + ", "
                + quote("created_at") + " " + timestampType + " NOT NULL)";
    }

    private static String quoteName(String name) {
        int dot = name.lastIndexOf('.');
        return dot < 0 ? quote(name) : quote(name.substring(0, dot)) + "." + quote(name.substring(dot + 1));
    }

    private static String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }
}
