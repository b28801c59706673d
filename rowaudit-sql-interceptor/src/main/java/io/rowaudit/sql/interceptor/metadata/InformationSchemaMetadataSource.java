package io.rowaudit.sql.interceptor.metadata;

import io.rowaudit.sql.common.command.SqlCommand;
import io.rowaudit.sql.common.command.SqlConnection;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads columns from {@code INFORMATION_SCHEMA.COLUMNS}, which SQL Server and most other engines
 * expose.
 *
 * <p>An unqualified table name that exists in more than one schema is rejected: the engine
 * resolves it through the session's default schema, which the catalog query cannot see.
 */
public class InformationSchemaMetadataSource implements TableMetadataSource {

    static final String COLUMNS_QUERY =
            "SELECT TABLE_SCHEMA, COLUMN_NAME FROM INFORMATION_SCHEMA.COLUMNS WHERE TABLE_NAME = @tableName";
    static final String SCHEMA_FILTER = " AND TABLE_SCHEMA = @schemaName";
    static final String ORDER = " ORDER BY TABLE_SCHEMA, ORDINAL_POSITION";

    @Override
    public List<String> loadColumns(SqlConnection connection, String schema, String table) throws SQLException {
        boolean hasSchema = schema != null && !schema.isEmpty();
        String sql = COLUMNS_QUERY + (hasSchema ? SCHEMA_FILTER : "") + ORDER;
        Map<String, List<String>> columnsBySchema;
        try (SqlCommand command = connection.createCommand(sql)) {
            command.getParameters().bind("@tableName", table);
            if (hasSchema) {
                command.getParameters().bind("@schemaName", schema);
            }
            columnsBySchema = command.query(resultSet -> {
                Map<String, List<String>> columns = new LinkedHashMap<>();
                while (resultSet.next()) {
                    columns.computeIfAbsent(resultSet.getString(1), s -> new ArrayList<>()).add(resultSet.getString(2));
                }
                return columns;
            });
        }
        if (columnsBySchema.size() > 1) {
            throw new SQLException("Table " + table + " exists in schemas " + columnsBySchema.keySet()
                    + ", qualify it with a schema");
        }
        return columnsBySchema.isEmpty() ? List.of() : columnsBySchema.values().iterator().next();
    }
}
