package io.rowaudit.sql.interceptor.metadata;

import io.rowaudit.sql.common.command.SqlConnection;

import java.sql.SQLException;
import java.util.List;

/**
 * Channel used to look up the column list of a table.
 */
@FunctionalInterface
public interface TableMetadataSource {

    /**
     * @param schema schema name, empty when the statement did not qualify the table
     * @return column names in ordinal order; empty when the table is unknown
     */
    List<String> loadColumns(SqlConnection connection, String schema, String table) throws SQLException;
}
