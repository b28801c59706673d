package io.rowaudit.sql.interceptor;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

public final class DuckDBTestSupport {

    private DuckDBTestSupport() {
    }

    /**
     * @return a fresh in-memory database with {@code sqls} already executed
     */
    public static Connection connection(String... sqls) throws SQLException {
        Connection connection = DriverManager.getConnection("jdbc:duckdb:");
        try (Statement statement = connection.createStatement()) {
            for (String sql : sqls) {
                statement.execute(sql);
            }
        }
        return connection;
    }

    public static Connection usersDatabase() throws SQLException {
        return connection(
                "CREATE TABLE Users (Id INTEGER, Email VARCHAR, Name VARCHAR)",
                "INSERT INTO Users VALUES (5, 'old@x.com', 'Bob'), (6, 'eve@x.com', 'Eve')");
    }
}
