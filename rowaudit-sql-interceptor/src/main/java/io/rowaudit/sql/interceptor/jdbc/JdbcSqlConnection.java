package io.rowaudit.sql.interceptor.jdbc;

import io.rowaudit.sql.common.command.SqlCommand;
import io.rowaudit.sql.common.command.SqlConnection;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

public class JdbcSqlConnection implements SqlConnection {

    private final Connection connection;

    public JdbcSqlConnection(Connection connection) {
        this.connection = Objects.requireNonNull(connection, "connection must not be null");
    }

    @Override
    public SqlCommand createCommand() throws SQLException {
        if (connection.isClosed()) {
            throw new SQLException("Connection is closed");
        }
        return new JdbcSqlCommand(connection);
    }

    @Override
    public void setAutoCommit(boolean autoCommit) throws SQLException {
        connection.setAutoCommit(autoCommit);
    }

    @Override
    public void commit() throws SQLException {
        connection.commit();
    }

    @Override
    public void rollback() throws SQLException {
        connection.rollback();
    }

    @Override
    public boolean isClosed() throws SQLException {
        return connection.isClosed();
    }

    @Override
    public Connection unwrap() {
        return connection;
    }

    @Override
    public void close() throws SQLException {
        connection.close();
    }
}
