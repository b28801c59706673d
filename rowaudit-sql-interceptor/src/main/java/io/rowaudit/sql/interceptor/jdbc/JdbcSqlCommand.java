package io.rowaudit.sql.interceptor.jdbc;

import io.rowaudit.sql.common.command.ResultSetHandler;
import io.rowaudit.sql.common.command.SqlCommand;
import io.rowaudit.sql.common.model.ParameterBindings;
import io.rowaudit.sql.parser.NamedParameters;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.List;
import java.util.Objects;

/**
 * {@link SqlCommand} on a JDBC connection. {@code @name} parameters are translated to {@code ?}
 * markers and bound by name on every execution; bindings the text does not use are ignored.
 * The prepared statement is reused until the command text changes.
 */
public class JdbcSqlCommand implements SqlCommand {

    private final Connection connection;
    private final ParameterBindings parameters = new ParameterBindings();
    private String commandText = "";
    private int queryTimeout;

    private PreparedStatement statement;
    private String preparedText;
    private List<String> parameterNames = List.of();

    public JdbcSqlCommand(Connection connection) {
        this.connection = Objects.requireNonNull(connection, "connection must not be null");
    }

    @Override
    public String getCommandText() {
        return commandText;
    }

    @Override
    public void setCommandText(String commandText) {
        this.commandText = commandText == null ? "" : commandText;
    }

    @Override
    public ParameterBindings getParameters() {
        return parameters;
    }

    @Override
    public int execute() throws SQLException {
        PreparedStatement ps = bound();
        if (ps.execute()) {
            // a query; there is no affected row count
            ps.getResultSet().close();
            return -1;
        }
        return ps.getUpdateCount();
    }

    @Override
    public Object executeScalar() throws SQLException {
        PreparedStatement ps = bound();
        if (!ps.execute()) {
            return null;
        }
        try (ResultSet resultSet = ps.getResultSet()) {
            return resultSet.next() ? resultSet.getObject(1) : null;
        }
    }

    @Override
    public <T> T query(ResultSetHandler<T> handler) throws SQLException {
        PreparedStatement ps = bound();
        try (ResultSet resultSet = ps.executeQuery()) {
            return handler.handle(resultSet);
        }
    }

    @Override
    public void prepare() throws SQLException {
        prepared();
    }

    @Override
    public void setQueryTimeout(int seconds) throws SQLException {
        if (seconds < 0) {
            throw new SQLException("query timeout must not be negative: " + seconds);
        }
        this.queryTimeout = seconds;
    }

    @Override
    public int getQueryTimeout() {
        return queryTimeout;
    }

    @Override
    public void cancel() throws SQLException {
        PreparedStatement running = statement;
        if (running != null) {
            running.cancel();
        }
    }

    @Override
    public void close() throws SQLException {
        if (statement != null) {
            try {
                statement.close();
            } finally {
                statement = null;
                preparedText = null;
            }
        }
    }

    private PreparedStatement prepared() throws SQLException {
        if (statement == null || !commandText.equals(preparedText)) {
            close();
            NamedParameters named = NamedParameters.parse(commandText);
            statement = connection.prepareStatement(named.jdbcSql());
            preparedText = commandText;
            parameterNames = named.parameterNames();
        }
        return statement;
    }

    private PreparedStatement bound() throws SQLException {
        PreparedStatement ps = prepared();
        if (queryTimeout > 0) {
            ps.setQueryTimeout(queryTimeout);
        }
        for (int i = 0; i < parameterNames.size(); i++) {
            String name = parameterNames.get(i);
            if (!parameters.contains(name)) {
                throw new SQLException("Must declare the scalar variable \"" + name + "\"");
            }
            Object value = parameters.get(name);
            if (value == null) {
                ps.setNull(i + 1, Types.NULL);
            } else {
                ps.setObject(i + 1, value);
            }
        }
        return ps;
    }
}
