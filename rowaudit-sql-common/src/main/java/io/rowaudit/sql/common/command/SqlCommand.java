package io.rowaudit.sql.common.command;

import io.rowaudit.sql.common.model.ParameterBindings;

import java.sql.SQLException;

/**
 * A single SQL command with named {@code @parameters}, bound to one connection.
 *
 * <p>Not thread safe: a command is used by one thread at a time, the same discipline as a JDBC
 * statement.
 */
public interface SqlCommand extends AutoCloseable {

    String getCommandText();

    void setCommandText(String commandText);

    /**
     * @return the live, mutable parameter bindings of this command
     */
    ParameterBindings getParameters();

    /**
     * Executes a statement that does not return rows.
     *
     * @return number of affected rows
     */
    int execute() throws SQLException;

    /**
     * @return first column of the first row returned, or {@code null} when the statement returns no rows
     */
    Object executeScalar() throws SQLException;

    /**
     * Executes the command and hands the rows to {@code handler}. The result set is closed afterwards.
     */
    <T> T query(ResultSetHandler<T> handler) throws SQLException;

    void prepare() throws SQLException;

    /**
     * @param seconds query timeout forwarded to the driver, 0 for none
     */
    void setQueryTimeout(int seconds) throws SQLException;

    int getQueryTimeout();

    void cancel() throws SQLException;

    @Override
    void close() throws SQLException;
}
