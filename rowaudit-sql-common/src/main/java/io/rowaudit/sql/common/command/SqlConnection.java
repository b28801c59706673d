package io.rowaudit.sql.common.command;

import java.sql.Connection;
import java.sql.SQLException;

public interface SqlConnection extends AutoCloseable {

    SqlCommand createCommand() throws SQLException;

    default SqlCommand createCommand(String commandText) throws SQLException {
        SqlCommand command = createCommand();
        command.setCommandText(commandText);
        return command;
    }

    void setAutoCommit(boolean autoCommit) throws SQLException;

    void commit() throws SQLException;

    void rollback() throws SQLException;

    boolean isClosed() throws SQLException;

    /**
     * @return the underlying JDBC connection, for calls this interface does not cover
     */
    Connection unwrap();

    @Override
    void close() throws SQLException;
}
