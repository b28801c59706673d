package io.rowaudit.sql.interceptor.jdbc;

import io.rowaudit.sql.common.command.SqlConnection;
import io.rowaudit.sql.interceptor.AuditInterceptor;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Connection whose commands are audited. Capture queries run on the wrapped connection, so they
 * are never audited themselves and share the caller's transaction.
 */
public class AuditingSqlConnection implements SqlConnection {

    private final SqlConnection delegate;
    private final AuditInterceptor interceptor;

    public AuditingSqlConnection(SqlConnection delegate, AuditInterceptor interceptor) {
        this.delegate = delegate;
        this.interceptor = interceptor;
    }

    @Override
    public AuditingSqlCommand createCommand() throws SQLException {
        return new AuditingSqlCommand(delegate.createCommand(), delegate, interceptor);
    }

    @Override
    public AuditingSqlCommand createCommand(String commandText) throws SQLException {
        AuditingSqlCommand command = createCommand();
        command.setCommandText(commandText);
        return command;
    }

    @Override
    public void setAutoCommit(boolean autoCommit) throws SQLException {
        delegate.setAutoCommit(autoCommit);
    }

    @Override
    public void commit() throws SQLException {
        delegate.commit();
    }

    @Override
    public void rollback() throws SQLException {
        delegate.rollback();
    }

    @Override
    public boolean isClosed() throws SQLException {
        return delegate.isClosed();
    }

    @Override
    public Connection unwrap() {
        return delegate.unwrap();
    }

    @Override
    public void close() throws SQLException {
        delegate.close();
    }
}
