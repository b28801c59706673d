package io.rowaudit.sql.interceptor.jdbc;

import io.rowaudit.sql.common.command.ResultSetHandler;
import io.rowaudit.sql.common.command.SqlCommand;
import io.rowaudit.sql.common.command.SqlConnection;
import io.rowaudit.sql.common.error.AuditOutcome;
import io.rowaudit.sql.common.model.ParameterBindings;
import io.rowaudit.sql.interceptor.AuditInterceptor;
import io.rowaudit.sql.interceptor.Execution;

import java.sql.SQLException;

/**
 * Routes {@link #execute()} and {@link #executeScalar()} through an {@link AuditInterceptor};
 * everything else goes straight to the wrapped command.
 */
public class AuditingSqlCommand implements SqlCommand {

    private final SqlCommand delegate;
    private final SqlConnection connection;
    private final AuditInterceptor interceptor;
    private AuditOutcome<?> lastOutcome;

    /**
     * @param connection the unaudited connection {@code delegate} belongs to
     */
    public AuditingSqlCommand(SqlCommand delegate, SqlConnection connection, AuditInterceptor interceptor) {
        this.delegate = delegate;
        this.connection = connection;
        this.interceptor = interceptor;
    }

    public AuditOutcome<Integer> executeWithOutcome() throws SQLException {
        AuditOutcome<Integer> outcome = interceptor.intercept(connection, delegate, Execution.NON_QUERY);
        lastOutcome = outcome;
        return outcome;
    }

    public AuditOutcome<Object> executeScalarWithOutcome() throws SQLException {
        AuditOutcome<Object> outcome = interceptor.intercept(connection, delegate, Execution.SCALAR);
        lastOutcome = outcome;
        return outcome;
    }

    /**
     * @return outcome of the latest execute call, {@code null} before the first one
     */
    public AuditOutcome<?> lastOutcome() {
        return lastOutcome;
    }

    @Override
    public int execute() throws SQLException {
        return executeWithOutcome().result();
    }

    @Override
    public Object executeScalar() throws SQLException {
        return executeScalarWithOutcome().result();
    }

    @Override
    public String getCommandText() {
        return delegate.getCommandText();
    }

    @Override
    public void setCommandText(String commandText) {
        delegate.setCommandText(commandText);
    }

    @Override
    public ParameterBindings getParameters() {
        return delegate.getParameters();
    }

    @Override
    public <T> T query(ResultSetHandler<T> handler) throws SQLException {
        return delegate.query(handler);
    }

    @Override
    public void prepare() throws SQLException {
        delegate.prepare();
    }

    @Override
    public void setQueryTimeout(int seconds) throws SQLException {
        delegate.setQueryTimeout(seconds);
    }

    @Override
    public int getQueryTimeout() {
        return delegate.getQueryTimeout();
    }

    @Override
    public void cancel() throws SQLException {
        delegate.cancel();
    }

    @Override
    public void close() throws SQLException {
        delegate.close();
    }
}
