package io.rowaudit.sql.interceptor.capture;

import io.rowaudit.sql.common.model.CaptureMode;
import io.rowaudit.sql.interceptor.Execution;

import java.sql.SQLException;

/**
 * Runs a data modification statement exactly once and captures the row before and after it.
 */
public interface CaptureStrategy {

    CaptureMode mode();

    /**
     * @throws CaptureException the strategy does not apply; the statement has not run
     * @throws SQLException     the statement itself failed
     */
    <T> CaptureResult<T> capture(CaptureRequest request, Execution<T> execution)
            throws CaptureException, SQLException;
}
