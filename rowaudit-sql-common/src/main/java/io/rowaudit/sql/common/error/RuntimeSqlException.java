package io.rowaudit.sql.common.error;

import java.sql.SQLException;

/**
 * Carries a {@link SQLException} through code paths that cannot declare it, such as cache loaders.
 */
public class RuntimeSqlException extends RuntimeException {
    final SQLException sqlException;

    public RuntimeSqlException(SQLException sqlException) {
        super(sqlException);
        this.sqlException = sqlException;
    }

    public SQLException getSqlException() {
        return sqlException;
    }
}
