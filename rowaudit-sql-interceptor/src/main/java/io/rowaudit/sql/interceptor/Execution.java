package io.rowaudit.sql.interceptor;

import io.rowaudit.sql.common.command.SqlCommand;

import java.sql.SQLException;
import java.util.function.IntFunction;

/**
 * How the caller wants the intercepted command to run.
 *
 * @param fromOutputRows result to hand back when the statement ran with an OUTPUT clause, given the
 *                       number of rows it returned
 */
public record Execution<T>(String name, Runner<T> runner, IntFunction<T> fromOutputRows) {

    public static final Execution<Integer> NON_QUERY =
            new Execution<>("non_query", SqlCommand::execute, rows -> rows);

    // a data modification without OUTPUT has no scalar to return
    public static final Execution<Object> SCALAR =
            new Execution<>("scalar", SqlCommand::executeScalar, rows -> null);

    @FunctionalInterface
    public interface Runner<T> {
        T run(SqlCommand command) throws SQLException;
    }

    public T run(SqlCommand command) throws SQLException {
        return runner.run(command);
    }
}
