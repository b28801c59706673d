package io.rowaudit.sql.common.command;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Source of JDBC connections, typically {@code dataSource::getConnection}. Callers close what they get.
 */
@FunctionalInterface
public interface ConnectionSupplier {
    Connection get() throws SQLException;
}
