package io.rowaudit.sql.interceptor.jdbc;

import io.rowaudit.sql.common.command.ConnectionSupplier;
import io.rowaudit.sql.interceptor.AuditInterceptor;

import javax.sql.DataSource;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;

/**
 * Opens JDBC connections wrapped for auditing, either from a {@link DataSource} or from a JDBC URL.
 */
public class AuditingConnectionFactory {

    private final ConnectionSupplier supplier;
    private final AuditInterceptor interceptor;

    public AuditingConnectionFactory(ConnectionSupplier supplier, AuditInterceptor interceptor) {
        this.supplier = supplier;
        this.interceptor = interceptor;
    }

    public static AuditingConnectionFactory of(DataSource dataSource, AuditInterceptor interceptor) {
        return new AuditingConnectionFactory(dataSource::getConnection, interceptor);
    }

    public static AuditingConnectionFactory of(String url, Properties properties, AuditInterceptor interceptor) {
        return new AuditingConnectionFactory(() -> DriverManager.getConnection(url, properties), interceptor);
    }

    public AuditingSqlConnection open() throws SQLException {
        return new AuditingSqlConnection(new JdbcSqlConnection(supplier.get()), interceptor);
    }

    public AuditInterceptor getInterceptor() {
        return interceptor;
    }
}
