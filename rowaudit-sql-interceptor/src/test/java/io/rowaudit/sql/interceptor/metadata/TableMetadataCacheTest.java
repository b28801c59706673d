package io.rowaudit.sql.interceptor.metadata;

import io.rowaudit.sql.common.command.SqlConnection;
import io.rowaudit.sql.interceptor.DuckDBTestSupport;
import io.rowaudit.sql.interceptor.jdbc.JdbcSqlConnection;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

public class TableMetadataCacheTest {

    @Test
    public void testInformationSchemaColumnsInOrdinalOrder() throws SQLException {
        try (var connection = new JdbcSqlConnection(DuckDBTestSupport.connection(
                "CREATE SCHEMA sales",
                "CREATE TABLE sales.Orders (OrderId INTEGER, Product VARCHAR, Amount DECIMAL(10, 2))"))) {
            var cache = new TableMetadataCache(new InformationSchemaMetadataSource());

            assertEquals(List.of("OrderId", "Product", "Amount"), cache.getColumns(connection, "sales", "Orders"));
            assertEquals(List.of("OrderId", "Product", "Amount"), cache.getColumns(connection, "", "Orders"));
            assertEquals(List.of(), cache.getColumns(connection, "sales", "Missing"));
        }
    }

    @Test
    public void testUnqualifiedNameInSeveralSchemasHasNoColumns() throws SQLException {
        try (var connection = new JdbcSqlConnection(DuckDBTestSupport.connection(
                "CREATE TABLE Users (Id INTEGER, Email VARCHAR)",
                "CREATE SCHEMA archive",
                "CREATE TABLE archive.Users (Id INTEGER, ArchivedAt TIMESTAMP)"))) {
            var cache = new TableMetadataCache(new InformationSchemaMetadataSource());

            assertEquals(List.of(), cache.getColumns(connection, "", "Users"));
            assertEquals(0, cache.size());
            assertEquals(List.of("Id", "Email"), cache.getColumns(connection, "main", "Users"));
            assertEquals(List.of("Id", "ArchivedAt"), cache.getColumns(connection, "archive", "Users"));
        }
    }

    @Test
    public void testKeyIsCaseInsensitive() {
        var loads = new AtomicInteger();
        var cache = new TableMetadataCache((c, schema, table) -> {
            loads.incrementAndGet();
            return List.of("Id");
        });
        SqlConnection connection = mock(SqlConnection.class);

        cache.getColumns(connection, "dbo", "Users");
        cache.getColumns(connection, "DBO", "users");

        assertEquals(1, loads.get());
        assertEquals("dbo.users", TableMetadataCache.key("DBO", "Users"));
        assertEquals(".users", TableMetadataCache.key(null, "Users"));
    }

    @Test
    public void testFailuresAndEmptyResultsAreNotCached() {
        var loads = new AtomicInteger();
        var cache = new TableMetadataCache((c, schema, table) -> {
            if (loads.incrementAndGet() == 1) {
                throw new SQLException("connection reset");
            }
            return loads.get() == 2 ? List.of() : List.of("Id");
        });
        SqlConnection connection = mock(SqlConnection.class);

        assertEquals(List.of(), cache.getColumns(connection, "", "T"));
        assertEquals(List.of(), cache.getColumns(connection, "", "T"));
        assertEquals(List.of("Id"), cache.getColumns(connection, "", "T"));
        assertEquals(List.of("Id"), cache.getColumns(connection, "", "T"));
        assertEquals(3, loads.get());
    }

    @Test
    public void testInvalidate() {
        var loads = new AtomicInteger();
        var cache = new TableMetadataCache((c, schema, table) -> List.of("v" + loads.incrementAndGet()));
        SqlConnection connection = mock(SqlConnection.class);

        assertEquals(List.of("v1"), cache.getColumns(connection, "s", "a"));
        cache.invalidate("S", "A");
        assertEquals(List.of("v2"), cache.getColumns(connection, "s", "a"));
        cache.getColumns(connection, "s", "b");
        assertEquals(2, cache.size());
        cache.invalidateAll();
        assertEquals(0, cache.size());
    }

    @Test
    public void testConcurrentCallersLoadOnce() throws InterruptedException {
        var loads = new AtomicInteger();
        var cache = new TableMetadataCache((c, schema, table) -> {
            loads.incrementAndGet();
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return List.of("Id");
        });
        SqlConnection connection = mock(SqlConnection.class);
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        var start = new CountDownLatch(1);
        try {
            for (int i = 0; i < threads; i++) {
                executor.submit(() -> {
                    start.await();
                    return cache.getColumns(connection, "dbo", "Users");
                });
            }
            start.countDown();
        } finally {
            executor.shutdown();
        }
        assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
        assertEquals(1, loads.get());
    }
}
