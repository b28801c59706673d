package io.rowaudit.sql.interceptor.metadata;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import io.rowaudit.sql.common.command.SqlConnection;
import io.rowaudit.sql.common.error.RuntimeSqlException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Column lists per table, shared by every connection of an interceptor.
 *
 * <p>A key is loaded at most once at a time; loads of other keys are not blocked. Failed or empty
 * lookups are not cached, so the next call retries.
 */
public class TableMetadataCache {

    private static final Logger logger = LoggerFactory.getLogger(TableMetadataCache.class);

    private final TableMetadataSource source;
    private final Cache<String, List<String>> cache;

    public TableMetadataCache(TableMetadataSource source) {
        this(source, Duration.ZERO, 10_000);
    }

    /**
     * @param expireAfterWrite zero or negative keeps entries until invalidated
     */
    public TableMetadataCache(TableMetadataSource source, Duration expireAfterWrite, long maximumSize) {
        this.source = source;
        var builder = CacheBuilder.newBuilder().maximumSize(maximumSize);
        if (expireAfterWrite != null && !expireAfterWrite.isZero() && !expireAfterWrite.isNegative()) {
            builder.expireAfterWrite(expireAfterWrite.toMillis(), TimeUnit.MILLISECONDS);
        }
        this.cache = builder.build();
    }

    public static String key(String schema, String table) {
        return ((schema == null ? "" : schema) + "." + table).toLowerCase(Locale.ROOT);
    }

    /**
     * @return ordered column names, or an empty list when they could not be loaded
     */
    public List<String> getColumns(SqlConnection connection, String schema, String table) {
        String key = key(schema, table);
        try {
            List<String> columns = cache.get(key, () -> load(connection, schema, table));
            if (columns.isEmpty()) {
                cache.invalidate(key);
            }
            return columns;
        } catch (ExecutionException | RuntimeException e) {
            Throwable cause = e.getCause() instanceof RuntimeSqlException r ? r.getSqlException() : e.getCause();
            logger.atWarn().setCause(cause == null ? e : cause)
                    .log("Unable to load columns of {}", key);
            return List.of();
        }
    }

    private List<String> load(SqlConnection connection, String schema, String table) {
        try {
            List<String> columns = List.copyOf(source.loadColumns(connection, schema, table));
            logger.atDebug().log("Loaded {} columns for {}.{}", columns.size(), schema, table);
            return columns;
        } catch (SQLException e) {
            throw new RuntimeSqlException(e);
        }
    }

    public void invalidate(String schema, String table) {
        cache.invalidate(key(schema, table));
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    public long size() {
        return cache.size();
    }
}
