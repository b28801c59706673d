package io.rowaudit.sql.sink;

import com.typesafe.config.Config;
import io.rowaudit.sql.common.AuditSink;
import io.rowaudit.sql.common.config.ConfigBasedProvider;
import io.rowaudit.sql.common.config.ConfigConstants;
import io.rowaudit.sql.common.model.AuditRecord;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Forwards records of selected tables only. Names match case-insensitively, either bare
 * ({@code Users}) or schema qualified ({@code dbo.Users}). An empty include list admits every
 * table; the exclude list wins over it.
 */
public class TableFilteringAuditSink implements AuditSink {

    private final AuditSink delegate;
    private final Set<String> include;
    private final Set<String> exclude;

    public TableFilteringAuditSink(AuditSink delegate, Collection<String> include, Collection<String> exclude) {
        this.delegate = delegate;
        this.include = normalize(include);
        this.exclude = normalize(exclude);
    }

    public TableFilteringAuditSink(Config config) throws Exception {
        this(ConfigBasedProvider.load(config, ConfigConstants.DELEGATE_PREFIX, AuditSink.class),
                config.hasPath(ConfigConstants.INCLUDE_TABLES_KEY)
                        ? config.getStringList(ConfigConstants.INCLUDE_TABLES_KEY) : Set.of(),
                config.hasPath(ConfigConstants.EXCLUDE_TABLES_KEY)
                        ? config.getStringList(ConfigConstants.EXCLUDE_TABLES_KEY) : Set.of());
    }

    private static Set<String> normalize(Collection<String> names) {
        return names.stream().map(n -> n.toLowerCase(Locale.ROOT)).collect(Collectors.toUnmodifiableSet());
    }

    public boolean accepts(AuditRecord record) {
        String table = record.tableName().toLowerCase(Locale.ROOT);
        String qualified = record.schemaName() == null || record.schemaName().isEmpty()
                ? table
                : record.schemaName().toLowerCase(Locale.ROOT) + "." + table;
        if (exclude.contains(table) || exclude.contains(qualified)) {
            return false;
        }
        return include.isEmpty() || include.contains(table) || include.contains(qualified);
    }

    @Override
    public void write(AuditRecord record) throws Exception {
        if (accepts(record)) {
            delegate.write(record);
        }
    }
}
