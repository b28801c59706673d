package io.rowaudit.sql.sink;

import com.typesafe.config.Config;
import io.rowaudit.sql.common.AuditSink;
import io.rowaudit.sql.common.config.ConfigBasedProvider;
import io.rowaudit.sql.common.config.ConfigConstants;
import io.rowaudit.sql.common.model.AuditRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Hands each record to every sink, even when an earlier one fails. The first failure is rethrown
 * with the others attached as suppressed exceptions.
 * <pre>{@code
 * sink {
 *   class = "io.rowaudit.sql.sink.CompositeAuditSink"
 *   sinks = [
 *     { class = "io.rowaudit.sql.sink.LoggingAuditSink" }
 *     { class = "io.rowaudit.sql.sink.JdbcAuditSink", connection { url = "jdbc:sqlserver://..." } }
 *   ]
 * }
 * }</pre>
 */
public class CompositeAuditSink implements AuditSink {

    private final List<AuditSink> sinks;

    public CompositeAuditSink(List<AuditSink> sinks) {
        this.sinks = List.copyOf(sinks);
    }

    public CompositeAuditSink(Config config) throws Exception {
        List<AuditSink> loaded = new ArrayList<>();
        for (Config sinkConfig : config.getConfigList(ConfigConstants.SINKS_KEY)) {
            loaded.add(ConfigBasedProvider.instantiate(sinkConfig, AuditSink.class));
        }
        this.sinks = List.copyOf(loaded);
    }

    @Override
    public void write(AuditRecord record) throws Exception {
        Exception failure = null;
        for (AuditSink sink : sinks) {
            try {
                sink.write(record);
            } catch (Exception e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    public List<AuditSink> getSinks() {
        return sinks;
    }
}
