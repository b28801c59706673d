package io.rowaudit.sql.runtime;

import com.typesafe.config.Config;
import io.rowaudit.sql.common.AuditSink;
import io.rowaudit.sql.common.model.AuditRecord;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class CollectingAuditSink implements AuditSink {

    static final List<AuditRecord> RECORDS = new CopyOnWriteArrayList<>();

    final String label;

    public CollectingAuditSink(Config config) {
        this.label = config.hasPath("label") ? config.getString("label") : "";
    }

    @Override
    public void write(AuditRecord record) {
        RECORDS.add(record);
    }
}
