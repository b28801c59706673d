package io.rowaudit.sql.common;

import io.rowaudit.sql.common.model.AuditRecord;

/**
 * Consumer of finished audit records. Called once per audited execution, on the thread that ran
 * the statement. Implementations may persist, forward, fan out or filter; whatever they throw is
 * logged by the caller and never reaches application code.
 */
@FunctionalInterface
public interface AuditSink {

    void write(AuditRecord record) throws Exception;
}
