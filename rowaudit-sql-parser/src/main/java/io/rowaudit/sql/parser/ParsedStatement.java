package io.rowaudit.sql.parser;

import io.rowaudit.sql.common.error.AuditFailure;

import java.util.List;

/**
 * Parse result. {@code failures} holds PARSE failures that were tolerated: a descriptor may be
 * auditable even though the text had a grammar error after its first statement.
 */
public record ParsedStatement(StatementDescriptor descriptor, List<AuditFailure> failures) {

    public ParsedStatement {
        failures = List.copyOf(failures);
    }

    public boolean isAuditable() {
        return descriptor.isAuditable();
    }
}
