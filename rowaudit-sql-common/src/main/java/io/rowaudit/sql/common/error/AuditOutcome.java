package io.rowaudit.sql.common.error;

import java.util.List;
import java.util.Objects;

/**
 * Result of one intercepted execution: the value the database returned plus what happened to the
 * audit around it. {@code result} is always the unmodified database result.
 *
 * @param states the interception states visited, in order
 */
public record AuditOutcome<T>(T result,
                              OutcomeStatus status,
                              String eventName,
                              List<AuditFailure> failures,
                              List<InterceptionState> states) {

    public AuditOutcome {
        Objects.requireNonNull(status, "status must not be null");
        failures = List.copyOf(failures);
        states = List.copyOf(states);
    }

    public boolean hasFailure(FailureKind kind) {
        return failures.stream().anyMatch(f -> f.kind() == kind);
    }

    public boolean isAudited() {
        return status == OutcomeStatus.AUDITED || status == OutcomeStatus.DEGRADED;
    }
}
