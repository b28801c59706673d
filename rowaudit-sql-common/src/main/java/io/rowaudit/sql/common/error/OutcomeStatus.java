package io.rowaudit.sql.common.error;

public enum OutcomeStatus {
    /** Not an INSERT, UPDATE or DELETE. Executed as is. */
    PASS_THROUGH,
    /** Executed and a complete audit record was dispatched. */
    AUDITED,
    /** Executed and a record was produced, but capture or dispatch failed along the way. */
    DEGRADED,
    /** Auditable, but no capture strategy could be applied. Executed without a record. */
    NOT_AUDITED
}
