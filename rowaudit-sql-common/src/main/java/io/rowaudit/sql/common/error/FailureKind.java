package io.rowaudit.sql.common.error;

/**
 * Failure categories of the audit pipeline. Only {@link #EXECUTION} reaches the caller; the others
 * are logged and reported through {@link AuditOutcome}.
 */
public enum FailureKind {
    /** Grammar error or unrecognised statement shape. The statement runs unaudited. */
    PARSE,
    /** Metadata lookup, rewrite anchor or snapshot read failed. The images are empty or partial. */
    CAPTURE,
    /** The real database call failed. Propagated unchanged, no audit record. */
    EXECUTION,
    /** The sink rejected the record. The caller already has its result. */
    DISPATCH
}
