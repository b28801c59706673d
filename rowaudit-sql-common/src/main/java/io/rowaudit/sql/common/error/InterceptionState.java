package io.rowaudit.sql.common.error;

/**
 * States of one intercepted execution.
 *
 * <pre>
 * IDLE -> CLASSIFYING -> NOT_AUDITABLE -> PASS_THROUGH_EXECUTE -> IDLE
 *                     -> AUDITABLE -> CAPTURE_BEFORE -> EXECUTE -> CAPTURE_AFTER -> ASSEMBLE -> DISPATCH -> IDLE
 * </pre>
 */
public enum InterceptionState {
    IDLE,
    CLASSIFYING,
    NOT_AUDITABLE,
    PASS_THROUGH_EXECUTE,
    AUDITABLE,
    CAPTURE_BEFORE,
    EXECUTE,
    CAPTURE_AFTER,
    ASSEMBLE,
    DISPATCH
}
