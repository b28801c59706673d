package io.rowaudit.sql.common.error;

import java.util.Objects;

public record AuditFailure(FailureKind kind, String stage, String message, Throwable cause) {

    public AuditFailure {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(stage, "stage must not be null");
    }

    public static AuditFailure parse(String stage, String message, Throwable cause) {
        return new AuditFailure(FailureKind.PARSE, stage, message, cause);
    }

    public static AuditFailure capture(String stage, String message, Throwable cause) {
        return new AuditFailure(FailureKind.CAPTURE, stage, message, cause);
    }

    public static AuditFailure dispatch(String stage, String message, Throwable cause) {
        return new AuditFailure(FailureKind.DISPATCH, stage, message, cause);
    }
}
