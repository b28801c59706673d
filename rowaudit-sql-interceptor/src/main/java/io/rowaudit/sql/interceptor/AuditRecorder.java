package io.rowaudit.sql.interceptor;

import io.rowaudit.sql.common.error.FailureKind;
import io.rowaudit.sql.common.model.CaptureMode;
import io.rowaudit.sql.common.model.OperationKind;

import java.time.Duration;

public interface AuditRecorder {

    void recordPassThrough();

    void recordAudited(OperationKind kind, CaptureMode mode, Duration elapsed);

    void recordNotAudited(OperationKind kind);

    void recordFailure(FailureKind kind);

    void recordFallback();
}
