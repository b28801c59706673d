package io.rowaudit.sql.interceptor.capture;

import io.rowaudit.sql.common.error.AuditFailure;
import io.rowaudit.sql.common.model.CaptureMode;
import io.rowaudit.sql.common.model.RowSnapshot;

import java.util.List;

/**
 * @param result       the value the real statement produced, returned to the caller unchanged
 * @param rowsAffected rows the statement touched, -1 when unknown
 * @param failures     capture problems that left an image empty or partial
 */
public record CaptureResult<T>(T result,
                               RowSnapshot before,
                               RowSnapshot after,
                               long rowsAffected,
                               List<AuditFailure> failures,
                               CaptureMode mode) {

    public CaptureResult {
        before = before == null ? RowSnapshot.empty() : before;
        after = after == null ? RowSnapshot.empty() : after;
        failures = List.copyOf(failures);
    }
}
