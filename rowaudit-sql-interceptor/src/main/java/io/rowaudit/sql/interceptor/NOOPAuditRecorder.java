package io.rowaudit.sql.interceptor;

import io.rowaudit.sql.common.error.FailureKind;
import io.rowaudit.sql.common.model.CaptureMode;
import io.rowaudit.sql.common.model.OperationKind;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Keeps plain counts in memory; used when no meter registry is configured.
 */
public class NOOPAuditRecorder implements AuditRecorder {

    private final AtomicLong passThrough = new AtomicLong();
    private final AtomicLong audited = new AtomicLong();
    private final AtomicLong notAudited = new AtomicLong();
    private final AtomicLong fallbacks = new AtomicLong();
    private final Map<FailureKind, AtomicLong> failures = new EnumMap<>(FailureKind.class);

    public NOOPAuditRecorder() {
        for (FailureKind kind : FailureKind.values()) {
            failures.put(kind, new AtomicLong());
        }
    }

    @Override
    public void recordPassThrough() {
        passThrough.incrementAndGet();
    }

    @Override
    public void recordAudited(OperationKind kind, CaptureMode mode, Duration elapsed) {
        audited.incrementAndGet();
    }

    @Override
    public void recordNotAudited(OperationKind kind) {
        notAudited.incrementAndGet();
    }

    @Override
    public void recordFailure(FailureKind kind) {
        failures.get(kind).incrementAndGet();
    }

    @Override
    public void recordFallback() {
        fallbacks.incrementAndGet();
    }

    public long getPassThroughCount() {
        return passThrough.get();
    }

    public long getAuditedCount() {
        return audited.get();
    }

    public long getNotAuditedCount() {
        return notAudited.get();
    }

    public long getFallbackCount() {
        return fallbacks.get();
    }

    public long getFailureCount(FailureKind kind) {
        return failures.get(kind).get();
    }
}
