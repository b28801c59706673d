package io.rowaudit.sql.interceptor;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.rowaudit.sql.common.error.FailureKind;
import io.rowaudit.sql.common.model.CaptureMode;
import io.rowaudit.sql.common.model.OperationKind;

import java.time.Duration;

public class MicroMeterAuditRecorder implements AuditRecorder {

    private static final String PREFIX = "rowaudit.interceptor.";

    private final MeterRegistry registry;
    private final String instanceId;

    // -------------------- Counters -------------------------
    private final Counter passThroughCounter;
    private final Counter fallbackCounter;

    public MicroMeterAuditRecorder(MeterRegistry registry, String instanceId) {
        this.registry = registry;
        this.instanceId = instanceId;
        this.passThroughCounter = counter("pass_through").register(registry);
        this.fallbackCounter = counter("fallback").register(registry);
    }

    private Counter.Builder counter(String name) {
        return Counter.builder(PREFIX + name + ".count")
                .tag("instance", instanceId);
    }

    @Override
    public void recordPassThrough() {
        passThroughCounter.increment();
    }

    @Override
    public void recordAudited(OperationKind kind, CaptureMode mode, Duration elapsed) {
        counter("audited")
                .tag("operation", kind.name())
                .tag("mode", mode.name())
                .register(registry)
                .increment();
        Timer.builder(PREFIX + "capture.timer")
                .tag("instance", instanceId)
                .tag("mode", mode.name())
                .register(registry)
                .record(elapsed);
    }

    @Override
    public void recordNotAudited(OperationKind kind) {
        counter("not_audited").tag("operation", kind.name()).register(registry).increment();
    }

    @Override
    public void recordFailure(FailureKind kind) {
        counter("failure").tag("kind", kind.name()).register(registry).increment();
    }

    @Override
    public void recordFallback() {
        fallbackCounter.increment();
    }
}
