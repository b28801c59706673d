package io.rowaudit.sql.interceptor;

import io.rowaudit.sql.common.ActorContextProvider;
import io.rowaudit.sql.common.AuditSink;
import io.rowaudit.sql.common.error.AuditFailure;
import io.rowaudit.sql.common.model.ActorContext;
import io.rowaudit.sql.common.model.AuditRecord;
import io.rowaudit.sql.common.model.ParameterBindings;
import io.rowaudit.sql.interceptor.capture.CaptureResult;
import io.rowaudit.sql.parser.StatementDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Turns a capture into an {@link AuditRecord} and hands it to the sink on the calling thread.
 */
public class AuditRecordAssembler {

    private static final Logger logger = LoggerFactory.getLogger(AuditRecordAssembler.class);

    private final AuditSink sink;
    private final ActorContextProvider actorContextProvider;
    private final Clock clock;
    private final String machineName;
    private final long processId;

    public AuditRecordAssembler(AuditSink sink, ActorContextProvider actorContextProvider) {
        this(sink, actorContextProvider, Clock.systemUTC(), defaultHostname());
    }

    public AuditRecordAssembler(AuditSink sink, ActorContextProvider actorContextProvider,
                                Clock clock, String machineName) {
        this.sink = sink;
        this.actorContextProvider = actorContextProvider == null ? ActorContextProvider.NONE : actorContextProvider;
        this.clock = clock;
        this.machineName = machineName;
        this.processId = ProcessHandle.current().pid();
    }

    private static String defaultHostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "localhost";
        }
    }

    public AuditRecord assemble(String commandText, StatementDescriptor descriptor, ParameterBindings bindings,
                                CaptureResult<?> capture, List<AuditFailure> failures) {
        return AuditRecord.builder()
                .timestamp(clock.instant())
                .eventName(descriptor.operationKind().eventName(descriptor.tableName()))
                .query(commandText)
                .parameters(bindings.asMap())
                .beforeImage(capture.before())
                .afterImage(capture.after())
                .schemaName(descriptor.schemaName())
                .tableName(descriptor.tableName())
                .operationType(descriptor.operationKind())
                .captureMode(capture.mode())
                .rowsAffected(capture.rowsAffected())
                .actor(currentActor(failures))
                .machineName(machineName)
                .processId(processId)
                .threadId(Thread.currentThread().getId())
                .build();
    }

    private ActorContext currentActor(List<AuditFailure> failures) {
        try {
            return actorContextProvider.currentContext().orElse(null);
        } catch (RuntimeException e) {
            logger.atWarn().setCause(e).log("Actor context provider failed, recording without actor");
            failures.add(AuditFailure.capture("actor", "actor context unavailable: " + e.getMessage(), e));
            return null;
        }
    }

    /**
     * @return the failure when the sink rejected the record
     */
    public Optional<AuditFailure> dispatch(AuditRecord record) {
        try {
            sink.write(record);
            return Optional.empty();
        } catch (Exception e) {
            logger.atError().setCause(e).log("Audit sink failed to write {}", record.eventName());
            return Optional.of(AuditFailure.dispatch("dispatch", "sink failed: " + e.getMessage(), e));
        }
    }
}
