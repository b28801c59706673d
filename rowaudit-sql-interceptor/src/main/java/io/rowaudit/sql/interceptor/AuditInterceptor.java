package io.rowaudit.sql.interceptor;

import io.rowaudit.sql.common.ActorContextProvider;
import io.rowaudit.sql.common.AuditSink;
import io.rowaudit.sql.common.command.SqlCommand;
import io.rowaudit.sql.common.command.SqlConnection;
import io.rowaudit.sql.common.error.AuditFailure;
import io.rowaudit.sql.common.error.AuditOutcome;
import io.rowaudit.sql.common.error.InterceptionState;
import io.rowaudit.sql.common.error.OutcomeStatus;
import io.rowaudit.sql.common.model.AuditRecord;
import io.rowaudit.sql.common.model.CaptureMode;
import io.rowaudit.sql.common.model.ParameterBindings;
import io.rowaudit.sql.interceptor.capture.AutoGeneratedColumns;
import io.rowaudit.sql.interceptor.capture.CaptureException;
import io.rowaudit.sql.interceptor.capture.CaptureRequest;
import io.rowaudit.sql.interceptor.capture.CaptureResult;
import io.rowaudit.sql.interceptor.capture.CaptureStrategy;
import io.rowaudit.sql.interceptor.capture.QueryRewriteCaptureStrategy;
import io.rowaudit.sql.interceptor.capture.SelectReloadCaptureStrategy;
import io.rowaudit.sql.interceptor.metadata.InformationSchemaMetadataSource;
import io.rowaudit.sql.interceptor.metadata.TableMetadataCache;
import io.rowaudit.sql.parser.ParsedStatement;
import io.rowaudit.sql.parser.StatementDescriptor;
import io.rowaudit.sql.parser.StatementParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Drives one intercepted execution: classify the text, capture around the real statement, build
 * the record and hand it to the sink.
 *
 * <p>The real statement runs exactly once whatever happens around it. Its {@link SQLException}
 * reaches the caller unchanged and produces no record. Any later failure is logged and reported
 * in the {@link AuditOutcome}, never thrown.
 *
 * <p>One interceptor is shared by all connections it audits; the metadata cache is its only
 * mutable state.
 */
public class AuditInterceptor {

    private static final Logger logger = LoggerFactory.getLogger(AuditInterceptor.class);

    private final AuditInterceptorConfig config;
    private final StatementParser parser;
    private final TableMetadataCache metadataCache;
    private final CaptureStrategy rewriteStrategy;
    private final SelectReloadCaptureStrategy reloadStrategy;
    private final AuditRecordAssembler assembler;
    private final AuditRecorder recorder;

    public AuditInterceptor(AuditSink sink) {
        this(AuditInterceptorConfig.defaults(), sink, ActorContextProvider.NONE);
    }

    public AuditInterceptor(AuditInterceptorConfig config, AuditSink sink, ActorContextProvider actorContextProvider) {
        this(config,
                new TableMetadataCache(new InformationSchemaMetadataSource(),
                        config.metadataExpireAfterWrite(), config.metadataMaximumSize()),
                new AuditRecordAssembler(sink, actorContextProvider),
                new NOOPAuditRecorder());
    }

    public AuditInterceptor(AuditInterceptorConfig config,
                            TableMetadataCache metadataCache,
                            AuditRecordAssembler assembler,
                            AuditRecorder recorder) {
        this.config = config;
        this.parser = new StatementParser();
        this.metadataCache = metadataCache;
        this.rewriteStrategy = new QueryRewriteCaptureStrategy(metadataCache);
        this.reloadStrategy = new SelectReloadCaptureStrategy(new AutoGeneratedColumns(config.autoGeneratedColumns()));
        this.assembler = assembler;
        this.recorder = recorder;
    }

    public TableMetadataCache getMetadataCache() {
        return metadataCache;
    }

    public AuditInterceptorConfig getConfig() {
        return config;
    }

    public boolean isAuditable(String commandText) {
        return parser.isAuditable(commandText);
    }

    /**
     * @param connection the connection {@code command} runs on, used for metadata and reload queries
     * @throws SQLException only when the real statement fails
     */
    public <T> AuditOutcome<T> intercept(SqlConnection connection, SqlCommand command, Execution<T> execution)
            throws SQLException {
        List<InterceptionState> states = new ArrayList<>();
        List<AuditFailure> failures = new ArrayList<>();
        states.add(InterceptionState.IDLE);
        states.add(InterceptionState.CLASSIFYING);

        String commandText = command.getCommandText();
        ParsedStatement parsed = classify(commandText);
        failures.addAll(parsed.failures());
        StatementDescriptor descriptor = parsed.descriptor();

        if (!parsed.isAuditable()) {
            states.add(InterceptionState.NOT_AUDITABLE);
            states.add(InterceptionState.PASS_THROUGH_EXECUTE);
            T result = execution.run(command);
            states.add(InterceptionState.IDLE);
            failures.forEach(f -> recorder.recordFailure(f.kind()));
            recorder.recordPassThrough();
            return new AuditOutcome<>(result, OutcomeStatus.PASS_THROUGH, null, failures, states);
        }

        states.add(InterceptionState.AUDITABLE);
        String eventName = descriptor.operationKind().eventName(descriptor.tableName());
        ParameterBindings bindings = command.getParameters().copy();
        CaptureRequest request = new CaptureRequest(connection, command, descriptor, bindings, states::add);

        long start = System.nanoTime();
        CaptureResult<T> capture = capture(request, execution, failures);
        if (capture == null) {
            // neither strategy applies: run the statement as it is
            states.add(InterceptionState.EXECUTE);
            T result = execution.run(command);
            states.add(InterceptionState.IDLE);
            failures.forEach(f -> recorder.recordFailure(f.kind()));
            recorder.recordNotAudited(descriptor.operationKind());
            logger.atWarn().log("{} executed without audit: {}", eventName, failures.get(failures.size() - 1).message());
            return new AuditOutcome<>(result, OutcomeStatus.NOT_AUDITED, eventName, failures, states);
        }
        failures.addAll(capture.failures());

        states.add(InterceptionState.ASSEMBLE);
        Optional<AuditRecord> record = assemble(commandText, descriptor, bindings, capture, failures);
        if (record.isPresent()) {
            states.add(InterceptionState.DISPATCH);
            assembler.dispatch(record.get()).ifPresent(failures::add);
        }
        states.add(InterceptionState.IDLE);

        failures.forEach(f -> recorder.recordFailure(f.kind()));
        recorder.recordAudited(descriptor.operationKind(), capture.mode(),
                Duration.ofNanos(System.nanoTime() - start));
        OutcomeStatus status = failures.isEmpty() ? OutcomeStatus.AUDITED : OutcomeStatus.DEGRADED;
        logger.atDebug().log("{} {} via {}", eventName, status, capture.mode());
        return new AuditOutcome<>(capture.result(), status, eventName, failures, states);
    }

    private ParsedStatement classify(String commandText) {
        try {
            return parser.parse(commandText);
        } catch (RuntimeException e) {
            logger.atError().setCause(e).log("Classification failed, executing without audit");
            return new ParsedStatement(StatementDescriptor.unknown(),
                    List.of(AuditFailure.parse("classify", "classification failed: " + e.getMessage(), e)));
        }
    }

    /**
     * @return the capture, or {@code null} when no strategy applies and the statement has not run
     */
    private <T> CaptureResult<T> capture(CaptureRequest request, Execution<T> execution, List<AuditFailure> failures)
            throws SQLException {
        if (config.captureStrategy() == CaptureMode.RELOAD) {
            return reloadStrategy.capture(request, execution);
        }
        try {
            return rewriteStrategy.capture(request, execution);
        } catch (CaptureException e) {
            logger.atDebug().log("Query rewrite not applicable to {}: {}",
                    request.descriptor().qualifiedTableName(), e.getMessage());
            failures.add(AuditFailure.capture("rewrite", e.getMessage(), e));
        }
        if (!config.fallbackToReload()) {
            return null;
        }
        recorder.recordFallback();
        return reloadStrategy.capture(request, execution);
    }

    private Optional<AuditRecord> assemble(String commandText, StatementDescriptor descriptor, ParameterBindings bindings,
                                           CaptureResult<?> capture, List<AuditFailure> failures) {
        try {
            return Optional.of(assembler.assemble(commandText, descriptor, bindings, capture, failures));
        } catch (RuntimeException e) {
            logger.atError().setCause(e).log("Unable to assemble audit record for {}", descriptor.tableName());
            failures.add(AuditFailure.capture("assemble", "record assembly failed: " + e.getMessage(), e));
            return Optional.empty();
        }
    }
}
