package io.rowaudit.sql.interceptor.capture;

import io.rowaudit.sql.common.command.SqlCommand;
import io.rowaudit.sql.common.error.InterceptionState;
import io.rowaudit.sql.common.model.CaptureMode;
import io.rowaudit.sql.common.model.OperationKind;
import io.rowaudit.sql.common.model.RowSnapshot;
import io.rowaudit.sql.interceptor.Execution;
import io.rowaudit.sql.interceptor.metadata.TableMetadataCache;
import io.rowaudit.sql.parser.StatementDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

/**
 * Captures both images in the same round trip as the statement by rewriting it with an
 * {@code OUTPUT} clause. Atomic with the modification, so preferred whenever it applies.
 */
public class QueryRewriteCaptureStrategy implements CaptureStrategy {

    private static final Logger logger = LoggerFactory.getLogger(QueryRewriteCaptureStrategy.class);

    private final TableMetadataCache metadataCache;

    public QueryRewriteCaptureStrategy(TableMetadataCache metadataCache) {
        this.metadataCache = metadataCache;
    }

    @Override
    public CaptureMode mode() {
        return CaptureMode.REWRITE;
    }

    @Override
    public <T> CaptureResult<T> capture(CaptureRequest request, Execution<T> execution)
            throws CaptureException, SQLException {
        StatementDescriptor descriptor = request.descriptor();
        List<String> columns = metadataCache.getColumns(request.connection(),
                descriptor.schemaName(), descriptor.tableName());
        if (columns.isEmpty()) {
            throw new CaptureException("no columns known for " + descriptor.qualifiedTableName());
        }
        SqlCommand command = request.command();
        String original = command.getCommandText();
        String rewritten = OutputClauseRewriter.rewrite(original, descriptor.operationKind(), columns);
        logger.atDebug().log("Rewritten command: {}", rewritten);

        request.enter(InterceptionState.CAPTURE_BEFORE);
        command.setCommandText(rewritten);
        try {
            request.enter(InterceptionState.EXECUTE);
            Images images = command.query(resultSet -> read(resultSet, descriptor.operationKind(), columns));
            request.enter(InterceptionState.CAPTURE_AFTER);
            T result = execution.fromOutputRows().apply(images.rows());
            return new CaptureResult<>(result, images.before(), images.after(), images.rows(), List.of(), mode());
        } finally {
            command.setCommandText(original);
        }
    }

    private record Images(RowSnapshot before, RowSnapshot after, int rows) {
    }

    // columns come back in OutputClauseRewriter.outputColumns order; for multi-row statements the last row wins
    private static Images read(ResultSet resultSet, OperationKind kind, List<String> columns) throws SQLException {
        var before = RowSnapshot.builder();
        var after = RowSnapshot.builder();
        int rows = 0;
        while (resultSet.next()) {
            rows++;
            int index = 1;
            for (String column : columns) {
                switch (kind) {
                    case INSERT -> after.put(column, resultSet.getObject(index++));
                    case DELETE -> before.put(column, resultSet.getObject(index++));
                    case UPDATE -> {
                        before.put(column, resultSet.getObject(index++));
                        after.put(column, resultSet.getObject(index++));
                    }
                    default -> throw new IllegalStateException("Unexpected operation " + kind);
                }
            }
        }
        return new Images(before.build(), after.build(), rows);
    }
}
