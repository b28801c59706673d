package io.rowaudit.sql.interceptor.capture;

import io.rowaudit.sql.common.command.SqlCommand;
import io.rowaudit.sql.common.command.SqlConnection;
import io.rowaudit.sql.common.error.AuditFailure;
import io.rowaudit.sql.common.error.InterceptionState;
import io.rowaudit.sql.common.model.CaptureMode;
import io.rowaudit.sql.common.model.OperationKind;
import io.rowaudit.sql.common.model.ParameterBindings;
import io.rowaudit.sql.common.model.RowSnapshot;
import io.rowaudit.sql.interceptor.Execution;
import io.rowaudit.sql.parser.SqlIdentifiers;
import io.rowaudit.sql.parser.StatementDescriptor;
import io.rowaudit.sql.parser.ValueSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Captures images with separate SELECT statements around the real one. Not atomic: concurrent
 * writers between the reads and the statement make the images inaccurate.
 *
 * <p>An UPDATE or DELETE without WHERE gets an empty before-image. The after-image of an INSERT is
 * found by matching every bound value that is not database generated, newest row first.
 */
public class SelectReloadCaptureStrategy implements CaptureStrategy {

    private static final Logger logger = LoggerFactory.getLogger(SelectReloadCaptureStrategy.class);

    private final AutoGeneratedColumns autoGeneratedColumns;

    public SelectReloadCaptureStrategy(AutoGeneratedColumns autoGeneratedColumns) {
        this.autoGeneratedColumns = autoGeneratedColumns;
    }

    @Override
    public CaptureMode mode() {
        return CaptureMode.RELOAD;
    }

    @Override
    public <T> CaptureResult<T> capture(CaptureRequest request, Execution<T> execution) throws SQLException {
        StatementDescriptor descriptor = request.descriptor();
        OperationKind kind = descriptor.operationKind();
        List<AuditFailure> failures = new ArrayList<>();

        request.enter(InterceptionState.CAPTURE_BEFORE);
        RowSnapshot before = RowSnapshot.empty();
        if (kind != OperationKind.INSERT && descriptor.hasWhereClause()) {
            before = selectByWhere(request, "before", failures);
        }

        request.enter(InterceptionState.EXECUTE);
        T result = execution.run(request.command());
        long rowsAffected = result instanceof Integer count ? count : -1;

        request.enter(InterceptionState.CAPTURE_AFTER);
        RowSnapshot after = switch (kind) {
            case INSERT -> reloadInserted(request, failures);
            case UPDATE -> descriptor.hasWhereClause() ? selectByWhere(request, "after", failures) : RowSnapshot.empty();
            default -> RowSnapshot.empty();
        };
        return new CaptureResult<>(result, before, after, rowsAffected, failures, mode());
    }

    private RowSnapshot selectByWhere(CaptureRequest request, String stage, List<AuditFailure> failures) {
        StatementDescriptor descriptor = request.descriptor();
        String sql = "SELECT * FROM " + descriptor.qualifiedTableName() + " WHERE " + descriptor.whereClause();
        try {
            return selectFirstRow(request.connection(), sql, request.bindings());
        } catch (SQLException e) {
            logger.atWarn().setCause(e).log("Unable to reload {} image of {}", stage, descriptor.qualifiedTableName());
            failures.add(AuditFailure.capture(stage, "reload failed: " + e.getMessage(), e));
            return RowSnapshot.empty();
        }
    }

    private RowSnapshot reloadInserted(CaptureRequest request, List<AuditFailure> failures) {
        StatementDescriptor descriptor = request.descriptor();
        ParameterBindings bindings = request.bindings();
        Map<String, String> columnToParameter = matchableColumns(descriptor, bindings);
        if (!columnToParameter.isEmpty()) {
            List<String> conditions = new ArrayList<>();
            ParameterBindings selectBindings = new ParameterBindings();
            columnToParameter.forEach((column, parameter) -> {
                String name = ParameterBindings.SIGIL + ParameterBindings.stripSigil(parameter);
                conditions.add(SqlIdentifiers.quote(column) + " = " + name);
                selectBindings.bind(name, bindings.get(parameter));
            });
            String sql = "SELECT * FROM " + descriptor.qualifiedTableName()
                    + " WHERE " + String.join(" AND ", conditions) + " ORDER BY 1 DESC";
            try {
                RowSnapshot row = selectFirstRow(request.connection(), sql, selectBindings);
                if (!row.isEmpty()) {
                    return row;
                }
                logger.atDebug().log("No inserted row matched in {}", descriptor.qualifiedTableName());
            } catch (SQLException e) {
                logger.atWarn().setCause(e).log("Unable to reload inserted row of {}", descriptor.qualifiedTableName());
                failures.add(AuditFailure.capture("after", "reload failed: " + e.getMessage(), e));
            }
        }
        RowSnapshot parsed = fromInsertValues(descriptor, bindings);
        if (!parsed.isEmpty()) {
            return parsed;
        }
        var builder = RowSnapshot.builder();
        bindings.asMap().forEach((name, value) -> builder.put(ParameterBindings.stripSigil(name), value));
        return builder.build();
    }

    /**
     * @return column to parameter name, for every non-null binding whose column is not database
     * generated; a parameter feeding an INSERT column maps to that column, any other to its own name
     */
    private Map<String, String> matchableColumns(StatementDescriptor descriptor, ParameterBindings bindings) {
        Map<String, String> columns = new LinkedHashMap<>();
        for (String parameter : bindings.names()) {
            if (bindings.get(parameter) == null) {
                continue;
            }
            String column = insertColumnFedBy(descriptor, parameter);
            if (!autoGeneratedColumns.isAutoGenerated(column)) {
                columns.putIfAbsent(column, parameter);
            }
        }
        return columns;
    }

    private static String insertColumnFedBy(StatementDescriptor descriptor, String parameter) {
        String bare = ParameterBindings.stripSigil(parameter);
        List<ValueSource> values = descriptor.insertValues();
        for (int i = 0; i < values.size() && i < descriptor.insertColumns().size(); i++) {
            ValueSource value = values.get(i);
            if (value.isParameter() && ParameterBindings.stripSigil(value.parameterName()).equalsIgnoreCase(bare)) {
                return descriptor.insertColumns().get(i);
            }
        }
        return bare;
    }

    private static RowSnapshot fromInsertValues(StatementDescriptor descriptor, ParameterBindings bindings) {
        var builder = RowSnapshot.builder();
        List<ValueSource> values = descriptor.insertValues();
        for (int i = 0; i < values.size() && i < descriptor.insertColumns().size(); i++) {
            ValueSource value = values.get(i);
            if (value.kind() == ValueSource.Kind.PARAMETER || value.kind() == ValueSource.Kind.LITERAL) {
                builder.put(descriptor.insertColumns().get(i), value.resolve(bindings));
            }
        }
        return builder.build();
    }

    static RowSnapshot selectFirstRow(SqlConnection connection, String sql, ParameterBindings bindings)
            throws SQLException {
        try (SqlCommand select = connection.createCommand(sql)) {
            bindings.asMap().forEach(select.getParameters()::bind);
            return select.query(SelectReloadCaptureStrategy::firstRow);
        }
    }

    private static RowSnapshot firstRow(ResultSet resultSet) throws SQLException {
        if (!resultSet.next()) {
            return RowSnapshot.empty();
        }
        ResultSetMetaData metaData = resultSet.getMetaData();
        var builder = RowSnapshot.builder();
        for (int i = 1; i <= metaData.getColumnCount(); i++) {
            builder.put(metaData.getColumnLabel(i), resultSet.getObject(i));
        }
        return builder.build();
    }
}
