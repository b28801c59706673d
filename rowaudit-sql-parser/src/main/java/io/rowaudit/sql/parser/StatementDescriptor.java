package io.rowaudit.sql.parser;

import io.rowaudit.sql.common.model.OperationKind;

import java.util.List;
import java.util.Objects;

/**
 * Structured form of one INSERT, UPDATE or DELETE statement.
 *
 * @param whereClause text after the statement-level WHERE keyword, verbatim from the source so
 *                    parameter references survive; empty when there is none
 */
public record StatementDescriptor(OperationKind operationKind,
                                  String schemaName,
                                  String tableName,
                                  String whereClause,
                                  List<String> insertColumns,
                                  List<ValueSource> insertValues,
                                  List<UpdateAssignment> updateFields) {

    private static final StatementDescriptor UNKNOWN =
            new StatementDescriptor(OperationKind.UNKNOWN, "", "", "", List.of(), List.of(), List.of());

    public StatementDescriptor {
        Objects.requireNonNull(operationKind, "operationKind must not be null");
        schemaName = schemaName == null ? "" : schemaName;
        tableName = tableName == null ? "" : tableName;
        whereClause = whereClause == null ? "" : whereClause;
        insertColumns = List.copyOf(insertColumns);
        insertValues = List.copyOf(insertValues);
        updateFields = List.copyOf(updateFields);
    }

    public static StatementDescriptor unknown() {
        return UNKNOWN;
    }

    public boolean isAuditable() {
        return operationKind.isAuditable() && !tableName.isEmpty();
    }

    public boolean hasSchema() {
        return !schemaName.isEmpty();
    }

    public boolean hasWhereClause() {
        return !whereClause.isEmpty();
    }

    /**
     * @return {@code "schema"."table"} or {@code "table"}, for use in generated statements
     */
    public String qualifiedTableName() {
        return SqlIdentifiers.qualify(schemaName, tableName);
    }
}
