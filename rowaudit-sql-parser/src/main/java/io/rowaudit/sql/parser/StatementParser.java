package io.rowaudit.sql.parser;

import com.alibaba.druid.DbType;
import com.alibaba.druid.sql.SQLUtils;
import com.alibaba.druid.sql.ast.SQLExpr;
import com.alibaba.druid.sql.ast.SQLName;
import com.alibaba.druid.sql.ast.SQLStatement;
import com.alibaba.druid.sql.ast.expr.SQLBooleanExpr;
import com.alibaba.druid.sql.ast.expr.SQLDefaultExpr;
import com.alibaba.druid.sql.ast.expr.SQLIdentifierExpr;
import com.alibaba.druid.sql.ast.expr.SQLNullExpr;
import com.alibaba.druid.sql.ast.expr.SQLNumericLiteralExpr;
import com.alibaba.druid.sql.ast.expr.SQLPropertyExpr;
import com.alibaba.druid.sql.ast.expr.SQLTextLiteralExpr;
import com.alibaba.druid.sql.ast.expr.SQLVariantRefExpr;
import com.alibaba.druid.sql.ast.statement.SQLDeleteStatement;
import com.alibaba.druid.sql.ast.statement.SQLInsertStatement;
import com.alibaba.druid.sql.ast.statement.SQLUpdateSetItem;
import com.alibaba.druid.sql.ast.statement.SQLUpdateStatement;
import com.alibaba.druid.sql.parser.ParserException;
import com.alibaba.druid.sql.parser.SQLParserUtils;
import com.alibaba.druid.sql.parser.SQLStatementParser;
import io.rowaudit.sql.common.error.AuditFailure;
import io.rowaudit.sql.common.model.OperationKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies and parses a single T-SQL data modification statement.
 *
 * <p>Instances are stateless and can be shared between threads.
 */
public class StatementParser {

    private static final Logger logger = LoggerFactory.getLogger(StatementParser.class);

    private static final DbType DIALECT = DbType.sqlserver;
    private static final Pattern POSITION = Pattern.compile("line (\\d+), column (\\d+)");
    private static final Set<String> WHERE_TERMINATORS = Set.of("OPTION");

    public boolean isAuditable(String commandText) {
        return parse(commandText).isAuditable();
    }

    public ParsedStatement parse(String commandText) {
        if (commandText == null || commandText.isBlank()) {
            return new ParsedStatement(StatementDescriptor.unknown(), List.of());
        }
        List<SQLStatement> statements = new ArrayList<>();
        List<AuditFailure> failures = new ArrayList<>();
        try {
            SQLStatementParser parser = SQLParserUtils.createSQLStatementParser(commandText, DIALECT);
            parser.parseStatementList(statements);
        } catch (ParserException e) {
            String position = position(e.getMessage());
            logger.atWarn().log("Unable to parse command text at {}: {}", position, e.getMessage());
            failures.add(AuditFailure.parse("parse", "grammar error at " + position + ": " + e.getMessage(), e));
        } catch (RuntimeException e) {
            logger.atError().setCause(e).log("Unexpected failure parsing command text");
            failures.add(AuditFailure.parse("parse", "unexpected parser failure: " + e.getMessage(), e));
            return new ParsedStatement(StatementDescriptor.unknown(), failures);
        }
        if (statements.size() != 1) {
            if (statements.size() > 1) {
                logger.atDebug().log("Command text holds {} statements, not audited", statements.size());
            }
            return new ParsedStatement(StatementDescriptor.unknown(), failures);
        }
        try {
            return new ParsedStatement(describe(statements.get(0), commandText), failures);
        } catch (RuntimeException e) {
            logger.atError().setCause(e).log("Unable to describe statement");
            failures.add(AuditFailure.parse("describe", "unable to describe statement: " + e.getMessage(), e));
            return new ParsedStatement(StatementDescriptor.unknown(), failures);
        }
    }

    private StatementDescriptor describe(SQLStatement statement, String commandText) {
        if (statement instanceof SQLInsertStatement insert) {
            return describeInsert(insert);
        }
        if (statement instanceof SQLUpdateStatement update) {
            String[] name = tableName(update.getTableName());
            List<UpdateAssignment> assignments = new ArrayList<>();
            for (SQLUpdateSetItem item : update.getItems()) {
                assignments.add(new UpdateAssignment(columnName(item.getColumn()), valueSource(item.getValue())));
            }
            String where = update.getWhere() == null ? "" : whereText(commandText);
            return new StatementDescriptor(OperationKind.UPDATE, name[0], name[1], where,
                    List.of(), List.of(), assignments);
        }
        if (statement instanceof SQLDeleteStatement delete) {
            String[] name = tableName(delete.getTableName());
            String where = delete.getWhere() == null ? "" : whereText(commandText);
            return new StatementDescriptor(OperationKind.DELETE, name[0], name[1], where,
                    List.of(), List.of(), List.of());
        }
        return StatementDescriptor.unknown();
    }

    private StatementDescriptor describeInsert(SQLInsertStatement insert) {
        String[] name = tableName(insert.getTableName());
        List<String> columns = new ArrayList<>();
        for (SQLExpr column : insert.getColumns()) {
            columns.add(columnName(column));
        }
        List<ValueSource> values = new ArrayList<>();
        List<SQLInsertStatement.ValuesClause> rows = insert.getValuesList();
        if (rows != null && !rows.isEmpty()) {
            for (SQLExpr value : rows.get(0).getValues()) {
                values.add(valueSource(value));
            }
        }
        return new StatementDescriptor(OperationKind.INSERT, name[0], name[1], "", columns, values, List.of());
    }

    /**
     * @return {schema, table}; the last two parts of a multi-part name
     */
    static String[] tableName(SQLName name) {
        if (name == null) {
            return new String[]{"", ""};
        }
        if (name instanceof SQLPropertyExpr property) {
            String schema = property.getOwner() instanceof SQLName owner ? owner.getSimpleName() : "";
            return new String[]{SqlIdentifiers.unquote(schema), SqlIdentifiers.unquote(property.getName())};
        }
        return new String[]{"", SqlIdentifiers.unquote(name.getSimpleName())};
    }

    static String columnName(SQLExpr expr) {
        if (expr instanceof SQLName name) {
            return SqlIdentifiers.unquote(name.getSimpleName());
        }
        return SqlIdentifiers.unquote(SQLUtils.toSQLString(expr, DIALECT));
    }

    static ValueSource valueSource(SQLExpr expr) {
        if (expr instanceof SQLVariantRefExpr variant) {
            return ValueSource.parameter(variant.getName());
        }
        if (expr instanceof SQLNullExpr) {
            return ValueSource.literal(null);
        }
        if (expr instanceof SQLTextLiteralExpr text) {
            return ValueSource.literal(text.getText());
        }
        if (expr instanceof SQLNumericLiteralExpr number) {
            return ValueSource.literal(number.getNumber());
        }
        if (expr instanceof SQLBooleanExpr bool) {
            return ValueSource.literal(bool.getBooleanValue());
        }
        if (expr instanceof SQLDefaultExpr) {
            return ValueSource.defaultValue();
        }
        if (expr instanceof SQLIdentifierExpr identifier) {
            String name = identifier.getName();
            if (name.startsWith("@") && !name.startsWith("@@")) {
                return ValueSource.parameter(name);
            }
            if (ValueSource.DEFAULT_KEYWORD.equalsIgnoreCase(name)) {
                return ValueSource.defaultValue();
            }
        }
        return ValueSource.expression(SQLUtils.toSQLString(expr, DIALECT));
    }

    /**
     * Text after the last statement-level WHERE of the first statement, up to a query hint or the
     * end of the statement. Taken from the source so that parameter references are kept as written.
     */
    static String whereText(String commandText) {
        List<SqlToken> tokens = SqlTokenizer.tokenize(commandText);
        int statementEnd = tokens.size();
        for (int i = 0; i < tokens.size(); i++) {
            if (tokens.get(i).type() == SqlToken.Type.SEMICOLON && tokens.get(i).depth() == 0) {
                statementEnd = i;
                break;
            }
        }
        List<SqlToken> statement = tokens.subList(0, statementEnd);
        int where = SqlTokenizer.lastIndexOfTopLevelKeyword(statement, "WHERE");
        if (where < 0) {
            return "";
        }
        int terminator = SqlTokenizer.indexOfTopLevelKeyword(statement, where + 1, WHERE_TERMINATORS);
        List<SqlToken> clause = statement.subList(where + 1, terminator < 0 ? statement.size() : terminator);
        int from = statement.get(where).end();
        int to = SqlTokenizer.endOfStatement(clause, from);
        return to <= from ? "" : commandText.substring(from, to).trim();
    }

    private static String position(String message) {
        if (message != null) {
            Matcher matcher = POSITION.matcher(message);
            if (matcher.find()) {
                return "line " + matcher.group(1) + ", column " + matcher.group(2);
            }
        }
        return "unknown position";
    }
}
