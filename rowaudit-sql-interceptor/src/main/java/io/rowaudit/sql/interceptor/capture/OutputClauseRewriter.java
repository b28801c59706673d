package io.rowaudit.sql.interceptor.capture;

import io.rowaudit.sql.common.model.OperationKind;
import io.rowaudit.sql.parser.SqlIdentifiers;
import io.rowaudit.sql.parser.SqlToken;
import io.rowaudit.sql.parser.SqlTokenizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Adds an {@code OUTPUT} clause to an INSERT, UPDATE or DELETE so the statement returns the
 * affected rows. Output columns are named {@code INSERTED_<column>} and {@code DELETED_<column>}
 * and appear in the order {@link #outputColumns} gives.
 */
public final class OutputClauseRewriter {

    public static final String INSERTED = "INSERTED";
    public static final String DELETED = "DELETED";

    private static final Set<String> CLAUSE_AFTER_TARGET = Set.of("FROM", "WHERE", "OPTION");

    private OutputClauseRewriter() {
    }

    public static String rewrite(String sql, OperationKind kind, List<String> columns) throws CaptureException {
        if (columns.isEmpty()) {
            throw new CaptureException("no columns to output");
        }
        List<SqlToken> tokens = SqlTokenizer.tokenize(sql);
        if (SqlTokenizer.indexOfTopLevelKeyword(tokens, 0, "OUTPUT") >= 0) {
            throw new CaptureException("statement already has an OUTPUT clause");
        }
        String clause = "OUTPUT " + String.join(", ", outputExpressions(kind, columns));
        int position = switch (kind) {
            case INSERT -> insertAnchor(tokens);
            case UPDATE -> updateAnchor(sql, tokens);
            case DELETE -> deleteAnchor(sql, tokens);
            default -> throw new CaptureException("cannot rewrite a " + kind + " statement");
        };
        return splice(sql, position, clause);
    }

    /**
     * @return output column labels in result set order
     */
    public static List<String> outputColumns(OperationKind kind, List<String> columns) {
        List<String> labels = new ArrayList<>();
        for (String column : columns) {
            for (String prefix : prefixes(kind)) {
                labels.add(prefix + "_" + column);
            }
        }
        return labels;
    }

    private static List<String> outputExpressions(OperationKind kind, List<String> columns) {
        List<String> expressions = new ArrayList<>();
        for (String column : columns) {
            for (String prefix : prefixes(kind)) {
                expressions.add(prefix + "." + SqlIdentifiers.quote(column)
                        + " AS " + SqlIdentifiers.quote(prefix + "_" + column));
            }
        }
        return expressions;
    }

    private static List<String> prefixes(OperationKind kind) {
        return switch (kind) {
            case INSERT -> List.of(INSERTED);
            case UPDATE -> List.of(DELETED, INSERTED);
            case DELETE -> List.of(DELETED);
            default -> List.of();
        };
    }

    private static int insertAnchor(List<SqlToken> tokens) throws CaptureException {
        int values = SqlTokenizer.indexOfTopLevelKeyword(tokens, 0, "VALUES");
        if (values < 0) {
            throw new CaptureException("INSERT has no VALUES clause");
        }
        // INSERT INTO t DEFAULT VALUES
        if (values > 0 && tokens.get(values - 1).isTopLevelKeyword("DEFAULT")) {
            return tokens.get(values - 1).start();
        }
        return tokens.get(values).start();
    }

    private static int updateAnchor(String sql, List<SqlToken> tokens) throws CaptureException {
        int set = SqlTokenizer.indexOfTopLevelKeyword(tokens, 0, "SET");
        if (set < 0) {
            throw new CaptureException("UPDATE has no SET clause");
        }
        int anchor = SqlTokenizer.indexOfTopLevelKeyword(tokens, set + 1, CLAUSE_AFTER_TARGET);
        return anchor < 0 ? SqlTokenizer.endOfStatement(tokens, sql.length()) : tokens.get(anchor).start();
    }

    private static int deleteAnchor(String sql, List<SqlToken> tokens) throws CaptureException {
        int index = SqlTokenizer.indexOfTopLevelKeyword(tokens, 0, "DELETE");
        if (index < 0) {
            throw new CaptureException("DELETE keyword not found");
        }
        index++;
        if (index < tokens.size() && tokens.get(index).isTopLevelKeyword("TOP")) {
            index = skipTop(tokens, index);
        }
        if (index < tokens.size() && tokens.get(index).isTopLevelKeyword("FROM")) {
            index++;
        }
        // the target table itself is never one of the clause keywords
        int anchor = SqlTokenizer.indexOfTopLevelKeyword(tokens, index + 1, CLAUSE_AFTER_TARGET);
        return anchor < 0 ? SqlTokenizer.endOfStatement(tokens, sql.length()) : tokens.get(anchor).start();
    }

    // TOP (n) [PERCENT]
    private static int skipTop(List<SqlToken> tokens, int top) {
        int index = top + 1;
        if (index < tokens.size() && tokens.get(index).type() == SqlToken.Type.OPEN_PAREN) {
            int depth = tokens.get(index).depth();
            index++;
            while (index < tokens.size() && !(tokens.get(index).type() == SqlToken.Type.CLOSE_PAREN
                    && tokens.get(index).depth() == depth)) {
                index++;
            }
            index++;
        } else {
            index++;
        }
        if (index < tokens.size() && tokens.get(index).isTopLevelKeyword("PERCENT")) {
            index++;
        }
        return index;
    }

    private static String splice(String sql, int position, String clause) {
        String head = sql.substring(0, position);
        String tail = sql.substring(position);
        StringBuilder builder = new StringBuilder(sql.length() + clause.length() + 2).append(head);
        if (!head.isEmpty() && !Character.isWhitespace(head.charAt(head.length() - 1))) {
            builder.append(' ');
        }
        builder.append(clause);
        if (!tail.isEmpty() && !Character.isWhitespace(tail.charAt(0)) && tail.charAt(0) != ';') {
            builder.append(' ');
        }
        return builder.append(tail).toString();
    }
}
