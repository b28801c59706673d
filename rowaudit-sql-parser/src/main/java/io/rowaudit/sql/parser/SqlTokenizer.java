package io.rowaudit.sql.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static io.rowaudit.sql.parser.SqlToken.Type;

/**
 * Lexical scanner for T-SQL text. Keeps string literals, quoted identifiers and comments as single
 * tokens so keyword searches never match inside them, and records the parenthesis depth of every
 * token so sub-queries can be told apart from the statement level. Unterminated literals and
 * comments run to the end of the text.
 */
public final class SqlTokenizer {

    private SqlTokenizer() {
    }

    public static List<SqlToken> tokenize(String sql) {
        List<SqlToken> tokens = new ArrayList<>();
        int length = sql.length();
        int depth = 0;
        int i = 0;
        while (i < length) {
            char c = sql.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            int start = i;
            if (c == '-' && peek(sql, i + 1) == '-') {
                i = indexOrEnd(sql, sql.indexOf('\n', i));
                tokens.add(token(sql, Type.COMMENT, start, i, depth));
            } else if (c == '/' && peek(sql, i + 1) == '*') {
                i = skipBlockComment(sql, i);
                tokens.add(token(sql, Type.COMMENT, start, i, depth));
            } else if (c == '\'') {
                i = skipQuoted(sql, i, '\'');
                tokens.add(token(sql, Type.STRING, start, i, depth));
            } else if ((c == 'N' || c == 'n') && peek(sql, i + 1) == '\'') {
                i = skipQuoted(sql, i + 1, '\'');
                tokens.add(token(sql, Type.STRING, start, i, depth));
            } else if (c == '"') {
                i = skipQuoted(sql, i, '"');
                tokens.add(token(sql, Type.QUOTED_IDENTIFIER, start, i, depth));
            } else if (c == '[') {
                i = skipQuoted(sql, i, ']');
                tokens.add(token(sql, Type.QUOTED_IDENTIFIER, start, i, depth));
            } else if (c == '@' && peek(sql, i + 1) == '@') {
                // @@ROWCOUNT and friends are system functions, not parameters
                i = skipWord(sql, i + 2);
                tokens.add(token(sql, Type.WORD, start, i, depth));
            } else if (c == '@' && isWordStart(peek(sql, i + 1))) {
                i = skipWord(sql, i + 1);
                tokens.add(token(sql, Type.PARAMETER, start, i, depth));
            } else if (isWordStart(c)) {
                i = skipWord(sql, i);
                tokens.add(token(sql, Type.WORD, start, i, depth));
            } else if (Character.isDigit(c) || (c == '.' && Character.isDigit(peek(sql, i + 1)))) {
                i = skipNumber(sql, i);
                tokens.add(token(sql, Type.NUMBER, start, i, depth));
            } else if (c == '(') {
                i++;
                tokens.add(token(sql, Type.OPEN_PAREN, start, i, depth));
                depth++;
            } else if (c == ')') {
                i++;
                depth = Math.max(0, depth - 1);
                tokens.add(token(sql, Type.CLOSE_PAREN, start, i, depth));
            } else if (c == ';') {
                i++;
                tokens.add(token(sql, Type.SEMICOLON, start, i, depth));
            } else {
                i++;
                tokens.add(token(sql, Type.SYMBOL, start, i, depth));
            }
        }
        return tokens;
    }

    /**
     * @return index of the first statement-level keyword among {@code keywords} at or after
     * {@code fromIndex}, or -1
     */
    public static int indexOfTopLevelKeyword(List<SqlToken> tokens, int fromIndex, Set<String> keywords) {
        for (int i = Math.max(0, fromIndex); i < tokens.size(); i++) {
            SqlToken token = tokens.get(i);
            if (token.depth() == 0 && token.type() == Type.WORD && contains(keywords, token.text())) {
                return i;
            }
        }
        return -1;
    }

    public static int indexOfTopLevelKeyword(List<SqlToken> tokens, int fromIndex, String keyword) {
        return indexOfTopLevelKeyword(tokens, fromIndex, Set.of(keyword));
    }

    public static int lastIndexOfTopLevelKeyword(List<SqlToken> tokens, String keyword) {
        for (int i = tokens.size() - 1; i >= 0; i--) {
            if (tokens.get(i).isTopLevelKeyword(keyword)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * @return offset just past the last token that is neither a comment nor a semicolon
     */
    public static int endOfStatement(List<SqlToken> tokens, int defaultEnd) {
        for (int i = tokens.size() - 1; i >= 0; i--) {
            SqlToken token = tokens.get(i);
            if (!token.isComment() && token.type() != Type.SEMICOLON) {
                return token.end();
            }
        }
        return defaultEnd;
    }

    private static boolean contains(Set<String> keywords, String word) {
        for (String keyword : keywords) {
            if (keyword.equalsIgnoreCase(word)) {
                return true;
            }
        }
        return false;
    }

    private static SqlToken token(String sql, Type type, int start, int end, int depth) {
        return new SqlToken(type, sql.substring(start, end), start, end, depth);
    }

    private static char peek(String sql, int index) {
        return index < sql.length() ? sql.charAt(index) : '\0';
    }

    private static int indexOrEnd(String sql, int index) {
        return index < 0 ? sql.length() : index;
    }

    private static boolean isWordStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '#';
    }

    private static boolean isWordPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '#' || c == '$' || c == '@';
    }

    private static int skipWord(String sql, int i) {
        while (i < sql.length() && isWordPart(sql.charAt(i))) {
            i++;
        }
        return i;
    }

    private static int skipNumber(String sql, int i) {
        int length = sql.length();
        while (i < length && (Character.isDigit(sql.charAt(i)) || sql.charAt(i) == '.')) {
            i++;
        }
        if (i < length && (sql.charAt(i) == 'e' || sql.charAt(i) == 'E')) {
            int j = i + 1;
            if (j < length && (sql.charAt(j) == '+' || sql.charAt(j) == '-')) {
                j++;
            }
            if (j < length && Character.isDigit(sql.charAt(j))) {
                i = j;
                while (i < length && Character.isDigit(sql.charAt(i))) {
                    i++;
                }
            }
        }
        return i;
    }

    // the closing quote is escaped by doubling it: 'it''s', [a]]b], "a""b"
    private static int skipQuoted(String sql, int openIndex, char close) {
        int i = openIndex + 1;
        while (i < sql.length()) {
            if (sql.charAt(i) == close) {
                if (peek(sql, i + 1) == close) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return sql.length();
    }

    // T-SQL block comments nest
    private static int skipBlockComment(String sql, int i) {
        int nesting = 0;
        while (i < sql.length()) {
            if (sql.charAt(i) == '/' && peek(sql, i + 1) == '*') {
                nesting++;
                i += 2;
            } else if (sql.charAt(i) == '*' && peek(sql, i + 1) == '/') {
                nesting--;
                i += 2;
                if (nesting == 0) {
                    return i;
                }
            } else {
                i++;
            }
        }
        return sql.length();
    }
}
