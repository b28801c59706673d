package io.rowaudit.sql.parser;

/**
 * Lexical token of a T-SQL statement.
 *
 * @param start offset of the first character in the source text
 * @param end   offset just past the last character
 * @param depth parenthesis nesting depth the token sits at, 0 for the statement level
 */
public record SqlToken(Type type, String text, int start, int end, int depth) {

    public enum Type {
        WORD,
        PARAMETER,
        NUMBER,
        STRING,
        QUOTED_IDENTIFIER,
        COMMENT,
        OPEN_PAREN,
        CLOSE_PAREN,
        SEMICOLON,
        SYMBOL
    }

    public boolean isKeyword(String keyword) {
        return type == Type.WORD && text.equalsIgnoreCase(keyword);
    }

    public boolean isTopLevelKeyword(String keyword) {
        return depth == 0 && isKeyword(keyword);
    }

    public boolean isComment() {
        return type == Type.COMMENT;
    }
}
