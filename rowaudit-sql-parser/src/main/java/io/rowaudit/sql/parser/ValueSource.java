package io.rowaudit.sql.parser;

import io.rowaudit.sql.common.model.ParameterBindings;

/**
 * Where the value of an inserted or assigned column comes from.
 */
public record ValueSource(Kind kind, String parameterName, Object literal, String expression) {

    public static final String DEFAULT_KEYWORD = "DEFAULT";

    public enum Kind {
        PARAMETER,
        LITERAL,
        DEFAULT,
        EXPRESSION
    }

    public static ValueSource parameter(String name) {
        return new ValueSource(Kind.PARAMETER, name, null, name);
    }

    /**
     * @param value String, Number or {@code null} for the NULL literal
     */
    public static ValueSource literal(Object value) {
        return new ValueSource(Kind.LITERAL, null, value, value == null ? "NULL" : value.toString());
    }

    public static ValueSource defaultValue() {
        return new ValueSource(Kind.DEFAULT, null, null, DEFAULT_KEYWORD);
    }

    public static ValueSource expression(String text) {
        return new ValueSource(Kind.EXPRESSION, null, null, text);
    }

    public boolean isParameter() {
        return kind == Kind.PARAMETER;
    }

    /**
     * @return the bound value for a parameter ({@code null} when unbound), the literal value, or the
     * source text of a default or an expression
     */
    public Object resolve(ParameterBindings bindings) {
        return switch (kind) {
            case PARAMETER -> bindings.get(parameterName);
            case LITERAL -> literal;
            case DEFAULT, EXPRESSION -> expression;
        };
    }
}
