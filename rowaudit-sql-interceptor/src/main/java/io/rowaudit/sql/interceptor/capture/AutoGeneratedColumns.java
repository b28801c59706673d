package io.rowaudit.sql.interceptor.capture;

import java.util.List;
import java.util.Locale;

/**
 * Column names whose values the database assigns on insert. Names compare case-insensitively. A
 * column also matches when one of the names is its last word, after an underscore or a camel case
 * hump: {@code UserId} and {@code user_id} match {@code id}, {@code Paid} and {@code Guid} do not.
 */
public class AutoGeneratedColumns {

    public static final List<String> DEFAULT_NAMES = List.of(
            "id", "createdat", "createddate", "timestamp", "rowversion", "modifiedat", "modifieddate");

    private final List<String> names;

    public AutoGeneratedColumns(List<String> names) {
        this.names = names.stream().map(n -> n.toLowerCase(Locale.ROOT)).toList();
    }

    public static AutoGeneratedColumns defaults() {
        return new AutoGeneratedColumns(DEFAULT_NAMES);
    }

    public boolean isAutoGenerated(String column) {
        String lower = column.toLowerCase(Locale.ROOT);
        for (String name : names) {
            if (lower.equals(name) || (lower.endsWith(name) && isWordStart(column, column.length() - name.length()))) {
                return true;
            }
        }
        return false;
    }

    private static boolean isWordStart(String column, int index) {
        char previous = column.charAt(index - 1);
        if (previous == '_') {
            return true;
        }
        return Character.isUpperCase(column.charAt(index))
                && (Character.isLowerCase(previous) || Character.isDigit(previous));
    }

    public List<String> names() {
        return names;
    }
}
