package io.rowaudit.sql.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rewrites T-SQL {@code @name} parameters into JDBC {@code ?} markers.
 *
 * @param jdbcSql        the text with every parameter replaced by {@code ?}
 * @param parameterNames parameter names in marker order, with their sigil; a name used twice appears twice
 */
public record NamedParameters(String jdbcSql, List<String> parameterNames) {

    public NamedParameters {
        parameterNames = Collections.unmodifiableList(parameterNames);
    }

    public static NamedParameters parse(String sql) {
        StringBuilder builder = new StringBuilder(sql.length());
        List<String> names = new ArrayList<>();
        int last = 0;
        for (SqlToken token : SqlTokenizer.tokenize(sql)) {
            if (token.type() == SqlToken.Type.PARAMETER) {
                builder.append(sql, last, token.start()).append('?');
                names.add(token.text());
                last = token.end();
            }
        }
        builder.append(sql, last, sql.length());
        return new NamedParameters(builder.toString(), names);
    }
}
