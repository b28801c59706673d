package io.rowaudit.sql.parser;

public final class SqlIdentifiers {

    private SqlIdentifiers() {
    }

    /**
     * Strips one level of {@code [..]}, {@code ".."} or {@code `..`} quoting and un-doubles escaped
     * closing quotes.
     */
    public static String unquote(String identifier) {
        if (identifier == null || identifier.length() < 2) {
            return identifier;
        }
        char first = identifier.charAt(0);
        char last = identifier.charAt(identifier.length() - 1);
        String inner = identifier.substring(1, identifier.length() - 1);
        if (first == '[' && last == ']') {
            return inner.replace("]]", "]");
        }
        if ((first == '"' || first == '`') && last == first) {
            String quote = String.valueOf(first);
            return inner.replace(quote + quote, quote);
        }
        return identifier;
    }

    /**
     * @return the identifier as an ANSI delimited identifier, accepted by SQL Server with
     * QUOTED_IDENTIFIER ON (the driver default)
     */
    public static String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    public static String qualify(String schema, String table) {
        return schema == null || schema.isEmpty() ? quote(table) : quote(schema) + "." + quote(table);
    }
}
