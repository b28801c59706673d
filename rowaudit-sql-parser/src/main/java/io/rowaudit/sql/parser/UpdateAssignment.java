package io.rowaudit.sql.parser;

public record UpdateAssignment(String columnName, ValueSource value) {
}
