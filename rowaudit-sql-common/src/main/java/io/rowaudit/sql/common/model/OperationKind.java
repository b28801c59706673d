package io.rowaudit.sql.common.model;

/**
 * Kind of data-mutating statement, derived from the leading clause of the statement text.
 */
public enum OperationKind {
    INSERT("Created"),
    UPDATE("Modified"),
    DELETE("Deleted"),
    UNKNOWN("Changed");

    private final String eventSuffix;

    OperationKind(String eventSuffix) {
        this.eventSuffix = eventSuffix;
    }

    public String eventSuffix() {
        return eventSuffix;
    }

    public boolean isAuditable() {
        return this != UNKNOWN;
    }

    /**
     * @return event name in the form {@code <table>_<suffix>}, e.g. {@code Users_Modified}
     */
    public String eventName(String tableName) {
        return tableName + "_" + eventSuffix;
    }
}
