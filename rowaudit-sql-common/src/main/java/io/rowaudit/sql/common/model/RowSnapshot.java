package io.rowaudit.sql.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Column to value image of a row. A column mapped to {@code null} holds a SQL NULL, which is
 * different from the column being absent. An empty snapshot is a valid image, e.g. the after
 * image of a delete.
 */
public final class RowSnapshot {

    private final Map<String, Object> values;

    private RowSnapshot(Map<String, Object> values) {
        this.values = values;
    }

    public static RowSnapshot empty() {
        return new RowSnapshot(Collections.emptyMap());
    }

    public static RowSnapshot of(Map<String, ?> values) {
        return new RowSnapshot(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    public boolean contains(String column) {
        return values.containsKey(column);
    }

    public Object get(String column) {
        return values.get(column);
    }

    public Set<String> columns() {
        return values.keySet();
    }

    @JsonValue
    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return values.equals(((RowSnapshot) o).values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return "RowSnapshot" + values;
    }

    public static final class Builder {
        private final Map<String, Object> values = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(String column, Object value) {
            values.put(Objects.requireNonNull(column, "column must not be null"), value);
            return this;
        }

        public Builder putAll(Map<String, ?> other) {
            other.forEach(this::put);
            return this;
        }

        public boolean isEmpty() {
            return values.isEmpty();
        }

        public RowSnapshot build() {
            if (values.isEmpty()) {
                return empty();
            }
            return new RowSnapshot(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
        }
    }
}
