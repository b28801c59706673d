package io.rowaudit.sql.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Named parameter values of a command, in binding order.
 *
 * <p>A parameter bound to SQL NULL is present with a {@code null} value; use {@link #contains(String)}
 * to tell it apart from a parameter that was never bound. Names are looked up with and without the
 * leading {@code @} so that {@code Email} and {@code @Email} refer to the same binding.
 */
public final class ParameterBindings {

    public static final char SIGIL = '@';

    private final Map<String, Object> values;

    public ParameterBindings() {
        this.values = new LinkedHashMap<>();
    }

    private ParameterBindings(Map<String, Object> values) {
        this.values = values;
    }

    public static ParameterBindings of(Map<String, ?> values) {
        var bindings = new ParameterBindings();
        values.forEach(bindings::bind);
        return bindings;
    }

    public ParameterBindings bind(String name, Object value) {
        Objects.requireNonNull(name, "parameter name must not be null");
        String existing = resolveKey(name);
        values.put(existing != null ? existing : name, value);
        return this;
    }

    public ParameterBindings bindNull(String name) {
        return bind(name, null);
    }

    public boolean remove(String name) {
        String key = resolveKey(name);
        if (key == null) {
            return false;
        }
        values.remove(key);
        return true;
    }

    public void clear() {
        values.clear();
    }

    public boolean contains(String name) {
        return resolveKey(name) != null;
    }

    /**
     * @return the bound value, {@code null} for a SQL NULL or an absent parameter
     */
    public Object get(String name) {
        String key = resolveKey(name);
        return key == null ? null : values.get(key);
    }

    /**
     * @return the key under which {@code name} is bound, trying the name as given, then with the
     * leading sigil added or removed; {@code null} when not bound
     */
    public String resolveKey(String name) {
        if (name == null || name.isEmpty()) {
            return null;
        }
        if (values.containsKey(name)) {
            return name;
        }
        String alternate = name.charAt(0) == SIGIL ? name.substring(1) : SIGIL + name;
        return values.containsKey(alternate) ? alternate : null;
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    /**
     * @return an independent copy, so later re-binding on a command does not leak into an audit record
     */
    public ParameterBindings copy() {
        return new ParameterBindings(new LinkedHashMap<>(values));
    }

    @JsonValue
    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    public static String stripSigil(String name) {
        return name != null && !name.isEmpty() && name.charAt(0) == SIGIL ? name.substring(1) : name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return values.equals(((ParameterBindings) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "ParameterBindings" + values;
    }
}
