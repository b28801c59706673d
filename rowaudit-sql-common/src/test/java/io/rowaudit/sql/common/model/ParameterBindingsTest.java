package io.rowaudit.sql.common.model;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ParameterBindingsTest {

    @Test
    public void testLookupToleratesSigil() {
        var bindings = new ParameterBindings().bind("@Email", "a@b.com").bind("Id", 5);

        assertEquals("a@b.com", bindings.get("Email"));
        assertEquals("a@b.com", bindings.get("@Email"));
        assertEquals(5, bindings.get("@Id"));
        assertEquals("@Email", bindings.resolveKey("Email"));
        assertEquals("Id", bindings.resolveKey("@Id"));
    }

    @Test
    public void testNullIsDistinctFromAbsent() {
        var bindings = new ParameterBindings().bindNull("@Name");

        assertTrue(bindings.contains("Name"));
        assertNull(bindings.get("Name"));
        assertFalse(bindings.contains("Missing"));
        assertNull(bindings.resolveKey("Missing"));
    }

    @Test
    public void testRebindKeepsOriginalKey() {
        var bindings = new ParameterBindings().bind("@Id", 1);
        bindings.bind("Id", 2);

        assertEquals(1, bindings.size());
        assertEquals(List.of("@Id"), List.copyOf(bindings.names()));
        assertEquals(2, bindings.get("@Id"));
    }

    @Test
    public void testCopyIsIndependent() {
        var bindings = new ParameterBindings().bind("@Id", 1);
        var copy = bindings.copy();
        bindings.bind("@Id", 2);

        assertEquals(1, copy.get("@Id"));
    }

    @Test
    public void testOfKeepsNullValues() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("@A", null);
        values.put("@B", "b");
        var bindings = ParameterBindings.of(values);

        assertTrue(bindings.contains("A"));
        assertEquals(values, bindings.asMap());
    }

    @Test
    public void testStripSigil() {
        assertEquals("Id", ParameterBindings.stripSigil("@Id"));
        assertEquals("Id", ParameterBindings.stripSigil("Id"));
        assertEquals("", ParameterBindings.stripSigil(""));
    }
}
