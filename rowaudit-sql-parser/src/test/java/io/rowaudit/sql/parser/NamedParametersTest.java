package io.rowaudit.sql.parser;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class NamedParametersTest {

    @Test
    public void testParametersBecomeMarkers() {
        var parsed = NamedParameters.parse("UPDATE Users SET Name = @Name WHERE Id = @Id OR Parent = @Id");

        assertEquals("UPDATE Users SET Name = ? WHERE Id = ? OR Parent = ?", parsed.jdbcSql());
        assertEquals(List.of("@Name", "@Id", "@Id"), parsed.parameterNames());
    }

    @Test
    public void testLiteralsAndCommentsAreLeftAlone() {
        String sql = "INSERT INTO Mail (Address, Note) VALUES (@Address, 'a@b.com') -- @ignored";
        var parsed = NamedParameters.parse(sql);

        assertEquals("INSERT INTO Mail (Address, Note) VALUES (?, 'a@b.com') -- @ignored", parsed.jdbcSql());
        assertEquals(List.of("@Address"), parsed.parameterNames());
    }

    @Test
    public void testNoParameters() {
        var parsed = NamedParameters.parse("SELECT @@ROWCOUNT");

        assertEquals("SELECT @@ROWCOUNT", parsed.jdbcSql());
        assertTrue(parsed.parameterNames().isEmpty());
    }
}
