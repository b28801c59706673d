package io.rowaudit.sql.parser;

import io.rowaudit.sql.common.error.FailureKind;
import io.rowaudit.sql.common.model.OperationKind;
import io.rowaudit.sql.common.model.ParameterBindings;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class StatementParserTest {

    private final StatementParser parser = new StatementParser();

    @Test
    public void testInsertPairsColumnsWithValues() {
        var parsed = parser.parse("INSERT INTO dbo.Users (Name, Email, Age, Note, CreatedAt) " +
                "VALUES (@Name, @Email, 42, NULL, GETDATE())");
        var descriptor = parsed.descriptor();

        assertTrue(parsed.isAuditable());
        assertEquals(OperationKind.INSERT, descriptor.operationKind());
        assertEquals("dbo", descriptor.schemaName());
        assertEquals("Users", descriptor.tableName());
        assertEquals(List.of("Name", "Email", "Age", "Note", "CreatedAt"), descriptor.insertColumns());
        assertEquals(descriptor.insertColumns().size(), descriptor.insertValues().size());

        var values = descriptor.insertValues();
        assertEquals(io.rowaudit.sql.parser.ValueSource.parameter("@Name"), values.get(0));
        assertEquals("@Email", values.get(1).parameterName());
        assertEquals(io.rowaudit.sql.parser.ValueSource.Kind.LITERAL, values.get(2).kind());
        assertEquals(42, ((Number) values.get(2).literal()).intValue());
        assertEquals(io.rowaudit.sql.parser.ValueSource.Kind.LITERAL, values.get(3).kind());
        assertNull(values.get(3).literal());
        assertEquals(io.rowaudit.sql.parser.ValueSource.Kind.EXPRESSION, values.get(4).kind());

        var bindings = new ParameterBindings().bind("Name", "Ann").bind("@Email", "ann@example.com");
        assertEquals("Ann", values.get(0).resolve(bindings));
        assertEquals("ann@example.com", values.get(1).resolve(bindings));
    }

    @Test
    public void testInsertStringLiteral() {
        var descriptor = parser.parse("INSERT INTO Tags (Label) VALUES (N'red')").descriptor();

        assertEquals("", descriptor.schemaName());
        assertEquals("Tags", descriptor.tableName());
        assertEquals("red", descriptor.insertValues().get(0).literal());
    }

    @Test
    public void testUpdateAssignmentsAndWhereText() {
        var descriptor = parser.parse("UPDATE [dbo].[Users] SET [Name] = @Name, Email = 'x@y.com' " +
                "WHERE Id = @Id AND Note <> 'WHERE';").descriptor();

        assertEquals(OperationKind.UPDATE, descriptor.operationKind());
        assertEquals("dbo", descriptor.schemaName());
        assertEquals("Users", descriptor.tableName());
        assertEquals(2, descriptor.updateFields().size());
        assertEquals("Name", descriptor.updateFields().get(0).columnName());
        assertEquals("@Name", descriptor.updateFields().get(0).value().parameterName());
        assertEquals("Email", descriptor.updateFields().get(1).columnName());
        assertEquals("x@y.com", descriptor.updateFields().get(1).value().literal());
        assertEquals("Id = @Id AND Note <> 'WHERE'", descriptor.whereClause());
        assertEquals("\"dbo\".\"Users\"", descriptor.qualifiedTableName());
    }

    @Test
    public void testUpdateWithoutWhere() {
        var descriptor = parser.parse("UPDATE Users SET Active = 0").descriptor();

        assertTrue(descriptor.isAuditable());
        assertFalse(descriptor.hasWhereClause());
        assertEquals("", descriptor.whereClause());
    }

    @Test
    public void testDeleteWithThreePartName() {
        var descriptor = parser.parse("DELETE FROM Sales.dbo.Orders WHERE OrderId = @OrderId").descriptor();

        assertEquals(OperationKind.DELETE, descriptor.operationKind());
        assertEquals("dbo", descriptor.schemaName());
        assertEquals("Orders", descriptor.tableName());
        assertEquals("OrderId = @OrderId", descriptor.whereClause());
    }

    @Test
    public void testWhereOfSubqueryIsIgnored() {
        var descriptor = parser.parse("DELETE FROM Orders WHERE CustomerId IN " +
                "(SELECT Id FROM Customers WHERE Region = @Region) -- WHERE 1 = 1").descriptor();

        assertEquals("CustomerId IN (SELECT Id FROM Customers WHERE Region = @Region)", descriptor.whereClause());
    }

    @Test
    public void testMalformedTextIsUnknownWithParseFailure() {
        var parsed = parser.parse("INSERT INTO Users (Name VALUES (@Name");

        assertFalse(parsed.isAuditable());
        assertEquals(OperationKind.UNKNOWN, parsed.descriptor().operationKind());
        assertFalse(parsed.failures().isEmpty());
        assertEquals(FailureKind.PARSE, parsed.failures().get(0).kind());
    }

    @Test
    public void testMultipleStatementsAreUnknown() {
        var parsed = parser.parse("DELETE FROM a WHERE id = 1; DELETE FROM b WHERE id = 2");

        assertEquals(OperationKind.UNKNOWN, parsed.descriptor().operationKind());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "SELECT * FROM Users",
            "",
            "   ",
            "CREATE TABLE t (id INT)"
    })
    public void testNotAuditable(String sql) {
        assertFalse(parser.isAuditable(sql));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "INSERT INTO Users (Name) VALUES (@Name)",
            "UPDATE Users SET Name = @Name WHERE Id = @Id",
            "DELETE FROM Users WHERE Id = @Id",
            "SELECT 1"
    })
    public void testClassificationIsIdempotent(String sql) {
        boolean first = parser.isAuditable(sql);
        assertEquals(first, parser.isAuditable(sql));
        assertEquals(parser.parse(sql).descriptor(), parser.parse(sql).descriptor());
    }

    @Test
    public void testNullText() {
        assertFalse(parser.isAuditable(null));
    }
}
