package io.rowaudit.sql.interceptor.jdbc;

import io.rowaudit.sql.common.command.SqlCommand;
import io.rowaudit.sql.interceptor.DuckDBTestSupport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class JdbcSqlCommandTest {

    private JdbcSqlConnection connection;

    @BeforeEach
    void setup() throws SQLException {
        connection = new JdbcSqlConnection(DuckDBTestSupport.usersDatabase());
    }

    @AfterEach
    void close() throws SQLException {
        connection.close();
    }

    @Test
    public void testNamedParametersBindByName() throws SQLException {
        try (SqlCommand command = connection.createCommand(
                "SELECT Name FROM Users WHERE Email = @Email OR Id = @Id ORDER BY Id")) {
            command.getParameters().bind("Id", 6).bind("@Email", "old@x.com");

            List<String> names = command.query(resultSet -> {
                List<String> list = new ArrayList<>();
                while (resultSet.next()) {
                    list.add(resultSet.getString(1));
                }
                return list;
            });

            assertEquals(List.of("Bob", "Eve"), names);
        }
    }

    @Test
    public void testExecuteReturnsAffectedRows() throws SQLException {
        try (SqlCommand command = connection.createCommand("UPDATE Users SET Name = @Name WHERE Id > @Id")) {
            command.getParameters().bind("@Name", "x").bind("@Id", 0);
            assertEquals(2, command.execute());

            command.getParameters().bind("Id", 5);
            assertEquals(1, command.execute());
        }
    }

    @Test
    public void testExecuteScalar() throws SQLException {
        try (SqlCommand command = connection.createCommand("SELECT count(*) FROM Users WHERE Name = @Name")) {
            command.getParameters().bind("@Name", "Bob");
            assertEquals(1L, ((Number) command.executeScalar()).longValue());

            command.setCommandText("DELETE FROM Users WHERE Id = 99");
            assertNull(command.executeScalar());
        }
    }

    @Test
    public void testNullBindingAndUnusedBindings() throws SQLException {
        try (SqlCommand command = connection.createCommand("UPDATE Users SET Email = @Email WHERE Id = 5")) {
            command.getParameters().bindNull("@Email").bind("@Unused", 1);
            assertEquals(1, command.execute());
        }
        try (SqlCommand command = connection.createCommand("SELECT Email IS NULL FROM Users WHERE Id = 5")) {
            assertEquals(Boolean.TRUE, command.executeScalar());
        }
    }

    @Test
    public void testMissingParameterFails() throws SQLException {
        try (SqlCommand command = connection.createCommand("DELETE FROM Users WHERE Id = @Id")) {
            var e = assertThrows(SQLException.class, command::execute);
            assertTrue(e.getMessage().contains("@Id"));
        }
    }

    @Test
    public void testQueryTimeoutValidation() throws SQLException {
        try (SqlCommand command = connection.createCommand()) {
            command.setQueryTimeout(30);
            assertEquals(30, command.getQueryTimeout());
            assertThrows(SQLException.class, () -> command.setQueryTimeout(-1));
        }
    }
}
