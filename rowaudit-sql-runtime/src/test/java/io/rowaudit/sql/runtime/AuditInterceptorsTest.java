package io.rowaudit.sql.runtime;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.rowaudit.sql.common.error.OutcomeStatus;
import io.rowaudit.sql.common.model.CaptureMode;
import io.rowaudit.sql.common.model.OperationKind;
import io.rowaudit.sql.interceptor.jdbc.AuditingSqlCommand;
import io.rowaudit.sql.interceptor.jdbc.AuditingSqlConnection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class AuditInterceptorsTest {

    @BeforeEach
    public void clear() {
        CollectingAuditSink.RECORDS.clear();
    }

    private static Config config(String overrides) {
        return ConfigFactory.parseString(overrides)
                .withFallback(ConfigFactory.load().getConfig("rowaudit"));
    }

    @Test
    public void testReferenceDefaults() throws Exception {
        var interceptor = AuditInterceptors.fromConfig(ConfigFactory.load().getConfig("rowaudit"));

        assertEquals(CaptureMode.REWRITE, interceptor.getConfig().captureStrategy());
        assertTrue(interceptor.getConfig().fallbackToReload());
        assertEquals(Duration.ZERO, interceptor.getConfig().metadataExpireAfterWrite());
        assertTrue(interceptor.getConfig().autoGeneratedColumns().contains("rowversion"));
    }

    @Test
    public void testAuditsThroughConfiguredSink() throws Exception {
        var config = config("""
                capture_strategy = "reload"
                sink { class = "io.rowaudit.sql.runtime.CollectingAuditSink", label = "test" }
                actor_context_provider {
                  class = "io.rowaudit.sql.interceptor.actor.StaticActorContextProvider"
                  actor_id = "batch"
                  display_name = "Nightly Batch"
                }
                connection { url = "jdbc:duckdb:" }
                """);
        var factory = AuditInterceptors.connectionFactory(config);

        try (AuditingSqlConnection connection = factory.open()) {
            try (var ddl = connection.createCommand("CREATE TABLE Accounts (Id INTEGER, Balance INTEGER)")) {
                ddl.execute();
            }
            try (var seed = connection.createCommand("INSERT INTO Accounts VALUES (1, 100)")) {
                seed.execute();
            }
            CollectingAuditSink.RECORDS.clear();

            try (AuditingSqlCommand command = connection.createCommand(
                    "UPDATE Accounts SET Balance = @Balance WHERE Id = @Id")) {
                command.getParameters().bind("@Balance", 80).bind("@Id", 1);
                var outcome = command.executeWithOutcome();

                assertEquals(OutcomeStatus.AUDITED, outcome.status());
            }
        }

        assertEquals(1, CollectingAuditSink.RECORDS.size());
        var record = CollectingAuditSink.RECORDS.get(0);
        assertEquals("Accounts_Modified", record.eventName());
        assertEquals(OperationKind.UPDATE, record.operationType());
        assertEquals(100, record.beforeImage().get("Balance"));
        assertEquals(80, record.afterImage().get("Balance"));
        assertEquals("batch", record.userId());
        assertEquals("Nightly Batch", record.userName());
    }

    @Test
    public void testMetricsEnabled() throws Exception {
        var registry = new SimpleMeterRegistry();
        var config = config("""
                capture_strategy = "reload"
                sink { class = "io.rowaudit.sql.runtime.CollectingAuditSink" }
                metrics { enabled = true, instance_id = "orders" }
                connection { url = "jdbc:duckdb:" }
                """);
        var factory = AuditInterceptors.connectionFactory(config, AuditInterceptors.fromConfig(config, registry));

        try (AuditingSqlConnection connection = factory.open();
             var command = connection.createCommand("SELECT 1")) {
            command.executeScalar();
        }

        assertEquals(1.0, registry.get("rowaudit.interceptor.pass_through.count")
                .tag("instance", "orders").counter().count());
    }

    @Test
    public void testMissingConnection() {
        var config = config("sink { class = \"io.rowaudit.sql.runtime.CollectingAuditSink\" }");

        assertThrows(IllegalArgumentException.class, () -> AuditInterceptors.connectionFactory(config));
    }

    @Test
    public void testUnknownCaptureStrategy() {
        assertThrows(IllegalArgumentException.class,
                () -> AuditInterceptors.fromConfig(config("capture_strategy = \"trigger\"")));
    }
}
