package io.rowaudit.sql.sink;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.databind.JsonNode;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.*;

public class LoggingAuditSinkTest {

    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();
    private final Logger auditLogger = (Logger) LoggerFactory.getLogger(LoggingAuditSink.AUDIT_LOGGER);

    @BeforeEach
    public void attach() {
        appender.start();
        auditLogger.addAppender(appender);
    }

    @AfterEach
    public void detach() {
        auditLogger.detachAppender(appender);
        appender.stop();
    }

    @Test
    public void testWritesOneJsonLinePerRecord() throws Exception {
        new LoggingAuditSink().write(AuditRecords.usersModified());

        assertEquals(1, appender.list.size());
        ILoggingEvent event = appender.list.get(0);
        assertEquals("rowaudit", event.getMarkerList().get(0).getName());

        JsonNode json = AuditJson.objectMapper().readTree(event.getFormattedMessage());
        assertEquals("Users_Modified", json.get("eventName").asText());
        assertEquals("2024-05-01T10:15:30Z", json.get("timestamp").asText());
        assertEquals("old@x.com", json.get("beforeImage").get("Email").asText());
        assertEquals("a@b.com", json.get("afterImage").get("Email").asText());
        assertEquals("UPDATE", json.get("operationType").asText());
        assertEquals("acme", json.get("customProperties").get("tenant").asText());
    }

    @Test
    public void testMarkerFromConfig() throws Exception {
        var sink = new LoggingAuditSink(ConfigFactory.parseString("marker = \"orders-audit\""));
        sink.write(AuditRecords.usersModified());

        assertEquals("orders-audit", appender.list.get(0).getMarkerList().get(0).getName());
    }
}
