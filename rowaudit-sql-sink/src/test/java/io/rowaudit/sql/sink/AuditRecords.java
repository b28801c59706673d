package io.rowaudit.sql.sink;

import io.rowaudit.sql.common.model.ActorContext;
import io.rowaudit.sql.common.model.AuditRecord;
import io.rowaudit.sql.common.model.CaptureMode;
import io.rowaudit.sql.common.model.OperationKind;
import io.rowaudit.sql.common.model.RowSnapshot;

import java.time.Instant;
import java.util.Map;

final class AuditRecords {

    static final Instant TIMESTAMP = Instant.parse("2024-05-01T10:15:30Z");

    private AuditRecords() {
    }

    static AuditRecord usersModified() {
        return update("dbo", "Users");
    }

    static AuditRecord update(String schema, String table) {
        return AuditRecord.builder()
                .timestamp(TIMESTAMP)
                .eventName(OperationKind.UPDATE.eventName(table))
                .query("UPDATE " + table + " SET Email=@Email WHERE Id=@Id")
                .parameters(Map.of("@Email", "a@b.com", "@Id", 5))
                .beforeImage(RowSnapshot.of(Map.of("Id", 5, "Email", "old@x.com")))
                .afterImage(RowSnapshot.of(Map.of("Id", 5, "Email", "a@b.com")))
                .schemaName(schema)
                .tableName(table)
                .operationType(OperationKind.UPDATE)
                .captureMode(CaptureMode.RELOAD)
                .rowsAffected(1)
                .actor(new ActorContext("42", "Ann", "10.0.0.7", "curl/8.0").withCustomProperty("tenant", "acme"))
                .machineName("test-host")
                .processId(1234)
                .threadId(7)
                .build();
    }
}
