package io.rowaudit.sql.common.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Finished audit record of one mutating statement. Immutable; handed over to an
 * {@link io.rowaudit.sql.common.AuditSink} which owns it from then on.
 *
 * <p>{@code timestamp} is the capture time, not the commit time.
 */
public record AuditRecord(
        Instant timestamp,
        String eventName,
        String query,
        Map<String, Object> parameters,
        RowSnapshot beforeImage,
        RowSnapshot afterImage,
        String schemaName,
        String tableName,
        OperationKind operationType,
        CaptureMode captureMode,
        long rowsAffected,

        // actor, absent when no context provider is configured
        String userId,
        String userName,
        String ipAddress,
        String userAgent,

        // where the statement ran
        String machineName,
        long processId,
        long threadId,

        Map<String, Object> customProperties
) {
    public AuditRecord {
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        Objects.requireNonNull(eventName, "eventName must not be null");
        Objects.requireNonNull(query, "query must not be null");
        Objects.requireNonNull(tableName, "tableName must not be null");
        Objects.requireNonNull(operationType, "operationType must not be null");
        parameters = copyOf(parameters);
        beforeImage = beforeImage == null ? RowSnapshot.empty() : beforeImage;
        afterImage = afterImage == null ? RowSnapshot.empty() : afterImage;
        customProperties = copyOf(customProperties);
    }

    private static Map<String, Object> copyOf(Map<String, Object> map) {
        // Map.copyOf rejects null values, which are legitimate SQL NULL bindings here
        return map == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Instant timestamp;
        private String eventName;
        private String query;
        private Map<String, Object> parameters = Collections.emptyMap();
        private RowSnapshot beforeImage = RowSnapshot.empty();
        private RowSnapshot afterImage = RowSnapshot.empty();
        private String schemaName;
        private String tableName;
        private OperationKind operationType = OperationKind.UNKNOWN;
        private CaptureMode captureMode;
        private long rowsAffected;
        private String userId;
        private String userName;
        private String ipAddress;
        private String userAgent;
        private String machineName;
        private long processId;
        private long threadId;
        private Map<String, Object> customProperties = Collections.emptyMap();

        private Builder() {
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder eventName(String eventName) {
            this.eventName = eventName;
            return this;
        }

        public Builder query(String query) {
            this.query = query;
            return this;
        }

        public Builder parameters(Map<String, Object> parameters) {
            this.parameters = parameters;
            return this;
        }

        public Builder beforeImage(RowSnapshot beforeImage) {
            this.beforeImage = beforeImage;
            return this;
        }

        public Builder afterImage(RowSnapshot afterImage) {
            this.afterImage = afterImage;
            return this;
        }

        public Builder schemaName(String schemaName) {
            this.schemaName = schemaName;
            return this;
        }

        public Builder tableName(String tableName) {
            this.tableName = tableName;
            return this;
        }

        public Builder operationType(OperationKind operationType) {
            this.operationType = operationType;
            return this;
        }

        public Builder captureMode(CaptureMode captureMode) {
            this.captureMode = captureMode;
            return this;
        }

        public Builder rowsAffected(long rowsAffected) {
            this.rowsAffected = rowsAffected;
            return this;
        }

        public Builder actor(ActorContext actor) {
            if (actor != null) {
                this.userId = actor.actorId();
                this.userName = actor.displayName();
                this.ipAddress = actor.networkAddress();
                this.userAgent = actor.agentString();
                this.customProperties = actor.customProperties();
            }
            return this;
        }

        public Builder machineName(String machineName) {
            this.machineName = machineName;
            return this;
        }

        public Builder processId(long processId) {
            this.processId = processId;
            return this;
        }

        public Builder threadId(long threadId) {
            this.threadId = threadId;
            return this;
        }

        public AuditRecord build() {
            return new AuditRecord(timestamp, eventName, query, parameters, beforeImage, afterImage,
                    schemaName, tableName, operationType, captureMode, rowsAffected,
                    userId, userName, ipAddress, userAgent,
                    machineName, processId, threadId, customProperties);
        }
    }
}
