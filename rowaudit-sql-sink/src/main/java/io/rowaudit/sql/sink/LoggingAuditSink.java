package io.rowaudit.sql.sink;

import com.typesafe.config.Config;
import io.rowaudit.sql.common.AuditSink;
import io.rowaudit.sql.common.model.AuditRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

/**
 * Writes every record as one JSON line to the {@value #AUDIT_LOGGER} logger, so the logging
 * backend decides where audit data ends up.
 */
public class LoggingAuditSink implements AuditSink {

    public static final String AUDIT_LOGGER = "rowaudit.audit";
    public static final String MARKER_KEY = "marker";

    private static final Logger auditLogger = LoggerFactory.getLogger(AUDIT_LOGGER);

    private final Marker marker;

    public LoggingAuditSink() {
        this(MarkerFactory.getMarker("rowaudit"));
    }

    public LoggingAuditSink(Marker marker) {
        this.marker = marker;
    }

    public LoggingAuditSink(Config config) {
        this(MarkerFactory.getMarker(config.hasPath(MARKER_KEY) ? config.getString(MARKER_KEY) : "rowaudit"));
    }

    @Override
    public void write(AuditRecord record) throws Exception {
        auditLogger.info(marker, AuditJson.write(record));
    }
}
