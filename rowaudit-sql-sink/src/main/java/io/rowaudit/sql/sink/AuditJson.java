package io.rowaudit.sql.sink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JSON form of audit records and of their maps. Dates are written as ISO-8601 strings.
 */
public final class AuditJson {

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private AuditJson() {
    }

    public static String write(Object value) throws JsonProcessingException {
        return objectMapper.writeValueAsString(value);
    }

    public static ObjectMapper objectMapper() {
        return objectMapper;
    }
}
