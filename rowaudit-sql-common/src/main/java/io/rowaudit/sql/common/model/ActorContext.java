package io.rowaudit.sql.common.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Who triggered a mutation. Every field except {@code customProperties} may be {@code null}.
 */
public record ActorContext(String actorId,
                           String displayName,
                           String networkAddress,
                           String agentString,
                           Map<String, Object> customProperties) {

    public ActorContext {
        customProperties = customProperties == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(customProperties));
    }

    public ActorContext(String actorId, String displayName, String networkAddress, String agentString) {
        this(actorId, displayName, networkAddress, agentString, Collections.emptyMap());
    }

    public static ActorContext system() {
        return new ActorContext("system", "System User", "unknown", "unknown");
    }

    public ActorContext withCustomProperty(String key, Object value) {
        var properties = new LinkedHashMap<>(customProperties);
        properties.put(key, value);
        return new ActorContext(actorId, displayName, networkAddress, agentString, properties);
    }
}
