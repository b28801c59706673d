package io.rowaudit.sql.interceptor.actor;

import com.typesafe.config.Config;
import io.rowaudit.sql.common.ActorContextProvider;
import io.rowaudit.sql.common.config.ConfigConstants;
import io.rowaudit.sql.common.model.ActorContext;

import java.util.Optional;

/**
 * Reports the same actor for every statement; the system actor unless configured otherwise:
 * <pre>{@code
 * actor_context_provider {
 *   class = "io.rowaudit.sql.interceptor.actor.StaticActorContextProvider"
 *   actor_id = "batch"
 *   display_name = "Nightly batch"
 * }
 * }</pre>
 */
public class StaticActorContextProvider implements ActorContextProvider {

    private final ActorContext context;

    public StaticActorContextProvider() {
        this(ActorContext.system());
    }

    public StaticActorContextProvider(ActorContext context) {
        this.context = context;
    }

    public StaticActorContextProvider(Config config) {
        ActorContext system = ActorContext.system();
        this.context = new ActorContext(
                string(config, ConfigConstants.ACTOR_ID_KEY, system.actorId()),
                string(config, ConfigConstants.DISPLAY_NAME_KEY, system.displayName()),
                string(config, ConfigConstants.NETWORK_ADDRESS_KEY, system.networkAddress()),
                string(config, ConfigConstants.AGENT_KEY, system.agentString()));
    }

    private static String string(Config config, String key, String defaultValue) {
        return config.hasPath(key) ? config.getString(key) : defaultValue;
    }

    @Override
    public Optional<ActorContext> currentContext() {
        return Optional.of(context);
    }
}
