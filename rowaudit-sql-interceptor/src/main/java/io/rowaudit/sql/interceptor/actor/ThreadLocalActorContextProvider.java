package io.rowaudit.sql.interceptor.actor;

import io.rowaudit.sql.common.ActorContextProvider;
import io.rowaudit.sql.common.model.ActorContext;

import java.util.Optional;

/**
 * Actor bound to the current thread for the duration of a request:
 * <pre>{@code
 * try (var scope = provider.bind(new ActorContext("42", "Ann", "10.0.0.7", "curl/8.0"))) {
 *     command.execute();
 * }
 * }</pre>
 * Scopes nest; closing one restores the actor that was bound before it.
 */
public class ThreadLocalActorContextProvider implements ActorContextProvider {

    private final ThreadLocal<ActorContext> current = new ThreadLocal<>();

    public Scope bind(ActorContext context) {
        ActorContext previous = current.get();
        current.set(context);
        return new Scope(previous);
    }

    @Override
    public Optional<ActorContext> currentContext() {
        return Optional.ofNullable(current.get());
    }

    public final class Scope implements AutoCloseable {
        private final ActorContext previous;

        private Scope(ActorContext previous) {
            this.previous = previous;
        }

        @Override
        public void close() {
            if (previous == null) {
                current.remove();
            } else {
                current.set(previous);
            }
        }
    }
}
