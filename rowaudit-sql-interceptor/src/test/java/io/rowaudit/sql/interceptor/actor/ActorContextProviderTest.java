package io.rowaudit.sql.interceptor.actor;

import com.typesafe.config.ConfigFactory;
import io.rowaudit.sql.common.model.ActorContext;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

public class ActorContextProviderTest {

    @Test
    public void testStaticDefaultsToSystemActor() {
        assertEquals(Optional.of(ActorContext.system()), new StaticActorContextProvider().currentContext());
    }

    @Test
    public void testStaticFromConfig() {
        var provider = new StaticActorContextProvider(ConfigFactory.parseString("""
                actor_id = batch
                display_name = "Nightly batch"
                """));
        ActorContext context = provider.currentContext().orElseThrow();

        assertEquals("batch", context.actorId());
        assertEquals("Nightly batch", context.displayName());
        assertEquals("unknown", context.networkAddress());
    }

    @Test
    public void testThreadLocalScopesNest() throws Exception {
        var provider = new ThreadLocalActorContextProvider();
        var ann = new ActorContext("1", "Ann", null, null);
        var bob = new ActorContext("2", "Bob", null, null);

        assertTrue(provider.currentContext().isEmpty());
        try (var outer = provider.bind(ann)) {
            try (var inner = provider.bind(bob)) {
                assertEquals("Bob", provider.currentContext().orElseThrow().displayName());
                assertTrue(CompletableFuture.supplyAsync(provider::currentContext).get().isEmpty());
            }
            assertEquals("Ann", provider.currentContext().orElseThrow().displayName());
        }
        assertTrue(provider.currentContext().isEmpty());
    }
}
