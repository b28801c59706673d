package io.rowaudit.sql.common;

import io.rowaudit.sql.common.model.ActorContext;

import java.util.Optional;

/**
 * Supplies the actor on whose behalf the current statement runs. Called once per audited execution.
 */
@FunctionalInterface
public interface ActorContextProvider {

    ActorContextProvider NONE = Optional::empty;

    Optional<ActorContext> currentContext();
}
