package io.rowaudit.sql.interceptor.capture;

import io.rowaudit.sql.common.command.SqlCommand;
import io.rowaudit.sql.common.command.SqlConnection;
import io.rowaudit.sql.common.error.InterceptionState;
import io.rowaudit.sql.common.model.ParameterBindings;
import io.rowaudit.sql.parser.StatementDescriptor;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * @param connection the connection {@code command} belongs to, used for capture queries
 * @param bindings   a copy of the command parameters taken before execution
 * @param listener   notified as the capture enters each state
 */
public record CaptureRequest(SqlConnection connection,
                             SqlCommand command,
                             StatementDescriptor descriptor,
                             ParameterBindings bindings,
                             Consumer<InterceptionState> listener) {

    public CaptureRequest {
        Objects.requireNonNull(connection, "connection must not be null");
        Objects.requireNonNull(command, "command must not be null");
        Objects.requireNonNull(descriptor, "descriptor must not be null");
        Objects.requireNonNull(bindings, "bindings must not be null");
        listener = listener == null ? state -> { } : listener;
    }

    void enter(InterceptionState state) {
        listener.accept(state);
    }
}
