// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.util.condition;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * An established condition handler, intended to be used within try-with-resources.
 * <p>
 * When a condition is signaled, handlers are consulted newest first until one of them transfers control.
 */
public final class Handler implements AutoCloseable {
    /**
     * Establishes a handler running the given procedure in the calling thread.
     */
    public Handler(final @NotNull Procedure procedure) {
        final var context = ConditionContext.localContext();
        next = context.newestHandler;
        this.procedure = procedure;
        owner = context;
        context.newestHandler = this;
    }

    /**
     * Does nothing; referencing the resource keeps compilers from warning about an unused try-with-resources
     * variable.
     */
    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    /**
     * Disestablishes the handler.
     */
    @Override
    public void close() {
        assert owner == ConditionContext.localContext() : "Handler closed by a different thread";
        assert owner.newestHandler == this : "Handlers closed out of order";
        owner.newestHandler = next;
    }

    void handle(final @NotNull SignaledCondition condition) throws Unwind {
        procedure.handle(condition);
    }

    final @Nullable Handler next;
    private final @NotNull Procedure procedure;
    private final @NotNull ConditionContext owner;

    /**
     * The body of a handler. Returning normally declines the condition, which older handlers then get to see.
     * Handling it means transferring control elsewhere, usually with {@link Restart#unwindTo()}.
     */
    @FunctionalInterface
    public interface Procedure {
        void handle(@NotNull SignaledCondition condition) throws Unwind;
    }
}
