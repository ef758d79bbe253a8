// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.util.condition;

import scribe.util.SneakyThrow;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A named point control can be transferred to from a condition handler.
 * <p>
 * Restarts are created by {@link ConditionContext#withRestart(String, Body)} and live exactly as long as
 * its callback runs.
 */
public final class Restart {
    Restart(final @NotNull String name) {
        final var context = ConditionContext.localContext();
        next = context.newestRestart;
        this.name = name;
        owner = context;
        context.newestRestart = this;
    }

    /**
     * Retrieves the user-readable name of this restart point, such as {@code abort-process}.
     */
    public @NotNull String name() {
        return name;
    }

    /**
     * Abandons everything between the caller and this restart point; the corresponding
     * {@link ConditionContext#withRestart(String, Body)} call returns {@code null}.
     * <p>
     * Never returns.
     */
    public void unwindTo() {
        throw SneakyThrow.doThrow(new Unwind(this));
    }

    void unlink() {
        assert owner == ConditionContext.localContext() : "Restart unlinked by a different thread";
        assert owner.newestRestart == this : "Restarts unlinked out of order";
        owner.newestRestart = next;
    }

    final @Nullable Restart next;
    private final @NotNull String name;
    private final @NotNull ConditionContext owner;

    /**
     * Code run while a restart point is established; it receives the restart so that it may hand it to handlers.
     */
    @FunctionalInterface
    public interface Body<T> {
        @SuppressWarnings("RedundantThrows")
        T call(@NotNull Restart restart) throws Unwind;
    }
}
