// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown when a fatal condition reached no handler willing to unwind. Entry points establish a handler that always
 * unwinds on fatal conditions, so seeing this means such a handler is missing.
 */
public final class UnhandledErrorError extends AssertionError {
    UnhandledErrorError(final @NotNull Condition condition) {
        super("No handler unwound from fatal condition " + condition);
        this.condition = condition;
    }

    public @NotNull Condition condition() {
        return condition;
    }

    private final transient @NotNull Condition condition;
}
