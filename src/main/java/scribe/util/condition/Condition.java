// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * Something that went wrong, or is worth telling the user about, during a run of the generator.
 * <p>
 * Every condition has a one-line message. Conditions with more to say, like the list of dependency cycles or the
 * stack trace of an I/O failure, override {@link #detailedMessage()}.
 */
public abstract class Condition {
    protected Condition(final @NotNull String message) {
        this.message = message;
    }

    public final @NotNull String message() {
        return message;
    }

    /**
     * The full report shown to the user. Just the message unless overridden.
     */
    public @NotNull String detailedMessage() {
        return message;
    }

    /**
     * The name the condition is reported under, the simple name of its class.
     */
    public final @NotNull String typeName() {
        return getClass().getSimpleName();
    }

    @Override
    public @NotNull String toString() {
        return typeName() + ": " + message;
    }

    private final @NotNull String message;
}
