// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * A condition as a handler sees it, together with how it was signaled.
 */
public record SignaledCondition(@NotNull Condition condition, @NotNull Severity severity) {
    /**
     * Whether the signaling code cannot continue, so a handler must unwind for the run to go on.
     */
    public boolean isFatal() {
        return severity == Severity.FATAL;
    }

    public enum Severity {
        /**
         * Signaled with {@link ConditionContext#error(Condition)}; returning from every handler is a bug.
         */
        FATAL,
        /**
         * Signaled with {@link ConditionContext#signalSuppressedException(Exception)}; handlers only take note of it.
         */
        NOTICE,
    }
}
