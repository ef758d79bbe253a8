// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.util.condition;

/**
 * A non-fatal condition reporting that a cleanup step failed, such as removing a leftover temporary file after a
 * failed deployment. The run goes on; the report only tells the user something may need tidying up by hand.
 * <p>
 * Signaled by {@link ConditionContext#signalSuppressedException(Exception)}; handlers must not unwind from it.
 */
public final class SuppressedExceptionCondition extends Condition {
    public SuppressedExceptionCondition(final Exception exception) {
        super("Cleanup failed, continuing anyway: " + exception);
        this.exception = exception;
    }

    public Exception exception() {
        return exception;
    }

    private final Exception exception;
}
