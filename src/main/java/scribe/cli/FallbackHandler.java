// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.cli;

import java.io.PrintStream;
import scribe.util.Trace;
import scribe.util.condition.Condition;
import scribe.util.condition.ConditionContext;
import scribe.util.condition.Handler;
import scribe.util.condition.Restart;
import scribe.util.condition.SignaledCondition;
import scribe.util.condition.SuppressedExceptionCondition;

/**
 * The outermost condition handler: reports conditions nobody else handled, and aborts the run on fatal ones.
 */
final class FallbackHandler implements Handler.Procedure {
    private FallbackHandler() {
    }

    static FallbackHandler instance() {
        return instance;
    }

    @Override
    public void handle(final SignaledCondition condition) {
        if (!condition.isFatal()) {
            if (condition.condition() instanceof final SuppressedExceptionCondition c) {
                Streams.report(err -> showCondition(err, c, "A condition"));
            }
            return;
        }
        Streams.report(err -> showCondition(err, condition.condition(), "A fatal condition"));
        findAbortRestart().unwindTo();
    }

    private static void showCondition(final PrintStream err, final Condition condition, final String prefix) {
        err.println(prefix + " of type " + condition.typeName() + " has been signaled.");
        err.println("\nDetailed message:");
        err.println(condition.detailedMessage().stripTrailing());
        final var traces = Trace.activeTraces();
        if (!traces.isEmpty()) {
            err.println("\nOperation trace:");
            for (final var traceMessage : traces) {
                err.println(" - " + traceMessage);
            }
        }
        err.println();
    }

    private static Restart findAbortRestart() {
        for (final var restart : ConditionContext.restarts()) {
            if (restart.name().equals(abortRestartName)) {
                return restart;
            }
        }
        throw new IllegalStateException("No " + abortRestartName + " restart available");
    }

    static final String abortRestartName = "abort-process";

    private static final FallbackHandler instance = new FallbackHandler();
}
