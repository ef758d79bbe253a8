// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.util.condition;

import java.util.ArrayList;
import java.util.List;
import scribe.util.SneakyThrow;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The per-thread registry of established handlers and restart points.
 * <p>
 * Instances are never exposed; the static methods operate on the calling thread's context.
 *
 * @see Handler
 * @see Restart
 */
public final class ConditionContext {
    private ConditionContext() {
    }

    /**
     * Signals the given condition as an error. If every handler declines it, {@link UnhandledErrorError} is thrown.
     * <p>
     * Never returns normally; the declared return type lets callers write {@code throw ConditionContext.error(...)}.
     */
    public static @NotNull UnhandledErrorError error(final @NotNull Condition condition) {
        deliverOrUnwind(new SignaledCondition(condition, SignaledCondition.Severity.FATAL));
        throw new UnhandledErrorError(condition);
    }

    /**
     * Signals the given exception as a non-fatal {@link SuppressedExceptionCondition}.
     * <p>
     * Called from cleanup code that is possibly already unwinding, so handlers are <strong>not</strong> allowed to
     * transfer control in response.
     */
    public static void signalSuppressedException(final @NotNull Exception exception) {
        try {
            localContext().deliver(new SignaledCondition(
                new SuppressedExceptionCondition(exception),
                SignaledCondition.Severity.NOTICE
            ));
        } catch (final Unwind u) {
            throw new AssertionError("A handler attempted to unwind from a cleanup failure report", u);
        }
    }

    /**
     * Runs the given cleanup callback, reporting any exception it throws with
     * {@link #signalSuppressedException(Exception)} instead of propagating it.
     */
    public static void withSuppressedExceptions(final @NotNull ThrowingCallback callback) {
        try {
            callback.run();
        } catch (final Exception e) {
            signalSuppressedException(e);
        }
    }

    /**
     * Runs the given body under a new restart point with the given name.
     *
     * @return The body's result, or {@code null} if control was transferred to this restart point.
     */
    public static <T> @Nullable T withRestart(
        final @NotNull String restartName,
        final @NotNull Restart.Body<? extends T> body
    ) {
        final var restart = new Restart(restartName);
        try {
            return body.call(restart);
        } catch (final Unwind unwind) {
            if (unwind.target() != restart) {
                throw SneakyThrow.doThrow(unwind);
            }
            return null;
        } finally {
            restart.unlink();
        }
    }

    /**
     * Returns the active restart points, newest first.
     */
    public static @NotNull List<@NotNull Restart> restarts() {
        final var restarts = new ArrayList<Restart>();
        for (var restart = localContext().newestRestart; restart != null; restart = restart.next) {
            restarts.add(restart);
        }
        return restarts;
    }

    static @NotNull ConditionContext localContext() {
        return localContext.get();
    }

    private static void deliverOrUnwind(final @NotNull SignaledCondition condition) {
        try {
            localContext().deliver(condition);
        } catch (final Unwind unwind) {
            throw SneakyThrow.doThrow(unwind);
        }
    }

    private void deliver(final @NotNull SignaledCondition condition) throws Unwind {
        // A condition signaled inside a handler only reaches the handlers established before that one.
        final var first = (runningHandler == null) ? newestHandler : runningHandler.next;
        for (var handler = first; handler != null; handler = handler.next) {
            final var saved = runningHandler;
            runningHandler = handler;
            try {
                handler.handle(condition);
            } finally {
                runningHandler = saved;
            }
        }
    }

    @Nullable Handler newestHandler = null;
    @Nullable Restart newestRestart = null;
    private @Nullable Handler runningHandler = null;

    private static final ThreadLocal<@NotNull ConditionContext> localContext =
        ThreadLocal.withInitial(ConditionContext::new);

    /**
     * A cleanup action that may throw anything.
     */
    @FunctionalInterface
    public interface ThrowingCallback {
        void run() throws Exception;
    }
}
