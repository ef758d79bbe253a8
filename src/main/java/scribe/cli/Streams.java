// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.cli;

import java.io.PrintStream;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import scribe.util.SneakyThrow;

/**
 * Console output of the command line tool. Every write holds one lock, so that a status line is never split by a
 * condition report.
 */
final class Streams {
    private Streams() {
    }

    /**
     * Prints one line of the change report, such as {@code "  Create   out/list.h"}.
     */
    static void printStatus(final String line) {
        locked(() -> standardOutput().println(line));
    }

    /**
     * Prints the problem with the command line, followed by the usage text, to standard error.
     */
    static void printUsage(final String usage, final String problem) {
        locked(() -> {
            final var err = standardError();
            err.println(problem);
            err.print(usage);
        });
    }

    static void printHelp(final String usage) {
        locked(() -> standardOutput().print(usage));
    }

    /**
     * Runs the given report writer with exclusive access to standard error.
     */
    static void report(final Consumer<PrintStream> writer) {
        locked(() -> writer.accept(standardError()));
    }

    // The unlock is in the finally block, the lock is taken interruptibly just before it.
    @SuppressWarnings("LockAcquiredButNotSafelyReleased")
    private static void locked(final Runnable action) {
        try {
            lock.lockInterruptibly();
        } catch (final InterruptedException e) {
            throw SneakyThrow.doThrow(e);
        }
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    @SuppressWarnings("UseOfSystemOutOrSystemErr")
    private static PrintStream standardOutput() {
        return System.out;
    }

    @SuppressWarnings("UseOfSystemOutOrSystemErr")
    private static PrintStream standardError() {
        return System.err;
    }

    private static final ReentrantLock lock = new ReentrantLock();
}
