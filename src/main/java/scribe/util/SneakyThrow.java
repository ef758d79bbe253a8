// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.util;

import org.jetbrains.annotations.NotNull;

/**
 * Throwing checked throwables past methods that do not declare them.
 */
public final class SneakyThrow {
    private SneakyThrow() {
    }

    /**
     * Throws the given throwable without the compiler checking its type. Used for
     * {@link scribe.util.condition.Unwind}, which crosses any code that signals a condition, and for interrupts of
     * console writes, which the command line tool cannot act upon anyway.
     * <p>
     * The return value exists only for {@code throw SneakyThrow.doThrow(e)} at call sites; nothing is ever returned.
     */
    public static @NotNull RuntimeException doThrow(final @NotNull Throwable throwable) {
        return SneakyThrow.<RuntimeException>rethrow(throwable);
    }

    @SuppressWarnings("unchecked")
    private static <E extends Throwable> @NotNull RuntimeException rethrow(
        final @NotNull Throwable throwable
    ) throws E {
        throw (E) throwable;
    }
}
