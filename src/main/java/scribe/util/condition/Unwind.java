// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * Carries control from a handler back to the {@link Restart} it chose.
 * <p>
 * Extends {@link Throwable} directly, so that {@code catch (Exception e)} in the code being abandoned does not stop
 * it. Only {@link Restart} creates it and only {@link ConditionContext} catches it; it is public so that
 * {@link Handler.Procedure} can declare it.
 */
@SuppressWarnings("ExtendsThrowable")
public final class Unwind extends Throwable {
    Unwind(final @NotNull Restart target) {
        super("Unwinding to restart " + target.name(), null, false, false);
        this.target = target;
    }

    @NotNull Restart target() {
        return target;
    }

    private final transient @NotNull Restart target;
}
