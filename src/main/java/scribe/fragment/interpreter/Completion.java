// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.fragment.interpreter;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * How the execution of a statement ended: normally, or by a {@code break}, {@code continue} or {@code return} that
 * still has to be handled by an enclosing loop or function.
 */
record Completion(Kind kind, @Nullable Object value, int line) {
    static Completion returning(final @Nullable Object value, final int line) {
        return new Completion(Kind.RETURN, value, line);
    }

    static Completion of(final Kind kind, final int line) {
        return new Completion(kind, null, line);
    }

    boolean isNormal() {
        return kind == Kind.NORMAL;
    }

    static final Completion normal = new Completion(Kind.NORMAL, null, 0);

    enum Kind {
        NORMAL,
        BREAK,
        CONTINUE,
        RETURN,
    }
}
