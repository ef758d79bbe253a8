// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.unit;

import org.checkerframework.checker.nullness.qual.Nullable;
import scribe.fragment.Program;

/**
 * A piece of a unit: either literal text copied to the output, or a parsed fragment to execute.
 */
public sealed interface Block {
    record Text(String content) implements Block {
    }

    /**
     * A fragment.
     *
     * @param source       The fragment source as it was parsed, after the source rewrites.
     * @param indentPrefix The whitespace preceding the opening marker, with everything but tabs turned into
     *                     spaces, prepended to every emitted line but the first. {@code null} in code units.
     * @param program      The parsed fragment.
     */
    record Fragment(String source, @Nullable String indentPrefix, Program program) implements Block {
    }
}
