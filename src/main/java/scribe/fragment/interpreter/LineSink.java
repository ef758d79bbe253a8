// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.fragment.interpreter;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Receives the lines emitted by the line emission primitive of the fragment being executed.
 */
@FunctionalInterface
public interface LineSink {
    /**
     * Accepts one emitted line.
     *
     * @param line      The already formatted line.
     * @param delimiter Text appended to the line unless it turns out to be the last one of its fragment, or
     *                  {@code null}.
     * @param newline   Whether the line is to be terminated by a line break unless it turns out to be the last one.
     */
    void emit(String line, @Nullable String delimiter, boolean newline);
}
