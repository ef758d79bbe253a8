// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.generator;

import java.util.ArrayList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;
import scribe.fragment.interpreter.LineSink;

/**
 * Collects the lines one fragment emits, and lays them out once the fragment has finished.
 * <p>
 * Every line but the first gets the fragment's indentation prefix, since the first one continues the literal text
 * preceding the fragment. Every line but the last gets its delimiter and, unless suppressed, a line break; the last
 * line flows into whatever text follows the fragment. This way a variable-length list can be joined with commas
 * without a trailing one.
 */
public final class EmissionBuffer implements LineSink {
    public EmissionBuffer(final String indentPrefix) {
        this.indentPrefix = indentPrefix;
    }

    @Override
    public void emit(final String line, final @Nullable String delimiter, final boolean newline) {
        lines.add(new Line(line, delimiter, newline));
    }

    /**
     * Lays out the lines emitted so far, and empties the buffer.
     */
    public String flush() {
        final var builder = new StringBuilder();
        final var last = lines.size() - 1;
        for (var i = 0; i <= last; i += 1) {
            final var line = lines.get(i);
            if (i > 0) {
                builder.append(indentPrefix);
            }
            builder.append(line.text);
            if (i < last) {
                if (line.delimiter != null) {
                    builder.append(line.delimiter);
                }
                if (line.newline) {
                    builder.append('\n');
                }
            }
        }
        lines.clear();
        return builder.toString();
    }

    private final String indentPrefix;
    private final List<Line> lines = new ArrayList<>();

    private record Line(String text, @Nullable String delimiter, boolean newline) {
    }
}
