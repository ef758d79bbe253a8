// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.util.condition;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import org.jetbrains.annotations.NotNull;

/**
 * A fatal condition reporting that a file could not be read or rewritten: a missing source unit, an unreadable
 * generated file given to the line marker adjuster. Output deployment failures have their own condition type.
 */
public final class FileAccessErrorCondition extends Condition {
    public FileAccessErrorCondition(final @NotNull Path file, final @NotNull IOException exception) {
        super("Cannot access " + file + ": " + exception.getMessage());
        this.file = file;
        this.exception = exception;
    }

    public @NotNull Path file() {
        return file;
    }

    public @NotNull IOException exception() {
        return exception;
    }

    /**
     * The message followed by the stack trace of the underlying exception.
     */
    @Override
    public @NotNull String detailedMessage() {
        final var charset = StandardCharsets.UTF_8;
        final var bytes = new ByteArrayOutputStream();
        try (final var stream = new PrintStream(bytes, false, charset)) {
            stream.println(message());
            exception.printStackTrace(stream);
        }
        return bytes.toString(charset);
    }

    private final @NotNull Path file;
    private final @NotNull IOException exception;
}
