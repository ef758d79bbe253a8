// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.test;

import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;
import scribe.generator.EmissionBuffer;

final class EmissionBufferTest {
    @Test
    void lastLineGetsNoSeparator() {
        final var buffer = new EmissionBuffer("");
        buffer.emit("- 1", ",", true);
        buffer.emit("- 2", ",", true);
        buffer.emit("- 3", ",", true);
        Assertions.assertThat(buffer.flush()).isEqualTo("- 1,\n- 2,\n- 3");
    }

    @Test
    void continuationLinesAreReindented() {
        final var buffer = new EmissionBuffer("\t\t");
        buffer.emit("first", null, true);
        buffer.emit("second", null, true);
        Assertions.assertThat(buffer.flush()).isEqualTo("first\n\t\tsecond");
    }

    @Test
    void suppressedNewlineKeepsDelimiter() {
        final var buffer = new EmissionBuffer("  ");
        buffer.emit("a", ", ", false);
        buffer.emit("b", ", ", false);
        buffer.emit("c", ", ", false);
        Assertions.assertThat(buffer.flush()).isEqualTo("a,   b,   c");
    }

    @Test
    void flushEmptiesBuffer() {
        final var buffer = new EmissionBuffer("");
        Assertions.assertThat(buffer.flush()).isEmpty();
        buffer.emit("once", null, true);
        Assertions.assertThat(buffer.flush()).isEqualTo("once");
        Assertions.assertThat(buffer.flush()).isEmpty();
    }
}
