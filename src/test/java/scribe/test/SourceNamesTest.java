// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.test;

import java.nio.file.Path;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import scribe.unit.SourceNames;

final class SourceNamesTest {
    @ParameterizedTest
    @CsvSource({
        "list.hy, true",
        "src/Main.javay, true",
        "registry.y, true",
        "notes.txt, false",
        "story, false",
        "dir.y/plain, false",
    })
    void acceptsNamesEndingInSuffixLetter(final String name, final boolean acceptable) {
        Assertions.assertThat(SourceNames.isAcceptable(Path.of(name))).isEqualTo(acceptable);
    }

    @Test
    void emptyStemExtensionMarksCodeUnit() {
        Assertions.assertThat(SourceNames.isCodeUnit(Path.of("lib/registry.y"))).isTrue();
        Assertions.assertThat(SourceNames.isCodeUnit(Path.of("lib/list.hy"))).isFalse();
    }

    @Test
    void targetDropsLastLetterUnderOutputRoot() {
        Assertions.assertThat(SourceNames.targetPath(Path.of("src/list.hy"), Path.of("out")))
            .isEqualTo(Path.of("out/src/list.h"));
        Assertions.assertThat(SourceNames.targetPath(Path.of("Main.javay"), Path.of("")))
            .isEqualTo(Path.of("Main.java"));
    }
}
