// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import scribe.generator.DeploymentResult;
import scribe.generator.LineMarkerAdjuster;

final class LineMarkerAdjusterTest {
    @Test
    void rewritesMarkersOfGeneratedFiles() {
        final var adjuster = new LineMarkerAdjuster(outputRoot, existing::contains);
        final var text = """
            # 1 "/work/out/src/list.h"
            # 12 "/work/out/src/list.h" 2
            #line 7 "/work/out/src/list.h"
            int x;
            """;
        Assertions.assertThat(adjuster.adjust(text)).isEqualTo("""
            # 1 "src/list.hy"
            # 12 "src/list.hy" 2
            #line 7 "src/list.hy"
            int x;
            """);
    }

    @Test
    void leavesOtherMarkersAlone() {
        final var adjuster = new LineMarkerAdjuster(outputRoot, existing::contains);
        final var text = """
            # 1 "/usr/include/stdio.h" 1 3
            # 2 "/work/out/src/handwritten.h"
            # 3 "/work/out"
            #pragma once
            printf("# 4 \\"/work/out/src/list.h\\"");
            """;
        Assertions.assertThat(adjuster.adjust(text)).isEqualTo(text);
    }

    @Test
    void adjustsFilesOnlyWhenSomethingChanged(@TempDir final Path directory) throws IOException {
        final var adjuster = new LineMarkerAdjuster(outputRoot, existing::contains);
        final var file = directory.resolve("list.i");
        Files.writeString(file, "# 3 \"/work/out/src/list.h\"\nint x;\n", StandardCharsets.UTF_8);

        Assertions.assertThat(adjuster.adjustFile(file)).isEqualTo(DeploymentResult.UPDATED);
        Assertions.assertThat(Files.readString(file, StandardCharsets.UTF_8))
            .isEqualTo("# 3 \"src/list.hy\"\nint x;\n");
        Assertions.assertThat(adjuster.adjustFile(file)).isEqualTo(DeploymentResult.UNCHANGED);
    }

    private static final Path outputRoot = Path.of("/work/out");
    private static final Set<Path> existing = Set.of(Path.of("src/list.hy"));
}
