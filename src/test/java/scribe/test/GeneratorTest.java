// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import scribe.fragment.interpreter.FragmentEvaluationErrorCondition;
import scribe.generator.Generator;
import scribe.graph.UnresolvedSymbolCondition;

final class GeneratorTest {
    @Test
    void generatesProjectInDependencyOrder(@TempDir final Path directory) throws IOException {
        final var sources = writeProject(directory);
        final var reports = generate(directory, sources);

        Assertions.assertThat(reports).containsExactly(
            "  Create   " + directory.resolve("point.h"),
            "  Create   " + directory.resolve("struct.h")
        );
        Assertions.assertThat(read(directory.resolve("struct.h")))
            .isEqualTo("struct point {\n    int x;\n    long y;\n};\n");
        Assertions.assertThat(read(directory.resolve("point.h"))).isEqualTo("// point fields\n\n\n");
        Assertions.assertThat(directory.resolve("types")).doesNotExist();
    }

    @Test
    void secondRunChangesNothing(@TempDir final Path directory) throws IOException {
        final var sources = writeProject(directory);
        generate(directory, sources);
        final var first = read(directory.resolve("struct.h"));

        Assertions.assertThat(generate(directory, sources)).isEmpty();
        Assertions.assertThat(read(directory.resolve("struct.h"))).isEqualTo(first);
    }

    @Test
    void changedSourceUpdatesDependentTargets(@TempDir final Path directory) throws IOException {
        final var sources = writeProject(directory);
        generate(directory, sources);
        write(directory.resolve("point.hy"), """
            // point fields
            {{{ Field("x", "int") }}}
            {{{ Field("y", "long") }}}
            {{{ Field("z", "char") }}}
            """);

        Assertions.assertThat(generate(directory, sources)).containsExactly(
            "  Update   " + directory.resolve("point.h"),
            "  Update   " + directory.resolve("struct.h")
        );
        Assertions.assertThat(read(directory.resolve("struct.h")))
            .isEqualTo("struct point {\n    int x;\n    long y;\n    char z;\n};\n");
    }

    @Test
    void unresolvedSymbolAbortsBeforeDeploying(@TempDir final Path directory) throws IOException {
        final var good = write(directory.resolve("good.txty"), "fine\n");
        final var bad = write(directory.resolve("bad.txty"), "{{{ x = Nowhere }}}\n");
        final var condition = Conditions.expectFatal(
            UnresolvedSymbolCondition.class,
            () -> generate(directory, List.of(good, bad))
        );
        Assertions.assertThat(condition.symbolName()).isEqualTo("Nowhere");
        Assertions.assertThat(directory.resolve("good.txt")).doesNotExist();
    }

    @Test
    void evaluationFailureKeepsEarlierOutput(@TempDir final Path directory) throws IOException {
        final var good = write(directory.resolve("good.txty"), "{{{ Value = 1 }}}fine\n");
        final var bad = write(directory.resolve("bad.txty"), "{{{\n    x = Value / 0\n}}}\n");
        final var condition = Conditions.expectFatal(
            FragmentEvaluationErrorCondition.class,
            () -> generate(directory, List.of(bad, good))
        );
        Assertions.assertThat(condition.location().sourceName()).isEqualTo(bad.toString());
        Assertions.assertThat(condition.location().lineNumber()).isEqualTo(2);
        Assertions.assertThat(read(directory.resolve("good.txt"))).isEqualTo("fine\n");
        Assertions.assertThat(directory.resolve("bad.txt")).doesNotExist();
    }

    private static List<Path> writeProject(final Path directory) throws IOException {
        final var types = write(directory.resolve("types.y"), """
            fields = []
            @producer
            def Field(name, type):
                fields.append((name, type))
            @consumer
            def Fields():
                return list(fields)
            """);
        final var point = write(directory.resolve("point.hy"), """
            // point fields
            {{{ Field("x", "int") }}}
            {{{ Field("y", "long") }}}
            """);
        final var struct = write(directory.resolve("struct.hy"), """
            struct point {
                {{{
                    for name, type in Fields():
                        echo("{type} {name};")
                }}}
            };
            """);
        return List.of(struct, types, point);
    }

    private static List<String> generate(final Path directory, final List<Path> sources) {
        final var reports = new ArrayList<String>();
        new Generator(directory, (result, target) -> reports.add(result.statusLine(target))).generate(sources);
        return reports;
    }

    private static Path write(final Path path, final String content) throws IOException {
        Files.writeString(path, content, StandardCharsets.UTF_8);
        return path;
    }

    private static String read(final Path path) throws IOException {
        return Files.readString(path, StandardCharsets.UTF_8);
    }
}
