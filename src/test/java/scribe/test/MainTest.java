// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import scribe.cli.Main;

final class MainTest {
    @Test
    void helpSucceeds() {
        Assertions.assertThat(Main.run(new String[]{"--help"})).isZero();
    }

    @Test
    void usageErrors() {
        Assertions.assertThat(Main.run(new String[]{})).isEqualTo(usage);
        Assertions.assertThat(Main.run(new String[]{"--frobnicate", "list.hy"})).isEqualTo(usage);
        Assertions.assertThat(Main.run(new String[]{"list.hy", "-d"})).isEqualTo(usage);
        Assertions.assertThat(Main.run(new String[]{"notes.txt"})).isEqualTo(usage);
    }

    @Test
    void generatesTargets(@TempDir final Path directory) throws IOException {
        final var source = directory.resolve("hello.txty");
        Files.writeString(source, "{{{ who = 'world' }}}Hello, {{{ echo('{who}') }}}!\n", StandardCharsets.UTF_8);
        Assertions.assertThat(Main.run(new String[]{"-d", directory.toString(), source.toString()})).isZero();
        Assertions.assertThat(Files.readString(directory.resolve("hello.txt"), StandardCharsets.UTF_8))
            .isEqualTo("Hello, world!\n");
    }

    @Test
    void fatalConditionGivesErrorExitCode(@TempDir final Path directory) throws IOException {
        final var source = directory.resolve("broken.txty");
        Files.writeString(source, "{{{ x = Missing }}}\n", StandardCharsets.UTF_8);
        Assertions.assertThat(Main.run(new String[]{"--outputdir=" + directory, source.toString()})).isEqualTo(1);
        Assertions.assertThat(directory.resolve("broken.txt")).doesNotExist();
    }

    @Test
    void unreadableSourceGivesErrorExitCode(@TempDir final Path directory) {
        final var source = directory.resolve("absent.txty");
        Assertions.assertThat(Main.run(new String[]{source.toString()})).isEqualTo(1);
    }

    @Test
    void adjustModeRewritesFilesInPlace(@TempDir final Path directory) throws IOException {
        final var file = directory.resolve("plain.i");
        Files.writeString(file, "int x;\n", StandardCharsets.UTF_8);
        Assertions.assertThat(Main.run(new String[]{"--adjust", "-d", directory.toString(), file.toString()}))
            .isZero();
        Assertions.assertThat(Files.readString(file, StandardCharsets.UTF_8)).isEqualTo("int x;\n");
    }

    private static final int usage = 64;
}
