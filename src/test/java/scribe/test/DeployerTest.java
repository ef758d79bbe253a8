// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import scribe.generator.Deployer;
import scribe.generator.DeploymentErrorCondition;
import scribe.generator.DeploymentResult;

final class DeployerTest {
    @Test
    void createsTargetAndParentDirectories(@TempDir final Path directory) throws IOException {
        final var target = directory.resolve("a/b/out.txt");
        Assertions.assertThat(Deployer.deploy(target, "héllo\n")).isEqualTo(DeploymentResult.CREATED);
        Assertions.assertThat(Files.readString(target, StandardCharsets.UTF_8)).isEqualTo("héllo\n");
        try (final var stream = Files.list(target.getParent())) {
            Assertions.assertThat(stream.toList()).containsExactly(target);
        }
    }

    @Test
    void identicalContentLeavesTargetUntouched(@TempDir final Path directory) throws IOException {
        final var target = directory.resolve("out.txt");
        Files.writeString(target, "same", StandardCharsets.UTF_8);
        final var past = FileTime.from(Instant.parse("2020-01-01T00:00:00Z"));
        Files.setLastModifiedTime(target, past);

        Assertions.assertThat(Deployer.deploy(target, "same")).isEqualTo(DeploymentResult.UNCHANGED);
        Assertions.assertThat(Files.getLastModifiedTime(target)).isEqualTo(past);
        Assertions.assertThat(directory.resolve("out.txt.tmp")).doesNotExist();
    }

    @Test
    void differentContentReplacesTarget(@TempDir final Path directory) throws IOException {
        final var target = directory.resolve("out.txt");
        Files.writeString(target, "old", StandardCharsets.UTF_8);
        Assertions.assertThat(Deployer.deploy(target, "new")).isEqualTo(DeploymentResult.UPDATED);
        Assertions.assertThat(Files.readString(target, StandardCharsets.UTF_8)).isEqualTo("new");
        Assertions.assertThat(directory.resolve("out.txt.tmp")).doesNotExist();
    }

    @Test
    void failureIsDeploymentError(@TempDir final Path directory) throws IOException {
        final var blocker = directory.resolve("blocker");
        Files.writeString(blocker, "not a directory", StandardCharsets.UTF_8);
        final var target = blocker.resolve("out.txt");
        final var condition = Conditions.expectFatal(
            DeploymentErrorCondition.class,
            () -> Deployer.deploy(target, "content")
        );
        Assertions.assertThat(condition.target()).isEqualTo(target);
        Assertions.assertThat(Files.readString(blocker, StandardCharsets.UTF_8)).isEqualTo("not a directory");
    }

    @Test
    void failureAfterWritingRemovesTemporaryAndKeepsTarget(@TempDir final Path directory) throws IOException {
        final var target = directory.resolve("out");
        final var inner = target.resolve("inner/x");
        Files.createDirectories(inner.getParent());
        Files.writeString(inner, "kept", StandardCharsets.UTF_8);

        final var condition = Conditions.expectFatal(
            DeploymentErrorCondition.class,
            () -> Deployer.deploy(target, "content")
        );
        Assertions.assertThat(condition.target()).isEqualTo(target);
        Assertions.assertThat(directory.resolve("out.tmp")).doesNotExist();
        Assertions.assertThat(target).isDirectory();
        Assertions.assertThat(Files.readString(inner, StandardCharsets.UTF_8)).isEqualTo("kept");
    }

    @Test
    void statusLinesNameActionAndTarget() {
        Assertions.assertThat(DeploymentResult.CREATED.statusLine(Path.of("out/list.h")))
            .isEqualTo("  Create   out/list.h");
        Assertions.assertThat(DeploymentResult.UPDATED.statusLine(Path.of("out/list.h")))
            .isEqualTo("  Update   out/list.h");
        Assertions.assertThat(DeploymentResult.UNCHANGED.isChange()).isFalse();
    }
}
