// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.generator;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import scribe.util.Trace;
import scribe.util.condition.ConditionContext;
import scribe.util.condition.UnhandledErrorError;

/**
 * Writes generated output to targets, touching a target only if its content actually changes, so that its
 * modification time stays meaningful to downstream build tools.
 * <p>
 * Output is first written to a temporary file next to the target, which then either replaces the target or, if
 * it's identical to the target, is thrown away. A failed write never leaves a partially written target behind.
 */
public final class Deployer {
    private Deployer() {
    }

    /**
     * Deploys the given content, encoded as UTF-8, to the given target.
     * <p>
     * I/O errors are signaled as fatal {@link DeploymentErrorCondition}s, after removing the temporary file.
     */
    @CheckReturnValue
    public static DeploymentResult deploy(final Path target, final String content) {
        try (final var trace = new Trace(() -> "Deploying " + target)) {
            trace.use();
            final var temporary = target.resolveSibling(target.getFileName() + temporarySuffix);
            try {
                final var directory = target.toAbsolutePath().getParent();
                if (directory != null) {
                    Files.createDirectories(directory);
                }
            } catch (final IOException e) {
                throw deploymentError(target, e);
            }
            try {
                Files.write(temporary, content.getBytes(StandardCharsets.UTF_8));
                final var existed = Files.exists(target);
                if (existed && Files.mismatch(temporary, target) == -1L) {
                    Files.delete(temporary);
                    return DeploymentResult.UNCHANGED;
                }
                replace(temporary, target);
                return existed ? DeploymentResult.UPDATED : DeploymentResult.CREATED;
            } catch (final IOException e) {
                ConditionContext.withSuppressedExceptions(() -> Files.deleteIfExists(temporary));
                throw deploymentError(target, e);
            }
        }
    }

    private static void replace(final Path temporary, final Path target) throws IOException {
        try {
            Files.move(temporary, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (final AtomicMoveNotSupportedException e) {
            Files.move(temporary, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static UnhandledErrorError deploymentError(final Path target, final IOException exception) {
        return ConditionContext.error(new DeploymentErrorCondition(target, exception));
    }

    static final String temporarySuffix = ".tmp";
}
