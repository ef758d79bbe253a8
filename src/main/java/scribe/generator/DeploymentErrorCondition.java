// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.generator;

import java.io.IOException;
import java.nio.file.Path;
import scribe.util.condition.Condition;

/**
 * A condition type indicating that generated output could not be written to its target: the directory couldn't be
 * created, or the temporary file couldn't be written or moved into place.
 */
public final class DeploymentErrorCondition extends Condition {
    DeploymentErrorCondition(final Path target, final IOException exception) {
        super("Cannot deploy " + target + ": " + exception);
        this.target = target;
        this.exception = exception;
    }

    public Path target() {
        return target;
    }

    public IOException exception() {
        return exception;
    }

    private final Path target;
    private final IOException exception;
}
