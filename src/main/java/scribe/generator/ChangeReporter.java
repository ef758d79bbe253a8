// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.generator;

import java.nio.file.Path;

/**
 * Receives a notice for every target whose content was changed.
 */
@FunctionalInterface
public interface ChangeReporter {
    void report(DeploymentResult result, Path target);
}
