// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.generator;

/**
 * What deploying a target did to it.
 */
public enum DeploymentResult {
    CREATED("Create"),
    UPDATED("Update"),
    UNCHANGED("Keep");

    DeploymentResult(final String label) {
        this.label = label;
    }

    /**
     * Checks whether the target file was touched.
     */
    public boolean isChange() {
        return this != UNCHANGED;
    }

    /**
     * Returns the status line reported for a target with this result.
     */
    public String statusLine(final Object target) {
        return "  " + label + "   " + target;
    }

    private final String label;
}
