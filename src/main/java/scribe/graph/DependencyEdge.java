// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.graph;

import scribe.unit.Unit;

/**
 * A dependency between two units: {@code dependent} is evaluated strictly after {@code prerequisite}.
 */
public record DependencyEdge(Unit dependent, Unit prerequisite) {
    public boolean isSelfEdge() {
        return dependent == prerequisite;
    }

    @Override
    public String toString() {
        return dependent + " -> " + prerequisite;
    }
}
