// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.graph;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import scribe.unit.Unit;

/**
 * The units of a project and the dependencies between them, direct and channel-derived alike.
 *
 * @param units    The units, in the order they were given.
 * @param edges    The dependencies. Duplicates collapse; self-edges may be present and are ignored by scheduling.
 * @param channels The data channels the channel-derived dependencies came from.
 */
public record DependencyGraph(List<Unit> units, Set<DependencyEdge> edges, List<DataChannel> channels) {
    public DependencyGraph {
        units = List.copyOf(units);
        edges = Collections.unmodifiableSet(new LinkedHashSet<>(edges));
        channels = List.copyOf(channels);
    }

    /**
     * Checks whether {@code dependent} directly depends on {@code prerequisite}.
     */
    public boolean hasEdge(final Unit dependent, final Unit prerequisite) {
        return edges.contains(new DependencyEdge(dependent, prerequisite));
    }
}
