// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.graph;

import java.util.List;
import scribe.util.condition.Condition;

/**
 * A condition type indicating that units depend on each other in a cycle, so no evaluation order exists.
 */
public final class CyclicDependencyCondition extends Condition {
    CyclicDependencyCondition(final List<String> cycles) {
        super("Cyclic dependencies between units");
        this.cycles = List.copyOf(cycles);
    }

    /**
     * Retrieves the rendered cycles, such as {@code a.hy → b.hy → a.hy}, sorted.
     */
    public List<String> cycles() {
        return cycles;
    }

    @Override
    public String detailedMessage() {
        final var builder = new StringBuilder(message()).append(':');
        for (final var cycle : cycles) {
            builder.append("\n  ").append(cycle);
        }
        return builder.toString();
    }

    private final List<String> cycles;
}
