// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.graph;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeSet;
import scribe.unit.Unit;
import scribe.util.Trace;
import scribe.util.condition.ConditionContext;

/**
 * Orders units so that every unit comes after all of its prerequisites.
 * <p>
 * This is Kahn's algorithm keyed on the number of prerequisites not yet scheduled. Among units ready at the same
 * time, the one given first goes first, so the order is deterministic.
 */
public final class Scheduler {
    private Scheduler(final DependencyGraph graph) {
        this.graph = graph;
        for (var i = 0; i < graph.units().size(); i += 1) {
            final var unit = graph.units().get(i);
            inputOrder.put(unit, i);
            remainingPrerequisites.put(unit, 0);
            dependents.put(unit, new ArrayList<>());
            prerequisites.put(unit, new ArrayList<>());
        }
        for (final var edge : graph.edges()) {
            if (edge.isSelfEdge()) {
                continue;
            }
            remainingPrerequisites.merge(edge.dependent(), 1, Integer::sum);
            dependents.get(edge.prerequisite()).add(edge.dependent());
            prerequisites.get(edge.dependent()).add(edge.prerequisite());
        }
    }

    /**
     * Computes the evaluation order of the units of the given graph.
     * <p>
     * If the dependencies are cyclic, a fatal {@link CyclicDependencyCondition} is signaled, listing a cycle reached
     * from every unit that couldn't be scheduled.
     */
    public static List<Unit> schedule(final DependencyGraph graph) {
        try (final var trace = new Trace("Scheduling unit evaluation")) {
            trace.use();
            return new Scheduler(graph).run();
        }
    }

    private List<Unit> run() {
        final var ready = new PriorityQueue<Unit>(Comparator.comparing(inputOrder::get));
        for (final var unit : graph.units()) {
            if (remainingPrerequisites.get(unit) == 0) {
                ready.add(unit);
            }
        }
        final var order = new ArrayList<Unit>(graph.units().size());
        while (!ready.isEmpty()) {
            final var unit = ready.remove();
            order.add(unit);
            for (final var dependent : dependents.get(unit)) {
                final var remaining = remainingPrerequisites.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(dependent);
                }
            }
        }
        if (order.size() != graph.units().size()) {
            final var unscheduled = new HashSet<>(graph.units());
            order.forEach(unscheduled::remove);
            throw ConditionContext.error(new CyclicDependencyCondition(findCycles(unscheduled)));
        }
        return order;
    }

    // Every unscheduled unit has an unscheduled prerequisite, so following them always ends up in a cycle.
    private List<String> findCycles(final Set<Unit> unscheduled) {
        final var byPath = Comparator.comparing((Unit unit) -> unit.source().toString());
        final var cycles = new TreeSet<String>();
        for (final var start : unscheduled) {
            final var path = new ArrayList<Unit>();
            var current = start;
            while (!path.contains(current)) {
                path.add(current);
                current = prerequisites.get(current).stream()
                    .filter(unscheduled::contains)
                    .min(byPath)
                    .orElseThrow();
            }
            cycles.add(render(path.subList(path.indexOf(current), path.size())));
        }
        return new ArrayList<>(cycles);
    }

    private static String render(final List<Unit> cycle) {
        var first = 0;
        for (var i = 1; i < cycle.size(); i += 1) {
            if (cycle.get(i).source().toString().compareTo(cycle.get(first).source().toString()) < 0) {
                first = i;
            }
        }
        final var builder = new StringBuilder();
        for (var i = 0; i < cycle.size(); i += 1) {
            builder.append(cycle.get((first + i) % cycle.size())).append(" → ");
        }
        return builder.append(cycle.get(first)).toString();
    }

    private final DependencyGraph graph;
    private final Map<Unit, Integer> inputOrder = new HashMap<>();
    private final Map<Unit, Integer> remainingPrerequisites = new HashMap<>();
    private final Map<Unit, List<Unit>> dependents = new HashMap<>();
    private final Map<Unit, List<Unit>> prerequisites = new HashMap<>();
}
