// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.graph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import scribe.fragment.interpreter.Builtins;
import scribe.unit.Unit;
import scribe.util.Trace;
import scribe.util.condition.ConditionContext;

/**
 * Derives the dependencies between units from the symbols they declare and reference.
 * <p>
 * A unit referencing a symbol depends on the unit declaring it. Additionally, for every unit declaring producer or
 * consumer symbols, each unit referencing one of its consumer symbols depends on each unit referencing one of its
 * producer symbols. This lets any number of units contribute to a registry and others drain it afterwards, without
 * contributors and drainers knowing about each other.
 */
public final class DependencyGraphBuilder {
    private DependencyGraphBuilder() {
    }

    /**
     * Builds the dependency graph of the given units.
     * <p>
     * Fatal {@link DuplicateSymbolCondition}s and {@link UnresolvedSymbolCondition}s are signaled for conflicting
     * declarations and dangling references.
     */
    public static DependencyGraph build(final List<Unit> units) {
        final var symbols = ProjectSymbolTable.build(units);
        try (final var trace = new Trace("Building the dependency graph")) {
            trace.use();
            final var edges = new LinkedHashSet<DependencyEdge>();
            final var channels = new LinkedHashMap<Unit, DataChannel>();
            for (final var unit : units) {
                for (final var name : unit.referencedNames()) {
                    if (unit.declares(name) || Builtins.names().contains(name)) {
                        continue;
                    }
                    final var symbol = symbols.lookup(name);
                    if (symbol == null) {
                        throw ConditionContext.error(new UnresolvedSymbolCondition(name, unit.source()));
                    }
                    final var owner = symbols.owner(symbol);
                    edges.add(new DependencyEdge(unit, owner));
                    switch (symbol.role()) {
                        case PRODUCER -> channels.computeIfAbsent(owner, DataChannel::new).addProducer(unit);
                        case CONSUMER -> channels.computeIfAbsent(owner, DataChannel::new).addConsumer(unit);
                        case PLAIN -> {
                        }
                    }
                }
            }
            for (final var channel : channels.values()) {
                for (final var consumer : channel.consumers()) {
                    for (final var producer : channel.producers()) {
                        edges.add(new DependencyEdge(consumer, producer));
                    }
                }
            }
            return new DependencyGraph(units, edges, new ArrayList<>(channels.values()));
        }
    }
}
