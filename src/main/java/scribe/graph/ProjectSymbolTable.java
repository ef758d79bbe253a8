// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.graph;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;
import scribe.unit.Symbol;
import scribe.unit.Unit;
import scribe.util.Trace;
import scribe.util.condition.ConditionContext;

/**
 * The symbols of all units of a project, by name.
 */
public final class ProjectSymbolTable {
    private ProjectSymbolTable() {
    }

    /**
     * Aggregates the symbols declared by the given units.
     * <p>
     * If two units declare the same name, a fatal {@link DuplicateSymbolCondition} is signaled, whether or not the
     * name is referenced anywhere.
     */
    public static ProjectSymbolTable build(final List<Unit> units) {
        try (final var trace = new Trace("Building the project symbol table")) {
            trace.use();
            final var table = new ProjectSymbolTable();
            for (final var unit : units) {
                for (final var symbol : unit.declaredSymbols()) {
                    table.add(unit, symbol);
                }
            }
            return table;
        }
    }

    /**
     * Looks up the symbol with the given name, returning {@code null} if no unit declares it.
     */
    public @Nullable Symbol lookup(final String name) {
        final var entry = entries.get(name);
        return (entry == null) ? null : entry.symbol;
    }

    /**
     * Retrieves the unit that declares the given symbol.
     */
    public Unit owner(final Symbol symbol) {
        final var entry = entries.get(symbol.name());
        if (entry == null || !entry.symbol.equals(symbol)) {
            throw new IllegalArgumentException("Symbol " + symbol.name() + " is not in the table");
        }
        return entry.owner;
    }

    private void add(final Unit unit, final Symbol symbol) {
        final var existing = entries.putIfAbsent(symbol.name(), new Entry(unit, symbol));
        if (existing != null) {
            throw ConditionContext.error(
                new DuplicateSymbolCondition(symbol.name(), existing.owner.source(), unit.source())
            );
        }
    }

    private final Map<String, Entry> entries = new HashMap<>();

    private record Entry(Unit owner, Symbol symbol) {
    }
}
