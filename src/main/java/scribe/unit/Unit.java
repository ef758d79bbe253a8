// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.unit;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * One loaded source file of a project.
 * <p>
 * A template unit has a target path and produces output; a code unit has none and runs only for its effect on the
 * shared environment. Units are immutable, and compare by identity.
 */
public final class Unit {
    /**
     * Creates a unit.
     *
     * @param source          The source path, which identifies the unit.
     * @param target          The target path, or {@code null} for a code unit.
     * @param blocks          The blocks, in source order.
     * @param declaredSymbols The symbols declared by the unit's fragments.
     * @param referencedNames The names read by the unit's fragments, other than its own declarations and built-ins.
     */
    public Unit(
        final Path source,
        final @Nullable Path target,
        final List<Block> blocks,
        final Set<Symbol> declaredSymbols,
        final Set<String> referencedNames
    ) {
        this.source = source;
        this.target = target;
        this.blocks = List.copyOf(blocks);
        this.declaredSymbols = Collections.unmodifiableSet(new LinkedHashSet<>(declaredSymbols));
        this.referencedNames = Collections.unmodifiableSet(new LinkedHashSet<>(referencedNames));
    }

    public Path source() {
        return source;
    }

    public @Nullable Path target() {
        return target;
    }

    public boolean isTemplate() {
        return target != null;
    }

    public List<Block> blocks() {
        return blocks;
    }

    public Set<Symbol> declaredSymbols() {
        return declaredSymbols;
    }

    public Set<String> referencedNames() {
        return referencedNames;
    }

    /**
     * Checks whether this unit declares a symbol with the given name.
     */
    public boolean declares(final String name) {
        return declaredSymbols.stream().anyMatch(symbol -> symbol.name().equals(name));
    }

    @Override
    public String toString() {
        return source.toString();
    }

    private final Path source;
    private final @Nullable Path target;
    private final List<Block> blocks;
    private final Set<Symbol> declaredSymbols;
    private final Set<String> referencedNames;
}
