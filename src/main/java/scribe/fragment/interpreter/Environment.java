// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.fragment.interpreter;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The global namespace shared by all units of one generator run.
 * <p>
 * A unit publishes the values of the names it declares here once its fragments have run, and every unit evaluated
 * later sees them as globals.
 */
public final class Environment {
    /**
     * Publishes the value of the given global name, replacing any earlier value.
     */
    public void define(final String name, final @Nullable Object value) {
        values.put(name, value);
    }

    /**
     * Checks whether the given global name has been published.
     */
    public boolean contains(final String name) {
        return values.containsKey(name);
    }

    /**
     * Retrieves the value of the given global name, or an empty optional if it hasn't been published. A published
     * {@code None} is also reported as empty; use {@link #contains} to tell the two apart.
     */
    public Optional<Object> lookup(final String name) {
        return Optional.ofNullable(values.get(name));
    }

    @Nullable Object get(final String name) {
        return values.get(name);
    }

    private final Map<String, @Nullable Object> values = new HashMap<>();
}
