// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.fragment.interpreter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A mutable set of local bindings, chained to the scope it is nested in.
 * <p>
 * Lookups walk the chain outwards; bindings are always created in the scope they're made in.
 */
public final class Scope {
    /**
     * Creates a new outermost scope.
     */
    public Scope() {
        this(null, false);
    }

    private Scope(final @Nullable Scope parent, final boolean isClassBody) {
        this.parent = parent;
        this.isClassBody = isClassBody;
    }

    /**
     * Creates a new scope nested in this one.
     */
    public Scope child() {
        return new Scope(this, false);
    }

    Scope classBody() {
        return new Scope(this, true);
    }

    /**
     * Returns the scope functions defined in this scope close over. Class bodies are skipped, so that methods don't
     * see the other attributes of their class as plain names.
     */
    Scope closureScope() {
        return (isClassBody && parent != null) ? parent.closureScope() : this;
    }

    /**
     * Binds the given name in this scope, shadowing any binding of the same name in the outer scopes.
     */
    public void bind(final String name, final @Nullable Object value) {
        bindings.put(name, value);
    }

    /**
     * Checks whether the given name is bound in this scope itself, without consulting the outer scopes.
     */
    public boolean isBoundLocally(final String name) {
        return bindings.containsKey(name);
    }

    /**
     * Finds the innermost scope, starting from this one, that binds the given name, or {@code null} if there's none.
     */
    @Nullable Scope findBinding(final String name) {
        for (var scope = this; scope != null; scope = scope.parent) {
            if (scope.bindings.containsKey(name)) {
                return scope;
            }
        }
        return null;
    }

    /**
     * Retrieves the value bound to the given name in this scope itself.
     */
    public @Nullable Object getLocal(final String name) {
        return bindings.get(name);
    }

    /**
     * Returns an unmodifiable view of the bindings made in this scope itself, in the order they were first made.
     */
    public Map<String, @Nullable Object> bindings() {
        return Collections.unmodifiableMap(bindings);
    }

    private final @Nullable Scope parent;
    private final boolean isClassBody;
    private final LinkedHashMap<String, @Nullable Object> bindings = new LinkedHashMap<>();
}
