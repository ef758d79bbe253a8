// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.fragment.interpreter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A class defined in fragment code. Calling it creates an {@link InstanceValue} and runs its {@code __init__}
 * method, if any.
 */
public final class ClassValue implements FragmentCallable {
    ClassValue(final String name, final @Nullable ClassValue base, final Map<String, @Nullable Object> attributes) {
        this.name = name;
        this.base = base;
        this.attributes = new LinkedHashMap<>(attributes);
    }

    public String name() {
        return name;
    }

    @Override
    public @Nullable Object call(final Invocation invocation) {
        final var instance = new InstanceValue(this);
        final var owner = definingClass(initializerName);
        if (owner != null && owner.attributes.get(initializerName) instanceof FunctionValue initializer) {
            final var arguments = new ArrayList<@Nullable Object>(invocation.arguments().size() + 1);
            arguments.add(instance);
            arguments.addAll(invocation.arguments());
            initializer.call(invocation.withArguments(arguments));
        } else if (!invocation.arguments().isEmpty() || !invocation.keywordArguments().isEmpty()) {
            throw new EvaluationFailure(name + "() takes no arguments");
        }
        return instance;
    }

    @Override
    public String toString() {
        return "<class '" + name + "'>";
    }

    /**
     * Finds the class, starting from this one and walking the base classes, that defines the given attribute.
     */
    @Nullable ClassValue definingClass(final String attribute) {
        for (var type = this; type != null; type = type.base) {
            if (type.attributes.containsKey(attribute)) {
                return type;
            }
        }
        return null;
    }

    @Nullable Object ownAttribute(final String attribute) {
        return attributes.get(attribute);
    }

    void setAttribute(final String attribute, final @Nullable Object value) {
        attributes.put(attribute, value);
    }

    boolean isSubclassOf(final ClassValue other) {
        for (var type = this; type != null; type = type.base) {
            if (type == other) {
                return true;
            }
        }
        return false;
    }

    private static final String initializerName = "__init__";

    private final String name;
    private final @Nullable ClassValue base;
    private final LinkedHashMap<String, @Nullable Object> attributes;
}
