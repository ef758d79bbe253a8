// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.fragment.interpreter;

import java.util.LinkedHashMap;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An instance of a class defined in fragment code, with its own mutable attributes.
 */
public final class InstanceValue {
    InstanceValue(final ClassValue type) {
        this.type = type;
    }

    public ClassValue type() {
        return type;
    }

    @Override
    public String toString() {
        return "<" + type.name() + " object>";
    }

    boolean hasField(final String name) {
        return fields.containsKey(name);
    }

    @Nullable Object field(final String name) {
        return fields.get(name);
    }

    void setField(final String name, final @Nullable Object value) {
        fields.put(name, value);
    }

    private final ClassValue type;
    private final LinkedHashMap<String, @Nullable Object> fields = new LinkedHashMap<>();
}
