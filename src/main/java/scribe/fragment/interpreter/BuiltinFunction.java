// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.fragment.interpreter;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A function implemented in Java, either a global built-in or a method of a string, list or dict.
 */
record BuiltinFunction(String name, FragmentCallable body) implements FragmentCallable {
    @Override
    public @Nullable Object call(final Invocation invocation) {
        return body.call(invocation);
    }

    @Override
    public String toString() {
        return "<built-in function " + name + ">";
    }
}
