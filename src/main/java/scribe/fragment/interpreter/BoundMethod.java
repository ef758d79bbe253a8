// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.fragment.interpreter;

import java.util.ArrayList;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A function retrieved through an instance, with the instance bound as its first argument.
 */
record BoundMethod(InstanceValue self, FunctionValue function) implements FragmentCallable {
    @Override
    public @Nullable Object call(final Invocation invocation) {
        final var arguments = new ArrayList<@Nullable Object>(invocation.arguments().size() + 1);
        arguments.add(self);
        arguments.addAll(invocation.arguments());
        return function.call(invocation.withArguments(arguments));
    }

    @Override
    public String toString() {
        return "<bound method " + function.name() + " of " + self + ">";
    }
}
