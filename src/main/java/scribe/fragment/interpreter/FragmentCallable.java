// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.fragment.interpreter;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A runtime value that can be called from fragment code.
 */
@FunctionalInterface
public interface FragmentCallable {
    @Nullable Object call(Invocation invocation);
}
