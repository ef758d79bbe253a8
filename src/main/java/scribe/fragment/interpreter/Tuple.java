// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.fragment.interpreter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An immutable sequence value.
 */
public record Tuple(List<@Nullable Object> elements) {
    public Tuple {
        elements = Collections.unmodifiableList(new ArrayList<>(elements));
    }

    public static Tuple of(final @Nullable Object... elements) {
        final var list = new ArrayList<@Nullable Object>(elements.length);
        Collections.addAll(list, elements);
        return new Tuple(list);
    }

    @Override
    public String toString() {
        return Values.repr(this);
    }
}
