// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.graph;

import java.nio.file.Path;
import scribe.util.condition.Condition;

/**
 * A condition type indicating that a unit references a symbol no unit declares.
 */
public final class UnresolvedSymbolCondition extends Condition {
    UnresolvedSymbolCondition(final String symbolName, final Path referencingUnit) {
        super("Unresolved symbol " + symbolName + " referenced by " + referencingUnit);
        this.symbolName = symbolName;
    }

    public String symbolName() {
        return symbolName;
    }

    private final String symbolName;
}
