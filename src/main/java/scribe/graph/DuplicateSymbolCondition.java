// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.graph;

import java.nio.file.Path;
import scribe.util.condition.Condition;

/**
 * A condition type indicating that two units declare a symbol with the same name.
 */
public final class DuplicateSymbolCondition extends Condition {
    DuplicateSymbolCondition(final String symbolName, final Path firstOwner, final Path secondOwner) {
        super("Symbol " + symbolName + " declared by both " + firstOwner + " and " + secondOwner);
        this.symbolName = symbolName;
    }

    public String symbolName() {
        return symbolName;
    }

    private final String symbolName;
}
