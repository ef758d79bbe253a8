// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.unit;

import scribe.fragment.SourceLocation;
import scribe.util.condition.Condition;

/**
 * A condition type indicating that a symbol was declared with contradictory roles, i.e. as both a producer and a
 * consumer.
 */
public final class InvalidDeclarationCondition extends Condition {
    InvalidDeclarationCondition(final String symbolName, final SourceLocation location) {
        super("Symbol " + symbolName + " cannot be both a producer and a consumer");
        this.symbolName = symbolName;
        this.location = location;
    }

    public String symbolName() {
        return symbolName;
    }

    @Override
    public String detailedMessage() {
        return message() + '\n' + location;
    }

    private final String symbolName;
    private final SourceLocation location;
}
