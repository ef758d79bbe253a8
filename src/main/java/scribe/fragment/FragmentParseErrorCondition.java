// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.fragment;

import scribe.util.condition.Condition;

/**
 * A condition type indicating that a fragment could not be tokenized or parsed.
 */
public final class FragmentParseErrorCondition extends Condition {
    public FragmentParseErrorCondition(final String rawMessage, final SourceLocation location) {
        super(rawMessage);
        this.location = location;
    }

    /**
     * Retrieves where the error was found.
     */
    public SourceLocation location() {
        return location;
    }

    @Override
    public String detailedMessage() {
        return message() + '\n' + location;
    }

    private final SourceLocation location;
}
