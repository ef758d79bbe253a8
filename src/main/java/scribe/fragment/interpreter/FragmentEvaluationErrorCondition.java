// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.fragment.interpreter;

import scribe.fragment.SourceLocation;
import scribe.util.condition.Condition;

/**
 * A condition type indicating that executing a fragment failed: an unknown name, an operation applied to values of
 * the wrong type, a failed assertion and the like.
 */
public final class FragmentEvaluationErrorCondition extends Condition {
    FragmentEvaluationErrorCondition(final String message, final SourceLocation location) {
        super(message);
        this.location = location;
    }

    /**
     * Retrieves the location of the statement that failed.
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
