// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.fragment.interpreter;

/**
 * Thrown by runtime helpers that know what went wrong but not where; the interpreter turns it into a
 * {@link FragmentEvaluationErrorCondition} carrying the line of the statement being executed.
 */
final class EvaluationFailure extends RuntimeException {
    EvaluationFailure(final String message) {
        super(message, null, false, false);
    }
}
