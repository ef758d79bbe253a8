// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.fragment.interpreter;

import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The arguments of one call of a {@link FragmentCallable}, together with the context the call was made in.
 *
 * @param interpreter       The interpreter making the call.
 * @param callerScope       The innermost scope of the call site.
 * @param arguments         The positional arguments.
 * @param keywordArguments  The keyword arguments, in source order.
 */
public record Invocation(
    Interpreter interpreter,
    Scope callerScope,
    List<@Nullable Object> arguments,
    Map<String, @Nullable Object> keywordArguments
) {
    Invocation withArguments(final List<@Nullable Object> newArguments) {
        return new Invocation(interpreter, callerScope, newArguments, keywordArguments);
    }

    /**
     * Ensures the call has between {@code min} and {@code max} positional arguments and no keyword arguments other
     * than the given ones.
     */
    void checkArity(final String function, final int min, final int max, final String... allowedKeywords) {
        final var count = arguments.size();
        if (count < min || count > max) {
            final var expected = (min == max) ? String.valueOf(min) : (min + " to " + max);
            throw new EvaluationFailure(
                function + "() takes " + expected + " positional argument(s) but " + count + " were given"
            );
        }
        for (final var keyword : keywordArguments.keySet()) {
            if (!List.of(allowedKeywords).contains(keyword)) {
                throw new EvaluationFailure(function + "() got an unexpected keyword argument '" + keyword + "'");
            }
        }
    }

    @Nullable Object argument(final int index) {
        return arguments.get(index);
    }

    /**
     * Retrieves the argument given either at the given position or under the given keyword, or {@code defaultValue}
     * if neither was given.
     */
    @Nullable Object argument(final int index, final String keyword, final @Nullable Object defaultValue) {
        if (index < arguments.size()) {
            if (keywordArguments.containsKey(keyword)) {
                throw new EvaluationFailure("Got multiple values for argument '" + keyword + "'");
            }
            return arguments.get(index);
        }
        return keywordArguments.containsKey(keyword) ? keywordArguments.get(keyword) : defaultValue;
    }

    /**
     * Calls another callable on behalf of the callee.
     */
    @Nullable Object call(final @Nullable Object callee, final @Nullable Object... callArguments) {
        return interpreter.call(callee, Values.listOf(callArguments), Map.of(), callerScope);
    }
}
