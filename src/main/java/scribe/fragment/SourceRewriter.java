// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.fragment;

import java.util.List;
import java.util.regex.Pattern;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;

/**
 * The two textual conveniences applied to fragment source before it is parsed.
 * <ul>
 * <li>{@code for X in EXPR if COND:} becomes {@code for X in [(X) for X in EXPR if COND]:}, iterating only over the
 * elements satisfying the condition.
 * <li>A line ending in {@code echo(ARGS)} becomes {@code __emit__(locals(), ARGS)}, a call of the hidden line
 * emission primitive receiving the local bindings of the call site.
 * </ul>
 * Both work line by line on plain text, and neither looks inside string literals.
 */
public final class SourceRewriter {
    private SourceRewriter() {
    }

    /**
     * Returns the given fragment source with both rewrites applied.
     */
    @CheckReturnValue
    public static String rewrite(final String source) {
        var result = source;
        for (final var rule : rules) {
            result = rule.pattern.matcher(result).replaceAll(rule.replacement);
        }
        return result;
    }

    /**
     * The name of the hidden line emission primitive.
     */
    public static final String emitFunctionName = "__emit__";

    private static final List<Rule> rules = List.of(
        new Rule(
            "^(\\s*)for\\s+([^\\s:]+)\\s+in\\s+([^:]+)\\s+if\\s+([^:]+):",
            "$1for $2 in [($2) for $2 in $3 if $4]:"
        ),
        new Rule(
            "(^|\\W)echo\\s*\\((.*)\\)([ \\t]*)$",
            "$1" + emitFunctionName + "(locals(), $2)$3"
        )
    );

    private record Rule(Pattern pattern, String replacement) {
        private Rule(final String regex, final String replacement) {
            this(Pattern.compile(regex, Pattern.MULTILINE), replacement);
        }
    }
}
