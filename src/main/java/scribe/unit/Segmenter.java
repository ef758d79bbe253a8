// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.unit;

import java.util.ArrayList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;
import scribe.fragment.FragmentParseErrorCondition;
import scribe.fragment.SourceLocation;
import scribe.util.condition.ConditionContext;

/**
 * Splits unit text into literal text and fragment source.
 * <p>
 * Template text is scanned line by line for <code>{{{</code>; once inside a fragment, only <code>}}}</code> is looked
 * for, so the first closing marker always ends the fragment, even one meant as part of a string inside the fragment.
 * Each fragment's source is prefixed with {@code if True:} so it parses as a nested block whatever column it starts
 * in.
 */
public final class Segmenter {
    private Segmenter() {
    }

    /**
     * Splits the text of a template unit.
     *
     * @param text       The complete unit text.
     * @param sourceName The unit's name, used in error messages.
     */
    public static List<Segment> segmentTemplate(final String text, final String sourceName) {
        return new Scanner(sourceName).scan(text);
    }

    /**
     * Wraps the text of a code unit, which is a single fragment in its entirety.
     */
    public static List<Segment> segmentCode(final String text) {
        return List.of(new Segment.Code(text, null, 1, text.isBlank()));
    }

    /**
     * One piece of a unit, before its fragments are parsed.
     */
    public sealed interface Segment {
        record Literal(String content) implements Segment {
        }

        /**
         * Fragment source.
         *
         * @param source       The source text, including the wrapping header in templates.
         * @param indentPrefix The normalized whitespace preceding the opening marker, {@code null} in code units.
         * @param firstLine    The line of the unit the first line of {@code source} corresponds to.
         * @param isEmpty      Whether the fragment contains nothing but whitespace.
         */
        record Code(String source, @Nullable String indentPrefix, int firstLine, boolean isEmpty) implements Segment {
        }
    }

    static final String openMarker = "{{{";
    static final String closeMarker = "}}}";
    static final String fragmentHeader = "if True:\n";
    private static final String markerPadding = " ".repeat(openMarker.length());

    private static final class Scanner {
        Scanner(final String sourceName) {
            this.sourceName = sourceName;
        }

        List<Segment> scan(final String text) {
            var lineNumber = 0;
            var start = 0;
            while (start < text.length()) {
                final var newline = text.indexOf('\n', start);
                final var end = (newline < 0) ? text.length() : (newline + 1);
                lineNumber += 1;
                scanLine(text.substring(start, end), lineNumber);
                start = end;
            }
            if (fragment != null) {
                throw ConditionContext.error(new FragmentParseErrorCondition(
                    "Fragment not terminated with " + closeMarker,
                    new SourceLocation(sourceName, fragmentLine)
                ));
            }
            flushLiteral();
            return segments;
        }

        private void scanLine(final String line, final int lineNumber) {
            var text = line;
            while (!text.isEmpty()) {
                final var currentFragment = fragment;
                if (currentFragment != null) {
                    final var close = text.indexOf(closeMarker);
                    if (close < 0) {
                        if (text.isBlank()) {
                            currentFragment.append(lineTerminator(text));
                        } else {
                            currentFragment.append(text);
                            hasCode = true;
                        }
                        return;
                    }
                    final var beforeClose = text.substring(0, close);
                    if (!beforeClose.isBlank()) {
                        currentFragment.append(beforeClose);
                        hasCode = true;
                    }
                    segments.add(new Segment.Code(
                        currentFragment.toString(),
                        indentPrefix,
                        fragmentLine - 1,
                        !hasCode
                    ));
                    fragment = null;
                    indentPrefix = null;
                    text = text.substring(close + closeMarker.length());
                    continue;
                }

                final var open = text.indexOf(openMarker);
                if (open < 0) {
                    literal.append(text);
                    return;
                }
                final var beforeOpen = text.substring(0, open);
                literal.append(beforeOpen);
                flushLiteral();
                fragmentLine = lineNumber;
                indentPrefix = beforeOpen.replaceAll("[^\t]", " ");
                final var newFragment = new StringBuilder(fragmentHeader);
                fragment = newFragment;
                hasCode = false;
                final var rest = indentPrefix + markerPadding + text.substring(open + openMarker.length());
                if (rest.isBlank()) {
                    newFragment.append(lineTerminator(rest));
                    return;
                }
                text = rest;
            }
        }

        private void flushLiteral() {
            if (literal.length() > 0) {
                segments.add(new Segment.Literal(literal.toString()));
                literal.setLength(0);
            }
        }

        // Keeps line numbering intact for lines that contribute no code.
        private String lineTerminator(final String text) {
            return text.endsWith("\n") ? "\n" : "";
        }

        private final String sourceName;
        private final List<Segment> segments = new ArrayList<>();
        private final StringBuilder literal = new StringBuilder();
        private @Nullable StringBuilder fragment = null;
        private @Nullable String indentPrefix = null;
        private int fragmentLine = 0;
        private boolean hasCode = false;
    }
}
