// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.fragment;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A lexical token of the fragment language.
 * <p>
 * For names, keywords and operators {@code text} is the token itself; literal tokens carry their decoded value in
 * {@code value}.
 */
record Token(Kind kind, String text, @Nullable Object value, int line) {
    boolean is(final Kind expectedKind, final String expectedText) {
        return kind == expectedKind && text.equals(expectedText);
    }

    boolean isOperator(final String operator) {
        return is(Kind.OPERATOR, operator);
    }

    boolean isKeyword(final String keyword) {
        return is(Kind.KEYWORD, keyword);
    }

    String describe() {
        return switch (kind) {
            case NEWLINE -> "end of line";
            case INDENT -> "indentation";
            case DEDENT -> "dedentation";
            case END -> "end of fragment";
            case STRING -> "string literal";
            default -> "'" + text + "'";
        };
    }

    enum Kind {
        NAME,
        KEYWORD,
        OPERATOR,
        INTEGER,
        DECIMAL,
        STRING,
        NEWLINE,
        INDENT,
        DEDENT,
        END,
    }
}
