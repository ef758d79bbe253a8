// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.fragment;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import scribe.util.condition.ConditionContext;
import scribe.util.condition.UnhandledErrorError;

/**
 * Turns fragment source text into tokens, synthesizing NEWLINE, INDENT and DEDENT tokens from line structure.
 * <p>
 * Line breaks inside brackets, and line breaks escaped with a backslash, do not end a logical line. Tabs advance
 * the indentation column to the next multiple of 8.
 */
final class Lexer {
    Lexer(final String source, final String sourceName, final int firstLine) {
        this.source = source.replace("\r\n", "\n");
        this.sourceName = sourceName;
        lineNumber = firstLine;
    }

    List<Token> tokenize() {
        final var length = source.length();
        while (true) {
            if (atLineStart && bracketDepth == 0) {
                if (!startLogicalLine()) {
                    break;
                }
            }
            if (position >= length) {
                break;
            }
            final var ch = source.charAt(position);
            switch (ch) {
                case ' ', '\t', '\f' -> position += 1;
                case '#' -> skipComment();
                case '\n' -> {
                    position += 1;
                    if (bracketDepth == 0) {
                        emitNewline();
                        atLineStart = true;
                    }
                    lineNumber += 1;
                }
                case '\\' -> readContinuation();
                case '"', '\'' -> readString(ch);
                default -> {
                    if (isNameStart(ch)) {
                        readName();
                    } else if (isDigit(ch) || (ch == '.' && isDigit(peekAt(position + 1)))) {
                        readNumber();
                    } else {
                        readOperator();
                    }
                }
            }
        }
        if (bracketDepth != 0) {
            throw signalError("Unexpected end of fragment inside brackets");
        }
        emitNewline();
        while (indentStack.size() > 1) {
            indentStack.remove(indentStack.size() - 1);
            tokens.add(new Token(Token.Kind.DEDENT, "", null, lineNumber));
        }
        tokens.add(new Token(Token.Kind.END, "", null, lineNumber));
        return tokens;
    }

    // Measures indentation of the next non-blank line, emitting INDENT/DEDENT tokens as needed. Returns false at the
    // end of input.
    private boolean startLogicalLine() {
        final var length = source.length();
        while (true) {
            int column = 0;
            while (position < length) {
                final var ch = source.charAt(position);
                if (ch == ' ') {
                    column += 1;
                } else if (ch == '\t') {
                    column = (column / tabWidth + 1) * tabWidth;
                } else if (ch == '\f') {
                    column = 0;
                } else {
                    break;
                }
                position += 1;
            }
            if (position >= length) {
                return false;
            }
            final var ch = source.charAt(position);
            if (ch == '\n') {
                position += 1;
                lineNumber += 1;
                continue;
            }
            if (ch == '#') {
                skipComment();
                continue;
            }
            adjustIndentation(column);
            atLineStart = false;
            return true;
        }
    }

    private void adjustIndentation(final int column) {
        final var current = indentStack.get(indentStack.size() - 1);
        if (column > current) {
            indentStack.add(column);
            tokens.add(new Token(Token.Kind.INDENT, "", null, lineNumber));
            return;
        }
        while (column < indentStack.get(indentStack.size() - 1)) {
            indentStack.remove(indentStack.size() - 1);
            tokens.add(new Token(Token.Kind.DEDENT, "", null, lineNumber));
        }
        if (column != indentStack.get(indentStack.size() - 1)) {
            throw signalError("Unindent does not match any outer indentation level");
        }
    }

    private void emitNewline() {
        if (tokens.isEmpty()) {
            return;
        }
        final var last = tokens.get(tokens.size() - 1).kind();
        if (last != Token.Kind.NEWLINE && last != Token.Kind.INDENT && last != Token.Kind.DEDENT) {
            tokens.add(new Token(Token.Kind.NEWLINE, "", null, lineNumber));
        }
    }

    private void skipComment() {
        final var end = source.indexOf('\n', position);
        position = (end == -1) ? source.length() : end;
    }

    private void readContinuation() {
        if (peekAt(position + 1) != '\n') {
            throw signalError("Unexpected character after line continuation character");
        }
        position += 2;
        lineNumber += 1;
    }

    private void readName() {
        final var start = position;
        while (position < source.length() && isNamePart(source.charAt(position))) {
            position += 1;
        }
        final var text = source.substring(start, position);
        final var kind = keywords.contains(text) ? Token.Kind.KEYWORD : Token.Kind.NAME;
        tokens.add(new Token(kind, text, null, lineNumber));
    }

    private void readNumber() {
        final var start = position;
        var isDecimal = false;
        while (position < source.length()) {
            final var ch = source.charAt(position);
            if (isDigit(ch) || ch == '_') {
                position += 1;
            } else if (ch == '.' && !isDecimal) {
                isDecimal = true;
                position += 1;
            } else if ((ch == 'e' || ch == 'E') && position > start) {
                isDecimal = true;
                position += 1;
                final var sign = peekAt(position);
                if (sign == '+' || sign == '-') {
                    position += 1;
                }
            } else {
                break;
            }
        }
        final var text = source.substring(start, position);
        final var digits = text.replace("_", "");
        try {
            final Object value = isDecimal ? (Object) Double.parseDouble(digits) : (Object) Long.parseLong(digits);
            tokens.add(new Token(isDecimal ? Token.Kind.DECIMAL : Token.Kind.INTEGER, text, value, lineNumber));
        } catch (final NumberFormatException e) {
            throw signalError("Malformed number literal " + text);
        }
    }

    private void readString(final char quote) {
        final var startLine = lineNumber;
        final var triple = peekAt(position + 1) == quote && peekAt(position + 2) == quote;
        position += triple ? 3 : 1;
        final var builder = new StringBuilder();
        while (true) {
            if (position >= source.length()) {
                throw signalError("Unterminated string literal starting in line " + startLine);
            }
            final var ch = source.charAt(position);
            if (ch == quote) {
                if (!triple) {
                    position += 1;
                    break;
                }
                if (peekAt(position + 1) == quote && peekAt(position + 2) == quote) {
                    position += 3;
                    break;
                }
                builder.append(ch);
                position += 1;
            } else if (ch == '\\') {
                readEscape(builder);
            } else if (ch == '\n') {
                if (!triple) {
                    throw signalError("Line break in single-quoted string literal");
                }
                builder.append(ch);
                lineNumber += 1;
                position += 1;
            } else {
                builder.append(ch);
                position += 1;
            }
        }
        final var value = builder.toString();
        tokens.add(new Token(Token.Kind.STRING, value, value, startLine));
    }

    private void readEscape(final StringBuilder builder) {
        final var escaped = peekAt(position + 1);
        position += 2;
        switch (escaped) {
            case 'n' -> builder.append('\n');
            case 't' -> builder.append('\t');
            case 'r' -> builder.append('\r');
            case '0' -> builder.append('\0');
            case '\\', '\'', '"' -> builder.append(escaped);
            case '\n' -> lineNumber += 1;
            default -> {
                // Unknown escapes stay as written.
                builder.append('\\');
                position -= 1;
            }
        }
    }

    private void readOperator() {
        for (final var candidates : operatorsByLength) {
            for (final var operator : candidates) {
                if (source.startsWith(operator, position)) {
                    position += operator.length();
                    trackBrackets(operator);
                    tokens.add(new Token(Token.Kind.OPERATOR, operator, null, lineNumber));
                    return;
                }
            }
        }
        throw signalError("Unexpected character '" + source.charAt(position) + "'");
    }

    private void trackBrackets(final String operator) {
        switch (operator) {
            case "(", "[", "{" -> bracketDepth += 1;
            case ")", "]", "}" -> {
                if (bracketDepth == 0) {
                    throw signalError("Unmatched '" + operator + "'");
                }
                bracketDepth -= 1;
            }
            default -> {
            }
        }
    }

    private char peekAt(final int index) {
        return (index < source.length()) ? source.charAt(index) : '\0';
    }

    private UnhandledErrorError signalError(final String message) {
        throw ConditionContext.error(
            new FragmentParseErrorCondition(message, new SourceLocation(sourceName, lineNumber)));
    }

    private static boolean isNameStart(final char ch) {
        return ch == '_' || Character.isLetter(ch);
    }

    private static boolean isNamePart(final char ch) {
        return ch == '_' || Character.isLetterOrDigit(ch);
    }

    private static boolean isDigit(final char ch) {
        return ch >= '0' && ch <= '9';
    }

    static final Set<String> keywords = Set.of(
        "and", "assert", "break", "class", "continue", "def", "elif", "else", "for", "if", "in", "is", "lambda",
        "not", "or", "pass", "return", "while", "True", "False", "None"
    );
    private static final List<List<String>> operatorsByLength = List.of(
        List.of("**=", "//="),
        List.of("**", "//", "==", "!=", "<=", ">=", "+=", "-=", "*=", "/=", "%="),
        List.of("+", "-", "*", "/", "%", "<", ">", "=", "(", ")", "[", "]", "{", "}", ",", ":", ".", ";", "@")
    );
    private static final int tabWidth = 8;

    private final String source;
    private final String sourceName;
    private final ArrayList<Token> tokens = new ArrayList<>();
    private final ArrayList<Integer> indentStack = new ArrayList<>(List.of(0));
    private int position = 0;
    private int lineNumber;
    private int bracketDepth = 0;
    private boolean atLineStart = true;
}
