// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.fragment.interpreter;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Text formatting: brace-delimited replacement fields, as used by {@code str.format} and by line emission, and the
 * older {@code %} operator.
 * <p>
 * A replacement field is {@code {NAME[.ATTR|[KEY]]...[!CONV][:SPEC]}}, where {@code NAME} is an identifier looked up
 * among the named arguments, a number indexing the positional arguments, or empty for the next positional argument.
 * {@code SPEC} is {@code [[FILL]ALIGN][WIDTH][.PRECISION][TYPE]}. Doubled braces stand for literal braces.
 */
final class Formatter {
    private Formatter() {
    }

    static String format(
        final String template,
        final List<@Nullable Object> positional,
        final Map<String, @Nullable Object> named
    ) {
        return format(template, positional, name -> {
            if (!named.containsKey(name)) {
                throw new EvaluationFailure("Unknown name '" + name + "' in format string");
            }
            return named.get(name);
        });
    }

    static String format(final String template, final List<@Nullable Object> positional, final NameLookup named) {
        return new Formatter.State(template, positional, named).run();
    }

    /**
     * Resolves the names used in replacement fields.
     */
    @FunctionalInterface
    interface NameLookup {
        @Nullable Object lookup(String name);
    }

    static String percentFormat(final String template, final List<@Nullable Object> arguments) {
        final var result = new StringBuilder(template.length());
        var next = 0;
        for (var i = 0; i < template.length(); i += 1) {
            final var c = template.charAt(i);
            if (c != '%') {
                result.append(c);
                continue;
            }
            i += 1;
            if (i >= template.length()) {
                throw new EvaluationFailure("Incomplete format");
            }
            final var conversion = template.charAt(i);
            if (conversion == '%') {
                result.append('%');
                continue;
            }
            if (next >= arguments.size()) {
                throw new EvaluationFailure("Not enough arguments for format string");
            }
            final var argument = arguments.get(next);
            next += 1;
            result.append(convert(argument, String.valueOf(conversion)));
        }
        if (next < arguments.size()) {
            throw new EvaluationFailure("Not all arguments converted during string formatting");
        }
        return result.toString();
    }

    private static String convert(final @Nullable Object value, final String type) {
        return switch (type) {
            case "", "s" -> Values.str(value);
            case "r" -> Values.repr(value);
            case "d" -> Long.toString(integer(value));
            case "x" -> hexadecimal(integer(value));
            case "f" -> String.format(Locale.ROOT, "%f", number(value));
            default -> throw new EvaluationFailure("Unknown format code '" + type + "'");
        };
    }

    // Sign and magnitude; -Long.MIN_VALUE wraps to itself, whose unsigned hex is the right magnitude.
    private static String hexadecimal(final long value) {
        return (value < 0) ? ("-" + Long.toHexString(-value)) : Long.toHexString(value);
    }

    private static long integer(final @Nullable Object value) {
        if (value instanceof Long || value instanceof Boolean) {
            return Values.asNumber(value).longValue();
        }
        throw new EvaluationFailure("An integer is required, not '" + Values.typeName(value) + "'");
    }

    private static double number(final @Nullable Object value) {
        if (Values.isNumeric(value)) {
            return Values.asNumber(value).doubleValue();
        }
        throw new EvaluationFailure("A number is required, not '" + Values.typeName(value) + "'");
    }

    private static final class State {
        State(final String template, final List<@Nullable Object> positional, final NameLookup named) {
            this.template = template;
            this.positional = positional;
            this.named = named;
        }

        String run() {
            while (position < template.length()) {
                final var c = template.charAt(position);
                if (c == '{' && peek(1) == '{') {
                    result.append('{');
                    position += 2;
                } else if (c == '}' && peek(1) == '}') {
                    result.append('}');
                    position += 2;
                } else if (c == '{') {
                    position += 1;
                    replacementField();
                } else if (c == '}') {
                    throw new EvaluationFailure("Single '}' encountered in format string");
                } else {
                    result.append(c);
                    position += 1;
                }
            }
            return result.toString();
        }

        private void replacementField() {
            var value = fieldHead();
            while (position < template.length()) {
                final var c = template.charAt(position);
                if (c == '.') {
                    position += 1;
                    value = Values.getAttribute(value, scan(".[!:}"));
                } else if (c == '[') {
                    position += 1;
                    final var key = scan("]");
                    expect(']');
                    value = index(value, key);
                } else {
                    break;
                }
            }
            var conversion = "s";
            if (peek(0) == '!') {
                position += 1;
                conversion = scan(":}");
                if (!conversion.equals("s") && !conversion.equals("r")) {
                    throw new EvaluationFailure("Unknown conversion specifier " + conversion);
                }
            }
            var spec = "";
            if (peek(0) == ':') {
                position += 1;
                spec = scan("}");
            }
            expect('}');
            final var text = conversion.equals("r") ? Values.repr(value) : null;
            result.append(applySpec(value, text, spec));
        }

        private @Nullable Object fieldHead() {
            final var head = scan(".[!:}");
            if (head.isEmpty()) {
                if (usedExplicitIndex) {
                    throw new EvaluationFailure("Cannot switch from manual field numbering to automatic numbering");
                }
                usedAutomaticIndex = true;
                final var index = nextAutomaticIndex;
                nextAutomaticIndex += 1;
                return positionalArgument(index);
            } else if (isDigits(head)) {
                if (usedAutomaticIndex) {
                    throw new EvaluationFailure("Cannot switch from automatic field numbering to manual numbering");
                }
                usedExplicitIndex = true;
                return positionalArgument(decimal(head));
            }
            return named.lookup(head);
        }

        private @Nullable Object positionalArgument(final int index) {
            if (index >= positional.size()) {
                throw new EvaluationFailure("Replacement index " + index + " out of range for positional arguments");
            }
            return positional.get(index);
        }

        private @Nullable Object index(final @Nullable Object value, final String key) {
            if (value instanceof Map<?, ?> map) {
                if (map.containsKey(key)) {
                    return map.get(key);
                }
                final var numericKey = integerKey(key);
                if (numericKey != null && map.containsKey(numericKey)) {
                    return map.get(numericKey);
                }
                throw new EvaluationFailure("Key " + Values.repr(key) + " not found");
            } else if ((value instanceof List<?> || value instanceof Tuple) && isDigits(key)) {
                final var elements = Values.iterate(value);
                final var i = decimal(key);
                if (i >= elements.size()) {
                    throw new EvaluationFailure("Index " + i + " out of range");
                }
                return elements.get(i);
            }
            throw new EvaluationFailure("'" + Values.typeName(value) + "' object is not subscriptable with " + key);
        }

        private static String applySpec(final @Nullable Object value, final @Nullable String converted,
            final String spec) {
            var i = 0;
            var fill = ' ';
            var align = '\0';
            if (spec.length() >= 2 && isAlignment(spec.charAt(1))) {
                fill = spec.charAt(0);
                align = spec.charAt(1);
                i = 2;
            } else if (!spec.isEmpty() && isAlignment(spec.charAt(0))) {
                align = spec.charAt(0);
                i = 1;
            }
            final var widthStart = i;
            while (i < spec.length() && Character.isDigit(spec.charAt(i))) {
                i += 1;
            }
            final var width = (i > widthStart) ? decimal(spec.substring(widthStart, i)) : 0;
            var precision = -1;
            if (i < spec.length() && spec.charAt(i) == '.') {
                final var precisionStart = i + 1;
                i = precisionStart;
                while (i < spec.length() && Character.isDigit(spec.charAt(i))) {
                    i += 1;
                }
                if (i == precisionStart) {
                    throw new EvaluationFailure("Format specifier missing precision");
                }
                precision = decimal(spec.substring(precisionStart, i));
            }
            final var type = spec.substring(i);
            if (type.length() > 1) {
                throw new EvaluationFailure("Invalid format specifier '" + spec + "'");
            }

            final String text;
            if (converted != null) {
                text = converted;
            } else if (type.equals("f") && precision >= 0) {
                text = String.format(Locale.ROOT, "%." + precision + "f", number(value));
            } else if (type.isEmpty() && precision >= 0 && value instanceof String s) {
                text = s.substring(0, Math.min(precision, s.length()));
            } else {
                text = convert(value, type);
            }

            if (text.length() >= width) {
                return text;
            }
            if (align == '\0') {
                align = Values.isNumeric(value) && converted == null ? '>' : '<';
            }
            final var padding = width - text.length();
            final var fillText = String.valueOf(fill);
            return switch (align) {
                case '<' -> text + fillText.repeat(padding);
                case '>' -> fillText.repeat(padding) + text;
                default -> fillText.repeat(padding / 2) + text + fillText.repeat(padding - padding / 2);
            };
        }

        private static boolean isAlignment(final char c) {
            return c == '<' || c == '>' || c == '^';
        }

        private String scan(final String terminators) {
            final var start = position;
            while (position < template.length() && terminators.indexOf(template.charAt(position)) < 0) {
                if (template.charAt(position) == '{') {
                    throw new EvaluationFailure("Unexpected '{' in field name");
                }
                position += 1;
            }
            return template.substring(start, position);
        }

        private void expect(final char c) {
            if (peek(0) != c) {
                throw new EvaluationFailure("Expected '" + c + "' in format string");
            }
            position += 1;
        }

        private char peek(final int offset) {
            final var index = position + offset;
            return (index < template.length()) ? template.charAt(index) : '\0';
        }

        private final String template;
        private final List<@Nullable Object> positional;
        private final NameLookup named;
        private final StringBuilder result = new StringBuilder();
        private int position = 0;
        private int nextAutomaticIndex = 0;
        private boolean usedAutomaticIndex = false;
        private boolean usedExplicitIndex = false;
    }

    private static int decimal(final String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (final NumberFormatException e) {
            throw new EvaluationFailure("Too many decimal digits in format string");
        }
    }

    // Digit strings beyond the range of a long cannot name an integer key.
    private static @Nullable Long integerKey(final String key) {
        if (!isDigits(key)) {
            return null;
        }
        try {
            return Long.parseLong(key);
        } catch (final NumberFormatException e) {
            return null;
        }
    }

    private static boolean isDigits(final String text) {
        return !text.isEmpty() && text.chars().allMatch(c -> c >= '0' && c <= '9');
    }
}
