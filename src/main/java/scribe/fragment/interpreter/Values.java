// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.fragment.interpreter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Operations every runtime value supports: truth testing, conversion to text, equality, ordering, iteration and
 * attribute access.
 */
public final class Values {
    private Values() {
    }

    /**
     * Checks whether the given value counts as true in a boolean context.
     */
    public static boolean isTruthy(final @Nullable Object value) {
        if (value == null) {
            return false;
        } else if (value instanceof Boolean b) {
            return b;
        } else if (value instanceof Long l) {
            return l != 0;
        } else if (value instanceof Double d) {
            return d != 0.0;
        } else if (value instanceof String s) {
            return !s.isEmpty();
        } else if (value instanceof List<?> list) {
            return !list.isEmpty();
        } else if (value instanceof Tuple tuple) {
            return !tuple.elements().isEmpty();
        } else if (value instanceof Map<?, ?> map) {
            return !map.isEmpty();
        }
        return true;
    }

    /**
     * Returns the user-facing type name of the given value, as used in error messages.
     */
    public static String typeName(final @Nullable Object value) {
        if (value == null) {
            return "NoneType";
        } else if (value instanceof Boolean) {
            return "bool";
        } else if (value instanceof Long) {
            return "int";
        } else if (value instanceof Double) {
            return "float";
        } else if (value instanceof String) {
            return "str";
        } else if (value instanceof List<?>) {
            return "list";
        } else if (value instanceof Tuple) {
            return "tuple";
        } else if (value instanceof Map<?, ?>) {
            return "dict";
        } else if (value instanceof FunctionValue) {
            return "function";
        } else if (value instanceof ClassValue) {
            return "type";
        } else if (value instanceof InstanceValue instance) {
            return instance.type().name();
        } else if (value instanceof BoundMethod) {
            return "method";
        }
        return "builtin_function_or_method";
    }

    /**
     * Converts the given value to text the way {@code str()} does: strings are used as-is, everything else is
     * {@linkplain #repr represented}.
     */
    public static String str(final @Nullable Object value) {
        return (value instanceof String s) ? s : repr(value);
    }

    /**
     * Converts the given value to its source-like textual representation, with strings quoted.
     */
    public static String repr(final @Nullable Object value) {
        return repr(value, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    // A list or dict already being represented further out shows up as [...] or {...}.
    private static String repr(final @Nullable Object value, final Set<Object> enclosing) {
        if (value == null) {
            return "None";
        } else if (value instanceof Boolean b) {
            return b ? "True" : "False";
        } else if (value instanceof Double d) {
            return formatDouble(d);
        } else if (value instanceof String s) {
            return quote(s);
        } else if (value instanceof List<?> list) {
            if (!enclosing.add(list)) {
                return "[...]";
            }
            final var text = joinRepr(list, "[", "]", enclosing);
            enclosing.remove(list);
            return text;
        } else if (value instanceof Tuple tuple) {
            final var elements = tuple.elements();
            return (elements.size() == 1)
                ? ("(" + repr(elements.get(0), enclosing) + ",)")
                : joinRepr(elements, "(", ")", enclosing);
        } else if (value instanceof Map<?, ?> map) {
            if (!enclosing.add(map)) {
                return "{...}";
            }
            final var builder = new StringBuilder("{");
            var first = true;
            for (final var entry : map.entrySet()) {
                if (!first) {
                    builder.append(", ");
                }
                first = false;
                builder.append(repr(entry.getKey(), enclosing)).append(": ").append(repr(entry.getValue(), enclosing));
            }
            enclosing.remove(map);
            return builder.append('}').toString();
        }
        return value.toString();
    }

    /**
     * Returns the given value if it may serve as a dict key. Lists and dicts, and tuples containing them, are
     * rejected: mutating them after insertion would change their hash and lose the entry.
     */
    static @Nullable Object dictKey(final @Nullable Object key) {
        if (key instanceof List<?> || key instanceof Map<?, ?>) {
            throw new EvaluationFailure("Unhashable type: '" + typeName(key) + "'");
        } else if (key instanceof Tuple tuple) {
            tuple.elements().forEach(Values::dictKey);
        }
        return key;
    }

    /**
     * Compares two values for equality. Integers and floats compare by numeric value, lists and tuples element by
     * element.
     */
    public static boolean equal(final @Nullable Object left, final @Nullable Object right) {
        if (left == right) {
            return true;
        } else if (left == null || right == null) {
            return false;
        } else if (isNumeric(left) && isNumeric(right)) {
            final var l = asNumber(left);
            final var r = asNumber(right);
            return (l instanceof Long a && r instanceof Long b) ? a.equals(b) : (l.doubleValue() == r.doubleValue());
        } else if (left instanceof List<?> l && right instanceof List<?> r) {
            return sequenceEqual(l, r);
        } else if (left instanceof Tuple l && right instanceof Tuple r) {
            return sequenceEqual(l.elements(), r.elements());
        }
        return left.equals(right);
    }

    /**
     * Orders two values: numbers numerically, strings lexicographically, and lists and tuples element by element.
     */
    static int compare(final @Nullable Object left, final @Nullable Object right) {
        if (left != null && right != null) {
            if (isNumeric(left) && isNumeric(right)) {
                final var l = asNumber(left);
                final var r = asNumber(right);
                return (l instanceof Long a && r instanceof Long b)
                    ? Long.compare(a, b)
                    : Double.compare(l.doubleValue(), r.doubleValue());
            } else if (left instanceof String l && right instanceof String r) {
                return l.compareTo(r);
            } else if (left instanceof List<?> l && right instanceof List<?> r) {
                return compareSequences(l, r);
            } else if (left instanceof Tuple l && right instanceof Tuple r) {
                return compareSequences(l.elements(), r.elements());
            }
        }
        throw new EvaluationFailure(
            "Ordering not supported between instances of '" + typeName(left) + "' and '" + typeName(right) + "'"
        );
    }

    /**
     * Returns the elements of the given iterable value as a fresh list: the elements of a list or tuple, the
     * characters of a string, or the keys of a dict.
     */
    static List<@Nullable Object> iterate(final @Nullable Object value) {
        if (value instanceof List<?> list) {
            return new ArrayList<>(list);
        } else if (value instanceof Tuple tuple) {
            return new ArrayList<>(tuple.elements());
        } else if (value instanceof String s) {
            final var result = new ArrayList<@Nullable Object>(s.length());
            s.codePoints().forEach(codePoint -> result.add(Character.toString(codePoint)));
            return result;
        } else if (value instanceof Map<?, ?> map) {
            return new ArrayList<>(map.keySet());
        }
        throw new EvaluationFailure("'" + typeName(value) + "' object is not iterable");
    }

    static boolean contains(final @Nullable Object container, final @Nullable Object element) {
        if (container instanceof String s) {
            if (element instanceof String e) {
                return s.contains(e);
            }
            throw new EvaluationFailure("'in <string>' requires string as left operand, not " + typeName(element));
        } else if (container instanceof Map<?, ?> map) {
            return map.containsKey(dictKey(element));
        } else if (container instanceof List<?> || container instanceof Tuple) {
            for (final var candidate : iterate(container)) {
                if (equal(candidate, element)) {
                    return true;
                }
            }
            return false;
        }
        throw new EvaluationFailure("Argument of type '" + typeName(container) + "' is not iterable");
    }

    static long length(final @Nullable Object value) {
        if (value instanceof String s) {
            return s.codePointCount(0, s.length());
        } else if (value instanceof List<?> list) {
            return list.size();
        } else if (value instanceof Tuple tuple) {
            return tuple.elements().size();
        } else if (value instanceof Map<?, ?> map) {
            return map.size();
        }
        throw new EvaluationFailure("Object of type '" + typeName(value) + "' has no len()");
    }

    /**
     * Checks whether the given value takes part in arithmetic: integers, floats and booleans.
     */
    static boolean isNumeric(final @Nullable Object value) {
        return value instanceof Long || value instanceof Double || value instanceof Boolean;
    }

    /**
     * Converts a {@linkplain #isNumeric numeric} value to a {@code Long} or {@code Double}.
     */
    static Number asNumber(final Object value) {
        if (value instanceof Boolean b) {
            return b ? 1L : 0L;
        }
        return (Number) value;
    }

    static boolean hasAttribute(final @Nullable Object object, final String name) {
        if (object instanceof InstanceValue instance) {
            return instance.hasField(name) || instance.type().definingClass(name) != null;
        } else if (object instanceof ClassValue type) {
            return name.equals(nameAttribute) || type.definingClass(name) != null;
        } else if (object instanceof FunctionValue) {
            return name.equals(nameAttribute);
        }
        return BuiltinMethods.lookup(object, name) != null;
    }

    /**
     * Retrieves an attribute of the given value. Functions found in the class of an instance are returned as methods
     * bound to that instance.
     */
    static @Nullable Object getAttribute(final @Nullable Object object, final String name) {
        if (object instanceof InstanceValue instance) {
            if (instance.hasField(name)) {
                return instance.field(name);
            }
            final var owner = instance.type().definingClass(name);
            if (owner != null) {
                final var value = owner.ownAttribute(name);
                return (value instanceof FunctionValue function) ? new BoundMethod(instance, function) : value;
            }
        } else if (object instanceof ClassValue type) {
            if (name.equals(nameAttribute)) {
                return type.name();
            }
            final var owner = type.definingClass(name);
            if (owner != null) {
                return owner.ownAttribute(name);
            }
        } else if (object instanceof FunctionValue function) {
            if (name.equals(nameAttribute)) {
                return function.name();
            }
        } else {
            final var method = BuiltinMethods.lookup(object, name);
            if (method != null) {
                return method;
            }
        }
        throw new EvaluationFailure("'" + typeName(object) + "' object has no attribute '" + name + "'");
    }

    static void setAttribute(final @Nullable Object object, final String name, final @Nullable Object value) {
        if (object instanceof InstanceValue instance) {
            instance.setField(name, value);
        } else if (object instanceof ClassValue type) {
            type.setAttribute(name, value);
        } else {
            throw new EvaluationFailure("Cannot set attribute '" + name + "' of '" + typeName(object) + "' object");
        }
    }

    static List<@Nullable Object> listOf(final @Nullable Object... elements) {
        final var result = new ArrayList<@Nullable Object>(elements.length);
        Collections.addAll(result, elements);
        return result;
    }

    static String formatDouble(final double value) {
        if (Double.isNaN(value)) {
            return "nan";
        } else if (Double.isInfinite(value)) {
            return (value > 0) ? "inf" : "-inf";
        } else if (value == Math.rint(value) && Math.abs(value) < 1e16) {
            return ((value == 0.0 && 1 / value < 0) ? "-" : "") + (long) value + ".0";
        }
        return Double.toString(value);
    }

    private static String quote(final String string) {
        final var delimiter = (string.indexOf('\'') >= 0 && string.indexOf('"') < 0) ? '"' : '\'';
        final var builder = new StringBuilder(string.length() + 2).append(delimiter);
        for (var i = 0; i < string.length(); i += 1) {
            final var c = string.charAt(i);
            switch (c) {
                case '\\' -> builder.append("\\\\");
                case '\n' -> builder.append("\\n");
                case '\t' -> builder.append("\\t");
                case '\r' -> builder.append("\\r");
                default -> {
                    if (c == delimiter) {
                        builder.append('\\');
                    }
                    builder.append(c);
                }
            }
        }
        return builder.append(delimiter).toString();
    }

    private static String joinRepr(
        final List<?> elements,
        final String open,
        final String close,
        final Set<Object> enclosing
    ) {
        final var builder = new StringBuilder(open);
        for (var i = 0; i < elements.size(); i += 1) {
            if (i > 0) {
                builder.append(", ");
            }
            builder.append(repr(elements.get(i), enclosing));
        }
        return builder.append(close).toString();
    }

    private static boolean sequenceEqual(final List<?> left, final List<?> right) {
        if (left.size() != right.size()) {
            return false;
        }
        for (var i = 0; i < left.size(); i += 1) {
            if (!equal(left.get(i), right.get(i))) {
                return false;
            }
        }
        return true;
    }

    private static int compareSequences(final List<?> left, final List<?> right) {
        final var common = Math.min(left.size(), right.size());
        for (var i = 0; i < common; i += 1) {
            if (!equal(left.get(i), right.get(i))) {
                return compare(left.get(i), right.get(i));
            }
        }
        return Integer.compare(left.size(), right.size());
    }

    private static final String nameAttribute = "__name__";
}
