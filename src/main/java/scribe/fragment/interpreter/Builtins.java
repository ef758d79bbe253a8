// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.fragment.interpreter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import org.checkerframework.checker.nullness.qual.Nullable;
import scribe.fragment.Expression.BinaryOperator;
import scribe.fragment.SourceRewriter;

/**
 * The global built-in functions, visible in every fragment unless shadowed.
 */
public final class Builtins {
    private Builtins() {
    }

    /**
     * Returns the names of all built-in functions. These are never treated as references to symbols declared by
     * units.
     */
    public static Set<String> names() {
        return Collections.unmodifiableSet(functions.keySet());
    }

    /**
     * Returns the role marker decorators, {@code producer} and {@code consumer}, keyed by name. At run time they
     * return the decorated function or class unchanged; only the fragment analyzer gives them meaning.
     */
    public static Map<String, Object> roleMarkers() {
        final var result = new LinkedHashMap<String, Object>();
        for (final var name : List.of("producer", "consumer")) {
            result.put(name, new BuiltinFunction(name, invocation -> {
                invocation.checkArity(name, 1, 1);
                return invocation.argument(0);
            }));
        }
        return result;
    }

    static @Nullable BuiltinFunction lookup(final String name) {
        return functions.get(name);
    }

    static boolean isBuiltin(final String name) {
        return functions.containsKey(name);
    }

    private static void define(final String name, final FragmentCallable body) {
        functions.put(name, new BuiltinFunction(name, body));
    }

    private static void defineType(final String name, final Predicate<@Nullable Object> test,
        final FragmentCallable constructor) {
        define(name, constructor);
        typeTests.put(name, test);
    }

    private static boolean isInstance(final @Nullable Object value, final @Nullable Object type) {
        if (type instanceof ClassValue classValue) {
            return value instanceof InstanceValue instance && instance.type().isSubclassOf(classValue);
        } else if (type instanceof BuiltinFunction function && typeTests.containsKey(function.name())) {
            return typeTests.get(function.name()).test(value);
        } else if (type instanceof Tuple tuple) {
            return tuple.elements().stream().anyMatch(element -> isInstance(value, element));
        }
        throw new EvaluationFailure("isinstance() arg 2 must be a type or tuple of types");
    }

    private static long parseInteger(final String text, final int base) {
        try {
            return Long.parseLong(text.strip().replace("_", ""), base);
        } catch (final NumberFormatException e) {
            throw new EvaluationFailure("Invalid literal for int() with base " + base + ": " + Values.repr(text));
        }
    }

    private static double parseDouble(final String text) {
        final var stripped = text.strip().toLowerCase();
        switch (stripped) {
            case "inf", "+inf", "infinity" -> {
                return Double.POSITIVE_INFINITY;
            }
            case "-inf", "-infinity" -> {
                return Double.NEGATIVE_INFINITY;
            }
            case "nan" -> {
                return Double.NaN;
            }
            default -> {
            }
        }
        try {
            return Double.parseDouble(stripped);
        } catch (final NumberFormatException e) {
            throw new EvaluationFailure("Could not convert string to float: " + Values.repr(text));
        }
    }

    private static List<@Nullable Object> range(final Invocation invocation) {
        invocation.checkArity("range", 1, 3);
        final var arguments = new ArrayList<Long>();
        for (final var argument : invocation.arguments()) {
            if (!(argument instanceof Long l)) {
                throw new EvaluationFailure("range() arguments must be int, not " + Values.typeName(argument));
            }
            arguments.add(l);
        }
        final long start = (arguments.size() == 1) ? 0 : arguments.get(0);
        final long stop = (arguments.size() == 1) ? arguments.get(0) : arguments.get(1);
        final long step = (arguments.size() == 3) ? arguments.get(2) : 1;
        if (step == 0) {
            throw new EvaluationFailure("range() step must not be zero");
        }
        final var result = new ArrayList<@Nullable Object>();
        for (var i = start; (step > 0) ? (i < stop) : (i > stop); i += step) {
            result.add(i);
        }
        return result;
    }

    private static @Nullable Object extreme(final Invocation invocation, final String name, final int sign) {
        invocation.checkArity(name, 1, Integer.MAX_VALUE, "key", "default");
        final var candidates = (invocation.arguments().size() == 1)
            ? Values.iterate(invocation.argument(0))
            : new ArrayList<>(invocation.arguments());
        if (candidates.isEmpty()) {
            if (invocation.keywordArguments().containsKey("default")) {
                return invocation.keywordArguments().get("default");
            }
            throw new EvaluationFailure(name + "() arg is an empty sequence");
        }
        final var key = invocation.keywordArguments().get("key");
        var best = candidates.get(0);
        var bestKey = (key == null) ? best : invocation.call(key, best);
        for (final var candidate : candidates.subList(1, candidates.size())) {
            final var candidateKey = (key == null) ? candidate : invocation.call(key, candidate);
            if (Values.compare(candidateKey, bestKey) * sign > 0) {
                best = candidate;
                bestKey = candidateKey;
            }
        }
        return best;
    }

    private static @Nullable Object emit(final Invocation invocation) {
        invocation.checkArity(SourceRewriter.emitFunctionName, 2, 4, "delim", "newline");
        final var sink = invocation.interpreter().lineSink();
        if (sink == null) {
            throw new EvaluationFailure("echo() is only available in template units");
        }
        if (!(invocation.argument(0) instanceof Map<?, ?> bindings)) {
            throw new EvaluationFailure("Malformed line emission");
        }
        final var line = invocation.argument(1);
        final var delimiter = invocation.argument(2, "delim", null);
        if (delimiter != null && !(delimiter instanceof String)) {
            throw new EvaluationFailure("echo() delimiter must be str, not " + Values.typeName(delimiter));
        }
        final var newline = Values.isTruthy(invocation.argument(3, "newline", true));
        final var text = (line instanceof String template)
            ? Formatter.format(template, List.of(), name -> bindings.containsKey(name)
                ? bindings.get(name)
                : invocation.interpreter().lookupName(name, invocation.callerScope()))
            : Values.str(line);
        sink.emit(text, (String) delimiter, newline);
        return null;
    }

    private static final Map<String, BuiltinFunction> functions = new LinkedHashMap<>();
    private static final Map<String, Predicate<@Nullable Object>> typeTests = new LinkedHashMap<>();

    static {
        define("len", invocation -> {
            invocation.checkArity("len", 1, 1);
            return Values.length(invocation.argument(0));
        });
        define("range", Builtins::range);
        defineType("str", value -> value instanceof String, invocation -> {
            invocation.checkArity("str", 0, 1);
            return invocation.arguments().isEmpty() ? "" : Values.str(invocation.argument(0));
        });
        defineType("int", value -> value instanceof Long, invocation -> {
            invocation.checkArity("int", 0, 2);
            if (invocation.arguments().isEmpty()) {
                return 0L;
            }
            final var value = invocation.argument(0);
            if (invocation.arguments().size() == 2) {
                if (!(value instanceof String s) || !(invocation.argument(1) instanceof Long base)) {
                    throw new EvaluationFailure("int() can't convert non-string with explicit base");
                }
                return parseInteger(s, base.intValue());
            } else if (value instanceof String s) {
                return parseInteger(s, 10);
            } else if (value instanceof Double d) {
                if (d.isNaN() || d.isInfinite()) {
                    throw new EvaluationFailure("Cannot convert " + Values.repr(d) + " to integer");
                }
                return (long) d.doubleValue();
            } else if (Values.isNumeric(value)) {
                return Values.asNumber(value).longValue();
            }
            throw new EvaluationFailure("int() argument must be a string or a number, not " + Values.typeName(value));
        });
        defineType("float", value -> value instanceof Double, invocation -> {
            invocation.checkArity("float", 0, 1);
            if (invocation.arguments().isEmpty()) {
                return 0.0;
            }
            final var value = invocation.argument(0);
            if (value instanceof String s) {
                return parseDouble(s);
            } else if (Values.isNumeric(value)) {
                return Values.asNumber(value).doubleValue();
            }
            throw new EvaluationFailure("float() argument must be a string or a number, not " + Values.typeName(value));
        });
        defineType("bool", value -> value instanceof Boolean, invocation -> {
            invocation.checkArity("bool", 0, 1);
            return !invocation.arguments().isEmpty() && Values.isTruthy(invocation.argument(0));
        });
        defineType("list", value -> value instanceof List<?>, invocation -> {
            invocation.checkArity("list", 0, 1);
            return invocation.arguments().isEmpty() ? new ArrayList<>() : Values.iterate(invocation.argument(0));
        });
        defineType("tuple", value -> value instanceof Tuple, invocation -> {
            invocation.checkArity("tuple", 0, 1);
            return invocation.arguments().isEmpty()
                ? new Tuple(List.of())
                : new Tuple(Values.iterate(invocation.argument(0)));
        });
        defineType("dict", value -> value instanceof Map<?, ?>, invocation -> {
            final var names = invocation.keywordArguments().keySet().toArray(new String[0]);
            invocation.checkArity("dict", 0, 1, names);
            final var result = new LinkedHashMap<@Nullable Object, @Nullable Object>();
            if (!invocation.arguments().isEmpty()) {
                final var source = invocation.argument(0);
                if (source instanceof Map<?, ?> map) {
                    result.putAll(map);
                } else {
                    for (final var pair : Values.iterate(source)) {
                        final var elements = Values.iterate(pair);
                        if (elements.size() != 2) {
                            throw new EvaluationFailure("dict() sequence elements must have length 2");
                        }
                        result.put(Values.dictKey(elements.get(0)), elements.get(1));
                    }
                }
            }
            result.putAll(invocation.keywordArguments());
            return result;
        });
        define("sorted", invocation -> {
            invocation.checkArity("sorted", 1, 1, "key", "reverse");
            final var result = Values.iterate(invocation.argument(0));
            final var reverse = Values.isTruthy(invocation.keywordArguments().get("reverse"));
            BuiltinMethods.sort(result, invocation, invocation.keywordArguments().get("key"), reverse);
            return result;
        });
        define("reversed", invocation -> {
            invocation.checkArity("reversed", 1, 1);
            final var result = Values.iterate(invocation.argument(0));
            Collections.reverse(result);
            return result;
        });
        define("enumerate", invocation -> {
            invocation.checkArity("enumerate", 1, 2, "start");
            final var start = invocation.argument(1, "start", 0L);
            if (!(start instanceof Long first)) {
                throw new EvaluationFailure("enumerate() start must be int, not " + Values.typeName(start));
            }
            final var result = new ArrayList<@Nullable Object>();
            var index = first.longValue();
            for (final var element : Values.iterate(invocation.argument(0))) {
                result.add(Tuple.of(index, element));
                index += 1;
            }
            return result;
        });
        define("zip", invocation -> {
            invocation.checkArity("zip", 0, Integer.MAX_VALUE);
            final var sequences = new ArrayList<List<@Nullable Object>>();
            for (final var argument : invocation.arguments()) {
                sequences.add(Values.iterate(argument));
            }
            final var length = sequences.stream().mapToInt(List::size).min().orElse(0);
            final var result = new ArrayList<@Nullable Object>(length);
            for (var i = 0; i < length; i += 1) {
                final var row = new ArrayList<@Nullable Object>(sequences.size());
                for (final var sequence : sequences) {
                    row.add(sequence.get(i));
                }
                result.add(new Tuple(row));
            }
            return result;
        });
        define("min", invocation -> extreme(invocation, "min", -1));
        define("max", invocation -> extreme(invocation, "max", 1));
        define("sum", invocation -> {
            invocation.checkArity("sum", 1, 2, "start");
            var total = invocation.argument(1, "start", 0L);
            for (final var element : Values.iterate(invocation.argument(0))) {
                total = Operators.binary(BinaryOperator.ADD, total, element);
            }
            return total;
        });
        define("any", invocation -> {
            invocation.checkArity("any", 1, 1);
            return Values.iterate(invocation.argument(0)).stream().anyMatch(Values::isTruthy);
        });
        define("all", invocation -> {
            invocation.checkArity("all", 1, 1);
            return Values.iterate(invocation.argument(0)).stream().allMatch(Values::isTruthy);
        });
        define("abs", invocation -> {
            invocation.checkArity("abs", 1, 1);
            final var value = invocation.argument(0);
            if (!Values.isNumeric(value)) {
                throw new EvaluationFailure("Bad operand type for abs(): '" + Values.typeName(value) + "'");
            }
            final var number = Values.asNumber(value);
            if (number instanceof Long l) {
                if (l == Long.MIN_VALUE) {
                    throw new EvaluationFailure("Integer overflow");
                }
                return Math.abs(l);
            }
            return Math.abs(number.doubleValue());
        });
        define("repr", invocation -> {
            invocation.checkArity("repr", 1, 1);
            return Values.repr(invocation.argument(0));
        });
        define("isinstance", invocation -> {
            invocation.checkArity("isinstance", 2, 2);
            return isInstance(invocation.argument(0), invocation.argument(1));
        });
        define("getattr", invocation -> {
            invocation.checkArity("getattr", 2, 3);
            if (!(invocation.argument(1) instanceof String name)) {
                throw new EvaluationFailure("getattr(): attribute name must be string");
            }
            final var object = invocation.argument(0);
            if (invocation.arguments().size() == 3 && !Values.hasAttribute(object, name)) {
                return invocation.argument(2);
            }
            return Values.getAttribute(object, name);
        });
        define("hasattr", invocation -> {
            invocation.checkArity("hasattr", 2, 2);
            if (!(invocation.argument(1) instanceof String name)) {
                throw new EvaluationFailure("hasattr(): attribute name must be string");
            }
            return Values.hasAttribute(invocation.argument(0), name);
        });
        define("setattr", invocation -> {
            invocation.checkArity("setattr", 3, 3);
            if (!(invocation.argument(1) instanceof String name)) {
                throw new EvaluationFailure("setattr(): attribute name must be string");
            }
            Values.setAttribute(invocation.argument(0), name, invocation.argument(2));
            return null;
        });
        define("map", invocation -> {
            invocation.checkArity("map", 2, 2);
            final var function = invocation.argument(0);
            final var result = new ArrayList<@Nullable Object>();
            for (final var element : Values.iterate(invocation.argument(1))) {
                result.add(invocation.call(function, element));
            }
            return result;
        });
        define("filter", invocation -> {
            invocation.checkArity("filter", 2, 2);
            final var function = invocation.argument(0);
            final var result = new ArrayList<@Nullable Object>();
            for (final var element : Values.iterate(invocation.argument(1))) {
                final var test = (function == null) ? element : invocation.call(function, element);
                if (Values.isTruthy(test)) {
                    result.add(element);
                }
            }
            return result;
        });
        define("locals", invocation -> {
            invocation.checkArity("locals", 0, 0);
            return new LinkedHashMap<@Nullable Object, @Nullable Object>(invocation.callerScope().bindings());
        });
        define(SourceRewriter.emitFunctionName, Builtins::emit);
    }
}
