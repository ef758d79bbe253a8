// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.fragment.interpreter;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The methods of strings, lists and dicts.
 */
final class BuiltinMethods {
    private BuiltinMethods() {
    }

    /**
     * Returns the named method of the given receiver, bound to that receiver, or {@code null} if the receiver has no
     * such method.
     */
    @SuppressWarnings("unchecked")
    static @Nullable BuiltinFunction lookup(final @Nullable Object receiver, final String name) {
        final Method<?> method;
        if (receiver instanceof String) {
            method = stringMethods.get(name);
        } else if (receiver instanceof List<?>) {
            method = listMethods.get(name);
        } else if (receiver instanceof Map<?, ?>) {
            method = dictMethods.get(name);
        } else {
            method = null;
        }
        if (method == null) {
            return null;
        }
        final var typed = (Method<Object>) method;
        return new BuiltinFunction(name, invocation -> typed.call(receiver, invocation));
    }

    @FunctionalInterface
    private interface Method<T> {
        @Nullable Object call(T receiver, Invocation invocation);
    }

    private static String string(final @Nullable Object value, final String what) {
        if (value instanceof String s) {
            return s;
        }
        throw new EvaluationFailure(what + " must be str, not " + Values.typeName(value));
    }

    private static long integer(final @Nullable Object value, final String what) {
        if (value instanceof Long l) {
            return l;
        }
        throw new EvaluationFailure(what + " must be int, not " + Values.typeName(value));
    }

    private static String strip(final String s, final @Nullable Object characters, final boolean left,
        final boolean right) {
        final var set = (characters == null) ? null : string(characters, "strip argument");
        var start = 0;
        var end = s.length();
        while (left && start < end && isStripped(s.charAt(start), set)) {
            start += 1;
        }
        while (right && end > start && isStripped(s.charAt(end - 1), set)) {
            end -= 1;
        }
        return s.substring(start, end);
    }

    private static boolean isStripped(final char c, final @Nullable String set) {
        return (set == null) ? Character.isWhitespace(c) : (set.indexOf(c) >= 0);
    }

    private static List<@Nullable Object> split(final String s, final @Nullable Object separator, final long limit) {
        final var result = new ArrayList<@Nullable Object>();
        if (separator == null) {
            final var trimmed = s.strip();
            if (trimmed.isEmpty()) {
                return result;
            }
            final var parts = trimmed.split("\\s+", (limit < 0) ? -1 : (int) limit + 1);
            for (final var part : parts) {
                result.add(part);
            }
            return result;
        }
        final var separatorText = string(separator, "separator");
        if (separatorText.isEmpty()) {
            throw new EvaluationFailure("Empty separator");
        }
        final var parts = s.split(Pattern.quote(separatorText), (limit < 0) ? -1 : (int) limit + 1);
        for (final var part : parts) {
            result.add(part);
        }
        return result;
    }

    private static long normalizeIndex(final long index, final int size) {
        return (index < 0) ? index + size : index;
    }

    private static List<@Nullable Object> asList(final Object receiver) {
        @SuppressWarnings("unchecked")
        final var list = (List<@Nullable Object>) receiver;
        return list;
    }

    private static Map<@Nullable Object, @Nullable Object> asMap(final Object receiver) {
        @SuppressWarnings("unchecked")
        final var map = (Map<@Nullable Object, @Nullable Object>) receiver;
        return map;
    }

    private static Comparator<@Nullable Object> ordering(final Invocation invocation, final @Nullable Object key) {
        if (key == null) {
            return Values::compare;
        }
        return (left, right) -> Values.compare(invocation.call(key, left), invocation.call(key, right));
    }

    static void sort(final List<@Nullable Object> list, final Invocation invocation, final @Nullable Object key,
        final boolean reverse) {
        final var comparator = ordering(invocation, key);
        list.sort(reverse ? comparator.reversed() : comparator);
    }

    private static final Map<String, Method<String>> stringMethods = new HashMap<>();

    private static final Map<String, Method<Object>> listMethods = new HashMap<>();

    private static final Map<String, Method<Object>> dictMethods = new HashMap<>();

    static {
        stringMethods.put("upper", (s, invocation) -> {
            invocation.checkArity("upper", 0, 0);
            return s.toUpperCase(Locale.ROOT);
        });
        stringMethods.put("lower", (s, invocation) -> {
            invocation.checkArity("lower", 0, 0);
            return s.toLowerCase(Locale.ROOT);
        });
        stringMethods.put("capitalize", (s, invocation) -> {
            invocation.checkArity("capitalize", 0, 0);
            return s.isEmpty()
                ? s
                : (s.substring(0, 1).toUpperCase(Locale.ROOT) + s.substring(1).toLowerCase(Locale.ROOT));
        });
        stringMethods.put("strip", (s, invocation) -> {
            invocation.checkArity("strip", 0, 1);
            return strip(s, invocation.argument(0, "chars", null), true, true);
        });
        stringMethods.put("lstrip", (s, invocation) -> {
            invocation.checkArity("lstrip", 0, 1);
            return strip(s, invocation.argument(0, "chars", null), true, false);
        });
        stringMethods.put("rstrip", (s, invocation) -> {
            invocation.checkArity("rstrip", 0, 1);
            return strip(s, invocation.argument(0, "chars", null), false, true);
        });
        stringMethods.put("split", (s, invocation) -> {
            invocation.checkArity("split", 0, 2, "sep", "maxsplit");
            final var limit = integer(invocation.argument(1, "maxsplit", -1L), "maxsplit");
            return split(s, invocation.argument(0, "sep", null), limit);
        });
        stringMethods.put("splitlines", (s, invocation) -> {
            invocation.checkArity("splitlines", 0, 0);
            final var result = new ArrayList<@Nullable Object>();
            s.lines().forEach(result::add);
            return result;
        });
        stringMethods.put("join", (s, invocation) -> {
            invocation.checkArity("join", 1, 1);
            final var parts = new ArrayList<String>();
            for (final var element : Values.iterate(invocation.argument(0))) {
                parts.add(string(element, "sequence item"));
            }
            return String.join(s, parts);
        });
        stringMethods.put("replace", (s, invocation) -> {
            invocation.checkArity("replace", 2, 2);
            return s.replace(string(invocation.argument(0), "old"), string(invocation.argument(1), "new"));
        });
        stringMethods.put("startswith", (s, invocation) -> {
            invocation.checkArity("startswith", 1, 1);
            final var prefix = invocation.argument(0);
            if (prefix instanceof Tuple tuple) {
                return tuple.elements().stream().anyMatch(p -> s.startsWith(string(p, "prefix")));
            }
            return s.startsWith(string(prefix, "prefix"));
        });
        stringMethods.put("endswith", (s, invocation) -> {
            invocation.checkArity("endswith", 1, 1);
            final var suffix = invocation.argument(0);
            if (suffix instanceof Tuple tuple) {
                return tuple.elements().stream().anyMatch(p -> s.endsWith(string(p, "suffix")));
            }
            return s.endsWith(string(suffix, "suffix"));
        });
        stringMethods.put("find", (s, invocation) -> {
            invocation.checkArity("find", 1, 1);
            return (long) s.indexOf(string(invocation.argument(0), "substring"));
        });
        stringMethods.put("count", (s, invocation) -> {
            invocation.checkArity("count", 1, 1);
            final var needle = string(invocation.argument(0), "substring");
            if (needle.isEmpty()) {
                return (long) s.length() + 1;
            }
            var count = 0L;
            for (var i = s.indexOf(needle); i >= 0; i = s.indexOf(needle, i + needle.length())) {
                count += 1;
            }
            return count;
        });
        stringMethods.put("format", (s, invocation) ->
            Formatter.format(s, invocation.arguments(), invocation.keywordArguments()));

        listMethods.put("append", (receiver, invocation) -> {
            invocation.checkArity("append", 1, 1);
            asList(receiver).add(invocation.argument(0));
            return null;
        });
        listMethods.put("extend", (receiver, invocation) -> {
            invocation.checkArity("extend", 1, 1);
            asList(receiver).addAll(Values.iterate(invocation.argument(0)));
            return null;
        });
        listMethods.put("insert", (receiver, invocation) -> {
            invocation.checkArity("insert", 2, 2);
            final var list = asList(receiver);
            final var index = normalizeIndex(integer(invocation.argument(0), "index"), list.size());
            list.add((int) Math.max(0, Math.min(index, list.size())), invocation.argument(1));
            return null;
        });
        listMethods.put("pop", (receiver, invocation) -> {
            invocation.checkArity("pop", 0, 1);
            final var list = asList(receiver);
            if (list.isEmpty()) {
                throw new EvaluationFailure("Pop from empty list");
            }
            final var index = normalizeIndex(integer(invocation.argument(0, "index", -1L), "index"), list.size());
            if (index < 0 || index >= list.size()) {
                throw new EvaluationFailure("Pop index out of range");
            }
            return list.remove((int) index);
        });
        listMethods.put("remove", (receiver, invocation) -> {
            invocation.checkArity("remove", 1, 1);
            final var list = asList(receiver);
            for (var i = 0; i < list.size(); i += 1) {
                if (Values.equal(list.get(i), invocation.argument(0))) {
                    list.remove(i);
                    return null;
                }
            }
            throw new EvaluationFailure("list.remove(x): x not in list");
        });
        listMethods.put("index", (receiver, invocation) -> {
            invocation.checkArity("index", 1, 1);
            final var list = asList(receiver);
            for (var i = 0; i < list.size(); i += 1) {
                if (Values.equal(list.get(i), invocation.argument(0))) {
                    return (long) i;
                }
            }
            throw new EvaluationFailure(Values.repr(invocation.argument(0)) + " is not in list");
        });
        listMethods.put("count", (receiver, invocation) -> {
            invocation.checkArity("count", 1, 1);
            return asList(receiver).stream().filter(e -> Values.equal(e, invocation.argument(0))).count();
        });
        listMethods.put("sort", (receiver, invocation) -> {
            invocation.checkArity("sort", 0, 0, "key", "reverse");
            final var reverse = Values.isTruthy(invocation.keywordArguments().get("reverse"));
            sort(asList(receiver), invocation, invocation.keywordArguments().get("key"), reverse);
            return null;
        });

        dictMethods.put("get", (receiver, invocation) -> {
            invocation.checkArity("get", 1, 2);
            final var map = asMap(receiver);
            final var key = Values.dictKey(invocation.argument(0));
            return map.containsKey(key) ? map.get(key) : invocation.argument(1, "default", null);
        });
        dictMethods.put("keys", (receiver, invocation) -> {
            invocation.checkArity("keys", 0, 0);
            return new ArrayList<@Nullable Object>(asMap(receiver).keySet());
        });
        dictMethods.put("values", (receiver, invocation) -> {
            invocation.checkArity("values", 0, 0);
            return new ArrayList<@Nullable Object>(asMap(receiver).values());
        });
        dictMethods.put("items", (receiver, invocation) -> {
            invocation.checkArity("items", 0, 0);
            final var result = new ArrayList<@Nullable Object>();
            asMap(receiver).forEach((key, value) -> result.add(Tuple.of(key, value)));
            return result;
        });
        dictMethods.put("setdefault", (receiver, invocation) -> {
            invocation.checkArity("setdefault", 1, 2);
            final var map = asMap(receiver);
            final var key = Values.dictKey(invocation.argument(0));
            if (!map.containsKey(key)) {
                map.put(key, invocation.argument(1, "default", null));
            }
            return map.get(key);
        });
        dictMethods.put("update", (receiver, invocation) -> {
            invocation.checkArity("update", 0, 1);
            final var map = asMap(receiver);
            if (!invocation.arguments().isEmpty()) {
                final var other = invocation.argument(0);
                if (!(other instanceof Map<?, ?> otherMap)) {
                    throw new EvaluationFailure("dict.update() argument must be a dict, not " + Values.typeName(other));
                }
                map.putAll(otherMap);
            }
            map.putAll(invocation.keywordArguments());
            return null;
        });
        dictMethods.put("pop", (receiver, invocation) -> {
            invocation.checkArity("pop", 1, 2);
            final var map = asMap(receiver);
            final var key = Values.dictKey(invocation.argument(0));
            if (map.containsKey(key)) {
                return map.remove(key);
            } else if (invocation.arguments().size() > 1) {
                return invocation.argument(1);
            }
            throw new EvaluationFailure("Key " + Values.repr(key) + " not found");
        });
        dictMethods.put("copy", (receiver, invocation) -> {
            invocation.checkArity("copy", 0, 0);
            return new LinkedHashMap<@Nullable Object, @Nullable Object>(asMap(receiver));
        });
    }
}
