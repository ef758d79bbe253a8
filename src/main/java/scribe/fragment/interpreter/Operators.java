// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.fragment.interpreter;

import java.util.ArrayList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;
import scribe.fragment.Expression.BinaryOperator;
import scribe.fragment.Expression.UnaryOperator;

/**
 * Arithmetic on runtime values. Integer arithmetic is exact: overflow is an error rather than a wraparound.
 */
final class Operators {
    private Operators() {
    }

    static @Nullable Object unary(final UnaryOperator operator, final @Nullable Object operand) {
        if (operator == UnaryOperator.NOT) {
            return !Values.isTruthy(operand);
        }
        if (!Values.isNumeric(operand)) {
            throw new EvaluationFailure(
                "Bad operand type for unary " + operator.symbol() + ": '" + Values.typeName(operand) + "'"
            );
        }
        final var number = Values.asNumber(operand);
        if (operator == UnaryOperator.PLUS) {
            return number;
        }
        return (number instanceof Long l) ? exact(() -> Math.negateExact(l)) : (Object) (-number.doubleValue());
    }

    static @Nullable Object binary(
        final BinaryOperator operator,
        final @Nullable Object left,
        final @Nullable Object right
    ) {
        if (Values.isNumeric(left) && Values.isNumeric(right)) {
            return arithmetic(operator, Values.asNumber(left), Values.asNumber(right));
        }
        switch (operator) {
            case ADD -> {
                if (left instanceof String l && right instanceof String r) {
                    return l + r;
                } else if (left instanceof List<?> l && right instanceof List<?> r) {
                    final var result = new ArrayList<@Nullable Object>(l);
                    result.addAll(r);
                    return result;
                } else if (left instanceof Tuple l && right instanceof Tuple r) {
                    final var result = new ArrayList<@Nullable Object>(l.elements());
                    result.addAll(r.elements());
                    return new Tuple(result);
                }
            }
            case MULTIPLY -> {
                if (right instanceof Long count && (left instanceof String || left instanceof List<?>)) {
                    return repeat(left, count);
                } else if (left instanceof Long count && (right instanceof String || right instanceof List<?>)) {
                    return repeat(right, count);
                }
            }
            case MODULO -> {
                if (left instanceof String template) {
                    final var arguments = (right instanceof Tuple tuple) ? tuple.elements() : Values.listOf(right);
                    return Formatter.percentFormat(template, arguments);
                }
            }
            default -> {
            }
        }
        throw unsupported(operator, left, right);
    }

    private static Object arithmetic(final BinaryOperator operator, final Number left, final Number right) {
        if (left instanceof Long l && right instanceof Long r) {
            return switch (operator) {
                case ADD -> exact(() -> Math.addExact(l, r));
                case SUBTRACT -> exact(() -> Math.subtractExact(l, r));
                case MULTIPLY -> exact(() -> Math.multiplyExact(l, r));
                case DIVIDE -> divide(l.doubleValue(), r.doubleValue());
                case FLOOR_DIVIDE -> floorDivide(l, r);
                case MODULO -> Math.floorMod(l, checkDivisor(r));
                case POWER -> (r >= 0) ? exact(() -> power(l, r)) : (Object) Math.pow(l, r);
            };
        }
        final var l = left.doubleValue();
        final var r = right.doubleValue();
        return switch (operator) {
            case ADD -> l + r;
            case SUBTRACT -> l - r;
            case MULTIPLY -> l * r;
            case DIVIDE -> divide(l, r);
            case FLOOR_DIVIDE -> Math.floor(divide(l, r));
            case MODULO -> l - r * Math.floor(divide(l, r));
            case POWER -> Math.pow(l, r);
        };
    }

    private static double divide(final double left, final double right) {
        if (right == 0.0) {
            throw new EvaluationFailure("Division by zero");
        }
        return left / right;
    }

    private static long checkDivisor(final long divisor) {
        if (divisor == 0) {
            throw new EvaluationFailure("Integer division or modulo by zero");
        }
        return divisor;
    }

    private static long floorDivide(final long dividend, final long divisor) {
        checkDivisor(divisor);
        if (dividend == Long.MIN_VALUE && divisor == -1) {
            throw new EvaluationFailure("Integer overflow");
        }
        return Math.floorDiv(dividend, divisor);
    }

    private static long power(final long base, final long exponent) {
        var result = 1L;
        var factor = base;
        var remaining = exponent;
        while (remaining > 0) {
            if ((remaining & 1) != 0) {
                result = Math.multiplyExact(result, factor);
            }
            remaining >>= 1;
            if (remaining > 0) {
                factor = Math.multiplyExact(factor, factor);
            }
        }
        return result;
    }

    private static Object repeat(final Object sequence, final long count) {
        if (count > Integer.MAX_VALUE) {
            throw new EvaluationFailure("Repetition count too large");
        }
        final var times = (int) Math.max(count, 0);
        if (sequence instanceof String s) {
            return s.repeat(times);
        }
        final var list = (List<?>) sequence;
        final var result = new ArrayList<@Nullable Object>(list.size() * times);
        for (var i = 0; i < times; i += 1) {
            result.addAll(list);
        }
        return result;
    }

    private static Object exact(final ExactOperation operation) {
        try {
            return operation.compute();
        } catch (final ArithmeticException e) {
            throw new EvaluationFailure("Integer overflow");
        }
    }

    private static EvaluationFailure unsupported(
        final BinaryOperator operator,
        final @Nullable Object left,
        final @Nullable Object right
    ) {
        return new EvaluationFailure(
            "Unsupported operand type(s) for " + operator.symbol() + ": '" + Values.typeName(left) + "' and '"
                + Values.typeName(right) + "'"
        );
    }

    @FunctionalInterface
    private interface ExactOperation {
        long compute();
    }
}
