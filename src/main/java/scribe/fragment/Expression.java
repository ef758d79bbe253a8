// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.fragment;

import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Expression nodes of the fragment syntax tree.
 * <p>
 * Syntax tree nodes are immutable. Every node records the source line it starts in.
 */
public sealed interface Expression {
    int line();

    <R, C> R accept(Visitor<R, C> visitor, C context);

    /**
     * A literal: {@code None}, a boolean, a {@code long}, a {@code double} or a string.
     */
    record Literal(@Nullable Object value, int line) implements Expression {
        @Override
        public <R, C> R accept(final Visitor<R, C> visitor, final C context) {
            return visitor.visitLiteral(this, context);
        }
    }

    record Name(String identifier, int line) implements Expression {
        @Override
        public <R, C> R accept(final Visitor<R, C> visitor, final C context) {
            return visitor.visitName(this, context);
        }
    }

    record ListDisplay(List<Expression> elements, int line) implements Expression {
        @Override
        public <R, C> R accept(final Visitor<R, C> visitor, final C context) {
            return visitor.visitListDisplay(this, context);
        }
    }

    record TupleDisplay(List<Expression> elements, int line) implements Expression {
        @Override
        public <R, C> R accept(final Visitor<R, C> visitor, final C context) {
            return visitor.visitTupleDisplay(this, context);
        }
    }

    record DictDisplay(List<Expression> keys, List<Expression> values, int line) implements Expression {
        @Override
        public <R, C> R accept(final Visitor<R, C> visitor, final C context) {
            return visitor.visitDictDisplay(this, context);
        }
    }

    record Attribute(Expression object, String name, int line) implements Expression {
        @Override
        public <R, C> R accept(final Visitor<R, C> visitor, final C context) {
            return visitor.visitAttribute(this, context);
        }
    }

    record Subscript(Expression object, Expression index, int line) implements Expression {
        @Override
        public <R, C> R accept(final Visitor<R, C> visitor, final C context) {
            return visitor.visitSubscript(this, context);
        }
    }

    /**
     * A slice, only valid as the index of a {@link Subscript}.
     */
    record Slice(@Nullable Expression lower, @Nullable Expression upper, int line) implements Expression {
        @Override
        public <R, C> R accept(final Visitor<R, C> visitor, final C context) {
            return visitor.visitSlice(this, context);
        }
    }

    record Call(
        Expression function,
        List<Expression> arguments,
        List<KeywordArgument> keywordArguments,
        int line
    ) implements Expression {
        @Override
        public <R, C> R accept(final Visitor<R, C> visitor, final C context) {
            return visitor.visitCall(this, context);
        }
    }

    record Unary(UnaryOperator operator, Expression operand, int line) implements Expression {
        @Override
        public <R, C> R accept(final Visitor<R, C> visitor, final C context) {
            return visitor.visitUnary(this, context);
        }
    }

    record Binary(BinaryOperator operator, Expression left, Expression right, int line) implements Expression {
        @Override
        public <R, C> R accept(final Visitor<R, C> visitor, final C context) {
            return visitor.visitBinary(this, context);
        }
    }

    /**
     * Short-circuiting {@code and} / {@code or}.
     */
    record Logical(boolean isAnd, Expression left, Expression right, int line) implements Expression {
        @Override
        public <R, C> R accept(final Visitor<R, C> visitor, final C context) {
            return visitor.visitLogical(this, context);
        }
    }

    /**
     * A possibly chained comparison: {@code first op[0] rest[0] op[1] rest[1] ...}.
     */
    record Comparison(
        Expression first,
        List<ComparisonOperator> operators,
        List<Expression> rest,
        int line
    ) implements Expression {
        @Override
        public <R, C> R accept(final Visitor<R, C> visitor, final C context) {
            return visitor.visitComparison(this, context);
        }
    }

    record Conditional(Expression condition, Expression whenTrue, Expression whenFalse, int line)
        implements Expression {
        @Override
        public <R, C> R accept(final Visitor<R, C> visitor, final C context) {
            return visitor.visitConditional(this, context);
        }
    }

    record Lambda(List<Parameter> parameters, Expression body, int line) implements Expression {
        @Override
        public <R, C> R accept(final Visitor<R, C> visitor, final C context) {
            return visitor.visitLambda(this, context);
        }
    }

    record ListComprehension(Expression element, List<Comprehension> clauses, int line) implements Expression {
        @Override
        public <R, C> R accept(final Visitor<R, C> visitor, final C context) {
            return visitor.visitListComprehension(this, context);
        }
    }

    record KeywordArgument(String name, Expression value) {
    }

    /**
     * One {@code for TARGET in ITERABLE if CONDITION...} clause of a comprehension.
     */
    record Comprehension(Expression target, Expression iterable, List<Expression> conditions) {
    }

    /**
     * A function or lambda parameter, with an optional default value evaluated at definition time.
     */
    record Parameter(String name, @Nullable Expression defaultValue) {
    }

    enum UnaryOperator {
        NEGATE("-"),
        PLUS("+"),
        NOT("not");

        UnaryOperator(final String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        private final String symbol;
    }

    enum BinaryOperator {
        ADD("+"),
        SUBTRACT("-"),
        MULTIPLY("*"),
        DIVIDE("/"),
        FLOOR_DIVIDE("//"),
        MODULO("%"),
        POWER("**");

        BinaryOperator(final String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        static @Nullable BinaryOperator fromAugmentedAssignment(final String operator) {
            for (final var value : values()) {
                if (operator.equals(value.symbol + "=")) {
                    return value;
                }
            }
            return null;
        }

        private final String symbol;
    }

    enum ComparisonOperator {
        LESS("<"),
        GREATER(">"),
        LESS_OR_EQUAL("<="),
        GREATER_OR_EQUAL(">="),
        EQUAL("=="),
        NOT_EQUAL("!="),
        IN("in"),
        NOT_IN("not in"),
        IS("is"),
        IS_NOT("is not");

        ComparisonOperator(final String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        private final String symbol;
    }

    /**
     * A visitor over expressions, with a caller-defined context value threaded through every visit.
     */
    interface Visitor<R, C> {
        R visitLiteral(Literal literal, C context);

        R visitName(Name name, C context);

        R visitListDisplay(ListDisplay display, C context);

        R visitTupleDisplay(TupleDisplay display, C context);

        R visitDictDisplay(DictDisplay display, C context);

        R visitAttribute(Attribute attribute, C context);

        R visitSubscript(Subscript subscript, C context);

        R visitSlice(Slice slice, C context);

        R visitCall(Call call, C context);

        R visitUnary(Unary unary, C context);

        R visitBinary(Binary binary, C context);

        R visitLogical(Logical logical, C context);

        R visitComparison(Comparison comparison, C context);

        R visitConditional(Conditional conditional, C context);

        R visitLambda(Lambda lambda, C context);

        R visitListComprehension(ListComprehension comprehension, C context);
    }
}
