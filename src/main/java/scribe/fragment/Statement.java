// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.fragment;

import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Statement nodes of the fragment syntax tree.
 */
public sealed interface Statement {
    int line();

    <R, C> R accept(Visitor<R, C> visitor, C context);

    record ExpressionStatement(Expression expression, int line) implements Statement {
        @Override
        public <R, C> R accept(final Visitor<R, C> visitor, final C context) {
            return visitor.visitExpressionStatement(this, context);
        }
    }

    /**
     * {@code t1 = t2 = ... = value}; every target receives the same value.
     */
    record Assignment(List<Expression> targets, Expression value, int line) implements Statement {
        @Override
        public <R, C> R accept(final Visitor<R, C> visitor, final C context) {
            return visitor.visitAssignment(this, context);
        }
    }

    record AugmentedAssignment(Expression target, Expression.BinaryOperator operator, Expression value, int line)
        implements Statement {
        @Override
        public <R, C> R accept(final Visitor<R, C> visitor, final C context) {
            return visitor.visitAugmentedAssignment(this, context);
        }
    }

    /**
     * {@code if}/{@code elif} branches tried in order, then {@code orElse}.
     */
    record If(List<Branch> branches, List<Statement> orElse, int line) implements Statement {
        @Override
        public <R, C> R accept(final Visitor<R, C> visitor, final C context) {
            return visitor.visitIf(this, context);
        }
    }

    record For(Expression target, Expression iterable, List<Statement> body, List<Statement> orElse, int line)
        implements Statement {
        @Override
        public <R, C> R accept(final Visitor<R, C> visitor, final C context) {
            return visitor.visitFor(this, context);
        }
    }

    record While(Expression condition, List<Statement> body, List<Statement> orElse, int line)
        implements Statement {
        @Override
        public <R, C> R accept(final Visitor<R, C> visitor, final C context) {
            return visitor.visitWhile(this, context);
        }
    }

    record FunctionDefinition(
        String name,
        List<Expression.Parameter> parameters,
        List<Statement> body,
        List<Expression> decorators,
        int line
    ) implements Statement {
        @Override
        public <R, C> R accept(final Visitor<R, C> visitor, final C context) {
            return visitor.visitFunctionDefinition(this, context);
        }
    }

    record ClassDefinition(
        String name,
        @Nullable Expression base,
        List<Statement> body,
        List<Expression> decorators,
        int line
    ) implements Statement {
        @Override
        public <R, C> R accept(final Visitor<R, C> visitor, final C context) {
            return visitor.visitClassDefinition(this, context);
        }
    }

    record Return(@Nullable Expression value, int line) implements Statement {
        @Override
        public <R, C> R accept(final Visitor<R, C> visitor, final C context) {
            return visitor.visitReturn(this, context);
        }
    }

    record Assert(Expression condition, @Nullable Expression message, int line) implements Statement {
        @Override
        public <R, C> R accept(final Visitor<R, C> visitor, final C context) {
            return visitor.visitAssert(this, context);
        }
    }

    /**
     * {@code pass}, {@code break} or {@code continue}.
     */
    record Simple(Kind kind, int line) implements Statement {
        @Override
        public <R, C> R accept(final Visitor<R, C> visitor, final C context) {
            return visitor.visitSimple(this, context);
        }

        public enum Kind {
            PASS,
            BREAK,
            CONTINUE,
        }
    }

    record Branch(Expression condition, List<Statement> body) {
    }

    /**
     * A visitor over statements, with a caller-defined context value threaded through every visit.
     */
    interface Visitor<R, C> {
        R visitExpressionStatement(ExpressionStatement statement, C context);

        R visitAssignment(Assignment assignment, C context);

        R visitAugmentedAssignment(AugmentedAssignment assignment, C context);

        R visitIf(If statement, C context);

        R visitFor(For statement, C context);

        R visitWhile(While statement, C context);

        R visitFunctionDefinition(FunctionDefinition definition, C context);

        R visitClassDefinition(ClassDefinition definition, C context);

        R visitReturn(Return statement, C context);

        R visitAssert(Assert statement, C context);

        R visitSimple(Simple statement, C context);
    }
}
