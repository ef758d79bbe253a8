// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.unit;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;
import scribe.fragment.Expression;
import scribe.fragment.Program;
import scribe.fragment.SourceLocation;
import scribe.fragment.Statement;
import scribe.fragment.interpreter.Builtins;
import scribe.util.condition.ConditionContext;
import scribe.util.condition.UnhandledErrorError;

/**
 * Collects the symbols a unit declares and the names it references, by walking the syntax trees of its fragments.
 * <p>
 * Only names starting with an upper-case letter are considered. A {@code def} or {@code class} at the top level of
 * a fragment declares its name, with the role given by a {@code @producer} or {@code @consumer} decorator; nested
 * ones don't. A name assigned to anywhere, including in loop and comprehension targets, declares a plain symbol. A
 * name read anywhere is a reference.
 * <p>
 * The context value threaded through the visit is the nesting depth: the number of enclosing {@code def},
 * {@code class} and {@code lambda} bodies.
 */
public final class FragmentAnalyzer
    implements Expression.Visitor<@Nullable Void, Integer>, Statement.Visitor<@Nullable Void, Integer> {
    /**
     * Creates an analyzer for the unit with the given source path.
     */
    public FragmentAnalyzer(final Path unitSource) {
        this.unitSource = unitSource;
    }

    /**
     * Walks one fragment of the unit.
     * <p>
     * If a declaration is marked as both a producer and a consumer, a fatal {@link InvalidDeclarationCondition} is
     * signaled.
     */
    public void analyze(final Program program) {
        sourceName = program.sourceName();
        visitAll(program.body(), 0);
    }

    /**
     * Returns the symbols declared by the fragments walked so far, in order of first declaration.
     */
    public Set<Symbol> declaredSymbols() {
        final var result = new LinkedHashSet<Symbol>();
        declarations.forEach((name, role) -> result.add(new Symbol(name, unitSource, role)));
        return Collections.unmodifiableSet(result);
    }

    /**
     * Returns the names referenced by the fragments walked so far, except the unit's own declarations and the
     * built-in names.
     */
    public Set<String> referencedNames() {
        final var result = new LinkedHashSet<>(references);
        result.removeAll(declarations.keySet());
        result.removeAll(Builtins.names());
        return Collections.unmodifiableSet(result);
    }

    static boolean isSymbolCandidate(final String name) {
        return !name.isEmpty() && Character.isUpperCase(name.codePointAt(0));
    }

    @Override
    public @Nullable Void visitLiteral(final Expression.Literal literal, final Integer depth) {
        return null;
    }

    @Override
    public @Nullable Void visitName(final Expression.Name name, final Integer depth) {
        if (isSymbolCandidate(name.identifier())) {
            references.add(name.identifier());
        }
        return null;
    }

    @Override
    public @Nullable Void visitListDisplay(final Expression.ListDisplay display, final Integer depth) {
        visitExpressions(display.elements(), depth);
        return null;
    }

    @Override
    public @Nullable Void visitTupleDisplay(final Expression.TupleDisplay display, final Integer depth) {
        visitExpressions(display.elements(), depth);
        return null;
    }

    @Override
    public @Nullable Void visitDictDisplay(final Expression.DictDisplay display, final Integer depth) {
        visitExpressions(display.keys(), depth);
        visitExpressions(display.values(), depth);
        return null;
    }

    @Override
    public @Nullable Void visitAttribute(final Expression.Attribute attribute, final Integer depth) {
        return attribute.object().accept(this, depth);
    }

    @Override
    public @Nullable Void visitSubscript(final Expression.Subscript subscript, final Integer depth) {
        subscript.object().accept(this, depth);
        return subscript.index().accept(this, depth);
    }

    @Override
    public @Nullable Void visitSlice(final Expression.Slice slice, final Integer depth) {
        visitOptional(slice.lower(), depth);
        visitOptional(slice.upper(), depth);
        return null;
    }

    @Override
    public @Nullable Void visitCall(final Expression.Call call, final Integer depth) {
        call.function().accept(this, depth);
        visitExpressions(call.arguments(), depth);
        for (final var keywordArgument : call.keywordArguments()) {
            keywordArgument.value().accept(this, depth);
        }
        return null;
    }

    @Override
    public @Nullable Void visitUnary(final Expression.Unary unary, final Integer depth) {
        return unary.operand().accept(this, depth);
    }

    @Override
    public @Nullable Void visitBinary(final Expression.Binary binary, final Integer depth) {
        binary.left().accept(this, depth);
        return binary.right().accept(this, depth);
    }

    @Override
    public @Nullable Void visitLogical(final Expression.Logical logical, final Integer depth) {
        logical.left().accept(this, depth);
        return logical.right().accept(this, depth);
    }

    @Override
    public @Nullable Void visitComparison(final Expression.Comparison comparison, final Integer depth) {
        comparison.first().accept(this, depth);
        visitExpressions(comparison.rest(), depth);
        return null;
    }

    @Override
    public @Nullable Void visitConditional(final Expression.Conditional conditional, final Integer depth) {
        conditional.condition().accept(this, depth);
        conditional.whenTrue().accept(this, depth);
        return conditional.whenFalse().accept(this, depth);
    }

    @Override
    public @Nullable Void visitLambda(final Expression.Lambda lambda, final Integer depth) {
        visitDefaults(lambda.parameters(), depth);
        return lambda.body().accept(this, depth + 1);
    }

    @Override
    public @Nullable Void visitListComprehension(
        final Expression.ListComprehension comprehension,
        final Integer depth
    ) {
        for (final var clause : comprehension.clauses()) {
            clause.iterable().accept(this, depth);
            declareTarget(clause.target(), depth);
            visitExpressions(clause.conditions(), depth);
        }
        return comprehension.element().accept(this, depth);
    }

    @Override
    public @Nullable Void visitExpressionStatement(
        final Statement.ExpressionStatement statement,
        final Integer depth
    ) {
        return statement.expression().accept(this, depth);
    }

    @Override
    public @Nullable Void visitAssignment(final Statement.Assignment assignment, final Integer depth) {
        for (final var target : assignment.targets()) {
            declareTarget(target, depth);
        }
        return assignment.value().accept(this, depth);
    }

    @Override
    public @Nullable Void visitAugmentedAssignment(
        final Statement.AugmentedAssignment assignment,
        final Integer depth
    ) {
        declareTarget(assignment.target(), depth);
        return assignment.value().accept(this, depth);
    }

    @Override
    public @Nullable Void visitIf(final Statement.If statement, final Integer depth) {
        for (final var branch : statement.branches()) {
            branch.condition().accept(this, depth);
            visitAll(branch.body(), depth);
        }
        visitAll(statement.orElse(), depth);
        return null;
    }

    @Override
    public @Nullable Void visitFor(final Statement.For statement, final Integer depth) {
        declareTarget(statement.target(), depth);
        statement.iterable().accept(this, depth);
        visitAll(statement.body(), depth);
        visitAll(statement.orElse(), depth);
        return null;
    }

    @Override
    public @Nullable Void visitWhile(final Statement.While statement, final Integer depth) {
        statement.condition().accept(this, depth);
        visitAll(statement.body(), depth);
        visitAll(statement.orElse(), depth);
        return null;
    }

    @Override
    public @Nullable Void visitFunctionDefinition(
        final Statement.FunctionDefinition definition,
        final Integer depth
    ) {
        visitExpressions(definition.decorators(), depth);
        declareDefinition(definition.name(), definition.decorators(), definition.line(), depth);
        visitDefaults(definition.parameters(), depth);
        visitAll(definition.body(), depth + 1);
        return null;
    }

    @Override
    public @Nullable Void visitClassDefinition(final Statement.ClassDefinition definition, final Integer depth) {
        visitExpressions(definition.decorators(), depth);
        declareDefinition(definition.name(), definition.decorators(), definition.line(), depth);
        visitOptional(definition.base(), depth);
        visitAll(definition.body(), depth + 1);
        return null;
    }

    @Override
    public @Nullable Void visitReturn(final Statement.Return statement, final Integer depth) {
        visitOptional(statement.value(), depth);
        return null;
    }

    @Override
    public @Nullable Void visitAssert(final Statement.Assert statement, final Integer depth) {
        statement.condition().accept(this, depth);
        visitOptional(statement.message(), depth);
        return null;
    }

    @Override
    public @Nullable Void visitSimple(final Statement.Simple statement, final Integer depth) {
        return null;
    }

    private void visitAll(final List<Statement> statements, final int depth) {
        for (final var statement : statements) {
            statement.accept(this, depth);
        }
    }

    private void visitExpressions(final List<Expression> expressions, final int depth) {
        for (final var expression : expressions) {
            expression.accept(this, depth);
        }
    }

    private void visitOptional(final @Nullable Expression expression, final int depth) {
        if (expression != null) {
            expression.accept(this, depth);
        }
    }

    private void visitDefaults(final List<Expression.Parameter> parameters, final int depth) {
        for (final var parameter : parameters) {
            visitOptional(parameter.defaultValue(), depth);
        }
    }

    // Names in a target are bound; anything else in it, such as the object of an attribute, is read.
    private void declareTarget(final Expression target, final int depth) {
        if (target instanceof Expression.Name name) {
            if (isSymbolCandidate(name.identifier())) {
                declare(name.identifier(), SymbolRole.PLAIN, name.line());
            }
        } else if (target instanceof Expression.TupleDisplay tuple) {
            tuple.elements().forEach(element -> declareTarget(element, depth));
        } else if (target instanceof Expression.ListDisplay list) {
            list.elements().forEach(element -> declareTarget(element, depth));
        } else {
            target.accept(this, depth);
        }
    }

    private void declareDefinition(
        final String name,
        final List<Expression> decorators,
        final int line,
        final int depth
    ) {
        if (depth != 0 || !isSymbolCandidate(name)) {
            return;
        }
        var isProducer = false;
        var isConsumer = false;
        for (final var decorator : decorators) {
            if (decorator instanceof Expression.Name marker) {
                isProducer |= marker.identifier().equals(producerMarker);
                isConsumer |= marker.identifier().equals(consumerMarker);
            }
        }
        if (isProducer && isConsumer) {
            throw invalidDeclaration(name, line);
        }
        declare(name, isProducer ? SymbolRole.PRODUCER : (isConsumer ? SymbolRole.CONSUMER : SymbolRole.PLAIN), line);
    }

    private void declare(final String name, final SymbolRole role, final int line) {
        final var existing = declarations.get(name);
        if (existing == null || existing == SymbolRole.PLAIN) {
            declarations.put(name, role);
        } else if (role != SymbolRole.PLAIN && role != existing) {
            throw invalidDeclaration(name, line);
        }
    }

    private UnhandledErrorError invalidDeclaration(final String name, final int line) {
        return ConditionContext.error(new InvalidDeclarationCondition(name, new SourceLocation(sourceName, line)));
    }

    static final String producerMarker = "producer";
    static final String consumerMarker = "consumer";

    private final Path unitSource;
    private final LinkedHashMap<String, SymbolRole> declarations = new LinkedHashMap<>();
    private final LinkedHashSet<String> references = new LinkedHashSet<>();
    private String sourceName = "";
}
