// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.fragment.interpreter;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;
import scribe.fragment.Expression;
import scribe.fragment.Program;
import scribe.fragment.SourceLocation;
import scribe.fragment.Statement;
import scribe.util.condition.ConditionContext;
import scribe.util.condition.UnhandledErrorError;

/**
 * A tree-walking interpreter executing fragment programs.
 * <p>
 * Names are resolved by walking the chain of local scopes outwards, then consulting the shared {@link Environment},
 * then the {@linkplain Builtins built-in functions}. Every runtime error is signaled as a fatal
 * {@link FragmentEvaluationErrorCondition} pointing at the statement that failed.
 */
public final class Interpreter
    implements Expression.Visitor<@Nullable Object, Scope>, Statement.Visitor<Completion, Scope> {
    public Interpreter(final Environment environment) {
        this.environment = environment;
    }

    /**
     * Returns the sink receiving emitted lines, or {@code null} if line emission is currently unavailable.
     */
    public @Nullable LineSink lineSink() {
        return lineSink;
    }

    /**
     * Sets the sink receiving the lines emitted by the fragments executed from now on. {@code null} makes line
     * emission an error.
     */
    public void setLineSink(final @Nullable LineSink lineSink) {
        this.lineSink = lineSink;
    }

    /**
     * Executes the given program in the given scope. Bindings made at the top level of the program are made in that
     * scope.
     */
    public void execute(final Program program, final Scope scope) {
        final var previousSource = sourceName;
        sourceName = program.sourceName();
        try {
            final var completion = executeBlock(program.body(), scope);
            if (!completion.isNormal()) {
                throw misplaced(completion);
            }
        } finally {
            sourceName = previousSource;
        }
    }

    /**
     * Calls the given callable value with the given arguments.
     */
    @Nullable Object call(
        final @Nullable Object callee,
        final List<@Nullable Object> arguments,
        final Map<String, @Nullable Object> keywordArguments,
        final Scope callerScope
    ) {
        if (!(callee instanceof FragmentCallable callable)) {
            throw new EvaluationFailure("'" + Values.typeName(callee) + "' object is not callable");
        }
        if (callDepth >= maxCallDepth) {
            throw new EvaluationFailure("Maximum call depth exceeded");
        }
        callDepth += 1;
        try {
            return callable.call(new Invocation(this, callerScope, arguments, keywordArguments));
        } finally {
            callDepth -= 1;
        }
    }

    @Nullable Object invokeFunction(final FunctionValue function, final Scope scope) {
        final var previousSource = sourceName;
        sourceName = function.sourceName();
        try {
            final var body = function.body();
            if (body instanceof FunctionValue.Body.Single single) {
                return evaluate(single.expression(), scope);
            }
            final var completion = executeBlock(((FunctionValue.Body.Block) body).statements(), scope);
            return switch (completion.kind()) {
                case NORMAL -> null;
                case RETURN -> completion.value();
                case BREAK, CONTINUE -> throw misplaced(completion);
            };
        } finally {
            sourceName = previousSource;
        }
    }

    /**
     * Resolves a name as seen from the given scope.
     */
    @Nullable Object lookupName(final String name, final Scope scope) {
        final var owner = scope.findBinding(name);
        if (owner != null) {
            return owner.getLocal(name);
        } else if (environment.contains(name)) {
            return environment.get(name);
        }
        final var builtin = Builtins.lookup(name);
        if (builtin == null) {
            throw new EvaluationFailure("Name '" + name + "' is not defined");
        }
        return builtin;
    }

    @Override
    public @Nullable Object visitLiteral(final Expression.Literal literal, final Scope scope) {
        return literal.value();
    }

    @Override
    public @Nullable Object visitName(final Expression.Name name, final Scope scope) {
        return lookupName(name.identifier(), scope);
    }

    @Override
    public @Nullable Object visitListDisplay(final Expression.ListDisplay display, final Scope scope) {
        return evaluateAll(display.elements(), scope);
    }

    @Override
    public @Nullable Object visitTupleDisplay(final Expression.TupleDisplay display, final Scope scope) {
        return new Tuple(evaluateAll(display.elements(), scope));
    }

    @Override
    public @Nullable Object visitDictDisplay(final Expression.DictDisplay display, final Scope scope) {
        final var result = new LinkedHashMap<@Nullable Object, @Nullable Object>();
        for (var i = 0; i < display.keys().size(); i += 1) {
            final var key = evaluate(display.keys().get(i), scope);
            result.put(Values.dictKey(key), evaluate(display.values().get(i), scope));
        }
        return result;
    }

    @Override
    public @Nullable Object visitAttribute(final Expression.Attribute attribute, final Scope scope) {
        return Values.getAttribute(evaluate(attribute.object(), scope), attribute.name());
    }

    @Override
    public @Nullable Object visitSubscript(final Expression.Subscript subscript, final Scope scope) {
        final var object = evaluate(subscript.object(), scope);
        if (subscript.index() instanceof Expression.Slice slice) {
            return slice(object, evaluateOptional(slice.lower(), scope), evaluateOptional(slice.upper(), scope));
        }
        return index(object, evaluate(subscript.index(), scope));
    }

    @Override
    public @Nullable Object visitSlice(final Expression.Slice slice, final Scope scope) {
        throw new EvaluationFailure("Slices are only valid as subscripts");
    }

    @Override
    public @Nullable Object visitCall(final Expression.Call call, final Scope scope) {
        final var function = evaluate(call.function(), scope);
        final var arguments = evaluateAll(call.arguments(), scope);
        final var keywordArguments = new LinkedHashMap<String, @Nullable Object>();
        for (final var keywordArgument : call.keywordArguments()) {
            if (keywordArguments.containsKey(keywordArgument.name())) {
                throw new EvaluationFailure("Keyword argument repeated: " + keywordArgument.name());
            }
            keywordArguments.put(keywordArgument.name(), evaluate(keywordArgument.value(), scope));
        }
        return call(function, arguments, keywordArguments, scope);
    }

    @Override
    public @Nullable Object visitUnary(final Expression.Unary unary, final Scope scope) {
        return Operators.unary(unary.operator(), evaluate(unary.operand(), scope));
    }

    @Override
    public @Nullable Object visitBinary(final Expression.Binary binary, final Scope scope) {
        final var left = evaluate(binary.left(), scope);
        final var right = evaluate(binary.right(), scope);
        return Operators.binary(binary.operator(), left, right);
    }

    @Override
    public @Nullable Object visitLogical(final Expression.Logical logical, final Scope scope) {
        final var left = evaluate(logical.left(), scope);
        if (Values.isTruthy(left) != logical.isAnd()) {
            return left;
        }
        return evaluate(logical.right(), scope);
    }

    @Override
    public @Nullable Object visitComparison(final Expression.Comparison comparison, final Scope scope) {
        var left = evaluate(comparison.first(), scope);
        for (var i = 0; i < comparison.operators().size(); i += 1) {
            final var right = evaluate(comparison.rest().get(i), scope);
            if (!compare(comparison.operators().get(i), left, right)) {
                return false;
            }
            left = right;
        }
        return true;
    }

    @Override
    public @Nullable Object visitConditional(final Expression.Conditional conditional, final Scope scope) {
        return Values.isTruthy(evaluate(conditional.condition(), scope))
            ? evaluate(conditional.whenTrue(), scope)
            : evaluate(conditional.whenFalse(), scope);
    }

    @Override
    public @Nullable Object visitLambda(final Expression.Lambda lambda, final Scope scope) {
        return new FunctionValue(
            "<lambda>",
            lambda.parameters(),
            evaluateDefaults(lambda.parameters(), scope),
            new FunctionValue.Body.Single(lambda.body()),
            scope.closureScope(),
            sourceName
        );
    }

    @Override
    public @Nullable Object visitListComprehension(
        final Expression.ListComprehension comprehension,
        final Scope scope
    ) {
        final var result = new ArrayList<@Nullable Object>();
        generate(comprehension, 0, scope.child(), result);
        return result;
    }

    @Override
    public Completion visitExpressionStatement(final Statement.ExpressionStatement statement, final Scope scope) {
        evaluate(statement.expression(), scope);
        return Completion.normal;
    }

    @Override
    public Completion visitAssignment(final Statement.Assignment assignment, final Scope scope) {
        final var value = evaluate(assignment.value(), scope);
        for (final var target : assignment.targets()) {
            assign(target, value, scope);
        }
        return Completion.normal;
    }

    @Override
    public Completion visitAugmentedAssignment(final Statement.AugmentedAssignment assignment, final Scope scope) {
        final var target = assignment.target();
        final var operator = assignment.operator();
        if (target instanceof Expression.Name name) {
            final var current = lookupName(name.identifier(), scope);
            scope.bind(name.identifier(), combine(operator, current, evaluate(assignment.value(), scope)));
        } else if (target instanceof Expression.Attribute attribute) {
            final var object = evaluate(attribute.object(), scope);
            final var current = Values.getAttribute(object, attribute.name());
            final var result = combine(operator, current, evaluate(assignment.value(), scope));
            Values.setAttribute(object, attribute.name(), result);
        } else if (target instanceof Expression.Subscript subscript
            && !(subscript.index() instanceof Expression.Slice)) {
            final var object = evaluate(subscript.object(), scope);
            final var key = evaluate(subscript.index(), scope);
            final var current = index(object, key);
            storeIndex(object, key, combine(operator, current, evaluate(assignment.value(), scope)));
        } else {
            throw new EvaluationFailure("Illegal target for augmented assignment");
        }
        return Completion.normal;
    }

    @Override
    public Completion visitIf(final Statement.If statement, final Scope scope) {
        for (final var branch : statement.branches()) {
            if (Values.isTruthy(evaluate(branch.condition(), scope))) {
                return executeBlock(branch.body(), scope);
            }
        }
        return executeBlock(statement.orElse(), scope);
    }

    @Override
    public Completion visitFor(final Statement.For statement, final Scope scope) {
        for (final var element : Values.iterate(evaluate(statement.iterable(), scope))) {
            assign(statement.target(), element, scope);
            final var completion = executeBlock(statement.body(), scope);
            switch (completion.kind()) {
                case BREAK -> {
                    return Completion.normal;
                }
                case RETURN -> {
                    return completion;
                }
                default -> {
                }
            }
        }
        return executeBlock(statement.orElse(), scope);
    }

    @Override
    public Completion visitWhile(final Statement.While statement, final Scope scope) {
        while (Values.isTruthy(evaluate(statement.condition(), scope))) {
            final var completion = executeBlock(statement.body(), scope);
            switch (completion.kind()) {
                case BREAK -> {
                    return Completion.normal;
                }
                case RETURN -> {
                    return completion;
                }
                default -> {
                }
            }
        }
        return executeBlock(statement.orElse(), scope);
    }

    @Override
    public Completion visitFunctionDefinition(final Statement.FunctionDefinition definition, final Scope scope) {
        final var function = new FunctionValue(
            definition.name(),
            definition.parameters(),
            evaluateDefaults(definition.parameters(), scope),
            new FunctionValue.Body.Block(definition.body()),
            scope.closureScope(),
            sourceName
        );
        scope.bind(definition.name(), decorate(function, definition.decorators(), scope));
        return Completion.normal;
    }

    @Override
    public Completion visitClassDefinition(final Statement.ClassDefinition definition, final Scope scope) {
        final @Nullable ClassValue base;
        if (definition.base() == null) {
            base = null;
        } else if (evaluate(definition.base(), scope) instanceof ClassValue baseClass) {
            base = baseClass;
        } else {
            throw new EvaluationFailure("Base of class " + definition.name() + " is not a class");
        }
        final var body = scope.classBody();
        final var completion = executeBlock(definition.body(), body);
        if (!completion.isNormal()) {
            throw misplaced(completion);
        }
        final var type = new ClassValue(definition.name(), base, body.bindings());
        scope.bind(definition.name(), decorate(type, definition.decorators(), scope));
        return Completion.normal;
    }

    @Override
    public Completion visitReturn(final Statement.Return statement, final Scope scope) {
        final var value = (statement.value() == null) ? null : evaluate(statement.value(), scope);
        return Completion.returning(value, statement.line());
    }

    @Override
    public Completion visitAssert(final Statement.Assert statement, final Scope scope) {
        if (!Values.isTruthy(evaluate(statement.condition(), scope))) {
            final var message = statement.message();
            throw new EvaluationFailure(
                (message == null) ? "Assertion failed" : ("Assertion failed: " + Values.str(evaluate(message, scope)))
            );
        }
        return Completion.normal;
    }

    @Override
    public Completion visitSimple(final Statement.Simple statement, final Scope scope) {
        return switch (statement.kind()) {
            case PASS -> Completion.normal;
            case BREAK -> Completion.of(Completion.Kind.BREAK, statement.line());
            case CONTINUE -> Completion.of(Completion.Kind.CONTINUE, statement.line());
        };
    }

    private Completion executeBlock(final List<Statement> statements, final Scope scope) {
        for (final var statement : statements) {
            final var completion = executeStatement(statement, scope);
            if (!completion.isNormal()) {
                return completion;
            }
        }
        return Completion.normal;
    }

    private Completion executeStatement(final Statement statement, final Scope scope) {
        try {
            return statement.accept(this, scope);
        } catch (final EvaluationFailure e) {
            throw fail(statement.line(), e.getMessage());
        }
    }

    private @Nullable Object evaluate(final Expression expression, final Scope scope) {
        return expression.accept(this, scope);
    }

    private @Nullable Object evaluateOptional(final @Nullable Expression expression, final Scope scope) {
        return (expression == null) ? null : evaluate(expression, scope);
    }

    private List<@Nullable Object> evaluateAll(final List<Expression> expressions, final Scope scope) {
        final var result = new ArrayList<@Nullable Object>(expressions.size());
        for (final var expression : expressions) {
            result.add(evaluate(expression, scope));
        }
        return result;
    }

    private Map<String, @Nullable Object> evaluateDefaults(
        final List<Expression.Parameter> parameters,
        final Scope scope
    ) {
        final var result = new HashMap<String, @Nullable Object>();
        for (final var parameter : parameters) {
            if (parameter.defaultValue() != null) {
                result.put(parameter.name(), evaluate(parameter.defaultValue(), scope));
            }
        }
        return result;
    }

    private @Nullable Object decorate(final Object value, final List<Expression> decorators, final Scope scope) {
        @Nullable Object result = value;
        for (var i = decorators.size() - 1; i >= 0; i -= 1) {
            final var decorator = evaluate(decorators.get(i), scope);
            result = call(decorator, Values.listOf(result), Map.of(), scope);
        }
        return result;
    }

    private void generate(
        final Expression.ListComprehension comprehension,
        final int clauseIndex,
        final Scope scope,
        final List<@Nullable Object> into
    ) {
        if (clauseIndex == comprehension.clauses().size()) {
            into.add(evaluate(comprehension.element(), scope));
            return;
        }
        final var clause = comprehension.clauses().get(clauseIndex);
        outer:
        for (final var element : Values.iterate(evaluate(clause.iterable(), scope))) {
            assign(clause.target(), element, scope);
            for (final var condition : clause.conditions()) {
                if (!Values.isTruthy(evaluate(condition, scope))) {
                    continue outer;
                }
            }
            generate(comprehension, clauseIndex + 1, scope, into);
        }
    }

    private void assign(final Expression target, final @Nullable Object value, final Scope scope) {
        if (target instanceof Expression.Name name) {
            scope.bind(name.identifier(), value);
        } else if (target instanceof Expression.Attribute attribute) {
            Values.setAttribute(evaluate(attribute.object(), scope), attribute.name(), value);
        } else if (target instanceof Expression.Subscript subscript) {
            if (subscript.index() instanceof Expression.Slice) {
                throw new EvaluationFailure("Slice assignment is not supported");
            }
            storeIndex(evaluate(subscript.object(), scope), evaluate(subscript.index(), scope), value);
        } else if (target instanceof Expression.TupleDisplay || target instanceof Expression.ListDisplay) {
            final var targets = (target instanceof Expression.TupleDisplay tuple)
                ? tuple.elements()
                : ((Expression.ListDisplay) target).elements();
            final var values = Values.iterate(value);
            if (values.size() != targets.size()) {
                throw new EvaluationFailure(
                    "Expected " + targets.size() + " values to unpack, got " + values.size()
                );
            }
            for (var i = 0; i < targets.size(); i += 1) {
                assign(targets.get(i), values.get(i), scope);
            }
        } else {
            throw new EvaluationFailure("Cannot assign to expression");
        }
    }

    private static @Nullable Object combine(
        final Expression.BinaryOperator operator,
        final @Nullable Object current,
        final @Nullable Object operand
    ) {
        if (operator == Expression.BinaryOperator.ADD && current instanceof List<?> list) {
            @SuppressWarnings("unchecked")
            final var target = (List<@Nullable Object>) list;
            target.addAll(Values.iterate(operand));
            return target;
        }
        return Operators.binary(operator, current, operand);
    }

    private static boolean compare(
        final Expression.ComparisonOperator operator,
        final @Nullable Object left,
        final @Nullable Object right
    ) {
        return switch (operator) {
            case LESS -> Values.compare(left, right) < 0;
            case GREATER -> Values.compare(left, right) > 0;
            case LESS_OR_EQUAL -> Values.compare(left, right) <= 0;
            case GREATER_OR_EQUAL -> Values.compare(left, right) >= 0;
            case EQUAL -> Values.equal(left, right);
            case NOT_EQUAL -> !Values.equal(left, right);
            case IN -> Values.contains(right, left);
            case NOT_IN -> !Values.contains(right, left);
            case IS -> isSame(left, right);
            case IS_NOT -> !isSame(left, right);
        };
    }

    private static boolean isSame(final @Nullable Object left, final @Nullable Object right) {
        if (left instanceof Boolean || left instanceof Long || left instanceof Double) {
            return left.equals(right);
        }
        return left == right;
    }

    private static @Nullable Object index(final @Nullable Object object, final @Nullable Object key) {
        if (object instanceof Map<?, ?> map) {
            if (!map.containsKey(Values.dictKey(key))) {
                throw new EvaluationFailure("Key " + Values.repr(key) + " not found");
            }
            return map.get(key);
        } else if (object instanceof List<?> || object instanceof Tuple || object instanceof String) {
            final var elements = Values.iterate(object);
            return elements.get(position(key, elements.size(), Values.typeName(object)));
        }
        throw new EvaluationFailure("'" + Values.typeName(object) + "' object is not subscriptable");
    }

    private static void storeIndex(final @Nullable Object object, final @Nullable Object key,
        final @Nullable Object value) {
        if (object instanceof Map<?, ?> map) {
            @SuppressWarnings("unchecked")
            final var target = (Map<@Nullable Object, @Nullable Object>) map;
            target.put(Values.dictKey(key), value);
        } else if (object instanceof List<?> list) {
            @SuppressWarnings("unchecked")
            final var target = (List<@Nullable Object>) list;
            target.set(position(key, target.size(), "list"), value);
        } else {
            throw new EvaluationFailure("'" + Values.typeName(object) + "' object does not support item assignment");
        }
    }

    private static int position(final @Nullable Object key, final int size, final String typeName) {
        if (!(key instanceof Long index)) {
            throw new EvaluationFailure(typeName + " indices must be integers, not " + Values.typeName(key));
        }
        final var normalized = (index < 0) ? index + size : index;
        if (normalized < 0 || normalized >= size) {
            throw new EvaluationFailure(typeName + " index out of range");
        }
        return (int) normalized;
    }

    private static Object slice(final @Nullable Object object, final @Nullable Object lower,
        final @Nullable Object upper) {
        if (!(object instanceof List<?> || object instanceof Tuple || object instanceof String)) {
            throw new EvaluationFailure("'" + Values.typeName(object) + "' object is not subscriptable");
        }
        final var elements = Values.iterate(object);
        final var size = elements.size();
        final var start = sliceBound(lower, 0, size);
        final var end = Math.max(start, sliceBound(upper, size, size));
        final var part = new ArrayList<>(elements.subList(start, end));
        if (object instanceof String) {
            final var builder = new StringBuilder();
            part.forEach(builder::append);
            return builder.toString();
        }
        return (object instanceof Tuple) ? new Tuple(part) : part;
    }

    private static int sliceBound(final @Nullable Object bound, final int defaultValue, final int size) {
        if (bound == null) {
            return defaultValue;
        }
        if (!(bound instanceof Long value)) {
            throw new EvaluationFailure("Slice indices must be integers or None, not " + Values.typeName(bound));
        }
        final var normalized = (value < 0) ? value + size : value;
        return (int) Math.max(0, Math.min(normalized, size));
    }

    private UnhandledErrorError misplaced(final Completion completion) {
        final var message = switch (completion.kind()) {
            case BREAK -> "'break' outside loop";
            case CONTINUE -> "'continue' outside loop";
            default -> "'return' outside function";
        };
        return fail(completion.line(), message);
    }

    private UnhandledErrorError fail(final int line, final String message) {
        return ConditionContext.error(
            new FragmentEvaluationErrorCondition(message, new SourceLocation(sourceName, line))
        );
    }

    private static final int maxCallDepth = 250;

    private final Environment environment;
    private @Nullable LineSink lineSink = null;
    private String sourceName = "<unknown>";
    private int callDepth = 0;
}
