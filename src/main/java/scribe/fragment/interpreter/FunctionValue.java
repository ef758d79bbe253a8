// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.fragment.interpreter;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;
import scribe.fragment.Expression;
import scribe.fragment.Statement;

/**
 * A function defined in fragment code, either by {@code def} or by {@code lambda}.
 * <p>
 * Functions close over the scope they were defined in, so they keep seeing the bindings of their defining unit even
 * when called from another one.
 */
public final class FunctionValue implements FragmentCallable {
    FunctionValue(
        final String name,
        final List<Expression.Parameter> parameters,
        final Map<String, @Nullable Object> defaultValues,
        final Body body,
        final Scope closure,
        final String sourceName
    ) {
        this.name = name;
        this.parameters = parameters;
        this.defaultValues = defaultValues;
        this.body = body;
        this.closure = closure;
        this.sourceName = sourceName;
    }

    public String name() {
        return name;
    }

    @Override
    public @Nullable Object call(final Invocation invocation) {
        return invocation.interpreter().invokeFunction(this, bindArguments(invocation));
    }

    @Override
    public String toString() {
        return "<function " + name + ">";
    }

    Body body() {
        return body;
    }

    String sourceName() {
        return sourceName;
    }

    private Scope bindArguments(final Invocation invocation) {
        final var arguments = invocation.arguments();
        if (arguments.size() > parameters.size()) {
            throw new EvaluationFailure(
                name + "() takes " + parameters.size() + " positional argument(s) but " + arguments.size()
                    + " were given"
            );
        }
        final var scope = closure.child();
        final var bound = new HashSet<String>();
        for (var i = 0; i < arguments.size(); i += 1) {
            final var parameterName = parameters.get(i).name();
            scope.bind(parameterName, arguments.get(i));
            bound.add(parameterName);
        }
        for (final var entry : invocation.keywordArguments().entrySet()) {
            final var keyword = entry.getKey();
            if (parameters.stream().noneMatch(parameter -> parameter.name().equals(keyword))) {
                throw new EvaluationFailure(name + "() got an unexpected keyword argument '" + keyword + "'");
            }
            if (!bound.add(keyword)) {
                throw new EvaluationFailure(name + "() got multiple values for argument '" + keyword + "'");
            }
            scope.bind(keyword, entry.getValue());
        }
        for (final var parameter : parameters) {
            final var parameterName = parameter.name();
            if (bound.contains(parameterName)) {
                continue;
            }
            if (!defaultValues.containsKey(parameterName)) {
                throw new EvaluationFailure(name + "() missing required argument '" + parameterName + "'");
            }
            scope.bind(parameterName, defaultValues.get(parameterName));
        }
        return scope;
    }

    /**
     * What a function evaluates when called: a block of statements for {@code def}, a single expression for
     * {@code lambda}.
     */
    sealed interface Body {
        record Block(List<Statement> statements) implements Body {
        }

        record Single(Expression expression) implements Body {
        }
    }

    private final String name;
    private final List<Expression.Parameter> parameters;
    private final Map<String, @Nullable Object> defaultValues;
    private final Body body;
    private final Scope closure;
    private final String sourceName;
}
