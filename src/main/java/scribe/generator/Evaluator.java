// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.generator;

import java.util.Objects;
import scribe.fragment.interpreter.Builtins;
import scribe.fragment.interpreter.Environment;
import scribe.fragment.interpreter.Interpreter;
import scribe.fragment.interpreter.Scope;
import scribe.unit.Block;
import scribe.unit.Unit;
import scribe.util.Trace;

/**
 * Evaluates units one after another against a shared environment.
 * <p>
 * Each unit gets its own local scope, shared by all of its fragments. After every fragment, the local bindings of
 * the names the unit declares are published to the environment, where units evaluated later see them; all other
 * bindings stay private to the unit.
 */
public final class Evaluator {
    public Evaluator(final Environment environment) {
        this.environment = environment;
        interpreter = new Interpreter(environment);
    }

    /**
     * Evaluates the given unit, returning its output. Code units produce no output, so the result is empty for
     * them.
     * <p>
     * Runtime errors in fragments are signaled as fatal
     * {@link scribe.fragment.interpreter.FragmentEvaluationErrorCondition}s.
     */
    public String evaluate(final Unit unit) {
        try (final var trace = new Trace(() -> "Evaluating unit " + unit.source())) {
            trace.use();
            final var scope = new Scope();
            Builtins.roleMarkers().forEach(scope::bind);
            final var output = new StringBuilder();
            for (final var block : unit.blocks()) {
                if (block instanceof Block.Text text) {
                    output.append(text.content());
                } else {
                    output.append(evaluateFragment(unit, (Block.Fragment) block, scope));
                }
            }
            return output.toString();
        }
    }

    private String evaluateFragment(final Unit unit, final Block.Fragment fragment, final Scope scope) {
        final var buffer = unit.isTemplate()
            ? new EmissionBuffer(Objects.requireNonNullElse(fragment.indentPrefix(), ""))
            : null;
        interpreter.setLineSink(buffer);
        try {
            interpreter.execute(fragment.program(), scope);
        } finally {
            interpreter.setLineSink(null);
        }
        for (final var symbol : unit.declaredSymbols()) {
            if (scope.isBoundLocally(symbol.name())) {
                environment.define(symbol.name(), scope.getLocal(symbol.name()));
            }
        }
        return (buffer == null) ? "" : buffer.flush();
    }

    private final Environment environment;
    private final Interpreter interpreter;
}
