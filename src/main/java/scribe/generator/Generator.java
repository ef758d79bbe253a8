// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.generator;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import scribe.fragment.interpreter.Environment;
import scribe.graph.DependencyGraphBuilder;
import scribe.graph.Scheduler;
import scribe.unit.Unit;
import scribe.unit.UnitLoader;
import scribe.util.Trace;

/**
 * The generation pipeline: loads all units, works out the order to evaluate them in, then evaluates them one by
 * one, deploying the output of each template as soon as it's complete.
 * <p>
 * Any fatal condition aborts the run. Units deployed before the failure keep their new output.
 */
public final class Generator {
    /**
     * Creates a generator.
     *
     * @param outputRoot The directory template targets are placed under.
     * @param reporter   Notified of every target that was created or updated.
     */
    public Generator(final Path outputRoot, final ChangeReporter reporter) {
        this.outputRoot = outputRoot;
        this.reporter = reporter;
    }

    /**
     * Generates the output of the units at the given source paths.
     */
    public void generate(final List<Path> sources) {
        try (final var trace = new Trace("Generating output")) {
            trace.use();
            final var units = new ArrayList<Unit>(sources.size());
            for (final var source : sources) {
                units.add(UnitLoader.load(source, outputRoot));
            }
            final var order = Scheduler.schedule(DependencyGraphBuilder.build(units));
            final var evaluator = new Evaluator(new Environment());
            for (final var unit : order) {
                final var output = evaluator.evaluate(unit);
                if (unit.isTemplate()) {
                    deploy(Objects.requireNonNull(unit.target()), output);
                }
            }
        }
    }

    private void deploy(final Path target, final String output) {
        final var result = Deployer.deploy(target, output);
        if (result.isChange()) {
            reporter.report(result, target);
        }
    }

    private final Path outputRoot;
    private final ChangeReporter reporter;
}
