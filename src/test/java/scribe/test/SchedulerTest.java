// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.stream.LongStream;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import scribe.graph.CyclicDependencyCondition;
import scribe.graph.DependencyGraphBuilder;
import scribe.graph.Scheduler;

final class SchedulerTest {
    @ParameterizedTest
    @MethodSource("seeds")
    void prerequisitesComeFirst(final long seed) {
        final var units = new ArrayList<>(List.of(
            DependencyGraphTest.unit("base.y", "Base = 1\n"),
            DependencyGraphTest.unit("left.y", "Left = Base + 1\n"),
            DependencyGraphTest.unit("right.y", "Right = Base * 2\n"),
            DependencyGraphTest.unit("top.y", "Top = Left + Right\n"),
            DependencyGraphTest.unit("registry.y", DependencyGraphTest.registryText),
            DependencyGraphTest.unit("feeder.y", "Register(Top)\n"),
            DependencyGraphTest.unit("drainer.y", "Total = sum(Drain())\n"),
            DependencyGraphTest.unit("report.y", "x = Total + Left\n")
        ));
        Collections.shuffle(units, new Random(seed));
        final var graph = DependencyGraphBuilder.build(units);
        final var order = Scheduler.schedule(graph);

        Assertions.assertThat(order).containsExactlyInAnyOrderElementsOf(units);
        for (final var edge : graph.edges()) {
            Assertions.assertThat(order.indexOf(edge.prerequisite()))
                .as("%s", edge)
                .isLessThan(order.indexOf(edge.dependent()));
        }
    }

    @Test
    void channelOrdersProducersBeforeConsumers() {
        final var registry = DependencyGraphTest.unit("registry.y", DependencyGraphTest.registryText);
        final var producer = DependencyGraphTest.unit("x.y", "Register(1)\n");
        final var consumer = DependencyGraphTest.unit("y.y", "items = Drain()\n");
        final var order = Scheduler.schedule(DependencyGraphBuilder.build(List.of(consumer, registry, producer)));
        Assertions.assertThat(order).containsExactly(registry, producer, consumer);
    }

    @Test
    void independentUnitsKeepInputOrder() {
        final var first = DependencyGraphTest.unit("b.y", "B = 1\n");
        final var second = DependencyGraphTest.unit("a.y", "A = 1\n");
        final var third = DependencyGraphTest.unit("c.y", "C = 1\n");
        Assertions.assertThat(Scheduler.schedule(DependencyGraphBuilder.build(List.of(first, second, third))))
            .containsExactly(first, second, third);
    }

    @Test
    void mutualReferencesAreCyclic() {
        final var a = DependencyGraphTest.unit("a.y", "Alpha = 1\nx = Beta\n");
        final var b = DependencyGraphTest.unit("b.y", "Beta = 1\ny = Alpha\n");
        final var graph = DependencyGraphBuilder.build(List.of(a, b));
        final var condition = Conditions.expectFatal(CyclicDependencyCondition.class, () -> Scheduler.schedule(graph));
        Assertions.assertThat(condition.cycles()).containsExactly("a.y → b.y → a.y");
        Assertions.assertThat(condition.detailedMessage()).contains("a.y → b.y → a.y");
    }

    @Test
    void everyCycleIsReportedOnce() {
        final var units = List.of(
            DependencyGraphTest.unit("c.y", "Gamma = 1\nx = Alpha\n"),
            DependencyGraphTest.unit("a.y", "Alpha = 1\nx = Beta\n"),
            DependencyGraphTest.unit("b.y", "Beta = 1\nx = Gamma\n"),
            DependencyGraphTest.unit("d.y", "Delta = 1\nx = Epsilon\n"),
            DependencyGraphTest.unit("e.y", "Epsilon = 1\nx = Delta\n"),
            DependencyGraphTest.unit("tail.y", "x = Alpha + Epsilon\n"),
            DependencyGraphTest.unit("ok.y", "Fine = 1\n")
        );
        final var graph = DependencyGraphBuilder.build(units);
        final var condition = Conditions.expectFatal(CyclicDependencyCondition.class, () -> Scheduler.schedule(graph));
        Assertions.assertThat(condition.cycles()).containsExactly("a.y → b.y → c.y → a.y", "d.y → e.y → d.y");
    }

    @Test
    void cycleThroughChannelAndDirectEdgesIsDetected() {
        final var registry = DependencyGraphTest.unit("registry.y", DependencyGraphTest.registryText);
        final var drainer = DependencyGraphTest.unit("drainer.y", "Shared = Drain()\n");
        final var feeder = DependencyGraphTest.unit("feeder.y", "Register(Shared)\n");
        final var graph = DependencyGraphBuilder.build(List.of(registry, drainer, feeder));
        final var condition = Conditions.expectFatal(CyclicDependencyCondition.class, () -> Scheduler.schedule(graph));
        Assertions.assertThat(condition.cycles()).containsExactly("drainer.y → feeder.y → drainer.y");
    }

    @Test
    void selfEdgeDoesNotBlockScheduling() {
        final var registry = DependencyGraphTest.unit("registry.y", DependencyGraphTest.registryText);
        final var both = DependencyGraphTest.unit("both.y", "Register(1)\nitems = Drain()\n");
        final var graph = DependencyGraphBuilder.build(List.of(both, registry));
        Assertions.assertThat(graph.hasEdge(both, both)).isTrue();
        Assertions.assertThat(Scheduler.schedule(graph)).containsExactly(registry, both);
    }

    private static LongStream seeds() {
        return LongStream.range(0, 8);
    }
}
