// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.test;

import java.nio.file.Path;
import java.util.List;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;
import scribe.graph.DataChannel;
import scribe.graph.DependencyGraphBuilder;
import scribe.graph.DuplicateSymbolCondition;
import scribe.graph.UnresolvedSymbolCondition;
import scribe.unit.Unit;
import scribe.unit.UnitLoader;

final class DependencyGraphTest {
    @Test
    void referenceCreatesDirectEdge() {
        final var library = unit("library.y", "def Helper():\n    return 1\n");
        final var user = unit("user.y", "x = Helper()\n");
        final var graph = DependencyGraphBuilder.build(List.of(library, user));
        Assertions.assertThat(graph.hasEdge(user, library)).isTrue();
        Assertions.assertThat(graph.hasEdge(library, user)).isFalse();
        Assertions.assertThat(graph.channels()).isEmpty();
    }

    @Test
    void duplicateDeclarationIsFatalEvenIfUnreferenced() {
        final var first = unit("first.y", "Thing = 1\n");
        final var second = unit("second.y", "def Thing():\n    pass\n");
        final var condition = Conditions.expectFatal(
            DuplicateSymbolCondition.class,
            () -> DependencyGraphBuilder.build(List.of(first, second))
        );
        Assertions.assertThat(condition.symbolName()).isEqualTo("Thing");
        Assertions.assertThat(condition.message()).contains("first.y").contains("second.y");
    }

    @Test
    void undeclaredReferenceIsFatal() {
        final var user = unit("user.y", "x = Missing + 1\n");
        final var condition = Conditions.expectFatal(
            UnresolvedSymbolCondition.class,
            () -> DependencyGraphBuilder.build(List.of(user))
        );
        Assertions.assertThat(condition.symbolName()).isEqualTo("Missing");
        Assertions.assertThat(condition.message()).contains("user.y");
    }

    @Test
    void builtinNamesNeedNoDeclaration() {
        final var user = unit("user.y", "x = len(str(range(3)))\n");
        final var graph = DependencyGraphBuilder.build(List.of(user));
        Assertions.assertThat(graph.edges()).isEmpty();
    }

    @Test
    void roleSymbolReferencesFormChannel() {
        final var registry = unit("registry.y", registryText);
        final var contributor = unit("contributor.y", "Register(1)\n");
        final var drainer = unit("drainer.y", "items = Drain()\n");
        final var graph = DependencyGraphBuilder.build(List.of(drainer, registry, contributor));

        Assertions.assertThat(graph.channels()).hasSize(1);
        final DataChannel channel = graph.channels().get(0);
        Assertions.assertThat(channel.owner()).isSameAs(registry);
        Assertions.assertThat(channel.producers()).containsExactly(contributor);
        Assertions.assertThat(channel.consumers()).containsExactly(drainer);

        Assertions.assertThat(graph.hasEdge(contributor, registry)).isTrue();
        Assertions.assertThat(graph.hasEdge(drainer, registry)).isTrue();
        Assertions.assertThat(graph.hasEdge(drainer, contributor)).isTrue();
        Assertions.assertThat(graph.hasEdge(contributor, drainer)).isFalse();
    }

    @Test
    void repeatedReferencesYieldOneEdge() {
        final var library = unit("library.y", "Value = 1\n");
        final var user = unit("user.y", "x = Value\ny = Value + Value\n");
        final var graph = DependencyGraphBuilder.build(List.of(library, user));
        Assertions.assertThat(graph.edges()).hasSize(1);
    }

    static Unit unit(final String path, final String text) {
        return UnitLoader.parse(Path.of(path), null, text);
    }

    static final String registryText = """
        entries = []
        @producer
        def Register(entry):
            entries.append(entry)
        @consumer
        def Drain():
            return list(entries)
        """;
}
