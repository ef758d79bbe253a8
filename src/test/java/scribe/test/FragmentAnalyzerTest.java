// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.test;

import java.nio.file.Path;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;
import scribe.unit.InvalidDeclarationCondition;
import scribe.unit.Symbol;
import scribe.unit.SymbolRole;
import scribe.unit.Unit;
import scribe.unit.UnitLoader;

final class FragmentAnalyzerTest {
    @Test
    void topLevelDefinitionsAreDeclared() {
        final var unit = codeUnit("""
            def Helper():
                pass
            class Shape:
                pass
            def lowercase():
                pass
            """);
        Assertions.assertThat(unit.declaredSymbols()).containsExactly(
            new Symbol("Helper", source, SymbolRole.PLAIN),
            new Symbol("Shape", source, SymbolRole.PLAIN)
        );
    }

    @Test
    void roleMarkersSetRoles() {
        final var unit = codeUnit("""
            @producer
            def Register(item):
                pass
            @consumer
            def Drain():
                pass
            """);
        Assertions.assertThat(unit.declaredSymbols()).containsExactly(
            new Symbol("Register", source, SymbolRole.PRODUCER),
            new Symbol("Drain", source, SymbolRole.CONSUMER)
        );
    }

    @Test
    void nestedDefinitionsAreNotDeclared() {
        final var unit = codeUnit("""
            def Outer():
                def Inner():
                    pass
                class Local:
                    pass
            """);
        Assertions.assertThat(unit.declaredSymbols()).extracting(Symbol::name).containsExactly("Outer");
    }

    @Test
    void assignmentsAtAnyDepthAreDeclared() {
        final var unit = codeUnit("""
            Count = 0
            First, Second = 1, 2
            for Item in []:
                pass
            def setup():
                Nested = 1
            squares = [Square * Square for Square in range(3)]
            """);
        Assertions.assertThat(unit.declaredSymbols()).extracting(Symbol::name)
            .containsExactly("Count", "First", "Second", "Item", "Nested", "Square");
        Assertions.assertThat(unit.declaredSymbols()).extracting(Symbol::role).containsOnly(SymbolRole.PLAIN);
    }

    @Test
    void readsAreReferencesExceptOwnDeclarationsAndBuiltins() {
        final var unit = codeUnit("""
            Local = 1
            x = Local + Other.size + len([Third])
            def f(value=Default):
                return Inside(value)
            """);
        Assertions.assertThat(unit.referencedNames()).containsExactly("Other", "Third", "Default", "Inside");
    }

    @Test
    void roleMarkedDeclarationWinsOverPlainAssignment() {
        final var unit = codeUnit("""
            Thing = None
            @producer
            def Thing(x):
                pass
            """);
        Assertions.assertThat(unit.declaredSymbols()).containsExactly(new Symbol("Thing", source, SymbolRole.PRODUCER));
    }

    @Test
    void producerAndConsumerTogetherIsInvalid() {
        final var condition = Conditions.expectFatal(InvalidDeclarationCondition.class, () -> codeUnit("""
            @producer
            @consumer
            def Both():
                pass
            """));
        Assertions.assertThat(condition.symbolName()).isEqualTo("Both");
    }

    @Test
    void conflictingRolesAcrossDefinitionsAreInvalid() {
        Conditions.expectFatal(InvalidDeclarationCondition.class, () -> codeUnit("""
            @producer
            def Twice():
                pass
            @consumer
            def Twice():
                pass
            """));
    }

    @Test
    void templateFragmentsAreAnalyzedTogether() {
        final var unit = UnitLoader.parse(Path.of("list.hy"), Path.of("out/list.h"), """
            {{{ Size = 3 }}}
            int values[{{{ echo("{Size}") }}}];
            {{{ x = Limit }}}
            """);
        Assertions.assertThat(unit.isTemplate()).isTrue();
        Assertions.assertThat(unit.declaredSymbols()).extracting(Symbol::name).containsExactly("Size");
        Assertions.assertThat(unit.referencedNames()).containsExactly("Limit");
    }

    private static Unit codeUnit(final String text) {
        return UnitLoader.parse(source, null, text);
    }

    private static final Path source = Path.of("lib.y");
}
