// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.test;

import java.nio.file.Path;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;
import scribe.fragment.interpreter.Environment;
import scribe.fragment.interpreter.FragmentEvaluationErrorCondition;
import scribe.generator.Evaluator;
import scribe.unit.UnitLoader;

final class EvaluatorTest {
    @Test
    void onlyDeclaredSymbolsArePublished() {
        final var environment = new Environment();
        final var library = UnitLoader.parse(Path.of("lib.y"), null, """
            helper = "private"
            Greeting = "Hello"
            def Greet(name):
                return Greeting + ", " + name
            """);
        Assertions.assertThat(new Evaluator(environment).evaluate(library)).isEmpty();
        Assertions.assertThat(environment.contains("Greeting")).isTrue();
        Assertions.assertThat(environment.contains("Greet")).isTrue();
        Assertions.assertThat(environment.contains("helper")).isFalse();
        Assertions.assertThat(environment.lookup("Greeting")).contains("Hello");
    }

    @Test
    void laterUnitsSeePublishedSymbols() {
        final var environment = new Environment();
        final var evaluator = new Evaluator(environment);
        evaluator.evaluate(UnitLoader.parse(Path.of("lib.y"), null, """
            def Greet(name):
                return "Hello, " + name
            """));
        final var template = UnitLoader.parse(Path.of("hello.txty"), Path.of("hello.txt"), """
            {{{ echo(Greet("world")) }}}
            """);
        Assertions.assertThat(evaluator.evaluate(template)).isEqualTo("Hello, world\n");
    }

    @Test
    void privateBindingsStayInTheirUnit() {
        final var environment = new Environment();
        final var evaluator = new Evaluator(environment);
        evaluator.evaluate(UnitLoader.parse(Path.of("lib.y"), null, "secret = 1\n"));
        final var template = UnitLoader.parse(Path.of("use.txty"), Path.of("use.txt"), "{{{ x = secret }}}");
        final var condition = Conditions.expectFatal(
            FragmentEvaluationErrorCondition.class,
            () -> evaluator.evaluate(template)
        );
        Assertions.assertThat(condition.message()).isEqualTo("Name 'secret' is not defined");
    }

    @Test
    void publishedValuesAreSnapshotsAfterEachFragment() {
        final var environment = new Environment();
        final var unit = UnitLoader.parse(Path.of("count.txty"), Path.of("count.txt"), """
            {{{ Count = 1 }}}{{{ Count = Count + 1 }}}
            """);
        new Evaluator(environment).evaluate(unit);
        Assertions.assertThat(environment.lookup("Count")).contains(2L);
    }
}
