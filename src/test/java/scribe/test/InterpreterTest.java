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

final class InterpreterTest {
    @Test
    void emissionJoinsLinesWithDelimiters() {
        Assertions.assertThat(render("""
            {{{
                for i in [1, 2, 3]:
                    echo("- {i}", ",")
            }}}""")).isEqualTo("- 1,\n- 2,\n- 3");
    }

    @Test
    void continuationLinesGetIndentPrefix() {
        Assertions.assertThat(render("\t\t{{{\n    echo(\"a\")\n    echo(\"b\")\n}}}\n"))
            .isEqualTo("\t\ta\n\t\tb\n");
    }

    @Test
    void newlineCanBeSuppressed() {
        Assertions.assertThat(render("""
            {{{
                echo("a", ", ", newline=False)
                echo("b")
            }}}""")).isEqualTo("a, b");
    }

    @Test
    void fragmentsShareUnitScope() {
        Assertions.assertThat(render("""
            {{{ name = "world" }}}Hello, {{{ echo("{name}") }}}!
            """)).isEqualTo("Hello, world!\n");
    }

    @Test
    void functionsTakeDefaultAndKeywordArguments() {
        Assertions.assertThat(render("""
            {{{
                def greet(name, greeting="Hello"):
                    return greeting + ", " + name
                echo(greet("world"))
                echo(greet("you", greeting="Bye"))
            }}}""")).isEqualTo("Hello, world\nBye, you");
    }

    @Test
    void classesSupportInheritanceAndState() {
        Assertions.assertThat(render("""
            {{{
                class Base:
                    def describe(self):
                        return "I am " + self.name()
                class Cat(Base):
                    def __init__(self, lives):
                        self.lives = lives
                    def name(self):
                        return "cat"
                    def lose(self):
                        self.lives -= 1
                cat = Cat(9)
                cat.lose()
                echo(cat.describe())
                echo("{cat.lives}")
            }}}""")).isEqualTo("I am cat\n8");
    }

    @Test
    void closuresSeeTheirDefiningScope() {
        Assertions.assertThat(render("""
            {{{
                def counter():
                    total = [0]
                    def bump():
                        total[0] += 1
                        return total[0]
                    return bump
                bump = counter()
                bump()
                echo("{n}".format(n=bump()))
            }}}""")).isEqualTo("2");
    }

    @Test
    void filteredForHeaderIteratesMatchingElements() {
        Assertions.assertThat(render("""
            {{{
                for n in range(10) if n % 3 == 0:
                    echo("{n}", ",")
            }}}""")).isEqualTo("0,\n3,\n6,\n9");
    }

    @Test
    void comprehensionsAndBuiltins() {
        Assertions.assertThat(render("""
            {{{
                echo(str([x * x for x in range(5) if x % 2 == 0]))
                echo(", ".join(sorted(["b", "c", "a"])))
                echo(str(sum(range(1, 5))) + " " + str(max(3, 9, 4)))
                echo(str(list(map(lambda x: x * 2, filter(lambda x: x > 1, [1, 2, 3])))))
                for i, word in enumerate(["zero", "one"]):
                    echo("{i}:{word}")
            }}}""")).isEqualTo("[0, 4, 16]\na, b, c\n10 9\n[4, 6]\n0:zero\n1:one");
    }

    @Test
    void formatSpecifications() {
        Assertions.assertThat(render("""
            {{{
                echo("{0:>5}|{1:<4}|{2:.2f}|{3:x}|{4:^7}".format("ab", "c", 3.14159, 255, "mid"))
                echo("%s=%d" % ("n", 5))
                echo("{{literal}}")
                point = {"x": 1}
                items = [10, 20]
                echo("{point[x]} {items[1]} {items!r}")
            }}}""")).isEqualTo("   ab|c   |3.14|ff|  mid  \nn=5\n{literal}\n1 20 [10, 20]");
    }

    @Test
    void loopsWithBreakAndElse() {
        Assertions.assertThat(render("""
            {{{
                n = 0
                while n < 10:
                    n += 1
                    if n == 3:
                        break
                else:
                    n = -1
                for m in []:
                    pass
                else:
                    m = "empty"
                echo("{n} {m}")
            }}}""")).isEqualTo("3 empty");
    }

    @Test
    void slicesAndNegativeIndices() {
        Assertions.assertThat(render("""
            {{{
                s = "abcdef"
                echo(s[1:3] + s[-1] + s[:2].upper())
                echo(str([1, 2, 3, 4][-2:]))
            }}}""")).isEqualTo("bcfAB\n[3, 4]");
    }

    @Test
    void runtimeErrorsPointAtFailingLine() {
        final var condition = Conditions.expectFatal(
            FragmentEvaluationErrorCondition.class,
            () -> render("first\n{{{\n    x = 1\n    y = x // 0\n}}}\n")
        );
        Assertions.assertThat(condition.message()).isEqualTo("Integer division or modulo by zero");
        Assertions.assertThat(condition.location().sourceName()).isEqualTo(source.toString());
        Assertions.assertThat(condition.location().lineNumber()).isEqualTo(4);
    }

    @Test
    void errorsInsideFunctionsPointAtFunctionBody() {
        final var condition = Conditions.expectFatal(FragmentEvaluationErrorCondition.class, () -> render("""
            {{{
                def broken():
                    return missing + 1
                broken()
            }}}"""));
        Assertions.assertThat(condition.message()).isEqualTo("Name 'missing' is not defined");
        Assertions.assertThat(condition.location().lineNumber()).isEqualTo(3);
    }

    @Test
    void failedAssertionIsEvaluationError() {
        final var condition = Conditions.expectFatal(
            FragmentEvaluationErrorCondition.class,
            () -> render("{{{ assert 1 == 2, 'nope' }}}")
        );
        Assertions.assertThat(condition.message()).isEqualTo("Assertion failed: nope");
    }

    @Test
    void integerArithmeticIsExact() {
        final var condition = Conditions.expectFatal(
            FragmentEvaluationErrorCondition.class,
            () -> render("{{{ x = 9223372036854775807 + 1 }}}")
        );
        Assertions.assertThat(condition.message()).isEqualTo("Integer overflow");
    }

    @Test
    void floorDivisionOverflowIsEvaluationError() {
        final var condition = Conditions.expectFatal(
            FragmentEvaluationErrorCondition.class,
            () -> render("{{{ x = (-9223372036854775807 - 1) // -1 }}}")
        );
        Assertions.assertThat(condition.message()).isEqualTo("Integer overflow");
    }

    @Test
    void oversizedFormatWidthIsEvaluationError() {
        final var condition = Conditions.expectFatal(
            FragmentEvaluationErrorCondition.class,
            () -> render("{{{ x = '{:>99999999999}'.format(1) }}}")
        );
        Assertions.assertThat(condition.message()).isEqualTo("Too many decimal digits in format string");
    }

    @Test
    void numericFieldKeysLookUpIntegerDictKeys() {
        Assertions.assertThat(render("""
            {{{
                s = '{0[1]}'.format({1: "one"})
                echo("{s}")
            }}}""")).isEqualTo("one");

        final var condition = Conditions.expectFatal(
            FragmentEvaluationErrorCondition.class,
            () -> render("{{{ x = '{0[99999999999999999999]}'.format({1: 2}) }}}")
        );
        Assertions.assertThat(condition.message()).isEqualTo("Key '99999999999999999999' not found");
    }

    @Test
    void selfContainingContainersAreAbbreviated() {
        Assertions.assertThat(render("""
            {{{
                items = [1]
                items.append(items)
                table = {}
                table["self"] = table
                table["items"] = items
                s = str(items)
                t = str(table)
                echo("{s}")
                echo("{t}")
            }}}""")).isEqualTo("[1, [...]]\n{'self': {...}, 'items': [1, [...]]}");
    }

    @Test
    void mutableDictKeysAreRejected() {
        final var display = Conditions.expectFatal(
            FragmentEvaluationErrorCondition.class,
            () -> render("{{{\n    k = [1]\n    d = {k: 2}\n}}}\n")
        );
        Assertions.assertThat(display.message()).isEqualTo("Unhashable type: 'list'");

        final var store = Conditions.expectFatal(
            FragmentEvaluationErrorCondition.class,
            () -> render("{{{\n    d = {}\n    d[(1, {})] = 2\n}}}\n")
        );
        Assertions.assertThat(store.message()).isEqualTo("Unhashable type: 'dict'");
    }

    @Test
    void tupleKeysStillWork() {
        Assertions.assertThat(render("""
            {{{
                d = {(1, "a"): "found"}
                v = d.get((1, "a"))
                echo("{v}")
            }}}""")).isEqualTo("found");
    }

    @Test
    void negativeHexadecimalHasSign() {
        Assertions.assertThat(render("""
            {{{
                a = '%x' % -255
                b = '{:x}'.format(-255)
                c = '%x' % 255
                echo("{a} {b} {c}")
            }}}""")).isEqualTo("-ff -ff ff");
    }

    @Test
    void runawayRecursionIsEvaluationError() {
        final var condition = Conditions.expectFatal(FragmentEvaluationErrorCondition.class, () -> render("""
            {{{
                def forever(n):
                    return forever(n + 1)
                forever(0)
            }}}"""));
        Assertions.assertThat(condition.message()).isEqualTo("Maximum call depth exceeded");
    }

    @Test
    void emissionFromCodeUnitIsEvaluationError() {
        final var unit = UnitLoader.parse(Path.of("lib.y"), null, "echo(\"x\")\n");
        final var condition = Conditions.expectFatal(
            FragmentEvaluationErrorCondition.class,
            () -> new Evaluator(new Environment()).evaluate(unit)
        );
        Assertions.assertThat(condition.message()).isEqualTo("echo() is only available in template units");
    }

    private static String render(final String template) {
        final var unit = UnitLoader.parse(source, Path.of("test.txt"), template);
        return new Evaluator(new Environment()).evaluate(unit);
    }

    private static final Path source = Path.of("test.txty");
}
