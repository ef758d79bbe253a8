// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.test;

import java.nio.file.Path;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;
import scribe.fragment.Expression;
import scribe.fragment.FragmentParseErrorCondition;
import scribe.fragment.Parser;
import scribe.fragment.SourceLocation;
import scribe.fragment.SourceRewriter;
import scribe.fragment.Statement;
import scribe.unit.UnitLoader;

final class ParserTest {
    @Test
    void parsesCompoundStatements() {
        final var program = Parser.parse("x = 1\nif x:\n    y = 2\nelif x > 1:\n    pass\nelse:\n    y = 3\n", "t", 1);
        Assertions.assertThat(program.sourceName()).isEqualTo("t");
        Assertions.assertThat(program.body()).hasSize(2);
        Assertions.assertThat(program.body().get(0)).isInstanceOf(Statement.Assignment.class);
        final var statement = (Statement.If) program.body().get(1);
        Assertions.assertThat(statement.branches()).hasSize(2);
        Assertions.assertThat(statement.orElse()).hasSize(1);
        Assertions.assertThat(statement.line()).isEqualTo(2);
    }

    @Test
    void linesAreNumberedFromFirstLine() {
        final var program = Parser.parse("a = [1,\n     2]\nb = 3\n", "t", 10);
        Assertions.assertThat(program.body()).extracting(Statement::line).containsExactly(10, 12);
    }

    @Test
    void adjacentStringLiteralsConcatenate() {
        final var program = Parser.parse("s = 'a' \"b\\n\" '''c\nd'''\n", "t", 1);
        final var assignment = (Statement.Assignment) program.body().get(0);
        Assertions.assertThat(assignment.value()).isEqualTo(new Expression.Literal("ab\nc\nd", 1));
    }

    @Test
    void chainedComparisonAndPrecedence() {
        final var program = Parser.parse("r = 1 < 2 + 3 * 4 <= 20\n", "t", 1);
        final var value = ((Statement.Assignment) program.body().get(0)).value();
        final var comparison = (Expression.Comparison) value;
        Assertions.assertThat(comparison.operators())
            .containsExactly(Expression.ComparisonOperator.LESS, Expression.ComparisonOperator.LESS_OR_EQUAL);
        final var sum = (Expression.Binary) comparison.rest().get(0);
        Assertions.assertThat(sum.operator()).isEqualTo(Expression.BinaryOperator.ADD);
        Assertions.assertThat(((Expression.Binary) sum.right()).operator())
            .isEqualTo(Expression.BinaryOperator.MULTIPLY);
    }

    @Test
    void missingIndentedBlockIsParseError() {
        final var condition = Conditions.expectFatal(
            FragmentParseErrorCondition.class,
            () -> Parser.parse("if True:\nx = 1\n", "t", 1)
        );
        Assertions.assertThat(condition.location().lineNumber()).isEqualTo(2);
    }

    @Test
    void unclosedBracketIsParseError() {
        final var condition = Conditions.expectFatal(
            FragmentParseErrorCondition.class,
            () -> Parser.parse("x = (1 +\n", "broken", 1)
        );
        Assertions.assertThat(condition.location().sourceName()).isEqualTo("broken");
    }

    @Test
    void templateParseErrorsPointAtUnitLine() {
        final var condition = Conditions.expectFatal(
            FragmentParseErrorCondition.class,
            () -> UnitLoader.parse(Path.of("t.hy"), Path.of("t.h"), "a\nb\n{{{\n    x = = 1\n}}}\n")
        );
        Assertions.assertThat(condition.location()).isEqualTo(new SourceLocation("t.hy", 4));
    }

    @Test
    void rewritesFilteredForAndEcho() {
        Assertions.assertThat(SourceRewriter.rewrite("  for x in items if x > 1:\n    echo(\"{x}\", \",\")\n"))
            .isEqualTo("  for x in [(x) for x in items if x > 1]:\n    __emit__(locals(), \"{x}\", \",\")\n");
        Assertions.assertThat(SourceRewriter.rewrite("recho(1)\n")).isEqualTo("recho(1)\n");
    }
}
