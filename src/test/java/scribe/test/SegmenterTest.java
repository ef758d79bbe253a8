// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.test;

import java.util.List;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;
import scribe.fragment.FragmentParseErrorCondition;
import scribe.unit.Segmenter;
import scribe.unit.Segmenter.Segment;

final class SegmenterTest {
    @Test
    void splitsLiteralTextAndFragments() {
        final var segments = Segmenter.segmentTemplate("a\n{{{ x = 1 }}}\nb\n", "test.hy");
        Assertions.assertThat(segments).containsExactly(
            new Segment.Literal("a\n"),
            new Segment.Code("if True:\n    x = 1 ", "", 1, false),
            new Segment.Literal("\nb\n")
        );
    }

    @Test
    void normalizesIndentPrefixKeepingTabs() {
        final var segments = Segmenter.segmentTemplate("\t\tfoo {{{ x = 1 }}}", "test.hy");
        final var code = (Segment.Code) segments.get(1);
        Assertions.assertThat(code.indentPrefix()).isEqualTo("\t\t    ");
        Assertions.assertThat(code.source()).isEqualTo("if True:\n\t\t        x = 1 ");
    }

    @Test
    void firstCloseMarkerEndsFragment() {
        final var segments = Segmenter.segmentTemplate("{{{ s = '}}}' }}}", "test.hy");
        Assertions.assertThat(segments).hasSize(2);
        Assertions.assertThat(((Segment.Code) segments.get(0)).source()).isEqualTo("if True:\n    s = '");
        Assertions.assertThat(segments.get(1)).isEqualTo(new Segment.Literal("' }}}"));
    }

    @Test
    void nestedOpenMarkerIsFragmentText() {
        final var segments = Segmenter.segmentTemplate("{{{ s = '{{{' }}}", "test.hy");
        Assertions.assertThat(segments).containsExactly(new Segment.Code("if True:\n    s = '{{{' ", "", 0, false));
    }

    @Test
    void blankFragmentIsEmptyButKeepsLineBreaks() {
        final var segments = Segmenter.segmentTemplate("{{{\n   \n}}}", "test.hy");
        Assertions.assertThat(segments).containsExactly(new Segment.Code("if True:\n\n\n", "", 0, true));
    }

    @Test
    void multilineFragmentKeepsLineStructure() {
        final var segments = Segmenter.segmentTemplate("x\n{{{\n    a = 1\n\n    b = 2\n}}}\n", "test.hy");
        Assertions.assertThat(segments).containsExactly(
            new Segment.Literal("x\n"),
            new Segment.Code("if True:\n\n    a = 1\n\n    b = 2\n", "", 1, false),
            new Segment.Literal("\n")
        );
    }

    @Test
    void unterminatedFragmentIsParseError() {
        final var condition = Conditions.expectFatal(
            FragmentParseErrorCondition.class,
            () -> Segmenter.segmentTemplate("a\n{{{ x = 1\n", "broken.hy")
        );
        Assertions.assertThat(condition.location().sourceName()).isEqualTo("broken.hy");
        Assertions.assertThat(condition.location().lineNumber()).isEqualTo(2);
    }

    @Test
    void codeUnitIsSingleFragment() {
        Assertions.assertThat(Segmenter.segmentCode("X = 1\n{{{ not a marker }}}\n"))
            .isEqualTo(List.of(new Segment.Code("X = 1\n{{{ not a marker }}}\n", null, 1, false)));
    }
}
