// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.unit;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;
import scribe.fragment.Parser;
import scribe.fragment.Program;
import scribe.fragment.SourceRewriter;
import scribe.util.Trace;
import scribe.util.condition.ConditionContext;
import scribe.util.condition.FileAccessErrorCondition;

/**
 * Turns source files into {@link Unit}s: segments them, parses their fragments and collects their symbols.
 */
public final class UnitLoader {
    private UnitLoader() {
    }

    /**
     * Reads and parses the unit at the given source path. Templates get their target under the given output root.
     * <p>
     * I/O errors are signaled as fatal {@link FileAccessErrorCondition}s, malformed fragments as fatal
     * {@link scribe.fragment.FragmentParseErrorCondition}s.
     */
    public static Unit load(final Path source, final Path outputRoot) {
        try (final var trace = new Trace(() -> "Loading unit " + source)) {
            trace.use();
            final String text;
            try {
                text = Files.readString(source, StandardCharsets.UTF_8);
            } catch (final IOException e) {
                throw ConditionContext.error(new FileAccessErrorCondition(source, e));
            }
            final var target = SourceNames.isCodeUnit(source) ? null : SourceNames.targetPath(source, outputRoot);
            return parse(source, target, text);
        }
    }

    /**
     * Parses unit text that has already been read.
     *
     * @param source The source path the text came from.
     * @param target The target path for a template, {@code null} for a code unit.
     * @param text   The unit text.
     */
    public static Unit parse(final Path source, final @Nullable Path target, final String text) {
        final var sourceName = source.toString();
        final var segments = (target == null)
            ? Segmenter.segmentCode(text)
            : Segmenter.segmentTemplate(text, sourceName);
        final var analyzer = new FragmentAnalyzer(source);
        final var blocks = new ArrayList<Block>(segments.size());
        for (final var segment : segments) {
            if (segment instanceof Segmenter.Segment.Literal literal) {
                blocks.add(new Block.Text(literal.content()));
                continue;
            }
            final var code = (Segmenter.Segment.Code) segment;
            final var rewritten = SourceRewriter.rewrite(code.source());
            final var program = code.isEmpty()
                ? new Program(sourceName, List.of())
                : Parser.parse(rewritten, sourceName, code.firstLine());
            analyzer.analyze(program);
            blocks.add(new Block.Fragment(rewritten, code.indentPrefix(), program));
        }
        return new Unit(source, target, blocks, analyzer.declaredSymbols(), analyzer.referencedNames());
    }
}
