// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.generator;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.function.Predicate;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import scribe.unit.SourceNames;
import scribe.util.Trace;
import scribe.util.condition.ConditionContext;
import scribe.util.condition.FileAccessErrorCondition;

/**
 * Rewrites the line markers a C-style preprocessor leaves in its output, so that they point at unit sources rather
 * than at the generated files the preprocessor actually read.
 * <p>
 * A line marker is a line like {@code # 12 "out/src/list.h" 2} or {@code #line 12 "out/src/list.h"}. If the quoted
 * path lies under the output root, and the path relative to the root plus {@code y} names an existing source file,
 * the quoted path is replaced with that source path. Nothing else is changed.
 */
public final class LineMarkerAdjuster {
    /**
     * Creates an adjuster.
     *
     * @param outputRoot   The output root generated files were placed under.
     * @param sourceExists Tells whether a candidate source path names an existing unit source.
     */
    public LineMarkerAdjuster(final Path outputRoot, final Predicate<Path> sourceExists) {
        this.outputRoot = outputRoot.toAbsolutePath().normalize();
        this.sourceExists = sourceExists;
    }

    /**
     * Creates an adjuster that checks the file system for source files.
     */
    public static LineMarkerAdjuster forFileSystem(final Path outputRoot) {
        return new LineMarkerAdjuster(outputRoot, Files::isRegularFile);
    }

    /**
     * Rewrites the line markers of the given text.
     */
    @CheckReturnValue
    public String adjust(final String text) {
        return lineMarker.matcher(text).replaceAll(match -> Matcher.quoteReplacement(adjustMarker(match)));
    }

    /**
     * Rewrites the line markers of the given file in place, through the {@link Deployer}, so the file is only
     * touched if a marker actually changed.
     */
    public DeploymentResult adjustFile(final Path file) {
        try (final var trace = new Trace(() -> "Adjusting line markers in " + file)) {
            trace.use();
            final String text;
            try {
                text = Files.readString(file, StandardCharsets.UTF_8);
            } catch (final IOException e) {
                throw ConditionContext.error(new FileAccessErrorCondition(file, e));
            }
            return Deployer.deploy(file, adjust(text));
        }
    }

    private String adjustMarker(final MatchResult match) {
        final var original = match.group();
        final var path = match.group(2);
        final Path generated;
        try {
            generated = Path.of(path).toAbsolutePath().normalize();
        } catch (final InvalidPathException e) {
            return original;
        }
        if (!generated.startsWith(outputRoot) || generated.equals(outputRoot)) {
            return original;
        }
        final var source = Path.of(outputRoot.relativize(generated) + SourceNames.suffix);
        if (!sourceExists.test(source)) {
            return original;
        }
        return match.group(1) + source + match.group(3);
    }

    private static final Pattern lineMarker =
        Pattern.compile("^([ \\t]*#[ \\t]*(?:line[ \\t]+)?\\d+[ \\t]+\")([^\"\\n]*)(\".*)$", Pattern.MULTILINE);

    private final Path outputRoot;
    private final Predicate<Path> sourceExists;
}
