// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.unit;

import java.nio.file.Path;

/**
 * The naming convention of unit sources: a source name has an extension ending in {@code y}, and the target of a
 * template is the source path without that final letter. A source whose extension is just {@code .y} is a code
 * unit.
 */
public final class SourceNames {
    private SourceNames() {
    }

    /**
     * Checks whether the given path follows the naming convention of unit sources.
     */
    public static boolean isAcceptable(final Path source) {
        final var name = baseName(source);
        return name.indexOf('.') >= 0 && name.endsWith(suffix);
    }

    /**
     * Checks whether the given source is a code unit, i.e. has no target.
     */
    public static boolean isCodeUnit(final Path source) {
        return baseName(source).endsWith("." + suffix);
    }

    /**
     * Computes the target of the given template source: the source path minus its last character, under the given
     * output root.
     */
    public static Path targetPath(final Path source, final Path outputRoot) {
        final var sourceText = source.toString();
        return outputRoot.resolve(sourceText.substring(0, sourceText.length() - 1));
    }

    private static String baseName(final Path path) {
        final var fileName = path.getFileName();
        return (fileName == null) ? "" : fileName.toString();
    }

    /**
     * The letter every source name ends with.
     */
    public static final String suffix = "y";
}
