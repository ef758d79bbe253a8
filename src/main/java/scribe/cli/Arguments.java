// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.cli;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import scribe.unit.SourceNames;

/**
 * Parsed command line arguments.
 *
 * @param outputRoot  The directory template targets are placed under.
 * @param adjustMode  Whether to adjust line markers in the given files instead of generating.
 * @param files       The positional arguments: unit sources, or in adjust mode, files to adjust.
 * @param helpWanted  Whether usage help was asked for.
 */
record Arguments(Path outputRoot, boolean adjustMode, List<Path> files, boolean helpWanted) {
    Arguments {
        files = List.copyOf(files);
    }

    static Arguments parse(final String[] args) throws UsageException {
        var outputRoot = "";
        var adjustMode = false;
        var optionsEnded = false;
        final var files = new ArrayList<String>();
        for (var i = 0; i < args.length; i += 1) {
            final var arg = args[i];
            if (optionsEnded || !arg.startsWith("-") || arg.equals("-")) {
                files.add(arg);
                continue;
            }
            switch (arg) {
                case "--" -> optionsEnded = true;
                case "-h", "--help" -> {
                    return new Arguments(Path.of(""), false, List.of(), true);
                }
                case "--adjust" -> adjustMode = true;
                case "-d", "--outputdir" -> {
                    if (i + 1 >= args.length) {
                        throw new UsageException("Option " + arg + " requires an argument");
                    }
                    i += 1;
                    outputRoot = args[i];
                }
                default -> {
                    if (arg.startsWith("--outputdir=")) {
                        outputRoot = arg.substring("--outputdir=".length());
                    } else if (arg.startsWith("-d") && !arg.startsWith("--")) {
                        outputRoot = arg.substring(2);
                    } else {
                        throw new UsageException("No such option: " + arg);
                    }
                }
            }
        }
        if (files.isEmpty()) {
            throw new UsageException("No input files given");
        }
        final var paths = new ArrayList<Path>(files.size());
        for (final var file : files) {
            final var path = toPath(file);
            if (!adjustMode && !SourceNames.isAcceptable(path)) {
                throw new UsageException("Bad filename extension: " + file);
            }
            paths.add(path);
        }
        return new Arguments(toPath(outputRoot), adjustMode, paths, false);
    }

    private static Path toPath(final String text) throws UsageException {
        try {
            return Path.of(text);
        } catch (final InvalidPathException e) {
            throw new UsageException("Invalid path " + text + ": " + e.getReason());
        }
    }

    static final String usage = """
        Usage: scribe [options] FILE...

        Options:
          -h, --help            show this help message and exit
          -d DIR, --outputdir=DIR
                                output directory
          --adjust              rewrite preprocessor line markers in FILE... to point
                                at unit sources instead of generated files
        """;
}
