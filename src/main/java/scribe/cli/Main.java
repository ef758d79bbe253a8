// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.cli;

import java.nio.file.Path;
import scribe.generator.DeploymentResult;
import scribe.generator.Generator;
import scribe.generator.LineMarkerAdjuster;
import scribe.util.condition.ConditionContext;
import scribe.util.condition.Handler;

/**
 * The program entry point.
 */
public final class Main {
    private Main() {
    }

    public static void main(final String[] args) {
        System.exit(run(args));
    }

    /**
     * Runs the program with the given arguments, returning the process exit code instead of exiting.
     */
    public static int run(final String[] args) {
        return runImpl(args).value;
    }

    private static ExitCode runImpl(final String[] args) {
        final Arguments arguments;
        try {
            arguments = Arguments.parse(args);
        } catch (final UsageException e) {
            Streams.printUsage(Arguments.usage, String.valueOf(e.getMessage()));
            return ExitCode.USAGE;
        }
        if (arguments.helpWanted()) {
            Streams.printHelp(Arguments.usage);
            return ExitCode.SUCCESS;
        }

        try (final var handler = new Handler(FallbackHandler.instance())) {
            handler.use();
            final var exitCode = ConditionContext.withRestart(FallbackHandler.abortRestartName, restart -> {
                if (arguments.adjustMode()) {
                    adjust(arguments);
                } else {
                    new Generator(arguments.outputRoot(), Main::reportChange).generate(arguments.files());
                }
                return ExitCode.SUCCESS;
            });
            return (exitCode != null) ? exitCode : ExitCode.ERROR;
        }
    }

    private static void adjust(final Arguments arguments) {
        final var adjuster = LineMarkerAdjuster.forFileSystem(arguments.outputRoot());
        for (final var file : arguments.files()) {
            final var result = adjuster.adjustFile(file);
            if (result.isChange()) {
                reportChange(result, file);
            }
        }
    }

    private static void reportChange(final DeploymentResult result, final Path target) {
        Streams.printStatus(result.statusLine(target));
    }

    private enum ExitCode {
        SUCCESS(0),
        ERROR(1),
        USAGE(64);

        ExitCode(final int value) {
            this.value = value;
        }

        private final int value;
    }
}
