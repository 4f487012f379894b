// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package shorthand.cli;

import java.util.ArrayList;
import shorthand.abbrev.Expander;
import shorthand.abbrev.Expansion;
import shorthand.util.condition.ConditionContext;
import shorthand.util.condition.Handler;
import shorthand.workbench.PreviewDocument;

final class Main {
    private Main() {
    }

    public static void main(final String[] args) {
        System.exit(mainImpl(args).value);
    }

    static ExitCode mainImpl(final String[] args) {
        try (final var handler = new Handler(FallbackHandler.instance())) {
            handler.use();
            final var exitCode = ConditionContext.withRestart("abort-process", restart -> {
                if (args.length == 0) {
                    new Repl(Streams.standardInput()).run();
                    return ExitCode.SUCCESS;
                }
                return expandArguments(args);
            });
            return (exitCode != null) ? exitCode : ExitCode.ERROR;
        }
    }

    private static ExitCode expandArguments(final String[] args) {
        var preview = false;
        final var abbreviations = new ArrayList<String>();
        for (final var arg : args) {
            switch (arg) {
                case "--preview" -> preview = true;
                case "--help" -> {
                    printUsage(false);
                    return ExitCode.SUCCESS;
                }
                default -> {
                    if (arg.startsWith("--")) {
                        printUsage(true);
                        return ExitCode.USAGE;
                    }
                    abbreviations.add(arg);
                }
            }
        }
        if (abbreviations.isEmpty()) {
            printUsage(true);
            return ExitCode.USAGE;
        }

        var exitCode = ExitCode.SUCCESS;
        for (final var abbreviation : abbreviations) {
            final var expansion = Expander.expand(abbreviation);
            try (final var streams = Streams.acquire()) {
                if (expansion instanceof final Expansion.Success success) {
                    streams.out().println(preview ? PreviewDocument.wrap(success.html()) : success.html());
                } else if (expansion instanceof final Expansion.Failure failure) {
                    streams.err().println(failure.error().describe(abbreviation));
                    exitCode = ExitCode.ERROR;
                }
            }
        }
        return exitCode;
    }

    private static void printUsage(final boolean toStandardError) {
        try (final var streams = Streams.acquire()) {
            final var stream = toStandardError ? streams.err() : streams.out();
            stream.println("Usage: shorthand [--preview] <abbreviation>...");
            stream.println("       shorthand            (interactive mode)");
        }
    }

    enum ExitCode {
        SUCCESS(0),
        ERROR(1),
        USAGE(64);

        ExitCode(final int value) {
            this.value = value;
        }

        private final int value;
    }
}
