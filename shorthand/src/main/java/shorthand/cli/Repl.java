// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package shorthand.cli;

import java.io.BufferedReader;
import java.io.IOException;
import shorthand.abbrev.Expansion;
import shorthand.util.Trace;
import shorthand.util.condition.ConditionContext;
import shorthand.util.condition.Unwind;
import shorthand.util.condition.exception.IOExceptionCondition;
import shorthand.workbench.Examples;
import shorthand.workbench.Session;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The interactive loop: every line is an abbreviation to expand, unless it starts with a colon.
 */
final class Repl {
    Repl(final BufferedReader input) {
        this.input = input;
    }

    void run() throws Unwind {
        printHelp();
        while (true) {
            final var line = readLine();
            if (line == null) {
                return;
            }
            if (line.isBlank()) {
                continue;
            }
            final var stripped = line.strip();
            if (!stripped.startsWith(":")) {
                // Not stripped: error offsets refer to the line as typed.
                expand(line);
                continue;
            }
            final var words = stripped.substring(1).strip().split("\\s+", 2);
            switch (words[0]) {
                case "q", "quit", "exit" -> {
                    return;
                }
                case "examples" -> listExamples();
                case "example" -> expandExample((words.length > 1) ? words[1] : "");
                case "copy" -> printLast(session.lastHtml());
                case "preview" -> printLast(session.previewDocument());
                case "help" -> printHelp();
                default -> unknownCommand(stripped);
            }
        }
    }

    private void expand(final String abbreviation) {
        final var expansion = session.update(abbreviation);
        try (final var streams = Streams.acquire()) {
            if (expansion instanceof final Expansion.Success success) {
                streams.out().println(success.html());
            } else if (expansion instanceof final Expansion.Failure failure) {
                streams.out().println("Error: " + failure.error().describe(abbreviation));
            }
        }
    }

    private void expandExample(final String number) {
        final var examples = Examples.all();
        final int index;
        try {
            index = Integer.parseInt(number.trim());
        } catch (final NumberFormatException e) {
            printMessage("Expected an example number between 1 and " + examples.size());
            return;
        }
        if (index < 1 || index > examples.size()) {
            printMessage("No example number " + index + ", expected 1 to " + examples.size());
            return;
        }
        final var abbreviation = examples.get(index - 1);
        printMessage(abbreviation);
        expand(abbreviation);
    }

    private static void listExamples() {
        try (final var streams = Streams.acquire()) {
            var index = 1;
            for (final var example : Examples.all()) {
                streams.out().println(" " + index + ". " + example);
                index += 1;
            }
        }
    }

    private static void printLast(final @Nullable String text) {
        printMessage((text != null) ? text : "Nothing to show, the last abbreviation didn't expand");
    }

    private static void printHelp() {
        printMessage("""
            Type an abbreviation to expand it, or one of the commands:
              :examples     list example abbreviations
              :example N    expand example number N
              :copy         print the last expanded markup again
              :preview      print the last expanded markup as a standalone document
              :help         show this message
              :quit         leave""");
    }

    private static void unknownCommand(final String command) {
        printMessage("Unknown command: " + command);
    }

    private static void printMessage(final String message) {
        try (final var streams = Streams.acquire()) {
            streams.out().println(message);
        }
    }

    private @Nullable String readLine() throws Unwind {
        try (final var trace = new Trace("Reading an abbreviation")) {
            trace.use();
            try (final var streams = Streams.acquire()) {
                streams.out().print("> ");
                streams.out().flush();
                try {
                    return input.readLine();
                } catch (final IOException e) {
                    throw ConditionContext.error(new IOExceptionCondition(e));
                }
            }
        }
    }

    private final BufferedReader input;
    private final Session session = new Session();
}
