// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package shorthand.util.condition.exception;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import shorthand.util.condition.Condition;

/**
 * A condition wrapping an {@link IOException}, for I/O failures the program can only report.
 */
public final class IOExceptionCondition extends Condition {
    /**
     * Initializes a new condition representing the given exception.
     */
    public IOExceptionCondition(final IOException exception) {
        super(String.valueOf(exception.getMessage()));
        this.exception = exception;
    }

    @Override
    public String detailedMessage() {
        final var writer = new StringWriter();
        try (final var printWriter = new PrintWriter(writer)) {
            exception.printStackTrace(printWriter);
        }
        return writer.toString();
    }

    @Override
    public String toString() {
        return getClass().getName() + ": " + exception;
    }

    private final IOException exception;
}
