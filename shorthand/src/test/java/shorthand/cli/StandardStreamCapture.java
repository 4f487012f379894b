// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package shorthand.cli;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Redirects standard output and standard error into memory until closed.
 */
final class StandardStreamCapture implements AutoCloseable {
    StandardStreamCapture() {
        System.setOut(new PrintStream(capturedOut, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(capturedErr, true, StandardCharsets.UTF_8));
    }

    String out() {
        System.out.flush();
        return normalize(capturedOut);
    }

    String err() {
        System.err.flush();
        return normalize(capturedErr);
    }

    @Override
    public void close() {
        System.setOut(savedOut);
        System.setErr(savedErr);
    }

    private static String normalize(final ByteArrayOutputStream stream) {
        return stream.toString(StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    private final PrintStream savedOut = System.out;
    private final PrintStream savedErr = System.err;
    private final ByteArrayOutputStream capturedOut = new ByteArrayOutputStream();
    private final ByteArrayOutputStream capturedErr = new ByteArrayOutputStream();
}
