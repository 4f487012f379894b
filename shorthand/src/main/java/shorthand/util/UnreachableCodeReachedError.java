// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package shorthand.util;

/**
 * Thrown when control flow reaches a point that the surrounding code guarantees to be unreachable.
 * <p>
 * This always indicates a bug, so it is an {@link AssertionError} rather than an exception.
 */
public final class UnreachableCodeReachedError extends AssertionError {
    public UnreachableCodeReachedError() {
        super("Execution reached a point expected to be unreachable");
    }

    public UnreachableCodeReachedError(final String message) {
        super(message);
    }

    public UnreachableCodeReachedError(final String message, final Throwable cause) {
        super(message, cause);
    }
}
