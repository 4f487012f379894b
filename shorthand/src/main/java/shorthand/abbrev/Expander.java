// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package shorthand.abbrev;

import shorthand.dom.Serializer;
import shorthand.util.Trace;
import shorthand.util.UnreachableCodeReachedError;
import shorthand.util.condition.ConditionContext;
import shorthand.util.condition.Handler;
import shorthand.util.condition.HandlerProcedure;
import shorthand.util.condition.Restart;
import shorthand.util.condition.SignaledCondition;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The expansion entry point: parses an abbreviation and serializes the resulting tree.
 */
public final class Expander {
    private Expander() {
    }

    /**
     * Expands the given abbreviation into indented HTML.
     * <p>
     * Malformed input never escapes as an exception: the {@link AbbreviationErrorCondition} signaled by the parser is
     * handled here by unwinding to an {@code abort-expansion} restart, and reported as an {@link Expansion.Failure}.
     * Other fatal conditions are left to outer handlers.
     */
    public static Expansion expand(final String abbreviation) {
        try (final var trace = new Trace(() -> "Expanding abbreviation " + abbreviation)) {
            trace.use();
            final var capture = new FailureCapture();
            final var success = ConditionContext.withRestart("abort-expansion", restart -> {
                capture.restart = restart;
                try (final var handler = new Handler(capture)) {
                    handler.use();
                    final var nodes = new AbbreviationParser(abbreviation).parse();
                    return new Expansion.Success(Serializer.toHtml(nodes), nodes);
                }
            });
            if (success != null) {
                return success;
            }
            final var error = capture.error;
            if (error == null) {
                throw new UnreachableCodeReachedError("Unwound to abort-expansion without a captured error");
            }
            return new Expansion.Failure(error);
        }
    }

    private static final class FailureCapture implements HandlerProcedure {
        @Override
        public void handle(final SignaledCondition signaled) {
            final var currentRestart = restart;
            if (signaled.isFatal()
                && signaled.condition() instanceof final AbbreviationErrorCondition condition
                && currentRestart != null) {
                error = condition.error();
                currentRestart.unwindTo();
            }
        }

        private @Nullable Restart restart = null;
        private @Nullable AbbreviationError error = null;
    }
}
