// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package shorthand.cli;

import shorthand.util.Trace;
import shorthand.util.condition.ConditionContext;
import shorthand.util.condition.HandlerProcedure;
import shorthand.util.condition.Restart;
import shorthand.util.condition.SignaledCondition;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The outermost handler: reports fatal conditions nobody else handled and aborts to the oldest restart.
 */
final class FallbackHandler implements HandlerProcedure {
    private FallbackHandler() {
    }

    static FallbackHandler instance() {
        return instance;
    }

    @Override
    public void handle(final SignaledCondition signaled) {
        if (!signaled.isFatal()) {
            return;
        }
        final var condition = signaled.condition();
        try (final var streams = Streams.acquire()) {
            final var err = streams.err();
            err.println("A fatal condition of type " + condition.getClass().getName() + " has been signaled.");
            err.println("\nDetailed message:");
            err.println(condition.detailedMessage().stripTrailing());
            err.println("\nOperation trace:");
            for (final var traceMessage : Trace.activeTraces()) {
                err.println(" - " + traceMessage);
            }
            err.println();
        }
        @Nullable Restart oldest = null;
        for (final var restart : ConditionContext.restarts()) {
            oldest = restart;
        }
        if (oldest == null) {
            throw new IllegalStateException("No restarts available");
        }
        oldest.unwindTo();
    }

    private static final FallbackHandler instance = new FallbackHandler();
}
