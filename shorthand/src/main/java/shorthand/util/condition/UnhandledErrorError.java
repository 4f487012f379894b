// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package shorthand.util.condition;

/**
 * Thrown by {@link ConditionContext#error(Condition)} when every handler declined a fatal condition.
 * <p>
 * Reaching this means some caller forgot to establish a handler, which is a bug.
 */
public final class UnhandledErrorError extends AssertionError {
    UnhandledErrorError(final Condition condition) {
        super("Fatal condition signaled, but no condition handler unwound; condition: " + condition);
    }
}
