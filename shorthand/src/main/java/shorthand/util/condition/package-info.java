// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * A condition and restart system in the spirit of Common Lisp, reduced to what expansion and the REPL need.
 * <p>
 * Code that detects a problem <em>signals</em> a {@link shorthand.util.condition.Condition}. Handlers run before the
 * stack is unwound and decide where control goes next, usually by unwinding to a {@link
 * shorthand.util.condition.Restart} established further up the stack.
 */
package shorthand.util.condition;
