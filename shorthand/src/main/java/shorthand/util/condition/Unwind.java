// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package shorthand.util.condition;

/**
 * The throwable that carries control from {@link Restart#unwindTo()} to the restart point.
 * <p>
 * Public only so that methods can declare {@code throws Unwind}; do not catch or throw it by hand. It extends
 * {@link Throwable} directly because it is neither an error nor an exceptional situation, just control flow.
 */
@SuppressWarnings("ExtendsThrowable")
public final class Unwind extends Throwable {
    Unwind(final Restart target) {
        super("Unwinding to a restart point", null, false, false);
        this.target = target;
    }

    Restart target() {
        return target;
    }

    private final transient Restart target;
}
