// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package shorthand.abbrev;

import java.util.OptionalInt;

/**
 * A description of why an abbreviation could not be expanded.
 *
 * @param kind     What went wrong.
 * @param message  A user-readable message.
 * @param position The 0-based offset of the offending character, if there is one.
 */
public record AbbreviationError(ErrorKind kind, String message, OptionalInt position) {
    /**
     * Returns the message, followed by the abbreviation and a caret under the offending character if the position is
     * known.
     */
    public String describe(final String abbreviation) {
        if (position.isEmpty()) {
            return message;
        }
        final var offset = position.getAsInt();
        return message + " at offset " + offset + '\n' + abbreviation + '\n' + " ".repeat(offset) + '^';
    }

    @Override
    public String toString() {
        return position.isPresent() ? (message + " at offset " + position.getAsInt()) : message;
    }
}
