// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package shorthand.abbrev;

import shorthand.util.condition.Condition;

/**
 * A condition type indicating that an abbreviation could not be parsed.
 */
public final class AbbreviationErrorCondition extends Condition {
    AbbreviationErrorCondition(final AbbreviationError error, final String abbreviation) {
        super(error.message());
        this.error = error;
        this.abbreviation = abbreviation;
    }

    /**
     * Retrieves the error value carried by this condition.
     */
    public AbbreviationError error() {
        return error;
    }

    @Override
    public String detailedMessage() {
        return error.describe(abbreviation);
    }

    private final AbbreviationError error;
    private final String abbreviation;
}
