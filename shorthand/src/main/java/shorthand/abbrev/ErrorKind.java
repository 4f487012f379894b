// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package shorthand.abbrev;

/**
 * The ways an abbreviation can be malformed.
 */
public enum ErrorKind {
    EMPTY_ABBREVIATION,
    UNEXPECTED_CHARACTER,
    UNEXPECTED_END,
    UNCLOSED_GROUP,
    UNCLOSED_ATTRIBUTE_SET,
    UNCLOSED_TEXT,
    UNCLOSED_QUOTE,
    DUPLICATE_ID,
    INVALID_MULTIPLIER,
    EXPECTED_ATTRIBUTE_VALUE,
    EXPECTED_IDENTIFIER,
    NESTING_TOO_DEEP,
    EXPANSION_TOO_LARGE,
}
