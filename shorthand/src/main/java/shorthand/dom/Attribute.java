// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package shorthand.dom;

/**
 * A typed representation of an element's attribute.
 */
public sealed interface Attribute {
    /**
     * Returns a new flag attribute: present, but without a value.
     */
    static Flag flag(final String name) {
        return new Flag(name);
    }

    /**
     * Returns a new attribute with a string value.
     */
    static Value of(final String name, final String value) {
        return new Value(name, value);
    }

    /**
     * Retrieves the name of this attribute.
     */
    String name();

    /**
     * An attribute that is serialized as its bare name, such as {@code disabled}.
     */
    record Flag(String name) implements Attribute {
    }

    /**
     * An attribute serialized as {@code name="value"}.
     * <p>
     * The value may contain numbering placeholders until the element is numbered.
     */
    record Value(String name, String value) implements Attribute {
    }
}
