// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package shorthand.dom;

import java.util.ArrayList;
import java.util.List;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;

/**
 * A utility class containing operations on lists of attributes.
 */
public final class Attributes {
    private Attributes() {
    }

    /**
     * Returns a new list of attributes with the given attribute set.
     * <p>
     * If an attribute with the same name is already present, it is replaced in place, so the position of the first
     * occurrence is kept and the last value wins. Otherwise, the attribute is appended.
     */
    @CheckReturnValue
    public static List<Attribute> updated(final List<Attribute> attributes, final Attribute attribute) {
        final var result = new ArrayList<>(attributes);
        final var name = attribute.name();
        for (final var it = result.listIterator(); it.hasNext(); ) {
            if (name.equals(it.next().name())) {
                it.set(attribute);
                return result;
            }
        }
        result.add(attribute);
        return result;
    }
}
