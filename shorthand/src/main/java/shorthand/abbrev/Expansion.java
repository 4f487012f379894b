// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package shorthand.abbrev;

import java.util.List;
import shorthand.dom.Node;

/**
 * The outcome of expanding one abbreviation.
 */
public sealed interface Expansion {
    /**
     * A successful expansion.
     *
     * @param html  The serialized markup.
     * @param nodes The parsed forest the markup was serialized from.
     */
    record Success(String html, List<Node> nodes) implements Expansion {
        public Success {
            nodes = List.copyOf(nodes);
        }
    }

    /**
     * A failed expansion. Nothing was produced.
     *
     * @param error Why the abbreviation was rejected.
     */
    record Failure(AbbreviationError error) implements Expansion {
    }
}
