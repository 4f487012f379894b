// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Abbreviation parsing and expansion.
 * <p>
 * An <dfn>abbreviation</dfn> is a compact description of an element tree, such as {@code ul>li.item$*3}. The entry
 * point is {@link shorthand.abbrev.Expander#expand(String)}.
 */
package shorthand.abbrev;
