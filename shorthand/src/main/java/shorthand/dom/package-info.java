// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The element tree produced by the abbreviation parser, and its serialization to indented HTML.
 */
package shorthand.dom;
