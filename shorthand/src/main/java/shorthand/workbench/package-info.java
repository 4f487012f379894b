// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The pieces of an interactive abbreviation workbench that don't depend on a particular user interface: the current
 * session, the example abbreviations and the standalone preview document.
 */
package shorthand.workbench;
