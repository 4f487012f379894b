// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Small utilities shared by the parser, the renderer and the command line interface.
 */
package shorthand.util;
