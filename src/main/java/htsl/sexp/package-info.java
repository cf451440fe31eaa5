// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Representation of S-expressions as Java objects.
 * <p>
 * This is the tree model the HTML generator consumes: strings, integers, symbols and lists, with {@code nil} standing
 * for the empty list.
 */
@NonNullByDefault
package htsl.sexp;

import htsl.util.annotation.NonNullByDefault;
