// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The S-expression reader, turning UTF-8 source text into {@link htsl.sexp.Sexp} objects.
 */
@NonNullByDefault
package htsl.sexp.reader;

import htsl.util.annotation.NonNullByDefault;
