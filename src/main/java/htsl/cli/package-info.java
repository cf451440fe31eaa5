// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The {@code htsl} command line tool, which renders S-expression files as HTML on standard output.
 */
@NonNullByDefault
package htsl.cli;

import htsl.util.annotation.NonNullByDefault;
