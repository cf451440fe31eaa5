// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Small utilities shared by the rest of htsl.
 */
@NonNullByDefault
package htsl.util;

import htsl.util.annotation.NonNullByDefault;
