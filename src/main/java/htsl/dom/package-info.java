// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * A minimal HTML DOM and its conversion into S-expressions the {@link htsl.html.Generator} can render.
 */
@NonNullByDefault
package htsl.dom;

import htsl.util.annotation.NonNullByDefault;
