// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * A condition and restart system modeled after Common Lisp's.
 * <p>
 * Fatal problems, such as malformed S-expression source or a DOM node that cannot be converted, are signaled as
 * conditions. Handlers run before the stack is unwound and decide where control goes, usually to a restart.
 */
@NonNullByDefault
package htsl.util.condition;

import htsl.util.annotation.NonNullByDefault;
