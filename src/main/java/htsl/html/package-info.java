// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The HTML generator: renders S-expression trees into HTML text with context-sensitive escaping.
 * <p>
 * A tree is a list headed by a tag symbol, optionally followed by an attribute list, followed by children:
 * {@code (a (@ (href . "https://example.com")) "text")}. Symbols whose name starts with {@code @} select special
 * rendering instead of a tag, see {@link htsl.html.Directive}.
 */
@NonNullByDefault
package htsl.html;

import htsl.util.annotation.NonNullByDefault;
