// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htsl.html;

import java.util.Set;

/**
 * Static classification of HTML element and attribute names.
 */
final class HtmlTables {
    private HtmlTables() {
    }

    /**
     * Returns {@code true} iff the element has no closing tag and no content.
     */
    static boolean isVoid(final String tagName) {
        return voidElements.contains(tagName);
    }

    /**
     * Returns {@code true} iff the element is surrounded by newlines when newline insertion is enabled.
     */
    static boolean isNewlineTag(final String tagName) {
        return newlineTags.contains(tagName);
    }

    /**
     * Returns {@code true} iff the element gets a leading newline even directly after another newline tag.
     */
    static boolean isAlwaysBreakTag(final String tagName) {
        return alwaysBreakTags.contains(tagName);
    }

    /**
     * Returns {@code true} iff the element is dropped altogether when it has no content besides empty strings.
     */
    static boolean isIgnorableWhenEmpty(final String tagName) {
        return ignorableWhenEmptyTags.contains(tagName);
    }

    /**
     * Returns {@code true} iff the attribute is known to hold a URL.
     */
    static boolean isUrlAttribute(final String attributeName) {
        return urlAttributes.contains(attributeName);
    }

    // https://html.spec.whatwg.org/multipage/syntax.html#void-elements
    private static final Set<String> voidElements = Set.of(
        "area", "base", "br", "col", "embed", "hr", "img", "input", "link", "meta", "source", "track", "wbr"
    );
    private static final Set<String> alwaysBreakTags = Set.of("head", "link", "meta", "title", "div");
    private static final Set<String> newlineTags = Set.of(
        "head", "link", "meta", "title", "script", "body",
        "article", "details", "div", "header", "footer", "form", "main", "summary",
        "h1", "h2", "h3", "h4", "h5", "h6",
        "li", "ol", "ul", "dd", "dt", "dl",
        "table", "thead", "tbody", "tr",
        "section", "input"
    );
    private static final Set<String> ignorableWhenEmptyTags = Set.of("div", "span", "code", "kbd", "p", "samp");
    // https://html.spec.whatwg.org/multipage/indices.html#attributes-1
    private static final Set<String> urlAttributes = Set.of(
        "action", "cite", "data", "formaction", "href", "itemid", "itemprop", "itemtype", "ping", "poster", "src"
    );
}
