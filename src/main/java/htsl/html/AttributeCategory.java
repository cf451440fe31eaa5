// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htsl.html;

/**
 * How the value of an attribute is escaped before the attribute value escaping proper.
 * <p>
 * {@link #CSS} and {@link #SCRIPT} values are currently treated like {@link #PLAIN} ones.
 */
public enum AttributeCategory {
    PLAIN,
    URL,
    CSS,
    SCRIPT;

    /**
     * Classifies the attribute with the given name.
     * <p>
     * A {@code data-} prefix or a namespace prefix is ignored, except that every attribute in the {@code xmlns}
     * namespace holds a URL. Besides the attributes known to hold URLs, names containing {@code url}, {@code uri},
     * {@code src} or {@code doi} are assumed to hold one too. {@code style} holds CSS and names starting with
     * {@code on} hold scripts.
     */
    public static AttributeCategory of(final String attributeName) {
        var name = attributeName;
        if (name.startsWith(dataPrefix)) {
            name = name.substring(dataPrefix.length());
        } else {
            final var colon = name.indexOf(':');
            if (colon >= 0) {
                if ("xmlns".equals(name.substring(0, colon))) {
                    return URL;
                }
                name = name.substring(colon + 1);
            }
        }

        if (HtmlTables.isUrlAttribute(name)) {
            return URL;
        }
        if ("style".equals(name)) {
            return CSS;
        }
        if (name.startsWith("on")) {
            return SCRIPT;
        }
        if (name.contains("url") || name.contains("uri") || name.contains("src") || name.contains("doi")) {
            return URL;
        }
        return PLAIN;
    }

    /**
     * Applies the escaping specific to this category to an attribute value.
     */
    String prepare(final String value) {
        return (this == URL) ? Escaping.escapeUrl(value) : value;
    }

    private static final String dataPrefix = "data-";
}
