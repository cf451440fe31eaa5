// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htsl.dom;

import java.util.List;

/**
 * The base interface for DOM tree nodes.
 * <p>
 * DOM tree nodes are guaranteed to be immutable.
 */
public sealed interface Node {
    /**
     * Returns a new DOM element node with the given name, attributes and children.
     */
    static Element element(final String name, final List<Attribute> attributes, final Node... children) {
        return new Element(name, attributes, List.of(children));
    }

    /**
     * Returns a new DOM element node with the given name and children and no attributes.
     */
    static Element simple(final String name, final Node... children) {
        return new Element(name, List.of(), List.of(children));
    }

    /**
     * DOM node representing text, to be escaped when rendered.
     */
    record Text(String text) implements Node {
    }

    /**
     * DOM node representing markup to be rendered verbatim.
     */
    record Raw(String data) implements Node {
    }

    /**
     * DOM node representing a comment.
     */
    record Comment(String data) implements Node {
    }

    /**
     * DOM node representing an HTML element, with optional attributes and optional children.
     */
    record Element(String name, List<Attribute> attributes, List<Node> children) implements Node {
        public Element {
            attributes = List.copyOf(attributes);
            children = List.copyOf(children);
        }
    }
}
