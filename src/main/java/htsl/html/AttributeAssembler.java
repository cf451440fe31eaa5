// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htsl.html;

import java.util.HashSet;
import java.util.List;
import java.util.TreeMap;
import htsl.sexp.Sexp;
import htsl.sexp.Sexps;
import htsl.util.annotation.Nullable;

/**
 * Turns the attribute list of an element into the attributes to write.
 * <p>
 * Each entry of the list is {@code (name)}, {@code (name value)} or {@code (name . value)}:
 * <ul>
 * <li>The first entry with a given name wins, later ones are ignored.
 * <li>If the winning entry's value is {@code nil}, the attribute is deleted.
 * <li>An entry without a value produces an attribute without a value, like {@code checked}.
 * <li>Strings, symbols and integers are accepted as values; entries with other values are dropped.
 * <li>Values are stripped of leading and trailing whitespace.
 * </ul>
 * Entries that don't fit that shape are dropped. The result is sorted by attribute name.
 */
final class AttributeAssembler {
    private AttributeAssembler() {
    }

    /**
     * Returns the entries of the attribute list, if the given first child after a tag symbol is an attribute list, or
     * {@code null} otherwise.
     * <p>
     * Only the shape tells an attribute list apart: it's either headed by the attribute marker symbol {@code @}, or
     * is a list whose first element is itself a list or a pair.
     */
    static @Nullable List<Sexp> attributeEntries(final Sexp firstChild) {
        final var head = Sexps.head(firstChild);
        if (head == null) {
            return null;
        }
        if (Sexps.isSymbol(head, Sexp.KnownSymbol.ATTRIBUTES)) {
            return Sexps.tail(firstChild);
        }
        if (head instanceof Sexp.List || head instanceof Sexp.DottedPair) {
            return Sexps.asList(firstChild);
        }
        return null;
    }

    static List<AssembledAttribute> assemble(final List<Sexp> entries) {
        final var claimedNames = new HashSet<String>();
        final var attributes = new TreeMap<String, AssembledAttribute>();
        for (final var entry : entries) {
            final Sexp key;
            final @Nullable Sexp value;
            if (entry instanceof Sexp.DottedPair pair) {
                key = pair.car();
                value = pair.cdr();
            } else if (entry instanceof Sexp.List list && !list.value().isEmpty()) {
                final var elements = list.value();
                key = elements.get(0);
                value = (elements.size() > 1) ? elements.get(1) : null;
            } else {
                continue;
            }

            final var name = attributeName(key);
            if (name == null || !claimedNames.add(name)) {
                continue;
            }
            if (value == null) {
                attributes.put(name, new AssembledAttribute(name, null, AttributeCategory.PLAIN));
                continue;
            }
            final var text = attributeText(value);
            if (text != null) {
                attributes.put(name, new AssembledAttribute(name, text.strip(), AttributeCategory.of(name)));
            }
        }
        return List.copyOf(attributes.values());
    }

    private static @Nullable String attributeName(final Sexp key) {
        if (!(key instanceof Sexp.Symbol symbol) || Sexps.isNil(symbol)) {
            return null;
        }
        final var name = symbol.symbolName();
        return name.isEmpty() ? null : name;
    }

    // Returns null both for nil, which deletes the attribute, and for values of unsupported types.
    private static @Nullable String attributeText(final Sexp value) {
        if (Sexps.isNil(value)) {
            return null;
        } else if (value instanceof Sexp.String string) {
            return string.value();
        } else if (value instanceof Sexp.Symbol symbol) {
            return symbol.symbolName();
        } else if (value instanceof Sexp.Integer integer) {
            return integer.value().toString();
        } else {
            return null;
        }
    }

    /**
     * An attribute ready to be written.
     *
     * @param name     The attribute name.
     * @param value    The stripped value, or {@code null} for an attribute without a value.
     * @param category The category deciding the additional escaping of the value.
     */
    record AssembledAttribute(String name, @Nullable String value, AttributeCategory category) {
    }
}
