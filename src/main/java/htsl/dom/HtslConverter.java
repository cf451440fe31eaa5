// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htsl.dom;

import java.util.ArrayList;
import java.util.List;
import htsl.sexp.Sexp;
import htsl.sexp.Sexps;
import htsl.sexp.SymbolTable;
import htsl.util.Trace;
import htsl.util.annotation.Nullable;
import htsl.util.condition.ConditionContext;
import htsl.util.condition.UnhandledErrorError;

/**
 * The HTSL converter: turns DOM trees into HTSL forms.
 * <p>
 * <dfn>HTSL</dfn>, <dfn>Hypertext S-expression Language</dfn>, is the HTML-as-sexps representation rendered by
 * {@link htsl.html.Generator}.
 */
public final class HtslConverter {
    /**
     * Initializes a new HTSL converter that interns element and attribute names into the given symbol table.
     */
    public HtslConverter(final SymbolTable symbolTable) {
        this.symbolTable = symbolTable;
    }

    /**
     * Converts the given DOM node into an S-expression.
     * <ul>
     * <li>{@code null} becomes {@code nil}.
     * <li>Text becomes a string.
     * <li>Raw markup becomes {@code (@H "markup")}.
     * <li>A comment becomes {@code (@@@ "comment")}.
     * <li>An element becomes {@code (name ((attribute . "value") ...) children ...)}, the attribute list being left
     * out if there are no attributes.
     * </ul>
     * Element and attribute names are stripped of surrounding whitespace. If a name is empty afterwards, a fatal
     * {@link HtslConversionErrorCondition} is signaled.
     */
    public Sexp convert(final @Nullable Node node) {
        if (node == null) {
            return Sexp.KnownSymbol.NIL;
        }
        if (node instanceof Node.Text text) {
            return Sexps.string(text.text());
        } else if (node instanceof Node.Raw raw) {
            return Sexps.list(Sexp.KnownSymbol.NO_ESCAPE, Sexps.string(raw.data()));
        } else if (node instanceof Node.Comment comment) {
            return Sexps.list(Sexp.KnownSymbol.BLOCK_COMMENT, Sexps.string(comment.data()));
        } else {
            return convertElement((Node.Element) node);
        }
    }

    private Sexp convertElement(final Node.Element element) {
        try (final var trace = new Trace(() -> "Converting DOM element '" + element.name() + "' into HTSL")) {
            trace.use();
            final var forms = new ArrayList<Sexp>(element.children().size() + 2);
            forms.add(makeSymbol(element.name(), "element"));
            if (!element.attributes().isEmpty()) {
                forms.add(convertAttributes(element.attributes()));
            }
            for (final var child : element.children()) {
                forms.add(convert(child));
            }
            return Sexps.list(forms);
        }
    }

    private Sexp convertAttributes(final List<Attribute> attributes) {
        final var pairs = new ArrayList<Sexp>(attributes.size());
        for (final var attribute : attributes) {
            final var name = makeSymbol(attribute.name(), "attribute");
            pairs.add(Sexps.cons(name, Sexps.string(attribute.value())));
        }
        return Sexps.list(pairs);
    }

    private Sexp.Symbol makeSymbol(final String name, final String kind) {
        final var stripped = name.strip();
        if (stripped.isEmpty()) {
            throw signalError("empty symbol string: " + kind + " name '" + name + "' is blank");
        }
        return symbolTable.intern(stripped);
    }

    private static UnhandledErrorError signalError(final String message) {
        throw ConditionContext.error(new HtslConversionErrorCondition(message));
    }

    private final SymbolTable symbolTable;
}
