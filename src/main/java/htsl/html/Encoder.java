// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htsl.html;

import java.util.List;
import htsl.sexp.Sexp;
import htsl.sexp.Sexps;

/**
 * The tree walker behind {@link Generator}, one instance per render call.
 * <p>
 * Besides the printer, the only state is whether the last thing written was an element that newline insertion
 * applied to, which suppresses the leading newline of a following newline element.
 */
final class Encoder {
    Encoder(final boolean insertNewlines, final Printer printer) {
        this.insertNewlines = insertNewlines;
        this.printer = printer;
    }

    void generate(final Sexp sexp) {
        if (sexp instanceof Sexp.String string) {
            printer.printEscaped(string.value(), Escaping.Escaper.TEXT);
            lastWasTag = false;
        } else if (sexp instanceof Sexp.Integer integer) {
            printer.printEscaped(integer.value().toString(), Escaping.Escaper.TEXT);
            lastWasTag = false;
        } else if (sexp instanceof Sexp.List list) {
            generateList(list.value());
        } else {
            lastWasTag = false;
        }
    }

    void generateAll(final Iterable<? extends Sexp> sexps) {
        for (final var sexp : sexps) {
            generate(sexp);
        }
    }

    private void generateList(final List<Sexp> elements) {
        if (elements.isEmpty()) {
            lastWasTag = false;
            return;
        }
        if (!(elements.get(0) instanceof Sexp.Symbol symbol) || Sexps.isNil(symbol)) {
            return;
        }
        final var rest = elements.subList(1, elements.size());
        final var directive = Directive.of(symbol);
        switch (directive) {
            case TAG -> {
                writeTag(symbol.symbolName(), rest);
                return;
            }
            case CDATA -> writeCdata(rest);
            case NO_ESCAPE -> writeNoEscape(rest);
            case INLINE_COMMENT -> writeInlineComment(rest);
            case BLOCK_COMMENT -> writeBlockComment(rest);
            case LIST_SPLICE -> generateAll(rest);
            case DOCTYPE -> writeDoctype(rest);
        }
        lastWasTag = false;
    }

    private void writeCdata(final List<Sexp> children) {
        printer.print("<![CDATA[");
        writeNoEscape(children);
        printer.print("]]>");
    }

    private void writeNoEscape(final List<Sexp> children) {
        for (final var child : children) {
            final var string = Sexps.asString(child);
            if (string != null) {
                printer.print(string);
            }
        }
    }

    private void writeInlineComment(final List<Sexp> items) {
        printer.print("<!--");
        for (final var item : items) {
            printer.print(' ');
            printer.print(Escaping.escapeComment(commentText(item)));
        }
        printer.print(" -->");
    }

    private void writeBlockComment(final List<Sexp> lines) {
        printer.print("<!--");
        for (final var line : lines) {
            printer.print('\n');
            printer.print(Escaping.escapeComment(commentText(line)));
        }
        printer.print("\n-->\n");
    }

    private void writeDoctype(final List<Sexp> children) {
        printer.print("<!DOCTYPE html>\n");
        generateAll(children);
    }

    private void writeTag(final String tagName, final List<Sexp> elements) {
        var children = elements;
        List<AttributeAssembler.AssembledAttribute> attributes = List.of();
        if (!elements.isEmpty()) {
            final var entries = AttributeAssembler.attributeEntries(elements.get(0));
            if (entries != null) {
                attributes = AttributeAssembler.assemble(entries);
                children = elements.subList(1, elements.size());
            }
        }
        if (HtmlTables.isIgnorableWhenEmpty(tagName) && allEmptyStrings(children)) {
            return;
        }

        final var withNewline = insertNewlines && HtmlTables.isNewlineTag(tagName);
        if (withNewline && (!lastWasTag || HtmlTables.isAlwaysBreakTag(tagName))) {
            printer.print('\n');
        }
        printer.print('<');
        printer.print(tagName);
        writeAttributes(attributes);
        printer.print('>');
        if (HtmlTables.isVoid(tagName)) {
            lastWasTag = withNewline;
            return;
        }

        generateAll(children);
        printer.print("</");
        printer.print(tagName);
        printer.print('>');
        if (withNewline) {
            printer.print('\n');
        }
        lastWasTag = withNewline;
    }

    private void writeAttributes(final List<AttributeAssembler.AssembledAttribute> attributes) {
        for (final var attribute : attributes) {
            printer.print(' ');
            printer.print(attribute.name());
            final var value = attribute.value();
            if (value != null) {
                printer.print("=\"");
                printer.printEscaped(attribute.category().prepare(value), Escaping.Escaper.ATTRIBUTE);
                printer.print('"');
            }
        }
    }

    private static boolean allEmptyStrings(final List<Sexp> children) {
        for (final var child : children) {
            if (!(child instanceof Sexp.String string) || !string.value().isEmpty()) {
                return false;
            }
        }
        return true;
    }

    // Comments show strings by their contents and anything else in its printed form.
    private static String commentText(final Sexp item) {
        final var string = Sexps.asString(item);
        return (string != null) ? string : Sexps.print(item);
    }

    private final boolean insertNewlines;
    private final Printer printer;
    // A render call starts as if right after a tag, so that output doesn't begin with a newline.
    private boolean lastWasTag = true;
}
