// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htsl.html;

import java.io.StringWriter;
import java.io.Writer;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import htsl.sexp.Sexp;

/**
 * The S-expression-to-HTML generator.
 * <p>
 * Strings are written as escaped text, integers in decimal, and lists headed by a symbol as elements or
 * {@linkplain Directive directives}. Anything else produces no output. The generator never rejects a tree: parts
 * that don't fit are silently dropped.
 * <p>
 * Instances are immutable and can be shared between threads. Every render call has its own state.
 */
public final class Generator {
    /**
     * Initializes a new generator that doesn't insert any newlines.
     */
    public Generator() {
        this(false);
    }

    private Generator(final boolean insertNewlines) {
        this.insertNewlines = insertNewlines;
    }

    /**
     * Returns a generator like this one, except that it inserts newlines around structural elements such as
     * {@code head}, {@code div} or {@code li}, making the output easier to read.
     */
    @CheckReturnValue
    public Generator withNewlines() {
        return new Generator(true);
    }

    /**
     * Returns {@code true} iff this generator inserts newlines around structural elements.
     */
    public boolean insertsNewlines() {
        return insertNewlines;
    }

    /**
     * Renders the given tree as HTML to the given writer.
     * <p>
     * If the writer throws, nothing more is written, and the first exception is returned in the result rather than
     * thrown. The writer is neither flushed nor closed.
     */
    public RenderResult renderTree(final Writer writer, final Sexp tree) {
        final var printer = new Printer(writer);
        new Encoder(insertNewlines, printer).generate(tree);
        return new RenderResult(printer.length(), printer.error());
    }

    /**
     * Renders the given trees one after another, as if they were the children of a single list splice.
     * <p>
     * Errors are reported like in {@link #renderTree(Writer, Sexp)}.
     */
    public RenderResult renderList(final Writer writer, final Iterable<? extends Sexp> trees) {
        final var printer = new Printer(writer);
        new Encoder(insertNewlines, printer).generateAll(trees);
        return new RenderResult(printer.length(), printer.error());
    }

    /**
     * Renders the given tree as an HTML string.
     */
    public String renderToString(final Sexp tree) {
        final var writer = new StringWriter();
        renderTree(writer, tree);
        return writer.toString();
    }

    /**
     * Renders the given trees one after another as an HTML string.
     */
    public String renderListToString(final Iterable<? extends Sexp> trees) {
        final var writer = new StringWriter();
        renderList(writer, trees);
        return writer.toString();
    }

    private final boolean insertNewlines;
}
