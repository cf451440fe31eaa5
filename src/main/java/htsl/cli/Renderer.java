// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htsl.cli;

import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import htsl.html.Generator;
import htsl.sexp.SymbolTable;
import htsl.sexp.reader.ByteStream;
import htsl.sexp.reader.Reader;
import htsl.util.Trace;
import htsl.util.condition.ConditionContext;
import htsl.util.condition.exception.IOExceptionCondition;

/**
 * Renders S-expression source files to HTML, one file after another, into a single writer.
 * <p>
 * All symbols read are interned into one symbol table shared by every file rendered by the same renderer.
 */
public final class Renderer {
    /**
     * Initializes a new renderer that renders with the given generator into the given writer.
     * <p>
     * The writer is neither flushed nor closed.
     */
    public Renderer(final Generator generator, final Writer writer) {
        this.generator = generator;
        this.writer = writer;
    }

    /**
     * Reads every top-level form of the given file and renders them in order.
     * <ul>
     * <li>If the file cannot be read, a fatal {@link IOExceptionCondition} is signaled.
     * <li>If the file is not valid S-expression source, a fatal
     * {@link htsl.sexp.reader.ReadErrorCondition ReadErrorCondition} is signaled. Nothing from that file is written.
     * <li>If writing fails, a fatal {@link IOExceptionCondition} is signaled.
     * </ul>
     */
    public void renderFile(final Path path) {
        try (final var trace = new Trace(() -> "Rendering file " + path)) {
            trace.use();
            try (final var stream = Files.newInputStream(path)) {
                renderForms(stream);
            } catch (final IOException e) {
                throw ConditionContext.error(new IOExceptionCondition(e));
            }
        }
    }

    /**
     * Reads every top-level form of the given stream and renders them in order. The stream is not closed.
     * <p>
     * Errors are signaled like in {@link #renderFile(Path)}.
     */
    public void renderStream(final String sourceName, final InputStream stream) {
        try (final var trace = new Trace(() -> "Rendering " + sourceName)) {
            trace.use();
            renderForms(stream);
        }
    }

    private void renderForms(final InputStream stream) {
        final var forms = new Reader(new ByteStream(stream), symbolTable).readAll();
        final var result = generator.renderList(writer, forms);
        final var error = result.error();
        if (error != null) {
            throw ConditionContext.error(new IOExceptionCondition(error));
        }
    }

    private final Generator generator;
    private final Writer writer;
    private final SymbolTable symbolTable = new SymbolTable();
}
