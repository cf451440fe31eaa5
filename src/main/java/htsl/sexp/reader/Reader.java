// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htsl.sexp.reader;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import htsl.sexp.Sexp;
import htsl.sexp.Sexps;
import htsl.sexp.SymbolTable;
import htsl.util.annotation.Nullable;
import htsl.util.condition.ConditionContext;
import htsl.util.condition.UnhandledErrorError;
import htsl.util.condition.exception.IOExceptionCondition;

/**
 * The S-expression reader: turns a stream of UTF-8 bytes into {@link Sexp} objects, one top-level form at a time.
 * <p>
 * The syntax understood is a small subset of Lisp:
 * <ul>
 * <li>lists in parentheses, including a single dotted pair such as {@code (href . "x")};
 * <li>double-quoted strings, where a backslash makes the following byte literal;
 * <li>decimal integers with an optional sign;
 * <li>symbols, which are any other run of bytes up to whitespace, a parenthesis, a double quote or a semicolon.
 * </ul>
 * A semicolon starts a comment that extends to the end of the line. The bytes {@code ' # | \} and NUL are reserved.
 */
public final class Reader {
    /**
     * Initializes a new S-expression reader that will read bytes from the given byte stream.
     * <p>
     * All symbols read will be interned into the given symbol table.
     */
    public Reader(final ByteStream stream, final SymbolTable symbolTable) {
        this.stream = stream;
        this.symbolTable = symbolTable;
    }

    /**
     * Attempts to parse the next top-level S-expression.
     *
     * <ul>
     * <li>If an S-expression was correctly parsed, its object representation in the form of a {@link Sexp} is returned.
     * <li>If the end of input is reached, {@code null} is returned.
     * <li>If a parse error occurs, a fatal {@link ReadErrorCondition} condition is signaled.
     * <li>If an I/O error occurs, the {@link IOException} is caught and signaled as a fatal
     * {@link IOExceptionCondition}.
     * </ul>
     */
    public @Nullable Sexp readTopLevelForm() {
        if (skipAtmosphere().hitEof()) {
            return null;
        }
        formStartLine = line;
        final var form = readForm(1);
        if (form == dot) {
            throw readError("Unexpected '.' outside of a list");
        }
        return form;
    }

    /**
     * Parses all remaining top-level S-expressions.
     * <p>
     * Errors are signaled as in {@link #readTopLevelForm()}.
     */
    public List<Sexp> readAll() {
        final var forms = new ArrayList<Sexp>();
        for (var form = readTopLevelForm(); form != null; form = readTopLevelForm()) {
            forms.add(form);
        }
        return forms;
    }

    // Skips whitespace and comments. Line feeds are counted here, the ones inside strings in readString.
    private HitEof skipAtmosphere() {
        while (!stream.reachedEnd()) {
            final var b = stream.peek();
            if (b == ';') {
                skipComment();
            } else if (isWhitespace(b)) {
                if (b == '\n') {
                    line += 1;
                }
                stream.discardPeek();
            } else {
                return HitEof.NO;
            }
        }
        return HitEof.YES;
    }

    private void skipComment() {
        while (!stream.reachedEnd() && stream.peek() != '\n') {
            stream.discardPeek();
        }
    }

    // Expects the stream to be positioned at the first byte of a form.
    private Sexp readForm(final int depth) {
        if (depth > maxDepth) {
            throw readError("Recursion limit reached, try to limit nesting");
        }
        final var b = stream.peek();
        if (isReserved(b)) {
            throw reservedCharacterError(b);
        }
        stream.discardPeek();
        return switch (b) {
            case ')' -> throw readError("Expected a form, but found ')' instead");
            case '(' -> readList(depth);
            case '"' -> readString();
            default -> readAtom(b);
        };
    }

    private Sexp readList(final int depth) {
        final var elements = new ArrayList<Sexp>();
        while (true) {
            skipToNextListItem();
            if (stream.peek() == ')') {
                stream.discardPeek();
                return new Sexp.List(elements);
            }
            final var element = readForm(depth + 1);
            if (element == dot) {
                return readDottedTail(elements, depth);
            }
            elements.add(element);
        }
    }

    private Sexp readDottedTail(final List<Sexp> elements, final int depth) {
        if (elements.isEmpty()) {
            throw readError("Expected a form before '.'");
        }
        skipToNextListItem();
        final var cdr = readForm(depth + 1);
        if (cdr == dot) {
            throw readError("Expected a form after '.', but found another '.'");
        }
        skipToNextListItem();
        if (stream.peek() != ')') {
            throw readError("Expected ')' after the form following '.'");
        }
        stream.discardPeek();

        if (elements.size() > 1 && Sexps.asList(cdr) == null) {
            throw readError("Dotted lists with more than one element before '.' are unsupported");
        }
        var result = cdr;
        for (int i = elements.size() - 1; i >= 0; i -= 1) {
            result = Sexps.cons(elements.get(i), result);
        }
        return result;
    }

    private void skipToNextListItem() {
        if (skipAtmosphere().hitEof()) {
            throw readError("Expected closing ')' but found end of input instead");
        }
    }

    private Sexp.String readString() {
        final var bytes = new ByteArrayOutputStream(initialStringCapacity);
        while (true) {
            var b = nextStringByte();
            if (b == '"') {
                return new Sexp.String(decodeUtf8(bytes));
            }
            if (b == '\\') {
                b = nextStringByte();
            }
            if (b == '\n') {
                line += 1;
            }
            bytes.write(b);
        }
    }

    private byte nextStringByte() {
        if (stream.reachedEnd()) {
            throw readError("Expected closing '\"' but found end of input instead");
        }
        final var b = stream.peek();
        stream.discardPeek();
        return b;
    }

    private Sexp readAtom(final byte firstByte) {
        final var bytes = new ByteArrayOutputStream(initialSymbolCapacity);
        bytes.write(firstByte);
        while (!stream.reachedEnd() && isSymbolByte(stream.peek())) {
            bytes.write(stream.peek());
            stream.discardPeek();
        }
        final var name = decodeUtf8(bytes);
        if (".".equals(name)) {
            return dot;
        }
        if (integerPattern.matcher(name).matches()) {
            return new Sexp.Integer(new BigInteger(name));
        }
        return symbolTable.intern(name);
    }

    private String decodeUtf8(final ByteArrayOutputStream bytes) {
        try {
            return utf8Decoder.decode(ByteBuffer.wrap(bytes.toByteArray())).toString();
        } catch (final CharacterCodingException e) {
            throw readError("Invalid UTF-8 byte sequence detected");
        }
    }

    private UnhandledErrorError reservedCharacterError(final byte b) {
        if (b == 0) {
            throw readError("Reserved control character U+0000 found");
        }
        throw readError("Reserved character '" + (char) b + "' found");
    }

    private UnhandledErrorError readError(final String message) {
        throw ConditionContext.error(new ReadErrorCondition(message, line, formStartLine));
    }

    private static boolean isWhitespace(final byte b) {
        return switch (b) {
            case ' ', '\t', '\n', '\r', 0x0B, 0x0C -> true;
            default -> false;
        };
    }

    private static boolean isReserved(final byte b) {
        return switch (b) {
            case '\'', '#', '|', '\\', 0 -> true;
            default -> false;
        };
    }

    private static boolean isSymbolByte(final byte b) {
        return !isWhitespace(b) && !isReserved(b) && b != '(' && b != ')' && b != '"' && b != ';';
    }

    private static CharsetDecoder newUtf8Decoder() {
        return StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
    }

    // Stands for a lone '.' token; never escapes the reader.
    private static final Sexp dot = new Sexp.RegularSymbol(".");
    private static final Pattern integerPattern = Pattern.compile("[+-]?[0-9]+");

    private static final int initialStringCapacity = 64;
    private static final int initialSymbolCapacity = 16;
    private static final int maxDepth = 150;

    private final ByteStream stream;
    private final SymbolTable symbolTable;
    private final CharsetDecoder utf8Decoder = newUtf8Decoder();
    private int line = 1;
    private int formStartLine = 1;
}
