// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htsl.sexp.reader;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import htsl.util.annotation.Nullable;
import htsl.util.condition.ConditionContext;
import htsl.util.condition.exception.IOExceptionCondition;

/**
 * A buffered source of bytes with a single byte of lookahead, as needed by the {@link Reader}.
 * <p>
 * The underlying input stream is never closed; its owner remains responsible for it.
 */
public final class ByteStream {
    /**
     * Initializes a new byte stream that will read bytes from the given input stream, which doesn't need to be
     * buffered.
     */
    public ByteStream(final InputStream stream) {
        source = stream;
    }

    /**
     * Returns a byte stream over the UTF-8 encoding of the given string.
     */
    public static ByteStream ofString(final String source) {
        return new ByteStream(new ByteArrayInputStream(source.getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * Returns {@code true} iff there are no more bytes.
     * <p>
     * {@link #peek()} and {@link #discardPeek()} may only be called after this method returned {@code false}. Reading
     * more bytes from the underlying stream may be needed to answer; an I/O error is signaled as a fatal
     * {@link IOExceptionCondition}.
     */
    public boolean reachedEnd() {
        return position >= limit && !fill();
    }

    /**
     * Returns the current byte without consuming it.
     */
    public byte peek() {
        assert position < limit : "peek() past the end of the buffered bytes";
        return buffer[position];
    }

    /**
     * Consumes the current byte.
     */
    public void discardPeek() {
        assert position < limit : "discardPeek() past the end of the buffered bytes";
        position += 1;
    }

    // Returns false at end of input.
    private boolean fill() {
        final var stream = source;
        if (stream == null) {
            return false;
        }
        final int count;
        try {
            count = stream.read(buffer, 0, buffer.length);
        } catch (final IOException e) {
            throw ConditionContext.error(new IOExceptionCondition(e));
        }
        if (count <= 0) {
            source = null;
            position = 0;
            limit = 0;
            return false;
        }
        position = 0;
        limit = count;
        return true;
    }

    private static final int bufferCapacity = 8192;

    private @Nullable InputStream source;
    private final byte[] buffer = new byte[bufferCapacity];
    private int position = 0;
    private int limit = 0;
}
