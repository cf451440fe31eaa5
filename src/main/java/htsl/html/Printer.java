// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htsl.html;

import java.io.IOException;
import java.io.Writer;
import htsl.util.annotation.Nullable;

/**
 * A writer wrapper that remembers the first write failure.
 * <p>
 * Once a write has failed, every later write is skipped, so the output stops exactly where the first failure
 * happened. Callers never see an exception; they ask for {@link #error()} once they're done.
 */
final class Printer {
    Printer(final Writer writer) {
        this.writer = writer;
    }

    void print(final char character) {
        if (error != null) {
            return;
        }
        try {
            writer.write(character);
            length += 1;
        } catch (final IOException e) {
            error = e;
        }
    }

    void print(final String string) {
        print(string, 0, string.length());
    }

    /**
     * Writes the given string, replacing the characters the escaper wants escaped.
     */
    void printEscaped(final String string, final Escaping.Escaper escaper) {
        int index = 0;
        int indexToEscape;
        while ((indexToEscape = Escaping.indexToEscape(string, index, escaper)) >= 0) {
            print(string, index, indexToEscape);
            final var replacement = escaper.escape(string.charAt(indexToEscape));
            assert replacement != null;
            print(replacement);
            index = indexToEscape + 1;
        }
        print(string, index, string.length());
    }

    long length() {
        return length;
    }

    @Nullable IOException error() {
        return error;
    }

    private void print(final String string, final int start, final int end) {
        if (error != null || start >= end) {
            return;
        }
        try {
            writer.write(string, start, end - start);
            length += end - start;
        } catch (final IOException e) {
            error = e;
        }
    }

    private final Writer writer;
    private long length = 0;
    private @Nullable IOException error = null;
}
