// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htsl.html;

import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import htsl.util.UnreachableCodeReachedError;
import htsl.util.annotation.Nullable;

/**
 * The escaping functions of the HTML generator, one per syntactic context.
 * <p>
 * All functions are pure and never fail.
 */
public final class Escaping {
    private Escaping() {
    }

    /**
     * Escapes a string for use as HTML text content: {@code & < > "} become character references and NUL becomes
     * U+FFFD REPLACEMENT CHARACTER.
     */
    public static String escapeText(final String string) {
        return escape(string, Escaper.TEXT);
    }

    /**
     * Escapes a string for use inside a double-quoted attribute value.
     * <p>
     * The same characters as in {@link #escapeText(String)} are escaped. The surrounding quotes are not added.
     */
    public static String escapeAttributeValue(final String string) {
        return escape(string, Escaper.ATTRIBUTE);
    }

    /**
     * Escapes a string for use inside an HTML comment, by replacing every {@code --} with {@code -&#45;}.
     */
    public static String escapeComment(final String string) {
        var index = string.indexOf("--");
        if (index < 0) {
            return string;
        }
        final var builder = new StringBuilder(string.length() + 16);
        var start = 0;
        while (index >= 0) {
            builder.append(string, start, index);
            builder.append(commentDashes);
            start = index + 2;
            index = string.indexOf("--", start);
        }
        builder.append(string, start, string.length());
        return builder.toString();
    }

    /**
     * Percent-encodes the UTF-8 bytes of a string that are not allowed to appear literally in a URL.
     * <p>
     * ASCII letters and digits, {@code - . _ ~} and the delimiters {@code ! # $ & * + , / : ; = ? @ [ ]} are kept.
     * A {@code %} followed by two hexadecimal digits is an existing escape and is kept too. Escapes are produced with
     * lower case hexadecimal digits. Unpaired surrogates are encoded as U+FFFD REPLACEMENT CHARACTER, {@code %ef%bf%bd}.
     */
    public static String escapeUrl(final String string) {
        final var bytes = encodeUtf8(string);
        final var length = bytes.length;
        @Nullable StringBuilder builder = null;
        for (int i = 0; i < length; i += 1) {
            final var b = bytes[i];
            final var keep = isUrlSafe(b) || (b == '%' && i + 2 < length && isHexDigit(bytes[i + 1])
                && isHexDigit(bytes[i + 2]));
            if (keep && builder == null) {
                continue;
            }
            if (builder == null) {
                builder = new StringBuilder(length + 32);
                // Everything before i is ASCII, so it maps one to one to the bytes.
                builder.append(string, 0, i);
            }
            if (keep) {
                builder.append((char) b);
            } else {
                final var value = Byte.toUnsignedInt(b);
                builder.append('%').append(hexDigits[value >>> 4]).append(hexDigits[value & 0xF]);
            }
        }
        return (builder == null) ? string : builder.toString();
    }

    static String escape(final String string, final Escaper escaper) {
        var index = indexToEscape(string, 0, escaper);
        if (index < 0) {
            return string;
        }
        final var builder = new StringBuilder(string.length() + 16);
        var start = 0;
        while (index >= 0) {
            builder.append(string, start, index);
            builder.append(escaper.escape(string.charAt(index)));
            start = index + 1;
            index = indexToEscape(string, start, escaper);
        }
        builder.append(string, start, string.length());
        return builder.toString();
    }

    /**
     * Returns the index of the first character at or after {@code startIndex} that needs escaping, or -1.
     */
    static int indexToEscape(final String string, final int startIndex, final Escaper escaper) {
        final var length = string.length();
        for (int i = startIndex; i < length; i += 1) {
            if (escaper.escape(string.charAt(i)) != null) {
                return i;
            }
        }
        return -1;
    }

    private static byte[] encodeUtf8(final String string) {
        final var encoder = StandardCharsets.UTF_8.newEncoder()
            .onMalformedInput(CodingErrorAction.REPLACE)
            .onUnmappableCharacter(CodingErrorAction.REPLACE)
            .replaceWith(utf8ReplacementCharacter);
        try {
            final var buffer = encoder.encode(CharBuffer.wrap(string));
            final var bytes = new byte[buffer.remaining()];
            buffer.get(bytes);
            return bytes;
        } catch (final CharacterCodingException e) {
            throw new UnreachableCodeReachedError("Encoding with replacement failed: " + e.getMessage());
        }
    }

    private static boolean isUrlSafe(final byte b) {
        if ((b >= 'a' && b <= 'z') || (b >= 'A' && b <= 'Z') || (b >= '0' && b <= '9')) {
            return true;
        }
        return switch (b) {
            case '-', '.', '_', '~',
                '!', '#', '$', '&', '*', '+', ',', '/', ':', ';', '=', '?', '@', '[', ']' -> true;
            default -> false;
        };
    }

    private static boolean isHexDigit(final byte b) {
        return (b >= '0' && b <= '9') || (b >= 'a' && b <= 'f') || (b >= 'A' && b <= 'F');
    }

    private static final String commentDashes = "-&#45;";
    private static final char[] hexDigits = "0123456789abcdef".toCharArray();
    private static final byte[] utf8ReplacementCharacter = {(byte) 0xEF, (byte) 0xBF, (byte) 0xBD};

    /**
     * Maps single characters to their escaped form.
     */
    sealed interface Escaper {
        Escaper TEXT = new TextEscaper();
        Escaper ATTRIBUTE = new AttributeEscaper();

        /**
         * Returns the replacement of the given character, or {@code null} if it can appear literally.
         */
        @Nullable String escape(char character);
    }

    private static final class TextEscaper implements Escaper {
        @Override
        public @Nullable String escape(final char character) {
            return switch (character) {
                case '&' -> "&amp;";
                case '<' -> "&lt;";
                case '>' -> "&gt;";
                case '"' -> "&quot;";
                case '\0' -> "\uFFFD";
                default -> null;
            };
        }
    }

    private static final class AttributeEscaper implements Escaper {
        @Override
        public @Nullable String escape(final char character) {
            return TEXT.escape(character);
        }
    }
}
