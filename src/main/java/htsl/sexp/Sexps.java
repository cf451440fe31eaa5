// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htsl.sexp;

import java.util.ArrayList;
import java.util.List;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import htsl.util.annotation.Nullable;

/**
 * A utility class containing common operations on S-expressions.
 * <p>
 * These operations are the whole read contract the HTML generator relies on: classifying an object, taking a list
 * apart into its head and remaining elements, and extracting the value of an atom.
 */
public final class Sexps {
    private Sexps() {
    }

    /**
     * Returns the string the given {@code sexp} represents, or {@code null} if it doesn't represent a string.
     */
    public static @Nullable String asString(final Sexp sexp) {
        return (sexp instanceof Sexp.String string) ? string.value() : null;
    }

    /**
     * Returns the elements of the list the given {@code sexp} represents, or {@code null} if it doesn't represent a
     * proper list.
     * <p>
     * Note that the known symbol {@code nil} represents an empty list.
     */
    public static @Nullable List<Sexp> asList(final Sexp sexp) {
        if (sexp instanceof Sexp.List list) {
            return list.value();
        } else if (isSymbol(sexp, Sexp.KnownSymbol.NIL)) {
            return List.of();
        } else {
            return null;
        }
    }

    /**
     * Returns the first element of the given non-empty list, or {@code null} if {@code sexp} is not a non-empty list.
     */
    public static @Nullable Sexp head(final Sexp sexp) {
        return (sexp instanceof Sexp.List list && !list.value().isEmpty()) ? list.value().get(0) : null;
    }

    /**
     * Returns the elements following the first one of the given list, or an empty list if {@code sexp} is not a
     * non-empty list.
     */
    public static List<Sexp> tail(final Sexp sexp) {
        if (sexp instanceof Sexp.List list && !list.value().isEmpty()) {
            final var elements = list.value();
            return elements.subList(1, elements.size());
        }
        return List.of();
    }

    /**
     * Returns {@code true} iff the given {@code sexp} represents the symbol {@code nil}.
     * <p>
     * Note that empty lists represent {@code nil}.
     */
    public static boolean isNil(final Sexp sexp) {
        return isSymbol(sexp, Sexp.KnownSymbol.NIL) || (sexp instanceof Sexp.List list && list.value().isEmpty());
    }

    /**
     * Returns {@code true} iff the given {@code sexp} is a symbol named like the given known symbol.
     * <p>
     * Symbols are compared by name, so uninterned symbols match too.
     */
    public static boolean isSymbol(final Sexp sexp, final Sexp.KnownSymbol known) {
        return sexp == known || (sexp instanceof Sexp.Symbol symbol && known.symbolName().equals(symbol.symbolName()));
    }

    /**
     * Returns a new string object.
     */
    @CheckReturnValue
    public static Sexp.String string(final String value) {
        return new Sexp.String(value);
    }

    /**
     * Returns a new proper list of the given elements.
     */
    @CheckReturnValue
    public static Sexp.List list(final Sexp... elements) {
        return new Sexp.List(List.of(elements));
    }

    /**
     * Returns a new proper list of the given elements.
     */
    @CheckReturnValue
    public static Sexp.List list(final List<? extends Sexp> elements) {
        return new Sexp.List(List.copyOf(elements));
    }

    /**
     * Returns the cons cell {@code (car . cdr)}.
     * <p>
     * As in Lisp, a cons cell whose {@code cdr} is a list is itself a list: {@code (a . (b c))} is {@code (a b c)} and
     * {@code (a . nil)} is {@code (a)}. Only when {@code cdr} is another atom is a {@link Sexp.DottedPair} returned.
     */
    @CheckReturnValue
    public static Sexp cons(final Sexp car, final Sexp cdr) {
        final var rest = asList(cdr);
        if (rest == null) {
            return new Sexp.DottedPair(car, cdr);
        }
        final var elements = new ArrayList<Sexp>(rest.size() + 1);
        elements.add(car);
        elements.addAll(rest);
        return new Sexp.List(elements);
    }

    /**
     * Prints the given S-expression on a single line, the way a Lisp printer would: strings are quoted, with
     * backslashes and double quotes escaped, and lists are parenthesized.
     */
    public static String print(final Sexp sexp) {
        final var builder = new StringBuilder();
        print(builder, sexp);
        return builder.toString();
    }

    private static void print(final StringBuilder builder, final Sexp sexp) {
        if (sexp instanceof Sexp.String string) {
            final var replaced = string.value().replace("\\", "\\\\").replace("\"", "\\\"");
            builder.append('"').append(replaced).append('"');
        } else if (sexp instanceof Sexp.Integer integer) {
            builder.append(integer.value());
        } else if (sexp instanceof Sexp.Symbol symbol) {
            builder.append(symbol.symbolName());
        } else if (sexp instanceof Sexp.DottedPair pair) {
            builder.append('(');
            print(builder, pair.car());
            builder.append(" . ");
            print(builder, pair.cdr());
            builder.append(')');
        } else if (sexp instanceof Sexp.List list) {
            builder.append('(');
            var first = true;
            for (final var element : list.value()) {
                if (!first) {
                    builder.append(' ');
                }
                first = false;
                print(builder, element);
            }
            builder.append(')');
        }
    }
}
