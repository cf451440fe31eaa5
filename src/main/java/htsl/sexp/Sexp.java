// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htsl.sexp;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import htsl.util.annotation.Nullable;

/**
 * Marker interface serving as the base type of S-expression objects.
 * <p>
 * S-expression objects are guaranteed to be immutable. The {@code toString} of every S-expression type returns its
 * printed representation, as produced by {@link Sexps#print(Sexp)}.
 */
public sealed interface Sexp {
    /**
     * Base interface for Lisp symbols.
     * <p>
     * Interned symbols can be compared by identity, see {@link SymbolTable}.
     */
    sealed interface Symbol extends Sexp {
        /**
         * Retrieves the name of this symbol.
         */
        java.lang.String symbolName();
    }

    /**
     * An S-expression integer object.
     */
    record Integer(BigInteger value) implements Sexp {
        @Override
        public java.lang.String toString() {
            return value.toString();
        }
    }

    /**
     * An S-expression proper list object.
     * <p>
     * The list holds an immutable copy of the elements it was constructed with.
     */
    record List(java.util.List<Sexp> value) implements Sexp {
        public List {
            value = java.util.List.copyOf(value);
        }

        @Override
        public java.lang.String toString() {
            return Sexps.print(this);
        }
    }

    /**
     * An improper cons cell, {@code (car . cdr)}, whose {@code cdr} is an atom other than {@code nil}.
     * <p>
     * Cons cells whose {@code cdr} is a list are proper lists and are represented by {@link List} instead; use
     * {@link Sexps#cons(Sexp, Sexp)} to build either one as appropriate.
     */
    record DottedPair(Sexp car, Sexp cdr) implements Sexp {
        public DottedPair {
            if (cdr instanceof List || Sexps.isNil(cdr)) {
                throw new IllegalArgumentException("The cdr of a dotted pair cannot be a list: " + cdr);
            }
        }

        @Override
        public java.lang.String toString() {
            return Sexps.print(this);
        }
    }

    /**
     * An S-expression string object.
     */
    record String(java.lang.String value) implements Sexp {
        @Override
        public java.lang.String toString() {
            return Sexps.print(this);
        }
    }

    /**
     * A regular Lisp symbol, not directly used by Java code.
     */
    final class RegularSymbol implements Sexp.Symbol {
        /**
         * Initializes a new, <em>uninterned</em> symbol.
         * <p>
         * Prefer {@link SymbolTable#intern(java.lang.String)}, which returns the canonical symbol for a name.
         */
        public RegularSymbol(final java.lang.String name) {
            this.name = name;
        }

        @Override
        public java.lang.String symbolName() {
            return name;
        }

        @Override
        public java.lang.String toString() {
            return name;
        }

        private final java.lang.String name;
    }

    /**
     * Lisp symbols directly used by Java code.
     * <p>
     * Symbols whose names start with {@code @} are the HTML generator's directives.
     */
    enum KnownSymbol implements Sexp.Symbol {
        NIL("nil"),
        T("t"),
        /**
         * Heads an attribute list: {@code (@ (href . "x") (id "y"))}.
         */
        ATTRIBUTES("@"),
        CDATA("@C"),
        NO_ESCAPE("@H"),
        LIST_SPLICE("@L"),
        INLINE_COMMENT("@@"),
        BLOCK_COMMENT("@@@"),
        DOCTYPE("@@@@");

        KnownSymbol(final java.lang.String name) {
            this.name = name;
        }

        /**
         * Retrieves the known symbol with the given name, or {@code null} if there's none.
         */
        public static @Nullable KnownSymbol byName(final java.lang.String name) {
            return symbolsByName.get(name);
        }

        @Override
        public java.lang.String symbolName() {
            return name;
        }

        @Override
        public java.lang.String toString() {
            return name;
        }

        private static final Map<java.lang.String, KnownSymbol> symbolsByName =
            Arrays.stream(values()).collect(Collectors.toUnmodifiableMap(KnownSymbol::symbolName, Function.identity()));

        private final java.lang.String name;
    }
}
