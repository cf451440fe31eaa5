// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htsl.sexp;

import java.util.concurrent.ConcurrentHashMap;

/**
 * A table for interning Lisp symbols.
 * <p>
 * Interned symbols can be compared for equality using object identity, which is much faster than string comparison.
 * <p>
 * This class is thread-safe: multiple threads can safely intern symbols into the same symbol table at the same time
 * with no external synchronization.
 */
public final class SymbolTable {
    /**
     * Produces the canonical representation of the symbol with the given name in this table.
     * <p>
     * Names of {@linkplain Sexp.KnownSymbol known symbols} always resolve to the known symbol. Any other name resolves
     * to the symbol created by the first call with that name.
     */
    public Sexp.Symbol intern(final String symbolName) {
        final var knownSymbol = Sexp.KnownSymbol.byName(symbolName);
        if (knownSymbol != null) {
            return knownSymbol;
        }
        return symbols.computeIfAbsent(symbolName, Sexp.RegularSymbol::new);
    }

    private final ConcurrentHashMap<String, Sexp.RegularSymbol> symbols = new ConcurrentHashMap<>();
}
