// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htsl.html;

import java.util.Map;
import htsl.sexp.Sexp;

/**
 * The rendering behaviors selected by the head symbol of a list.
 */
public enum Directive {
    /**
     * An ordinary element; the head symbol is the tag name. This is also what any unrecognized {@code @} symbol, the
     * attribute marker {@code @} among them, falls back to.
     */
    TAG,
    /**
     * {@code (@C "text" ...)}: string children written unescaped inside {@code <![CDATA[...]]>}.
     */
    CDATA,
    /**
     * {@code (@H "text" ...)}: string children written unescaped.
     */
    NO_ESCAPE,
    /**
     * {@code (@@ item ...)}: a single line comment.
     */
    INLINE_COMMENT,
    /**
     * {@code (@@@ line ...)}: a comment with one line per child.
     */
    BLOCK_COMMENT,
    /**
     * {@code (@L child ...)}: children rendered in place, without any enclosing element.
     */
    LIST_SPLICE,
    /**
     * {@code (@@@@ child ...)}: the HTML5 doctype declaration, followed by the children.
     */
    DOCTYPE;

    /**
     * Resolves the directive the given head symbol selects.
     */
    public static Directive of(final Sexp.Symbol symbol) {
        final var name = symbol.symbolName();
        if (!name.startsWith("@")) {
            return TAG;
        }
        return directivesBySymbolName.getOrDefault(name, TAG);
    }

    private static final Map<String, Directive> directivesBySymbolName = Map.of(
        Sexp.KnownSymbol.CDATA.symbolName(), CDATA,
        Sexp.KnownSymbol.NO_ESCAPE.symbolName(), NO_ESCAPE,
        Sexp.KnownSymbol.INLINE_COMMENT.symbolName(), INLINE_COMMENT,
        Sexp.KnownSymbol.BLOCK_COMMENT.symbolName(), BLOCK_COMMENT,
        Sexp.KnownSymbol.LIST_SPLICE.symbolName(), LIST_SPLICE,
        Sexp.KnownSymbol.DOCTYPE.symbolName(), DOCTYPE
    );
}
