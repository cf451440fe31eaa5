// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htsl.test;

import java.util.ArrayList;
import java.util.List;
import htsl.dom.Attribute;
import htsl.dom.HtslConversionErrorCondition;
import htsl.dom.HtslConverter;
import htsl.dom.Node;
import htsl.html.Generator;
import htsl.sexp.Sexp;
import htsl.sexp.Sexps;
import htsl.sexp.SymbolTable;
import htsl.util.Trace;
import htsl.util.condition.ConditionContext;
import htsl.util.condition.Handler;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;

final class HtslConverterTest {
    @Test
    void convertsLeafNodes() {
        assertThat(converter.convert(null)).isSameAs(Sexp.KnownSymbol.NIL);
        assertThat(converter.convert(new Node.Text("a<b"))).isEqualTo(Sexps.string("a<b"));
        assertThat(Sexps.print(converter.convert(new Node.Raw("<b>")))).isEqualTo("(@H \"<b>\")");
        assertThat(Sexps.print(converter.convert(new Node.Comment("note")))).isEqualTo("(@@@ \"note\")");
    }

    @Test
    void convertsElements() {
        final var node = Node.element(
            "ol",
            Attribute.list("start", "17", "reversed"),
            Node.simple("li", new Node.Text("one")),
            Node.simple("li")
        );
        final var converted = converter.convert(node);
        assertThat(Sexps.print(converted)).isEqualTo("(ol ((start . \"17\") (reversed . \"\")) (li \"one\") (li))");
        assertThat(Sexps.head(converted)).isSameAs(symbolTable.intern("ol"));
    }

    @Test
    void omitsEmptyAttributeList() {
        final var converted = converter.convert(Node.simple("p", new Node.Text("x")));
        assertThat(Sexps.print(converted)).isEqualTo("(p \"x\")");
    }

    @Test
    void stripsNames() {
        final var node = Node.element(" a ", List.of(Attribute.of("\thref ", "/x")), new Node.Text("t"));
        assertThat(Sexps.print(converter.convert(node))).isEqualTo("(a ((href . \"/x\")) \"t\")");
    }

    @Test
    void convertedTreesRender() {
        final var node = Node.simple(
            "body",
            new Node.Comment("generated"),
            Node.element("a", Attribute.list("href", "/a b", "title", "\"x\""), new Node.Text("1 < 2")),
            new Node.Raw("<hr>"),
            Node.element("input", Attribute.list("disabled"))
        );
        assertThat(generator.renderToString(converter.convert(node))).isEqualTo(
            "<body><!--\ngenerated\n-->\n<a href=\"/a%20b\" title=\"&quot;x&quot;\">1 &lt; 2</a><hr>"
                + "<input disabled=\"\"></body>"
        );
    }

    @Test
    void signalsBlankElementName() {
        final var node = Node.simple("div", Node.simple("  "));
        final var condition = FatalConditions.capture(() -> converter.convert(node));
        assertThat(condition).isInstanceOf(HtslConversionErrorCondition.class);
        assertThat(condition.message()).startsWith("empty symbol string");
    }

    @Test
    void signalsBlankAttributeName() {
        final var node = Node.element("div", Attribute.list("id", "x", " ", "y"));
        final var condition = FatalConditions.capture(() -> converter.convert(node));
        assertThat(condition).isInstanceOf(HtslConversionErrorCondition.class);
        assertThat(condition.message()).startsWith("empty symbol string");
    }

    @Test
    void tracesElementsBeingConverted() {
        final var node = Node.simple("main", Node.simple("section", Node.simple("")));
        final var traces = new ArrayList<String>();
        ConditionContext.withRestart("abort-test", restart -> {
            try (final var handler = new Handler(signaled -> {
                Trace.activeTraces().forEach(traces::add);
                restart.unwindTo();
            })) {
                handler.use();
                return converter.convert(node);
            }
        });
        assertThat(traces).containsExactly(
            "Converting DOM element '' into HTSL",
            "Converting DOM element 'section' into HTSL",
            "Converting DOM element 'main' into HTSL"
        );
        assertThat(Trace.activeTraces()).isEmpty();
    }

    private final SymbolTable symbolTable = new SymbolTable();
    private final HtslConverter converter = new HtslConverter(symbolTable);
    private final Generator generator = new Generator();
}
