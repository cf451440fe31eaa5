// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htsl.test;

import htsl.html.Generator;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

final class VoidElementTest {
    @ParameterizedTest
    @ValueSource(strings = {
        "area", "base", "br", "col", "embed", "hr", "img", "input", "link", "meta", "source", "track", "wbr"
    })
    void voidElementsHaveNoChildrenOrClosingTag(final String name) {
        final var bare = TestSexps.read("(" + name + ")");
        final var withChildren = TestSexps.read("(" + name + " (@ (id \"x\")) \"child\" (b \"bold\") 42)");
        assertThat(generator.renderToString(bare)).isEqualTo("<" + name + ">");
        assertThat(generator.renderToString(withChildren)).isEqualTo("<" + name + " id=\"x\">");
        assertThat(generator.withNewlines().renderToString(withChildren))
            .doesNotContain("</")
            .doesNotContain("child")
            .doesNotEndWith("\n")
            .endsWith("<" + name + " id=\"x\">");
    }

    private static final Generator generator = new Generator();
}
