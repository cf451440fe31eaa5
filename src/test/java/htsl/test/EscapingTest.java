// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htsl.test;

import htsl.html.Escaping;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

final class EscapingTest {
    @Test
    void escapesText() {
        assertThat(Escaping.escapeText("plain")).isEqualTo("plain");
        assertThat(Escaping.escapeText("")).isEmpty();
        assertThat(Escaping.escapeText("<a href=\"x\">&</a>"))
            .isEqualTo("&lt;a href=&quot;x&quot;&gt;&amp;&lt;/a&gt;");
        assertThat(Escaping.escapeText("it's")).isEqualTo("it's");
        assertThat(Escaping.escapeText("\0")).isEqualTo("\uFFFD");
        assertThat(Escaping.escapeText("&amp;")).isEqualTo("&amp;amp;");
    }

    @Test
    void attributeValuesEscapeLikeText() {
        final var value = "a\"b<c>d&e\0f";
        assertThat(Escaping.escapeAttributeValue(value)).isEqualTo(Escaping.escapeText(value));
        assertThat(Escaping.escapeAttributeValue("x y")).isEqualTo("x y");
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "comment|comment",
        "-|-",
        "--|-&#45;",
        "---|-&#45;-",
        "----|-&#45;-&#45;",
        "-------->|-&#45;-&#45;-&#45;-&#45;>",
        "a--b--c|a-&#45;b-&#45;c",
        "<!-- x -->|<!-&#45; x -&#45;>",
    })
    void escapesComments(final String input, final String expected) {
        assertThat(Escaping.escapeComment(input)).isEqualTo(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {"--", "---", "- --- -", "-->", "a-----b", "<!---->"})
    void escapedCommentsHaveNoDoubleHyphen(final String input) {
        assertThat(Escaping.escapeComment(input)).doesNotContain("--");
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "https://example.com/a/b?c=d&e=f#g|https://example.com/a/b?c=d&e=f#g",
        "search?q=%&r=Ä|search?q=%25&r=%c3%84",
        "a b|a%20b",
        "100%|100%25",
        "%4|%254",
        "%4g|%254g",
        "%4F|%4F",
        "a%2fb|a%2fb",
        "\"quoted\"|%22quoted%22",
        "<>|%3c%3e",
        "~user/[x]@host|~user/[x]@host",
        "żółw|%c5%bc%c3%b3%c5%82w",
    })
    void escapesUrls(final String input, final String expected) {
        assertThat(Escaping.escapeUrl(input)).isEqualTo(expected);
    }

    @Test
    void urlEscapingKeepsSafeStringsIntact() {
        final var safe = "AZaz09-._~!#$&*+,/:;=?@[]";
        assertThat(Escaping.escapeUrl(safe)).isSameAs(safe);
        assertThat(Escaping.escapeUrl("")).isEmpty();
    }

    @Test
    void unpairedSurrogatesBecomeReplacementCharacter() {
        assertThat(Escaping.escapeUrl("a\uD800b")).isEqualTo("a%ef%bf%bdb");
        assertThat(Escaping.escapeUrl("\uDC00")).isEqualTo("%ef%bf%bd");
        assertThat(Escaping.escapeUrl("\uD83D\uDE00")).isEqualTo("%f0%9f%98%80");
    }
}
