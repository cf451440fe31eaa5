// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htsl.test;

import htsl.html.AttributeCategory;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

final class AttributeCategoryTest {
    @ParameterizedTest
    @CsvSource({
        "action, URL",
        "cite, URL",
        "data, URL",
        "formaction, URL",
        "href, URL",
        "itemid, URL",
        "itemprop, URL",
        "itemtype, URL",
        "ping, URL",
        "poster, URL",
        "src, URL",
        "data-href, URL",
        "data-title, PLAIN",
        "xlink:href, URL",
        "xlink:title, PLAIN",
        "xmlns:svg, URL",
        "xmlns:anything, URL",
        "srcset, URL",
        "imageurl, URL",
        "resourceuri, URL",
        "doi, URL",
        "style, CSS",
        "data-style, CSS",
        "onclick, SCRIPT",
        "onload, SCRIPT",
        "id, PLAIN",
        "class, PLAIN",
        "title, PLAIN",
        "lang, PLAIN",
    })
    void classifiesAttributeNames(final String name, final AttributeCategory expected) {
        assertThat(AttributeCategory.of(name)).isEqualTo(expected);
    }
}
