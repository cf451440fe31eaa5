// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htsl.dom;

import java.util.ArrayList;
import java.util.List;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;

/**
 * A DOM element's attribute. Attributes without a value have an empty string value.
 */
public record Attribute(String name, String value) {
    /**
     * Returns a new attribute.
     */
    @CheckReturnValue
    public static Attribute of(final String name, final String value) {
        return new Attribute(name, value);
    }

    /**
     * Returns a list of attributes from alternating names and values.
     * <p>
     * A trailing name without a value gets an empty value, so {@code list("start", "17", "reversed")} describes
     * {@code start="17" reversed}.
     */
    @CheckReturnValue
    public static List<Attribute> list(final String... namesAndValues) {
        final var attributes = new ArrayList<Attribute>((namesAndValues.length + 1) / 2);
        for (int i = 0; i < namesAndValues.length; i += 2) {
            final var value = (i + 1 < namesAndValues.length) ? namesAndValues[i + 1] : "";
            attributes.add(new Attribute(namesAndValues[i], value));
        }
        return List.copyOf(attributes);
    }
}
