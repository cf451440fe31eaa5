// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htsl.dom;

import htsl.util.condition.Condition;

/**
 * A condition type indicating that a DOM node could not be converted into an S-expression.
 */
public final class HtslConversionErrorCondition extends Condition {
    HtslConversionErrorCondition(final String message) {
        super(message);
    }
}
