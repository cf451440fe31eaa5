// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htsl.sexp.reader;

import htsl.util.condition.Condition;

/**
 * A condition type indicating that S-expression source could not be parsed.
 */
public final class ReadErrorCondition extends Condition {
    ReadErrorCondition(final String message, final int lineNumber, final int formStartLineNumber) {
        super(message);
        this.lineNumber = lineNumber;
        this.formStartLineNumber = formStartLineNumber;
    }

    /**
     * Retrieves the line the error was detected at, counting from 1.
     */
    public int lineNumber() {
        return lineNumber;
    }

    /**
     * Retrieves the line the top-level form containing the error starts at, counting from 1.
     */
    public int formStartLineNumber() {
        return formStartLineNumber;
    }

    @Override
    public String detailedMessage() {
        return message() + "\nIn line " + lineNumber + ", within top-level form starting at line "
            + formStartLineNumber;
    }

    private final int lineNumber;
    private final int formStartLineNumber;
}
