// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htsl.util.condition;

/**
 * The base type of all conditions.
 * <p>
 * A condition describes an occurrence that code further up the call stack may want to react to. Handlers of a
 * condition execute <em>before</em> the stack is unwound, so they can still reach restarts established below them.
 */
public abstract class Condition {
    /**
     * Initializes a new condition with the given user-readable message.
     */
    protected Condition(final String message) {
        this.message = message;
    }

    /**
     * Retrieves the short user-readable message.
     */
    public final String message() {
        return message;
    }

    /**
     * Retrieves the full user-readable message. Subclasses add context such as source locations here.
     */
    public String detailedMessage() {
        return message;
    }

    @Override
    public String toString() {
        return getClass().getName() + ": " + message;
    }

    private final String message;
}
