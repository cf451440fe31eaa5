// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htsl.util.condition;

/**
 * The procedure of a {@link Handler}.
 */
@FunctionalInterface
public interface HandlerProcedure {
    /**
     * Processes the given condition.
     * <p>
     * Returning normally declines the condition. Handling it means transferring control elsewhere, typically by
     * calling {@link Restart#unwindTo()}.
     */
    void handle(SignaledCondition condition) throws Unwind;
}
