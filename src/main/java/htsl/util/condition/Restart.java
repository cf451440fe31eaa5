// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htsl.util.condition;

import htsl.util.SneakyThrow;

/**
 * A named restart point, established by {@link ConditionContext#withRestart(String, RestartCallback)}.
 */
public final class Restart {
    Restart(final String name, final ConditionContext context) {
        this.name = name;
        this.context = context;
    }

    /**
     * Retrieves the user-readable name of this restart point.
     */
    public String name() {
        return name;
    }

    /**
     * Transfers control to this restart point. Never returns.
     * <p>
     * Only valid on the thread that established the restart, while the restart is still active.
     */
    public void unwindTo() {
        assert context == ConditionContext.localContext() : "Unwinding to a restart of a different thread";
        throw SneakyThrow.doThrow(new Unwind(this));
    }

    @Override
    public String toString() {
        return "Restart[" + name + "]";
    }

    private final String name;
    private final ConditionContext context;
}
