// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htsl.cli;

import htsl.util.Trace;
import htsl.util.annotation.Nullable;
import htsl.util.condition.Condition;
import htsl.util.condition.ConditionContext;
import htsl.util.condition.HandlerProcedure;
import htsl.util.condition.Restart;
import htsl.util.condition.SignaledCondition;

/**
 * The outermost handler: reports fatal conditions on standard error and aborts the process.
 * <p>
 * Standard input may be the source being rendered, so unlike an interactive debugger this handler never asks which
 * restart to pick.
 */
final class FallbackHandler implements HandlerProcedure {
    private FallbackHandler() {
    }

    static FallbackHandler instance() {
        return instance;
    }

    @Override
    public void handle(final SignaledCondition condition) {
        if (!condition.isFatal()) {
            return;
        }
        final var restart = findAbortRestart();
        try (final var streams = Streams.acquire()) {
            showCondition(streams, condition.condition());
        }
        if (restart != null) {
            restart.unwindTo();
        }
    }

    private static @Nullable Restart findAbortRestart() {
        for (final var restart : ConditionContext.restarts()) {
            if (restart.name().equals(abortRestartName)) {
                return restart;
            }
        }
        return null;
    }

    private static void showCondition(final Streams streams, final Condition condition) {
        final var err = streams.err();
        err.println("A fatal condition of type " + condition.getClass().getName() + " has been signaled.");
        err.println("\nDetailed message:");
        err.println(condition.detailedMessage().stripTrailing());
        err.println("\nOperation trace:");
        for (final var traceMessage : Trace.activeTraces()) {
            err.println(" - " + traceMessage);
        }
        err.println();
    }

    private static final String abortRestartName = "abort-process";
    private static final FallbackHandler instance = new FallbackHandler();
}
