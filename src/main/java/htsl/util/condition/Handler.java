// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htsl.util.condition;

/**
 * A condition handler, intended to be used within try-with-resources.
 * <p>
 * When a condition is signaled, the procedures of the installed handlers run from the most recently installed one to
 * the oldest, until one of them transfers control.
 */
public final class Handler implements AutoCloseable {
    /**
     * Installs a new handler with the given procedure in the current thread's condition context.
     */
    public Handler(final HandlerProcedure procedure) {
        this.procedure = procedure;
        context = ConditionContext.localContext();
        context.install(this);
    }

    /**
     * Does nothing; silences warnings about unreferenced auto-closeable resources.
     */
    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    /**
     * Uninstalls this handler. Handlers must be uninstalled by their own thread, newest first.
     */
    @Override
    public void close() {
        assert context == ConditionContext.localContext() : "Handler closed by a different thread";
        context.uninstall(this);
    }

    void handle(final SignaledCondition condition) throws Unwind {
        procedure.handle(condition);
    }

    private final HandlerProcedure procedure;
    private final ConditionContext context;
}
