// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htsl.util.condition;

import java.util.ArrayList;
import java.util.List;
import htsl.util.SneakyThrow;
import htsl.util.annotation.Nullable;

/**
 * The per-thread registry of installed handlers and established restarts.
 * <p>
 * Instances are never exposed; the static methods operate on the calling thread's context.
 *
 * @see Handler
 * @see Restart
 */
public final class ConditionContext {
    private ConditionContext() {
    }

    /**
     * Signals the given condition as non-fatal.
     * <p>
     * Installed handlers run from the newest to the oldest. If all of them decline, this method returns normally.
     * A handler may unwind to a restart, in which case control never returns here.
     */
    public static void signal(final Condition condition) {
        localContext().runHandlers(new SignaledCondition(condition, false));
    }

    /**
     * Signals the given condition as fatal.
     * <p>
     * Behaves like {@link #signal(Condition)}, except that if every handler declines, {@link UnhandledErrorError} is
     * thrown. Never returns normally; the declared return type lets call sites write
     * {@code throw ConditionContext.error(...)} to help the compiler's control flow analysis.
     */
    public static UnhandledErrorError error(final Condition condition) {
        localContext().runHandlers(new SignaledCondition(condition, true));
        throw new UnhandledErrorError(condition);
    }

    /**
     * Executes {@code callback} with a restart point named {@code restartName} around it.
     *
     * @return The value returned by {@code callback}, or {@code null} if control was transferred to this restart.
     */
    public static <T> @Nullable T withRestart(final String restartName, final RestartCallback<? extends T> callback) {
        final var context = localContext();
        final var restart = new Restart(restartName, context);
        context.restarts.add(restart);
        try {
            return callback.call(restart);
        } catch (final Unwind unwind) {
            if (unwind.target() != restart) {
                throw SneakyThrow.doThrow(unwind);
            }
            return null;
        } finally {
            removeLast(context.restarts, restart);
        }
    }

    /**
     * Returns a snapshot of the active restart points, newest first.
     */
    public static List<Restart> restarts() {
        final var restarts = localContext().restarts;
        final var result = new ArrayList<Restart>(restarts.size());
        for (int i = restarts.size() - 1; i >= 0; i -= 1) {
            result.add(restarts.get(i));
        }
        return result;
    }

    static ConditionContext localContext() {
        return localContext.get();
    }

    void install(final Handler handler) {
        handlers.add(handler);
    }

    void uninstall(final Handler handler) {
        removeLast(handlers, handler);
    }

    private void runHandlers(final SignaledCondition condition) {
        // A running handler sees only the handlers older than itself, so signaling from a handler can't recurse.
        final var savedLimit = visibleHandlers;
        final var start = (savedLimit < 0) ? handlers.size() : savedLimit;
        try {
            for (int i = start - 1; i >= 0; i -= 1) {
                visibleHandlers = i;
                handlers.get(i).handle(condition);
            }
        } catch (final Unwind unwind) {
            throw SneakyThrow.doThrow(unwind);
        } finally {
            visibleHandlers = savedLimit;
        }
    }

    private static <T> void removeLast(final List<T> list, final T element) {
        final var last = list.size() - 1;
        assert last >= 0 && list.get(last) == element : "Handlers or restarts closed out of order";
        list.remove(last);
    }

    private final List<Handler> handlers = new ArrayList<>();
    private final List<Restart> restarts = new ArrayList<>();
    // Number of handlers visible to a nested signal, or -1 outside of any handler.
    private int visibleHandlers = -1;

    private static final ThreadLocal<ConditionContext> localContext = ThreadLocal.withInitial(ConditionContext::new);
}
