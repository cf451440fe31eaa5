// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htsl.util;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import htsl.util.condition.MessageSupplier;
import org.checkerframework.checker.nullness.qual.MonotonicNonNull;

/**
 * A user-readable description of an operation in progress, intended to be used within try-with-resources.
 * <p>
 * Traces describe <em>what</em> the program was doing when a condition was signaled, e.g. "Rendering file x", so that
 * the command line front end can show it next to the condition. They are not a machine stack trace.
 * <p>
 * A trace belongs to the thread that created it, and traces must be closed in the reverse order of creation.
 */
public final class Trace implements AutoCloseable {
    /**
     * Registers a new trace whose message is computed lazily, at most once.
     */
    public Trace(final MessageSupplier supplier) {
        this.supplier = supplier;
        activeTraces.get().push(this);
    }

    /**
     * Returns a snapshot of the calling thread's active trace messages, most recently registered first.
     */
    public static List<String> activeTraces() {
        final var traces = activeTraces.get();
        final var messages = new ArrayList<String>(traces.size());
        for (final var trace : traces) {
            messages.add(trace.message());
        }
        return messages;
    }

    /**
     * Does nothing; silences warnings about unreferenced auto-closeable resources.
     */
    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    /**
     * Unregisters this trace. Use try-with-resources instead of calling this directly.
     */
    @Override
    public void close() {
        final var removed = activeTraces.get().pop();
        assert removed == this : "Traces closed out of order or by a different thread";
    }

    private String message() {
        var result = message;
        if (result == null) {
            result = supplier.get();
            message = result;
        }
        return result;
    }

    // The head is the most recently registered trace.
    private static final ThreadLocal<ArrayDeque<Trace>> activeTraces = ThreadLocal.withInitial(ArrayDeque::new);

    private final MessageSupplier supplier;
    private @MonotonicNonNull String message = null;
}
