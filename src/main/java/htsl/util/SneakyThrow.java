// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htsl.util;

/**
 * Facilities for bypassing the checked exception mechanism.
 */
public final class SneakyThrow {
    private SneakyThrow() {
    }

    /**
     * Throws the given throwable as if it were unchecked, whatever its actual type.
     * <p>
     * Reserved for throwable types that are effectively unchecked in practice, namely {@link InterruptedException}
     * and {@link htsl.util.condition.Unwind}.
     * <p>
     * Never returns normally; the declared return type lets call sites write {@code throw SneakyThrow.doThrow(e)}.
     */
    public static UnreachableCodeReachedError doThrow(final Throwable throwable) {
        throw doThrowImpl(throwable);
    }

    // E is erased to Throwable, so the cast does not exist in bytecode, while the compiler infers E as
    // RuntimeException at the call site.
    @SuppressWarnings("unchecked")
    private static <E extends Throwable> UnreachableCodeReachedError doThrowImpl(final Throwable throwable) throws E {
        throw (E) throwable;
    }
}
