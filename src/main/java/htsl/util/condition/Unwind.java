// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htsl.util.condition;

/**
 * The throwable used by the restart mechanism to transfer control to a restart point.
 * <p>
 * Public only so that methods can declare {@code throws Unwind}; never catch or throw it by hand. It is neither an
 * {@link Exception} nor an {@link Error} because it represents control flow, not a failure.
 */
@SuppressWarnings("ExtendsThrowable")
public final class Unwind extends Throwable {
    Unwind(final Restart target) {
        super("Unwinding to a restart point", null, false, false);
        this.target = target;
    }

    Restart target() {
        return target;
    }

    private final transient Restart target;
}
