// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htsl.html;

import java.io.IOException;
import htsl.util.annotation.Nullable;

/**
 * The outcome of a render call.
 *
 * @param length The number of characters successfully written.
 * @param error  The first exception thrown by the writer, or {@code null} if every write succeeded. Nothing was
 *               written after it.
 */
public record RenderResult(long length, @Nullable IOException error) {
    /**
     * Returns {@code true} iff every write succeeded.
     */
    public boolean isSuccess() {
        return error == null;
    }

    /**
     * Rethrows the recorded writer exception, if any.
     */
    public void throwIfFailed() throws IOException {
        if (error != null) {
            throw error;
        }
    }
}
