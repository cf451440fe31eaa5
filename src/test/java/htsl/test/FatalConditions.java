// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htsl.test;

import java.util.ArrayList;
import htsl.util.condition.Condition;
import htsl.util.condition.ConditionContext;
import htsl.util.condition.Handler;
import static org.assertj.core.api.Assertions.assertThat;

final class FatalConditions {
    private FatalConditions() {
    }

    /**
     * Runs the given action, expecting it to signal a fatal condition, and returns that condition.
     */
    static Condition capture(final Runnable action) {
        final var captured = new ArrayList<Condition>(1);
        ConditionContext.withRestart("abort-test", restart -> {
            try (final var handler = new Handler(signaled -> {
                if (signaled.isFatal()) {
                    captured.add(signaled.condition());
                    restart.unwindTo();
                }
            })) {
                handler.use();
                action.run();
            }
            return null;
        });
        assertThat(captured).as("fatal conditions signaled").hasSize(1);
        return captured.get(0);
    }
}
