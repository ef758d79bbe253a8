// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.test;

import java.util.concurrent.atomic.AtomicReference;
import org.assertj.core.api.Assertions;
import scribe.util.condition.Condition;
import scribe.util.condition.ConditionContext;
import scribe.util.condition.Handler;

/**
 * Runs code expected to signal a fatal condition, capturing the condition and unwinding out of the failed code.
 */
final class Conditions {
    private Conditions() {
    }

    static <T extends Condition> T expectFatal(final Class<T> type, final Runnable action) {
        final var captured = new AtomicReference<Condition>();
        ConditionContext.withRestart("abort-test", restart -> {
            try (final var handler = new Handler(signaled -> {
                if (signaled.isFatal()) {
                    captured.set(signaled.condition());
                    restart.unwindTo();
                }
            })) {
                handler.use();
                action.run();
            }
            return null;
        });
        Assertions.assertThat(captured.get()).isInstanceOf(type);
        return type.cast(captured.get());
    }
}
