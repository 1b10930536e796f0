package io.keepsake.core.schedule;

import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Decides whether a period is due at a trigger and computes the following trigger.
 *
 * <p>{@link #isDue} is expected to be called once per trigger produced by {@link #nextTrigger}.
 * It never blocks and is the only place a {@link SkipState} changes.
 */
public final class PeriodPolicy {

    public boolean isDue(PeriodSpec spec, SkipState skipState, ZonedDateTime at) {
        Objects.requireNonNull(spec, "spec must not be null");
        Objects.requireNonNull(skipState, "skipState must not be null");
        Objects.requireNonNull(at, "at must not be null");

        TriggerRule rule = TriggerRules.forKind(spec.kind());
        if (!rule.matches(spec, at)) {
            return false;
        }
        synchronized (skipState) {
            if (!rule.gatedByFrequency(spec) || skipState.skipCount() >= spec.frequency() - 1) {
                skipState.reset();
                return true;
            }
            skipState.increment();
            return false;
        }
    }

    public ZonedDateTime nextTrigger(PeriodSpec spec, ZonedDateTime after) {
        Objects.requireNonNull(spec, "spec must not be null");
        Objects.requireNonNull(after, "after must not be null");
        return TriggerRules.forKind(spec.kind()).nextTrigger(spec, after);
    }
}
