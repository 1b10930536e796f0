package io.keepsake.core.schedule;

import java.time.ZonedDateTime;

/**
 * Calendar behaviour of one {@link PeriodKind}.
 */
interface TriggerRule {

    /**
     * First trigger strictly after {@code after}.
     */
    ZonedDateTime nextTrigger(PeriodSpec spec, ZonedDateTime after);

    /**
     * Whether a trigger at {@code at} falls on the pinned calendar slot of the period.
     */
    default boolean matches(PeriodSpec spec, ZonedDateTime at) {
        return true;
    }

    /**
     * Whether matching triggers are additionally thinned out by {@link PeriodSpec#frequency()}.
     */
    default boolean gatedByFrequency(PeriodSpec spec) {
        return true;
    }
}
