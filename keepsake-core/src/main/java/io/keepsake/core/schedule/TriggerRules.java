package io.keepsake.core.schedule;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

final class TriggerRules {
    static final DayOfWeek DEFAULT_WEEKDAY = DayOfWeek.MONDAY;

    private static final Map<PeriodKind, TriggerRule> RULES;

    static {
        Map<PeriodKind, TriggerRule> rules = new EnumMap<>(PeriodKind.class);
        rules.put(PeriodKind.HOURLY, new Hourly());
        rules.put(PeriodKind.DAILY, new Daily());
        rules.put(PeriodKind.WEEKLY, new Weekly());
        rules.put(PeriodKind.MONTHLY, new Monthly());
        RULES = Collections.unmodifiableMap(rules);
    }

    private TriggerRules() {
    }

    static TriggerRule forKind(PeriodKind kind) {
        TriggerRule rule = RULES.get(kind);
        if (rule == null) {
            throw new IllegalArgumentException("no trigger rule for period kind " + kind);
        }
        return rule;
    }

    private static ZonedDateTime atTime(LocalDate date, PeriodSpec spec, ZonedDateTime zoneSource) {
        return ZonedDateTime.of(date, spec.timeOfDay(), zoneSource.getZone());
    }

    private static final class Hourly implements TriggerRule {
        @Override
        public ZonedDateTime nextTrigger(PeriodSpec spec, ZonedDateTime after) {
            ZonedDateTime candidate = after.truncatedTo(ChronoUnit.HOURS).withMinute(spec.timeOfDay().getMinute());
            while (!candidate.isAfter(after)) {
                candidate = candidate.plusHours(1);
            }
            return candidate;
        }
    }

    private static final class Daily implements TriggerRule {
        @Override
        public ZonedDateTime nextTrigger(PeriodSpec spec, ZonedDateTime after) {
            LocalDate date = after.toLocalDate();
            ZonedDateTime candidate = atTime(date, spec, after);
            while (!candidate.isAfter(after)) {
                date = date.plusDays(1);
                candidate = atTime(date, spec, after);
            }
            return candidate;
        }
    }

    // without a weekday pin the week is anchored on DEFAULT_WEEKDAY and thinned by frequency
    private static final class Weekly implements TriggerRule {
        @Override
        public ZonedDateTime nextTrigger(PeriodSpec spec, ZonedDateTime after) {
            LocalDate date = after.toLocalDate().with(TemporalAdjusters.nextOrSame(weekday(spec)));
            ZonedDateTime candidate = atTime(date, spec, after);
            while (!candidate.isAfter(after)) {
                date = date.plusWeeks(1);
                candidate = atTime(date, spec, after);
            }
            return candidate;
        }

        @Override
        public boolean matches(PeriodSpec spec, ZonedDateTime at) {
            return at.getDayOfWeek() == weekday(spec);
        }

        @Override
        public boolean gatedByFrequency(PeriodSpec spec) {
            return spec.weekday() == null;
        }

        private DayOfWeek weekday(PeriodSpec spec) {
            return spec.weekday() == null ? DEFAULT_WEEKDAY : spec.weekday();
        }
    }

    // months shorter than dayOfMonth have no trigger at all
    private static final class Monthly implements TriggerRule {
        @Override
        public ZonedDateTime nextTrigger(PeriodSpec spec, ZonedDateTime after) {
            int day = spec.dayOfMonth();
            LocalDate month = after.toLocalDate().withDayOfMonth(1);
            while (true) {
                if (day <= month.lengthOfMonth()) {
                    ZonedDateTime candidate = atTime(month.withDayOfMonth(day), spec, after);
                    if (candidate.isAfter(after)) {
                        return candidate;
                    }
                }
                month = month.plusMonths(1);
            }
        }

        @Override
        public boolean matches(PeriodSpec spec, ZonedDateTime at) {
            return at.getDayOfMonth() == spec.dayOfMonth();
        }
    }
}
