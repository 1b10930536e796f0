package io.keepsake.core.schedule;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.Objects;

/**
 * How often a job runs.
 *
 * @param kind the natural cadence of the trigger
 * @param frequency run on every {@code frequency}-th due-eligible trigger
 * @param timeOfDay wall-clock time of the trigger; only the minute is used for hourly periods
 * @param weekday optional weekday pin, weekly periods only
 * @param dayOfMonth day pin, required for monthly periods and rejected otherwise
 */
public record PeriodSpec(
    PeriodKind kind,
    int frequency,
    LocalTime timeOfDay,
    DayOfWeek weekday,
    Integer dayOfMonth
) {

    public PeriodSpec {
        Objects.requireNonNull(kind, "kind must not be null");
        timeOfDay = timeOfDay == null ? LocalTime.MIDNIGHT : timeOfDay.withSecond(0).withNano(0);
        if (frequency < 1) {
            throw new IllegalArgumentException("frequency must be >= 1");
        }
        if (weekday != null && kind != PeriodKind.WEEKLY) {
            throw new IllegalArgumentException("weekday is only valid for weekly periods");
        }
        if (kind == PeriodKind.MONTHLY) {
            if (dayOfMonth == null) {
                throw new IllegalArgumentException("dayOfMonth is required for monthly periods");
            }
            if (dayOfMonth < 1 || dayOfMonth > 31) {
                throw new IllegalArgumentException("dayOfMonth must be between 1 and 31");
            }
        } else if (dayOfMonth != null) {
            throw new IllegalArgumentException("dayOfMonth is only valid for monthly periods");
        }
    }

    public static PeriodSpec hourly(int frequency) {
        return new PeriodSpec(PeriodKind.HOURLY, frequency, LocalTime.MIDNIGHT, null, null);
    }

    public static PeriodSpec daily(int frequency, LocalTime timeOfDay) {
        return new PeriodSpec(PeriodKind.DAILY, frequency, timeOfDay, null, null);
    }

    public static PeriodSpec weekly(DayOfWeek weekday, LocalTime timeOfDay) {
        return new PeriodSpec(PeriodKind.WEEKLY, 1, timeOfDay, weekday, null);
    }

    public static PeriodSpec monthly(int dayOfMonth, int frequency, LocalTime timeOfDay) {
        return new PeriodSpec(PeriodKind.MONTHLY, frequency, timeOfDay, null, dayOfMonth);
    }

    public String describe() {
        StringBuilder out = new StringBuilder(kind.name().toLowerCase());
        if (frequency > 1) {
            out.append(" x").append(frequency);
        }
        if (weekday != null) {
            out.append(" on ").append(weekday.name().toLowerCase());
        }
        if (dayOfMonth != null) {
            out.append(" on day ").append(dayOfMonth);
        }
        if (kind == PeriodKind.HOURLY) {
            out.append(" at :").append(String.format("%02d", timeOfDay.getMinute()));
        } else {
            out.append(" at ").append(timeOfDay);
        }
        return out.toString();
    }
}
