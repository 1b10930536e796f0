package io.keepsake.core.schedule;

public enum PeriodKind {
    HOURLY,
    DAILY,
    WEEKLY,
    MONTHLY
}
