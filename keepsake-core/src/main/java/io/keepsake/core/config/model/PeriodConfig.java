package io.keepsake.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.keepsake.core.schedule.PeriodKind;
import io.keepsake.core.schedule.PeriodSpec;
import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PeriodConfig(
    PeriodKind type,
    Integer frequency,
    @JsonAlias({"run_time"}) String runTime,
    DayOfWeek weekday,
    @JsonAlias({"day_of_month"}) Integer dayOfMonth
) {
    private static final DateTimeFormatter RUN_TIME = DateTimeFormatter.ofPattern("H:mm");

    public PeriodConfig {
        type = type == null ? PeriodKind.DAILY : type;
        frequency = frequency == null ? 1 : frequency;
        runTime = runTime == null || runTime.isBlank() ? "00:00" : runTime.trim();
    }

    /**
     * @throws IllegalArgumentException when the values do not form a valid period
     */
    public PeriodSpec toSpec() {
        LocalTime time;
        try {
            time = LocalTime.parse(runTime, RUN_TIME);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("run_time '" + runTime + "' is not in HH:MM format", e);
        }
        return new PeriodSpec(type, frequency, time, weekday, dayOfMonth);
    }
}
