package io.keepsake.core.target;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * How many daily, weekly, monthly and yearly snapshots a prune keeps.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RetentionPolicy(int keepDaily, int keepWeekly, int keepMonthly, int keepYearly) {

    public static final int DEFAULT_DAILY = 14;
    public static final int DEFAULT_WEEKLY = 16;
    public static final int DEFAULT_MONTHLY = 18;
    public static final int DEFAULT_YEARLY = 3;

    public RetentionPolicy {
        if (keepDaily < 0 || keepWeekly < 0 || keepMonthly < 0 || keepYearly < 0) {
            throw new IllegalArgumentException("retention counts must be >= 0");
        }
    }

    public static RetentionPolicy defaults() {
        return new RetentionPolicy(DEFAULT_DAILY, DEFAULT_WEEKLY, DEFAULT_MONTHLY, DEFAULT_YEARLY);
    }

    /**
     * Missing counts fall back to the defaults.
     */
    @JsonCreator
    static RetentionPolicy fromJson(
        @JsonProperty("keepDaily") @JsonAlias({"days", "keep_daily"}) Integer keepDaily,
        @JsonProperty("keepWeekly") @JsonAlias({"weeks", "keep_weekly"}) Integer keepWeekly,
        @JsonProperty("keepMonthly") @JsonAlias({"months", "keep_monthly"}) Integer keepMonthly,
        @JsonProperty("keepYearly") @JsonAlias({"years", "keep_yearly"}) Integer keepYearly
    ) {
        return new RetentionPolicy(
            keepDaily == null ? DEFAULT_DAILY : keepDaily,
            keepWeekly == null ? DEFAULT_WEEKLY : keepWeekly,
            keepMonthly == null ? DEFAULT_MONTHLY : keepMonthly,
            keepYearly == null ? DEFAULT_YEARLY : keepYearly
        );
    }
}
