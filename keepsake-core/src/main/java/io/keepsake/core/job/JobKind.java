package io.keepsake.core.job;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum JobKind {
    @JsonProperty("data-backup")
    DATA_BACKUP("backup"),
    @JsonProperty("docker-compose-backup")
    CONTAINER_BACKUP("backup"),
    @JsonProperty("check")
    CHECK("check");

    private final String activity;

    JobKind(String activity) {
        this.activity = activity;
    }

    /**
     * Word used in operator-facing messages, {@code backup} or {@code check}.
     */
    public String activity() {
        return activity;
    }

    /**
     * The activity word as it starts a notification title, {@code Backup} or {@code Check}.
     */
    public String title() {
        return Character.toUpperCase(activity.charAt(0)) + activity.substring(1);
    }
}
