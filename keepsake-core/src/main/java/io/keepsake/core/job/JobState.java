package io.keepsake.core.job;

public enum JobState {
    IDLE,
    QUEUED,
    RUNNING
}
