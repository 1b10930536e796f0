package io.keepsake.core.support;

import io.keepsake.core.job.Job;
import io.keepsake.core.job.JobKind;
import io.keepsake.core.job.JobTask;
import io.keepsake.core.job.RunOutcome;
import io.keepsake.core.schedule.PeriodSpec;
import java.time.LocalTime;

public final class Jobs {

    private Jobs() {
    }

    public static Job daily(String name, LocalTime at) {
        return job(name, PeriodSpec.daily(1, at), RunOutcome::new);
    }

    public static Job job(String name, PeriodSpec period, JobTask task) {
        return new Job(name, JobKind.DATA_BACKUP, period, task, new RecordingNotificationSink());
    }
}
