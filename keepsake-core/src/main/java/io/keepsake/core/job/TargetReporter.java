package io.keepsake.core.job;

import io.keepsake.core.notify.NotificationSink;
import io.keepsake.core.notify.Priority;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Records per-target results into a {@link RunOutcome} and raises one notification per failing
 * target.
 */
final class TargetReporter {
    private static final Logger LOG = LoggerFactory.getLogger(TargetReporter.class);

    private final String jobName;
    private final JobKind kind;
    private final NotificationSink notifications;
    private final RunOutcome outcome = new RunOutcome();

    TargetReporter(String jobName, JobKind kind, NotificationSink notifications) {
        this.jobName = jobName;
        this.kind = kind;
        this.notifications = notifications;
    }

    void report(String target, List<String> errors) {
        outcome.record(target, errors);
        if (errors.isEmpty()) {
            LOG.info("{} task {} finished for {}", kind.title(), jobName, target);
            return;
        }
        for (String error : errors) {
            LOG.error("{} task {} failed for {}: {}", kind.title(), jobName, target, error);
        }
        notifications.notify(errorTitle(target, errors.size()), String.join("\n", errors), Priority.HIGH);
    }

    void unavailable(String target, String deviceId) {
        String message = "Device " + deviceId + " is not mounted";
        LOG.error("Target {} of task {} is unavailable: {}", target, jobName, message);
        outcome.record(target, List.of(message));
        notifications.notify(
            "Unable to run " + kind.activity() + " task " + jobName + " - " + target,
            message,
            Priority.HIGH
        );
    }

    void complete() {
        if (outcome.successful()) {
            notifications.notify(
                kind.title() + " Complete",
                kind.title() + " task " + jobName + " completed successfully",
                Priority.LOW
            );
        }
    }

    RunOutcome outcome() {
        return outcome;
    }

    String errorTitle(String target, int errorCount) {
        String prefix = errorCount == 1 ? "An Error" : "Errors";
        return prefix + " while running " + kind.activity() + " task " + jobName + " - " + target;
    }
}
