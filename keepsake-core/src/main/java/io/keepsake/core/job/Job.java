package io.keepsake.core.job;

import io.keepsake.core.notify.NotificationSink;
import io.keepsake.core.notify.Priority;
import io.keepsake.core.schedule.PeriodSpec;
import io.keepsake.core.schedule.SkipState;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A configured job and its run state.
 *
 * <p>The state moves {@code IDLE -> QUEUED -> RUNNING -> IDLE}. {@link #markQueued()} is the only
 * way out of {@code IDLE}, so a job that is queued or running cannot be queued a second time.
 * {@link #run()} owns the move into and out of {@code RUNNING}, always ends back in {@code IDLE} and
 * never lets a failure of the task escape.
 */
public final class Job {
    private static final Logger LOG = LoggerFactory.getLogger(Job.class);

    private final String name;
    private final JobKind kind;
    private final PeriodSpec period;
    private final SkipState skipState = new SkipState();
    private final JobTask task;
    private final NotificationSink notifications;
    private final AtomicReference<JobState> state = new AtomicReference<>(JobState.IDLE);

    public Job(String name, JobKind kind, PeriodSpec period, JobTask task, NotificationSink notifications) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.period = Objects.requireNonNull(period, "period must not be null");
        this.task = Objects.requireNonNull(task, "task must not be null");
        this.notifications = Objects.requireNonNull(notifications, "notifications must not be null");
    }

    public String name() {
        return name;
    }

    public JobKind kind() {
        return kind;
    }

    public PeriodSpec period() {
        return period;
    }

    public SkipState skipState() {
        return skipState;
    }

    public JobState state() {
        return state.get();
    }

    public boolean queued() {
        return state.get() != JobState.IDLE;
    }

    /**
     * @return {@code false} when the job is already queued or running
     */
    public boolean markQueued() {
        return state.compareAndSet(JobState.IDLE, JobState.QUEUED);
    }

    /**
     * Withdraws a job that was queued but will not be run. Has no effect once the job is running.
     *
     * @return {@code false} when the job was not queued
     */
    public boolean release() {
        return state.compareAndSet(JobState.QUEUED, JobState.IDLE);
    }

    /**
     * Runs the task to completion on the calling thread.
     *
     * @return the outcome, or empty when the run was aborted by an unexpected error
     * @throws IllegalStateException when the job is already running
     */
    public Optional<RunOutcome> run() {
        if (!state.compareAndSet(JobState.QUEUED, JobState.RUNNING)
            && !state.compareAndSet(JobState.IDLE, JobState.RUNNING)) {
            throw new IllegalStateException("Task " + name + " is already running");
        }
        LOG.info("Starting task {}", name);
        try {
            RunOutcome outcome = task.execute();
            if (outcome.successful()) {
                LOG.info("Task {} completed without errors", name);
            } else {
                LOG.warn("Task {} completed with {} error(s) on {}", name, outcome.errorCount(), outcome.failedTargets());
            }
            return Optional.of(outcome);
        } catch (Exception | Error e) {
            LOG.error("Unable to run {} task {}", kind.activity(), name, e);
            notifications.notify(
                kind.title() + " Failed",
                "Error occurred during " + kind.activity() + " for " + name,
                Priority.HIGH
            );
            return Optional.empty();
        } finally {
            LOG.info("Finished task {}", name);
            state.set(JobState.IDLE);
        }
    }

    @Override
    public String toString() {
        return "Job[" + name + ", " + kind + ", " + period.describe() + ", " + state.get() + "]";
    }
}
