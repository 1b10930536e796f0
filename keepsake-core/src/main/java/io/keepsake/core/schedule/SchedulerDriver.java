package io.keepsake.core.schedule;

import io.keepsake.core.job.Job;
import io.keepsake.core.queue.ExecutionQueue;
import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wakes up at a fixed cadence and hands every job whose trigger has passed, and whose period is
 * due, to the execution queue. It never runs a job itself.
 *
 * <p>Triggers missed while the process was busy or suspended are collapsed into one evaluation.
 */
public final class SchedulerDriver implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(SchedulerDriver.class);

    private final List<Job> jobs;
    private final ExecutionQueue queue;
    private final PeriodPolicy policy;
    private final Clock clock;
    private final Duration tickInterval;
    private final Map<String, ZonedDateTime> nextTriggers = new ConcurrentHashMap<>();
    private ScheduledExecutorService executor;

    public SchedulerDriver(List<Job> jobs, ExecutionQueue queue, PeriodPolicy policy, Clock clock, Duration tickInterval) {
        this.jobs = List.copyOf(jobs);
        this.queue = queue;
        this.policy = policy;
        this.clock = clock;
        this.tickInterval = tickInterval;
        ZonedDateTime now = ZonedDateTime.now(clock);
        for (Job job : this.jobs) {
            ZonedDateTime next = policy.nextTrigger(job.period(), now);
            nextTriggers.put(job.name(), next);
            LOG.info("Scheduling task {} ({}), next trigger {}", job.name(), job.period().describe(), next);
        }
    }

    public synchronized void start() {
        if (executor != null) {
            throw new IllegalStateException("Scheduler already started");
        }
        executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "keepsake-scheduler");
            thread.setDaemon(true);
            return thread;
        });
        executor.scheduleAtFixedRate(this::safeTick, 0, tickInterval.toMillis(), TimeUnit.MILLISECONDS);
        LOG.info("Scheduler started with {} task(s), tick {}", jobs.size(), tickInterval);
    }

    /**
     * Evaluates every job whose trigger is at or before the clock's current time.
     *
     * @return the number of jobs added to the queue
     */
    public int tick() {
        ZonedDateTime now = ZonedDateTime.now(clock);
        int enqueued = 0;
        for (Job job : jobs) {
            ZonedDateTime trigger = nextTriggers.get(job.name());
            if (now.isBefore(trigger)) {
                continue;
            }
            boolean due = policy.isDue(job.period(), job.skipState(), trigger);
            nextTriggers.put(job.name(), policy.nextTrigger(job.period(), now));
            if (due) {
                if (queue.enqueue(job)) {
                    enqueued++;
                }
            } else {
                LOG.debug("Task {} not due at {} ({})", job.name(), trigger, job.skipState());
            }
        }
        return enqueued;
    }

    public Optional<ZonedDateTime> nextTrigger(String jobName) {
        return Optional.ofNullable(nextTriggers.get(jobName));
    }

    private void safeTick() {
        try {
            tick();
        } catch (RuntimeException e) {
            LOG.error("Scheduler tick failed", e);
        }
    }

    @Override
    public synchronized void close() {
        if (executor != null) {
            executor.shutdownNow();
            executor = null;
            LOG.info("Scheduler stopped");
        }
    }
}
