package io.keepsake.core.runtime;

import io.keepsake.core.job.Job;
import io.keepsake.core.queue.ExecutionQueue;
import io.keepsake.core.queue.QueueWorker;
import io.keepsake.core.schedule.PeriodPolicy;
import io.keepsake.core.schedule.SchedulerDriver;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Owns the queue, the worker and the scheduler driver for one set of jobs.
 */
public final class KeepsakeRuntime implements AutoCloseable {
    public static final Duration DEFAULT_TICK = Duration.ofSeconds(1);

    private final List<Job> jobs;
    private final ExecutionQueue queue = new ExecutionQueue();
    private final QueueWorker worker;
    private final SchedulerDriver driver;

    public KeepsakeRuntime(List<Job> jobs, Clock clock, Duration tick) {
        this.jobs = List.copyOf(jobs);
        this.worker = new QueueWorker(queue);
        this.driver = new SchedulerDriver(this.jobs, queue, new PeriodPolicy(), clock, tick);
    }

    public void start() {
        worker.start();
        driver.start();
    }

    /**
     * Runs every job once, in order, on the calling thread.
     *
     * @return the number of jobs run
     */
    public int runImmediately() {
        for (Job job : jobs) {
            queue.enqueue(job);
        }
        return worker.drain();
    }

    public List<Job> jobs() {
        return jobs;
    }

    public SchedulerDriver driver() {
        return driver;
    }

    public ExecutionQueue queue() {
        return queue;
    }

    @Override
    public void close() {
        driver.close();
        worker.close();
    }
}
