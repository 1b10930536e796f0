package io.keepsake.core.queue;

import io.keepsake.core.job.Job;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * FIFO of jobs waiting for the worker. A job is in the queue at most once: it is marked queued
 * before it is appended and stays marked until its run finishes.
 */
public final class ExecutionQueue {
    private static final Logger LOG = LoggerFactory.getLogger(ExecutionQueue.class);

    private final BlockingQueue<Job> queue = new LinkedBlockingQueue<>();

    /**
     * @return {@code false} when the job was already queued or running and nothing was added
     */
    public boolean enqueue(Job job) {
        if (!job.markQueued()) {
            LOG.warn("Task {} is already queued, skipping", job.name());
            return false;
        }
        queue.add(job);
        LOG.info("Task {} queued ({} waiting)", job.name(), queue.size());
        return true;
    }

    public Job take() throws InterruptedException {
        return queue.take();
    }

    public Optional<Job> poll() {
        return Optional.ofNullable(queue.poll());
    }

    public int size() {
        return queue.size();
    }

    public List<String> pending() {
        return queue.stream().map(Job::name).toList();
    }
}
