package io.keepsake.core.queue;

import io.keepsake.core.job.Job;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs queued jobs one at a time, in queue order, on a single thread.
 */
public final class QueueWorker implements Runnable, AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(QueueWorker.class);
    private static final long SHUTDOWN_WAIT_SECONDS = 30;

    private final ExecutionQueue queue;
    private ExecutorService executor;

    public QueueWorker(ExecutionQueue queue) {
        this.queue = queue;
    }

    public synchronized void start() {
        if (executor != null) {
            throw new IllegalStateException("Worker already started");
        }
        executor = Executors.newSingleThreadExecutor(runnable -> new Thread(runnable, "keepsake-worker"));
        executor.execute(this);
    }

    @Override
    public void run() {
        LOG.info("Task queue worker started");
        while (!Thread.currentThread().isInterrupted()) {
            try {
                process(queue.take());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        LOG.info("Task queue worker stopped");
    }

    /**
     * Runs every job currently queued on the calling thread.
     *
     * @return the number of jobs run
     */
    public int drain() {
        int processed = 0;
        Optional<Job> next = queue.poll();
        while (next.isPresent()) {
            process(next.get());
            processed++;
            next = queue.poll();
        }
        return processed;
    }

    void process(Job job) {
        try {
            job.run();
        } catch (Throwable t) {
            LOG.error("Unhandled error while running task {}", job.name(), t);
        }
    }

    @Override
    public synchronized void close() {
        if (executor == null) {
            return;
        }
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                LOG.warn("Task queue worker did not stop within {}s", SHUTDOWN_WAIT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        executor = null;
    }
}
