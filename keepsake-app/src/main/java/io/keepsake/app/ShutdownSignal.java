package io.keepsake.app;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands a JVM shutdown over to the main thread. The hook thread asks for the stop and then holds
 * the JVM open until the main thread reports that the runtime is closed, or until the grace
 * period runs out.
 */
final class ShutdownSignal {
    private static final Logger LOG = LoggerFactory.getLogger(ShutdownSignal.class);

    private final CountDownLatch requested = new CountDownLatch(1);
    private final CountDownLatch closed = new CountDownLatch(1);
    private final Duration grace;

    ShutdownSignal(Duration grace) {
        this.grace = grace;
    }

    Thread hook() {
        return new Thread(this::requestAndWait, "keepsake-shutdown");
    }

    void requestAndWait() {
        requested.countDown();
        try {
            if (!closed.await(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("Scheduler did not shut down within {}s", grace.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    void awaitRequest() throws InterruptedException {
        requested.await();
    }

    void markClosed() {
        closed.countDown();
    }
}
