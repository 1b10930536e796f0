package io.keepsake.app;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class ShutdownSignalTest {

    @Test
    void shouldHoldTheHookUntilTheRuntimeIsClosed() throws Exception {
        ShutdownSignal signal = new ShutdownSignal(Duration.ofSeconds(30));
        Thread hook = signal.hook();

        hook.start();
        signal.awaitRequest();
        hook.join(200);

        assertThat(hook.isAlive()).isTrue();

        signal.markClosed();
        hook.join(TimeUnit.SECONDS.toMillis(5));

        assertThat(hook.isAlive()).isFalse();
    }

    @Test
    void shouldReleaseTheHookWhenTheGracePeriodRunsOut() throws Exception {
        ShutdownSignal signal = new ShutdownSignal(Duration.ofMillis(100));
        Thread hook = signal.hook();

        hook.start();
        hook.join(TimeUnit.SECONDS.toMillis(5));

        assertThat(hook.isAlive()).isFalse();
    }

    @Test
    void shouldNotBlockTheHookWhenClosedFirst() {
        ShutdownSignal signal = new ShutdownSignal(Duration.ofSeconds(30));
        signal.markClosed();

        long started = System.nanoTime();
        signal.requestAndWait();

        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(5));
    }
}
