package io.keepsake.core.job;

import static org.assertj.core.api.Assertions.assertThat;

import io.keepsake.core.notify.Priority;
import io.keepsake.core.schedule.PeriodSpec;
import io.keepsake.core.support.RecordingNotificationSink;
import java.io.IOException;
import java.time.LocalTime;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class JobTest {
    private final RecordingNotificationSink notifications = new RecordingNotificationSink();

    @Test
    void shouldBeRunningWhileTheTaskExecutes() {
        AtomicReference<Job> self = new AtomicReference<>();
        AtomicReference<JobState> observed = new AtomicReference<>();
        Job job = new Job("photos", JobKind.DATA_BACKUP, PeriodSpec.daily(1, LocalTime.MIDNIGHT), () -> {
            observed.set(self.get().state());
            return new RunOutcome();
        }, notifications);
        self.set(job);

        assertThat(job.markQueued()).isTrue();
        Optional<RunOutcome> outcome = job.run();

        assertThat(observed.get()).isEqualTo(JobState.RUNNING);
        assertThat(outcome).isPresent();
        assertThat(job.state()).isEqualTo(JobState.IDLE);
    }

    @Test
    void shouldReportUnexpectedFailureOnceAndReturnToIdle() {
        Job job = new Job("photos", JobKind.DATA_BACKUP, PeriodSpec.daily(1, LocalTime.MIDNIGHT), () -> {
            throw new IOException("Unable to get list of all mounted partitions");
        }, notifications);
        job.markQueued();

        Optional<RunOutcome> outcome = job.run();

        assertThat(outcome).isEmpty();
        assertThat(job.state()).isEqualTo(JobState.IDLE);
        assertThat(notifications.sent()).singleElement()
            .satisfies(notification -> {
                assertThat(notification.priority()).isEqualTo(Priority.HIGH);
                assertThat(notification.title()).isEqualTo("Backup Failed");
                assertThat(notification.body()).isEqualTo("Error occurred during backup for photos");
            });
    }

    @Test
    void shouldNameTheActivityOfCheckJobs() {
        Job job = new Job("verify", JobKind.CHECK, PeriodSpec.daily(1, LocalTime.MIDNIGHT), () -> {
            throw new IllegalStateException("boom");
        }, notifications);

        job.run();

        assertThat(notifications.sent()).extracting(RecordingNotificationSink.Notification::title)
            .containsExactly("Check Failed");
    }

    @Test
    void shouldRefuseToBeQueuedTwice() {
        Job job = new Job("photos", JobKind.DATA_BACKUP, PeriodSpec.daily(1, LocalTime.MIDNIGHT), RunOutcome::new, notifications);

        assertThat(job.markQueued()).isTrue();
        assertThat(job.markQueued()).isFalse();
        job.release();
        assertThat(job.markQueued()).isTrue();
    }

    @Test
    void shouldReportAnErrorThrownByTheTaskAndReturnToIdle() {
        Job job = new Job("photos", JobKind.DATA_BACKUP, PeriodSpec.daily(1, LocalTime.MIDNIGHT), () -> {
            throw new AssertionError("restic output could not be parsed");
        }, notifications);
        job.markQueued();

        Optional<RunOutcome> outcome = job.run();

        assertThat(outcome).isEmpty();
        assertThat(job.state()).isEqualTo(JobState.IDLE);
        assertThat(notifications.withPriority(Priority.HIGH)).extracting(RecordingNotificationSink.Notification::title)
            .containsExactly("Backup Failed");
    }

    @Test
    void shouldNotBeWithdrawnWhileRunning() {
        AtomicReference<Job> self = new AtomicReference<>();
        AtomicReference<Boolean> released = new AtomicReference<>();
        AtomicReference<JobState> observed = new AtomicReference<>();
        Job job = new Job("photos", JobKind.DATA_BACKUP, PeriodSpec.daily(1, LocalTime.MIDNIGHT), () -> {
            released.set(self.get().release());
            observed.set(self.get().state());
            return new RunOutcome();
        }, notifications);
        self.set(job);

        job.markQueued();
        job.run();

        assertThat(released.get()).isFalse();
        assertThat(observed.get()).isEqualTo(JobState.RUNNING);
    }

    @Test
    void shouldStayQueuedWhenQueuedAgainAfterItsRun() {
        Job job = new Job("photos", JobKind.DATA_BACKUP, PeriodSpec.daily(1, LocalTime.MIDNIGHT), RunOutcome::new, notifications);
        job.markQueued();
        job.run();

        assertThat(job.markQueued()).isTrue();

        assertThat(job.state()).isEqualTo(JobState.QUEUED);
        assertThat(job.markQueued()).isFalse();
    }

    @Test
    void shouldRefuseToRunWhileAlreadyRunning() {
        AtomicReference<Job> self = new AtomicReference<>();
        AtomicReference<Throwable> nested = new AtomicReference<>();
        Job job = new Job("photos", JobKind.DATA_BACKUP, PeriodSpec.daily(1, LocalTime.MIDNIGHT), () -> {
            try {
                self.get().run();
            } catch (IllegalStateException e) {
                nested.set(e);
            }
            return new RunOutcome();
        }, notifications);
        self.set(job);

        job.markQueued();
        Optional<RunOutcome> outcome = job.run();

        assertThat(nested.get()).hasMessage("Task photos is already running");
        assertThat(outcome).isPresent();
        assertThat(job.state()).isEqualTo(JobState.IDLE);
    }
}
