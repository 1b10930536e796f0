package io.keepsake.core.job;

import io.keepsake.core.backend.BackendException;
import io.keepsake.core.backend.TransferBackend;
import io.keepsake.core.device.MountTable;
import io.keepsake.core.notify.Priority;
import io.keepsake.core.target.LocalTarget;
import io.keepsake.core.target.RemoteTarget;
import io.keepsake.core.target.RepositoryLocation;
import io.keepsake.core.target.RetentionPolicy;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Snapshots the sources into the primary repository, then replicates the primary to every
 * secondary device and, when cloud backups are enabled, to every remote target.
 *
 * <p>An unavailable primary ends the run. Any other target is handled on its own: its errors are
 * reported for it alone and the next target is attempted regardless.
 */
public final class BackupTask implements JobTask {
    private static final Logger LOG = LoggerFactory.getLogger(BackupTask.class);

    private final String jobName;
    private final RepositorySet repositories;
    private final RetentionPolicy retention;
    private final SourceBackup sourceBackup;
    private final JobEnvironment environment;

    public BackupTask(
        String jobName,
        RepositorySet repositories,
        RetentionPolicy retention,
        SourceBackup sourceBackup,
        JobEnvironment environment
    ) {
        this.jobName = Objects.requireNonNull(jobName, "jobName must not be null");
        this.repositories = Objects.requireNonNull(repositories, "repositories must not be null");
        this.retention = Objects.requireNonNull(retention, "retention must not be null");
        this.sourceBackup = Objects.requireNonNull(sourceBackup, "sourceBackup must not be null");
        this.environment = Objects.requireNonNull(environment, "environment must not be null");
    }

    @Override
    public RunOutcome execute() throws IOException {
        TargetReporter reporter = new TargetReporter(jobName, sourceBackup.kind(), environment.notifications());
        MountTable mounts = MountTable.of(environment.devices().listMounts());

        Optional<LocalTarget> primary = repositories.primary();
        if (primary.isEmpty()) {
            LOG.error("No primary device found for task {}", jobName);
            environment.notifications().notify(
                "Backup Failed",
                "No primary device found for backup task " + jobName,
                Priority.HIGH
            );
            reporter.outcome().record("primary", List.of("No primary device found"));
            return reporter.outcome();
        }
        Optional<Path> primaryMount = mounts.firstMount(primary.get().deviceId());
        if (primaryMount.isEmpty()) {
            reporter.unavailable(primary.get().label(), primary.get().deviceId());
            return reporter.outcome();
        }

        RepositoryLocation primaryRepository = repositories.local(primaryMount.get());
        LOG.info("Backing up task {} to primary repository {}", jobName, primaryRepository);
        TransferBackend backend = environment.backend();
        List<String> errors = new ArrayList<>();
        errors.addAll(backend.init(primaryRepository));
        errors.addAll(backend.unlock(primaryRepository));
        errors.addAll(sourceBackup.perform(primaryRepository));
        errors.addAll(backend.prune(primaryRepository, retention));
        reporter.report(primaryRepository.uri(), errors);

        for (LocalTarget secondary : repositories.secondaries()) {
            Optional<Path> mount = mounts.firstMount(secondary.deviceId());
            if (mount.isEmpty()) {
                reporter.unavailable(secondary.label(), secondary.deviceId());
                continue;
            }
            replicate(reporter, primaryRepository, repositories.local(mount.get()));
        }

        if (environment.cloudEnabled()) {
            for (RemoteTarget remote : repositories.remoteTargets()) {
                replicate(reporter, primaryRepository, repositories.remote(remote));
            }
        } else if (!repositories.remoteTargets().isEmpty()) {
            LOG.info("Cloud backups disabled, skipping {} remote target(s) of task {}",
                repositories.remoteTargets().size(), jobName);
        }

        reporter.complete();
        return reporter.outcome();
    }

    private void replicate(TargetReporter reporter, RepositoryLocation primary, RepositoryLocation target) {
        LOG.info("Copying task {} from {} to {}", jobName, primary, target);
        TransferBackend backend = environment.backend();
        List<String> errors = new ArrayList<>();
        try {
            errors.addAll(backend.init(target));
            errors.addAll(backend.unlock(target));
            errors.addAll(backend.copy(primary, target));
            errors.addAll(backend.prune(target, retention));
        } catch (BackendException e) {
            LOG.error("Backend failure while copying task {} to {}", jobName, target, e);
            errors.add(e.getMessage());
        }
        reporter.report(target.uri(), errors);
    }
}
