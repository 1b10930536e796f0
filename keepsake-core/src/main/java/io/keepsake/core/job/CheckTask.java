package io.keepsake.core.job;

import io.keepsake.core.backend.BackendException;
import io.keepsake.core.device.MountTable;
import io.keepsake.core.target.LocalTarget;
import io.keepsake.core.target.RemoteTarget;
import io.keepsake.core.target.RepositoryLocation;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies the integrity of every copy of a repository, local devices first, then remote targets.
 */
public final class CheckTask implements JobTask {
    private static final Logger LOG = LoggerFactory.getLogger(CheckTask.class);

    private final String jobName;
    private final RepositorySet repositories;
    private final boolean readData;
    private final String subset;
    private final JobEnvironment environment;

    public CheckTask(String jobName, RepositorySet repositories, boolean readData, String subset, JobEnvironment environment) {
        this.jobName = Objects.requireNonNull(jobName, "jobName must not be null");
        this.repositories = Objects.requireNonNull(repositories, "repositories must not be null");
        this.readData = readData;
        this.subset = subset == null || subset.isBlank() ? null : subset.trim();
        this.environment = Objects.requireNonNull(environment, "environment must not be null");
    }

    @Override
    public RunOutcome execute() throws IOException {
        TargetReporter reporter = new TargetReporter(jobName, JobKind.CHECK, environment.notifications());
        MountTable mounts = MountTable.of(environment.devices().listMounts());

        for (LocalTarget local : repositories.localTargets()) {
            Optional<Path> mount = mounts.firstMount(local.deviceId());
            if (mount.isEmpty()) {
                reporter.unavailable(local.label(), local.deviceId());
                continue;
            }
            verify(reporter, repositories.local(mount.get()));
        }
        for (RemoteTarget remote : repositories.remoteTargets()) {
            verify(reporter, repositories.remote(remote));
        }

        reporter.complete();
        return reporter.outcome();
    }

    private void verify(TargetReporter reporter, RepositoryLocation repository) {
        LOG.info("Checking task {} repository {}", jobName, repository);
        List<String> errors;
        try {
            errors = environment.backend().verify(repository, readData, subset);
        } catch (BackendException e) {
            LOG.error("Backend failure while checking {}", repository, e);
            errors = List.of(e.getMessage());
        }
        reporter.report(repository.uri(), errors);
    }
}
