package io.keepsake.core.job;

import io.keepsake.core.target.LocalTarget;
import io.keepsake.core.target.RemoteTarget;
import io.keepsake.core.target.RepositoryLocation;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Every place a job's repository is kept. Each target holds the repository under
 * {@code <target root>/<repoName>}.
 */
public record RepositorySet(
    String repoName,
    Path passwordFile,
    List<LocalTarget> localTargets,
    List<RemoteTarget> remoteTargets
) {

    public RepositorySet {
        Objects.requireNonNull(repoName, "repoName must not be null");
        localTargets = localTargets == null ? List.of() : List.copyOf(localTargets);
        remoteTargets = remoteTargets == null ? List.of() : List.copyOf(remoteTargets);
    }

    public Optional<LocalTarget> primary() {
        return localTargets.stream().filter(LocalTarget::primary).findFirst();
    }

    public List<LocalTarget> secondaries() {
        return localTargets.stream().filter(target -> !target.primary()).toList();
    }

    public RepositoryLocation local(Path mountPoint) {
        return RepositoryLocation.local(mountPoint.resolve(repoName), passwordFile);
    }

    public RepositoryLocation remote(RemoteTarget target) {
        return target.repository(repoName, passwordFile);
    }
}
