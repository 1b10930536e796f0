package io.keepsake.core.job;

import io.keepsake.core.backend.TransferBackend;
import io.keepsake.core.container.ContainerLifecycle;
import io.keepsake.core.container.ContainerLifecycleException;
import io.keepsake.core.target.RepositoryLocation;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Backs up container project directories one at a time, stopping each container for the
 * duration of its snapshot. The container is always started again, whatever the backup did.
 */
public final class ContainerSourceBackup implements SourceBackup {
    private static final Logger LOG = LoggerFactory.getLogger(ContainerSourceBackup.class);

    private final TransferBackend backend;
    private final ContainerLifecycle containers;
    private final List<Path> sources;
    private final List<Path> excludeFiles;
    private final boolean stopContainers;

    public ContainerSourceBackup(
        TransferBackend backend,
        ContainerLifecycle containers,
        Path sourceRoot,
        List<String> paths,
        List<Path> excludeFiles,
        boolean stopContainers
    ) {
        this.backend = backend;
        this.containers = containers;
        this.sources = paths.stream().map(sourceRoot::resolve).toList();
        this.excludeFiles = excludeFiles == null ? List.of() : List.copyOf(excludeFiles);
        this.stopContainers = stopContainers;
    }

    @Override
    public JobKind kind() {
        return JobKind.CONTAINER_BACKUP;
    }

    @Override
    public List<String> perform(RepositoryLocation primary) {
        List<String> errors = new ArrayList<>();
        for (Path source : sources) {
            if (stopContainers) {
                try {
                    containers.stop(source);
                } catch (ContainerLifecycleException e) {
                    LOG.error("Error while stopping container at path {}", source, e);
                }
            }
            try {
                errors.addAll(backend.backup(primary, List.of(source), excludeFiles));
            } finally {
                if (stopContainers) {
                    try {
                        containers.start(source);
                    } catch (ContainerLifecycleException e) {
                        LOG.error("Error while starting container at path {}", source, e);
                    }
                }
            }
        }
        return errors;
    }
}
