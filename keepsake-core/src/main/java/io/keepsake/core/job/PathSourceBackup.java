package io.keepsake.core.job;

import io.keepsake.core.backend.TransferBackend;
import io.keepsake.core.target.RepositoryLocation;
import java.nio.file.Path;
import java.util.List;

/**
 * Backs up plain directories under a source root in one snapshot.
 */
public final class PathSourceBackup implements SourceBackup {
    private final TransferBackend backend;
    private final List<Path> sources;
    private final List<Path> excludeFiles;

    public PathSourceBackup(TransferBackend backend, Path sourceRoot, List<String> paths, List<Path> excludeFiles) {
        this.backend = backend;
        this.sources = paths.stream().map(sourceRoot::resolve).toList();
        this.excludeFiles = excludeFiles == null ? List.of() : List.copyOf(excludeFiles);
    }

    @Override
    public JobKind kind() {
        return JobKind.DATA_BACKUP;
    }

    @Override
    public List<String> perform(RepositoryLocation primary) {
        return backend.backup(primary, sources, excludeFiles);
    }
}
