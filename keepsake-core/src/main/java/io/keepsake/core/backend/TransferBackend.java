package io.keepsake.core.backend;

import io.keepsake.core.target.RepositoryLocation;
import io.keepsake.core.target.RetentionPolicy;
import java.nio.file.Path;
import java.util.List;

/**
 * Repository operations of the external backup tool.
 *
 * <p>Every operation reports expected operational failures as human-readable messages and returns
 * an empty list on success. Operations are idempotent for states that are already reached: an
 * initialized repository initializes without error and an unlocked repository unlocks without
 * error. Unexpected failures surface as {@link BackendException}.
 */
public interface TransferBackend {

    List<String> init(RepositoryLocation repository);

    List<String> unlock(RepositoryLocation repository);

    List<String> backup(RepositoryLocation repository, List<Path> paths, List<Path> excludeFiles);

    List<String> copy(RepositoryLocation source, RepositoryLocation destination);

    List<String> prune(RepositoryLocation repository, RetentionPolicy retention);

    /**
     * @param deep read back pack data instead of only checking the structure
     * @param subset optional read-data subset such as {@code 1/5} or {@code 10%}; implies {@code deep}
     */
    List<String> verify(RepositoryLocation repository, boolean deep, String subset);
}
