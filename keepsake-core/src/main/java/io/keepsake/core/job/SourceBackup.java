package io.keepsake.core.job;

import io.keepsake.core.target.RepositoryLocation;
import java.util.List;

/**
 * Moves source data into the primary repository. One implementation per kind of data source.
 */
public interface SourceBackup {

    JobKind kind();

    List<String> perform(RepositoryLocation primary);
}
