package io.keepsake.core.target;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * A concrete restic repository: where it lives, how to open it and what the
 * backend process needs in its environment to reach it.
 */
public record RepositoryLocation(String uri, Path passwordFile, Map<String, String> environment) {

    public RepositoryLocation {
        Objects.requireNonNull(uri, "uri must not be null");
        environment = environment == null ? Map.of() : Map.copyOf(environment);
    }

    public static RepositoryLocation local(Path path, Path passwordFile) {
        return new RepositoryLocation(path.toString(), passwordFile, Map.of());
    }

    @Override
    public String toString() {
        return uri;
    }
}
