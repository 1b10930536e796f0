package io.keepsake.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.keepsake.core.target.RetentionPolicy;

/**
 * Values inherited by every task that does not set them itself.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DefaultsConfig(
    @JsonAlias({"repo_roots"}) RepoRootsConfig repoRoots,
    RetentionPolicy retention
) {
}
