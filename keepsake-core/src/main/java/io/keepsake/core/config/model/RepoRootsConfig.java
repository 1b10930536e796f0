package io.keepsake.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.keepsake.core.target.LocalTarget;
import io.keepsake.core.target.RemoteTarget;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RepoRootsConfig(
    @JsonAlias({"local_devices"}) List<LocalTarget> localDevices,
    @JsonAlias({"cloud_repos"}) List<RemoteTarget> cloudRepos
) {

    public RepoRootsConfig {
        localDevices = localDevices == null ? List.of() : List.copyOf(localDevices);
        cloudRepos = cloudRepos == null ? List.of() : List.copyOf(cloudRepos);
    }
}
