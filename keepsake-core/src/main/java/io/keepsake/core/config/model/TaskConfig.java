package io.keepsake.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.keepsake.core.job.JobKind;
import io.keepsake.core.target.RetentionPolicy;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TaskConfig(
    JobKind type,
    String repo,
    String root,
    @JsonAlias({"pw_file"}) String passwordFile,
    PeriodConfig period,
    @JsonAlias({"repo_roots"}) RepoRootsConfig repoRoots,
    List<String> paths,
    RetentionPolicy retention,
    @JsonAlias({"exclude_files"}) List<String> excludeFiles,
    @JsonAlias({"stop_container"}) Boolean stopContainer,
    @JsonAlias({"read_data"}) Boolean readData,
    String subset
) {

    public TaskConfig {
        paths = paths == null ? List.of() : List.copyOf(paths);
        excludeFiles = excludeFiles == null ? List.of() : List.copyOf(excludeFiles);
        stopContainer = stopContainer == null ? Boolean.TRUE : stopContainer;
        readData = readData == null ? Boolean.FALSE : readData;
    }
}
