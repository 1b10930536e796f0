package io.keepsake.core.job;

import io.keepsake.core.config.ConfigPaths;
import io.keepsake.core.config.model.KeepsakeConfig;
import io.keepsake.core.config.model.TaskConfig;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds runnable jobs from a validated configuration.
 */
public final class JobFactory {
    private final JobEnvironment environment;

    public JobFactory(JobEnvironment environment) {
        this.environment = environment;
    }

    public List<Job> create(KeepsakeConfig config) {
        List<Job> jobs = new ArrayList<>();
        for (Map.Entry<String, TaskConfig> entry : config.tasks().entrySet()) {
            jobs.add(create(entry.getKey(), entry.getValue()));
        }
        return jobs;
    }

    public Job create(String name, TaskConfig task) {
        RepositorySet repositories = new RepositorySet(
            task.repo(),
            ConfigPaths.resolve(task.passwordFile()),
            task.repoRoots().localDevices(),
            task.repoRoots().cloudRepos()
        );
        JobTask jobTask = switch (task.type()) {
            case DATA_BACKUP -> new BackupTask(
                name,
                repositories,
                task.retention(),
                new PathSourceBackup(environment.backend(), sourceRoot(task), task.paths(), excludeFiles(task)),
                environment
            );
            case CONTAINER_BACKUP -> new BackupTask(
                name,
                repositories,
                task.retention(),
                new ContainerSourceBackup(
                    environment.backend(),
                    environment.containers(),
                    sourceRoot(task),
                    task.paths(),
                    excludeFiles(task),
                    task.stopContainer()
                ),
                environment
            );
            case CHECK -> new CheckTask(name, repositories, task.readData(), task.subset(), environment);
        };
        return new Job(name, task.type(), task.period().toSpec(), jobTask, environment.notifications());
    }

    private static Path sourceRoot(TaskConfig task) {
        return ConfigPaths.resolve(task.root());
    }

    private static List<Path> excludeFiles(TaskConfig task) {
        return task.excludeFiles().stream().map(ConfigPaths::resolve).toList();
    }
}
