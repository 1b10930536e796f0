package io.keepsake.cli;

import io.keepsake.core.config.model.KeepsakeConfig;
import io.keepsake.core.config.model.TaskConfig;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

@Command(name = "validate", description = "Validate the configuration file and list its tasks")
public final class ValidateCommand implements Callable<Integer> {
    private final CliContext context;

    @Mixin
    CommonOptions common;

    public ValidateCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        common.applyLogLevel();
        Path configPath = common.configPath(context);
        try {
            KeepsakeConfig config = context.configService().load(configPath);
            System.out.println("Config path: " + configPath);
            System.out.println("Notifications: " + (config.notificationsConfigured() ? config.ntfy().topicUrl() : "log only"));
            System.out.println("Tasks: " + config.tasks().size());
            for (Map.Entry<String, TaskConfig> entry : config.tasks().entrySet()) {
                TaskConfig task = entry.getValue();
                System.out.println("  " + entry.getKey()
                    + " [" + task.type().name().toLowerCase() + "] repo=" + task.repo()
                    + ", " + task.period().toSpec().describe()
                    + ", local=" + task.repoRoots().localDevices().size()
                    + ", cloud=" + task.repoRoots().cloudRepos().size());
            }
            System.out.println("Configuration is valid");
            return 0;
        } catch (Exception e) {
            System.err.println("Validate command failed: " + e.getMessage());
            return 1;
        }
    }
}
