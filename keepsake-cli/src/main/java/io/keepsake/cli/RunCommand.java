package io.keepsake.cli;

import io.keepsake.core.config.model.KeepsakeConfig;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

@Command(name = "run", description = "Start the scheduler and run tasks as they become due")
public final class RunCommand implements Callable<Integer> {
    private final CliContext context;

    @Mixin
    CommonOptions common;

    @Option(names = {"--no-cloud"}, description = "Skip remote targets")
    boolean noCloud;

    @Option(names = {"-t", "--job"}, description = "Only run the named task (repeatable)")
    List<String> jobs = new ArrayList<>();

    @Option(names = {"--immediate"}, description = "Run the selected tasks once now, then exit")
    boolean immediate;

    public RunCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        common.applyLogLevel();
        try {
            KeepsakeConfig config = context.configService().load(common.configPath(context)).select(jobs);
            return context.schedulerRunner().run(config, new RunOptions(!noCloud, immediate));
        } catch (Exception e) {
            System.err.println("Run command failed: " + e.getMessage());
            return 1;
        }
    }
}
