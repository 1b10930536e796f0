package io.keepsake.cli;

import io.keepsake.core.config.model.KeepsakeConfig;
import io.keepsake.core.config.model.TaskConfig;
import io.keepsake.core.schedule.PeriodPolicy;
import io.keepsake.core.schedule.PeriodSpec;
import java.time.ZonedDateTime;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

@Command(name = "status", description = "Show each task's schedule and next trigger")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;
    private final PeriodPolicy policy = new PeriodPolicy();

    @Mixin
    CommonOptions common;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        common.applyLogLevel();
        try {
            KeepsakeConfig config = context.configService().load(common.configPath(context));
            ZonedDateTime now = ZonedDateTime.now(context.clock());
            System.out.println("Now: " + now);
            for (Map.Entry<String, TaskConfig> entry : config.tasks().entrySet()) {
                PeriodSpec period = entry.getValue().period().toSpec();
                System.out.println(entry.getKey()
                    + ": " + entry.getValue().type().activity()
                    + ", " + period.describe()
                    + ", next trigger " + policy.nextTrigger(period, now));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
