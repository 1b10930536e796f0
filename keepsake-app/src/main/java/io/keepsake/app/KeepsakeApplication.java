package io.keepsake.app;

import io.keepsake.cli.CliContext;
import io.keepsake.cli.KeepsakeCliCommand;
import io.keepsake.cli.RunCommand;
import io.keepsake.cli.RunOptions;
import io.keepsake.cli.StatusCommand;
import io.keepsake.cli.ValidateCommand;
import io.keepsake.core.backend.ResticBackend;
import io.keepsake.core.config.ConfigPaths;
import io.keepsake.core.config.ConfigService;
import io.keepsake.core.config.model.KeepsakeConfig;
import io.keepsake.core.config.model.NtfyConfig;
import io.keepsake.core.container.ComposeContainerLifecycle;
import io.keepsake.core.device.LsblkDeviceResolver;
import io.keepsake.core.job.Job;
import io.keepsake.core.job.JobEnvironment;
import io.keepsake.core.job.JobFactory;
import io.keepsake.core.notify.LoggingNotificationSink;
import io.keepsake.core.notify.NotificationSink;
import io.keepsake.core.notify.NtfyNotificationSink;
import io.keepsake.core.process.CommandRunner;
import io.keepsake.core.process.ProcessCommandRunner;
import io.keepsake.core.runtime.KeepsakeRuntime;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class KeepsakeApplication {
    private static final Logger LOG = LoggerFactory.getLogger(KeepsakeApplication.class);
    private static final Duration CONTAINER_TIMEOUT = Duration.ofMinutes(10);
    private static final Duration DEVICE_TIMEOUT = Duration.ofSeconds(30);
    // longer than the 30s the worker waits for a running task
    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(45);

    private KeepsakeApplication() {
    }

    public static void main(String[] args) {
        CliContext context = new CliContext(
            new ConfigService(),
            ConfigPaths.defaultConfigPath(),
            Clock.systemDefaultZone(),
            KeepsakeApplication::runScheduler
        );

        CommandLine commandLine = new CommandLine(new KeepsakeCliCommand());
        commandLine.addSubcommand("run", new RunCommand(context));
        commandLine.addSubcommand("validate", new ValidateCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    static JobEnvironment buildEnvironment(KeepsakeConfig config, RunOptions options) {
        CommandRunner runner = new ProcessCommandRunner();
        return new JobEnvironment(
            new ResticBackend(runner, config.restic().binary(), config.restic().timeout()),
            new ComposeContainerLifecycle(runner, CONTAINER_TIMEOUT),
            new LsblkDeviceResolver(runner, DEVICE_TIMEOUT),
            buildNotificationSink(config),
            options.cloudEnabled()
        );
    }

    private static NotificationSink buildNotificationSink(KeepsakeConfig config) {
        if (!config.notificationsConfigured()) {
            LOG.info("No ntfy topic configured, notifications are logged only");
            return new LoggingNotificationSink();
        }
        NtfyConfig ntfy = config.ntfy();
        return new NtfyNotificationSink(ntfy.topicUrl(), ntfy.token(), ntfy.tags());
    }

    private static int runScheduler(KeepsakeConfig config, RunOptions options) throws Exception {
        JobEnvironment environment = buildEnvironment(config, options);
        if (!options.cloudEnabled()) {
            LOG.info("Cloud backups disabled for this process");
        }
        List<Job> jobs = new JobFactory(environment).create(config);

        ShutdownSignal shutdown = new ShutdownSignal(SHUTDOWN_GRACE);
        try (KeepsakeRuntime runtime = new KeepsakeRuntime(jobs, Clock.systemDefaultZone(), KeepsakeRuntime.DEFAULT_TICK)) {
            if (options.immediate()) {
                int ran = runtime.runImmediately();
                LOG.info("Ran {} task(s) immediately", ran);
                return 0;
            }

            Runtime.getRuntime().addShutdownHook(shutdown.hook());
            runtime.start();
            System.out.println("Keepsake scheduler started with " + jobs.size() + " task(s)");
            shutdown.awaitRequest();
            LOG.info("Shutting down scheduler");
        } finally {
            shutdown.markClosed();
        }
        return 0;
    }
}
