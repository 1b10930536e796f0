package io.keepsake.core.container;

import io.keepsake.core.process.CommandResult;
import io.keepsake.core.process.CommandRunner;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Brings a docker compose project down and up again from its project directory.
 */
public final class ComposeContainerLifecycle implements ContainerLifecycle {
    private static final Logger LOG = LoggerFactory.getLogger(ComposeContainerLifecycle.class);

    private final CommandRunner runner;
    private final Duration timeout;

    public ComposeContainerLifecycle(CommandRunner runner, Duration timeout) {
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    @Override
    public void stop(Path path) throws ContainerLifecycleException {
        LOG.info("Stopping container {}...", path);
        compose(path, "stop", List.of("docker", "compose", "down"));
        LOG.info("Container {} stopped successfully.", path);
    }

    @Override
    public void start(Path path) throws ContainerLifecycleException {
        LOG.info("Starting container {}...", path);
        compose(path, "start", List.of("docker", "compose", "up", "-d"));
        LOG.info("Container {} started successfully.", path);
    }

    private void compose(Path path, String action, List<String> command) throws ContainerLifecycleException {
        CommandResult result;
        try {
            result = runner.run(command, path, Map.of(), timeout);
        } catch (IOException e) {
            throw new ContainerLifecycleException("Failed to " + action + " container " + path, e);
        }
        if (!result.succeeded()) {
            String reason = result.timedOut() ? "timed out after " + timeout : "exit code " + result.exitCode();
            throw new ContainerLifecycleException(
                "Failed to " + action + " container " + path + " (" + reason + "): " + result.output().trim()
            );
        }
        LOG.debug("Results from {} of container {}\n{}", action, path, result.output());
    }
}
