package io.keepsake.core.backend;

import io.keepsake.core.process.CommandResult;
import io.keepsake.core.process.CommandRunner;
import io.keepsake.core.target.RepositoryLocation;
import io.keepsake.core.target.RetentionPolicy;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TransferBackend} driving the {@code restic} command line tool.
 *
 * <p>Repository and password file are handed to restic through its environment variables, together
 * with whatever credentials the repository location carries, so nothing leaks into the JVM's own
 * environment or between targets.
 */
public final class ResticBackend implements TransferBackend {
    private static final Logger LOG = LoggerFactory.getLogger(ResticBackend.class);
    private static final int LOGGED_OUTPUT_CHARS = 2_000;

    private final CommandRunner runner;
    private final String binary;
    private final Duration timeout;

    public ResticBackend(CommandRunner runner, String binary, Duration timeout) {
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
        this.binary = binary == null || binary.isBlank() ? "restic" : binary;
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    @Override
    public List<String> init(RepositoryLocation repository) {
        CommandResult probe = invoke(repository, Map.of(), List.of("cat", "config"));
        if (probe.succeeded()) {
            LOG.debug("Repo {} already exists", repository);
            return List.of();
        }

        CommandResult result = invoke(repository, Map.of(), List.of("init"));
        if (!result.succeeded()) {
            return failure("Unable to initialize repo " + repository, result);
        }
        LOG.warn("Repo {} created", repository);
        return List.of();
    }

    @Override
    public List<String> unlock(RepositoryLocation repository) {
        CommandResult result = invoke(repository, Map.of(), List.of("unlock"));
        if (!result.succeeded()) {
            return failure("Unable to unlock repo " + repository, result);
        }
        return List.of();
    }

    @Override
    public List<String> backup(RepositoryLocation repository, List<Path> paths, List<Path> excludeFiles) {
        if (paths == null || paths.isEmpty()) {
            return List.of("Backup for " + repository + " has no source paths");
        }
        List<String> args = new ArrayList<>();
        args.add("backup");
        for (Path path : paths) {
            args.add(path.toString());
        }
        if (excludeFiles != null) {
            for (Path excludeFile : excludeFiles) {
                args.add("--exclude-file");
                args.add(excludeFile.toString());
            }
        }

        LOG.info("Running backup for {}...", repository);
        CommandResult result = invoke(repository, Map.of(), args);
        if (!result.succeeded()) {
            return failure("Backup for " + repository + " failed.", result);
        }
        LOG.info("Backup for {} completed successfully.", repository);
        LOG.debug("Backup result for {}\n{}", repository, tail(result.output()));
        return List.of();
    }

    @Override
    public List<String> copy(RepositoryLocation source, RepositoryLocation destination) {
        List<String> args = new ArrayList<>(List.of("copy", "--from-repo", source.uri()));
        if (source.passwordFile() != null) {
            args.add("--from-password-file");
            args.add(source.passwordFile().toString());
        }

        LOG.info("Copying {} to {}...", source, destination);
        CommandResult result = invoke(destination, source.environment(), args);
        if (!result.succeeded()) {
            return failure("Copy from " + source + " to " + destination + " failed.", result);
        }
        LOG.info("Copy from {} to {} completed successfully.", source, destination);
        return List.of();
    }

    @Override
    public List<String> prune(RepositoryLocation repository, RetentionPolicy retention) {
        List<String> args = List.of(
            "forget",
            "--prune",
            "--keep-daily", String.valueOf(retention.keepDaily()),
            "--keep-weekly", String.valueOf(retention.keepWeekly()),
            "--keep-monthly", String.valueOf(retention.keepMonthly()),
            "--keep-yearly", String.valueOf(retention.keepYearly())
        );

        LOG.info("Running cleanup for {}...", repository);
        CommandResult result = invoke(repository, Map.of(), args);
        if (!result.succeeded()) {
            return failure("Cleanup for " + repository + " failed.", result);
        }
        LOG.info("Cleanup for {} completed successfully.", repository);
        return List.of();
    }

    @Override
    public List<String> verify(RepositoryLocation repository, boolean deep, String subset) {
        List<String> args = new ArrayList<>();
        args.add("check");
        if (subset != null && !subset.isBlank()) {
            LOG.info("Running read data subset:{} check on repository {}", subset, repository);
            args.add("--read-data-subset=" + subset.trim());
        } else if (deep) {
            LOG.info("Running read data check on repository {}", repository);
            args.add("--read-data");
        } else {
            LOG.info("Running standard check on repository {}", repository);
        }

        CommandResult result = invoke(repository, Map.of(), args);
        if (!result.succeeded()) {
            return failure("Check for " + repository + " failed.", result);
        }
        LOG.info("Check for {} completed successfully.", repository);
        return List.of();
    }

    private CommandResult invoke(RepositoryLocation repository, Map<String, String> extraEnvironment, List<String> args) {
        List<String> command = new ArrayList<>(args.size() + 1);
        command.add(binary);
        command.addAll(args);

        Map<String, String> environment = new HashMap<>(extraEnvironment);
        environment.putAll(repository.environment());
        environment.put("RESTIC_REPOSITORY", repository.uri());
        if (repository.passwordFile() != null) {
            environment.put("RESTIC_PASSWORD_FILE", repository.passwordFile().toString());
        }

        try {
            return runner.run(command, null, environment, timeout);
        } catch (IOException e) {
            throw new BackendException("Unable to run " + binary + " " + args.get(0) + " against " + repository, e);
        }
    }

    private List<String> failure(String message, CommandResult result) {
        String detail = result.timedOut() ? message + " (timed out after " + timeout + ")" : message;
        LOG.error("{}\n{}", detail, tail(result.output()));
        return List.of(detail);
    }

    private String tail(String output) {
        if (output == null) {
            return "";
        }
        if (output.length() <= LOGGED_OUTPUT_CHARS) {
            return output;
        }
        return "..." + output.substring(output.length() - LOGGED_OUTPUT_CHARS);
    }
}
