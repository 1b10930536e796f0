package io.keepsake.core.process;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ProcessCommandRunner implements CommandRunner {
    private static final Logger LOG = LoggerFactory.getLogger(ProcessCommandRunner.class);
    private static final int MAX_OUTPUT_CHARS = 12_000;

    @Override
    public CommandResult run(List<String> command, Path workingDirectory, Map<String, String> environment, Duration timeout)
        throws IOException {
        // output goes to a file so a chatty process can never fill the pipe and stall
        Path output = Files.createTempFile("keepsake-cmd", ".log");
        try {
            ProcessBuilder builder = new ProcessBuilder(command)
                .redirectErrorStream(true)
                .redirectOutput(output.toFile());
            if (workingDirectory != null) {
                builder.directory(workingDirectory.toFile());
            }
            if (environment != null) {
                builder.environment().putAll(environment);
            }

            LOG.debug("Running {}", String.join(" ", command));
            Process process = builder.start();
            try {
                boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
                if (!finished) {
                    process.destroyForcibly();
                    LOG.warn("Command {} timed out after {}", command.get(0), timeout);
                    return CommandResult.timeout(readOutput(output));
                }
            } catch (InterruptedException ie) {
                process.destroyForcibly();
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("interrupted while waiting for " + command.get(0));
            }
            return new CommandResult(process.exitValue(), readOutput(output), false);
        } finally {
            Files.deleteIfExists(output);
        }
    }

    private String readOutput(Path output) throws IOException {
        String text = new String(Files.readAllBytes(output), StandardCharsets.UTF_8);
        if (text.length() > MAX_OUTPUT_CHARS) {
            return "[truncated]\n" + text.substring(text.length() - MAX_OUTPUT_CHARS);
        }
        return text;
    }
}
