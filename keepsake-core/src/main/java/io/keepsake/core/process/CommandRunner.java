package io.keepsake.core.process;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Runs an external program to completion. Implementations block the caller.
 */
public interface CommandRunner {

    /**
     * @throws IOException when the program cannot be started at all
     */
    CommandResult run(List<String> command, Path workingDirectory, Map<String, String> environment, Duration timeout)
        throws IOException;
}
