package io.keepsake.cli;

import ch.qos.logback.classic.Level;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Option;

/**
 * Options shared by every subcommand.
 */
public final class CommonOptions {

    @Option(names = {"-c", "--config"}, description = "Path to the configuration file (default: ~/.keepsake/config.json)")
    Path configPath;

    @Option(names = {"--debug"}, description = "Log at debug level")
    boolean debug;

    Path configPath(CliContext context) {
        return configPath != null ? configPath : context.configPath();
    }

    void applyLogLevel() {
        if (!debug) {
            return;
        }
        Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger logbackRoot) {
            logbackRoot.setLevel(Level.DEBUG);
        }
    }
}
