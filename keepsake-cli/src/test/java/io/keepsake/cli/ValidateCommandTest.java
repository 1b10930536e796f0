package io.keepsake.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.keepsake.core.config.ConfigService;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class ValidateCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldListTasksOfAValidConfiguration() throws Exception {
        Path configPath = CommandTestSupport.writeConfig(tempDir, CommandTestSupport.CONFIG);
        CliContext context = new CliContext(new ConfigService(), configPath);

        CommandTestSupport.Execution execution = CommandTestSupport.execute(new CommandLine(new ValidateCommand(context)));

        assertThat(execution.exitCode()).isZero();
        assertThat(execution.out())
            .contains("Tasks: 2")
            .contains("photos [data_backup] repo=photos, daily at 02:00")
            .contains("verify [check]")
            .contains("Configuration is valid");
    }

    @Test
    void shouldFailOnAnInvalidConfigurationGivenWithConfigOption() throws Exception {
        Path broken = tempDir.resolve("broken.json");
        Files.writeString(broken, "{ \"tasks\": {} }");
        CliContext context = new CliContext(new ConfigService(), tempDir.resolve("unused.json"));

        CommandTestSupport.Execution execution = CommandTestSupport.execute(
            new CommandLine(new ValidateCommand(context)), "--config", broken.toString());

        assertThat(execution.exitCode()).isEqualTo(1);
        assertThat(execution.err()).contains("Validate command failed: No tasks configured");
    }
}
