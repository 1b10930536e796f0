package io.keepsake.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.keepsake.core.config.ConfigService;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class StatusCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldPrintNextTriggerOfEachTask() throws Exception {
        Path configPath = CommandTestSupport.writeConfig(tempDir, CommandTestSupport.CONFIG);
        Clock clock = Clock.fixed(Instant.parse("2024-03-04T10:00:00Z"), ZoneOffset.UTC);
        CliContext context = new CliContext(new ConfigService(), configPath, clock, (config, options) -> 0);

        CommandTestSupport.Execution execution = CommandTestSupport.execute(new CommandLine(new StatusCommand(context)));

        assertThat(execution.exitCode()).isZero();
        assertThat(execution.out())
            .contains("photos: backup, daily at 02:00, next trigger 2024-03-05T02:00Z")
            .contains("verify: check, weekly on sunday at 00:00, next trigger 2024-03-10T00:00Z");
    }
}
