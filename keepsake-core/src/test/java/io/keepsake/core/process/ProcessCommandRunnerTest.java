package io.keepsake.core.process;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

@DisabledOnOs(OS.WINDOWS)
class ProcessCommandRunnerTest {

    @TempDir
    Path tempDir;

    private final ProcessCommandRunner runner = new ProcessCommandRunner();

    @Test
    void shouldCaptureMergedOutputAndExitCode() throws Exception {
        CommandResult result = runner.run(
            List.of("/bin/sh", "-c", "echo out; echo err 1>&2; exit 3"),
            null,
            Map.of(),
            Duration.ofSeconds(10)
        );

        assertThat(result.exitCode()).isEqualTo(3);
        assertThat(result.succeeded()).isFalse();
        assertThat(result.output()).contains("out").contains("err");
    }

    @Test
    void shouldApplyEnvironmentAndWorkingDirectory() throws Exception {
        CommandResult result = runner.run(
            List.of("/bin/sh", "-c", "echo \"$RESTIC_REPOSITORY\"; pwd"),
            tempDir,
            Map.of("RESTIC_REPOSITORY", "/mnt/a/photos"),
            Duration.ofSeconds(10)
        );

        assertThat(result.succeeded()).isTrue();
        assertThat(result.output()).contains("/mnt/a/photos").contains(tempDir.toRealPath().toString());
    }

    @Test
    void shouldKillCommandsThatOutliveTheirTimeout() throws Exception {
        CommandResult result = runner.run(List.of("/bin/sh", "-c", "sleep 5"), null, Map.of(), Duration.ofMillis(200));

        assertThat(result.timedOut()).isTrue();
        assertThat(result.succeeded()).isFalse();
    }
}
