package io.keepsake.cli;

import io.keepsake.core.config.ConfigService;
import java.nio.file.Path;
import java.time.Clock;

public record CliContext(
    ConfigService configService,
    Path configPath,
    Clock clock,
    SchedulerRunner schedulerRunner
) {
    public CliContext(ConfigService configService, Path configPath) {
        this(configService, configPath, Clock.systemDefaultZone(), (config, options) -> {
            throw new UnsupportedOperationException("scheduler runner is not configured");
        });
    }
}
