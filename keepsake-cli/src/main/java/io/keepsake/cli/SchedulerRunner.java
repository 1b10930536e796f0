package io.keepsake.cli;

import io.keepsake.core.config.model.KeepsakeConfig;

@FunctionalInterface
public interface SchedulerRunner {
    int run(KeepsakeConfig config, RunOptions options) throws Exception;
}
