package io.keepsake.cli;

import picocli.CommandLine.Command;

@Command(name = "keepsake", mixinStandardHelpOptions = true, description = "Scheduled restic backups to local devices and the cloud")
public final class KeepsakeCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
