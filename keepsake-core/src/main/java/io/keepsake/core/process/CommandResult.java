package io.keepsake.core.process;

public record CommandResult(int exitCode, String output, boolean timedOut) {

    public static CommandResult timeout(String output) {
        return new CommandResult(-1, output, true);
    }

    public boolean succeeded() {
        return !timedOut && exitCode == 0;
    }
}
