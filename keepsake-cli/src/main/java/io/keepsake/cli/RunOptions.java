package io.keepsake.cli;

/**
 * @param cloudEnabled replicate to remote targets on every run
 * @param immediate run the selected tasks once in the foreground, then exit
 */
public record RunOptions(boolean cloudEnabled, boolean immediate) {
}
