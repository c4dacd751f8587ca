package com.powerguard.device;

/**
 * A device shell command ran but reported failure.
 */
public class ShellCommandException extends RuntimeException {

    private final String command;
    private final int exitCode;
    private final String output;

    public ShellCommandException(String message, String command, int exitCode, String output) {
        super(message);
        this.command = command;
        this.exitCode = exitCode;
        this.output = output;
    }

    public String getCommand() { return command; }
    public int getExitCode() { return exitCode; }
    public String getOutput() { return output; }
}
